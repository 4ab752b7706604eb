package net.spookly.xrayagent.monitor;

import java.util.Locale;

/**
 * Renders the agent's gauges and counters in the Prometheus text exposition format.
 */
public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(int usersCount,
                                boolean proxyRunning,
                                double systemLoad,
                                long commandsApplied,
                                long commandsFailed) {
        StringBuilder builder = new StringBuilder();
        metric(builder, "xray_agent_users_count", "gauge", "Number of users in the proxy config", usersCount);
        metric(builder, "xray_agent_xray_running", "gauge", "Whether the proxy is running", proxyRunning ? 1 : 0);
        metric(builder, "xray_agent_system_load", "gauge", "One minute system load average", systemLoad);
        metric(builder, "xray_agent_commands_applied_total", "counter", "Commands applied", commandsApplied);
        metric(builder, "xray_agent_commands_failed_total", "counter", "Commands that failed", commandsFailed);
        return builder.toString();
    }

    private static void metric(StringBuilder builder, String name, String type, String help, Number value) {
        builder.append("# HELP ").append(name).append(' ').append(help).append('\n');
        builder.append("# TYPE ").append(name).append(' ').append(type).append('\n');
        builder.append(name).append(' ').append(render(value)).append('\n');
    }

    private static String render(Number value) {
        if (value instanceof Double) {
            return String.format(Locale.ROOT, "%.2f", value.doubleValue());
        }
        return Long.toString(value.longValue());
    }
}
