package net.spookly.xrayagent;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import net.spookly.xrayagent.config.AgentSettings;
import net.spookly.xrayagent.config.ConfigException;
import net.spookly.xrayagent.config.ConfigLoader;
import net.spookly.xrayagent.config.ConfigPrinter;
import net.spookly.xrayagent.config.ConfigWarnings;
import net.spookly.xrayagent.endpoint.CommandServer;
import net.spookly.xrayagent.event.AgentAuditLogger;
import net.spookly.xrayagent.event.AgentEventListener;
import net.spookly.xrayagent.model.AgentIdentity;
import net.spookly.xrayagent.monitor.AgentStatusView;
import net.spookly.xrayagent.monitor.HealthMonitor;
import net.spookly.xrayagent.monitor.MetricsReporter;
import net.spookly.xrayagent.reconcile.CommandQueue;
import net.spookly.xrayagent.reconcile.ReconcileException;
import net.spookly.xrayagent.reconcile.Reconciler;
import net.spookly.xrayagent.reconcile.ReloadExecutor;
import net.spookly.xrayagent.store.ConfigStore;
import net.spookly.xrayagent.store.StorageCorruptedException;
import net.spookly.xrayagent.upstream.CoreApiClient;
import net.spookly.xrayagent.upstream.CoreApiEventPublisher;
import net.spookly.xrayagent.upstream.RegistrationManager;
import net.spookly.xrayagent.upstream.UpstreamAckTracker;
import net.spookly.xrayagent.util.Backoff;
import net.spookly.xrayagent.util.SecretRedactor;
import net.spookly.xrayagent.xray.CommandLineProxyController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standalone entry point for the xray agent process.
 * <p>
 * Exit status 1 means the configuration is invalid, 2 means the live proxy document is corrupt.
 */
public final class XrayAgentMain {
    static final int EXIT_CONFIG = 1;
    static final int EXIT_STORAGE_CORRUPTED = 2;

    private static final String DEFAULT_CONFIG = "config/xray-agent.yaml";
    private static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    private XrayAgentMain() {
    }

    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        Path configPath = options.configPath;
        AgentSettings settings;
        try {
            settings = ConfigLoader.load(configPath);
        } catch (ConfigException e) {
            System.err.println(e.getMessage());
            System.exit(EXIT_CONFIG);
            return;
        }
        // slf4j-simple reads its level once, when the first logger is created.
        if (System.getProperty(LOG_LEVEL_PROPERTY) == null) {
            System.setProperty(LOG_LEVEL_PROPERTY, settings.logging.level.toLowerCase());
        }
        Logger log = LoggerFactory.getLogger(XrayAgentMain.class);
        for (String warning : ConfigWarnings.collect(settings, configPath)) {
            log.warn("Config warning: {}", warning);
        }
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(settings));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }

        AgentIdentity identity = AgentIdentity.from(settings);
        log.info("xray-agent {} starting: serverId={} agentUrl={} apiKey={}", AgentIdentity.VERSION,
                identity.serverId(), identity.agentUrl(), SecretRedactor.redact(identity.apiKey()));

        ConfigStore store = new ConfigStore(Paths.get(settings.xray.configPath), settings.xray.inboundTag);
        try {
            store.open();
        } catch (StorageCorruptedException e) {
            log.error("Proxy config storage is corrupted, refusing to start", e);
            System.exit(EXIT_STORAGE_CORRUPTED);
            return;
        }

        CommandLineProxyController proxy = CommandLineProxyController.fromSettings(settings);
        Duration operationTimeout = Duration.ofMillis(settings.reconcile.operationTimeoutMs);
        ReloadExecutor reloadExecutor = new ReloadExecutor(proxy, Paths.get(settings.xray.scratchDir), operationTimeout);
        Reconciler reconciler = new Reconciler(
                store,
                reloadExecutor,
                settings.xray.userFlow,
                settings.reconcile.storageRetries,
                Duration.ofMillis(settings.reconcile.storageRetryBackoffMs)
        );
        if (Boolean.TRUE.equals(settings.xray.reloadOnStartup)) {
            try {
                reconciler.resync();
            } catch (ReconcileException e) {
                log.warn("Startup resync failed ({}): {}", e.failure().wireName(), e.getMessage());
            }
        }

        UpstreamAckTracker ackTracker = new UpstreamAckTracker();
        CoreApiClient coreApi = CoreApiClient.fromSettings(settings, identity, ackTracker);
        AgentEventListener events = AgentEventListener.fanOut(List.of(
                AgentAuditLogger.INSTANCE,
                new CoreApiEventPublisher(coreApi)
        ));

        CommandQueue queue = new CommandQueue(reconciler, events, settings.reconcile.queueCapacity);
        HealthMonitor healthMonitor = new HealthMonitor(
                proxy,
                settings.monitoring.failureThreshold,
                Duration.ofSeconds(settings.monitoring.healthIntervalSeconds),
                events
        );
        MetricsReporter metricsReporter = new MetricsReporter(
                proxy,
                store,
                coreApi,
                Duration.ofSeconds(settings.monitoring.metricsIntervalSeconds)
        );
        AgentSettings.RegistrationConfig registration = settings.coreApi.registration;
        RegistrationManager registrationManager = new RegistrationManager(
                coreApi,
                ackTracker,
                new Backoff(Duration.ofMillis(registration.initialBackoffMs), Duration.ofMillis(registration.maxBackoffMs)),
                Duration.ofSeconds(registration.reregisterAfterSeconds),
                events
        );
        CommandServer commandServer = new CommandServer(
                settings.server,
                identity,
                queue,
                new AgentStatusView(healthMonitor, metricsReporter, registrationManager, ackTracker, store, queue)
        );

        commandServer.start();
        registrationManager.start();
        healthMonitor.start();
        metricsReporter.start();

        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            metricsReporter.stop();
            healthMonitor.stop();
            registrationManager.stop();
            commandServer.stop();
            // The in-flight command may need a full validate and reload.
            queue.shutdown(operationTimeout.multipliedBy(2));
            reloadExecutor.close();
            proxy.close();
            latch.countDown();
        }, "xray-agent-shutdown"));

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
