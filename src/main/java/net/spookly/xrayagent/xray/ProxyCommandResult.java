package net.spookly.xrayagent.xray;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Exit status and combined output of an external proxy command.
 */
@Value
@Accessors(fluent = true)
public class ProxyCommandResult {
    int exitCode;
    String output;

    public boolean ok() {
        return exitCode == 0;
    }

    public static ProxyCommandResult success() {
        return new ProxyCommandResult(0, "");
    }

    public static ProxyCommandResult failure(String output) {
        return new ProxyCommandResult(1, output);
    }
}
