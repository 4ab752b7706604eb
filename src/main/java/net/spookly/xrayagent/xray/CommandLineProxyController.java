package net.spookly.xrayagent.xray;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import net.spookly.xrayagent.config.AgentSettings;
import net.spookly.xrayagent.util.ListenAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the proxy through configured external commands ({@code xray -test}, a reload signal,
 * {@code xray api statsquery}) and probes liveness by connecting to the management port.
 */
public final class CommandLineProxyController implements ProxyController {
    private static final Logger log = LoggerFactory.getLogger(CommandLineProxyController.class);
    private static final String CONFIG_PLACEHOLDER = "{config}";
    private static final int MAX_OUTPUT_CHARS = 4096;
    private static final int LIVENESS_TIMEOUT_MS = 1000;

    private final List<String> testCommand;
    private final List<String> reloadCommand;
    private final List<String> statsCommand;
    private final ListenAddress apiAddress;
    private final long timeoutMs;
    private final ExecutorService outputReaders = Executors.newCachedThreadPool(threadFactory());

    public CommandLineProxyController(List<String> testCommand,
                                      List<String> reloadCommand,
                                      List<String> statsCommand,
                                      ListenAddress apiAddress,
                                      long timeoutMs) {
        this.testCommand = List.copyOf(Objects.requireNonNull(testCommand, "testCommand"));
        this.reloadCommand = List.copyOf(Objects.requireNonNull(reloadCommand, "reloadCommand"));
        this.statsCommand = List.copyOf(Objects.requireNonNull(statsCommand, "statsCommand"));
        this.apiAddress = Objects.requireNonNull(apiAddress, "apiAddress");
        this.timeoutMs = timeoutMs;
    }

    public static CommandLineProxyController fromSettings(AgentSettings settings) {
        AgentSettings.XrayConfig xray = settings.xray;
        return new CommandLineProxyController(
                xray.testCommand,
                xray.reloadCommand,
                xray.statsCommand,
                ListenAddress.parse(xray.apiAddress),
                xray.commandTimeoutMs
        );
    }

    @Override
    public ProxyCommandResult validate(Path candidate) throws ProxyCommandException {
        return run("validate", substitute(testCommand, candidate));
    }

    @Override
    public void reload(Path candidate) throws ProxyCommandException {
        ProxyCommandResult result = run("reload", substitute(reloadCommand, candidate));
        if (!result.ok()) {
            throw new ProxyCommandException("reload exited with " + result.exitCode() + ": " + abbreviate(result.output()));
        }
    }

    @Override
    public boolean isAlive() {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(apiAddress.host(), apiAddress.port()), LIVENESS_TIMEOUT_MS);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public ProxyStats queryStats() throws ProxyCommandException {
        ProxyCommandResult result = run("stats", statsCommand);
        if (!result.ok()) {
            throw new ProxyCommandException("stats query exited with " + result.exitCode() + ": " + abbreviate(result.output()));
        }
        try {
            return ProxyStats.parse(result.output());
        } catch (IOException e) {
            throw new ProxyCommandException("Failed to parse stats output", e);
        }
    }

    /**
     * Start time of the oldest running process whose executable has the same name as the one in the
     * test command, e.g. {@code xray}.
     */
    @Override
    public Optional<Instant> startedAt() {
        if (testCommand.isEmpty()) {
            return Optional.empty();
        }
        String name = executableName(testCommand.get(0));
        return ProcessHandle.allProcesses()
                .filter(handle -> handle.info().command().map(command -> name.equals(executableName(command))).orElse(false))
                .map(handle -> handle.info().startInstant())
                .flatMap(Optional::stream)
                .min(Comparator.naturalOrder());
    }

    @Override
    public void close() {
        outputReaders.shutdownNow();
    }

    static String executableName(String command) {
        return command.substring(command.lastIndexOf('/') + 1);
    }

    ProxyCommandResult run(String label, List<String> argv) throws ProxyCommandException {
        Process process;
        try {
            process = new ProcessBuilder(argv).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new ProxyCommandException("Failed to start " + label + " command " + argv.get(0), e);
        }
        CompletableFuture<String> output = CompletableFuture.supplyAsync(
                () -> readOutput(process.getInputStream()), outputReaders);
        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw ProxyCommandException.timeout(label + " command timed out after " + timeoutMs + "ms");
            }
            String text = output.get(LIVENESS_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            int exitCode = process.exitValue();
            log.debug("{} command exited with {}", label, exitCode);
            return new ProxyCommandResult(exitCode, text);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ProxyCommandException(label + " command interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ProxyCommandException("Failed to read " + label + " command output", e);
        }
    }

    static List<String> substitute(List<String> template, Path candidate) {
        String path = candidate.toAbsolutePath().toString();
        List<String> argv = new ArrayList<>(template.size());
        for (String arg : template) {
            argv.add(arg.replace(CONFIG_PLACEHOLDER, path));
        }
        return argv;
    }

    private static String readOutput(InputStream input) {
        try (input) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String abbreviate(String output) {
        if (output == null || output.length() <= MAX_OUTPUT_CHARS) {
            return output;
        }
        return output.substring(0, MAX_OUTPUT_CHARS) + "...";
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "xray-agent-proxy-output");
            thread.setDaemon(true);
            return thread;
        };
    }
}
