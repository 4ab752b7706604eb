package net.spookly.xrayagent.reconcile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import net.spookly.xrayagent.store.ProxyConfiguration;
import net.spookly.xrayagent.xray.ProxyCommandException;
import net.spookly.xrayagent.xray.ProxyCommandResult;
import net.spookly.xrayagent.xray.ProxyController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a candidate document with the proxy and, only when it passes, asks the proxy to load it.
 * <p>
 * The candidate is written to a scratch file that never replaces the live document; persisting the
 * candidate is left to the caller once the reload succeeded.
 */
public final class ReloadExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReloadExecutor.class);

    private final ProxyController proxy;
    private final Path scratchDir;
    private final Duration operationTimeout;
    private final ExecutorService operations = Executors.newCachedThreadPool(threadFactory());

    public ReloadExecutor(ProxyController proxy, Path scratchDir, Duration operationTimeout) {
        this.proxy = Objects.requireNonNull(proxy, "proxy");
        this.scratchDir = Objects.requireNonNull(scratchDir, "scratchDir");
        this.operationTimeout = Objects.requireNonNull(operationTimeout, "operationTimeout");
    }

    /**
     * Validate then reload the candidate.
     *
     * @throws ValidationException the proxy rejected the candidate and was not reloaded
     * @throws TimeoutException validation took longer than the operation timeout
     * @throws ProxyCommandException the validate command could not be run
     * @throws ReloadIncompleteException the candidate validated but the reload failed or timed out
     * @throws IOException the scratch file could not be written
     */
    public void apply(ProxyConfiguration candidate)
            throws ValidationException, TimeoutException, ProxyCommandException, ReloadIncompleteException, IOException {
        Path scratch = writeScratch(candidate);
        try {
            ProxyCommandResult result = bounded("validate", () -> proxy.validate(scratch));
            if (!result.ok()) {
                log.warn("Proxy rejected candidate config (exit {}): {}", result.exitCode(), result.output());
                throw new ValidationException("proxy rejected candidate config (exit " + result.exitCode() + ")",
                        result.output());
            }
            try {
                bounded("reload", () -> {
                    proxy.reload(scratch);
                    return null;
                });
            } catch (TimeoutException | ProxyCommandException e) {
                throw new ReloadIncompleteException(e.getMessage(), e);
            }
            log.debug("Proxy reloaded with {} users", candidate.userCount());
        } finally {
            Files.deleteIfExists(scratch);
        }
    }

    @Override
    public void close() {
        operations.shutdownNow();
    }

    private Path writeScratch(ProxyConfiguration candidate) throws IOException {
        Files.createDirectories(scratchDir);
        Path scratch = scratchDir.resolve("candidate-" + UUID.randomUUID() + ".json");
        Files.write(scratch, candidate.toBytes());
        return scratch;
    }

    private <T> T bounded(String label, ProxyOperation<T> operation)
            throws TimeoutException, ProxyCommandException {
        Future<T> future = operations.submit(operation::run);
        try {
            return future.get(operationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException(label + " did not finish within " + operationTimeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProxyCommandException(label + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProxyCommandException proxyError) {
                if (proxyError.timedOut()) {
                    throw new TimeoutException(proxyError.getMessage());
                }
                throw proxyError;
            }
            throw new ProxyCommandException(label + " failed: " + cause, cause);
        }
    }

    @FunctionalInterface
    private interface ProxyOperation<T> {
        T run() throws ProxyCommandException;
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "xray-agent-proxy-op");
            thread.setDaemon(true);
            return thread;
        };
    }
}
