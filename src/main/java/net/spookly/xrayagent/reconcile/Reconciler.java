package net.spookly.xrayagent.reconcile;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

import net.spookly.xrayagent.model.Command;
import net.spookly.xrayagent.model.ProxyUser;
import net.spookly.xrayagent.store.ConfigStore;
import net.spookly.xrayagent.store.ProxyConfiguration;
import net.spookly.xrayagent.xray.ProxyCommandException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a command into a new proxy configuration and brings the proxy to it.
 * <p>
 * Each apply runs read, mutate, validate, reload and commit while holding the store's mutation lock,
 * so concurrent applies never interleave. Applying a command that is already in effect is a no-op
 * and does not reload the proxy.
 */
public final class Reconciler {
    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final ConfigStore store;
    private final ReloadExecutor reloadExecutor;
    private final String userFlow;
    private final int storageAttempts;
    private final Duration storageRetryBackoff;

    public Reconciler(ConfigStore store,
                      ReloadExecutor reloadExecutor,
                      String userFlow,
                      int storageAttempts,
                      Duration storageRetryBackoff) {
        this.store = Objects.requireNonNull(store, "store");
        this.reloadExecutor = Objects.requireNonNull(reloadExecutor, "reloadExecutor");
        this.userFlow = userFlow;
        if (storageAttempts <= 0) {
            throw new IllegalArgumentException("storageAttempts must be greater than 0");
        }
        this.storageAttempts = storageAttempts;
        this.storageRetryBackoff = Objects.requireNonNull(storageRetryBackoff, "storageRetryBackoff");
    }

    public ApplyResult apply(Command command) throws ReconcileException {
        Objects.requireNonNull(command, "command");
        ReentrantLock lock = store.mutationLock();
        lock.lock();
        try {
            ProxyConfiguration current = readWithRetry();
            ProxyConfiguration candidate = mutate(current, command);
            if (candidate.equals(current)) {
                log.debug("Command {} for {} already in effect", command.kind().wireName(), command.userUuid());
                return new ApplyResult(command, false, current.userCount());
            }
            reload(candidate, current);
            try {
                commitWithRetry(candidate);
            } catch (ReconcileException e) {
                restore(current, "failed commit");
                throw e;
            }
            log.info("Applied {} for {} ({} users)", command.kind().wireName(), command.userUuid(), candidate.userCount());
            return new ApplyResult(command, true, candidate.userCount());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reload the proxy with the committed document. Used at startup so the running proxy matches what
     * is on disk even if the agent stopped between a reload and its commit.
     */
    public void resync() throws ReconcileException {
        ReentrantLock lock = store.mutationLock();
        lock.lock();
        try {
            ProxyConfiguration current = readWithRetry();
            reload(current, null);
            log.info("Proxy resynced with committed config ({} users)", current.userCount());
        } finally {
            lock.unlock();
        }
    }

    ProxyConfiguration mutate(ProxyConfiguration current, Command command) {
        switch (command.kind()) {
            case ADD_USER:
                return current.withUserAdded(new ProxyUser(command.userUuid(), command.email()), userFlow);
            case REMOVE_USER:
                return current.withUserRemoved(command.userUuid());
            case REGENERATE_USER:
                String email = command.email();
                if (email == null || email.isBlank()) {
                    email = current.users().stream()
                            .filter(user -> user.uuid().equals(command.oldUserUuid()))
                            .map(ProxyUser::email)
                            .findFirst()
                            .orElse(null);
                }
                return current.withUserRemoved(command.oldUserUuid())
                        .withUserAdded(new ProxyUser(command.userUuid(), email), userFlow);
            default:
                throw new IllegalArgumentException("Unsupported command " + command.kind());
        }
    }

    /**
     * Validate and load {@code candidate}. When the reload itself fails part way, the proxy is pointed
     * back at {@code restoreTo} if one is given.
     */
    private void reload(ProxyConfiguration candidate, ProxyConfiguration restoreTo) throws ReconcileException {
        try {
            reloadExecutor.apply(candidate);
        } catch (ReloadIncompleteException e) {
            if (restoreTo != null) {
                restore(restoreTo, "incomplete reload");
            }
            ReconcileFailure failure = e.timedOut() ? ReconcileFailure.TIMEOUT : ReconcileFailure.PROXY_UNAVAILABLE;
            throw new ReconcileException(failure, e.getMessage(), e);
        } catch (ValidationException e) {
            throw new ReconcileException(ReconcileFailure.INVALID_CONFIG, e.getMessage() + ": " + e.proxyOutput(), e);
        } catch (TimeoutException e) {
            throw new ReconcileException(ReconcileFailure.TIMEOUT, e.getMessage(), e);
        } catch (ProxyCommandException e) {
            throw new ReconcileException(ReconcileFailure.PROXY_UNAVAILABLE, e.getMessage(), e);
        } catch (IOException e) {
            throw new ReconcileException(ReconcileFailure.STORAGE_UNAVAILABLE,
                    "Failed to write candidate config: " + e.getMessage(), e);
        }
    }

    private void restore(ProxyConfiguration committed, String reason) {
        // The proxy may already run the candidate; point it back at what is on disk.
        try {
            reloadExecutor.apply(committed);
            log.warn("Restored proxy to committed config after {}", reason);
        } catch (Exception e) {
            log.error("Failed to restore proxy to committed config, it will be resynced on restart", e);
        }
    }

    private ProxyConfiguration readWithRetry() throws ReconcileException {
        IOException last = null;
        for (int attempt = 1; attempt <= storageAttempts; attempt++) {
            try {
                return store.read();
            } catch (IOException e) {
                last = e;
                log.warn("Read of {} failed (attempt {}/{}): {}", store.livePath(), attempt, storageAttempts, e.getMessage());
                pauseBeforeRetry(attempt);
            }
        }
        throw new ReconcileException(ReconcileFailure.STORAGE_UNAVAILABLE,
                "Failed to read proxy config after " + storageAttempts + " attempts: " + last.getMessage(), last);
    }

    private void commitWithRetry(ProxyConfiguration candidate) throws ReconcileException {
        IOException last = null;
        for (int attempt = 1; attempt <= storageAttempts; attempt++) {
            try {
                store.commit(candidate);
                return;
            } catch (IOException e) {
                last = e;
                log.warn("Commit of {} failed (attempt {}/{}): {}", store.livePath(), attempt, storageAttempts, e.getMessage());
                pauseBeforeRetry(attempt);
            }
        }
        throw new ReconcileException(ReconcileFailure.STORAGE_UNAVAILABLE,
                "Failed to commit proxy config after " + storageAttempts + " attempts: " + last.getMessage(), last);
    }

    private void pauseBeforeRetry(int attempt) throws ReconcileException {
        if (attempt >= storageAttempts || storageRetryBackoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(storageRetryBackoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReconcileException(ReconcileFailure.STORAGE_UNAVAILABLE, "Interrupted while retrying storage", e);
        }
    }
}
