package net.spookly.xrayagent.xray;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * In-memory proxy used by tests. Records every validate and reload and can be told to reject,
 * stall or fail.
 */
public final class FakeProxyController implements ProxyController {
    public final AtomicInteger validateCount = new AtomicInteger();
    public final AtomicInteger reloadCount = new AtomicInteger();
    public final List<String> reloadedDocuments = new CopyOnWriteArrayList<>();
    public volatile Predicate<String> validator = content -> true;
    public volatile boolean alive = true;
    public volatile boolean statsFail;
    public volatile boolean reloadFail;
    public volatile long validateDelayMs;
    public final AtomicInteger slowReloads = new AtomicInteger();
    public volatile long slowReloadMs;
    public volatile Instant startedAt;
    public volatile CountDownLatch validateGate;
    public volatile Map<String, Long> counters = Map.of();

    @Override
    public ProxyCommandResult validate(Path candidate) throws ProxyCommandException {
        validateCount.incrementAndGet();
        CountDownLatch gate = validateGate;
        try {
            if (gate != null) {
                gate.await(10, TimeUnit.SECONDS);
            }
            if (validateDelayMs > 0) {
                Thread.sleep(validateDelayMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProxyCommandException("interrupted", e);
        }
        return validator.test(read(candidate)) ? ProxyCommandResult.success() : ProxyCommandResult.failure("rejected by fake");
    }

    @Override
    public void reload(Path candidate) throws ProxyCommandException {
        if (reloadFail) {
            throw new ProxyCommandException("reload failed");
        }
        reloadCount.incrementAndGet();
        reloadedDocuments.add(read(candidate));
        // The new document is already live when a slow reload stalls.
        if (slowReloads.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            try {
                Thread.sleep(slowReloadMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProxyCommandException("reload interrupted", e);
            }
        }
    }

    @Override
    public Optional<Instant> startedAt() {
        return Optional.ofNullable(startedAt);
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public ProxyStats queryStats() throws ProxyCommandException {
        if (statsFail) {
            throw new ProxyCommandException("stats unavailable");
        }
        return new ProxyStats(counters);
    }

    public String lastReloaded() {
        return reloadedDocuments.isEmpty() ? null : reloadedDocuments.get(reloadedDocuments.size() - 1);
    }

    private static String read(Path candidate) {
        try {
            return Files.readString(candidate, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
