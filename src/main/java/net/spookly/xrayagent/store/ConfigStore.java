package net.spookly.xrayagent.store;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sole owner of the live proxy configuration document.
 * <p>
 * Commits write a sibling temp file and rename it over the live path, so a crash mid-write leaves
 * the previous document in place. Every commit must happen while the caller holds
 * {@link #mutationLock()}.
 */
public class ConfigStore {
    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path livePath;
    private final String inboundTag;
    private final ReentrantLock mutationLock = new ReentrantLock(true);
    private volatile ProxyConfiguration snapshot;

    public ConfigStore(Path livePath, String inboundTag) {
        this.livePath = Objects.requireNonNull(livePath, "livePath").toAbsolutePath();
        this.inboundTag = Objects.requireNonNull(inboundTag, "inboundTag");
    }

    /**
     * Prepare the store for use: drop temp files left by an interrupted commit, write a bootstrap
     * document when none exists, and load the committed snapshot.
     *
     * @throws StorageCorruptedException when the live document exists but cannot be parsed
     */
    public void open() throws StorageCorruptedException {
        try {
            Path parent = livePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            removeStaleTempFiles();
            if (!Files.exists(livePath)) {
                log.warn("Proxy config {} not found, writing bootstrap document", livePath);
                mutationLock.lock();
                try {
                    commit(ProxyConfiguration.bootstrap(inboundTag));
                } finally {
                    mutationLock.unlock();
                }
                return;
            }
        } catch (IOException e) {
            throw new StorageCorruptedException("Failed to prepare proxy config directory for " + livePath, e);
        }
        try {
            snapshot = read();
        } catch (IOException e) {
            throw new StorageCorruptedException("Proxy config " + livePath + " is unreadable: " + e.getMessage(), e);
        }
        log.info("Loaded proxy config {} with {} users", livePath, snapshot.userCount());
    }

    /**
     * Read the live document from disk.
     */
    public ProxyConfiguration read() throws IOException {
        byte[] content = Files.readAllBytes(livePath);
        return ProxyConfiguration.parse(content, inboundTag);
    }

    /**
     * Atomically replace the live document. The caller must hold the mutation lock.
     */
    public void commit(ProxyConfiguration configuration) throws IOException {
        Objects.requireNonNull(configuration, "configuration");
        if (!mutationLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("commit requires the mutation lock");
        }
        Path temp = livePath.resolveSibling(livePath.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try {
            writeDurably(temp, configuration.toBytes());
            moveIntoPlace(temp);
        } finally {
            Files.deleteIfExists(temp);
        }
        snapshot = configuration;
        log.debug("Committed proxy config {} ({} users)", livePath, configuration.userCount());
    }

    /**
     * Last document committed or loaded, without touching the disk.
     */
    public ProxyConfiguration snapshot() {
        return snapshot;
    }

    /**
     * The single lock serializing every read-modify-commit cycle.
     */
    public ReentrantLock mutationLock() {
        return mutationLock;
    }

    public Path livePath() {
        return livePath;
    }

    public String inboundTag() {
        return inboundTag;
    }

    private void writeDurably(Path target, byte[] content) throws IOException {
        try (FileChannel channel = FileChannel.open(target,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, livePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported for {}, falling back to replace", livePath);
            Files.move(temp, livePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void removeStaleTempFiles() throws IOException {
        Path parent = livePath.getParent();
        if (parent == null) {
            return;
        }
        String prefix = livePath.getFileName() + ".";
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(parent,
                entry -> entry.getFileName().toString().startsWith(prefix)
                        && entry.getFileName().toString().endsWith(TEMP_SUFFIX))) {
            for (Path entry : entries) {
                if (Files.deleteIfExists(entry)) {
                    log.info("Removed stale temp file {}", entry);
                }
            }
        }
    }
}
