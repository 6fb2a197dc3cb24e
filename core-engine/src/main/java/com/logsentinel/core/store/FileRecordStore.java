package com.logsentinel.core.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.logsentinel.core.exception.StoreUnavailableException;
import com.logsentinel.core.model.ErrorSignature;
import com.logsentinel.core.model.HistoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable {@link RecordStore} keeping one JSON document per signature.
 *
 * <h3>Layout</h3>
 * <p>
 * {@code <directory>/<sha256(signature key)>.json} holds the record;
 * a sibling {@code .lock} file is used for OS-level locking.
 * </p>
 *
 * <h3>Atomicity</h3>
 * <p>
 * A write takes the signature's in-process lock, then an exclusive lock on its
 * {@code .lock} file, re-reads the stored version, and publishes the new
 * document by writing a temp file and moving it over the old one with
 * {@link StandardCopyOption#ATOMIC_MOVE}. A process killed mid-write leaves at
 * most a stray temp file; the record itself is either the old or the new
 * version. Lock waits are bounded by {@code lockTimeoutMillis}.
 * </p>
 *
 * @since 1.0.0
 */
public class FileRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileRecordStore.class);

    private static final String RECORD_SUFFIX = ".json";
    private static final String LOCK_SUFFIX = ".lock";
    private static final long FILE_LOCK_POLL_MILLIS = 5;

    private final Path directory;
    private final long lockTimeoutMillis;
    private final ObjectMapper mapper;
    private final ConcurrentMap<String, KeyLock> locks = new ConcurrentHashMap<>();

    /**
     * @param directory         directory holding the record files; created if
     *                          missing
     * @param lockTimeoutMillis bound on waiting for a signature's write lock
     * @throws StoreUnavailableException if the directory cannot be created
     */
    public FileRecordStore(Path directory, long lockTimeoutMillis) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        if (lockTimeoutMillis < 1) {
            throw new IllegalArgumentException("lockTimeoutMillis must be >= 1, got: " + lockTimeoutMillis);
        }
        this.lockTimeoutMillis = lockTimeoutMillis;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot create store directory " + directory, e);
        }
        LOG.info("File record store opened at {}", directory.toAbsolutePath());
    }

    @Override
    public Optional<HistoryRecord> load(ErrorSignature signature) {
        Objects.requireNonNull(signature, "signature must not be null");
        return read(recordPath(fileName(signature)));
    }

    @Override
    public boolean compareAndSet(ErrorSignature signature, long expectedVersion, HistoryRecord updated) {
        Objects.requireNonNull(signature, "signature must not be null");
        Objects.requireNonNull(updated, "updated record must not be null");

        String name = fileName(signature);
        KeyLock keyLock = retain(name);
        try {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(lockTimeoutMillis);
            acquire(keyLock.lock, signature);
            try {
                return writeIfVersion(name, signature, expectedVersion, updated, deadline);
            } finally {
                keyLock.lock.unlock();
            }
        } finally {
            release(name);
        }
    }

    /** Number of signatures with a write in progress or waiting. */
    int activeLocks() {
        return locks.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean writeIfVersion(String name, ErrorSignature signature, long expectedVersion,
            HistoryRecord updated, long deadline) {
        try (FileChannel channel = FileChannel.open(directory.resolve(name + LOCK_SUFFIX),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                FileLock ignored = acquireFileLock(channel, deadline, signature)) {

            Path target = recordPath(name);
            long currentVersion = read(target).map(HistoryRecord::getVersion).orElse(0L);
            if (currentVersion != expectedVersion) {
                return false;
            }
            Path tmp = Files.createTempFile(directory, name, ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), updated);
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tmp);
            }
            return true;
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to write record for '" + signature.key() + "'", e);
        }
    }

    // Entries live only while some thread holds or waits for the key's lock.
    private KeyLock retain(String name) {
        return locks.compute(name, (k, current) -> {
            KeyLock keyLock = current != null ? current : new KeyLock();
            keyLock.users++;
            return keyLock;
        });
    }

    private void release(String name) {
        locks.computeIfPresent(name, (k, current) -> --current.users == 0 ? null : current);
    }

    private Optional<HistoryRecord> read(Path path) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(path.toFile(), HistoryRecord.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to read record " + path.getFileName(), e);
        }
    }

    private void acquire(ReentrantLock lock, ErrorSignature signature) {
        try {
            if (!lock.tryLock(lockTimeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new StoreUnavailableException("Timed out after " + lockTimeoutMillis
                        + " ms waiting for write lock on '" + signature.key() + "'");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted waiting for write lock on '"
                    + signature.key() + "'", e);
        }
    }

    private FileLock acquireFileLock(FileChannel channel, long deadlineNanos, ErrorSignature signature)
            throws IOException {
        while (true) {
            FileLock fileLock;
            try {
                fileLock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                LOG.trace("File lock on '{}' held by another store in this JVM, polling", signature.key());
                fileLock = null;
            }
            if (fileLock != null) {
                return fileLock;
            }
            if (System.nanoTime() > deadlineNanos) {
                throw new StoreUnavailableException("Timed out after " + lockTimeoutMillis
                        + " ms waiting for file lock on '" + signature.key() + "'");
            }
            try {
                Thread.sleep(FILE_LOCK_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StoreUnavailableException("Interrupted waiting for file lock on '"
                        + signature.key() + "'", e);
            }
        }
    }

    private Path recordPath(String name) {
        return directory.resolve(name + RECORD_SUFFIX);
    }

    static String fileName(ErrorSignature signature) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(signature.key().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
