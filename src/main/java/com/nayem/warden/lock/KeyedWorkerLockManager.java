package com.nayem.warden.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Per-key mutual exclusion across independent processes sharing a filesystem.
 * <p>
 * Each key maps to {@code <directory>/<key>.lock}, on which an OS advisory lock
 * is taken with {@link FileChannel#lock()}. Acquisition blocks with no timeout;
 * callers needing a bounded wait must impose one themselves.
 * </p>
 * <p>
 * OS file locks are held per process, so threads of this JVM are first
 * serialized through a {@link KeyedMemoryLockManager} keyed by the normalized
 * lock-file path and shared by every manager in the JVM, so two managers on
 * the same directory wait for each other as well.
 * </p>
 */
public class KeyedWorkerLockManager {

    private static final Logger log = LoggerFactory.getLogger(KeyedWorkerLockManager.class);
    private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9_]+$");
    private static final String LOCK_SUFFIX = ".lock";

    private final Path directory;
    private static final KeyedMemoryLockManager<Path> JVM_LOCKS = new KeyedMemoryLockManager<>();

    public KeyedWorkerLockManager(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("Lock directory must not be null");
        }
        this.directory = directory;
    }

    /**
     * Blocks until this process holds the lock for {@code key}.
     *
     * @throws InvalidLockKeyException  if {@code key} is not {@code [A-Za-z0-9_]+}
     * @throws LockAcquisitionException if the lock file cannot be opened or locked
     */
    public LockHandle lock(String key) {
        Path path = lockPath(key);
        LockHandle local = JVM_LOCKS.lock(path.toAbsolutePath().normalize());
        FileChannel channel = null;
        try {
            Files.createDirectories(directory);
            channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = channel.lock();
            log.debug("Acquired worker lock {} at {}", key, path);
            return new WorkerLockHandle(key, channel, fileLock, local);
        } catch (IOException | OverlappingFileLockException e) {
            closeQuietly(channel, key);
            local.close();
            throw new LockAcquisitionException("Failed to lock " + path, e);
        } catch (RuntimeException e) {
            closeQuietly(channel, key);
            local.close();
            throw e;
        }
    }

    /**
     * Runs {@code action} while holding the worker lock for {@code key}.
     */
    public <R> R withLock(String key, Callable<R> action) throws Exception {
        try (LockHandle ignored = lock(key)) {
            return action.call();
        }
    }

    /**
     * The lock-file path for {@code key}. Validates the key but does not touch
     * the filesystem.
     */
    public Path lockPath(String key) {
        validateKey(key);
        return directory.resolve(key + LOCK_SUFFIX);
    }

    public Path getDirectory() {
        return directory;
    }

    static void validateKey(String key) {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new InvalidLockKeyException(key);
        }
    }

    private static void closeQuietly(FileChannel channel, String key) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close lock file channel for {}: {}", key, e.getMessage());
        }
    }

    private static final class WorkerLockHandle implements LockHandle {
        private final String key;
        private final FileChannel channel;
        private final FileLock fileLock;
        private final LockHandle local;
        private final AtomicBoolean released = new AtomicBoolean();

        WorkerLockHandle(String key, FileChannel channel, FileLock fileLock, LockHandle local) {
            this.key = key;
            this.channel = channel;
            this.fileLock = fileLock;
            this.local = local;
        }

        @Override
        public Object key() {
            return key;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                fileLock.release();
            } catch (IOException e) {
                log.warn("Failed to release worker lock {}: {}", key, e.getMessage());
            } finally {
                closeQuietly(channel, key);
                local.close();
            }
        }
    }
}
