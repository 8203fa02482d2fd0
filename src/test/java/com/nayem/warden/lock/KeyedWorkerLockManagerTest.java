package com.nayem.warden.lock;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class KeyedWorkerLockManagerTest {

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @ValueSource(strings = {"bad/key", "bad-key", "has space", "", "../escape", "dots.lock"})
    public void testInvalidKeysRejectedWithoutTouchingFilesystem(String key) {
        Path lockDir = tempDir.resolve("locks");
        KeyedWorkerLockManager manager = new KeyedWorkerLockManager(lockDir);

        InvalidLockKeyException e = assertThrows(InvalidLockKeyException.class, () -> manager.lock(key));
        assertEquals(key, e.getKey());
        assertFalse(Files.exists(lockDir), "No directory should be created for a rejected key");
    }

    @Test
    public void testNullKeyRejected() {
        KeyedWorkerLockManager manager = new KeyedWorkerLockManager(tempDir);
        assertThrows(InvalidLockKeyException.class, () -> manager.lock(null));
    }

    @Test
    public void testLockCreatesDirectoryAndFile() throws Exception {
        Path lockDir = tempDir.resolve("nested").resolve("locks");
        KeyedWorkerLockManager manager = new KeyedWorkerLockManager(lockDir);

        String result = manager.withLock("job_42", () -> {
            assertTrue(Files.exists(lockDir.resolve("job_42.lock")));
            return "done";
        });

        assertEquals("done", result);
        assertEquals(lockDir.resolve("job_42.lock"), manager.lockPath("job_42"));
    }

    @Test
    public void testThreadsInSameProcessAreSerialized() throws Exception {
        KeyedWorkerLockManager manager = new KeyedWorkerLockManager(tempDir);
        AtomicBoolean acquired = new AtomicBoolean();

        LockHandle first = manager.lock("shared");
        Thread waiter = new Thread(() -> {
            try (LockHandle ignored = manager.lock("shared")) {
                acquired.set(true);
            }
        });
        waiter.start();

        Thread.sleep(100);
        assertFalse(acquired.get(), "Second thread must wait for the first holder");

        first.close();
        waiter.join(5000);
        assertTrue(acquired.get());
    }

    @Test
    public void testDifferentKeysDoNotBlock() throws Exception {
        KeyedWorkerLockManager manager = new KeyedWorkerLockManager(tempDir);
        AtomicInteger count = new AtomicInteger();

        try (LockHandle a = manager.lock("a")) {
            Thread other = new Thread(() -> {
                try (LockHandle b = manager.lock("b")) {
                    count.incrementAndGet();
                }
            });
            other.start();
            other.join(5000);
        }

        assertEquals(1, count.get());
    }

    @Test
    public void testExceptionReleasesLock() throws Exception {
        KeyedWorkerLockManager manager = new KeyedWorkerLockManager(tempDir);

        assertThrows(IllegalStateException.class, () -> manager.withLock("k", () -> {
            throw new IllegalStateException("fail");
        }));

        assertEquals(1, manager.withLock("k", () -> 1));
    }

    @Test
    public void testUnwritableDirectoryFailsWithLockAcquisitionException() throws Exception {
        Path file = Files.createFile(tempDir.resolve("not-a-dir"));
        KeyedWorkerLockManager manager = new KeyedWorkerLockManager(file);

        assertThrows(LockAcquisitionException.class, () -> manager.lock("k"));
    }

    @Test
    public void testManagersSharingADirectoryWaitForEachOther() throws Exception {
        KeyedWorkerLockManager first = new KeyedWorkerLockManager(tempDir);
        KeyedWorkerLockManager second = new KeyedWorkerLockManager(tempDir.resolve("..").resolve(tempDir.getFileName()));
        AtomicBoolean acquired = new AtomicBoolean();
        AtomicReference<Throwable> failure = new AtomicReference<>();

        LockHandle held = first.lock("job");
        Thread waiter = new Thread(() -> {
            try (LockHandle ignored = second.lock("job")) {
                acquired.set(true);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        waiter.start();

        Thread.sleep(200);
        assertNull(failure.get(), "Second manager must block, not fail");
        assertFalse(acquired.get());

        held.close();
        waiter.join(5000);
        assertNull(failure.get());
        assertTrue(acquired.get());
    }

    @Test
    public void testReentrantAcquireOnSameThreadFailsWithLockAcquisitionException() {
        KeyedWorkerLockManager manager = new KeyedWorkerLockManager(tempDir);

        try (LockHandle ignored = manager.lock("k")) {
            assertThrows(LockAcquisitionException.class, () -> manager.lock("k"));
        }
        assertDoesNotThrow(() -> manager.lock("k").close());
    }

    /**
     * The OS file lock is the only thing standing between two processes.
     */
    @Test
    public void testLockHeldByAnotherProcessBlocksUntilItExits() throws Exception {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        Process child = new ProcessBuilder(java, "-cp", System.getProperty("java.class.path"),
                WorkerLockHolder.class.getName(), tempDir.toString(), "k")
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        try {
            BufferedReader out = new BufferedReader(new InputStreamReader(child.getInputStream(), StandardCharsets.UTF_8));
            String line;
            while ((line = out.readLine()) != null && !WorkerLockHolder.LOCKED.equals(line)) {
                // skip anything the child logs before it holds the lock
            }
            assertEquals(WorkerLockHolder.LOCKED, line, "Child process never reported holding the lock");

            KeyedWorkerLockManager manager = new KeyedWorkerLockManager(tempDir);
            CountDownLatch acquired = new CountDownLatch(1);
            Thread waiter = new Thread(() -> {
                try (LockHandle ignored = manager.lock("k")) {
                    acquired.countDown();
                }
            });
            waiter.start();

            assertFalse(acquired.await(500, TimeUnit.MILLISECONDS), "Parent must wait while the child holds the lock");

            child.getOutputStream().close();
            assertTrue(child.waitFor(10, TimeUnit.SECONDS), "Child process did not exit");
            assertTrue(acquired.await(10, TimeUnit.SECONDS), "Parent must acquire once the child is gone");
            waiter.join(5000);
        } finally {
            child.destroyForcibly();
        }
    }
}
