package com.nayem.warden.lock;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Child-process entry point: takes a worker lock, reports it on stdout and
 * keeps it until stdin is closed, then exits without releasing it explicitly.
 */
public final class WorkerLockHolder {

    static final String LOCKED = "LOCKED";

    private WorkerLockHolder() {
    }

    public static void main(String[] args) throws IOException {
        KeyedWorkerLockManager manager = new KeyedWorkerLockManager(Path.of(args[0]));
        manager.lock(args[1]);
        System.out.println(LOCKED);
        System.out.flush();

        InputStream in = System.in;
        while (in.read() != -1) {
            // hold until the parent closes our stdin
        }
        System.exit(0);
    }
}
