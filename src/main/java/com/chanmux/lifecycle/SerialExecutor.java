package com.chanmux.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/** Runs submitted tasks one at a time, in submission order, on a shared executor. */
final class SerialExecutor implements Executor {

    private static final Logger log = LoggerFactory.getLogger(SerialExecutor.class);

    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Executor executor;
    private Runnable active;

    SerialExecutor(Executor executor) {
        this.executor = executor;
    }

    @Override
    public synchronized void execute(Runnable r) {
        tasks.add(() -> {
            try {
                r.run();
            } finally {
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    private synchronized void scheduleNext() {
        if ((active = tasks.poll()) != null) {
            try {
                executor.execute(active);
            } catch (RejectedExecutionException e) {
                // the backing pool is shut down; nothing queued here can run any more
                log.warn("Dropping {} queued task(s): {}", tasks.size() + 1, e.getMessage());
                tasks.clear();
                active = null;
            }
        }
    }

    synchronized int pending() {
        return tasks.size() + (active != null ? 1 : 0);
    }
}
