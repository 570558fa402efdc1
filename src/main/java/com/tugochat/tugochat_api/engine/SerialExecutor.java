package com.tugochat.tugochat_api.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Mailbox that runs submitted tasks one at a time, in submission order, on a
 * shared delegate executor. Gives each match its own sequential context
 * without a dedicated thread.
 *
 * A task submitted from inside a running task is queued behind it, never run
 * re-entrantly.
 */
public class SerialExecutor implements Executor {

    private static final Logger log = LoggerFactory.getLogger(SerialExecutor.class);

    private final String name;
    private final Executor delegate;
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private boolean draining;

    public SerialExecutor(String name, Executor delegate) {
        this.name = name;
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable task) {
        synchronized (this) {
            tasks.add(task);
            if (draining) {
                return;
            }
            draining = true;
        }
        try {
            delegate.execute(this::drain);
        } catch (RejectedExecutionException e) {
            synchronized (this) {
                draining = false;
                tasks.clear();
            }
            log.warn("Mailbox {} rejected by worker pool, dropping pending tasks", name, e);
        }
    }

    private void drain() {
        while (true) {
            Runnable next;
            synchronized (this) {
                next = tasks.poll();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            try {
                next.run();
            } catch (RuntimeException e) {
                // One bad task must not wedge the mailbox
                log.error("Task failed in mailbox {}", name, e);
            }
        }
    }
}
