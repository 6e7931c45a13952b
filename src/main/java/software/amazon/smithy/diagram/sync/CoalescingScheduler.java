/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.sync;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs delayed tasks keyed by name, where scheduling a task for a key cancels
 * and replaces any task still pending for it. A burst of schedules for one
 * key therefore runs only the last task, once the burst has been quiet for
 * the task's delay.
 *
 * <p>All tasks run on one thread, in the order their delays expire.
 */
public final class CoalescingScheduler implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(CoalescingScheduler.class.getName());

    private final ExecutorService executor;
    private final Map<String, CompletableFuture<Void>> tasks = new ConcurrentHashMap<>();

    public CoalescingScheduler() {
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "diagram-sync");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * @param key The key to coalesce on
     * @param delayMs How long to wait before running the task
     * @param task The task
     * @return A future completing once the task has run, or cancelled if the
     *  task is replaced or cancelled first
     */
    public CompletableFuture<Void> schedule(String key, long delayMs, Runnable task) {
        CompletableFuture<Void> future = CompletableFuture.runAsync(
                () -> runLogged(key, task),
                CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS, executor));
        CompletableFuture<Void> previous = tasks.put(key, future);
        if (previous != null && !previous.isDone()) {
            previous.cancel(true);
            LOGGER.finest(() -> "Replaced pending task for " + key);
        }
        future.whenComplete((unused, throwable) -> tasks.remove(key, future));
        return future;
    }

    /**
     * @param key The key to check
     * @return Whether a task is waiting to run for the key
     */
    public boolean isPending(String key) {
        CompletableFuture<Void> task = tasks.get(key);
        return task != null && !task.isDone();
    }

    /**
     * @param key The key to cancel the pending task of
     * @return Whether a pending task was cancelled
     */
    public boolean cancel(String key) {
        CompletableFuture<Void> task = tasks.remove(key);
        if (task != null && !task.isDone()) {
            task.cancel(true);
            return true;
        }
        return false;
    }

    public void cancelAll() {
        for (CompletableFuture<Void> task : tasks.values()) {
            task.cancel(true);
        }
        tasks.clear();
    }

    @Override
    public void close() {
        cancelAll();
        executor.shutdownNow();
    }

    private static void runLogged(String key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, e, () -> "Task for " + key + " failed");
        }
    }
}
