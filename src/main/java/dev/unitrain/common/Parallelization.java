package dev.unitrain.common;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Helpers for splitting per-sample work over a fixed pool.
 */
public final class Parallelization {

    private Parallelization() {}

    public record WorkRange(int start, int end) {
        public int size() {
            return end - start;
        }
    }

    /**
     * Split {@code totalWork} items into at most {@code numThreads} contiguous ranges,
     * the first ranges taking one extra item when the split is uneven.
     */
    public static WorkRange[] splitWork(int totalWork, int numThreads) {
        int parts = Math.max(1, Math.min(numThreads, totalWork));
        WorkRange[] ranges = new WorkRange[parts];
        int workPerThread = totalWork / parts;
        int remainder = totalWork % parts;

        int start = 0;
        for (int i = 0; i < parts; i++) {
            int size = workPerThread + (i < remainder ? 1 : 0);
            ranges[i] = new WorkRange(start, start + size);
            start += size;
        }
        return ranges;
    }

    /**
     * Run the tasks on the executor and wait for all of them. The first failure is
     * rethrown once every task has finished.
     */
    public static void executeParallel(ExecutorService executor, Runnable... tasks) {
        if (executor == null || tasks.length <= 1) {
            for (Runnable task : tasks)
                task.run();
            return;
        }

        CountDownLatch latch = new CountDownLatch(tasks.length);
        @SuppressWarnings("unchecked")
        Future<?>[] futures = new Future[tasks.length];
        for (int i = 0; i < tasks.length; i++) {
            Runnable task = tasks[i];
            futures[i] = executor.submit(() -> {
                try {
                    task.run();
                } finally {
                    latch.countDown();
                }
            });
        }

        try {
            latch.await();
            for (Future<?> future : futures)
                future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Parallel execution interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException)
                throw (RuntimeException) e.getCause();
            throw new RuntimeException("Parallel task failed", e.getCause());
        }
    }
}
