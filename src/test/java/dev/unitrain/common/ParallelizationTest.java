package dev.unitrain.common;

import dev.unitrain.common.Parallelization.WorkRange;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ParallelizationTest {

    @Test
    void testSplitWorkCoversEveryItemOnce() {
        WorkRange[] ranges = Parallelization.splitWork(10, 3);
        assertEquals(3, ranges.length);
        assertEquals(4, ranges[0].size());
        assertEquals(3, ranges[1].size());
        assertEquals(3, ranges[2].size());
        assertEquals(0, ranges[0].start());
        assertEquals(ranges[0].end(), ranges[1].start());
        assertEquals(10, ranges[2].end());
    }

    @Test
    void testSplitWorkNeverMakesEmptyRanges() {
        WorkRange[] ranges = Parallelization.splitWork(2, 8);
        assertEquals(2, ranges.length);
        for (WorkRange range : ranges)
            assertEquals(1, range.size());

        WorkRange[] none = Parallelization.splitWork(0, 4);
        assertEquals(1, none.length);
        assertEquals(0, none[0].size());
    }

    @Test
    void testExecuteParallelRunsAllTasks() {
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            AtomicInteger counter = new AtomicInteger();
            Runnable[] tasks = new Runnable[6];
            for (int i = 0; i < tasks.length; i++)
                tasks[i] = counter::incrementAndGet;

            Parallelization.executeParallel(executor, tasks);
            assertEquals(6, counter.get());

            // null executor runs inline
            Parallelization.executeParallel(null, tasks);
            assertEquals(12, counter.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testExecuteParallelRethrowsTaskFailure() {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            AtomicInteger finished = new AtomicInteger();
            IllegalStateException e = assertThrows(IllegalStateException.class, () ->
                Parallelization.executeParallel(executor,
                    finished::incrementAndGet,
                    () -> { throw new IllegalStateException("boom"); }));
            assertEquals("boom", e.getMessage());
            assertEquals(1, finished.get());
        } finally {
            executor.shutdownNow();
        }
    }
}
