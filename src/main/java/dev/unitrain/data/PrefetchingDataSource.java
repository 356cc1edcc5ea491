package dev.unitrain.data;

import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Wraps a data source so its batches are produced by one background thread.
 *
 * <p>The producer runs at most {@code capacity} batches ahead of the consumer. Batches are
 * delivered in exactly the order the wrapped source yields them. A failure in the producer
 * is rethrown on the consuming thread: errors as they are, exceptions wrapped in an
 * {@link IllegalStateException}.
 *
 * <p>A consumer that stops before the end of a pass should {@link BatchIterator#close()}
 * the iterator so the producer thread exits.
 */
public class PrefetchingDataSource implements DataSource {

    private static final int DEFAULT_CAPACITY = 2;

    private final DataSource delegate;
    private final int capacity;

    public PrefetchingDataSource(DataSource delegate) {
        this(delegate, DEFAULT_CAPACITY);
    }

    public PrefetchingDataSource(DataSource delegate, int capacity) {
        if (capacity <= 0)
            throw new IllegalArgumentException("Prefetch capacity must be positive: " + capacity);
        this.delegate = delegate;
        this.capacity = capacity;
    }

    @Override
    public int numBatches() {
        return delegate.numBatches();
    }

    @Override
    public DataShape shape() {
        return delegate.shape();
    }

    @Override
    public int batchSize() {
        return delegate.batchSize();
    }

    @Override
    public BatchIterator iterator() {
        BlockingQueue<Slot> queue = new ArrayBlockingQueue<>(capacity);
        Thread producer = new Thread(() -> produce(queue), "batch-prefetch");
        producer.setDaemon(true);
        producer.start();
        return new PrefetchIterator(queue, producer);
    }

    private void produce(BlockingQueue<Slot> queue) {
        Slot last;
        try {
            for (Batch batch : delegate)
                queue.put(new Slot(batch, null));
            last = Slot.END;
        } catch (InterruptedException e) {
            // consumer closed the pass
            return;
        } catch (Throwable t) {
            last = new Slot(null, t);
        }
        try {
            queue.put(last);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record Slot(Batch batch, Throwable failure) {
        static final Slot END = new Slot(null, null);
    }

    private static final class PrefetchIterator implements BatchIterator {
        private final BlockingQueue<Slot> queue;
        private final Thread producer;
        private Slot next;
        private boolean finished;

        PrefetchIterator(BlockingQueue<Slot> queue, Thread producer) {
            this.queue = queue;
            this.producer = producer;
        }

        @Override
        public boolean hasNext() {
            if (finished)
                return false;
            if (next == null) {
                try {
                    next = queue.take();
                } catch (InterruptedException e) {
                    producer.interrupt();
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for the next batch", e);
                }
            }
            if (next.failure() != null) {
                finished = true;
                Throwable failure = next.failure();
                if (failure instanceof Error)
                    throw (Error) failure;
                throw new IllegalStateException("Batch producer failed", failure);
            }
            if (next == Slot.END) {
                finished = true;
                return false;
            }
            return true;
        }

        @Override
        public Batch next() {
            if (!hasNext())
                throw new NoSuchElementException();
            Batch batch = next.batch();
            next = null;
            return batch;
        }

        @Override
        public void close() {
            finished = true;
            next = null;
            producer.interrupt();
            queue.clear();
        }
    }
}
