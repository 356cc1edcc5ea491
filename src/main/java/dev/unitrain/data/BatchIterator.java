package dev.unitrain.data;

import java.util.Iterator;

/**
 * Iterator over one pass that holds resources, such as a producer thread, until the pass
 * ends or is abandoned.
 */
public interface BatchIterator extends Iterator<Batch>, AutoCloseable {

    /**
     * Release the pass. Safe to call more than once and after the last batch.
     */
    @Override
    void close();

    /**
     * Close {@code batches} if it holds resources; plain iterators are left alone.
     */
    static void release(Iterator<Batch> batches) {
        if (batches instanceof BatchIterator)
            ((BatchIterator) batches).close();
    }
}
