package dev.unitrain.data;

/**
 * Supplier of batches for one phase.
 *
 * <p>Each call to {@link #iterator()} starts a new pass over the data. Batches are consumed
 * strictly in the order they are yielded.
 */
public interface DataSource extends Iterable<Batch> {

    /**
     * Number of batches one pass yields.
     */
    int numBatches();

    DataShape shape();

    /**
     * Largest number of samples in any batch; the last batch of a pass may be shorter.
     */
    int batchSize();
}
