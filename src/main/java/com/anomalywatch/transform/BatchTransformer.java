package com.anomalywatch.transform;

import com.anomalywatch.batch.DataBatch;

/**
 * A pure mapping from one batch to another.
 *
 * <p>Implementations must not modify the input, must accept an empty batch (returning an empty
 * batch with the same columns unless reshaping columns is their purpose), and must keep row
 * order unless filtering or reordering is what they do.</p>
 */
@FunctionalInterface
public interface BatchTransformer {

    DataBatch transform(DataBatch batch);

    default String describe() {
        return getClass().getSimpleName();
    }
}
