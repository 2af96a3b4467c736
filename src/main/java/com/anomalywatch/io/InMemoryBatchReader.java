package com.anomalywatch.io;

import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.transform.TransformHook;
import com.anomalywatch.transform.TransformPipeline;
import com.anomalywatch.workflow.BatchReader;

/**
 * Serves a batch already held in memory, running the optional {@code AFTER} chain on each load.
 */
public class InMemoryBatchReader implements BatchReader {

    private final DataBatch batch;
    private final TransformPipeline pipeline;

    public InMemoryBatchReader(DataBatch batch, TransformPipeline pipeline) {
        this.batch = batch;
        this.pipeline = pipeline != null ? pipeline : TransformPipeline.empty();
    }

    public InMemoryBatchReader(DataBatch batch) {
        this(batch, null);
    }

    @Override
    public DataBatch load() {
        return pipeline.apply(TransformHook.AFTER, batch);
    }
}
