package com.anomalywatch.workflow;

import com.anomalywatch.batch.DataBatch;

/** Durable sink for a fully formed batch. */
public interface BatchWriter {

    void write(DataBatch batch);
}
