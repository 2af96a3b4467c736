package com.anomalywatch.workflow;

import com.anomalywatch.batch.DataBatch;

public interface BatchReader {

    DataBatch load();
}
