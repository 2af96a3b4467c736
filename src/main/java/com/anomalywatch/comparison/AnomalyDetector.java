package com.anomalywatch.comparison;

import com.anomalywatch.batch.DataBatch;

/**
 * Compares a wide forecast batch with a wide actual batch and renders the findings as a batch.
 */
public interface AnomalyDetector {

    DataBatch detect(DataBatch forecast, DataBatch actual);
}
