package com.anomalywatch.workflow;

import com.anomalywatch.batch.DataBatch;

/**
 * Forecasting model collaborator. Takes a wide history batch (date column plus one numeric column
 * per metric key) and returns one row per future date with a pipe-delimited quantile string per key.
 */
public interface Forecaster {

    DataBatch forecast(DataBatch history, int horizon);
}
