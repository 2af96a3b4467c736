package com.anomalywatch.workflow;

import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.exception.EmptyBatchException;
import com.anomalywatch.exception.InvalidWorkflowException;
import com.anomalywatch.transform.TransformHook;
import com.anomalywatch.transform.TransformPipeline;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Reader, {@code BEFORE} chain, forecaster, {@code AFTER} chain, writer. The writer is optional.
 */
@Slf4j
public class ForecastWorkflow {

    private final BatchReader reader;
    private final Forecaster forecaster;
    private final BatchWriter writer;
    private final TransformPipeline pipeline;

    @Builder
    public ForecastWorkflow(@NonNull BatchReader reader, @NonNull Forecaster forecaster,
                            BatchWriter writer, TransformPipeline pipeline) {
        this.reader = reader;
        this.forecaster = forecaster;
        this.writer = writer;
        this.pipeline = pipeline != null ? pipeline : TransformPipeline.empty();
    }

    public DataBatch run(int horizon) {
        DataBatch forecast = runWithoutOutput(horizon);
        if (writer != null) {
            writer.write(forecast);
            log.info("Forecast written | rows={}", forecast.size());
        }
        return forecast;
    }

    public DataBatch runWithoutOutput(int horizon) {
        if (horizon <= 0) {
            throw new InvalidWorkflowException("horizon must be a positive integer, got " + horizon);
        }
        DataBatch history = reader.load();
        if (history == null || history.isEmpty()) {
            throw new EmptyBatchException("History reader");
        }
        log.info("Forecast workflow started | historyRows={} | horizon={}", history.size(), horizon);

        DataBatch prepared = pipeline.apply(TransformHook.BEFORE, history);
        DataBatch forecast = forecaster.forecast(prepared, horizon);
        DataBatch result = pipeline.apply(TransformHook.AFTER, forecast);

        log.info("Forecast workflow finished | rows={} | columns={}", result.size(), result.getColumns().size());
        return result;
    }
}
