package com.anomalywatch.workflow;

import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.comparison.AnomalyDetector;
import com.anomalywatch.exception.EmptyBatchException;
import com.anomalywatch.transform.TransformHook;
import com.anomalywatch.transform.TransformPipeline;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads forecasts and actuals, runs the {@code BEFORE} chain on the actual batch (usually a pivot),
 * detects, runs the {@code AFTER_DETECTION} chain on the results and hands them to the writer.
 * An empty result is a valid outcome and is still written.
 */
@Slf4j
public class AnomalyDetectionWorkflow {

    private final BatchReader forecastReader;
    private final BatchReader actualReader;
    private final AnomalyDetector detector;
    private final BatchWriter writer;
    private final TransformPipeline pipeline;

    @Builder
    public AnomalyDetectionWorkflow(@NonNull BatchReader forecastReader, @NonNull BatchReader actualReader,
                                    @NonNull AnomalyDetector detector, BatchWriter writer,
                                    TransformPipeline pipeline) {
        this.forecastReader = forecastReader;
        this.actualReader = actualReader;
        this.detector = detector;
        this.writer = writer;
        this.pipeline = pipeline != null ? pipeline : TransformPipeline.empty();
    }

    public DataBatch run() {
        DataBatch forecast = forecastReader.load();
        if (forecast == null || forecast.isEmpty()) {
            throw new EmptyBatchException("Forecast reader");
        }
        DataBatch actual = actualReader.load();
        if (actual == null || actual.isEmpty()) {
            throw new EmptyBatchException("Actual reader");
        }
        log.info("Anomaly detection started | forecastRows={} | actualRows={}", forecast.size(), actual.size());

        DataBatch preparedActual = pipeline.apply(TransformHook.BEFORE, actual);
        DataBatch detected = detector.detect(forecast, preparedActual);
        DataBatch result = pipeline.apply(TransformHook.AFTER_DETECTION, detected);

        if (writer != null) {
            writer.write(result);
        }
        log.info("Anomaly detection finished | detected={} | returned={} | written={}",
                 detected.size(), result.size(), writer != null);
        return result;
    }
}
