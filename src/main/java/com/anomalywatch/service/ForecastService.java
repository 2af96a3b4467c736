package com.anomalywatch.service;

import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.client.ForecastModelClient;
import com.anomalywatch.dto.ForecastRequest;
import com.anomalywatch.dto.ForecastResponse;
import com.anomalywatch.io.InMemoryBatchReader;
import com.anomalywatch.transform.BatchTransformer;
import com.anomalywatch.workflow.ForecastWorkflow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    private final ForecastModelClient forecastModelClient;
    private final TransformerFactory  transformerFactory;

    public ForecastResponse forecast(ForecastRequest req, String requestId) {
        List<BatchTransformer> leading = req.getPivot() != null
            ? List.of(transformerFactory.pivot(req.getPivot()))
            : List.of();

        ForecastWorkflow workflow = ForecastWorkflow.builder()
            .reader(new InMemoryBatchReader(DataBatch.fromRows(req.getHistoryRows())))
            .forecaster(forecastModelClient)
            .pipeline(transformerFactory.pipeline(req.getTransformers(), leading))
            .build();

        DataBatch forecast = workflow.runWithoutOutput(req.getHorizon());
        log.info("Forecast complete | horizon={} | rows={} | requestId={}",
                 req.getHorizon(), forecast.size(), requestId);
        return ForecastResponse.builder()
            .requestId(requestId)
            .horizon(req.getHorizon())
            .columns(forecast.getColumns())
            .rows(forecast.getRows())
            .build();
    }
}
