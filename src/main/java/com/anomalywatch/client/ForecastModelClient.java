package com.anomalywatch.client;

import com.anomalywatch.batch.Cells;
import com.anomalywatch.batch.DataBatch;
import com.anomalywatch.exception.EmptyBatchException;
import com.anomalywatch.exception.ForecastModelException;
import com.anomalywatch.exception.ForecastModelUnavailableException;
import com.anomalywatch.exception.InvalidWorkflowException;
import com.anomalywatch.quantile.QuantileVector;
import com.anomalywatch.workflow.Forecaster;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Client for the external quantile forecasting model.
 *
 * <p>{@code POST /forecast} receives one series per metric column of a wide history batch and
 * answers with {@value QuantileVector#DEFAULT_LENGTH} quantiles per (step, metric). The returned
 * batch has one row per future date, continuing daily after the last history date, and one
 * pipe-delimited quantile cell per metric. Metrics the model leaves out get an empty cell.</p>
 */
@Slf4j
@Component
public class ForecastModelClient implements Forecaster {

    @Value("${forecast.model.base-url}")
    private String baseUrl;

    @Value("${forecast.model.timeout-seconds:10}")
    private int timeoutSeconds;

    @Value("${forecast.model.max-horizon:256}")
    private int maxHorizon;

    @Value("${detection.date-column:date}")
    private String dateColumn;

    private WebClient webClient;
    private static final TypeReference<Map<String, Object>> MODEL_INFO_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("ForecastModelClient initialised → {}", baseUrl);
    }

    @Override
    public DataBatch forecast(DataBatch history, int horizon) {
        return forecastAsync(history, horizon)
            .blockOptional()
            .orElseThrow(() -> new ForecastModelException("Forecast model returned an empty response"));
    }

    public Mono<DataBatch> forecastAsync(DataBatch history, int horizon) {
        if (horizon <= 0 || horizon > maxHorizon) {
            throw new InvalidWorkflowException(
                "horizon must be between 1 and " + maxHorizon + ", got " + horizon);
        }
        if (history.isEmpty()) {
            throw new EmptyBatchException("Forecast history");
        }
        history.requireColumn(dateColumn);
        List<String> metrics = history.getColumns().stream()
            .filter(c -> !c.equals(dateColumn))
            .toList();
        LocalDate lastDate = lastDate(history);

        return webClient.post().uri("/forecast")
            .bodyValue(buildBody(history, metrics, horizon))
            .retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp ->
                resp.bodyToMono(String.class).map(b -> new ForecastModelException("Forecast model rejected request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp ->
                resp.bodyToMono(String.class).map(b -> new ForecastModelUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(json -> toBatch(json, metrics, lastDate, horizon))
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((spec, sig) -> new ForecastModelUnavailableException(sig.failure())))
            .onErrorMap(WebClientRequestException.class, ForecastModelUnavailableException::new)
            .doOnNext(batch -> log.info("Forecast received | metrics={} | horizon={} | from={}",
                                        metrics.size(), horizon, lastDate.plusDays(1)));
    }

    public Mono<Boolean> isHealthy() {
        return webClient.get().uri("/health").retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> json.hasNonNull("status") && "ok".equals(json.get("status").asText()))
            .onErrorReturn(false);
    }

    public Mono<Map<String, Object>> getModelInfo() {
        return webClient.get().uri("/model/info").retrieve()
            .onStatus(HttpStatusCode::isError, resp ->
                resp.bodyToMono(String.class).map(b -> new ForecastModelUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .map(json -> mapper.convertValue(json, MODEL_INFO_TYPE))
            .onErrorMap(WebClientRequestException.class, ForecastModelUnavailableException::new);
    }

    private ObjectNode buildBody(DataBatch history, List<String> metrics, int horizon) {
        ObjectNode body = mapper.createObjectNode();
        body.put("horizon", horizon);
        body.put("quantiles", QuantileVector.DEFAULT_LENGTH);
        ArrayNode dates = body.putArray("dates");
        for (Object cell : history.columnValues(dateColumn)) {
            LocalDate date = Cells.toDate(cell);
            dates.add(date != null ? date.format(DateTimeFormatter.ISO_DATE) : null);
        }
        ArrayNode series = body.putArray("series");
        for (String metric : metrics) {
            ObjectNode node = series.addObject();
            node.put("metric", metric);
            ArrayNode values = node.putArray("values");
            for (Object cell : history.columnValues(metric)) {
                Double value = Cells.toDouble(metric, cell);
                if (value == null) {
                    values.addNull();
                } else {
                    values.add(value);
                }
            }
        }
        return body;
    }

    private DataBatch toBatch(JsonNode json, List<String> metrics, LocalDate lastDate, int horizon) {
        if (json == null || !json.has("forecasts") || !json.get("forecasts").isArray()) {
            throw new ForecastModelException("Forecast model response missing 'forecasts': " + json);
        }
        Map<String, List<String>> cellsByMetric = new HashMap<>();
        for (JsonNode forecast : json.get("forecasts")) {
            String metric = forecast.path("metric").asText(null);
            JsonNode steps = forecast.get("quantiles");
            if (metric == null || steps == null || !steps.isArray()) {
                throw new ForecastModelException("Malformed forecast entry: " + forecast);
            }
            if (steps.size() != horizon) {
                throw new ForecastModelException("Expected " + horizon + " steps for metric '" + metric
                    + "', got " + steps.size());
            }
            List<String> cells = new ArrayList<>(horizon);
            for (JsonNode step : steps) {
                cells.add(toVector(metric, step).encode());
            }
            cellsByMetric.put(metric, cells);
        }

        List<String> columns = new ArrayList<>();
        columns.add(dateColumn);
        columns.addAll(metrics);
        List<Map<String, Object>> rows = new ArrayList<>(horizon);
        for (int step = 0; step < horizon; step++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(dateColumn, lastDate.plusDays(step + 1L));
            for (String metric : metrics) {
                List<String> cells = cellsByMetric.get(metric);
                row.put(metric, cells != null ? cells.get(step) : null);
            }
            rows.add(row);
        }
        return DataBatch.of(columns, rows);
    }

    private QuantileVector toVector(String metric, JsonNode step) {
        if (!step.isArray() || step.size() != QuantileVector.DEFAULT_LENGTH) {
            throw new ForecastModelException("Expected " + QuantileVector.DEFAULT_LENGTH
                + " quantiles for metric '" + metric + "', got " + step);
        }
        double[] values = new double[step.size()];
        for (int i = 0; i < values.length; i++) {
            JsonNode value = step.get(i);
            if (!value.isNumber()) {
                throw new ForecastModelException("Non-numeric quantile for metric '" + metric + "': " + step);
            }
            values[i] = value.asDouble();
        }
        return QuantileVector.of(values);
    }

    private LocalDate lastDate(DataBatch history) {
        LocalDate last = null;
        for (Object cell : history.columnValues(dateColumn)) {
            LocalDate date = Cells.toDate(cell);
            if (date != null && (last == null || date.isAfter(last))) {
                last = date;
            }
        }
        if (last == null) {
            throw new InvalidWorkflowException("History has no parsable dates in column '" + dateColumn + "'");
        }
        return last;
    }
}
