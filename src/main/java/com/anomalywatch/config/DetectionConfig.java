package com.anomalywatch.config;

import com.anomalywatch.comparison.ComparisonEngine;
import com.anomalywatch.comparison.ComparisonSettings;
import com.anomalywatch.quantile.QuantileIndices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Default comparison settings from {@code detection.*}. Requests may override any of them.
 */
@Slf4j
@Configuration
public class DetectionConfig {

    @Value("${detection.date-column:date}")
    private String dateColumn;

    @Value("${detection.lower-index:1}")
    private int lowerIndex;

    @Value("${detection.upper-index:9}")
    private int upperIndex;

    @Value("${detection.point-index:5}")
    private int pointIndex;

    @Value("${detection.dimension-names:}")
    private List<String> dimensionNames;

    @Value("${detection.separator:_}")
    private String separator;

    @Value("${detection.metric-name:}")
    private String metricName;

    @Bean
    public ComparisonSettings comparisonSettings() {
        ComparisonSettings settings = ComparisonSettings.builder()
            .dateColumn(dateColumn)
            .indices(new QuantileIndices(lowerIndex, upperIndex, pointIndex))
            .dimensionNames(dimensionNames.stream().map(String::trim).filter(s -> !s.isEmpty()).toList())
            .separator(separator)
            .metricName(metricName.isBlank() ? null : metricName)
            .build();
        log.info("Detection defaults | dateColumn={} | indices={}/{}/{} | dimensions={}",
                 dateColumn, lowerIndex, upperIndex, pointIndex, settings.getDimensionNames());
        return settings;
    }

    @Bean
    public ComparisonEngine comparisonEngine(ComparisonSettings comparisonSettings) {
        return new ComparisonEngine(comparisonSettings);
    }
}
