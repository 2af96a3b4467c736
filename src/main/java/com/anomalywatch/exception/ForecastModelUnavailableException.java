package com.anomalywatch.exception;

public class ForecastModelUnavailableException extends AnomalyWatchException {
    public ForecastModelUnavailableException(Throwable cause) {
        super("FORECAST_MODEL_UNAVAILABLE",
              "The forecasting model service is currently unavailable. Please try again later.",
              cause);
    }
}
