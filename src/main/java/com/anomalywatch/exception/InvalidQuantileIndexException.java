package com.anomalywatch.exception;

public class InvalidQuantileIndexException extends AnomalyWatchException {
    public InvalidQuantileIndexException(int lower, int upper, int point, int vectorLength) {
        super("INVALID_QUANTILE_INDEX",
              "Quantile indices lower=" + lower + ", upper=" + upper + ", point=" + point
              + " must satisfy 0 <= lower < upper < " + vectorLength + " and 0 <= point < " + vectorLength + ".");
    }
}
