package com.anomalywatch.quantile;

import com.anomalywatch.exception.InvalidQuantileIndexException;
import lombok.Value;

/**
 * Positions inside a {@link QuantileVector} used as lower bound, upper bound and point forecast.
 * Defaults give the p10..p90 (80%) interval around the median.
 */
@Value
public class QuantileIndices {

    public static final int DEFAULT_LOWER = 1;
    public static final int DEFAULT_UPPER = 9;
    public static final int DEFAULT_POINT = 5;

    int lower;
    int upper;
    int point;

    public static QuantileIndices defaults() {
        return new QuantileIndices(DEFAULT_LOWER, DEFAULT_UPPER, DEFAULT_POINT);
    }

    /**
     * @throws InvalidQuantileIndexException unless {@code 0 <= lower < upper < vectorLength}
     *         and {@code 0 <= point < vectorLength}
     */
    public QuantileIndices validate(int vectorLength) {
        boolean boundsOk = lower >= 0 && lower < upper && upper < vectorLength;
        boolean pointOk = point >= 0 && point < vectorLength;
        if (!boundsOk || !pointOk) {
            throw new InvalidQuantileIndexException(lower, upper, point, vectorLength);
        }
        return this;
    }
}
