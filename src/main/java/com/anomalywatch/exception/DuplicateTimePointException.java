package com.anomalywatch.exception;

import java.time.LocalDate;

public class DuplicateTimePointException extends AnomalyWatchException {
    public DuplicateTimePointException(String batchName, LocalDate date) {
        super("DUPLICATE_TIME_POINT", batchName + " batch has more than one row for date " + date + ".");
    }
}
