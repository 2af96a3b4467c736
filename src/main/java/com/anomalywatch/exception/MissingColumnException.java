package com.anomalywatch.exception;

import java.util.Collection;

public class MissingColumnException extends AnomalyWatchException {
    public MissingColumnException(Collection<String> missing, Collection<String> available) {
        super("MISSING_COLUMN",
              "Required column(s) " + missing + " not found. Available columns: " + available);
    }
}
