package com.anomalywatch.transform.filter;

public enum FilterMode {
    INCLUDE,
    EXCLUDE
}
