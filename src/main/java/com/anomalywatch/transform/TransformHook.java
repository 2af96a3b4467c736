package com.anomalywatch.transform;

import com.anomalywatch.exception.InvalidTransformerConfigException;

import java.util.Arrays;
import java.util.Locale;

/** Points in a host operation's lifecycle at which a transformer chain runs. */
public enum TransformHook {
    BEFORE("before"),
    AFTER("after"),
    AFTER_DETECTION("after_detection");

    private final String configName;

    TransformHook(String configName) {
        this.configName = configName;
    }

    /** Resolves {@code before}, {@code after} or {@code after_detection} (case-insensitive). */
    public static TransformHook fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(h -> h.configName.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new InvalidTransformerConfigException(
                "Unknown transform hook '" + name + "'; expected one of before, after, after_detection"));
    }
}
