package com.anomalywatch.quantile;

import com.anomalywatch.exception.MalformedQuantileException;
import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fixed-length quantile prediction for one metric at one date.
 *
 * <p>Wire form is the values joined by {@code |}, e.g. {@code "100|90|92|95|98|100|102|105|108|110"}.
 * Only positions carry meaning; the values are not assumed to be sorted.</p>
 */
@EqualsAndHashCode
public final class QuantileVector {

    public static final String DELIMITER = "|";
    public static final int DEFAULT_LENGTH = 10;

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final double[] values;

    private QuantileVector(double[] values) {
        this.values = values;
    }

    public static QuantileVector of(double... values) {
        return new QuantileVector(values.clone());
    }

    public static QuantileVector parse(String cell) {
        return parse(cell, DEFAULT_LENGTH);
    }

    /**
     * Parses the wire form. The split must yield exactly {@code length} finite decimal tokens
     * ({@code 12}, {@code -0.5}, {@code 1e3}); hex and type-suffixed literals are rejected.
     *
     * @throws MalformedQuantileException on a wrong token count or any unparsable token
     */
    public static QuantileVector parse(String cell, int length) {
        if (cell == null) {
            throw new MalformedQuantileException("null", "cell is null");
        }
        String[] tokens = cell.split("\\|", -1);
        if (tokens.length != length) {
            throw new MalformedQuantileException(cell,
                "expected " + length + " values, got " + tokens.length);
        }
        double[] parsed = new double[length];
        for (int i = 0; i < length; i++) {
            String token = tokens[i].trim();
            try {
                parsed[i] = Double.parseDouble(token);
            } catch (NumberFormatException ex) {
                throw new MalformedQuantileException(cell, "token " + i + " ('" + token + "') is not numeric", ex);
            }
            if (!Double.isFinite(parsed[i])) {
                throw new MalformedQuantileException(cell, "token " + i + " ('" + token + "') is not finite");
            }
            if (!DECIMAL.matcher(token).matches()) {
                throw new MalformedQuantileException(cell, "token " + i + " ('" + token + "') is not a plain decimal");
            }
        }
        return new QuantileVector(parsed);
    }

    public double get(int index) {
        return values[index];
    }

    public int length() {
        return values.length;
    }

    /** Both interval positions exactly zero: the model produced no forecast for this cell. */
    public boolean isNoForecast(QuantileIndices indices) {
        return values[indices.getLower()] == 0.0 && values[indices.getUpper()] == 0.0;
    }

    public String encode() {
        return Arrays.stream(values)
            .mapToObj(QuantileVector::formatValue)
            .collect(Collectors.joining(DELIMITER));
    }

    private static String formatValue(double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }

    @Override
    public String toString() {
        return encode();
    }
}
