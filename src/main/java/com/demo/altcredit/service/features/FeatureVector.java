package com.demo.altcredit.service.features;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Immutable model input, always {@link Feature#COUNT} values in canonical order. */
public final class FeatureVector {

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    public static FeatureVector of(double[] values) {
        if (values == null || values.length != Feature.COUNT) {
            throw new IllegalArgumentException("Feature vector must have " + Feature.COUNT + " values, got "
                    + (values == null ? "null" : values.length));
        }
        return new FeatureVector(values.clone());
    }

    public int size() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double get(Feature feature) {
        return values[feature.ordinal()];
    }

    public double[] toArray() {
        return values.clone();
    }

    public Map<String, Double> asNamedMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (Feature f : Feature.canonicalOrder()) {
            out.put(f.columnName(), values[f.ordinal()]);
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector)) return false;
        return Arrays.equals(values, ((FeatureVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
