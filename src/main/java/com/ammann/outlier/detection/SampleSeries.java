/* (C)2026 */
package com.ammann.outlier.detection;

import com.ammann.outlier.exception.MalformedInputException;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, ordered sequence of {@link Sample}s handed to the detection engine.
 *
 * <p>Order is meaningful: result indices refer to positions in this series, and the
 * inconsistency analysis compares neighbouring samples. The engine never reorders a
 * series; callers sort by time before building one.
 */
public final class SampleSeries {

    private static final SampleSeries EMPTY = new SampleSeries(List.of());

    private final List<Sample> samples;
    private final double[] values;

    private SampleSeries(List<Sample> samples) {
        this.samples = samples;
        this.values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).value();
        }
    }

    public static SampleSeries empty() {
        return EMPTY;
    }

    /**
     * Builds a series from bare values.
     *
     * @throws MalformedInputException if any value is NaN or infinite
     */
    public static SampleSeries of(double... values) {
        if (values == null) {
            throw new MalformedInputException("Sample values must not be null");
        }
        List<Sample> samples = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw MalformedInputException.atIndex(i, values[i]);
            }
            samples.add(Sample.of(values[i]));
        }
        return new SampleSeries(List.copyOf(samples));
    }

    /**
     * Builds a series from boxed values, as received from JSON payloads or storage.
     *
     * @throws MalformedInputException if the list is {@code null} or holds a {@code null},
     *     NaN or infinite element
     */
    public static SampleSeries ofValues(List<? extends Number> values) {
        if (values == null) {
            throw new MalformedInputException("Sample values must not be null");
        }
        List<Sample> samples = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Number value = values.get(i);
            if (value == null || !Double.isFinite(value.doubleValue())) {
                throw MalformedInputException.atIndex(i, value);
            }
            samples.add(Sample.of(value.doubleValue()));
        }
        return new SampleSeries(List.copyOf(samples));
    }

    /**
     * Builds a series from samples that already carry ids and timestamps.
     *
     * @throws MalformedInputException if the list is {@code null} or holds a {@code null} sample
     */
    public static SampleSeries of(List<Sample> samples) {
        if (samples == null) {
            throw new MalformedInputException("Samples must not be null");
        }
        for (int i = 0; i < samples.size(); i++) {
            if (samples.get(i) == null) {
                throw MalformedInputException.atIndex(i, null);
            }
        }
        return new SampleSeries(List.copyOf(samples));
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public Sample get(int index) {
        return samples.get(index);
    }

    public double valueAt(int index) {
        return values[index];
    }

    /** Returns a copy of the sample values in series order. */
    public double[] values() {
        return values.clone();
    }

    /** Values at the given positions, in the order the positions are listed. */
    List<Double> valuesAt(List<Integer> indices) {
        List<Double> selected = new ArrayList<>(indices.size());
        for (int index : indices) {
            selected.add(values[index]);
        }
        return selected;
    }

    @Override
    public String toString() {
        return "SampleSeries[size=" + samples.size() + "]";
    }
}
