/* (C)2026 */
package com.ammann.outlier.enumeration;

import com.ammann.outlier.exception.ValidationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The five outlier detection strategies offered by the engine.
 *
 * <p>Each constant carries the stable key used in result payloads, ensemble vote
 * breakdowns and the {@code method} query parameter.
 */
public enum DetectionMethod {
    /** Standardized deviation from the mean. */
    ZSCORE("zscore"),
    /** Tukey fences around the interquartile range. */
    IQR("iqr"),
    /** Median/MAD based z-score scaled by 0.6745. */
    MODIFIED_ZSCORE("modified_zscore"),
    /** Absolute deviation from the median against a multiple of the MAD. */
    MAD("mad"),
    /** Consensus vote over the four univariate methods. */
    ENSEMBLE("ensemble");

    private final String key;

    DetectionMethod(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a method from its key. Matching ignores case and accepts {@code -} in place of
     * {@code _}; a {@code null} or blank key selects {@link #ENSEMBLE}.
     *
     * @param key the method key, e.g. {@code "modified_zscore"}
     * @return the matching method
     * @throws ValidationException if the key names no known method
     */
    public static DetectionMethod fromKey(String key) {
        if (key == null || key.isBlank()) {
            return ENSEMBLE;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (DetectionMethod method : values()) {
            if (method.key.equals(normalized)) {
                return method;
            }
        }
        throw ValidationException.invalidParameter("method", key, "one of " + supportedKeys());
    }

    /** Comma separated list of accepted keys, used in error messages. */
    public static String supportedKeys() {
        return Arrays.stream(values()).map(DetectionMethod::key).collect(Collectors.joining(", "));
    }
}
