/* (C)2026 */
package com.ammann.outlier.detection;

import com.ammann.outlier.exception.ValidationException;

/** Argument checks for detector parameters. */
final class Parameters {

    private Parameters() {}

    static double requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw ValidationException.invalidParameter(name, value, "a finite number > 0");
        }
        return value;
    }

    static double requireFraction(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0 || value > 1.0) {
            throw ValidationException.invalidParameter(name, value, "a fraction in (0, 1]");
        }
        return value;
    }
}
