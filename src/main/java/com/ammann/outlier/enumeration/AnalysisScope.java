/* (C)2026 */
package com.ammann.outlier.enumeration;

import java.util.Locale;

/**
 * Population a score series was drawn from.
 */
public enum AnalysisScope {
    /** A single user's assessment history. */
    USER,
    /** All scores of one detailed age group. */
    AGE_GROUP,
    /** Every stored score. */
    GLOBAL;

    /** Lower-case tag value used in metrics and response payloads. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
