/* (C)2026 */
package com.ammann.outlier.enumeration;

/**
 * Outcome of a single detection run.
 *
 * <p>Only {@link #COMPLETED} results carry diagnostics. The other two are neutral results:
 * the method name is still populated but no sample is flagged.
 */
public enum ResultStatus {
    /** The method ran over the full series. */
    COMPLETED,
    /** Fewer samples than the method requires. */
    INSUFFICIENT_DATA,
    /** Zero standard deviation or zero MAD; no sample can be scored. */
    DEGENERATE_DISTRIBUTION
}
