/* (C)2026 */
package com.ammann.outlier.detection;

/**
 * Tunable parameters of every detector, passed explicitly to each analysis.
 *
 * @param zScoreThreshold z-score above which a sample is flagged
 * @param iqrMultiplier fence width in units of IQR
 * @param modifiedZScoreThreshold modified z-score above which a sample is flagged
 * @param madThreshold multiple of the MAD a deviation must exceed
 * @param consensusThreshold fraction of ensemble voters that must agree
 * @param inconsistencySigmaMultiplier standard deviations above the mean change that mark a
 *     transition as inconsistent
 * @param highInconsistencyCvPercent coefficient of variation (percent) above which a history
 *     is highly inconsistent
 */
public record DetectionConfig(
        double zScoreThreshold,
        double iqrMultiplier,
        double modifiedZScoreThreshold,
        double madThreshold,
        double consensusThreshold,
        double inconsistencySigmaMultiplier,
        double highInconsistencyCvPercent) {

    public static final double DEFAULT_ZSCORE_THRESHOLD = 2.5;
    public static final double DEFAULT_IQR_MULTIPLIER = 1.5;
    public static final double DEFAULT_MODIFIED_ZSCORE_THRESHOLD = 3.5;
    public static final double DEFAULT_MAD_THRESHOLD = 2.5;
    public static final double DEFAULT_CONSENSUS_THRESHOLD = 0.5;
    public static final double DEFAULT_INCONSISTENCY_SIGMA_MULTIPLIER = 2.0;
    public static final double DEFAULT_HIGH_INCONSISTENCY_CV_PERCENT = 30.0;

    public DetectionConfig {
        Parameters.requirePositive("zScoreThreshold", zScoreThreshold);
        Parameters.requirePositive("iqrMultiplier", iqrMultiplier);
        Parameters.requirePositive("modifiedZScoreThreshold", modifiedZScoreThreshold);
        Parameters.requirePositive("madThreshold", madThreshold);
        Parameters.requireFraction("consensusThreshold", consensusThreshold);
        Parameters.requirePositive("inconsistencySigmaMultiplier", inconsistencySigmaMultiplier);
        Parameters.requirePositive("highInconsistencyCvPercent", highInconsistencyCvPercent);
    }

    public static DetectionConfig defaults() {
        return new DetectionConfig(
                DEFAULT_ZSCORE_THRESHOLD,
                DEFAULT_IQR_MULTIPLIER,
                DEFAULT_MODIFIED_ZSCORE_THRESHOLD,
                DEFAULT_MAD_THRESHOLD,
                DEFAULT_CONSENSUS_THRESHOLD,
                DEFAULT_INCONSISTENCY_SIGMA_MULTIPLIER,
                DEFAULT_HIGH_INCONSISTENCY_CV_PERCENT);
    }

    public DetectionConfig withZScoreThreshold(double value) {
        return new DetectionConfig(
                value,
                iqrMultiplier,
                modifiedZScoreThreshold,
                madThreshold,
                consensusThreshold,
                inconsistencySigmaMultiplier,
                highInconsistencyCvPercent);
    }

    public DetectionConfig withIqrMultiplier(double value) {
        return new DetectionConfig(
                zScoreThreshold,
                value,
                modifiedZScoreThreshold,
                madThreshold,
                consensusThreshold,
                inconsistencySigmaMultiplier,
                highInconsistencyCvPercent);
    }

    public DetectionConfig withModifiedZScoreThreshold(double value) {
        return new DetectionConfig(
                zScoreThreshold,
                iqrMultiplier,
                value,
                madThreshold,
                consensusThreshold,
                inconsistencySigmaMultiplier,
                highInconsistencyCvPercent);
    }

    public DetectionConfig withMadThreshold(double value) {
        return new DetectionConfig(
                zScoreThreshold,
                iqrMultiplier,
                modifiedZScoreThreshold,
                value,
                consensusThreshold,
                inconsistencySigmaMultiplier,
                highInconsistencyCvPercent);
    }

    public DetectionConfig withConsensusThreshold(double value) {
        return new DetectionConfig(
                zScoreThreshold,
                iqrMultiplier,
                modifiedZScoreThreshold,
                madThreshold,
                value,
                inconsistencySigmaMultiplier,
                highInconsistencyCvPercent);
    }

    public ZScoreMethod zScoreMethod() {
        return new ZScoreMethod(zScoreThreshold);
    }

    public IqrMethod iqrMethod() {
        return new IqrMethod(iqrMultiplier);
    }

    public ModifiedZScoreMethod modifiedZScoreMethod() {
        return new ModifiedZScoreMethod(modifiedZScoreThreshold);
    }

    public MadMethod madMethod() {
        return new MadMethod(madThreshold);
    }

    public InconsistencyAnalyzer inconsistencyAnalyzer() {
        return new InconsistencyAnalyzer(inconsistencySigmaMultiplier, highInconsistencyCvPercent);
    }
}
