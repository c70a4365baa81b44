/* (C)2026 */
package com.ammann.outlier.service;

import com.ammann.outlier.detection.DetectionConfig;
import com.ammann.outlier.detection.DetectionResult;
import com.ammann.outlier.detection.EnsembleMethod;
import com.ammann.outlier.detection.EnsembleResult;
import com.ammann.outlier.detection.InconsistencyReport;
import com.ammann.outlier.detection.IqrMethod;
import com.ammann.outlier.detection.MadMethod;
import com.ammann.outlier.detection.MethodResult;
import com.ammann.outlier.detection.ModifiedZScoreMethod;
import com.ammann.outlier.detection.SampleSeries;
import com.ammann.outlier.detection.ZScoreMethod;
import com.ammann.outlier.enumeration.DetectionMethod;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.util.concurrent.Executor;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.jboss.logging.Logger;

/**
 * Call interface of the outlier detection engine.
 *
 * <p>Exposes one operation per detection strategy plus the inconsistency analysis.
 * Defaults for every threshold come from configuration and are bundled into an explicit
 * {@link DetectionConfig} per call; overloads taking a parameter override it for that call
 * only. The service holds no mutable state and may be called concurrently.
 *
 * <p>All operations return neutral results for short or zero-spread series. Only malformed
 * input (rejected when the {@link SampleSeries} is built) and invalid parameters throw.
 */
@ApplicationScoped
public class OutlierDetectionService {

    private static final Logger LOG = Logger.getLogger(OutlierDetectionService.class);

    @ConfigProperty(name = "outlier.zscore.threshold", defaultValue = "2.5")
    double zScoreThreshold = DetectionConfig.DEFAULT_ZSCORE_THRESHOLD;

    @ConfigProperty(name = "outlier.iqr.multiplier", defaultValue = "1.5")
    double iqrMultiplier = DetectionConfig.DEFAULT_IQR_MULTIPLIER;

    @ConfigProperty(name = "outlier.modified-zscore.threshold", defaultValue = "3.5")
    double modifiedZScoreThreshold = DetectionConfig.DEFAULT_MODIFIED_ZSCORE_THRESHOLD;

    @ConfigProperty(name = "outlier.mad.threshold", defaultValue = "2.5")
    double madThreshold = DetectionConfig.DEFAULT_MAD_THRESHOLD;

    @ConfigProperty(name = "outlier.ensemble.consensus-threshold", defaultValue = "0.5")
    double consensusThreshold = DetectionConfig.DEFAULT_CONSENSUS_THRESHOLD;

    @ConfigProperty(name = "outlier.inconsistency.sigma-multiplier", defaultValue = "2.0")
    double inconsistencySigmaMultiplier = DetectionConfig.DEFAULT_INCONSISTENCY_SIGMA_MULTIPLIER;

    @ConfigProperty(name = "outlier.inconsistency.high-cv-percent", defaultValue = "30.0")
    double highInconsistencyCvPercent = DetectionConfig.DEFAULT_HIGH_INCONSISTENCY_CV_PERCENT;

    @ConfigProperty(name = "outlier.ensemble.parallel", defaultValue = "false")
    boolean parallelEnsemble;

    @Inject
    @Named("outlier-ensemble-executor")
    ManagedExecutor ensembleExecutor;

    /** Thresholds currently in effect. */
    public DetectionConfig config() {
        return new DetectionConfig(
                zScoreThreshold,
                iqrMultiplier,
                modifiedZScoreThreshold,
                madThreshold,
                consensusThreshold,
                inconsistencySigmaMultiplier,
                highInconsistencyCvPercent);
    }

    public MethodResult detectOutliersZScore(SampleSeries series) {
        return detectOutliersZScore(series, zScoreThreshold);
    }

    public MethodResult detectOutliersZScore(SampleSeries series, double threshold) {
        return new ZScoreMethod(threshold).detect(series);
    }

    public MethodResult detectOutliersIqr(SampleSeries series) {
        return detectOutliersIqr(series, iqrMultiplier);
    }

    public MethodResult detectOutliersIqr(SampleSeries series, double multiplier) {
        return new IqrMethod(multiplier).detect(series);
    }

    public MethodResult detectOutliersModifiedZScore(SampleSeries series) {
        return detectOutliersModifiedZScore(series, modifiedZScoreThreshold);
    }

    public MethodResult detectOutliersModifiedZScore(SampleSeries series, double threshold) {
        return new ModifiedZScoreMethod(threshold).detect(series);
    }

    public MethodResult detectOutliersMad(SampleSeries series) {
        return detectOutliersMad(series, madThreshold);
    }

    public MethodResult detectOutliersMad(SampleSeries series, double threshold) {
        return new MadMethod(threshold).detect(series);
    }

    public EnsembleResult detectOutliersEnsemble(SampleSeries series) {
        return detectOutliersEnsemble(series, consensusThreshold);
    }

    /**
     * Runs the four standard voters with the configured thresholds and applies the given
     * consensus fraction.
     *
     * @param series samples in analysis order
     * @param consensusThreshold fraction of voters that must agree, in {@code (0, 1]}
     * @return votes, consensus outliers and every voter's own result
     */
    public EnsembleResult detectOutliersEnsemble(SampleSeries series, double consensusThreshold) {
        DetectionConfig config = config().withConsensusThreshold(consensusThreshold);
        return new EnsembleMethod(config, votingExecutor()).detect(series);
    }

    public InconsistencyReport detectInconsistency(SampleSeries series) {
        return config().inconsistencyAnalyzer().analyze(series);
    }

    /**
     * Runs one strategy with its configured default parameter.
     */
    public DetectionResult detect(DetectionMethod method, SampleSeries series) {
        return detect(method, series, null);
    }

    /**
     * Runs one strategy, optionally overriding its single tunable parameter: the threshold
     * for the z-score, modified z-score and MAD methods, the fence multiplier for IQR and
     * the consensus fraction for the ensemble.
     *
     * @param method strategy to run
     * @param series samples in analysis order
     * @param parameter override, or {@code null} for the configured default
     * @return the strategy's result
     */
    public DetectionResult detect(DetectionMethod method, SampleSeries series, Double parameter) {
        LOG.debugf(
                "Running %s detection over %d samples (parameter=%s)",
                method.key(), series.size(), parameter);
        return switch (method) {
            case ZSCORE -> detectOutliersZScore(series, orDefault(parameter, zScoreThreshold));
            case IQR -> detectOutliersIqr(series, orDefault(parameter, iqrMultiplier));
            case MODIFIED_ZSCORE -> detectOutliersModifiedZScore(
                    series, orDefault(parameter, modifiedZScoreThreshold));
            case MAD -> detectOutliersMad(series, orDefault(parameter, madThreshold));
            case ENSEMBLE -> detectOutliersEnsemble(series, orDefault(parameter, consensusThreshold));
        };
    }

    private Executor votingExecutor() {
        return parallelEnsemble ? ensembleExecutor : null;
    }

    private static double orDefault(Double parameter, double fallback) {
        return parameter != null ? parameter : fallback;
    }
}
