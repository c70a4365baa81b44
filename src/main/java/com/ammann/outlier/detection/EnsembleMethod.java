/* (C)2026 */
package com.ammann.outlier.detection;

import com.ammann.outlier.enumeration.ResultStatus;
import com.ammann.outlier.exception.ValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.jboss.logging.Logger;

/**
 * Consensus voting over independent univariate detectors.
 *
 * <p>Every voter scores the whole series; {@code votes[i]} counts the voters that flagged
 * sample {@code i}. A sample is a consensus outlier iff
 * {@code votes[i] >= ceil(voters * consensusThreshold)}. With the four standard voters and
 * the default threshold of 0.5, two agreeing methods are enough.
 *
 * <p>Voters run sequentially on the calling thread unless an {@link Executor} is supplied,
 * in which case they run concurrently. The result does not depend on the executor: votes
 * are tallied in voter order after all voters have finished.
 */
public final class EnsembleMethod {

    private static final Logger LOG = Logger.getLogger(EnsembleMethod.class);

    static final int MIN_SAMPLES = 2;

    private final List<OutlierMethod> voters;
    private final double consensusThreshold;
    private final Executor executor;

    public EnsembleMethod() {
        this(DetectionConfig.defaults());
    }

    public EnsembleMethod(DetectionConfig config) {
        this(config, null);
    }

    /**
     * Creates the standard four-voter ensemble from a configuration.
     *
     * @param config thresholds for the voters and the consensus fraction
     * @param executor runs voters concurrently when non-null
     */
    public EnsembleMethod(DetectionConfig config, Executor executor) {
        this(
                List.of(
                        config.zScoreMethod(),
                        config.iqrMethod(),
                        config.modifiedZScoreMethod(),
                        config.madMethod()),
                config.consensusThreshold(),
                executor);
    }

    public EnsembleMethod(List<OutlierMethod> voters, double consensusThreshold, Executor executor) {
        if (voters == null || voters.isEmpty()) {
            throw new ValidationException("Ensemble requires at least one voting method");
        }
        this.voters = List.copyOf(voters);
        this.consensusThreshold =
                Parameters.requireFraction("consensusThreshold", consensusThreshold);
        this.executor = executor;
    }

    public double consensusThreshold() {
        return consensusThreshold;
    }

    /** Number of agreeing voters required to flag a sample. */
    public int consensusVotesNeeded() {
        return (int) Math.ceil(voters.size() * consensusThreshold);
    }

    public EnsembleResult detect(SampleSeries series) {
        if (series.size() < MIN_SAMPLES) {
            LOG.debugf("Ensemble skipped: %d samples, %d required", series.size(), MIN_SAMPLES);
            return EnsembleResult.insufficientData(consensusThreshold);
        }

        List<MethodResult> results = runVoters(series);

        int[] votes = new int[series.size()];
        Map<String, MethodResult> individualResults = new LinkedHashMap<>();
        List<String> methodsUsed = new ArrayList<>(results.size());
        for (MethodResult result : results) {
            for (int index : result.outlierIndices()) {
                votes[index]++;
            }
            individualResults.put(result.methodName(), result);
            methodsUsed.add(result.methodName());
        }

        int votesNeeded = consensusVotesNeeded();
        List<Integer> voteList = new ArrayList<>(votes.length);
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < votes.length; i++) {
            voteList.add(votes[i]);
            if (votes[i] >= votesNeeded) {
                indices.add(i);
            }
        }

        LOG.debugf(
                "Ensemble flagged %d of %d samples (%d of %d votes needed)",
                indices.size(), series.size(), votesNeeded, voters.size());

        return new EnsembleResult(
                series.valuesAt(indices),
                indices,
                voteList,
                methodsUsed,
                consensusThreshold,
                votesNeeded,
                individualResults,
                ResultStatus.COMPLETED);
    }

    private List<MethodResult> runVoters(SampleSeries series) {
        if (executor == null) {
            List<MethodResult> results = new ArrayList<>(voters.size());
            for (OutlierMethod voter : voters) {
                results.add(voter.detect(series));
            }
            return results;
        }

        List<CompletableFuture<MethodResult>> futures = new ArrayList<>(voters.size());
        for (OutlierMethod voter : voters) {
            futures.add(submit(voter, series));
        }
        List<MethodResult> results = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<MethodResult> future : futures) {
                results.add(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        return results;
    }

    private CompletableFuture<MethodResult> submit(OutlierMethod voter, SampleSeries series) {
        try {
            return CompletableFuture.supplyAsync(() -> voter.detect(series), executor);
        } catch (RejectedExecutionException e) {
            LOG.debugf("Executor rejected %s voter, running it on the calling thread", voter.method());
            return CompletableFuture.completedFuture(voter.detect(series));
        }
    }
}
