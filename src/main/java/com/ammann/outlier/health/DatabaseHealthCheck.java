package com.ammann.outlier.health;

import com.ammann.outlier.model.ScoreRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;

/**
 * Readiness health check that verifies the score store answers queries.
 *
 * <p>Reports DOWN if counting the stored scores fails or takes longer than one second.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(DatabaseHealthCheck.class);
    static final long MAX_QUERY_MILLIS = 1000;

    @Inject ScoreRepository scoreRepository;

    @Override
    @ActivateRequestContext
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();

            long totalScores = scoreRepository.count();

            Duration queryTime = Duration.between(start, Instant.now());
            boolean performanceOk = queryTime.toMillis() < MAX_QUERY_MILLIS;

            return HealthCheckResponse.named("score-store")
                    .status(performanceOk)
                    .withData("total-scores", totalScores)
                    .withData("query-time-ms", queryTime.toMillis())
                    .withData("performance-ok", performanceOk)
                    .build();

        } catch (Exception e) {
            LOG.warnf("Score store health check failed: %s", e.getMessage());
            return HealthCheckResponse.named("score-store")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("database-accessible", false)
                    .build();
        }
    }
}
