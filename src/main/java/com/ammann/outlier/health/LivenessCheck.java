package com.ammann.outlier.health;

import com.ammann.outlier.enumeration.DetectionMethod;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * Liveness health check reporting the process as alive together with the detection
 * methods the engine serves.
 */
@Liveness
public class LivenessCheck implements HealthCheck
{

    @Override
    public HealthCheckResponse call()
    {
        return HealthCheckResponse.named("alive")
                .up()
                .withData("detection-methods", DetectionMethod.supportedKeys())
                .build();
    }

}
