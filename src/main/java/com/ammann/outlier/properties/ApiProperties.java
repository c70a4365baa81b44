/* (C)2026 */
package com.ammann.outlier.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Outlier analysis endpoints
     */
    public static final class Outliers {
        private Outliers() {}

        public static final String BASE = "/outliers";
        public static final String USER = "/users/{username}";
        public static final String USER_INCONSISTENCY = USER + "/inconsistency";
        public static final String AGE_GROUP = "/age-groups/{ageGroup}";
        public static final String GLOBAL = "/global";
        public static final String STATISTICS = "/statistics";
        public static final String ANALYZE = "/analyze";
    }
}
