/* (C)2026 */
package com.ammann.dip.properties;

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
     * Dip classification and discovery endpoints
     */
    public static final class Dips {
        private Dips() {}

        public static final String BASE = "/dips";
        public static final String CLASSIFY = BASE + "/classify";
        public static final String DISCOVER = BASE + "/discover";
        public static final String ROLLING = BASE + "/rolling";
        public static final String BATCH = BASE + "/batch";
    }

    /**
     * Trend context endpoints
     */
    public static final class Trend {
        private Trend() {}

        public static final String BASE = "/trend";
    }

    /**
     * Health check endpoints (Quarkus defaults)
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/q/health";
        public static final String LIVE = BASE + "/live";
        public static final String READY = BASE + "/ready";
        public static final String METRICS = "/q/metrics";
        public static final String OPENAPI = "/q/openapi";
    }
}
