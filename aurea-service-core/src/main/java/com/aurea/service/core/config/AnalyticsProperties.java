package com.aurea.service.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "aurea.analytics")
public class AnalyticsProperties {
    private Dashboard dashboard = new Dashboard();
    private Buckets buckets = new Buckets();
    private MicroConversions microConversions = new MicroConversions();
    private Limits limits = new Limits();

    public Dashboard getDashboard() {
        return dashboard;
    }

    public void setDashboard(Dashboard dashboard) {
        this.dashboard = dashboard;
    }

    public Buckets getBuckets() {
        return buckets;
    }

    public void setBuckets(Buckets buckets) {
        this.buckets = buckets;
    }

    public MicroConversions getMicroConversions() {
        return microConversions;
    }

    public void setMicroConversions(MicroConversions microConversions) {
        this.microConversions = microConversions;
    }

    public Limits getLimits() {
        return limits;
    }

    public void setLimits(Limits limits) {
        this.limits = limits;
    }

    public static class Dashboard {
        private int workers = 4;
        private long timeoutSeconds = 30;

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    public static class Buckets {
        /** Zone in which bucket floors are computed. */
        private String zone = "UTC";

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class MicroConversions {
        private int minSessions = 5;

        public int getMinSessions() {
            return minSessions;
        }

        public void setMinSessions(int minSessions) {
            this.minSessions = minSessions;
        }
    }

    public static class Limits {
        private int defaultLimit = 20;
        private int maxLimit = 100;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        /** Null falls back to the default; anything else must lie in 1..max. */
        public int resolve(Integer requested) {
            if (requested == null) {
                return defaultLimit;
            }
            if (requested < 1 || requested > maxLimit) {
                throw new IllegalArgumentException("limit must be between 1 and " + maxLimit);
            }
            return requested;
        }
    }
}
