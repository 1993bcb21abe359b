package com.example.voice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "voice.security")
public class VoiceSecurityProperties {

    /**
     * Toggle for the inbound HTTP rate limiter.
     */
    private boolean rateLimitingEnabled = true;

    /**
     * Ant-style paths that are never throttled. Provider webhooks retry on 429.
     */
    private List<String> rateLimitExemptPaths = new ArrayList<>(List.of("/api/webhooks/**"));

    /**
     * Budget shared by all dashboard operators of one organization, keyed on the
     * organization header.
     */
    @Valid
    private final Budget organization = new Budget(600, Duration.ofMinutes(1));

    /**
     * Budget per client address, drawn by every request whether or not it names an organization.
     */
    @Valid
    private final Budget address = new Budget(300, Duration.ofMinutes(1));

    /**
     * Buckets untouched for this long are forgotten.
     */
    @NotNull
    private Duration bucketIdleTimeout = Duration.ofMinutes(10);

    /**
     * Upper bound on tracked buckets. Keys seen once the bound is reached share one overflow bucket.
     */
    @Min(1)
    private int maxTrackedBuckets = 50_000;

    public boolean isRateLimitingEnabled() {
        return rateLimitingEnabled;
    }

    public void setRateLimitingEnabled(boolean rateLimitingEnabled) {
        this.rateLimitingEnabled = rateLimitingEnabled;
    }

    public List<String> getRateLimitExemptPaths() {
        return rateLimitExemptPaths;
    }

    public void setRateLimitExemptPaths(List<String> rateLimitExemptPaths) {
        this.rateLimitExemptPaths = rateLimitExemptPaths;
    }

    public Budget getOrganization() {
        return organization;
    }

    public Budget getAddress() {
        return address;
    }

    public Duration getBucketIdleTimeout() {
        return bucketIdleTimeout;
    }

    public void setBucketIdleTimeout(Duration bucketIdleTimeout) {
        this.bucketIdleTimeout = bucketIdleTimeout;
    }

    public int getMaxTrackedBuckets() {
        return maxTrackedBuckets;
    }

    public void setMaxTrackedBuckets(int maxTrackedBuckets) {
        this.maxTrackedBuckets = maxTrackedBuckets;
    }

    public static class Budget {

        /**
         * Requests admitted per period; unused requests do not carry over.
         */
        @Min(1)
        private long requests;

        @NotNull
        private Duration period;

        public Budget() {
        }

        Budget(long requests, Duration period) {
            this.requests = requests;
            this.period = period;
        }

        public long getRequests() {
            return requests;
        }

        public void setRequests(long requests) {
            this.requests = requests;
        }

        public Duration getPeriod() {
            return period;
        }

        public void setPeriod(Duration period) {
            this.period = period;
        }
    }
}
