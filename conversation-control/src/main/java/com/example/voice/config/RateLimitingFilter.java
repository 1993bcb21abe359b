package com.example.voice.config;

import com.example.voice.controller.RequestHeaders;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Token-bucket throttle for the control surface. Every request draws from its client
 * address bucket; requests carrying an organization header also draw from that
 * organization's bucket, so rotating the header does not buy a fresh budget.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitingFilter extends OncePerRequestFilter {

    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String OVERFLOW_KEY = "overflow";

    private final VoiceSecurityProperties securityProperties;
    private final ConcurrentMap<String, TrackedBucket> buckets = new ConcurrentHashMap<>();
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RateLimitingFilter(VoiceSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!securityProperties.isRateLimitingEnabled() || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        List<String> exemptPaths = securityProperties.getRateLimitExemptPaths();
        String path = request.getRequestURI();
        return exemptPaths != null && path != null
                && exemptPaths.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        ConsumptionProbe addressProbe = bucket("ip:" + clientAddress(request), securityProperties.getAddress())
                .tryConsumeAndReturnRemaining(1);
        if (!addressProbe.isConsumed()) {
            reject(request, response, addressProbe);
            return;
        }
        ConsumptionProbe probe = addressProbe;
        String organizationId = request.getHeader(RequestHeaders.ORGANIZATION_ID);
        if (StringUtils.hasText(organizationId)) {
            probe = bucket("org:" + organizationId.trim(), securityProperties.getOrganization())
                    .tryConsumeAndReturnRemaining(1);
            if (!probe.isConsumed()) {
                reject(request, response, probe);
                return;
            }
        }
        response.setHeader(REMAINING_HEADER,
                String.valueOf(Math.min(addressProbe.getRemainingTokens(), probe.getRemainingTokens())));
        filterChain.doFilter(request, response);
    }

    /**
     * Forgets buckets that have been idle past the configured timeout. An idle bucket has
     * refilled completely, so dropping it loses no state.
     */
    @Scheduled(fixedDelayString = "${voice.security.bucket-eviction-interval:60000}")
    public void evictIdleBuckets() {
        Duration idleTimeout = securityProperties.getBucketIdleTimeout();
        long cutoff = System.nanoTime() - (idleTimeout == null ? Duration.ofMinutes(10) : idleTimeout).toNanos();
        int before = buckets.size();
        buckets.entrySet().removeIf(entry -> entry.getValue().lastUsed - cutoff < 0);
        int evicted = before - buckets.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate-limit buckets, {} tracked", evicted, buckets.size());
        }
    }

    int trackedBuckets() {
        return buckets.size();
    }

    private Bucket bucket(String key, VoiceSecurityProperties.Budget budget) {
        TrackedBucket tracked = buckets.get(key);
        if (tracked == null) {
            String effectiveKey = buckets.size() >= securityProperties.getMaxTrackedBuckets()
                    ? OVERFLOW_KEY + ":" + key.substring(0, key.indexOf(':'))
                    : key;
            tracked = buckets.computeIfAbsent(effectiveKey, ignored -> new TrackedBucket(newBucket(budget)));
        }
        tracked.lastUsed = System.nanoTime();
        return tracked.bucket;
    }

    private Bucket newBucket(VoiceSecurityProperties.Budget budget) {
        long requests = Math.max(budget.getRequests(), 1);
        Duration period = budget.getPeriod() == null || budget.getPeriod().isZero() || budget.getPeriod().isNegative()
                ? Duration.ofMinutes(1)
                : budget.getPeriod();
        return Bucket.builder()
                .addLimit(Bandwidth.classic(requests, Refill.intervally(requests, period)))
                .build();
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, ConsumptionProbe probe)
            throws IOException {
        long retryAfterSeconds = Math.max(TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()), 1);
        log.debug("Throttled {} {} (organization {}), retry in {}s", request.getMethod(), request.getRequestURI(),
                request.getHeader(RequestHeaders.ORGANIZATION_ID), retryAfterSeconds);
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.setHeader(REMAINING_HEADER, "0");
        response.getWriter().write("{\"timestamp\":\"" + Instant.now()
                + "\",\"error\":\"Request rate exceeded\",\"code\":\"rate_limited\"}");
    }

    private static String clientAddress(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(forwardedFor)) {
            return forwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private static final class TrackedBucket {

        private final Bucket bucket;
        private volatile long lastUsed = System.nanoTime();

        private TrackedBucket(Bucket bucket) {
            this.bucket = bucket;
        }
    }
}
