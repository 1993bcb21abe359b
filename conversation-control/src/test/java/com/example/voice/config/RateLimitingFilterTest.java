package com.example.voice.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.voice.controller.RequestHeaders;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitingFilterTest {

    private VoiceSecurityProperties properties;
    private RateLimitingFilter filter;

    @BeforeEach
    void setUp() {
        properties = new VoiceSecurityProperties();
        properties.getOrganization().setRequests(2);
        properties.getOrganization().setPeriod(Duration.ofMinutes(1));
        properties.getAddress().setRequests(5);
        properties.getAddress().setPeriod(Duration.ofMinutes(1));
        filter = new RateLimitingFilter(properties);
    }

    @Test
    void organizationBudgetIsSharedAcrossPathsAndRejectsWhenSpent() throws Exception {
        MockHttpServletResponse first = perform(organizationRequest("org-1", "10.0.0.1", "/api/dashboard/stats"));
        MockHttpServletResponse second = perform(organizationRequest("org-1", "10.0.0.2", "/api/leads"));
        MockHttpServletResponse third = perform(organizationRequest("org-1", "10.0.0.3", "/api/dashboard/stats"));

        assertThat(first.getStatus()).isEqualTo(200);
        assertThat(first.getHeader(RateLimitingFilter.REMAINING_HEADER)).isEqualTo("1");
        assertThat(second.getStatus()).isEqualTo(200);
        assertThat(third.getStatus()).isEqualTo(429);
        assertThat(third.getHeader("Retry-After")).isNotBlank();
        assertThat(third.getContentAsString()).contains("\"code\":\"rate_limited\"");
    }

    @Test
    void organizationsDoNotShareBuckets() throws Exception {
        perform(organizationRequest("org-1", "10.0.0.1", "/api/leads"));
        perform(organizationRequest("org-1", "10.0.0.1", "/api/leads"));

        assertThat(perform(organizationRequest("org-2", "10.0.0.2", "/api/leads")).getStatus()).isEqualTo(200);
    }

    @Test
    void rotatingOrganizationHeaderStillSpendsTheAddressBudget() throws Exception {
        for (int i = 0; i < 5; i++) {
            assertThat(perform(organizationRequest("org-" + i, "10.0.0.9", "/api/leads")).getStatus())
                    .isEqualTo(200);
        }

        assertThat(perform(organizationRequest("org-fresh", "10.0.0.9", "/api/leads")).getStatus()).isEqualTo(429);
    }

    @Test
    void requestsWithoutOrganizationAreLimitedPerAddress() throws Exception {
        properties.getAddress().setRequests(1);
        filter = new RateLimitingFilter(properties);

        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/dashboard/stats");
        request.setRemoteAddr("10.0.0.5");
        assertThat(perform(request).getStatus()).isEqualTo(200);

        MockHttpServletRequest again = new MockHttpServletRequest("GET", "/api/dashboard/stats");
        again.setRemoteAddr("10.0.0.5");
        assertThat(perform(again).getStatus()).isEqualTo(429);

        MockHttpServletRequest forwarded = new MockHttpServletRequest("GET", "/api/dashboard/stats");
        forwarded.setRemoteAddr("10.0.0.5");
        forwarded.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.5");
        assertThat(perform(forwarded).getStatus()).isEqualTo(200);
    }

    @Test
    void trackedBucketsAreCappedAndIdleOnesEvicted() throws Exception {
        properties.setMaxTrackedBuckets(4);
        properties.getAddress().setRequests(100);
        filter = new RateLimitingFilter(properties);

        for (int i = 0; i < 20; i++) {
            perform(organizationRequest("org-" + i, "10.0.0.1", "/api/leads"));
        }
        assertThat(filter.trackedBuckets()).isLessThanOrEqualTo(5);

        properties.setBucketIdleTimeout(Duration.ZERO);
        Thread.sleep(5);
        filter.evictIdleBuckets();
        assertThat(filter.trackedBuckets()).isZero();
    }

    @Test
    void webhookPathsAreNeverThrottled() throws Exception {
        for (int i = 0; i < 10; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/webhooks/call-status");
            MockHttpServletResponse response = perform(request);
            assertThat(response.getStatus()).isEqualTo(200);
            assertThat(response.getHeader(RateLimitingFilter.REMAINING_HEADER)).isNull();
        }
    }

    @Test
    void disabledLimiterPassesEverything() throws Exception {
        properties.setRateLimitingEnabled(false);

        for (int i = 0; i < 10; i++) {
            assertThat(perform(organizationRequest("org-1", "10.0.0.1", "/api/leads")).getStatus()).isEqualTo(200);
        }
    }

    private MockHttpServletRequest organizationRequest(String organizationId, String address, String path) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
        request.setRemoteAddr(address);
        request.addHeader(RequestHeaders.ORGANIZATION_ID, organizationId);
        return request;
    }

    private MockHttpServletResponse perform(MockHttpServletRequest request) throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }
}
