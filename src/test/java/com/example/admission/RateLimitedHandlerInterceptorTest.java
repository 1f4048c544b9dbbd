package com.example.admission;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimitedHandlerInterceptorTest {

    static class ReportController {
        @RateLimited(requests = 2, windowSeconds = 30)
        public String export() { return "ok"; }

        public String plain() { return "ok"; }

        @RateLimited(requests = 0, windowSeconds = 60)
        public String misconfigured() { return "ok"; }
    }

    private final PolicyOverride overrides = new PolicyOverride();
    private final RateLimitProperties props = new RateLimitProperties();
    private AdmissionDecider decider;
    private RateLimitedHandlerInterceptor interceptor;

    @BeforeEach
    void setUp() {
        PolicyTable table = new PolicyTable(List.of(), new PolicyRule("*", 1000, 3600), List.of(), 0.5);
        decider = new AdmissionDecider(table, new IdentifierResolver(true), overrides,
                MutableClock.startingAtEpoch(), 1000, new SimpleMeterRegistry());
        interceptor = new RateLimitedHandlerInterceptor(decider, overrides, props);
    }

    private static MockHttpServletRequest request(String path) {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", path);
        req.setUserPrincipal(() -> "u1");
        return req;
    }

    @Test
    void annotatedHandlerIsLimitedByItsRouteRule() throws Exception {
        HandlerMethod handler = new HandlerMethod(new ReportController(), "export");

        MockHttpServletResponse first = new MockHttpServletResponse();
        assertThat(interceptor.preHandle(request("/api/reports/export"), first, handler)).isTrue();
        assertThat(first.getHeader("X-RateLimit-Limit")).isEqualTo("2");
        assertThat(first.getHeader("X-RateLimit-Remaining")).isEqualTo("1");
        assertThat(first.getHeader("X-RateLimit-Reset")).isEqualTo("30");

        assertThat(interceptor.preHandle(request("/api/reports/export"), new MockHttpServletResponse(), handler)).isTrue();

        assertThatThrownBy(() -> interceptor.preHandle(request("/api/reports/export"), new MockHttpServletResponse(), handler))
                .isInstanceOfSatisfying(RateLimitExceededException.class,
                        ex -> assertThat(ex.getRetryAfterSeconds()).isEqualTo(30));

        // 共有のルールは変わっていない
        assertThat(overrides.current()).isNull();
        assertThat(decider.describe(AdmissionRequest.authenticated("/api/reports/export", "u1")).limit()).isEqualTo(1000);
    }

    @Test
    void unannotatedHandlerPassesThroughWithoutCounting() throws Exception {
        HandlerMethod handler = new HandlerMethod(new ReportController(), "plain");
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(request("/api/reports/plain"), response, handler)).isTrue();

        assertThat(response.getHeader("X-RateLimit-Limit")).isNull();
        assertThat(decider.activeWindows()).isZero();
    }

    @Test
    void nonHandlerMethodIsIgnored() throws Exception {
        assertThat(interceptor.preHandle(request("/static/app.js"), new MockHttpServletResponse(), new Object())).isTrue();
    }

    @Test
    void filterAndRouteCountersAreSeparateForTheSameRequest() throws Exception {
        HandlerMethod handler = new HandlerMethod(new ReportController(), "export");
        RateLimitFilter filter = new RateLimitFilter(decider, props, new ObjectMapper());

        for (int i = 0; i < 2; i++) {
            MockHttpServletRequest req = request("/api/reports/export");
            MockHttpServletResponse res = new MockHttpServletResponse();
            MockFilterChain chain = new MockFilterChain();

            filter.doFilter(req, res, chain);
            assertThat(chain.getRequest()).as("filter passed request #%d", i + 1).isNotNull();
            assertThat(interceptor.preHandle(req, res, handler)).isTrue();
        }

        assertThatThrownBy(() -> interceptor.preHandle(request("/api/reports/export"), new MockHttpServletResponse(), handler))
                .isInstanceOf(RateLimitExceededException.class);

        // グローバル側はフィルタの2回分だけ
        MockHttpServletResponse res = new MockHttpServletResponse();
        filter.doFilter(request("/api/reports/export"), res, new MockFilterChain());
        assertThat(res.getHeader("X-RateLimit-Limit")).isEqualTo("1000");
        assertThat(res.getHeader("X-RateLimit-Remaining")).isEqualTo("997");
    }

    @Test
    void invalidAnnotationIsRejectedWhenRoutesAreValidated() throws Exception {
        HandlerMethod ok = new HandlerMethod(new ReportController(), "export");
        HandlerMethod broken = new HandlerMethod(new ReportController(), "misconfigured");

        assertThatThrownBy(() -> interceptor.validate(List.of(ok, broken)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("misconfigured");
    }

    @Test
    void invalidAnnotationAtRequestTimeFailsOpen() throws Exception {
        HandlerMethod broken = new HandlerMethod(new ReportController(), "misconfigured");
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(request("/api/reports/misconfigured"), response, broken)).isTrue();
        assertThat(response.getHeader("X-RateLimit-Limit")).isNull();
    }
}
