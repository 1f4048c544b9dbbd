package com.example.admission;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 全リクエストの入口で上限を判定する。
 *
 *  - 許可 → X-RateLimit-* を付けて次へ
 *  - 拒否 → 429 + Retry-After を返して打ち切り
 *  - 除外パス → ヘッダ無しで次へ
 */
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    private final AdmissionDecider decider;
    private final RateLimitProperties props;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(AdmissionDecider decider, RateLimitProperties props, ObjectMapper objectMapper) {
        this.decider = decider;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        Decision decision = decider.check(() -> ServletAdmissionRequests.from(request, props.getForwardedHeader()));

        if (!decision.allowed()) {
            log.warn("Rate limit exceeded for {} (limit: {}, reset: {}s)",
                    request.getRequestURI(), decision.limit(), decision.resetSeconds());
            writeTooManyRequests(request, response, decision);
            return;
        }

        // レスポンスがコミットされる前に付ける
        if (props.isIncludeHeaders()) {
            RateLimitHeaders.apply(response, decision);
        }
        filterChain.doFilter(request, response);
    }

    private void writeTooManyRequests(HttpServletRequest request,
                                      HttpServletResponse response,
                                      Decision decision) throws IOException {
        RateLimitHeaders.applyTooManyRequests(response, decision, props.isIncludeHeaders());
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());

        ApiResponse<Void> body = ApiResponse.rateLimited(decision.resetSeconds(),
                request.getHeader(RateLimitHeaders.REQUEST_ID));
        objectMapper.writeValue(response.getWriter(), body);
    }
}
