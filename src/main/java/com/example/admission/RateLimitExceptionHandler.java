package com.example.admission;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RateLimitExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RateLimitExceptionHandler.class);

    private final RateLimitProperties props;

    public RateLimitExceptionHandler(RateLimitProperties props) {
        this.props = props;
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleRateLimit(RateLimitExceededException ex,
                                                             HttpServletRequest req,
                                                             HttpServletResponse res) {
        Decision decision = ex.getDecision();
        log.warn("Route rate limit exceeded for {} (limit: {}, reset: {}s)",
                req.getRequestURI(), decision.limit(), decision.resetSeconds());

        RateLimitHeaders.applyTooManyRequests(res, decision, props.isIncludeHeaders());
        ApiResponse<Void> body = ApiResponse.rateLimited((int) ex.getRetryAfterSeconds(),
                req.getHeader(RateLimitHeaders.REQUEST_ID));
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(body);
    }
}
