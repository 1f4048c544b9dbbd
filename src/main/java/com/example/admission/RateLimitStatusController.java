package com.example.admission;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class RateLimitStatusController {

    private final AdmissionDecider decider;
    private final RateLimitProperties props;

    public RateLimitStatusController(AdmissionDecider decider, RateLimitProperties props) {
        this.decider = decider;
        this.props = props;
    }

    /**
     * 使い方:
     *  curl -i "http://localhost:8080/api/rate-limit"
     *
     * 呼び出し元に今効いているルール (identifier は先頭のみ, limit, window) を返す。
     * 認証の有無どちらでも使える。
     */
    @GetMapping("/rate-limit")
    public ApiResponse<RateLimitStatus> status(HttpServletRequest request) {
        AdmissionRequest admission = ServletAdmissionRequests.from(request, props.getForwardedHeader());
        return ApiResponse.ok(decider.describe(admission), request.getHeader(RateLimitHeaders.REQUEST_ID));
    }
}
