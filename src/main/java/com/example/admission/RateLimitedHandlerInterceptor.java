package com.example.admission;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.lang.reflect.Method;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * &#64;RateLimited の付いたハンドラに、そのルート専用の上限を掛ける。
 *
 * アノテーションはハンドラメソッドごとに一度だけ読み、検証済みの RouteRule としてキャッシュする。
 * 起動時 (ContextRefreshedEvent) に全ハンドラを見て、不正な値があれば起動を失敗させる。
 * 判定は PolicyOverride のスコープ内で行うので、共有の PolicyTable は変わらない。
 * カウンタは "route:" 付きのキーなので、フィルタのグローバル判定とは別勘定。
 */
public class RateLimitedHandlerInterceptor implements HandlerInterceptor, ApplicationListener<ContextRefreshedEvent> {

    private static final Logger log = LoggerFactory.getLogger(RateLimitedHandlerInterceptor.class);

    private final AdmissionDecider decider;
    private final PolicyOverride overrides;
    private final RateLimitProperties props;

    private final ConcurrentHashMap<Method, Optional<RouteRule>> routeRules = new ConcurrentHashMap<>();

    public RateLimitedHandlerInterceptor(AdmissionDecider decider, PolicyOverride overrides, RateLimitProperties props) {
        this.decider = decider;
        this.overrides = overrides;
        this.props = props;
    }

    @Override
    public void onApplicationEvent(ContextRefreshedEvent event) {
        event.getApplicationContext()
                .getBeansOfType(RequestMappingHandlerMapping.class)
                .values()
                .forEach(mapping -> validate(mapping.getHandlerMethods().values()));
    }

    /**
     * 全ハンドラの &#64;RateLimited を検証してキャッシュに載せる。不正なら IllegalStateException。
     */
    void validate(Collection<HandlerMethod> handlers) {
        for (HandlerMethod hm : handlers) {
            try {
                routeRule(hm);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid @RateLimited on " + hm.getShortLogMessage() + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod hm)) return true;

        Decision decision;
        try {
            RouteRule route = routeRule(hm).orElse(null);
            if (route == null) return true;

            AdmissionRequest admission = ServletAdmissionRequests.from(request, props.getForwardedHeader());
            PolicyRule rule = route.toPolicyRule(admission.path());
            decision = overrides.withOverride(rule, () -> decider.check(admission));
        } catch (RuntimeException e) {
            // ルート設定の不備などでリクエストを落とさない
            log.error("Route rate limit check failed for {}, admitting request", request.getRequestURI(), e);
            return true;
        }

        if (!decision.allowed()) {
            throw new RateLimitExceededException(decision);
        }

        // フィルタで付けたグローバルの値よりルート側を優先
        if (props.isIncludeHeaders()) {
            RateLimitHeaders.apply(response, decision);
        }
        return true;
    }

    private Optional<RouteRule> routeRule(HandlerMethod hm) {
        // 例外のときはキャッシュされない
        return routeRules.computeIfAbsent(hm.getMethod(), m -> find(hm).map(RouteRule::of));
    }

    private static Optional<RateLimited> find(HandlerMethod hm) {
        RateLimited onMethod = AnnotatedElementUtils.findMergedAnnotation(hm.getMethod(), RateLimited.class);
        if (onMethod != null) return Optional.of(onMethod);
        return Optional.ofNullable(AnnotatedElementUtils.findMergedAnnotation(hm.getBeanType(), RateLimited.class));
    }

    /**
     * 検証済みのルート設定。pattern が null ならリクエストパスを使う。
     */
    record RouteRule(String pattern, int requests, int windowSeconds) {

        RouteRule {
            // PolicyRule と同じ検証を先にやっておく
            new PolicyRule(pattern == null ? "" : pattern, requests, windowSeconds);
        }

        static RouteRule of(RateLimited cfg) {
            return new RouteRule(cfg.pattern().isEmpty() ? null : cfg.pattern(), cfg.requests(), cfg.windowSeconds());
        }

        PolicyRule toPolicyRule(String path) {
            return new PolicyRule(pattern == null ? path : pattern, requests, windowSeconds);
        }
    }
}
