package com.example.admission;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * レートリミッター一式の組み立て。
 * 設定が不正 (default ルール無し、倍率が範囲外など) ならここで例外になり、起動が失敗する。
 */
@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimitConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RateLimitConfiguration.class);

    // Spring Security のフィルタチェーン (-100) の後。principal が入ってから判定したい
    static final int FILTER_ORDER = -99;

    @Bean
    Clock rateLimitClock() {
        return Clock.systemUTC();
    }

    @Bean
    PolicyOverride policyOverride() {
        return new PolicyOverride();
    }

    @Bean
    AdmissionDecider admissionDecider(RateLimitProperties props,
                                      PolicyOverride policyOverride,
                                      Clock rateLimitClock,
                                      MeterRegistry registry) {
        PolicyTable table = props.toPolicyTable();
        log.info("Rate limiting: {} endpoint rules, default {}/{}s, {} exempt paths, anonymous x{}",
                table.rules().size(),
                table.defaultRule().maxRequests(),
                table.defaultRule().windowSeconds(),
                props.getExemptPaths().size(),
                table.anonymousMultiplier());
        return new AdmissionDecider(
                table,
                new IdentifierResolver(props.isTrustForwardedHeader()),
                policyOverride,
                rateLimitClock,
                props.getSweepInterval(),
                registry
        );
    }

    @Bean
    @ConditionalOnProperty(prefix = "ratelimit", name = "enabled", havingValue = "true", matchIfMissing = true)
    FilterRegistrationBean<RateLimitFilter> rateLimitFilter(AdmissionDecider decider,
                                                            RateLimitProperties props,
                                                            ObjectMapper objectMapper) {
        FilterRegistrationBean<RateLimitFilter> registration =
                new FilterRegistrationBean<>(new RateLimitFilter(decider, props, objectMapper));
        registration.setOrder(FILTER_ORDER);
        registration.addUrlPatterns("/*");
        return registration;
    }

    // ratelimit.enabled=false ならルート単位の制限も掛けない
    @Bean
    @ConditionalOnProperty(prefix = "ratelimit", name = "enabled", havingValue = "true", matchIfMissing = true)
    RateLimitedHandlerInterceptor rateLimitedHandlerInterceptor(AdmissionDecider decider,
                                                                PolicyOverride policyOverride,
                                                                RateLimitProperties props) {
        return new RateLimitedHandlerInterceptor(decider, policyOverride, props);
    }
}
