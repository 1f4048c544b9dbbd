package com.example.admission;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class RateLimitWebConfig implements WebMvcConfigurer {

    // ratelimit.enabled=false のときは Bean 自体が無い
    private final ObjectProvider<RateLimitedHandlerInterceptor> interceptor;

    public RateLimitWebConfig(ObjectProvider<RateLimitedHandlerInterceptor> interceptor) {
        this.interceptor = interceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        interceptor.ifAvailable(registry::addInterceptor);
    }
}
