package com.tenantgate.core.security;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "tenantgate.security.jwt.enabled", havingValue = "true")
public class SecurityConfig {

    @Bean
    public FilterRegistrationBean<JwtAuthFilter> jwtAuthFilter(SecurityProperties properties) {
        var filter = new JwtAuthFilter(JwtTokenVerifier.fromProperties(properties), properties.getProtectedPrefixes());
        var registration = new FilterRegistrationBean<>(filter);
        registration.setOrder(1);
        registration.addUrlPatterns("/*");
        return registration;
    }
}
