package com.chartgate.gateway.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the public chart API. Embeds are loaded cross-origin from customer pages, so every
 * origin may read {@code /v1/**}; credentials travel in headers, never cookies.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/v1/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("Retry-After", "X-Correlation-ID")
                .allowCredentials(false)
                .maxAge(3600);
    }
}
