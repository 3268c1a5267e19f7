package com.demo.altcredit.config;

import java.util.Arrays;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${app.cors.allowed-origins:*}")
    private String corsOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        var reg = registry.addMapping("/**")
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*");
        String[] origins = StringUtils.hasText(corsOrigins)
                ? Arrays.stream(corsOrigins.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toArray(String[]::new)
                : new String[0];
        if (origins.length == 0 || Arrays.asList(origins).contains("*")) {
            // credentials cannot be combined with a literal "*" origin
            reg.allowedOriginPatterns("*").allowCredentials(true);
        } else {
            reg.allowedOrigins(origins).allowCredentials(true);
        }
    }
}
