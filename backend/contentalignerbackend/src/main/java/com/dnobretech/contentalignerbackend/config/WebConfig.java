package com.dnobretech.contentalignerbackend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;


@Configuration
public class WebConfig {

    // o viewer do alinhamento roda em outra origem
    @Bean
    public CorsFilter corsFilter(@Value("${aligner.cors.allowed-origins:*}") List<String> allowedOrigins) {
        CorsConfiguration c = new CorsConfiguration();
        allowedOrigins.forEach(c::addAllowedOriginPattern);
        c.addAllowedHeader("*");
        c.addAllowedMethod("*");
        c.addExposedHeader("Content-Disposition");
        UrlBasedCorsConfigurationSource s = new UrlBasedCorsConfigurationSource();
        s.registerCorsConfiguration("/api/**", c);
        return new CorsFilter(s);
    }
}
