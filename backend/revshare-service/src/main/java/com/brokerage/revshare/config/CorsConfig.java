package com.brokerage.revshare.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.Arrays;
import java.util.List;

/**
 * CORS for the back office dashboard. Covers everything under {@code /api/**}:
 * agent maintenance and downlines ({@code /api/agents}), transaction entry
 * ({@code /api/transactions}) and the revenue share ledger with its annual
 * allowance lookup ({@code /api/revenue-shares}). Origins come from
 * {@code brokerage.dashboard.allowed-origins}.
 */
@Configuration
public class CorsConfig {

    @Value("${brokerage.dashboard.allowed-origins:http://localhost:5173,http://localhost:5000}")
    private List<String> allowedOrigins;

    @Bean
    public CorsFilter corsFilter() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowCredentials(true);
        config.setAllowedOrigins(allowedOrigins);
        config.setAllowedHeaders(Arrays.asList(
                "Origin",
                "Content-Type",
                "Accept",
                "Authorization",
                "X-Requested-With"));
        config.setAllowedMethods(Arrays.asList(
                "GET",
                "POST",
                "PUT",
                "DELETE",
                "OPTIONS"));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", config);

        return new CorsFilter(source);
    }
}
