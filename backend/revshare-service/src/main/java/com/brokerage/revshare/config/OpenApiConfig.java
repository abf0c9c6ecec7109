package com.brokerage.revshare.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI/Swagger configuration
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI backofficeOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Brokerage Back Office API")
                        .description(
                                "Agent hierarchy, transaction entry and multi-tier revenue share distribution")
                        .version("1.0.0"));
    }
}
