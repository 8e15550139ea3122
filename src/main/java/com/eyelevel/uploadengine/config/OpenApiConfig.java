package com.eyelevel.uploadengine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * API documentation for the upload, provider and report endpoints. Not exposed in production.
 */
@Configuration
@Profile("!prod")
public class OpenApiConfig {

    @Bean
    public OpenAPI uploadEngineOpenAPI(@Value("${spring.application.name:upload-engine}") final String appName) {
        return new OpenAPI().info(new Info().title(appName)
                                            .version("v1")
                                            .description("Uploads payloads to a pool of S3-compatible providers "
                                                    + "with health tracking, retries and priority failover."));
    }
}
