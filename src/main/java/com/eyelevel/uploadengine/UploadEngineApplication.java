package com.eyelevel.uploadengine;

import com.eyelevel.uploadengine.config.UploadEngineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;

/**
 * The main entry point for the Upload Engine Spring Boot application.
 * <p>
 * Binds the "app.upload" properties to {@link UploadEngineConfig}; the configured providers are registered
 * by {@link com.eyelevel.uploadengine.config.ProviderBootstrapper} once the context is up.
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(value = UploadEngineConfig.class)
public class UploadEngineApplication {

    public static void main(final String[] args) {
        log.info("🚀 Starting UploadEngineApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(UploadEngineApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "UploadEngine"));
        log.info("Access URLs:");
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
