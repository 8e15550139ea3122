package com.eyelevel.uploadengine.config;

import com.eyelevel.uploadengine.retry.JitteredExponentialBackOffPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans of the upload engine.
 */
@Slf4j
@Configuration
public class EngineConfig {

    /**
     * Time source for response timing, health check stamps and cost periods. Replaced in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JitteredExponentialBackOffPolicy uploadBackOffPolicy(final UploadEngineConfig config) {
        final UploadEngineConfig.Retry retry = config.getRetry();
        log.info("Configuring upload backoff: base {}ms, cap {}ms, jitter ratio {}", retry.getBaseDelayMs(),
                retry.getMaxDelayMs(), retry.getJitterRatio());
        return new JitteredExponentialBackOffPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(),
                retry.getJitterRatio());
    }
}
