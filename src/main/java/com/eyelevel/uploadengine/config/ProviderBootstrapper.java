package com.eyelevel.uploadengine.config;

import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.model.ProviderConfig;
import com.eyelevel.uploadengine.model.ProviderPlatform;
import com.eyelevel.uploadengine.registry.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Registers the providers listed under {@code app.upload.providers} once the application has started.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderBootstrapper implements ApplicationRunner {

    private final UploadEngineConfig config;
    private final ProviderRegistry providerRegistry;

    @Override
    public void run(final ApplicationArguments args) {
        if (config.getProviders().isEmpty()) {
            log.warn("No upload providers configured under 'app.upload.providers'");
            return;
        }
        int registered = 0;
        for (final UploadEngineConfig.ProviderProperties properties : config.getProviders()) {
            if (!StringUtils.hasText(properties.getId())) {
                log.error("Skipping configured provider without an id: {}", properties);
                continue;
            }
            if (providerRegistry.register(toProvider(properties))) {
                registered++;
            }
        }
        log.info("Registered {} of {} configured upload providers; {} healthy", registered,
                config.getProviders().size(), providerRegistry.healthyProviders().size());
    }

    static Provider toProvider(final UploadEngineConfig.ProviderProperties properties) {
        final ProviderConfig providerConfig = ProviderConfig.builder()
                                                            .endpoint(properties.getEndpoint())
                                                            .region(properties.getRegion())
                                                            .bucketName(properties.getBucketName())
                                                            .encryptedTransport(properties.isEncryptedTransport())
                                                            .syncMode(properties.getSyncMode())
                                                            .costPerMegabyte(properties.getCostPerMegabyte())
                                                            .accessKey(properties.getAccessKey())
                                                            .secretKey(properties.getSecretKey())
                                                            .build();
        return Provider.builder()
                       .id(properties.getId())
                       .platform(ProviderPlatform.convertByValue(properties.getPlatform()))
                       .priority(properties.getPriority())
                       .config(providerConfig)
                       .build();
    }
}
