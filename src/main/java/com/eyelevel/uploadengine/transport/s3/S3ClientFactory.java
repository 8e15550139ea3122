package com.eyelevel.uploadengine.transport.s3;

import com.eyelevel.uploadengine.config.UploadEngineConfig;
import com.eyelevel.uploadengine.exception.InsecureEndpointException;
import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.model.ProviderConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Builds and caches one {@link S3Client} per provider. Any S3-compatible service works: a custom endpoint
 * switches the client to path-style addressing. A provider that requires encrypted transport only gets a
 * client for an HTTPS endpoint.
 */
@Slf4j
@Component
public class S3ClientFactory {

    private static final String DEFAULT_REGION = "us-east-1";
    private static final String HTTPS = "https";

    private final ConcurrentMap<String, S3Client> clients = new ConcurrentHashMap<>();
    private final UploadEngineConfig config;

    public S3ClientFactory(final UploadEngineConfig config) {
        this.config = config;
        log.info("S3ClientFactory initialized with {} SDK-level retries", config.getTransport().getSdkRetryCount());
    }

    /**
     * Returns the cached client of a provider, building it on first use.
     *
     * @throws InsecureEndpointException if the provider requires encrypted transport and its endpoint is not HTTPS.
     */
    public S3Client clientFor(final Provider provider) {
        return clients.computeIfAbsent(provider.getId(), id -> build(provider));
    }

    /**
     * Closes and forgets the client of a provider, so the next call rebuilds it from the current configuration.
     */
    public void evict(final String providerId) {
        final S3Client client = clients.remove(providerId);
        if (client != null) {
            client.close();
            log.debug("Closed S3 client of provider '{}'", providerId);
        }
    }

    @PreDestroy
    public void closeAll() {
        log.info("Closing {} S3 clients", clients.size());
        clients.keySet().forEach(this::evict);
    }

    private S3Client build(final Provider provider) {
        final ProviderConfig providerConfig = provider.getConfig();
        final String region = StringUtils.hasText(providerConfig.getRegion())
                ? providerConfig.getRegion()
                : DEFAULT_REGION;

        final RetryPolicy retryPolicy = RetryPolicy.forRetryMode(RetryMode.STANDARD).toBuilder()
                                                   .numRetries(config.getTransport().getSdkRetryCount()).build();
        final S3ClientBuilder builder = S3Client.builder()
                                                .region(Region.of(region))
                                                .credentialsProvider(credentialsFor(provider))
                                                .overrideConfiguration(ClientOverrideConfiguration.builder()
                                                                                                  .retryPolicy(retryPolicy)
                                                                                                  .build());
        if (StringUtils.hasText(providerConfig.getEndpoint())) {
            final URI endpoint = URI.create(providerConfig.getEndpoint());
            if (providerConfig.isEncryptedTransport() && !HTTPS.equalsIgnoreCase(endpoint.getScheme())) {
                throw new InsecureEndpointException(String.format(
                        "Provider '%s' requires encrypted transport but its endpoint '%s' is not HTTPS",
                        provider.getId(), endpoint));
            }
            builder.endpointOverride(endpoint).forcePathStyle(true);
        }
        log.info("Configuring S3Client for provider '{}' (region: {}, endpoint: {})", provider.getId(), region,
                StringUtils.hasText(providerConfig.getEndpoint()) ? providerConfig.getEndpoint() : "<default>");
        return builder.build();
    }

    private AwsCredentialsProvider credentialsFor(final Provider provider) {
        final ProviderConfig providerConfig = provider.getConfig();
        if (StringUtils.hasText(providerConfig.getAccessKey()) && StringUtils.hasText(providerConfig.getSecretKey())) {
            log.debug("Provider '{}' uses static credentials", provider.getId());
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(providerConfig.getAccessKey(), providerConfig.getSecretKey()));
        }
        log.debug("Provider '{}' uses the default credentials chain", provider.getId());
        return DefaultCredentialsProvider.create();
    }
}
