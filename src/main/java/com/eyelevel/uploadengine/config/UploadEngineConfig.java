package com.eyelevel.uploadengine.config;

import com.eyelevel.uploadengine.model.LoadBalanceStrategy;
import com.eyelevel.uploadengine.model.SyncMode;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds application properties under the "app.upload" prefix to a strongly-typed
 * configuration object: strategy, budget, retry tuning and the initial provider list.
 */
@Data
@ConfigurationProperties(prefix = "app.upload")
public class UploadEngineConfig {

    private LoadBalanceStrategy loadBalanceStrategy = LoadBalanceStrategy.ROUND_ROBIN;
    private boolean enableCostOptimization;
    private Budget budget = new Budget();
    private Retry retry = new Retry();
    private Transport transport = new Transport();
    private List<ProviderProperties> providers = new ArrayList<>();

    @Data
    public static class Budget {
        private double maxMonthlyCost = 100.0;
        private double defaultCostPerMegabyte = 0.025;
        private int periodDays = 30;
    }

    @Data
    public static class Retry {
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30000;
        private double jitterRatio = 0.25;
        private int defaultMaxRetries = 3;
    }

    @Data
    public static class Transport {
        // Retries inside the SDK would hide failed attempts from health tracking.
        private int sdkRetryCount = 0;
    }

    @Data
    public static class ProviderProperties {
        private String id;
        private String platform;
        private int priority;
        private String endpoint;
        private String region;
        private String bucketName;
        private boolean encryptedTransport = true;
        private SyncMode syncMode = SyncMode.OFFLINE_FIRST;
        private Double costPerMegabyte;
        private String accessKey;
        @ToString.Exclude
        private String secretKey;
    }
}
