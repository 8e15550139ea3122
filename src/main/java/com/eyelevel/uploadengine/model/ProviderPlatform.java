package com.eyelevel.uploadengine.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The vendor family behind a provider. Informational only: rates and behavior come from
 * the provider's own configuration, never from this value.
 */
@Getter
@AllArgsConstructor
public enum ProviderPlatform {
    AWS("aws"),
    AZURE("azure"),
    GCP("gcp"),
    CUSTOM("custom");

    private static final Map<String, ProviderPlatform> VALUE_MAP = Stream.of(values()).collect(
            Collectors.toMap(ProviderPlatform::getValue, Function.identity()));
    private final String value;

    /**
     * Converts a configuration string to a platform, defaulting to {@code CUSTOM} for unknown values.
     */
    public static ProviderPlatform convertByValue(final String value) {
        if (value == null) {
            return CUSTOM;
        }
        return VALUE_MAP.getOrDefault(value.trim().toLowerCase(), CUSTOM);
    }
}
