package com.eyelevel.uploadengine.controller;

import com.eyelevel.uploadengine.dto.common.ApiResponse;
import com.eyelevel.uploadengine.dto.provider.FailoverRequest;
import com.eyelevel.uploadengine.dto.provider.ProviderConfigRequest;
import com.eyelevel.uploadengine.dto.provider.ProviderResponse;
import com.eyelevel.uploadengine.dto.provider.RegisterProviderRequest;
import com.eyelevel.uploadengine.dto.provider.StrategyRequest;
import com.eyelevel.uploadengine.exception.api.BadGatewayException;
import com.eyelevel.uploadengine.exception.api.BadRequestException;
import com.eyelevel.uploadengine.exception.api.ConflictException;
import com.eyelevel.uploadengine.exception.api.NotFoundException;
import com.eyelevel.uploadengine.failover.FailoverCoordinator;
import com.eyelevel.uploadengine.health.HealthTracker;
import com.eyelevel.uploadengine.model.LoadBalanceStrategy;
import com.eyelevel.uploadengine.model.Provider;
import com.eyelevel.uploadengine.model.ProviderStatus;
import com.eyelevel.uploadengine.registry.ProviderRegistry;
import com.eyelevel.uploadengine.selection.ProviderSelector;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for provider administration: registration, configuration, health checks and traffic steering.
 */
@Slf4j
@RestController
@RequestMapping("/providers")
@RequiredArgsConstructor
public class ProviderController implements ProviderApi {

    private final ProviderRegistry providerRegistry;
    private final HealthTracker healthTracker;
    private final ProviderSelector providerSelector;
    private final FailoverCoordinator failoverCoordinator;

    // --- 1. REGISTRATION ---

    @Override
    @GetMapping("/v1")
    public ResponseEntity<ApiResponse<List<ProviderResponse>>> listProviders() {
        final List<ProviderResponse> providers = providerRegistry.listProviders().stream()
                                                                 .map(this::toResponse)
                                                                 .toList();
        return ResponseEntity.ok(ApiResponse.ok("Providers retrieved successfully.", providers));
    }

    @Override
    @PostMapping("/v1")
    public ResponseEntity<ApiResponse<ProviderResponse>> registerProvider(
            @Valid @RequestBody final RegisterProviderRequest request) {
        log.info("Registering provider '{}' with priority {}", request.getId(), request.getPriority());
        final Provider provider = request.toProvider();
        if (!providerRegistry.register(provider)) {
            throw new ConflictException("A provider with id '" + provider.getId() + "' is already registered.");
        }
        final ProviderResponse body = toResponse(provider);
        final String message = healthTracker.isHealthy(provider.getId())
                ? "Provider registered and connected successfully."
                : "Provider registered but failed its connection test; it stays offline until it recovers.";

        final ApiResponse<ProviderResponse> response = ApiResponse.<ProviderResponse>builder()
                                                                  .response(body)
                                                                  .displayMessage(message)
                                                                  .showMessage(true)
                                                                  .statusCode(HttpStatus.CREATED.value())
                                                                  .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    @PutMapping("/v1/{providerId}/config")
    public ResponseEntity<ApiResponse<ProviderResponse>> updateProviderConfig(
            @PathVariable final String providerId, @Valid @RequestBody final ProviderConfigRequest request) {
        log.info("Updating configuration of provider '{}': {}", providerId, request);
        final Provider current = findOrThrow(providerId);
        final boolean connected = providerRegistry.reconfigure(providerId, request.toProviderConfig());
        final Provider updated = providerRegistry.find(providerId).orElse(current);

        final String message = connected
                ? "Provider configuration updated successfully."
                : "Provider configuration updated but the connection test failed; the provider is offline.";
        return ResponseEntity.ok(ApiResponse.ok(message, toResponse(updated)));
    }

    @Override
    @DeleteMapping("/v1/{providerId}")
    public ResponseEntity<ApiResponse<Void>> removeProvider(@PathVariable final String providerId) {
        log.info("Removing provider '{}'", providerId);
        if (!providerRegistry.unregister(providerId)) {
            throw new NotFoundException("Provider '" + providerId + "' not found.");
        }
        return ResponseEntity.ok(ApiResponse.ok("Provider removed successfully.", null));
    }

    // --- 2. HEALTH ---

    @Override
    @PostMapping("/v1/health-check")
    public ResponseEntity<ApiResponse<List<ProviderStatus>>> healthCheckAll() {
        final boolean anyHealthy = providerRegistry.performHealthCheck();
        final String message = anyHealthy
                ? "Health check completed."
                : "Health check completed. No provider is healthy.";
        return ResponseEntity.ok(ApiResponse.ok(message, providerRegistry.listStatuses()));
    }

    @Override
    @PostMapping("/v1/{providerId}/health-check")
    public ResponseEntity<ApiResponse<ProviderStatus>> healthCheck(@PathVariable final String providerId) {
        findOrThrow(providerId);
        final boolean healthy = providerRegistry.performHealthCheck(providerId);
        final String message = healthy ? "Provider is healthy." : "Provider is not healthy.";
        return ResponseEntity.ok(ApiResponse.ok(message, statusOrThrow(providerId)));
    }

    @Override
    @PostMapping("/v1/{providerId}/recover")
    public ResponseEntity<ApiResponse<ProviderStatus>> recoverProvider(@PathVariable final String providerId) {
        findOrThrow(providerId);
        if (!providerRegistry.recoverProvider(providerId)) {
            throw new BadGatewayException("Provider '" + providerId + "' still does not answer.");
        }
        return ResponseEntity.ok(ApiResponse.ok("Provider recovered successfully.", statusOrThrow(providerId)));
    }

    // --- 3. TRAFFIC ---

    @Override
    @PostMapping("/v1/failover")
    public ResponseEntity<ApiResponse<Void>> triggerFailover(@Valid @RequestBody final FailoverRequest request) {
        if (!failoverCoordinator.triggerFailover(request.getFromProviderId(), request.getToProviderId())) {
            throw new BadRequestException(String.format(
                    "Cannot fail over from '%s' to '%s'. Both providers must exist and the target must be healthy.",
                    request.getFromProviderId(), request.getToProviderId()));
        }
        return ResponseEntity.ok(ApiResponse.ok("Failover triggered successfully.", null));
    }

    @Override
    @PutMapping("/v1/strategy")
    public ResponseEntity<ApiResponse<LoadBalanceStrategy>> setStrategy(
            @Valid @RequestBody final StrategyRequest request) {
        try {
            providerSelector.setStrategy(request.getStrategy());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage());
        }
        return ResponseEntity.ok(ApiResponse.ok("Load balancing strategy updated.", providerSelector.getStrategy()));
    }

    @Override
    @PostMapping("/v1/load/redistribute")
    public ResponseEntity<ApiResponse<Void>> redistributeLoad() {
        providerSelector.redistributeLoad();
        return ResponseEntity.ok(ApiResponse.ok("Load counters reset.", null));
    }

    private Provider findOrThrow(final String providerId) {
        return providerRegistry.find(providerId)
                               .orElseThrow(() -> new NotFoundException("Provider '" + providerId + "' not found."));
    }

    private ProviderStatus statusOrThrow(final String providerId) {
        return healthTracker.getStatus(providerId)
                            .orElseThrow(() -> new NotFoundException("Provider '" + providerId + "' not found."));
    }

    private ProviderResponse toResponse(final Provider provider) {
        return ProviderResponse.from(provider, healthTracker.getStatus(provider.getId()).orElse(null));
    }
}
