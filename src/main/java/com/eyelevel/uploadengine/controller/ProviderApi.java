package com.eyelevel.uploadengine.controller;

import com.eyelevel.uploadengine.dto.common.ApiResponse;
import com.eyelevel.uploadengine.dto.provider.FailoverRequest;
import com.eyelevel.uploadengine.dto.provider.ProviderConfigRequest;
import com.eyelevel.uploadengine.dto.provider.ProviderResponse;
import com.eyelevel.uploadengine.dto.provider.RegisterProviderRequest;
import com.eyelevel.uploadengine.dto.provider.StrategyRequest;
import com.eyelevel.uploadengine.model.LoadBalanceStrategy;
import com.eyelevel.uploadengine.model.ProviderStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;

import java.util.List;

@Tag(name = "Providers", description = "Endpoints for registering providers and steering traffic between them. Changes apply to live routing.")
public interface ProviderApi {

    @Operation(summary = "List Providers", description = "Lists every registered provider in failover order, with its runtime status.")
    ResponseEntity<ApiResponse<List<ProviderResponse>>> listProviders();

    @Operation(summary = "Register Provider",
            description = "Registers a provider and probes it once. A provider that fails the probe stays registered but offline.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Provider registered.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Invalid provider definition.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - A provider with this id already exists.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ProviderResponse>> registerProvider(@Valid @RequestBody RegisterProviderRequest request);

    @Operation(summary = "Update Provider Configuration",
            description = "Replaces the provider's configuration and re-probes it. A failed probe marks the provider offline but keeps the new configuration.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Configuration replaced.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown provider.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ProviderResponse>> updateProviderConfig(
            @Parameter(description = "Provider id.", required = true, example = "aws-primary") @PathVariable String providerId,
            @Valid @RequestBody ProviderConfigRequest request);

    @Operation(summary = "Remove Provider", description = "Removes a provider with its status, load counter and cost account.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Provider removed."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown provider.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Void>> removeProvider(
            @Parameter(description = "Provider id.", required = true, example = "aws-primary") @PathVariable String providerId);

    @Operation(summary = "Check All Providers", description = "Probes every registered provider and returns the resulting statuses.")
    ResponseEntity<ApiResponse<List<ProviderStatus>>> healthCheckAll();

    @Operation(summary = "Check One Provider", description = "Probes a single provider and returns its status.")
    ResponseEntity<ApiResponse<ProviderStatus>> healthCheck(
            @Parameter(description = "Provider id.", required = true, example = "aws-primary") @PathVariable String providerId);

    @Operation(summary = "Recover Provider",
            description = "Probes a provider after an outage. If it answers, its statistics are cleared and it is back to OPTIMAL.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Provider recovered.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - Unknown provider.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Bad Gateway - The provider still does not answer.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ProviderStatus>> recoverProvider(
            @Parameter(description = "Provider id.", required = true, example = "aws-primary") @PathVariable String providerId);

    @Operation(summary = "Trigger Failover",
            description = "Marks the source provider offline so traffic moves to the others. The target must be registered and healthy.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Failover triggered."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Unknown providers or unhealthy target.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<Void>> triggerFailover(@Valid @RequestBody FailoverRequest request);

    @Operation(summary = "Change Load Balancing Strategy", description = "Switches the strategy used for new selections.")
    ResponseEntity<ApiResponse<LoadBalanceStrategy>> setStrategy(@Valid @RequestBody StrategyRequest request);

    @Operation(summary = "Redistribute Load", description = "Resets every load counter and the round-robin position.")
    ResponseEntity<ApiResponse<Void>> redistributeLoad();
}
