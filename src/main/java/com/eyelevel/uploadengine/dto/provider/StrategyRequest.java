package com.eyelevel.uploadengine.dto.provider;

import com.eyelevel.uploadengine.model.LoadBalanceStrategy;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class StrategyRequest {

    @NotNull(message = "The 'strategy' field is required.")
    @Schema(description = "Load balancing strategy to activate.", example = "LEAST_LOADED")
    private LoadBalanceStrategy strategy;
}
