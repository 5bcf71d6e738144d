package com.thetaguard.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class LifecycleRequest {

    @Valid
    @NotNull(message = "Market snapshot is required")
    private MarketSnapshotDto market;
}
