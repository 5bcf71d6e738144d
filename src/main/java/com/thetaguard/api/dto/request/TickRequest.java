package com.thetaguard.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class TickRequest {

    @Valid
    @NotNull(message = "Account snapshot is required")
    private AccountSnapshotDto account;

    @Valid
    @NotNull(message = "Market snapshot is required")
    private MarketSnapshotDto market;
}
