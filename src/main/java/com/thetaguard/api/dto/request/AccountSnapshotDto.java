package com.thetaguard.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountSnapshotDto {

    private String accountId;

    @NotNull(message = "Equity is required")
    @PositiveOrZero(message = "Equity must not be negative")
    private BigDecimal equity;

    /** Fraction of equity committed as buying power. */
    @DecimalMin(value = "0.0", message = "Buying power used must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Buying power used must be between 0 and 1")
    private double buyingPowerUsed;
}
