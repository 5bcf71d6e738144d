package com.thetaguard.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Already-resolved account values injected by the execution layer on each tick.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountSnapshot {

    private String accountId;
    private BigDecimal equity;

    /** Fraction of equity currently committed as buying power, 0 to 1. */
    private double buyingPowerUsed;

    private Instant asOf;
}
