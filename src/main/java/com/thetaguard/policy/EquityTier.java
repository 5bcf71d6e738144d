package com.thetaguard.policy;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** Base per-group position limits for accounts with at least {@code minEquity}. */
@Getter
@Builder
public class EquityTier {

    private final String name;
    private final BigDecimal minEquity;
    private final Map<String, Integer> groupLimits;
}
