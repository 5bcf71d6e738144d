package com.thetaguard.policy;

import java.math.BigDecimal;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/**
 * What an account is permitted to do once its equity reaches {@code minEquity}.
 */
@Getter
@Builder
public class PhaseProfile {

    public static final String ALL_STRATEGIES = "ALL";

    private final int phase;
    private final BigDecimal minEquity;
    private final int maxPositions;
    private final double maxRiskPerTrade;
    private final int defaultUnitSize;
    private final Set<String> allowedStrategies;
    private final String description;

    public boolean allows(String strategy) {
        return allowedStrategies.contains(ALL_STRATEGIES) || allowedStrategies.contains(strategy);
    }
}
