package com.thetaguard.phase;

import java.math.BigDecimal;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/**
 * Where an account sits within its phase. {@code nextPhaseEquity} is null in the top phase,
 * where {@code progressPercent} is 100.
 */
@Getter
@Builder
public class PhaseMetrics {

    private final int phase;
    private final String description;
    private final BigDecimal equity;
    private final BigDecimal phaseMinEquity;
    private final BigDecimal nextPhaseEquity;
    private final double progressPercent;
    private final int maxPositions;
    private final double maxRiskPerTrade;
    private final Set<String> allowedStrategies;
}
