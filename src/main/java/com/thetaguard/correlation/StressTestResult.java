package com.thetaguard.correlation;

import com.thetaguard.domain.enums.StressRiskLevel;
import com.thetaguard.domain.model.AdmissionDecision;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Result of replaying a hypothetical portfolio through the admission gates at a stress VIX.
 *
 * <p>{@code estimatedLoss} covers only the positions the gates would have admitted;
 * {@code unprotectedLoss} is the same estimate with every scenario position held.
 */
@Getter
@Builder
public class StressTestResult {

    private final double vix;
    private final BigDecimal estimatedLoss;
    private final BigDecimal unprotectedLoss;
    private final StressRiskLevel riskLevel;
    private final int violationCount;
    private final int admittedCount;
    private final double concentrationScore;
    private final List<AdmissionDecision> rejections;
}
