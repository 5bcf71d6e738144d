package com.thetaguard.policy;

import com.thetaguard.domain.enums.VixRegime;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * One volatility band: readings from {@code lowerBound} (inclusive) up to the next band's lower
 * bound (exclusive) map to {@code regime}.
 */
@Getter
@Builder
public class RegimeBand {

    private final VixRegime regime;
    private final double lowerBound;

    /** Max buying-power fraction for phases 1..4, index 0 = phase 1. */
    private final List<Double> maxBuyingPowerByPhase;

    public double maxBuyingPower(int phase) {
        if (phase < 1 || phase > maxBuyingPowerByPhase.size()) {
            return 0.0;
        }
        return maxBuyingPowerByPhase.get(phase - 1);
    }
}
