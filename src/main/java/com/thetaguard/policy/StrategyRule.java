package com.thetaguard.policy;

import lombok.Builder;
import lombok.Getter;

/**
 * Exit rules and sizing priors for one strategy tag. A null stop-loss multiple means the
 * strategy has no stop (covered-call style positions).
 */
@Getter
@Builder
public class StrategyRule {

    private final String strategy;

    /** Fraction of max profit at which the position is closed, e.g. 0.50. */
    private final double profitTarget;

    /** Loss as a multiple of the entry premium at which the position is closed, e.g. 2.0. */
    private final Double stopLossMultiple;

    /** Days-to-expiry at or below which the position is defended. Never below the global 21. */
    private final int dteManagement;

    private final double winRate;
    private final double averageWin;
    private final double averageLoss;

    /** Overrides the global Kelly multiplier when set. */
    private final Double kellyMultiplier;

    public boolean hasStopLoss() {
        return stopLossMultiple != null;
    }
}
