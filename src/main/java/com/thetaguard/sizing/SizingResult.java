package com.thetaguard.sizing;

import com.thetaguard.domain.enums.SizingOutcome;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Output of the Kelly sizer.
 *
 * <p>{@code shouldTrade} is the decision; {@code riskFraction} is only meaningful when it is
 * true. A degenerate input never produces a fraction, it produces {@code shouldTrade=false} and
 * an {@code error} describing what was wrong.
 */
@Getter
@Builder
@ToString
public class SizingResult {

    private final String strategy;
    private final double riskFraction;
    private final boolean shouldTrade;
    private final SizingOutcome outcome;

    /** Uncapped Kelly fraction before the conservatism multiplier; NaN when inputs were degenerate. */
    private final double rawKelly;

    private final String reason;
    private final String error;

    public static SizingResult trade(String strategy, double riskFraction, double rawKelly, SizingOutcome outcome) {
        return SizingResult.builder()
                .strategy(strategy)
                .riskFraction(riskFraction)
                .shouldTrade(true)
                .outcome(outcome)
                .rawKelly(rawKelly)
                .reason(outcome == SizingOutcome.CAPPED
                        ? String.format("Kelly fraction capped at %.4f", riskFraction)
                        : String.format("Kelly fraction %.4f", riskFraction))
                .build();
    }

    public static SizingResult doNotTrade(String strategy, SizingOutcome outcome, double rawKelly, String reason) {
        return SizingResult.builder()
                .strategy(strategy)
                .riskFraction(0.0)
                .shouldTrade(false)
                .outcome(outcome)
                .rawKelly(rawKelly)
                .reason(reason)
                .error(outcome == SizingOutcome.DEGENERATE_INPUT ? reason : null)
                .build();
    }
}
