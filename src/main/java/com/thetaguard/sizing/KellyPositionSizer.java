package com.thetaguard.sizing;

import com.thetaguard.domain.enums.SizingOutcome;
import com.thetaguard.policy.RiskParameters;
import com.thetaguard.policy.RiskPolicyProvider;
import com.thetaguard.policy.StrategyRule;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fractional Kelly sizing with a hard per-trade cap.
 *
 * <pre>
 * b = avgWin / avgLoss
 * f = (p * b - q) / b          q = 1 - p
 * fraction = clamp(f * multiplier, 0, cap)
 * </pre>
 *
 * <p>Fails closed. Zero or negative magnitudes, a win rate outside (0, 1) or any non-finite
 * input yields {@code shouldTrade=false} with no fraction. There is no fallback constant.
 */
@Component
public class KellyPositionSizer {

    private static final Logger log = LoggerFactory.getLogger(KellyPositionSizer.class);

    private static final BigDecimal MAX_CONTRACTS = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final RiskPolicyProvider riskPolicyProvider;

    public KellyPositionSizer(RiskPolicyProvider riskPolicyProvider) {
        this.riskPolicyProvider = riskPolicyProvider;
    }

    public SizingResult size(String strategy, double winRate, double averageWin, double averageLoss) {
        return size(strategy, winRate, averageWin, averageLoss, riskPolicyProvider.current().getDefaultPerTradeRiskCap());
    }

    public SizingResult size(String strategy, double winRate, double averageWin, double averageLoss, double cap) {
        RiskParameters parameters = riskPolicyProvider.current();

        String invalid = describeInvalidInput(winRate, averageWin, averageLoss, cap);
        if (invalid != null) {
            log.warn("Sizing refused for {}: {}", strategy, invalid);
            return SizingResult.doNotTrade(strategy, SizingOutcome.DEGENERATE_INPUT, Double.NaN, invalid);
        }

        double payoffRatio = averageWin / averageLoss;
        double rawKelly = (winRate * payoffRatio - (1.0 - winRate)) / payoffRatio;
        if (rawKelly <= 0.0) {
            log.info("No edge for {}: raw Kelly {}", strategy, String.format("%.4f", rawKelly));
            return SizingResult.doNotTrade(
                    strategy, SizingOutcome.NEGATIVE_EDGE, rawKelly, String.format("No edge: raw Kelly %.4f", rawKelly));
        }

        StrategyRule rule = parameters.ruleFor(strategy);
        double multiplier = rule.getKellyMultiplier() != null ? rule.getKellyMultiplier() : parameters.getKellyMultiplier();
        double adjusted = rawKelly * multiplier;

        if (adjusted > cap) {
            log.debug("Kelly fraction for {} capped: {} -> {}", strategy, adjusted, cap);
            return SizingResult.trade(strategy, cap, rawKelly, SizingOutcome.CAPPED);
        }
        return SizingResult.trade(strategy, adjusted, rawKelly, SizingOutcome.OK);
    }

    /** Sizes from the win-rate and payoff priors configured for the strategy. */
    public SizingResult sizeFromPriors(String strategy, double cap) {
        StrategyRule rule = riskPolicyProvider.current().ruleFor(strategy);
        return size(strategy, rule.getWinRate(), rule.getAverageWin(), rule.getAverageLoss(), cap);
    }

    /**
     * Whole contracts affordable under the sized risk fraction. 0 when the result says not to
     * trade or the per-contract loss is not positive.
     */
    public int recommendedContracts(SizingResult result, BigDecimal equity, BigDecimal maxLossPerContract) {
        if (!result.isShouldTrade() || maxLossPerContract == null || maxLossPerContract.signum() <= 0) {
            return 0;
        }
        return equity.multiply(BigDecimal.valueOf(result.getRiskFraction()))
                .divide(maxLossPerContract, 0, RoundingMode.FLOOR)
                .max(BigDecimal.ZERO)
                .min(MAX_CONTRACTS)
                .intValueExact();
    }

    private String describeInvalidInput(double winRate, double averageWin, double averageLoss, double cap) {
        if (!Double.isFinite(winRate) || !Double.isFinite(averageWin) || !Double.isFinite(averageLoss)) {
            return "non-finite input";
        }
        if (averageLoss <= 0.0) {
            return "average loss must be positive, was " + averageLoss;
        }
        if (averageWin <= 0.0) {
            return "average win must be positive, was " + averageWin;
        }
        if (winRate <= 0.0 || winRate >= 1.0) {
            return "win rate must be within (0, 1), was " + winRate;
        }
        if (!Double.isFinite(cap) || cap <= 0.0 || cap > 1.0) {
            return "per-trade cap must be within (0, 1], was " + cap;
        }
        return null;
    }
}
