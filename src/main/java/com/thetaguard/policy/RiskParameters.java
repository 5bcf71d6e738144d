package com.thetaguard.policy;

import com.thetaguard.domain.enums.VixRegime;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;

/**
 * Immutable, versioned risk policy table. Built once from configuration, validated by
 * {@link RiskParametersValidator}, and swapped wholesale through {@link RiskPolicyProvider}.
 *
 * <p>Lists are ordered ascending (regime bands by lower bound, phases by minimum equity,
 * equity tiers by minimum equity).
 */
@Getter
@Builder(toBuilder = true)
public class RiskParameters {

    /** Short options at or inside this many days to expiry are always managed; no policy goes below it. */
    public static final int DEFENSIVE_DTE_FLOOR = 21;

    private final String version;

    // ==================== Regime ====================

    private final List<RegimeBand> regimeBands;
    private final double coarseHighThreshold;

    /** Index readings below this are treated as a broken feed. */
    private final double minValidVix;

    // ==================== Phase ====================

    private final List<PhaseProfile> phases;

    // ==================== Strategy rules ====================

    private final Map<String, StrategyRule> strategyRules;
    private final StrategyRule defaultStrategyRule;
    private final double kellyMultiplier;
    private final double defaultPerTradeRiskCap;

    // ==================== Correlation ====================

    private final List<CorrelationGroupDefinition> correlationGroups;
    private final List<EquityTier> equityTiers;
    private final Set<String> equityLikeGroups;
    private final int equityAggregateCap;
    private final boolean strictGroupMapping;

    // ==================== Defensive ====================

    private final int defensiveDte;
    private final int rollMinDte;
    private final int rollMaxDte;
    private final int assignmentWindowDays;
    private final double putAssignmentBuffer;
    private final double callAssignmentBuffer;
    private final double challengeBuffer;

    // ==================== Emergency ====================

    private final EmergencyThresholds emergency;

    public StrategyRule ruleFor(String strategy) {
        StrategyRule rule = strategy != null ? strategyRules.get(strategy) : null;
        return rule != null ? rule : defaultStrategyRule;
    }

    public Optional<PhaseProfile> phaseProfile(int phase) {
        return phases.stream().filter(p -> p.getPhase() == phase).findFirst();
    }

    public Optional<CorrelationGroupDefinition> group(String groupId) {
        return correlationGroups.stream().filter(g -> g.getId().equals(groupId)).findFirst();
    }

    public RegimeBand band(VixRegime regime) {
        return regimeBands.stream()
                .filter(b -> b.getRegime() == regime)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No band for regime " + regime));
    }

    /** Highest tier whose minimum equity the account reaches; the lowest tier when below all. */
    public EquityTier equityTier(BigDecimal equity) {
        return equityTiers.stream()
                .filter(t -> equity.compareTo(t.getMinEquity()) >= 0)
                .max(Comparator.comparing(EquityTier::getMinEquity))
                .orElse(equityTiers.get(0));
    }
}
