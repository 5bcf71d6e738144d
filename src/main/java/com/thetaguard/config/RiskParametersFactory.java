package com.thetaguard.config;

import com.thetaguard.exception.PolicyViolationException;
import com.thetaguard.policy.CorrelationGroupDefinition;
import com.thetaguard.policy.EmergencyThresholds;
import com.thetaguard.policy.EquityTier;
import com.thetaguard.policy.PhaseProfile;
import com.thetaguard.policy.RegimeBand;
import com.thetaguard.policy.RiskParameters;
import com.thetaguard.policy.StrategyRule;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Converts bound {@link RiskParametersProperties} into an immutable {@link RiskParameters}.
 *
 * <p>Structural problems that would make conversion impossible (a group without a limit for
 * every tier, a duplicated strategy tag) are reported as {@link PolicyViolationException};
 * semantic checks belong to {@link com.thetaguard.policy.RiskParametersValidator}.
 */
public final class RiskParametersFactory {

    private RiskParametersFactory() {}

    public static RiskParameters from(RiskParametersProperties properties) {
        RiskParametersProperties.Correlation correlation = properties.getCorrelation();

        return RiskParameters.builder()
                .version(properties.getVersion())
                .regimeBands(properties.getRegime().getBands().stream()
                        .map(b -> RegimeBand.builder()
                                .regime(b.getRegime())
                                .lowerBound(b.getLowerBound())
                                .maxBuyingPowerByPhase(List.copyOf(b.getMaxBuyingPower()))
                                .build())
                        .collect(Collectors.toUnmodifiableList()))
                .coarseHighThreshold(properties.getRegime().getCoarseHighThreshold())
                .minValidVix(properties.getRegime().getMinValidVix())
                .phases(properties.getPhases().stream()
                        .map(p -> PhaseProfile.builder()
                                .phase(p.getPhase())
                                .minEquity(p.getMinEquity())
                                .maxPositions(p.getMaxPositions())
                                .maxRiskPerTrade(p.getMaxRiskPerTrade())
                                .defaultUnitSize(p.getDefaultUnitSize())
                                .allowedStrategies(Set.copyOf(p.getStrategies()))
                                .description(p.getDescription())
                                .build())
                        .collect(Collectors.toUnmodifiableList()))
                .strategyRules(toRuleMap(properties.getStrategies()))
                .defaultStrategyRule(toRule(properties.getDefaultStrategy()))
                .kellyMultiplier(properties.getSizing().getKellyMultiplier())
                .defaultPerTradeRiskCap(properties.getSizing().getDefaultPerTradeRiskCap())
                .correlationGroups(correlation.getGroups().stream()
                        .map(g -> CorrelationGroupDefinition.builder()
                                .id(g.getId())
                                .name(g.getName())
                                .symbols(g.getSymbols().stream()
                                        .map(s -> s.toUpperCase(Locale.ROOT))
                                        .collect(Collectors.toUnmodifiableSet()))
                                .crisisWeight(g.getCrisisWeight())
                                .build())
                        .collect(Collectors.toUnmodifiableList()))
                .equityTiers(toTiers(correlation))
                .equityLikeGroups(Set.copyOf(correlation.getEquityLikeGroups()))
                .equityAggregateCap(correlation.getEquityAggregateCap())
                .strictGroupMapping(correlation.isStrictGroupMapping())
                .defensiveDte(properties.getDefensive().getDefensiveDte())
                .rollMinDte(properties.getDefensive().getRollMinDte())
                .rollMaxDte(properties.getDefensive().getRollMaxDte())
                .assignmentWindowDays(properties.getDefensive().getAssignmentWindowDays())
                .putAssignmentBuffer(properties.getDefensive().getPutAssignmentBuffer())
                .callAssignmentBuffer(properties.getDefensive().getCallAssignmentBuffer())
                .challengeBuffer(properties.getDefensive().getChallengeBuffer())
                .emergency(EmergencyThresholds.builder()
                        .preventive(properties.getEmergency().getPreventive())
                        .elevated(properties.getEmergency().getElevated())
                        .emergency(properties.getEmergency().getEmergency())
                        .headroomMultiplier(properties.getEmergency().getHeadroomMultiplier())
                        .exposureReduction(properties.getEmergency().getExposureReduction())
                        .hysteresis(properties.getEmergency().getHysteresis())
                        .build())
                .build();
    }

    private static Map<String, StrategyRule> toRuleMap(List<RiskParametersProperties.Strategy> strategies) {
        Map<String, StrategyRule> rules = new LinkedHashMap<>();
        for (RiskParametersProperties.Strategy strategy : strategies) {
            if (rules.put(strategy.getName(), toRule(strategy)) != null) {
                throw new PolicyViolationException("duplicate strategy rule " + strategy.getName());
            }
        }
        return Map.copyOf(rules);
    }

    private static StrategyRule toRule(RiskParametersProperties.Strategy strategy) {
        return StrategyRule.builder()
                .strategy(strategy.getName())
                .profitTarget(strategy.getProfitTarget())
                .stopLossMultiple(strategy.getStopLossMultiple())
                .dteManagement(strategy.getDteManagement())
                .winRate(strategy.getWinRate())
                .averageWin(strategy.getAverageWin())
                .averageLoss(strategy.getAverageLoss())
                .kellyMultiplier(strategy.getKellyMultiplier())
                .build();
    }

    private static List<EquityTier> toTiers(RiskParametersProperties.Correlation correlation) {
        List<RiskParametersProperties.Tier> tiers = correlation.getTiers();
        for (RiskParametersProperties.Group group : correlation.getGroups()) {
            if (group.getTierLimits().size() != tiers.size()) {
                throw new PolicyViolationException("correlation group " + group.getId() + " has "
                        + group.getTierLimits().size() + " tier limits, expected " + tiers.size());
            }
        }
        return IntStream.range(0, tiers.size())
                .mapToObj(i -> EquityTier.builder()
                        .name(tiers.get(i).getName())
                        .minEquity(tiers.get(i).getMinEquity())
                        .groupLimits(correlation.getGroups().stream()
                                .collect(Collectors.toUnmodifiableMap(
                                        RiskParametersProperties.Group::getId, g -> g.getTierLimits().get(i))))
                        .build())
                .collect(Collectors.toUnmodifiableList());
    }
}
