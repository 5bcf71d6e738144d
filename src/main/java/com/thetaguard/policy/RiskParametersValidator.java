package com.thetaguard.policy;

import com.thetaguard.domain.enums.VixRegime;
import com.thetaguard.exception.PolicyViolationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Eager validation of a {@link RiskParameters} table.
 *
 * <p>Collects every problem rather than stopping at the first, then throws a single
 * {@link PolicyViolationException}. Nothing is corrected: a table with overlapping bands,
 * unordered thresholds or non-positive limits is rejected as a whole.
 */
@Component
public class RiskParametersValidator {

    private static final Logger log = LoggerFactory.getLogger(RiskParametersValidator.class);

    public void validate(RiskParameters parameters) {
        List<String> violations = new ArrayList<>();

        if (parameters.getVersion() == null || parameters.getVersion().isBlank()) {
            violations.add("version must be set");
        }
        validateRegimeBands(parameters, violations);
        validatePhases(parameters, violations);
        validateStrategyRules(parameters, violations);
        validateCorrelation(parameters, violations);
        validateDefensive(parameters, violations);
        validateEmergency(parameters.getEmergency(), violations);

        if (!violations.isEmpty()) {
            log.error("Risk parameters {} rejected: {}", parameters.getVersion(), violations);
            throw new PolicyViolationException(violations);
        }
        log.info(
                "Risk parameters {} validated: {} regime bands, {} phases, {} strategy rules, {} correlation groups",
                parameters.getVersion(),
                parameters.getRegimeBands().size(),
                parameters.getPhases().size(),
                parameters.getStrategyRules().size(),
                parameters.getCorrelationGroups().size());
    }

    private void validateRegimeBands(RiskParameters parameters, List<String> violations) {
        List<RegimeBand> bands = parameters.getRegimeBands();
        if (bands == null || bands.size() != VixRegime.values().length) {
            violations.add("exactly one regime band per regime is required");
            return;
        }
        int phaseCount = parameters.getPhases() != null ? parameters.getPhases().size() : 0;
        for (int i = 0; i < bands.size(); i++) {
            RegimeBand band = bands.get(i);
            if (band.getRegime() != VixRegime.values()[i]) {
                violations.add("regime band " + i + " must be " + VixRegime.values()[i] + " but was " + band.getRegime());
            }
            if (i == 0 && band.getLowerBound() != 0.0) {
                violations.add("first regime band must start at 0");
            }
            if (i > 0 && band.getLowerBound() <= bands.get(i - 1).getLowerBound()) {
                violations.add("regime band lower bounds must be strictly ascending at " + band.getRegime());
            }
            List<Double> fractions = band.getMaxBuyingPowerByPhase();
            if (fractions == null || fractions.size() != phaseCount) {
                violations.add("regime band " + band.getRegime() + " needs one buying-power fraction per phase");
            } else {
                for (Double fraction : fractions) {
                    if (fraction == null || fraction <= 0.0 || fraction > 1.0) {
                        violations.add("regime band " + band.getRegime() + " buying-power fraction out of (0, 1]: "
                                + fraction);
                    }
                }
            }
        }
        if (parameters.getCoarseHighThreshold() <= 0.0) {
            violations.add("coarse high threshold must be positive");
        }
        if (parameters.getMinValidVix() < 0.0 || parameters.getMinValidVix() >= bands.get(1).getLowerBound()) {
            violations.add("minimum valid VIX must be non-negative and below the second band");
        }
    }

    private void validatePhases(RiskParameters parameters, List<String> violations) {
        List<PhaseProfile> phases = parameters.getPhases();
        if (phases == null || phases.isEmpty()) {
            violations.add("at least one phase is required");
            return;
        }
        BigDecimal previousMin = null;
        for (int i = 0; i < phases.size(); i++) {
            PhaseProfile phase = phases.get(i);
            if (phase.getPhase() != i + 1) {
                violations.add("phases must be numbered consecutively from 1, found " + phase.getPhase());
            }
            if (phase.getMinEquity() == null || phase.getMinEquity().signum() <= 0) {
                violations.add("phase " + phase.getPhase() + " minimum equity must be positive");
            } else if (previousMin != null && phase.getMinEquity().compareTo(previousMin) <= 0) {
                violations.add("phase thresholds must be strictly ascending at phase " + phase.getPhase());
            }
            previousMin = phase.getMinEquity();
            if (phase.getMaxPositions() <= 0) {
                violations.add("phase " + phase.getPhase() + " max positions must be positive");
            }
            if (phase.getMaxRiskPerTrade() <= 0.0 || phase.getMaxRiskPerTrade() > 1.0) {
                violations.add("phase " + phase.getPhase() + " max risk per trade out of (0, 1]");
            }
            if (phase.getDefaultUnitSize() <= 0) {
                violations.add("phase " + phase.getPhase() + " default unit size must be positive");
            }
            if (phase.getAllowedStrategies() == null || phase.getAllowedStrategies().isEmpty()) {
                violations.add("phase " + phase.getPhase() + " allows no strategies");
            }
        }
    }

    private void validateStrategyRules(RiskParameters parameters, List<String> violations) {
        if (parameters.getDefaultStrategyRule() == null) {
            violations.add("a default strategy rule is required");
        } else {
            validateRule(parameters.getDefaultStrategyRule(), parameters.getDefensiveDte(), violations);
        }
        if (parameters.getStrategyRules() != null) {
            parameters.getStrategyRules().values().forEach(r -> validateRule(r, parameters.getDefensiveDte(), violations));
        }
        if (parameters.getKellyMultiplier() <= 0.0 || parameters.getKellyMultiplier() > 1.0) {
            violations.add("Kelly multiplier out of (0, 1]");
        }
        if (parameters.getDefaultPerTradeRiskCap() <= 0.0 || parameters.getDefaultPerTradeRiskCap() > 1.0) {
            violations.add("default per-trade risk cap out of (0, 1]");
        }
    }

    private void validateRule(StrategyRule rule, int defensiveDte, List<String> violations) {
        String name = rule.getStrategy();
        if (rule.getProfitTarget() <= 0.0 || rule.getProfitTarget() > 1.0) {
            violations.add(name + " profit target out of (0, 1]");
        }
        if (rule.hasStopLoss() && rule.getStopLossMultiple() <= 0.0) {
            violations.add(name + " stop-loss multiple must be positive");
        }
        if (rule.getDteManagement() < defensiveDte) {
            violations.add(name + " DTE management " + rule.getDteManagement() + " is below the absolute "
                    + defensiveDte + "-DTE rule");
        }
        if (rule.getWinRate() <= 0.0 || rule.getWinRate() >= 1.0) {
            violations.add(name + " win-rate prior out of (0, 1)");
        }
        if (rule.getAverageWin() <= 0.0 || rule.getAverageLoss() <= 0.0) {
            violations.add(name + " average win/loss priors must be positive");
        }
        if (rule.getKellyMultiplier() != null
                && (rule.getKellyMultiplier() <= 0.0 || rule.getKellyMultiplier() > 1.0)) {
            violations.add(name + " Kelly multiplier out of (0, 1]");
        }
    }

    private void validateCorrelation(RiskParameters parameters, List<String> violations) {
        List<CorrelationGroupDefinition> groups = parameters.getCorrelationGroups();
        if (groups == null || groups.isEmpty()) {
            violations.add("at least one correlation group is required");
            return;
        }
        Set<String> groupIds = new HashSet<>();
        Map<String, String> symbolOwner = new HashMap<>();
        for (CorrelationGroupDefinition group : groups) {
            if (!groupIds.add(group.getId())) {
                violations.add("duplicate correlation group " + group.getId());
            }
            if (group.getSymbols() == null || group.getSymbols().isEmpty()) {
                violations.add("correlation group " + group.getId() + " has no symbols");
                continue;
            }
            if (group.getCrisisWeight() < -1.0 || group.getCrisisWeight() > 1.0) {
                violations.add("correlation group " + group.getId() + " crisis weight out of [-1, 1]");
            }
            for (String symbol : group.getSymbols()) {
                String previous = symbolOwner.put(symbol, group.getId());
                if (previous != null) {
                    violations.add("symbol " + symbol + " maps to both " + previous + " and " + group.getId());
                }
            }
        }

        List<EquityTier> tiers = parameters.getEquityTiers();
        if (tiers == null || tiers.isEmpty()) {
            violations.add("at least one equity tier is required");
        } else {
            BigDecimal previousMin = null;
            for (EquityTier tier : tiers) {
                if (tier.getMinEquity() == null || tier.getMinEquity().signum() < 0) {
                    violations.add("equity tier " + tier.getName() + " minimum must be non-negative");
                } else if (previousMin != null && tier.getMinEquity().compareTo(previousMin) <= 0) {
                    violations.add("equity tiers must be strictly ascending at " + tier.getName());
                }
                previousMin = tier.getMinEquity();
                for (String groupId : groupIds) {
                    Integer limit = tier.getGroupLimits() != null ? tier.getGroupLimits().get(groupId) : null;
                    if (limit == null || limit <= 0) {
                        violations.add("equity tier " + tier.getName() + " needs a positive limit for " + groupId);
                    }
                }
            }
        }

        Set<String> equityLike = parameters.getEquityLikeGroups();
        if (equityLike == null || equityLike.isEmpty()) {
            violations.add("equity-like groups must be declared");
        } else if (!groupIds.containsAll(equityLike)) {
            violations.add("equity-like groups reference unknown group ids: " + equityLike);
        }
        if (parameters.getEquityAggregateCap() <= 0) {
            violations.add("equity aggregate cap must be positive");
        }
    }

    private void validateDefensive(RiskParameters parameters, List<String> violations) {
        if (parameters.getDefensiveDte() < RiskParameters.DEFENSIVE_DTE_FLOOR) {
            violations.add("defensive DTE " + parameters.getDefensiveDte() + " is below the absolute "
                    + RiskParameters.DEFENSIVE_DTE_FLOOR + "-DTE floor");
        }
        if (parameters.getRollMinDte() <= parameters.getDefensiveDte()) {
            violations.add("roll window must start after the defensive DTE");
        }
        if (parameters.getRollMaxDte() < parameters.getRollMinDte()) {
            violations.add("roll window max DTE must not be below its min DTE");
        }
        if (parameters.getAssignmentWindowDays() < 0) {
            violations.add("assignment window must not be negative");
        }
        if (parameters.getPutAssignmentBuffer() < 0.0
                || parameters.getCallAssignmentBuffer() < 0.0
                || parameters.getChallengeBuffer() < 0.0) {
            violations.add("assignment and challenge buffers must not be negative");
        }
    }

    private void validateEmergency(EmergencyThresholds emergency, List<String> violations) {
        if (emergency == null) {
            violations.add("emergency thresholds are required");
            return;
        }
        if (emergency.getPreventive() <= 0.0) {
            violations.add("preventive threshold must be positive");
        }
        if (!(emergency.getPreventive() < emergency.getElevated() && emergency.getElevated() < emergency.getEmergency())) {
            violations.add("emergency thresholds must be distinct and ascending: preventive "
                    + emergency.getPreventive() + ", elevated " + emergency.getElevated() + ", emergency "
                    + emergency.getEmergency());
        }
        if (emergency.getHeadroomMultiplier() <= 0.0 || emergency.getHeadroomMultiplier() > 1.0) {
            violations.add("headroom multiplier out of (0, 1]");
        }
        if (emergency.getExposureReduction() <= 0.0 || emergency.getExposureReduction() >= 1.0) {
            violations.add("exposure reduction out of (0, 1)");
        }
        if (emergency.getHysteresis() < 0.0 || emergency.getHysteresis() >= emergency.getPreventive()) {
            violations.add("hysteresis must be non-negative and below the preventive threshold");
        }
    }
}
