package com.thetaguard.correlation;

import com.thetaguard.domain.enums.AdmissionReason;
import com.thetaguard.domain.enums.StressRiskLevel;
import com.thetaguard.domain.enums.VixRegime;
import com.thetaguard.domain.model.AdmissionDecision;
import com.thetaguard.domain.model.Position;
import com.thetaguard.event.EventPublisherHelper;
import com.thetaguard.mapper.JsonHelper;
import com.thetaguard.policy.CorrelationGroupDefinition;
import com.thetaguard.policy.EquityTier;
import com.thetaguard.policy.RiskParameters;
import com.thetaguard.policy.RiskPolicyProvider;
import com.thetaguard.regime.RegimeClassifier;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The single gate every candidate position passes before entry.
 *
 * <p>Owns the symbol-to-group mapping (from the current {@link RiskParameters}) and the live
 * per-group counters. Gates, in order:
 * <ol>
 *   <li>Unmapped symbol: admitted and recorded as a policy gap, or denied under strict mapping</li>
 *   <li>Per-group limit: base limit for the account's equity tier, one slot less when the regime
 *       is HIGH or worse, never below 1</li>
 *   <li>Equity-like aggregate: the designated equity groups share one combined cap on top of
 *       their individual limits</li>
 * </ol>
 *
 * <p>One instance serves one account. Every read and write of the counters happens under
 * {@link #lock}, and {@link #tryAdmit} runs the gates and the registration in the same critical
 * section, so two concurrent candidates cannot both take the last slot of a group.
 */
@Service
public class CorrelationAdmissionController {

    private static final Logger log = LoggerFactory.getLogger(CorrelationAdmissionController.class);

    private static final double CONCENTRATION_SCALE = 50.0;
    private static final double EQUITY_SURCHARGE = 30.0;
    private static final double DIVERSIFICATION_DISCOUNT = 0.8;
    private static final int DIVERSIFIED_GROUP_COUNT = 3;
    private static final double HIGH_RISK_SCORE = 70.0;
    private static final double ELEVATED_RISK_SCORE = 50.0;
    private static final double VAR_PER_POSITION = 0.05;
    private static final double UNMAPPED_STRESS_WEIGHT = 0.5;

    private final RiskPolicyProvider riskPolicyProvider;
    private final RegimeClassifier regimeClassifier;
    private final EventPublisherHelper eventPublisherHelper;

    private final ReentrantLock lock = new ReentrantLock();
    private final GroupCounters counters = new GroupCounters();
    private final Set<String> policyGaps = ConcurrentHashMap.newKeySet();

    private BigDecimal equity = BigDecimal.ZERO;
    private VixRegime regime = VixRegime.NORMAL;
    private long version;

    public CorrelationAdmissionController(
            RiskPolicyProvider riskPolicyProvider,
            RegimeClassifier regimeClassifier,
            EventPublisherHelper eventPublisherHelper) {
        this.riskPolicyProvider = riskPolicyProvider;
        this.regimeClassifier = regimeClassifier;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // CONTEXT
    // ========================

    /** Sets the equity and regime the dynamic limits are derived from. Called on every tick. */
    public void updateContext(BigDecimal equity, VixRegime regime) {
        lock.lock();
        try {
            if (this.regime != regime) {
                log.info("Correlation limits now computed for regime {} (was {})", regime, this.regime);
            }
            this.equity = equity;
            this.regime = regime;
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> resolveGroup(String symbol) {
        RiskParameters parameters = riskPolicyProvider.current();
        return findGroup(symbol, parameters).map(CorrelationGroupDefinition::getId);
    }

    /** Current limit for a group under the stored equity and regime. */
    public int limitFor(String groupId) {
        lock.lock();
        try {
            return limitFor(groupId, riskPolicyProvider.current(), equity, regime);
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // ADMISSION
    // ========================

    /** Evaluates the gates without registering anything. */
    public AdmissionDecision canAdmit(String symbol) {
        lock.lock();
        try {
            return evaluate(symbol, counters, riskPolicyProvider.current(), equity, regime, true);
        } finally {
            lock.unlock();
        }
    }

    /** As {@link #canAdmit(String)}, refusing outright when the account is below the minimum phase. */
    public AdmissionDecision canAdmit(String symbol, int accountPhase) {
        if (accountPhase <= 0) {
            return belowMinimum(symbol);
        }
        return canAdmit(symbol);
    }

    /**
     * Atomic check-and-register. The position is counted immediately when admitted, before any
     * fill arrives; release it with {@link #unregister} if the entry never happens.
     */
    public AdmissionDecision tryAdmit(String positionId, String symbol, int accountPhase) {
        if (accountPhase <= 0) {
            return belowMinimum(symbol);
        }
        lock.lock();
        try {
            if (counters.contains(positionId)) {
                return AdmissionDecision.deny(
                        AdmissionReason.DUPLICATE_POSITION, symbol, "Position " + positionId + " already registered");
            }
            RiskParameters parameters = riskPolicyProvider.current();
            AdmissionDecision decision = evaluate(symbol, counters, parameters, equity, regime, true);
            if (decision.isAllowed()) {
                String groupId = decision.getGroupId() != null ? decision.getGroupId() : GroupCounters.UNMAPPED;
                counters.add(groupId, positionId, SymbolNormalizer.clean(symbol));
                version++;
                log.info("Registered {} ({}) in group {}, version {}", positionId, symbol, groupId, version);
            }
            return decision;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Counts a position without running the gates. Used when the position already exists at the
     * broker (reconciliation, restart); admission decisions go through {@link #tryAdmit}.
     */
    public void register(String positionId, String symbol) {
        lock.lock();
        try {
            registerUnchecked(positionId, symbol, riskPolicyProvider.current());
        } finally {
            lock.unlock();
        }
    }

    public boolean unregister(String positionId) {
        lock.lock();
        try {
            String groupId = counters.remove(positionId);
            if (groupId == null) {
                log.warn("Unregister of unknown position {}", positionId);
                return false;
            }
            version++;
            log.info("Unregistered {} from group {}, version {}", positionId, groupId, version);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Replaces the counters with the given positions, e.g. after broker reconciliation. */
    public int synchronize(Collection<Position> positions) {
        lock.lock();
        try {
            RiskParameters parameters = riskPolicyProvider.current();
            counters.clear();
            for (Position position : positions) {
                registerUnchecked(position.getId(), position.getSymbol(), parameters);
            }
            version++;
            log.info("Correlation counters synchronized with {} positions, version {}", counters.total(), version);
            return counters.total();
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // RISK SCORING
    // ========================

    /** Weighted concentration score in [0, 100] for the live counters. */
    public double riskScore() {
        lock.lock();
        try {
            return riskScore(counters, riskPolicyProvider.current());
        } finally {
            lock.unlock();
        }
    }

    /** Crisis value-at-risk as a fraction of the account, with a diversification benefit. */
    public double crisisVaR() {
        lock.lock();
        try {
            RiskParameters parameters = riskPolicyProvider.current();
            double var = 0.0;
            for (String groupId : counters.groupsInUse()) {
                var += VAR_PER_POSITION * counters.count(groupId) * Math.abs(weightOf(groupId, parameters));
            }
            int groupsInUse = counters.groupsInUse().size();
            if (groupsInUse > 1) {
                var *= 1.0 - 0.1 * Math.min(groupsInUse - 1, 3);
            }
            return var;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replays {@code scenario} in order through fresh counters at the stress VIX, with the current
     * equity tier. Positions the gates reject count as violations and are excluded from
     * {@code estimatedLoss}.
     */
    public StressTestResult stressTest(List<StressScenarioPosition> scenario, double vix) {
        RiskParameters parameters = riskPolicyProvider.current();
        VixRegime stressRegime = regimeClassifier.classify(vix);
        BigDecimal tierEquity;
        lock.lock();
        try {
            tierEquity = equity;
        } finally {
            lock.unlock();
        }

        GroupCounters replay = new GroupCounters();
        GroupCounters unprotected = new GroupCounters();
        List<AdmissionDecision> rejections = new ArrayList<>();
        double shock = Math.max(0.1, Math.min(1.0, (vix - 10.0) / 50.0));
        BigDecimal estimatedLoss = BigDecimal.ZERO;
        BigDecimal unprotectedLoss = BigDecimal.ZERO;

        for (int i = 0; i < scenario.size(); i++) {
            StressScenarioPosition position = scenario.get(i);
            String positionId = "stress-" + i;
            Optional<CorrelationGroupDefinition> group = findGroup(position.getSymbol(), parameters);
            double weight = group.map(CorrelationGroupDefinition::getCrisisWeight).orElse(UNMAPPED_STRESS_WEIGHT);
            BigDecimal loss = position.getMaxLoss()
                    .multiply(BigDecimal.valueOf(Math.abs(weight) * shock))
                    .setScale(2, RoundingMode.HALF_UP);

            unprotected.add(group.map(CorrelationGroupDefinition::getId).orElse(GroupCounters.UNMAPPED), positionId,
                    position.getSymbol());
            unprotectedLoss = unprotectedLoss.add(loss);

            AdmissionDecision decision = evaluate(position.getSymbol(), replay, parameters, tierEquity, stressRegime, false);
            if (decision.isAllowed()) {
                replay.add(decision.getGroupId() != null ? decision.getGroupId() : GroupCounters.UNMAPPED, positionId,
                        position.getSymbol());
                estimatedLoss = estimatedLoss.add(loss);
            } else {
                rejections.add(decision);
            }
        }

        double score = riskScore(unprotected, parameters);
        StressRiskLevel level = classifyStress(score, rejections.size(), vix, parameters);
        log.info(
                "Stress test at VIX {}: {} of {} admitted, estimated loss {} vs unprotected {}, level {}",
                vix, replay.total(), scenario.size(), estimatedLoss, unprotectedLoss, level);

        return StressTestResult.builder()
                .vix(vix)
                .estimatedLoss(estimatedLoss)
                .unprotectedLoss(unprotectedLoss)
                .riskLevel(level)
                .violationCount(rejections.size())
                .admittedCount(replay.total())
                .concentrationScore(score)
                .rejections(List.copyOf(rejections))
                .build();
    }

    public CorrelationSummary summary() {
        lock.lock();
        try {
            RiskParameters parameters = riskPolicyProvider.current();
            List<CorrelationSummary.GroupUsage> usage = new ArrayList<>();
            List<String> warnings = new ArrayList<>();

            for (CorrelationGroupDefinition group : parameters.getCorrelationGroups()) {
                int count = counters.count(group.getId());
                int limit = limitFor(group.getId(), parameters, equity, regime);
                if (count > 0) {
                    usage.add(CorrelationSummary.GroupUsage.builder()
                            .groupId(group.getId())
                            .name(group.getName())
                            .count(count)
                            .limit(limit)
                            .crisisWeight(group.getCrisisWeight())
                            .symbols(new ArrayList<>(counters.members(group.getId()).values()))
                            .build());
                }
                if (count > limit) {
                    warnings.add(String.format("Group %s over its limit: %d/%d", group.getId(), count, limit));
                }
            }

            double score = riskScore(counters, parameters);
            if (score > HIGH_RISK_SCORE) {
                warnings.add(String.format("High correlation risk score: %.1f", score));
            }
            int equityLike = counters.countAll(parameters.getEquityLikeGroups());
            if (equityLike >= parameters.getEquityAggregateCap()) {
                warnings.add(String.format(
                        "Total equity exposure at limit: %d/%d", equityLike, parameters.getEquityAggregateCap()));
            }
            if (!policyGaps.isEmpty()) {
                warnings.add("Symbols without correlation group: " + new TreeSet<>(policyGaps));
            }

            return CorrelationSummary.builder()
                    .version(version)
                    .regime(regime)
                    .equityTier(parameters.equityTier(equity).getName())
                    .totalPositions(counters.total())
                    .unmappedPositions(counters.count(GroupCounters.UNMAPPED))
                    .equityLikePositions(equityLike)
                    .equityAggregateCap(parameters.getEquityAggregateCap())
                    .riskScore(score)
                    .crisisVaR(crisisVaR())
                    .groups(usage)
                    .warnings(warnings)
                    .policyGaps(Set.copyOf(policyGaps))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    // ========================
    // SNAPSHOT / RESTORE
    // ========================

    public CorrelationSnapshot snapshot() {
        lock.lock();
        try {
            return CorrelationSnapshot.builder()
                    .version(version)
                    .parametersVersion(riskPolicyProvider.current().getVersion())
                    .equity(equity)
                    .regime(regime)
                    .takenAt(Instant.now())
                    .groups(counters.export())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public String snapshotJson() {
        return JsonHelper.toJson(snapshot());
    }

    /** Replaces counters and context with the snapshot's. The snapshot version is kept. */
    public void restore(CorrelationSnapshot snapshot) {
        lock.lock();
        try {
            String currentParameters = riskPolicyProvider.current().getVersion();
            if (!currentParameters.equals(snapshot.getParametersVersion())) {
                log.warn(
                        "Restoring correlation snapshot taken under parameters {} into {}",
                        snapshot.getParametersVersion(), currentParameters);
            }
            counters.clear();
            snapshot.getGroups().forEach((groupId, entries) -> entries.forEach(
                    entry -> counters.add(groupId, entry.getPositionId(), entry.getSymbol())));
            equity = snapshot.getEquity();
            regime = snapshot.getRegime();
            version = snapshot.getVersion();
            log.info("Correlation counters restored: {} positions, version {}", counters.total(), version);
        } finally {
            lock.unlock();
        }
    }

    public void restoreJson(String json) {
        CorrelationSnapshot snapshot = JsonHelper.fromJson(json, CorrelationSnapshot.class);
        if (snapshot == null) {
            throw new IllegalArgumentException("Empty correlation snapshot");
        }
        restore(snapshot);
    }

    // ========================
    // ACCESSORS
    // ========================

    public int totalTrackedPositions() {
        lock.lock();
        try {
            return counters.total();
        } finally {
            lock.unlock();
        }
    }

    public int activeCount(String groupId) {
        lock.lock();
        try {
            return counters.count(groupId);
        } finally {
            lock.unlock();
        }
    }

    public long getVersion() {
        lock.lock();
        try {
            return version;
        } finally {
            lock.unlock();
        }
    }

    /** Group id to member position ids, for diagnostics. */
    public Map<String, Set<String>> activePositionsByGroup() {
        lock.lock();
        try {
            return counters.export().entrySet().stream()
                    .collect(Collectors.toMap(
                            Map.Entry::getKey,
                            e -> e.getValue().stream()
                                    .map(CorrelationSnapshot.Entry::getPositionId)
                                    .collect(Collectors.toSet())));
        } finally {
            lock.unlock();
        }
    }

    public Set<String> getPolicyGaps() {
        return Set.copyOf(policyGaps);
    }

    // ========================
    // INTERNALS
    // ========================

    private AdmissionDecision evaluate(
            String symbol,
            GroupCounters state,
            RiskParameters parameters,
            BigDecimal tierEquity,
            VixRegime limitRegime,
            boolean live) {
        Optional<CorrelationGroupDefinition> group = findGroup(symbol, parameters);

        if (group.isEmpty()) {
            if (live) {
                recordPolicyGap(symbol);
            }
            if (parameters.isStrictGroupMapping()) {
                return AdmissionDecision.deny(
                        AdmissionReason.UNMAPPED_SYMBOL_REJECTED,
                        symbol,
                        "Symbol " + symbol + " not in correlation groups, strict mapping rejects it");
            }
            return AdmissionDecision.allowUnmapped(symbol);
        }

        String groupId = group.get().getId();
        int count = state.count(groupId);
        int limit = limitFor(groupId, parameters, tierEquity, limitRegime);
        if (count >= limit) {
            return AdmissionDecision.denyAtLimit(
                    AdmissionReason.GROUP_LIMIT,
                    symbol,
                    groupId,
                    limit,
                    count,
                    String.format(
                            "Correlation group %s (%s) at limit: %d/%d in regime %s",
                            groupId, group.get().getName(), count, limit, limitRegime));
        }

        Set<String> equityLike = parameters.getEquityLikeGroups();
        if (equityLike.contains(groupId)) {
            int combined = state.countAll(equityLike);
            int cap = parameters.getEquityAggregateCap();
            if (combined >= cap) {
                return AdmissionDecision.denyAtLimit(
                        AdmissionReason.EQUITY_AGGREGATE_LIMIT,
                        symbol,
                        groupId,
                        cap,
                        combined,
                        String.format(
                                "Total equity exposure at limit: %d/%d across groups %s (group %s holds %d/%d)",
                                combined, cap, new TreeSet<>(equityLike), groupId, count, limit));
            }
        }

        return AdmissionDecision.allow(symbol, groupId, limit, count);
    }

    private int limitFor(String groupId, RiskParameters parameters, BigDecimal tierEquity, VixRegime limitRegime) {
        EquityTier tier = parameters.equityTier(tierEquity);
        int base = tier.getGroupLimits().getOrDefault(groupId, 1);
        if (limitRegime.isAtLeast(VixRegime.HIGH)) {
            return Math.max(1, base - 1);
        }
        return base;
    }

    private double riskScore(GroupCounters state, RiskParameters parameters) {
        int total = state.mappedTotal();
        if (total == 0) {
            return 0.0;
        }
        double score = 0.0;
        for (String groupId : state.groupsInUse()) {
            double share = (double) state.count(groupId) / total;
            score += share * Math.abs(weightOf(groupId, parameters)) * CONCENTRATION_SCALE;
        }
        double equityShare = (double) state.countAll(parameters.getEquityLikeGroups()) / total;
        score += equityShare * EQUITY_SURCHARGE;

        if (state.groupsInUse().size() > DIVERSIFIED_GROUP_COUNT) {
            score *= DIVERSIFICATION_DISCOUNT;
        }
        return Math.max(0.0, Math.min(100.0, score));
    }

    private StressRiskLevel classifyStress(double score, int violations, double vix, RiskParameters parameters) {
        double crisisVix = parameters.band(VixRegime.VERY_HIGH).getLowerBound();
        double highVix = parameters.band(VixRegime.HIGH).getLowerBound();
        if (vix >= crisisVix && (violations > 0 || score > HIGH_RISK_SCORE)) {
            return StressRiskLevel.EXTREME;
        }
        if (score > HIGH_RISK_SCORE || violations > 0) {
            return StressRiskLevel.HIGH;
        }
        if (score > ELEVATED_RISK_SCORE || vix >= highVix) {
            return StressRiskLevel.ELEVATED;
        }
        return StressRiskLevel.NORMAL;
    }

    private double weightOf(String groupId, RiskParameters parameters) {
        return parameters.group(groupId).map(CorrelationGroupDefinition::getCrisisWeight).orElse(UNMAPPED_STRESS_WEIGHT);
    }

    private Optional<CorrelationGroupDefinition> findGroup(String symbol, RiskParameters parameters) {
        Map<String, CorrelationGroupDefinition> bySymbol = new HashMap<>();
        for (CorrelationGroupDefinition group : parameters.getCorrelationGroups()) {
            group.getSymbols().forEach(s -> bySymbol.put(s, group));
        }
        String root = SymbolNormalizer.root(symbol, bySymbol.keySet());
        return Optional.ofNullable(bySymbol.get(root));
    }

    private void registerUnchecked(String positionId, String symbol, RiskParameters parameters) {
        if (counters.contains(positionId)) {
            log.warn("Position {} already registered, ignoring", positionId);
            return;
        }
        String groupId = findGroup(symbol, parameters)
                .map(CorrelationGroupDefinition::getId)
                .orElseGet(() -> {
                    recordPolicyGap(symbol);
                    return GroupCounters.UNMAPPED;
                });
        counters.add(groupId, positionId, SymbolNormalizer.clean(symbol));
        version++;
    }

    private void recordPolicyGap(String symbol) {
        String cleaned = SymbolNormalizer.clean(symbol);
        if (policyGaps.add(cleaned)) {
            log.warn("Policy gap: symbol {} is not mapped to any correlation group", cleaned);
            eventPublisherHelper.publishPolicyGap(this, cleaned);
        }
    }

    private AdmissionDecision belowMinimum(String symbol) {
        return AdmissionDecision.deny(
                AdmissionReason.BELOW_MINIMUM_PHASE, symbol, "Account below minimum phase, no new positions");
    }
}
