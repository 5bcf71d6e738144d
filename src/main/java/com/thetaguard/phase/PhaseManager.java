package com.thetaguard.phase;

import com.thetaguard.event.EventPublisherHelper;
import com.thetaguard.policy.PhaseProfile;
import com.thetaguard.policy.RiskParameters;
import com.thetaguard.policy.RiskPolicyProvider;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Maps account equity to a phase (1 to 4, or 0 below the minimum) and answers what that phase
 * permits: which strategies, how many concurrent positions, how much risk per trade.
 *
 * <p>{@link #determinePhase(BigDecimal)} is a pure step function of equity with no hysteresis.
 * {@link #updatePhase(BigDecimal)} additionally caches the result and announces changes; the
 * announcement is for observability only, callers always re-query.
 */
@Service
public class PhaseManager {

    private static final Logger log = LoggerFactory.getLogger(PhaseManager.class);

    public static final int BELOW_MINIMUM = 0;

    private final RiskPolicyProvider riskPolicyProvider;
    private final EventPublisherHelper eventPublisherHelper;

    private final AtomicReference<CachedPhase> cachedPhase = new AtomicReference<>();

    public PhaseManager(RiskPolicyProvider riskPolicyProvider, EventPublisherHelper eventPublisherHelper) {
        this.riskPolicyProvider = riskPolicyProvider;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public int determinePhase(BigDecimal equity) {
        int phase = BELOW_MINIMUM;
        for (PhaseProfile profile : riskPolicyProvider.current().getPhases()) {
            if (equity.compareTo(profile.getMinEquity()) >= 0) {
                phase = profile.getPhase();
            }
        }
        return phase;
    }

    /**
     * Recomputes the phase, caches it with the equity, and publishes a transition event when it
     * differs from the previously cached phase.
     */
    public int updatePhase(BigDecimal equity) {
        int phase = determinePhase(equity);
        CachedPhase previous = cachedPhase.getAndSet(new CachedPhase(equity, phase));

        if (previous == null) {
            log.info("Account phase initialised at {} (equity {})", phase, equity);
        } else if (previous.phase != phase) {
            log.info("Account phase transition {} -> {} (equity {} -> {})", previous.phase, phase, previous.equity, equity);
            eventPublisherHelper.publishPhaseTransition(this, previous.phase, phase, equity);
        }
        return phase;
    }

    /** Last phase computed by {@link #updatePhase}, or 0 before the first update. */
    public int getCurrentPhase() {
        CachedPhase current = cachedPhase.get();
        return current != null ? current.phase : BELOW_MINIMUM;
    }

    public Optional<PhaseProfile> profile(int phase) {
        return riskPolicyProvider.current().phaseProfile(phase);
    }

    public boolean isStrategyAllowed(String strategy) {
        return isStrategyAllowed(strategy, getCurrentPhase());
    }

    public boolean isStrategyAllowed(String strategy, int phase) {
        return profile(phase).map(p -> p.allows(strategy)).orElse(false);
    }

    public int getMaxPositions(int phase) {
        return profile(phase).map(PhaseProfile::getMaxPositions).orElse(0);
    }

    public double getMaxRiskPerTrade(int phase) {
        return profile(phase).map(PhaseProfile::getMaxRiskPerTrade).orElse(0.0);
    }

    /** Position size at the cached phase and equity. Returns 0 before the first update. */
    public int calculatePositionSize(String strategy, BigDecimal riskAmount) {
        CachedPhase current = cachedPhase.get();
        if (current == null) {
            return 0;
        }
        return calculatePositionSize(strategy, riskAmount, current.equity);
    }

    /**
     * Number of units to trade: the phase's default unit size, reduced so that the money at risk
     * ({@code units * riskAmount}) stays within {@code equity * maxRiskPerTrade}.
     *
     * @param riskAmount money at risk per unit
     * @return 0 when the strategy is not allowed, the account is below the minimum phase,
     *     or riskAmount is not positive
     */
    public int calculatePositionSize(String strategy, BigDecimal riskAmount, BigDecimal equity) {
        int phase = determinePhase(equity);
        Optional<PhaseProfile> profile = profile(phase);
        if (profile.isEmpty() || !profile.get().allows(strategy)) {
            log.debug("Strategy {} not allowed in phase {}, size 0", strategy, phase);
            return 0;
        }
        if (riskAmount == null || riskAmount.signum() <= 0) {
            log.warn("Non-positive risk amount {} for {}, size 0", riskAmount, strategy);
            return 0;
        }

        BigDecimal riskBudget = equity.multiply(BigDecimal.valueOf(profile.get().getMaxRiskPerTrade()));
        return riskBudget.divide(riskAmount, 0, RoundingMode.FLOOR)
                .min(BigDecimal.valueOf(profile.get().getDefaultUnitSize()))
                .intValueExact();
    }

    public PhaseMetrics phaseMetrics(BigDecimal equity) {
        RiskParameters parameters = riskPolicyProvider.current();
        List<PhaseProfile> phases = parameters.getPhases();
        int phase = determinePhase(equity);

        if (phase == BELOW_MINIMUM) {
            BigDecimal firstMin = phases.get(0).getMinEquity();
            return PhaseMetrics.builder()
                    .phase(BELOW_MINIMUM)
                    .description("Below minimum account size")
                    .equity(equity)
                    .phaseMinEquity(BigDecimal.ZERO)
                    .nextPhaseEquity(firstMin)
                    .progressPercent(progress(equity, BigDecimal.ZERO, firstMin))
                    .maxPositions(0)
                    .maxRiskPerTrade(0.0)
                    .allowedStrategies(Set.of())
                    .build();
        }

        PhaseProfile profile = parameters.phaseProfile(phase).orElseThrow();
        BigDecimal next = phase < phases.size() ? phases.get(phase).getMinEquity() : null;
        return PhaseMetrics.builder()
                .phase(phase)
                .description(profile.getDescription())
                .equity(equity)
                .phaseMinEquity(profile.getMinEquity())
                .nextPhaseEquity(next)
                .progressPercent(next != null ? progress(equity, profile.getMinEquity(), next) : 100.0)
                .maxPositions(profile.getMaxPositions())
                .maxRiskPerTrade(profile.getMaxRiskPerTrade())
                .allowedStrategies(profile.getAllowedStrategies())
                .build();
    }

    private double progress(BigDecimal equity, BigDecimal from, BigDecimal to) {
        BigDecimal span = to.subtract(from);
        if (span.signum() <= 0) {
            return 100.0;
        }
        double percent = equity.subtract(from)
                .divide(span, MathContext.DECIMAL64)
                .multiply(BigDecimal.valueOf(100))
                .doubleValue();
        return Math.max(0.0, Math.min(100.0, percent));
    }

    private static final class CachedPhase {
        private final BigDecimal equity;
        private final int phase;

        private CachedPhase(BigDecimal equity, int phase) {
            this.equity = equity;
            this.phase = phase;
        }
    }
}
