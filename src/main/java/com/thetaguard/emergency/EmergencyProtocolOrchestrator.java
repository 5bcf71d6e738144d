package com.thetaguard.emergency;

import com.thetaguard.domain.enums.LifecycleAction;
import com.thetaguard.domain.enums.LifecycleState;
import com.thetaguard.domain.enums.ProtocolLevel;
import com.thetaguard.domain.enums.VixRegime;
import com.thetaguard.domain.model.Position;
import com.thetaguard.event.EventPublisherHelper;
import com.thetaguard.event.RiskEventType;
import com.thetaguard.event.RiskLevel;
import com.thetaguard.lifecycle.LifecycleDecision;
import com.thetaguard.policy.EmergencyThresholds;
import com.thetaguard.policy.RiskPolicyProvider;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Escalation ladder NORMAL -> PREVENTIVE -> ELEVATED -> EMERGENCY driven by the VIX.
 *
 * <p>Within an episode the level only climbs. It returns to NORMAL once the VIX falls below the
 * PREVENTIVE threshold minus the hysteresis band, or on {@link #reset()}.
 */
@Service
public class EmergencyProtocolOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(EmergencyProtocolOrchestrator.class);

    private final RiskPolicyProvider riskPolicyProvider;
    private final EventPublisherHelper eventPublisherHelper;

    private final AtomicReference<ProtocolLevel> currentLevel = new AtomicReference<>(ProtocolLevel.NORMAL);

    public EmergencyProtocolOrchestrator(
            RiskPolicyProvider riskPolicyProvider, EventPublisherHelper eventPublisherHelper) {
        this.riskPolicyProvider = riskPolicyProvider;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /** Level implied by a single reading, ignoring history. */
    public ProtocolLevel levelFor(double vix) {
        EmergencyThresholds thresholds = riskPolicyProvider.current().getEmergency();
        if (vix >= thresholds.getEmergency()) {
            return ProtocolLevel.EMERGENCY;
        }
        if (vix >= thresholds.getElevated()) {
            return ProtocolLevel.ELEVATED;
        }
        if (vix >= thresholds.getPreventive()) {
            return ProtocolLevel.PREVENTIVE;
        }
        return ProtocolLevel.NORMAL;
    }

    /**
     * Directive for a regime with no history, taken at the regime's lower VIX bound: the least
     * severe level any reading in that regime can produce.
     */
    public ProtocolDirective currentProtocol(VixRegime regime) {
        double lowerBound = riskPolicyProvider.current().band(regime).getLowerBound();
        return directiveFor(levelFor(lowerBound));
    }

    /** Feeds a reading into the ladder and returns the directive now in force. */
    public ProtocolDirective onVixReading(double vix) {
        EmergencyThresholds thresholds = riskPolicyProvider.current().getEmergency();
        ProtocolLevel previous;
        ProtocolLevel next;
        do {
            previous = currentLevel.get();
            next = nextLevel(previous, vix, thresholds);
        } while (!currentLevel.compareAndSet(previous, next));

        if (next.ordinal() > previous.ordinal()) {
            log.warn("Protocol escalated {} -> {} at VIX {}", previous, next, vix);
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.PROTOCOL_ESCALATION,
                    next == ProtocolLevel.EMERGENCY ? RiskLevel.CRITICAL : RiskLevel.WARNING,
                    "Emergency protocol escalated to " + next + ": " + next.getDescription(),
                    Map.of("vix", vix, "previous", previous.name(), "current", next.name()));
        } else if (next.ordinal() < previous.ordinal()) {
            log.info("Protocol reset {} -> {} at VIX {}", previous, next, vix);
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.PROTOCOL_RESET,
                    RiskLevel.INFO,
                    "Emergency protocol back to " + next,
                    Map.of("vix", vix, "previous", previous.name(), "current", next.name()));
        }
        return directiveFor(next);
    }

    public ProtocolLevel getCurrentLevel() {
        return currentLevel.get();
    }

    public ProtocolDirective currentDirective() {
        return directiveFor(currentLevel.get());
    }

    /** Manual reset to NORMAL, e.g. after an operator reviewed the episode. */
    public void reset() {
        ProtocolLevel previous = currentLevel.getAndSet(ProtocolLevel.NORMAL);
        if (previous != ProtocolLevel.NORMAL) {
            log.info("Protocol manually reset from {}", previous);
            eventPublisherHelper.publishRiskEvent(
                    this, RiskEventType.PROTOCOL_RESET, RiskLevel.INFO, "Emergency protocol manually reset from " + previous);
        }
    }

    public ProtocolDirective directiveFor(ProtocolLevel level) {
        EmergencyThresholds thresholds = riskPolicyProvider.current().getEmergency();
        List<String> actions = new ArrayList<>();
        if (level.isAtLeast(ProtocolLevel.PREVENTIVE)) {
            actions.add(String.format("Cap new-entry buying power at %.0f%% of the regime limit",
                    thresholds.getHeadroomMultiplier() * 100));
        }
        if (level.isAtLeast(ProtocolLevel.ELEVATED)) {
            actions.add("Block all new entries");
            actions.add(String.format("Reduce every position by %.0f%%", thresholds.getExposureReduction() * 100));
        }
        if (level.isAtLeast(ProtocolLevel.EMERGENCY)) {
            actions.add("Close all positions expiring today");
            actions.add("Raise critical alert");
        }
        return ProtocolDirective.builder()
                .level(level)
                .headroomMultiplier(level.isAtLeast(ProtocolLevel.PREVENTIVE) ? thresholds.getHeadroomMultiplier() : 1.0)
                .blockNewEntries(level.isAtLeast(ProtocolLevel.ELEVATED))
                .exposureReduction(level.isAtLeast(ProtocolLevel.ELEVATED) ? thresholds.getExposureReduction() : 0.0)
                .closeSameDayExpirations(level.isAtLeast(ProtocolLevel.EMERGENCY))
                .criticalAlert(level.isAtLeast(ProtocolLevel.EMERGENCY))
                .actions(List.copyOf(actions))
                .build();
    }

    /**
     * Expands a directive into per-position instructions: EMERGENCY_CLOSE for positions expiring
     * {@code today}, then REDUCE for the rest. A reduction rounds down, so a one-lot position is
     * not reduced.
     */
    public List<LifecycleDecision> directiveInstructions(
            ProtocolDirective directive, List<Position> positions, LocalDate today) {
        List<LifecycleDecision> closes = new ArrayList<>();
        List<LifecycleDecision> reductions = new ArrayList<>();

        for (Position position : positions) {
            LifecycleState state = position.getLifecycleState();
            if (state == LifecycleState.PENDING || state == LifecycleState.CLOSED) {
                continue;
            }
            if (directive.isCloseSameDayExpirations() && today.equals(position.getExpiry())) {
                closes.add(LifecycleDecision.builder()
                        .positionId(position.getId())
                        .action(LifecycleAction.EMERGENCY_CLOSE)
                        .reason("Emergency protocol: same-day expiration force-closed")
                        .state(state)
                        .build());
                continue;
            }
            if (directive.getExposureReduction() > 0.0) {
                int cut = (int) Math.floor(Math.abs(position.getQuantity()) * directive.getExposureReduction());
                if (cut > 0) {
                    reductions.add(LifecycleDecision.builder()
                            .positionId(position.getId())
                            .action(LifecycleAction.REDUCE)
                            .quantity(cut)
                            .reason(String.format("%s protocol: reduce exposure by %.0f%% (%d of %d)",
                                    directive.getLevel(), directive.getExposureReduction() * 100, cut,
                                    Math.abs(position.getQuantity())))
                            .state(state)
                            .build());
                }
            }
        }

        List<LifecycleDecision> instructions = new ArrayList<>(closes);
        instructions.addAll(reductions);
        return instructions;
    }

    private ProtocolLevel nextLevel(ProtocolLevel current, double vix, EmergencyThresholds thresholds) {
        ProtocolLevel implied = levelFor(vix);
        if (implied.ordinal() >= current.ordinal()) {
            return implied;
        }
        if (vix < thresholds.getPreventive() - thresholds.getHysteresis()) {
            return ProtocolLevel.NORMAL;
        }
        return current;
    }
}
