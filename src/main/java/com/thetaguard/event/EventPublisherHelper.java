package com.thetaguard.event;

import java.math.BigDecimal;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with typed factory methods for
 * the decision core's events, so call sites read {@code publishAdmissionDenied(...)} instead of
 * constructing events inline.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Risk ----

    public void publishRiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message));
    }

    public void publishRiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message, details));
    }

    public void publishAdmissionDenied(Object source, String message, Map<String, Object> details) {
        publishRiskEvent(source, RiskEventType.ADMISSION_DENIED, RiskLevel.WARNING, message, details);
    }

    public void publishPolicyGap(Object source, String symbol) {
        publishRiskEvent(
                source,
                RiskEventType.POLICY_GAP,
                RiskLevel.WARNING,
                "Symbol " + symbol + " is not mapped to any correlation group",
                Map.of("symbol", symbol));
    }

    // ---- Phase ----

    public void publishPhaseTransition(Object source, int previousPhase, int currentPhase, BigDecimal equity) {
        applicationEventPublisher.publishEvent(new PhaseTransitionEvent(source, previousPhase, currentPhase, equity));
    }
}
