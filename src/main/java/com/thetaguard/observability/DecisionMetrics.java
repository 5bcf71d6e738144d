package com.thetaguard.observability;

import com.thetaguard.correlation.CorrelationAdmissionController;
import com.thetaguard.domain.enums.LifecycleAction;
import com.thetaguard.domain.model.AdmissionDecision;
import com.thetaguard.emergency.EmergencyProtocolOrchestrator;
import com.thetaguard.event.RiskEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the decision core:
 * <ul>
 *   <li><b>thetaguard.admissions</b> (counter, tags outcome and reason)</li>
 *   <li><b>thetaguard.lifecycle.actions</b> (counter, tag action)</li>
 *   <li><b>thetaguard.risk.events</b> (counter, tags type and level)</li>
 *   <li><b>thetaguard.protocol.level</b> (gauge, 0 = NORMAL .. 3 = EMERGENCY)</li>
 *   <li><b>thetaguard.correlation.risk.score</b> (gauge, 0..100)</li>
 * </ul>
 *
 * <p>Gauges are polled from the owning services at scrape time.
 */
@Service
public class DecisionMetrics {

    private final MeterRegistry meterRegistry;

    public DecisionMetrics(
            MeterRegistry meterRegistry,
            EmergencyProtocolOrchestrator emergencyProtocolOrchestrator,
            CorrelationAdmissionController correlationAdmissionController) {
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge(
                "thetaguard.protocol.level",
                emergencyProtocolOrchestrator,
                orchestrator -> orchestrator.getCurrentLevel().ordinal());

        meterRegistry.gauge(
                "thetaguard.correlation.risk.score",
                correlationAdmissionController,
                CorrelationAdmissionController::riskScore);
    }

    public void recordAdmission(AdmissionDecision decision) {
        Counter.builder("thetaguard.admissions")
                .description("Admission decisions by outcome and reason")
                .tag("outcome", decision.isAllowed() ? "admitted" : "denied")
                .tag("reason", decision.getReason().name())
                .register(meterRegistry)
                .increment();
    }

    public void recordLifecycleAction(LifecycleAction action) {
        Counter.builder("thetaguard.lifecycle.actions")
                .description("Lifecycle actions emitted by position evaluation")
                .tag("action", action.name())
                .register(meterRegistry)
                .increment();
    }

    /** Counts every risk event. Runs after the core listeners. */
    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        Counter.builder("thetaguard.risk.events")
                .description("Risk events published by the decision core")
                .tag("type", event.getEventType().name())
                .tag("level", event.getLevel().name())
                .register(meterRegistry)
                .increment();
    }
}
