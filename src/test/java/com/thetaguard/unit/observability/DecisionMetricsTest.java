package com.thetaguard.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.thetaguard.correlation.CorrelationAdmissionController;
import com.thetaguard.domain.enums.AdmissionReason;
import com.thetaguard.domain.enums.LifecycleAction;
import com.thetaguard.domain.model.AdmissionDecision;
import com.thetaguard.emergency.EmergencyProtocolOrchestrator;
import com.thetaguard.event.EventPublisherHelper;
import com.thetaguard.event.RiskEvent;
import com.thetaguard.event.RiskEventType;
import com.thetaguard.event.RiskLevel;
import com.thetaguard.fixtures.RiskParametersFixture;
import com.thetaguard.observability.DecisionMetrics;
import com.thetaguard.policy.RiskPolicyProvider;
import com.thetaguard.regime.RegimeClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for DecisionMetrics: counters for admissions, lifecycle actions and risk events, and the
 * gauges polled from the protocol orchestrator and the correlation controller.
 */
@ExtendWith(MockitoExtension.class)
class DecisionMetricsTest {

    private MeterRegistry meterRegistry;
    private EmergencyProtocolOrchestrator orchestrator;
    private CorrelationAdmissionController correlation;
    private DecisionMetrics decisionMetrics;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        RiskPolicyProvider provider = RiskParametersFixture.provider();
        orchestrator = new EmergencyProtocolOrchestrator(provider, eventPublisherHelper);
        correlation =
                new CorrelationAdmissionController(provider, new RegimeClassifier(provider), eventPublisherHelper);
        decisionMetrics = new DecisionMetrics(meterRegistry, orchestrator, correlation);
    }

    @Nested
    @DisplayName("Counters")
    class Counters {

        @Test
        @DisplayName("Admissions are split by outcome and reason")
        void admissions() {
            decisionMetrics.recordAdmission(AdmissionDecision.allow("SPY", "A2", 3, 1));
            decisionMetrics.recordAdmission(AdmissionDecision.deny(AdmissionReason.EMERGENCY_ENTRY_BLOCK, "SPY", "blocked"));
            decisionMetrics.recordAdmission(AdmissionDecision.deny(AdmissionReason.EMERGENCY_ENTRY_BLOCK, "QQQ", "blocked"));

            assertThat(meterRegistry.get("thetaguard.admissions").tag("outcome", "admitted").counter().count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get("thetaguard.admissions")
                    .tag("outcome", "denied")
                    .tag("reason", "EMERGENCY_ENTRY_BLOCK")
                    .counter()
                    .count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Lifecycle actions are counted per action")
        void lifecycleActions() {
            decisionMetrics.recordLifecycleAction(LifecycleAction.HOLD);
            decisionMetrics.recordLifecycleAction(LifecycleAction.ROLL);
            decisionMetrics.recordLifecycleAction(LifecycleAction.ROLL);

            assertThat(meterRegistry.get("thetaguard.lifecycle.actions").tag("action", "ROLL").counter().count())
                    .isEqualTo(2.0);
        }

        @Test
        @DisplayName("Risk events are counted by type and level")
        void riskEvents() {
            decisionMetrics.onRiskEvent(new RiskEvent(this, RiskEventType.POLICY_GAP, RiskLevel.WARNING, "gap"));

            assertThat(meterRegistry.get("thetaguard.risk.events")
                    .tag("type", "POLICY_GAP")
                    .tag("level", "WARNING")
                    .counter()
                    .count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Gauges")
    class Gauges {

        @Test
        @DisplayName("Protocol level gauge follows the ladder")
        void protocolLevel() {
            assertThat(meterRegistry.get("thetaguard.protocol.level").gauge().value()).isZero();

            orchestrator.onVixReading(42.0);

            assertThat(meterRegistry.get("thetaguard.protocol.level").gauge().value()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Risk score gauge is registered")
        void riskScore() {
            assertThat(meterRegistry.get("thetaguard.correlation.risk.score").gauge().value())
                    .isEqualTo(correlation.riskScore());
        }
    }
}
