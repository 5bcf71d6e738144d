package com.thetaguard.fixtures;

import com.thetaguard.config.MarketSessionProperties;
import com.thetaguard.correlation.CorrelationAdmissionController;
import com.thetaguard.domain.model.OptionContract;
import com.thetaguard.emergency.EmergencyProtocolOrchestrator;
import com.thetaguard.engine.DecisionEngine;
import com.thetaguard.event.EventPublisherHelper;
import com.thetaguard.lifecycle.DefensiveLifecycleManager;
import com.thetaguard.lifecycle.OptionChainProvider;
import com.thetaguard.lifecycle.PositionBook;
import com.thetaguard.lifecycle.RollPlanner;
import com.thetaguard.marketdata.DataSeverityClassifier;
import com.thetaguard.marketdata.MarketDataResolver;
import com.thetaguard.observability.DecisionMetrics;
import com.thetaguard.phase.PhaseManager;
import com.thetaguard.policy.RiskPolicyProvider;
import com.thetaguard.regime.RegimeClassifier;
import com.thetaguard.sizing.KellyPositionSizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * The whole decision core wired by hand from real components, with the shipped policy table.
 * Only the event publisher comes from the caller, usually a mock, so tests can verify events.
 */
@Getter
public class DecisionCoreFixture {

    private final RiskPolicyProvider riskPolicyProvider;
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final List<OptionContract> optionChain = new ArrayList<>();

    private final RegimeClassifier regimeClassifier;
    private final PhaseManager phaseManager;
    private final KellyPositionSizer kellyPositionSizer;
    private final CorrelationAdmissionController correlationAdmissionController;
    private final PositionBook positionBook;
    private final MarketDataResolver marketDataResolver;
    private final DefensiveLifecycleManager defensiveLifecycleManager;
    private final EmergencyProtocolOrchestrator emergencyProtocolOrchestrator;
    private final DecisionMetrics decisionMetrics;
    private final DecisionEngine decisionEngine;

    public DecisionCoreFixture(EventPublisherHelper eventPublisherHelper) {
        riskPolicyProvider = RiskParametersFixture.provider();
        MarketSessionProperties sessionProperties = new MarketSessionProperties();
        DataSeverityClassifier classifier = new DataSeverityClassifier(sessionProperties);
        OptionChainProvider chainProvider = (underlying, from, to) -> List.copyOf(optionChain);

        regimeClassifier = new RegimeClassifier(riskPolicyProvider);
        phaseManager = new PhaseManager(riskPolicyProvider, eventPublisherHelper);
        kellyPositionSizer = new KellyPositionSizer(riskPolicyProvider);
        correlationAdmissionController =
                new CorrelationAdmissionController(riskPolicyProvider, regimeClassifier, eventPublisherHelper);
        positionBook = new PositionBook(correlationAdmissionController);
        marketDataResolver = new MarketDataResolver(classifier, eventPublisherHelper);
        defensiveLifecycleManager = new DefensiveLifecycleManager(
                positionBook, new RollPlanner(chainProvider, riskPolicyProvider), marketDataResolver, riskPolicyProvider);
        emergencyProtocolOrchestrator = new EmergencyProtocolOrchestrator(riskPolicyProvider, eventPublisherHelper);
        decisionMetrics =
                new DecisionMetrics(meterRegistry, emergencyProtocolOrchestrator, correlationAdmissionController);
        decisionEngine = new DecisionEngine(
                regimeClassifier,
                phaseManager,
                kellyPositionSizer,
                correlationAdmissionController,
                positionBook,
                defensiveLifecycleManager,
                emergencyProtocolOrchestrator,
                marketDataResolver,
                classifier,
                eventPublisherHelper,
                decisionMetrics);
    }
}
