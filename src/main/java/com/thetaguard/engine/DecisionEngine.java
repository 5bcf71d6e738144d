package com.thetaguard.engine;

import com.thetaguard.correlation.CorrelationAdmissionController;
import com.thetaguard.domain.enums.AdmissionReason;
import com.thetaguard.domain.enums.DataSeverity;
import com.thetaguard.domain.enums.LifecycleAction;
import com.thetaguard.domain.enums.LifecycleState;
import com.thetaguard.domain.enums.SizingOutcome;
import com.thetaguard.domain.enums.VixRegime;
import com.thetaguard.domain.model.AccountSnapshot;
import com.thetaguard.domain.model.AccountState;
import com.thetaguard.domain.model.AdmissionDecision;
import com.thetaguard.domain.model.AdmissionRequest;
import com.thetaguard.domain.model.FillDetails;
import com.thetaguard.domain.model.MarketSnapshot;
import com.thetaguard.domain.model.Position;
import com.thetaguard.emergency.EmergencyProtocolOrchestrator;
import com.thetaguard.emergency.ProtocolDirective;
import com.thetaguard.event.EventPublisherHelper;
import com.thetaguard.event.RiskEventType;
import com.thetaguard.event.RiskLevel;
import com.thetaguard.exception.DataUnavailableException;
import com.thetaguard.exception.DecisionCoreHaltedException;
import com.thetaguard.exception.LifecycleTransitionException;
import com.thetaguard.lifecycle.DefensiveLifecycleManager;
import com.thetaguard.lifecycle.LifecycleDecision;
import com.thetaguard.lifecycle.PositionBook;
import com.thetaguard.marketdata.DataSeverityClassifier;
import com.thetaguard.marketdata.MarketDataResolver;
import com.thetaguard.observability.DecisionMetrics;
import com.thetaguard.phase.PhaseManager;
import com.thetaguard.regime.RegimeClassifier;
import com.thetaguard.sizing.KellyPositionSizer;
import com.thetaguard.sizing.SizingResult;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the decision core. Derives the account state from injected snapshots and runs
 * admission, sizing, lifecycle evaluation and the emergency protocol against it.
 *
 * <p>Admission gates, first failure wins:
 * <ol>
 *   <li>Core halted: {@link DecisionCoreHaltedException}</li>
 *   <li>Equity below phase 1</li>
 *   <li>Strategy not allowed in the phase</li>
 *   <li>Max positions for the phase, reservations included. {@link #admitAndReserve} checks it
 *       and reserves under one lock</li>
 *   <li>Protocol blocks new entries (ELEVATED and above)</li>
 *   <li>Buying power used at or above the regime limit times the protocol headroom</li>
 *   <li>Correlation group and equity-aggregate limits</li>
 * </ol>
 *
 * <p>A FATAL data outage halts the core: admissions are refused until {@link #resume()}, while
 * tracked positions keep being evaluated and accept fills.
 */
@Service
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    static final String VIX_INSTRUMENT = "VIX";

    private final RegimeClassifier regimeClassifier;
    private final PhaseManager phaseManager;
    private final KellyPositionSizer kellyPositionSizer;
    private final CorrelationAdmissionController correlationAdmissionController;
    private final PositionBook positionBook;
    private final DefensiveLifecycleManager defensiveLifecycleManager;
    private final EmergencyProtocolOrchestrator emergencyProtocolOrchestrator;
    private final MarketDataResolver marketDataResolver;
    private final DataSeverityClassifier dataSeverityClassifier;
    private final EventPublisherHelper eventPublisherHelper;
    private final DecisionMetrics decisionMetrics;

    private final AtomicBoolean halted = new AtomicBoolean(false);
    private final AtomicReference<String> haltReason = new AtomicReference<>();
    private final AtomicReference<AccountState> lastAccountState = new AtomicReference<>();

    // Guards the max-positions gate together with the reservation it admits.
    private final ReentrantLock admissionLock = new ReentrantLock();

    public DecisionEngine(
            RegimeClassifier regimeClassifier,
            PhaseManager phaseManager,
            KellyPositionSizer kellyPositionSizer,
            CorrelationAdmissionController correlationAdmissionController,
            PositionBook positionBook,
            DefensiveLifecycleManager defensiveLifecycleManager,
            EmergencyProtocolOrchestrator emergencyProtocolOrchestrator,
            MarketDataResolver marketDataResolver,
            DataSeverityClassifier dataSeverityClassifier,
            EventPublisherHelper eventPublisherHelper,
            DecisionMetrics decisionMetrics) {
        this.regimeClassifier = regimeClassifier;
        this.phaseManager = phaseManager;
        this.kellyPositionSizer = kellyPositionSizer;
        this.correlationAdmissionController = correlationAdmissionController;
        this.positionBook = positionBook;
        this.defensiveLifecycleManager = defensiveLifecycleManager;
        this.emergencyProtocolOrchestrator = emergencyProtocolOrchestrator;
        this.marketDataResolver = marketDataResolver;
        this.dataSeverityClassifier = dataSeverityClassifier;
        this.eventPublisherHelper = eventPublisherHelper;
        this.decisionMetrics = decisionMetrics;
    }

    // ========================
    // ADMISSION
    // ========================

    /** Runs every gate without reserving anything. */
    public AdmissionDecision evaluateAdmission(
            AdmissionRequest candidate, AccountSnapshot account, MarketSnapshot market) {
        AdmissionDecision decision = haltOnFatal(() -> {
            ensureNotHalted();
            AccountState state = deriveAccountState(account, market);
            resolveCandidateUnderlying(candidate, market);
            return preCorrelationGates(candidate, state)
                    .orElseGet(() -> correlationAdmissionController.canAdmit(candidate.getSymbol(), state.getPhase()));
        });
        return recordAdmission(candidate, decision);
    }

    /**
     * Runs every gate and, when admitted, reserves the position as PENDING so it counts against
     * the limits until its entry fill or {@link #releaseReservation}.
     */
    public AdmissionDecision admitAndReserve(
            AdmissionRequest candidate, AccountSnapshot account, MarketSnapshot market) {
        AdmissionDecision decision = haltOnFatal(() -> {
            ensureNotHalted();
            AccountState state = deriveAccountState(account, market);
            resolveCandidateUnderlying(candidate, market);
            admissionLock.lock();
            try {
                Optional<AdmissionDecision> denied = preCorrelationGates(candidate, state);
                if (denied.isPresent()) {
                    return denied.get();
                }
                if (positionBook.find(candidate.getPositionId()).isPresent()) {
                    return AdmissionDecision.deny(
                            AdmissionReason.DUPLICATE_POSITION,
                            candidate.getSymbol(),
                            "Position " + candidate.getPositionId() + " is already tracked");
                }
                return positionBook.reserve(toPosition(candidate), state.getPhase());
            } finally {
                admissionLock.unlock();
            }
        });
        return recordAdmission(candidate, decision);
    }

    /** Cancels a reservation whose entry order was never filled. */
    public Position releaseReservation(String positionId) {
        Position position = positionBook.get(positionId);
        if (position.getLifecycleState() != LifecycleState.PENDING) {
            throw new LifecycleTransitionException(positionId, position.getLifecycleState(), LifecycleState.CLOSED);
        }
        log.info("Releasing reservation {} ({})", positionId, position.getSymbol());
        return positionBook.unregister(positionId);
    }

    private Optional<AdmissionDecision> preCorrelationGates(AdmissionRequest candidate, AccountState state) {
        String symbol = candidate.getSymbol();
        int phase = state.getPhase();

        if (phase == PhaseManager.BELOW_MINIMUM) {
            return Optional.of(AdmissionDecision.deny(
                    AdmissionReason.BELOW_MINIMUM_PHASE,
                    symbol,
                    "Equity " + state.getEquity() + " is below the phase 1 minimum"));
        }
        if (!phaseManager.isStrategyAllowed(candidate.getStrategy(), phase)) {
            return Optional.of(AdmissionDecision.deny(
                    AdmissionReason.STRATEGY_NOT_ALLOWED,
                    symbol,
                    "Strategy " + candidate.getStrategy() + " is not allowed in phase " + phase));
        }
        int maxPositions = phaseManager.getMaxPositions(phase);
        int tracked = positionBook.trackedCount();
        if (tracked >= maxPositions) {
            return Optional.of(AdmissionDecision.denyAtLimit(
                    AdmissionReason.MAX_POSITIONS,
                    symbol,
                    null,
                    maxPositions,
                    tracked,
                    String.format("Phase %d position limit reached: %d/%d", phase, tracked, maxPositions)));
        }
        ProtocolDirective directive = emergencyProtocolOrchestrator.directiveFor(state.getProtocolLevel());
        if (directive.isBlockNewEntries()) {
            return Optional.of(AdmissionDecision.deny(
                    AdmissionReason.EMERGENCY_ENTRY_BLOCK,
                    symbol,
                    "New entries blocked by " + state.getProtocolLevel() + " protocol at VIX " + state.getVix()));
        }
        if (state.getBuyingPowerUsed() >= state.getMaxBuyingPower()) {
            return Optional.of(AdmissionDecision.deny(
                    AdmissionReason.BUYING_POWER_BUDGET,
                    symbol,
                    String.format("Buying power used %.1f%% at or above the %.1f%% budget for phase %d in %s",
                            state.getBuyingPowerUsed() * 100, state.getMaxBuyingPower() * 100, phase,
                            state.getRegime())));
        }
        return Optional.empty();
    }

    private AdmissionDecision recordAdmission(AdmissionRequest candidate, AdmissionDecision decision) {
        decisionMetrics.recordAdmission(decision);
        if (!decision.isAllowed()) {
            log.warn("Admission denied for {} ({}): {}", candidate.getSymbol(), decision.getReason(),
                    decision.getMessage());
            Map<String, Object> details = new HashMap<>();
            details.put("symbol", candidate.getSymbol());
            details.put("reason", decision.getReason().name());
            if (decision.getGroupId() != null) {
                details.put("groupId", decision.getGroupId());
            }
            eventPublisherHelper.publishAdmissionDenied(this, decision.getMessage(), details);
        }
        return decision;
    }

    // ========================
    // SIZING
    // ========================

    /**
     * Kelly sizing capped at the current phase's max risk per trade. A strategy the phase does not
     * allow is refused before any arithmetic.
     */
    public SizingResult sizePosition(String strategy, double winRate, double averageWin, double averageLoss) {
        int phase = phaseManager.getCurrentPhase();
        if (!phaseManager.isStrategyAllowed(strategy, phase)) {
            return SizingResult.doNotTrade(
                    strategy,
                    SizingOutcome.STRATEGY_NOT_ALLOWED,
                    Double.NaN,
                    "Strategy " + strategy + " is not allowed in phase " + phase);
        }
        return kellyPositionSizer.size(strategy, winRate, averageWin, averageLoss, phaseManager.getMaxRiskPerTrade(phase));
    }

    /** As {@link #sizePosition}, from the strategy's configured priors. */
    public SizingResult sizePositionFromPriors(String strategy) {
        int phase = phaseManager.getCurrentPhase();
        if (!phaseManager.isStrategyAllowed(strategy, phase)) {
            return SizingResult.doNotTrade(
                    strategy,
                    SizingOutcome.STRATEGY_NOT_ALLOWED,
                    Double.NaN,
                    "Strategy " + strategy + " is not allowed in phase " + phase);
        }
        return kellyPositionSizer.sizeFromPriors(strategy, phaseManager.getMaxRiskPerTrade(phase));
    }

    // ========================
    // LIFECYCLE
    // ========================

    public LifecycleDecision evaluatePositionLifecycle(String positionId, MarketSnapshot market) {
        LifecycleDecision decision = haltOnFatal(() -> defensiveLifecycleManager.evaluate(positionId, market));
        recordLifecycle(decision);
        return decision;
    }

    public LifecycleDecision planDefense(String positionId, LocalDate today) {
        LifecycleDecision decision = defensiveLifecycleManager.planDefense(positionId, today);
        recordLifecycle(decision);
        return decision;
    }

    /** Applies an execution report from the broker to the book and the correlation counters. */
    public Position registerFill(FillDetails fill) {
        Position updated = defensiveLifecycleManager.applyFill(fill);
        log.info("Fill {} applied to {}: now {}", fill.getFillType(), fill.getPositionId(), updated.getLifecycleState());
        return updated;
    }

    private void recordLifecycle(LifecycleDecision decision) {
        decisionMetrics.recordLifecycleAction(decision.getAction());
        if (decision.requiresExecution()) {
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.DEFENSIVE_ACTION,
                    decision.getAction() == LifecycleAction.EMERGENCY_CLOSE ? RiskLevel.CRITICAL : RiskLevel.WARNING,
                    decision.getPositionId() + " " + decision.getAction() + ": " + decision.getReason(),
                    Map.of("positionId", decision.getPositionId(), "action", decision.getAction().name()));
        }
    }

    // ========================
    // TICK
    // ========================

    /**
     * One decision cycle: re-derives the account state, feeds the VIX into the protocol ladder,
     * evaluates every active position and expands the protocol directive into instructions.
     *
     * @throws DataUnavailableException when the VIX is unavailable at CRITICAL or FATAL severity,
     *     or a position's data is FATAL; FATAL also halts the core
     */
    public TickReport onTick(AccountSnapshot account, MarketSnapshot market) {
        return haltOnFatal(() -> {
            AccountState state = deriveAccountState(account, market);
            ProtocolDirective directive = emergencyProtocolOrchestrator.directiveFor(state.getProtocolLevel());
            LocalDate today = dataSeverityClassifier.tradeDate(market.getAsOf());

            List<Position> active = positionBook.activePositions();
            List<LifecycleDecision> decisions = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            for (Position position : active) {
                try {
                    LifecycleDecision decision = defensiveLifecycleManager.evaluate(position.getId(), market);
                    recordLifecycle(decision);
                    decisions.add(decision);
                } catch (DataUnavailableException e) {
                    if (e.getSeverity() == DataSeverity.FATAL) {
                        throw e;
                    }
                    log.warn("Skipped {} this tick: {}", position.getId(), e.getMessage());
                    errors.add(position.getId() + ": " + e.getMessage());
                }
            }

            List<LifecycleDecision> instructions =
                    emergencyProtocolOrchestrator.directiveInstructions(directive, positionBook.activePositions(), today);
            instructions.forEach(this::recordLifecycle);

            log.debug("Tick {}: phase {}, {} (VIX {}), protocol {}, {} positions, {} instructions",
                    market.getAsOf(), state.getPhase(), state.getRegime(), state.getVix(), directive.getLevel(),
                    active.size(), instructions.size());

            return TickReport.builder()
                    .asOf(market.getAsOf())
                    .accountState(state)
                    .directive(directive)
                    .instructions(instructions)
                    .decisions(decisions)
                    .errors(errors)
                    .halted(halted.get())
                    .build();
        });
    }

    /**
     * Derives phase, regime, protocol level and buying-power budget from the snapshots, and pushes
     * equity and regime into the correlation controller.
     */
    public AccountState deriveAccountState(AccountSnapshot account, MarketSnapshot market) {
        double vix = marketDataResolver.resolveRequired(
                VIX_INSTRUMENT, VIX_INSTRUMENT, Optional.ofNullable(market.getVix()), market.getAsOf());
        if (!regimeClassifier.isValidReading(vix)) {
            throw new DataUnavailableException(
                    VIX_INSTRUMENT,
                    dataSeverityClassifier.classify(VIX_INSTRUMENT, market.getAsOf()),
                    "invalid reading " + vix);
        }

        int phase = phaseManager.updatePhase(account.getEquity());
        VixRegime regime = regimeClassifier.classify(vix);
        ProtocolDirective directive = emergencyProtocolOrchestrator.onVixReading(vix);
        correlationAdmissionController.updateContext(account.getEquity(), regime);

        AccountState state = AccountState.builder()
                .accountId(account.getAccountId())
                .equity(account.getEquity())
                .phase(phase)
                .regime(regime)
                .vix(vix)
                .maxBuyingPower(regimeClassifier.maxBuyingPower(regime, phase) * directive.getHeadroomMultiplier())
                .buyingPowerUsed(account.getBuyingPowerUsed())
                .protocolLevel(directive.getLevel())
                .build();
        lastAccountState.set(state);
        return state;
    }

    public Optional<AccountState> getLastAccountState() {
        return Optional.ofNullable(lastAccountState.get());
    }

    // ========================
    // PROTOCOL
    // ========================

    public ProtocolDirective currentProtocol(VixRegime regime) {
        return emergencyProtocolOrchestrator.currentProtocol(regime);
    }

    public ProtocolDirective currentProtocol() {
        return emergencyProtocolOrchestrator.currentDirective();
    }

    // ========================
    // HALT
    // ========================

    public void halt(String reason) {
        if (halted.compareAndSet(false, true)) {
            haltReason.set(reason);
            log.error("Decision core HALTED: {}", reason);
            eventPublisherHelper.publishRiskEvent(
                    this, RiskEventType.CORE_HALTED, RiskLevel.CRITICAL, "Decision core halted: " + reason,
                    Map.of("reason", reason));
        }
    }

    public void resume() {
        if (halted.compareAndSet(true, false)) {
            String reason = haltReason.getAndSet(null);
            log.info("Decision core resumed (was halted: {})", reason);
            eventPublisherHelper.publishRiskEvent(
                    this, RiskEventType.CORE_RESUMED, RiskLevel.INFO, "Decision core resumed");
        }
    }

    public boolean isHalted() {
        return halted.get();
    }

    public Optional<String> getHaltReason() {
        return Optional.ofNullable(haltReason.get());
    }

    private void ensureNotHalted() {
        if (halted.get()) {
            throw new DecisionCoreHaltedException(haltReason.get() != null ? haltReason.get() : "unknown");
        }
    }

    private <T> T haltOnFatal(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataUnavailableException e) {
            if (e.getSeverity() == DataSeverity.FATAL) {
                halt("FATAL data outage for " + e.getInstrument());
            }
            throw e;
        }
    }

    // ========================
    // HELPERS
    // ========================

    /** Fails the admission when the candidate's underlying is missing at CRITICAL or FATAL severity. */
    private void resolveCandidateUnderlying(AdmissionRequest candidate, MarketSnapshot market) {
        marketDataResolver.resolve(
                candidate.getSymbol(), candidate.getSymbol(), market.underlying(candidate.getSymbol()), market.getAsOf());
    }

    private Position toPosition(AdmissionRequest candidate) {
        return Position.builder()
                .id(candidate.getPositionId())
                .symbol(candidate.getSymbol())
                .strategy(candidate.getStrategy())
                .quantity(candidate.getQuantity())
                .entryPrice(candidate.getEntryPrice())
                .expiry(candidate.getExpiry())
                .optionRight(candidate.getOptionRight())
                .strike(candidate.getStrike())
                .maxLoss(candidate.getMaxLoss())
                .entryTime(Instant.now())
                .build();
    }
}
