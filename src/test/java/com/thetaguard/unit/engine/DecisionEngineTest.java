package com.thetaguard.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.thetaguard.domain.enums.AdmissionReason;
import com.thetaguard.domain.enums.DataSeverity;
import com.thetaguard.domain.enums.FillType;
import com.thetaguard.domain.enums.LifecycleAction;
import com.thetaguard.domain.enums.LifecycleState;
import com.thetaguard.domain.enums.OptionRight;
import com.thetaguard.domain.enums.ProtocolLevel;
import com.thetaguard.domain.enums.SizingOutcome;
import com.thetaguard.domain.enums.VixRegime;
import com.thetaguard.domain.model.AccountSnapshot;
import com.thetaguard.domain.model.AccountState;
import com.thetaguard.domain.model.AdmissionDecision;
import com.thetaguard.domain.model.AdmissionRequest;
import com.thetaguard.domain.model.FillDetails;
import com.thetaguard.domain.model.MarketSnapshot;
import com.thetaguard.domain.vo.MarketReading;
import com.thetaguard.engine.DecisionEngine;
import com.thetaguard.engine.TickReport;
import com.thetaguard.event.EventPublisherHelper;
import com.thetaguard.event.RiskEventType;
import com.thetaguard.event.RiskLevel;
import com.thetaguard.exception.DataUnavailableException;
import com.thetaguard.exception.DecisionCoreHaltedException;
import com.thetaguard.exception.LifecycleTransitionException;
import com.thetaguard.fixtures.DecisionCoreFixture;
import com.thetaguard.lifecycle.LifecycleDecision;
import com.thetaguard.sizing.SizingResult;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DecisionEngineTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    // Saturday: absent values are EXPECTED gaps
    private static final ZonedDateTime SATURDAY = ZonedDateTime.of(2026, 10, 17, 12, 0, 0, 0, NEW_YORK);
    private static final ZonedDateTime MONDAY_MIDDAY = ZonedDateTime.of(2026, 10, 19, 12, 0, 0, 0, NEW_YORK);

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private DecisionCoreFixture core;
    private DecisionEngine engine;

    @BeforeEach
    void setUp() {
        core = new DecisionCoreFixture(eventPublisherHelper);
        engine = core.getDecisionEngine();
    }

    private static AccountSnapshot account(String equity, double buyingPowerUsed) {
        return AccountSnapshot.builder()
                .accountId("ACC-1")
                .equity(new BigDecimal(equity))
                .buyingPowerUsed(buyingPowerUsed)
                .build();
    }

    private static MarketSnapshot market(ZonedDateTime asOf, double vix) {
        return MarketSnapshot.builder().asOf(asOf).vix(MarketReading.value(vix)).build();
    }

    private static AdmissionRequest candidate(String id, String symbol, String strategy) {
        return AdmissionRequest.builder()
                .positionId(id)
                .symbol(symbol)
                .strategy(strategy)
                .quantity(-2)
                .entryPrice(new BigDecimal("1.50"))
                .build();
    }

    private double admissionCount(String outcome, AdmissionReason reason) {
        return core.getMeterRegistry().get("thetaguard.admissions")
                .tag("outcome", outcome)
                .tag("reason", reason.name())
                .counter()
                .count();
    }

    // ==============================
    // ACCOUNT STATE
    // ==============================

    @Nested
    @DisplayName("Account state derivation")
    class AccountStateDerivation {

        @Test
        @DisplayName("Phase, regime, protocol and budget come from one snapshot pair")
        void derive() {
            AccountState state = engine.deriveAccountState(account("45000", 0.1), market(SATURDAY, 26.0));

            assertThat(state.getPhase()).isEqualTo(2);
            assertThat(state.getRegime()).isEqualTo(VixRegime.NORMAL);
            assertThat(state.getProtocolLevel()).isEqualTo(ProtocolLevel.PREVENTIVE);
            // NORMAL phase 2 = 0.50, PREVENTIVE headroom 0.75
            assertThat(state.getMaxBuyingPower()).isCloseTo(0.375, within(1e-9));
            assertThat(engine.getLastAccountState()).containsSame(state);
        }

        @Test
        @DisplayName("Missing VIX with no history is an error, not a zero reading")
        void missingVixWithoutHistory() {
            MarketSnapshot noVix = MarketSnapshot.builder().asOf(SATURDAY).build();

            assertThatThrownBy(() -> engine.deriveAccountState(account("45000", 0.1), noVix))
                    .isInstanceOf(DataUnavailableException.class);
            assertThat(engine.isHalted()).isFalse();
        }

        @Test
        @DisplayName("Missing VIX outside the session falls back to the last known value")
        void missingVixWithHistory() {
            engine.deriveAccountState(account("45000", 0.1), market(SATURDAY, 32.0));

            AccountState state = engine.deriveAccountState(
                    account("45000", 0.1), MarketSnapshot.builder().asOf(SATURDAY.plusHours(1)).build());

            assertThat(state.getVix()).isEqualTo(32.0);
            assertThat(state.getRegime()).isEqualTo(VixRegime.HIGH);
        }

        @Test
        @DisplayName("Implausible VIX reading is rejected")
        void implausibleVix() {
            assertThatThrownBy(() -> engine.deriveAccountState(account("45000", 0.1), market(SATURDAY, 3.0)))
                    .isInstanceOf(DataUnavailableException.class)
                    .hasMessageContaining("invalid reading");
        }
    }

    // ==============================
    // ADMISSION GATES
    // ==============================

    @Nested
    @DisplayName("Admission gates")
    class AdmissionGates {

        @Test
        @DisplayName("Account below phase 1 admits nothing")
        void belowMinimumPhase() {
            AdmissionDecision decision = engine.evaluateAdmission(
                    candidate("p1", "GLD", "FRIDAY_0DTE"), account("20000", 0.0), market(SATURDAY, 18.0));

            assertThat(decision.getReason()).isEqualTo(AdmissionReason.BELOW_MINIMUM_PHASE);
            assertThat(admissionCount("denied", AdmissionReason.BELOW_MINIMUM_PHASE)).isEqualTo(1.0);
            verify(eventPublisherHelper).publishAdmissionDenied(any(), anyString(), anyMap());
        }

        @Test
        @DisplayName("Strategy outside the phase allow-list is denied")
        void strategyNotAllowed() {
            AdmissionDecision decision = engine.evaluateAdmission(
                    candidate("p1", "SPY", "IPMCC"), account("35000", 0.0), market(SATURDAY, 18.0));

            assertThat(decision.getReason()).isEqualTo(AdmissionReason.STRATEGY_NOT_ALLOWED);
        }

        @Test
        @DisplayName("Reservations count against the phase position limit")
        void maxPositions() {
            String[] symbols = {"GLD", "SLV", "CL", "NG", "ZC", "LE"};
            for (int i = 0; i < symbols.length; i++) {
                AdmissionDecision admitted = engine.admitAndReserve(
                        candidate("p" + i, symbols[i], "FUTURES_STRANGLES"), account("35000", 0.1), market(SATURDAY, 18.0));
                assertThat(admitted.isAllowed()).as(symbols[i]).isTrue();
            }

            AdmissionDecision decision = engine.evaluateAdmission(
                    candidate("p7", "6E", "FUTURES_STRANGLES"), account("35000", 0.1), market(SATURDAY, 18.0));

            assertThat(decision.getReason()).isEqualTo(AdmissionReason.MAX_POSITIONS);
            assertThat(decision.getLimit()).isEqualTo(6);
            assertThat(decision.getCurrentCount()).isEqualTo(6);
        }

        @Test
        @DisplayName("ELEVATED protocol blocks every new entry")
        void emergencyBlock() {
            AdmissionDecision decision = engine.evaluateAdmission(
                    candidate("p1", "GLD", "FRIDAY_0DTE"), account("50000", 0.0), market(SATURDAY, 35.0));

            assertThat(decision.getReason()).isEqualTo(AdmissionReason.EMERGENCY_ENTRY_BLOCK);
        }

        @Test
        @DisplayName("Buying-power budget includes the preventive headroom cut")
        void buyingPowerWithHeadroom() {
            // phase 1, NORMAL: 0.40 * 0.75 = 0.30
            AdmissionDecision over = engine.evaluateAdmission(
                    candidate("p1", "GLD", "FRIDAY_0DTE"), account("35000", 0.32), market(SATURDAY, 26.0));
            AdmissionDecision under = engine.evaluateAdmission(
                    candidate("p1", "GLD", "FRIDAY_0DTE"), account("35000", 0.28), market(SATURDAY, 26.0));

            assertThat(over.getReason()).isEqualTo(AdmissionReason.BUYING_POWER_BUDGET);
            assertThat(under.isAllowed()).isTrue();
        }

        @Test
        @DisplayName("Correlation limits apply after the account gates")
        void correlationLimit() {
            engine.admitAndReserve(candidate("p1", "ES", "FUTURES_STRANGLES"), account("35000", 0.1), market(SATURDAY, 18.0));

            AdmissionDecision decision = engine.admitAndReserve(
                    candidate("p2", "/NQZ6", "FUTURES_STRANGLES"), account("35000", 0.1), market(SATURDAY, 18.0));

            assertThat(decision.getReason()).isEqualTo(AdmissionReason.GROUP_LIMIT);
            assertThat(decision.getGroupId()).isEqualTo("A1");
            assertThat(core.getPositionBook().find("p2")).isEmpty();
        }
    }

    // ==============================
    // RESERVATIONS
    // ==============================

    @Nested
    @DisplayName("Reservations")
    class Reservations {

        @Test
        @DisplayName("Admitted candidate is reserved as PENDING and can be released")
        void reserveAndRelease() {
            AdmissionDecision decision = engine.admitAndReserve(
                    candidate("p1", "GLD", "FRIDAY_0DTE"), account("35000", 0.1), market(SATURDAY, 18.0));

            assertThat(decision.isAllowed()).isTrue();
            assertThat(core.getPositionBook().get("p1").getLifecycleState()).isEqualTo(LifecycleState.PENDING);
            assertThat(admissionCount("admitted", AdmissionReason.OK)).isEqualTo(1.0);

            engine.releaseReservation("p1");

            assertThat(core.getPositionBook().find("p1")).isEmpty();
            assertThat(core.getCorrelationAdmissionController().activeCount("B1")).isZero();
        }

        @Test
        @DisplayName("Same position id cannot be reserved twice")
        void duplicateReservation() {
            engine.admitAndReserve(candidate("p1", "GLD", "FRIDAY_0DTE"), account("35000", 0.1), market(SATURDAY, 18.0));

            AdmissionDecision decision = engine.admitAndReserve(
                    candidate("p1", "CL", "FRIDAY_0DTE"), account("35000", 0.1), market(SATURDAY, 18.0));

            assertThat(decision.getReason()).isEqualTo(AdmissionReason.DUPLICATE_POSITION);
        }

        @Test
        @DisplayName("Filled position is no longer a reservation")
        void releaseAfterFill() {
            engine.admitAndReserve(candidate("p1", "GLD", "FRIDAY_0DTE"), account("35000", 0.1), market(SATURDAY, 18.0));
            engine.registerFill(FillDetails.builder()
                    .positionId("p1").fillType(FillType.ENTRY).price(new BigDecimal("1.45")).build());

            assertThatThrownBy(() -> engine.releaseReservation("p1")).isInstanceOf(LifecycleTransitionException.class);
        }

        @Test
        @DisplayName("Concurrent reservations never exceed the phase position limit")
        void concurrentReservations() throws Exception {
            int threads = 16;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<AdmissionDecision>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    AdmissionRequest request = candidate("c" + i, "ZZQ" + (char) ('A' + i), "FUTURES_STRANGLES");
                    futures.add(executor.submit(() -> {
                        start.await();
                        return engine.admitAndReserve(request, account("32000", 0.1), market(SATURDAY, 18.0));
                    }));
                }
                start.countDown();

                int admitted = 0;
                for (Future<AdmissionDecision> future : futures) {
                    AdmissionDecision decision = future.get(5, TimeUnit.SECONDS);
                    if (decision.isAllowed()) {
                        admitted++;
                    } else {
                        assertThat(decision.getReason()).isEqualTo(AdmissionReason.MAX_POSITIONS);
                    }
                }

                assertThat(admitted).isEqualTo(6);
                assertThat(core.getPositionBook().trackedCount()).isEqualTo(6);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    // ==============================
    // HALT
    // ==============================

    @Nested
    @DisplayName("Halt on fatal data")
    class Halt {

        @Test
        @DisplayName("Missing VIX during the session halts the core until resumed")
        void fatalHalts() {
            MarketSnapshot noVix = MarketSnapshot.builder().asOf(MONDAY_MIDDAY).build();

            assertThatThrownBy(() -> engine.evaluateAdmission(candidate("p1", "GLD", "FRIDAY_0DTE"),
                    account("35000", 0.1), noVix))
                    .isInstanceOf(DataUnavailableException.class)
                    .satisfies(e -> assertThat(((DataUnavailableException) e).getSeverity())
                            .isEqualTo(DataSeverity.FATAL));

            assertThat(engine.isHalted()).isTrue();
            assertThat(engine.getHaltReason()).contains("FATAL data outage for VIX");
            verify(eventPublisherHelper).publishRiskEvent(
                    any(), eq(RiskEventType.CORE_HALTED), eq(RiskLevel.CRITICAL), anyString(), anyMap());

            MarketSnapshot healthy = MarketSnapshot.builder()
                    .asOf(MONDAY_MIDDAY)
                    .vix(MarketReading.value(18.0))
                    .underlyingPrice("GLD", MarketReading.value(230.0))
                    .build();
            assertThatThrownBy(() -> engine.evaluateAdmission(candidate("p1", "GLD", "FRIDAY_0DTE"),
                    account("35000", 0.1), healthy))
                    .isInstanceOf(DecisionCoreHaltedException.class);

            engine.resume();

            assertThat(engine.isHalted()).isFalse();
            assertThat(engine.evaluateAdmission(candidate("p1", "GLD", "FRIDAY_0DTE"), account("35000", 0.1), healthy)
                    .isAllowed()).isTrue();
        }

        @Test
        @DisplayName("Missing non-major underlying during the session fails the query without halting")
        void criticalDoesNotHalt() {
            MarketSnapshot withoutGld = market(MONDAY_MIDDAY, 18.0);

            assertThatThrownBy(() -> engine.evaluateAdmission(candidate("p1", "GLD", "FRIDAY_0DTE"),
                    account("35000", 0.1), withoutGld))
                    .isInstanceOf(DataUnavailableException.class);

            assertThat(engine.isHalted()).isFalse();
            verify(eventPublisherHelper, never()).publishRiskEvent(
                    any(), eq(RiskEventType.CORE_HALTED), any(), anyString(), anyMap());
        }
    }

    // ==============================
    // SIZING
    // ==============================

    @Nested
    @DisplayName("Sizing")
    class Sizing {

        @Test
        @DisplayName("Before the first tick no strategy is allowed")
        void beforeFirstTick() {
            SizingResult result = engine.sizePositionFromPriors("FRIDAY_0DTE");

            assertThat(result.getOutcome()).isEqualTo(SizingOutcome.STRATEGY_NOT_ALLOWED);
            assertThat(result.isShouldTrade()).isFalse();
        }

        @Test
        @DisplayName("Kelly fraction is capped at the phase's max risk per trade")
        void cappedAtPhaseRisk() {
            engine.deriveAccountState(account("35000", 0.1), market(SATURDAY, 18.0));

            SizingResult result = engine.sizePositionFromPriors("FRIDAY_0DTE");

            assertThat(result.getOutcome()).isEqualTo(SizingOutcome.CAPPED);
            assertThat(result.getRiskFraction()).isEqualTo(0.03);
        }

        @Test
        @DisplayName("Zero average loss never sizes a trade")
        void zeroAverageLoss() {
            engine.deriveAccountState(account("35000", 0.1), market(SATURDAY, 18.0));

            SizingResult result = engine.sizePosition("FRIDAY_0DTE", 0.9, 1.0, 0.0);

            assertThat(result.isShouldTrade()).isFalse();
            assertThat(result.getOutcome()).isEqualTo(SizingOutcome.DEGENERATE_INPUT);
        }
    }

    // ==============================
    // TICK AND LIFECYCLE
    // ==============================

    @Nested
    @DisplayName("Tick and lifecycle")
    class TickAndLifecycle {

        private void openShortPut(String id, String symbol, LocalDate expiry, int quantity) {
            AdmissionRequest request = AdmissionRequest.builder()
                    .positionId(id)
                    .symbol(symbol)
                    .strategy("LONG_TERM_112")
                    .quantity(quantity)
                    .entryPrice(new BigDecimal("2.00"))
                    .expiry(expiry)
                    .optionRight(OptionRight.PUT)
                    .strike(new BigDecimal("100"))
                    .build();
            assertThat(engine.admitAndReserve(request, account("50000", 0.1), market(SATURDAY, 16.0)).isAllowed())
                    .isTrue();
            engine.registerFill(FillDetails.builder()
                    .positionId(id).fillType(FillType.ENTRY).price(new BigDecimal("2.00")).build());
        }

        @Test
        @DisplayName("Emergency tick closes same-day expirations first and reduces the rest")
        void emergencyTick() {
            LocalDate today = SATURDAY.toLocalDate();
            openShortPut("p1", "GLD", today.plusDays(60), -4);
            openShortPut("p2", "CL", today, -2);

            TickReport report = engine.onTick(account("50000", 0.1), market(SATURDAY, 45.0));

            assertThat(report.getDirective().getLevel()).isEqualTo(ProtocolLevel.EMERGENCY);
            assertThat(report.getAccountState().getMaxBuyingPower()).isCloseTo(0.25 * 0.75, within(1e-9));
            assertThat(report.getInstructions()).extracting(LifecycleDecision::getAction)
                    .containsExactly(LifecycleAction.EMERGENCY_CLOSE, LifecycleAction.REDUCE);
            assertThat(report.getInstructions().get(1).getQuantity()).isEqualTo(2);
            assertThat(report.getDecisions()).hasSize(2);
            assertThat(report.getErrors()).isEmpty();
            assertThat(report.isHalted()).isFalse();
        }

        @Test
        @DisplayName("Calm tick holds positions outside the DTE window")
        void calmTick() {
            openShortPut("p1", "GLD", SATURDAY.toLocalDate().plusDays(60), -1);

            TickReport report = engine.onTick(account("50000", 0.1), market(SATURDAY, 16.0));

            assertThat(report.getInstructions()).isEmpty();
            assertThat(report.getDecisions()).extracting(LifecycleDecision::getAction).containsExactly(LifecycleAction.HOLD);
            assertThat(report.actionableCount()).isZero();
        }

        @Test
        @DisplayName("Position inside 21 DTE is defended and a defensive event is published")
        void defendPublishesEvent() {
            openShortPut("p1", "GLD", SATURDAY.toLocalDate().plusDays(21), -1);

            LifecycleDecision decision = engine.evaluatePositionLifecycle("p1", market(SATURDAY, 16.0));

            assertThat(decision.getAction()).isEqualTo(LifecycleAction.DEFEND);
            assertThat(decision.getState()).isEqualTo(LifecycleState.CHALLENGED);
            verify(eventPublisherHelper).publishRiskEvent(
                    any(), eq(RiskEventType.DEFENSIVE_ACTION), eq(RiskLevel.WARNING), anyString(), anyMap());
            assertThat(core.getMeterRegistry().get("thetaguard.lifecycle.actions").tag("action", "DEFEND")
                    .counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Protocol lookup by regime")
        void protocolByRegime() {
            assertThat(engine.currentProtocol(VixRegime.HIGH).isBlockNewEntries()).isTrue();
            assertThat(engine.currentProtocol().getLevel()).isEqualTo(ProtocolLevel.NORMAL);
        }
    }
}
