package com.thetaguard.unit.phase;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.thetaguard.event.EventPublisherHelper;
import com.thetaguard.fixtures.RiskParametersFixture;
import com.thetaguard.phase.PhaseManager;
import com.thetaguard.phase.PhaseMetrics;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PhaseManagerTest {

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private PhaseManager phaseManager;

    @BeforeEach
    void setUp() {
        phaseManager = new PhaseManager(RiskParametersFixture.provider(), eventPublisherHelper);
    }

    // ==============================
    // PHASE DETERMINATION
    // ==============================

    @Nested
    @DisplayName("Phase determination")
    class Determination {

        @Test
        @DisplayName("Thresholds at 30k, 40k, 60k and 75k")
        void thresholds() {
            assertThat(phaseManager.determinePhase(new BigDecimal("29999.99"))).isZero();
            assertThat(phaseManager.determinePhase(new BigDecimal("30000"))).isEqualTo(1);
            assertThat(phaseManager.determinePhase(new BigDecimal("39999"))).isEqualTo(1);
            assertThat(phaseManager.determinePhase(new BigDecimal("40000"))).isEqualTo(2);
            assertThat(phaseManager.determinePhase(new BigDecimal("60000"))).isEqualTo(3);
            assertThat(phaseManager.determinePhase(new BigDecimal("75000"))).isEqualTo(4);
            assertThat(phaseManager.determinePhase(new BigDecimal("5000000"))).isEqualTo(4);
        }

        @Test
        @DisplayName("Phase is non-decreasing in equity")
        void monotonic() {
            int previous = 0;
            for (int equity = 0; equity <= 120_000; equity += 250) {
                int phase = phaseManager.determinePhase(BigDecimal.valueOf(equity));
                assertThat(phase).isGreaterThanOrEqualTo(previous);
                previous = phase;
            }
            assertThat(previous).isEqualTo(4);
        }

        @Test
        @DisplayName("Transition publishes an event only when the phase changes")
        void transitionEvent() {
            phaseManager.updatePhase(new BigDecimal("35000"));
            phaseManager.updatePhase(new BigDecimal("36000"));
            verify(eventPublisherHelper, never()).publishPhaseTransition(any(), anyInt(), anyInt(), any());

            phaseManager.updatePhase(new BigDecimal("41000"));
            verify(eventPublisherHelper).publishPhaseTransition(any(), eq(1), eq(2), eq(new BigDecimal("41000")));
            assertThat(phaseManager.getCurrentPhase()).isEqualTo(2);
        }
    }

    // ==============================
    // STRATEGIES AND SIZE
    // ==============================

    @Nested
    @DisplayName("Strategy gating and position size")
    class Sizing {

        @Test
        @DisplayName("Allow-lists grow with the phase and phase 4 allows everything")
        void allowLists() {
            assertThat(phaseManager.isStrategyAllowed("FRIDAY_0DTE", 1)).isTrue();
            assertThat(phaseManager.isStrategyAllowed("IPMCC", 1)).isFalse();
            assertThat(phaseManager.isStrategyAllowed("IPMCC", 2)).isTrue();
            assertThat(phaseManager.isStrategyAllowed("RATIO_SPREADS", 2)).isFalse();
            assertThat(phaseManager.isStrategyAllowed("RATIO_SPREADS", 3)).isTrue();
            assertThat(phaseManager.isStrategyAllowed("ANYTHING_NEW", 4)).isTrue();
            assertThat(phaseManager.isStrategyAllowed("FRIDAY_0DTE", 0)).isFalse();
        }

        @Test
        @DisplayName("Size is the unit size when risk allows it")
        void unitSizeWhenRiskAllows() {
            // phase 2: 45,000 * 0.04 = 1,800 budget, 500 per unit -> 3, capped at unit size 2
            assertThat(phaseManager.calculatePositionSize("IPMCC", new BigDecimal("500"), new BigDecimal("45000")))
                    .isEqualTo(2);
        }

        @Test
        @DisplayName("Size is reduced to the risk cap")
        void reducedToRiskCap() {
            // phase 4: 80,000 * 0.05 = 4,000 budget, 1,500 per unit -> 2 (unit size 5)
            assertThat(phaseManager.calculatePositionSize("RATIO_SPREADS", new BigDecimal("1500"), new BigDecimal("80000")))
                    .isEqualTo(2);
        }

        @Test
        @DisplayName("Tiny risk per unit still yields the unit size")
        void tinyRiskAmount() {
            // 35,000 budget / 1e-7 per unit is far beyond the int range
            assertThat(phaseManager.calculatePositionSize(
                            "FRIDAY_0DTE", new BigDecimal("0.0000001"), new BigDecimal("35000")))
                    .isEqualTo(1);
        }

        @Test
        @DisplayName("Disallowed strategy, phase 0 or non-positive risk give 0")
        void zeroCases() {
            assertThat(phaseManager.calculatePositionSize("IPMCC", new BigDecimal("100"), new BigDecimal("35000")))
                    .isZero();
            assertThat(phaseManager.calculatePositionSize("FRIDAY_0DTE", new BigDecimal("100"), new BigDecimal("20000")))
                    .isZero();
            assertThat(phaseManager.calculatePositionSize("FRIDAY_0DTE", BigDecimal.ZERO, new BigDecimal("35000")))
                    .isZero();
        }

        @Test
        @DisplayName("Cached overload uses the equity of the last update")
        void cachedEquity() {
            assertThat(phaseManager.calculatePositionSize("FRIDAY_0DTE", new BigDecimal("100"))).isZero();

            phaseManager.updatePhase(new BigDecimal("35000"));

            assertThat(phaseManager.calculatePositionSize("FRIDAY_0DTE", new BigDecimal("100"))).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Phase metrics")
    class Metrics {

        @Test
        @DisplayName("Progress is measured towards the next threshold")
        void progress() {
            PhaseMetrics metrics = phaseManager.phaseMetrics(new BigDecimal("50000"));

            assertThat(metrics.getPhase()).isEqualTo(2);
            assertThat(metrics.getNextPhaseEquity()).isEqualByComparingTo("60000");
            assertThat(metrics.getProgressPercent()).isEqualTo(50.0);
            assertThat(metrics.getMaxPositions()).isEqualTo(10);
        }

        @Test
        @DisplayName("Top phase reports 100% and no next threshold")
        void topPhase() {
            PhaseMetrics metrics = phaseManager.phaseMetrics(new BigDecimal("90000"));

            assertThat(metrics.getPhase()).isEqualTo(4);
            assertThat(metrics.getNextPhaseEquity()).isNull();
            assertThat(metrics.getProgressPercent()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Below minimum reports progress towards phase 1")
        void belowMinimum() {
            PhaseMetrics metrics = phaseManager.phaseMetrics(new BigDecimal("15000"));

            assertThat(metrics.getPhase()).isZero();
            assertThat(metrics.getAllowedStrategies()).isEmpty();
            assertThat(metrics.getProgressPercent()).isEqualTo(50.0);
        }
    }
}
