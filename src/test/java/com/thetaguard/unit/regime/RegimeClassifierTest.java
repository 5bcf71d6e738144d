package com.thetaguard.unit.regime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.thetaguard.domain.enums.CoarseRegime;
import com.thetaguard.domain.enums.VixRegime;
import com.thetaguard.fixtures.RiskParametersFixture;
import com.thetaguard.regime.RegimeAssessment;
import com.thetaguard.regime.RegimeClassifier;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RegimeClassifierTest {

    private RegimeClassifier regimeClassifier;

    @BeforeEach
    void setUp() {
        regimeClassifier = new RegimeClassifier(RiskParametersFixture.provider());
    }

    @Nested
    @DisplayName("Band classification")
    class Classification {

        @Test
        @DisplayName("Readings map to the five bands")
        void mapsReadingsToBands() {
            assertThat(regimeClassifier.classify(12.0)).isEqualTo(VixRegime.VERY_LOW);
            assertThat(regimeClassifier.classify(17.5)).isEqualTo(VixRegime.LOW);
            assertThat(regimeClassifier.classify(24.9)).isEqualTo(VixRegime.NORMAL);
            assertThat(regimeClassifier.classify(35.0)).isEqualTo(VixRegime.HIGH);
            assertThat(regimeClassifier.classify(65.7)).isEqualTo(VixRegime.VERY_HIGH);
        }

        @Test
        @DisplayName("A reading exactly on a boundary belongs to the higher band")
        void boundaryBelongsToHigherBand() {
            assertThat(regimeClassifier.classify(15.0)).isEqualTo(VixRegime.LOW);
            assertThat(regimeClassifier.classify(20.0)).isEqualTo(VixRegime.NORMAL);
            assertThat(regimeClassifier.classify(30.0)).isEqualTo(VixRegime.HIGH);
            assertThat(regimeClassifier.classify(40.0)).isEqualTo(VixRegime.VERY_HIGH);
            assertThat(regimeClassifier.classify(19.999)).isEqualTo(VixRegime.LOW);
        }

        @Test
        @DisplayName("Repeated classification of 20.0 never flips")
        void boundaryIsStable() {
            assertThat(IntStream.range(0, 1000).mapToObj(i -> regimeClassifier.classify(20.0)).distinct())
                    .containsExactly(VixRegime.NORMAL);
        }

        @Test
        @DisplayName("Invalid readings are rejected, not defaulted")
        void rejectsInvalidReadings() {
            assertThatThrownBy(() -> regimeClassifier.classify(Double.NaN))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> regimeClassifier.classify(2.0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(regimeClassifier.isValidReading(Double.POSITIVE_INFINITY)).isFalse();
            assertThat(regimeClassifier.isValidReading(5.0)).isTrue();
        }
    }

    @Nested
    @DisplayName("Buying power and coarse regime")
    class BuyingPower {

        @Test
        @DisplayName("Max buying power comes from the (regime, phase) table")
        void lookupTable() {
            assertThat(regimeClassifier.maxBuyingPower(VixRegime.LOW, 2)).isEqualTo(0.60);
            assertThat(regimeClassifier.maxBuyingPower(VixRegime.VERY_HIGH, 4)).isEqualTo(0.35);
            assertThat(regimeClassifier.maxBuyingPower(VixRegime.NORMAL, 1)).isEqualTo(0.40);
        }

        @Test
        @DisplayName("Phase 0 gets no buying power in any regime")
        void phaseZeroGetsNothing() {
            for (VixRegime regime : VixRegime.values()) {
                assertThat(regimeClassifier.maxBuyingPower(regime, 0)).isZero();
            }
        }

        @Test
        @DisplayName("Coarse regime switches to HIGH at 25")
        void coarseRegime() {
            assertThat(regimeClassifier.classifyCoarse(24.99)).isEqualTo(CoarseRegime.NORMAL);
            assertThat(regimeClassifier.classifyCoarse(25.0)).isEqualTo(CoarseRegime.HIGH);
        }

        @Test
        @DisplayName("Assessment bundles regime, budget and posture")
        void assessment() {
            RegimeAssessment assessment = regimeClassifier.assess(32.0, 3);

            assertThat(assessment.getRegime()).isEqualTo(VixRegime.HIGH);
            assertThat(assessment.getCoarseRegime()).isEqualTo(CoarseRegime.HIGH);
            assertThat(assessment.getMaxBuyingPower()).isEqualTo(0.40);
            assertThat(assessment.getPosture()).isEqualTo(VixRegime.HIGH.getPosture());
        }
    }
}
