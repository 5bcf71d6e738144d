package com.thetaguard.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;

import com.thetaguard.config.MarketSessionProperties;
import com.thetaguard.domain.enums.DataSeverity;
import com.thetaguard.domain.vo.MarketReading;
import com.thetaguard.fixtures.RiskParametersFixture;
import com.thetaguard.marketdata.DataSeverityClassifier;
import com.thetaguard.marketdata.SessionAwareDataQualityGate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SessionAwareDataQualityGateTest {

    private static final ZonedDateTime MONDAY_MIDDAY =
            ZonedDateTime.of(2026, 10, 19, 12, 0, 0, 0, ZoneId.of("America/New_York"));

    private SessionAwareDataQualityGate gate;

    @BeforeEach
    void setUp() {
        MarketSessionProperties properties = new MarketSessionProperties();
        gate = new SessionAwareDataQualityGate(
                new DataSeverityClassifier(properties), properties, RiskParametersFixture.provider());
    }

    @Test
    @DisplayName("Fresh finite value is a VALUE")
    void freshValue() {
        MarketReading reading = gate.assess("VIX", 18.2, MONDAY_MIDDAY.minusSeconds(5).toInstant(), MONDAY_MIDDAY);

        assertThat(reading).isEqualTo(MarketReading.value(18.2));
    }

    @Test
    @DisplayName("Stale value is DEGRADED with its age")
    void staleValue() {
        MarketReading reading = gate.assess("GLD", 230.0, MONDAY_MIDDAY.minusSeconds(90).toInstant(), MONDAY_MIDDAY);

        assertThat(reading).isEqualTo(MarketReading.degraded(230.0, "stale by 90s"));
        assertThat(reading.asOptional()).hasValue(230.0);
    }

    @Test
    @DisplayName("Missing value is unavailable with the session severity")
    void missingValue() {
        MarketReading reading = gate.assess("VIX", null, null, MONDAY_MIDDAY);

        assertThat(reading).isInstanceOf(MarketReading.Unavailable.class);
        assertThat(((MarketReading.Unavailable) reading).getSeverity()).isEqualTo(DataSeverity.FATAL);
        assertThat(reading.isAvailable()).isFalse();
    }

    @Test
    @DisplayName("Non-finite, non-positive and implausible VIX values are unavailable")
    void invalidValues() {
        assertThat(gate.assess("GLD", Double.NaN, null, MONDAY_MIDDAY).isAvailable()).isFalse();
        assertThat(gate.assess("GLD", 0.0, null, MONDAY_MIDDAY).isAvailable()).isFalse();
        assertThat(gate.assess("VIX", 3.0, null, MONDAY_MIDDAY).isAvailable()).isFalse();
        assertThat(gate.assess("GLD", 3.0, null, MONDAY_MIDDAY).isAvailable()).isTrue();
    }
}
