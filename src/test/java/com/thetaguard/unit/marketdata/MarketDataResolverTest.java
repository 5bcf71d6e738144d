package com.thetaguard.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.thetaguard.config.MarketSessionProperties;
import com.thetaguard.domain.enums.DataSeverity;
import com.thetaguard.domain.vo.MarketReading;
import com.thetaguard.event.EventPublisherHelper;
import com.thetaguard.event.RiskEventType;
import com.thetaguard.event.RiskLevel;
import com.thetaguard.exception.DataUnavailableException;
import com.thetaguard.marketdata.DataSeverityClassifier;
import com.thetaguard.marketdata.MarketDataResolver;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.OptionalDouble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MarketDataResolverTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    private static final ZonedDateTime SATURDAY = ZonedDateTime.of(2026, 10, 17, 12, 0, 0, 0, NEW_YORK);
    private static final ZonedDateTime MONDAY_MIDDAY = ZonedDateTime.of(2026, 10, 19, 12, 0, 0, 0, NEW_YORK);

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private MarketDataResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new MarketDataResolver(new DataSeverityClassifier(new MarketSessionProperties()), eventPublisherHelper);
    }

    @Test
    @DisplayName("Good values pass through and are remembered")
    void valuePassesThrough() {
        OptionalDouble value = resolver.resolve("GLD", "GLD", Optional.of(MarketReading.value(230.5)), MONDAY_MIDDAY);

        assertThat(value).hasValue(230.5);
        assertThat(resolver.resolve("GLD", "GLD", Optional.empty(), SATURDAY)).hasValue(230.5);
    }

    @Test
    @DisplayName("Degraded values are usable")
    void degradedUsable() {
        OptionalDouble value = resolver.resolve(
                "GLD", "GLD", Optional.of(MarketReading.degraded(229.0, "stale by 90s")), MONDAY_MIDDAY);

        assertThat(value).hasValue(229.0);
    }

    @Test
    @DisplayName("Expected gap with no history resolves to nothing, never to zero")
    void expectedGapWithoutHistory() {
        assertThat(resolver.resolve("GLD", "GLD", Optional.empty(), SATURDAY)).isEmpty();
        verifyNoInteractions(eventPublisherHelper);
    }

    @Test
    @DisplayName("Required value with no history is an error even when the gap is expected")
    void requiredWithoutHistory() {
        assertThatThrownBy(() -> resolver.resolveRequired("VIX", "VIX", Optional.empty(), SATURDAY))
                .isInstanceOf(DataUnavailableException.class)
                .satisfies(e -> assertThat(((DataUnavailableException) e).getSeverity()).isEqualTo(DataSeverity.EXPECTED));
    }

    @Test
    @DisplayName("Critical gap raises and publishes a warning event")
    void criticalGap() {
        resolver.resolve("GLD", "GLD", Optional.of(MarketReading.value(230.0)), MONDAY_MIDDAY);

        assertThatThrownBy(() -> resolver.resolve("GLD", "GLD", Optional.empty(), MONDAY_MIDDAY))
                .isInstanceOf(DataUnavailableException.class)
                .satisfies(e -> assertThat(((DataUnavailableException) e).getSeverity()).isEqualTo(DataSeverity.CRITICAL));
        verify(eventPublisherHelper).publishRiskEvent(
                any(), eq(RiskEventType.DATA_UNAVAILABLE), eq(RiskLevel.WARNING), anyString(), anyMap());
    }

    @Test
    @DisplayName("Missing major index during the session is fatal")
    void fatalGap() {
        MarketReading unavailable = MarketReading.unavailable(DataSeverity.FATAL, "feed down");

        assertThatThrownBy(() -> resolver.resolve("VIX", "VIX", Optional.of(unavailable), MONDAY_MIDDAY))
                .isInstanceOf(DataUnavailableException.class)
                .satisfies(e -> assertThat(((DataUnavailableException) e).getSeverity()).isEqualTo(DataSeverity.FATAL));
        verify(eventPublisherHelper).publishRiskEvent(
                any(), eq(RiskEventType.DATA_UNAVAILABLE), eq(RiskLevel.CRITICAL), anyString(), anyMap());
    }

    @Test
    @DisplayName("Forgotten keys lose their last known value")
    void forget() {
        resolver.resolve("mark:p1", "SPY", Optional.of(MarketReading.value(1.25)), MONDAY_MIDDAY);

        resolver.forget("mark:p1");

        assertThat(resolver.resolve("mark:p1", "SPY", Optional.empty(), SATURDAY)).isEmpty();
    }
}
