package com.thetaguard.marketdata;

import com.thetaguard.domain.enums.DataSeverity;
import com.thetaguard.domain.vo.MarketReading;
import com.thetaguard.event.EventPublisherHelper;
import com.thetaguard.event.RiskEventType;
import com.thetaguard.event.RiskLevel;
import com.thetaguard.exception.DataUnavailableException;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves a {@link MarketReading} into a number a decision can use, according to severity:
 * EXPECTED and WARNING fall back to the last good value (or nothing), CRITICAL and FATAL raise
 * {@link DataUnavailableException}. Good values are remembered per key.
 */
@Component
public class MarketDataResolver {

    private static final Logger log = LoggerFactory.getLogger(MarketDataResolver.class);

    private final DataSeverityClassifier dataSeverityClassifier;
    private final EventPublisherHelper eventPublisherHelper;
    private final Map<String, Double> lastKnown = new ConcurrentHashMap<>();

    public MarketDataResolver(DataSeverityClassifier dataSeverityClassifier, EventPublisherHelper eventPublisherHelper) {
        this.dataSeverityClassifier = dataSeverityClassifier;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * @param key cache key for the last good value, e.g. the symbol or "mark:" + position id
     * @param instrument instrument name used for severity classification
     * @param reading the reading, empty when the feed did not report the instrument at all
     * @return the value to decide with, empty when only a tolerable gap remains
     */
    public OptionalDouble resolve(String key, String instrument, Optional<MarketReading> reading, ZonedDateTime at) {
        MarketReading resolved = reading.orElseGet(() ->
                MarketReading.unavailable(dataSeverityClassifier.classify(instrument, at), "not reported"));

        return resolved.match(
                value -> {
                    lastKnown.put(key, value);
                    return OptionalDouble.of(value);
                },
                (value, reason) -> {
                    log.warn("Degraded value for {}: {} ({})", instrument, value, reason);
                    lastKnown.put(key, value);
                    return OptionalDouble.of(value);
                },
                unavailable -> fallback(key, instrument, unavailable));
    }

    /** As {@link #resolve}, but a tolerable gap with no last value is also an error. */
    public double resolveRequired(String key, String instrument, Optional<MarketReading> reading, ZonedDateTime at) {
        OptionalDouble value = resolve(key, instrument, reading, at);
        if (value.isEmpty()) {
            throw new DataUnavailableException(
                    instrument, dataSeverityClassifier.classify(instrument, at), "no current or last known value");
        }
        return value.getAsDouble();
    }

    public LocalDate tradeDate(ZonedDateTime at) {
        return dataSeverityClassifier.tradeDate(at);
    }

    public void forget(String key) {
        lastKnown.remove(key);
    }

    private OptionalDouble fallback(String key, String instrument, MarketReading.Unavailable unavailable) {
        DataSeverity severity = unavailable.getSeverity();
        if (!severity.allowsFallback()) {
            log.error("{} data unavailable for {}: {}", severity, instrument, unavailable.getReason());
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.DATA_UNAVAILABLE,
                    severity == DataSeverity.FATAL ? RiskLevel.CRITICAL : RiskLevel.WARNING,
                    "Market data unavailable for " + instrument + ": " + unavailable.getReason(),
                    Map.of("instrument", instrument, "severity", severity.name()));
            throw new DataUnavailableException(instrument, severity, unavailable.getReason());
        }

        Double last = lastKnown.get(key);
        if (last != null) {
            log.info("{} gap for {} ({}), using last known {}", severity, instrument, unavailable.getReason(), last);
            return OptionalDouble.of(last);
        }
        log.info("{} gap for {} ({}), no last known value", severity, instrument, unavailable.getReason());
        return OptionalDouble.empty();
    }
}
