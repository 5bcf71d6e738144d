package com.thetaguard.marketdata;

import com.thetaguard.domain.vo.MarketReading;
import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Boundary to the data-quality collaborator: turns a raw observed value into a
 * {@link MarketReading}. Freshness and plausibility checks live behind this interface.
 */
public interface MarketDataQualityGate {

    /**
     * @param rawValue the observed value, null when the feed reported nothing
     * @param observedAt when the value was observed, null when unknown
     * @param now decision time
     */
    MarketReading assess(String instrument, Double rawValue, Instant observedAt, ZonedDateTime now);
}
