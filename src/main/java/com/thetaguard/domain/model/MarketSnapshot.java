package com.thetaguard.domain.model;

import com.thetaguard.domain.vo.MarketReading;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Point-in-time market values supplied by the market-data layer.
 *
 * <p>Underlying prices are keyed by symbol, option marks by position id. A key that is absent
 * means the feed did not report it at all; the engine classifies that by time of day.
 */
@Getter
@Builder
public class MarketSnapshot {

    private final ZonedDateTime asOf;
    private final MarketReading vix;

    @Singular
    private final Map<String, MarketReading> underlyingPrices;

    @Singular
    private final Map<String, MarketReading> optionMarks;

    public Optional<MarketReading> underlying(String symbol) {
        return Optional.ofNullable(underlyingPrices.get(symbol));
    }

    public Optional<MarketReading> optionMark(String positionId) {
        return Optional.ofNullable(optionMarks.get(positionId));
    }
}
