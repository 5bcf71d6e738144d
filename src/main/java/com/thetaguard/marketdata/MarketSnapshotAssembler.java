package com.thetaguard.marketdata;

import com.thetaguard.api.dto.request.MarketSnapshotDto;
import com.thetaguard.domain.model.MarketSnapshot;
import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link MarketSnapshot} from raw feed values, running every value through the
 * {@link MarketDataQualityGate}. Times are moved into the exchange zone.
 */
@Component
public class MarketSnapshotAssembler {

    private final MarketDataQualityGate marketDataQualityGate;
    private final Clock decisionClock;

    public MarketSnapshotAssembler(MarketDataQualityGate marketDataQualityGate, Clock decisionClock) {
        this.marketDataQualityGate = marketDataQualityGate;
        this.decisionClock = decisionClock;
    }

    public MarketSnapshot assemble(MarketSnapshotDto dto) {
        ZonedDateTime asOf = dto.getAsOf() != null
                ? dto.getAsOf().withZoneSameInstant(decisionClock.getZone())
                : ZonedDateTime.now(decisionClock);
        Instant observedAt = dto.getObservedAt() != null ? dto.getObservedAt() : asOf.toInstant();

        MarketSnapshot.MarketSnapshotBuilder builder = MarketSnapshot.builder()
                .asOf(asOf)
                .vix(marketDataQualityGate.assess(SessionAwareDataQualityGate.VIX, dto.getVix(), observedAt, asOf));
        if (dto.getUnderlyingPrices() != null) {
            dto.getUnderlyingPrices().forEach((symbol, price) -> builder.underlyingPrice(
                    symbol, marketDataQualityGate.assess(symbol, price, observedAt, asOf)));
        }
        if (dto.getOptionMarks() != null) {
            dto.getOptionMarks().forEach((positionId, mark) -> builder.optionMark(
                    positionId, marketDataQualityGate.assess(positionId, mark, observedAt, asOf)));
        }
        return builder.build();
    }
}
