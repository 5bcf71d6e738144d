package com.thetaguard.api.dto.request;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw market values as reported by the feed. Missing or invalid values are classified by the
 * quality gate, not rejected here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketSnapshotDto {

    /** Decision time; defaults to now in the exchange zone. */
    private ZonedDateTime asOf;

    /** When the values were observed; defaults to {@code asOf}. */
    private Instant observedAt;

    private Double vix;

    @Builder.Default
    private Map<String, Double> underlyingPrices = new HashMap<>();

    /** Option marks keyed by position id. */
    @Builder.Default
    private Map<String, Double> optionMarks = new HashMap<>();
}
