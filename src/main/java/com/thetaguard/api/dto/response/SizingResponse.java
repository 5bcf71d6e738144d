package com.thetaguard.api.dto.response;

import com.thetaguard.domain.enums.SizingOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Sizing answer. {@code shouldTrade} is authoritative; a zero {@code riskFraction} alone never
 * means "trade".
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SizingResponse {

    private String strategy;
    private boolean shouldTrade;
    private double riskFraction;
    private SizingOutcome outcome;
    private Double rawKelly;
    private String reason;
    private String error;

    /** Null unless the request carried equity and maxLossPerContract. */
    private Integer recommendedContracts;
}
