package com.thetaguard.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import lombok.Data;

/**
 * Kelly sizing inputs. When winRate, averageWin and averageLoss are all omitted the strategy's
 * configured priors are used. Degenerate values are not rejected here: the sizer answers them
 * with shouldTrade=false.
 */
@Data
public class SizingRequest {

    @NotBlank(message = "Strategy is required")
    private String strategy;

    private Double winRate;
    private Double averageWin;
    private Double averageLoss;

    /** Optional; with maxLossPerContract, yields a whole-contract recommendation. */
    private BigDecimal equity;

    private BigDecimal maxLossPerContract;

    public boolean usesPriors() {
        return winRate == null && averageWin == null && averageLoss == null;
    }
}
