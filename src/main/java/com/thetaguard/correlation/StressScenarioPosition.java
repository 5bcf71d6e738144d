package com.thetaguard.correlation;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A hypothetical position for a stress replay: symbol and the money it can lose outright. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StressScenarioPosition {

    private String symbol;
    private BigDecimal maxLoss;

    public static StressScenarioPosition of(String symbol, BigDecimal maxLoss) {
        return new StressScenarioPosition(symbol, maxLoss);
    }
}
