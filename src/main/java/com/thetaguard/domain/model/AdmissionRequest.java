package com.thetaguard.domain.model;

import com.thetaguard.domain.enums.OptionRight;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A candidate entry. Only symbol and strategy matter for the admission decision; the remaining
 * fields describe the position that gets reserved when the candidate is admitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdmissionRequest {

    private String positionId;
    private String symbol;
    private String strategy;
    private int quantity;
    private BigDecimal entryPrice;
    private LocalDate expiry;
    private OptionRight optionRight;
    private BigDecimal strike;
    private BigDecimal maxLoss;
}
