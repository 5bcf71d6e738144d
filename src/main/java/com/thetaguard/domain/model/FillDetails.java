package com.thetaguard.domain.model;

import com.thetaguard.domain.enums.FillType;
import com.thetaguard.domain.enums.OptionRight;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Execution report from the execution layer.
 *
 * <ul>
 *   <li>ENTRY: confirms a reserved position at {@code price}</li>
 *   <li>ROLL: the position now holds the contract described by expiry/strike/right, opened at {@code price}</li>
 *   <li>CLOSE: the position is flat</li>
 *   <li>REDUCE: {@code quantity} units were bought back or sold (unsigned)</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FillDetails {

    private String positionId;
    private FillType fillType;
    private int quantity;
    private BigDecimal price;
    private LocalDate expiry;
    private BigDecimal strike;
    private OptionRight optionRight;
    private Instant filledAt;
}
