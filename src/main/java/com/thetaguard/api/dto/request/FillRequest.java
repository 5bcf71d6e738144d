package com.thetaguard.api.dto.request;

import com.thetaguard.domain.enums.FillType;
import com.thetaguard.domain.enums.OptionRight;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Execution report from the broker. Expiry, strike and right describe the new contract on a
 * ROLL fill; quantity is the number of units cut on a REDUCE fill.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FillRequest {

    @NotBlank(message = "Position id is required")
    private String positionId;

    @NotNull(message = "Fill type is required")
    private FillType fillType;

    @PositiveOrZero(message = "Quantity must not be negative")
    private int quantity;

    private BigDecimal price;
    private LocalDate expiry;
    private BigDecimal strike;
    private OptionRight optionRight;
    private Instant filledAt;
}
