package com.thetaguard.api.dto.request;

import com.thetaguard.domain.enums.OptionRight;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Candidate entry plus the account and market context to decide it against. With
 * {@code reserve=true} an admitted candidate is reserved as PENDING.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdmissionRequestDto {

    @NotBlank(message = "Position id is required")
    private String positionId;

    @NotBlank(message = "Symbol is required")
    private String symbol;

    @NotBlank(message = "Strategy is required")
    private String strategy;

    private int quantity;
    private BigDecimal entryPrice;
    private LocalDate expiry;
    private OptionRight optionRight;
    private BigDecimal strike;
    private BigDecimal maxLoss;

    private boolean reserve;

    @Valid
    @NotNull(message = "Account snapshot is required")
    private AccountSnapshotDto account;

    @Valid
    @NotNull(message = "Market snapshot is required")
    private MarketSnapshotDto market;
}
