package com.thetaguard.api.dto.response;

import com.thetaguard.domain.enums.LifecycleState;
import com.thetaguard.domain.enums.OptionRight;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionResponse {

    private String id;
    private String symbol;
    private String strategy;
    private int quantity;
    private BigDecimal entryPrice;
    private BigDecimal currentMark;
    private LocalDate expiry;
    private OptionRight optionRight;
    private BigDecimal strike;
    private String correlationGroup;
    private LifecycleState lifecycleState;
    private Instant lastUpdated;
}
