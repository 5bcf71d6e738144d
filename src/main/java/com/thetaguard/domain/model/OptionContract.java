package com.thetaguard.domain.model;

import com.thetaguard.domain.enums.OptionRight;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionContract {

    private String underlying;
    private LocalDate expiry;
    private BigDecimal strike;
    private OptionRight right;
    private BigDecimal mark;
}
