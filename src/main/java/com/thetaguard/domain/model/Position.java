package com.thetaguard.domain.model;

import com.thetaguard.domain.enums.LifecycleState;
import com.thetaguard.domain.enums.OptionRight;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A position tracked by the decision core, from admission reservation to confirmed close.
 *
 * <p>Quantity is signed: positive = long (debit paid), negative = short (credit received).
 * {@code entryPrice} is the per-unit premium at entry, {@code currentMark} the latest per-unit
 * price to close. Option-only fields ({@code optionRight}, {@code strike}) are null for
 * futures and stock positions.
 *
 * <p>Instances held by the {@code PositionBook} are never handed out directly; readers get copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String symbol;
    private String strategy;

    /** Signed quantity: positive = long, negative = short. */
    private int quantity;

    private BigDecimal entryPrice;
    private BigDecimal currentMark;

    private LocalDate expiry;
    private OptionRight optionRight;
    private BigDecimal strike;

    /** Worst-case loss in account currency, used by stress tests. Null when unknown. */
    private BigDecimal maxLoss;

    /** Correlation group id resolved at admission, null for unmapped symbols. */
    private String correlationGroup;

    private LifecycleState lifecycleState;

    private Instant entryTime;
    private Instant lastUpdated;

    public boolean isShort() {
        return quantity < 0;
    }

    public boolean isOption() {
        return optionRight != null && strike != null;
    }

    public long daysToExpiry(LocalDate today) {
        return ChronoUnit.DAYS.between(today, expiry);
    }
}
