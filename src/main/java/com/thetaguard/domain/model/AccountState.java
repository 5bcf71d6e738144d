package com.thetaguard.domain.model;

import com.thetaguard.domain.enums.ProtocolLevel;
import com.thetaguard.domain.enums.VixRegime;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Account view re-derived on every tick from equity and live margin usage. Never persisted.
 */
@Getter
@Builder
@ToString
public class AccountState {

    private final String accountId;
    private final BigDecimal equity;
    private final int phase;
    private final VixRegime regime;
    private final double vix;

    /** Maximum buying-power fraction for (phase, regime), after any protocol headroom cut. */
    private final double maxBuyingPower;

    private final double buyingPowerUsed;
    private final ProtocolLevel protocolLevel;
}
