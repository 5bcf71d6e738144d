package com.thetaguard.lifecycle;

import com.thetaguard.domain.model.OptionContract;
import java.time.LocalDate;
import java.util.List;

/**
 * Boundary to the market-data layer for roll candidates. Implementations return already-resolved
 * contracts; the decision core never waits on a feed.
 */
public interface OptionChainProvider {

    /** Listed contracts on {@code underlying} expiring between the two dates, inclusive. */
    List<OptionContract> contracts(String underlying, LocalDate fromExpiry, LocalDate toExpiry);
}
