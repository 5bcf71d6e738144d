package com.thetaguard.marketdata;

import com.thetaguard.config.MarketSessionProperties;
import com.thetaguard.domain.enums.DataSeverity;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Decides how serious a missing value is from when it went missing.
 *
 * <pre>
 * weekend / holiday / outside 09:30-16:00   EXPECTED
 * first warm-up minutes after the open       WARNING
 * active session                             CRITICAL
 * active session, major index                FATAL
 * </pre>
 */
@Component
public class DataSeverityClassifier {

    private final MarketSessionProperties marketSessionProperties;

    public DataSeverityClassifier(MarketSessionProperties marketSessionProperties) {
        this.marketSessionProperties = marketSessionProperties;
    }

    public DataSeverity classify(String instrument, ZonedDateTime at) {
        ZonedDateTime local = at.withZoneSameInstant(ZoneId.of(marketSessionProperties.getZone()));
        if (!isSessionOpen(local)) {
            return DataSeverity.EXPECTED;
        }
        LocalTime warmupEnd = marketSessionProperties.getOpen().plusMinutes(marketSessionProperties.getWarmupMinutes());
        if (!local.toLocalTime().isAfter(warmupEnd)) {
            return DataSeverity.WARNING;
        }
        return isMajorIndex(instrument) ? DataSeverity.FATAL : DataSeverity.CRITICAL;
    }

    /** Calendar date of {@code at} in the exchange time zone; days to expiry count from it. */
    public LocalDate tradeDate(ZonedDateTime at) {
        return at.withZoneSameInstant(ZoneId.of(marketSessionProperties.getZone())).toLocalDate();
    }

    public boolean isSessionOpen(ZonedDateTime local) {
        if (!isTradingDay(local.toLocalDate())) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        return !time.isBefore(marketSessionProperties.getOpen()) && time.isBefore(marketSessionProperties.getClose());
    }

    public boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        return !marketSessionProperties.getHolidays().contains(date);
    }

    public boolean isMajorIndex(String instrument) {
        String normalized = instrument.trim().toUpperCase(Locale.ROOT);
        return marketSessionProperties.getMajorIndices().stream().anyMatch(normalized::equals);
    }
}
