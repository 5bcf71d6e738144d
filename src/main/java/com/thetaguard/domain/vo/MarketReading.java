package com.thetaguard.domain.vo;

import com.thetaguard.domain.enums.DataSeverity;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.BiFunction;
import java.util.function.DoubleFunction;
import java.util.function.Function;

/**
 * Result of a market-data query: a trustworthy value, a usable but degraded value, or nothing.
 *
 * <p>There is no numeric default for the unavailable case. Callers go through {@link #match}
 * and decide explicitly what a missing value means for them.
 */
public abstract class MarketReading {

    private MarketReading() {}

    public static MarketReading value(double value) {
        return new Value(value);
    }

    public static MarketReading degraded(double value, String reason) {
        return new Degraded(value, reason);
    }

    public static MarketReading unavailable(DataSeverity severity, String reason) {
        return new Unavailable(severity, reason);
    }

    public abstract <R> R match(
            DoubleFunction<R> onValue,
            BiFunction<Double, String, R> onDegraded,
            Function<Unavailable, R> onUnavailable);

    /** The numeric value for VALUE and DEGRADED readings, empty when unavailable. */
    public OptionalDouble asOptional() {
        return match(OptionalDouble::of, (v, reason) -> OptionalDouble.of(v), u -> OptionalDouble.empty());
    }

    public boolean isAvailable() {
        return asOptional().isPresent();
    }

    public static final class Value extends MarketReading {
        private final double value;

        private Value(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public <R> R match(
                DoubleFunction<R> onValue,
                BiFunction<Double, String, R> onDegraded,
                Function<Unavailable, R> onUnavailable) {
            return onValue.apply(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Value && Double.compare(((Value) o).value, value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return "Value(" + value + ")";
        }
    }

    public static final class Degraded extends MarketReading {
        private final double value;
        private final String reason;

        private Degraded(double value, String reason) {
            this.value = value;
            this.reason = reason;
        }

        public double getValue() {
            return value;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public <R> R match(
                DoubleFunction<R> onValue,
                BiFunction<Double, String, R> onDegraded,
                Function<Unavailable, R> onUnavailable) {
            return onDegraded.apply(value, reason);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Degraded)) {
                return false;
            }
            Degraded other = (Degraded) o;
            return Double.compare(other.value, value) == 0 && Objects.equals(other.reason, reason);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, reason);
        }

        @Override
        public String toString() {
            return "Degraded(" + value + ", " + reason + ")";
        }
    }

    public static final class Unavailable extends MarketReading {
        private final DataSeverity severity;
        private final String reason;

        private Unavailable(DataSeverity severity, String reason) {
            this.severity = Objects.requireNonNull(severity, "severity");
            this.reason = reason;
        }

        public DataSeverity getSeverity() {
            return severity;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public <R> R match(
                DoubleFunction<R> onValue,
                BiFunction<Double, String, R> onDegraded,
                Function<Unavailable, R> onUnavailable) {
            return onUnavailable.apply(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Unavailable)) {
                return false;
            }
            Unavailable other = (Unavailable) o;
            return other.severity == severity && Objects.equals(other.reason, reason);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, reason);
        }

        @Override
        public String toString() {
            return "Unavailable(" + severity + ", " + reason + ")";
        }
    }
}
