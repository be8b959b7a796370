package spl.idstring.model;

import java.util.Objects;

/**
 * Ranged quantity, rendered in interval notation, e.g. {@code [1,5):1:mol}.
 */
public record QuantityRange(String low, boolean lowInclusive, String high, boolean highInclusive,
                            String denominator, String unit) implements Quantity {

    public QuantityRange {
        Objects.requireNonNull(low, "low");
        Objects.requireNonNull(high, "high");
        Objects.requireNonNull(denominator, "denominator");
        Objects.requireNonNull(unit, "unit");
    }

    @Override
    public String toString() {
        return (lowInclusive ? "[" : "(") + low + "," + high + (highInclusive ? "]" : ")")
                + ":" + denominator + ":" + unit;
    }
}
