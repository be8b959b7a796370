package spl.idstring.model;

import java.util.Objects;

/**
 * Single-valued quantity, rendered {@code numerator:denominator:unit}.
 */
public record PointQuantity(String numerator, String denominator, String unit) implements Quantity {

    public PointQuantity {
        Objects.requireNonNull(numerator, "numerator");
        Objects.requireNonNull(denominator, "denominator");
        Objects.requireNonNull(unit, "unit");
    }

    @Override
    public String toString() {
        return numerator + ":" + denominator + ":" + unit;
    }
}
