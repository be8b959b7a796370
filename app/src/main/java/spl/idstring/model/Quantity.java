package spl.idstring.model;

/**
 * Amount of a polymer: a numerator (single value or range) over a denominator with unit.
 * {@link #toString()} yields the rendered form used in identifier strings.
 */
public interface Quantity {

    String denominator();

    String unit();
}
