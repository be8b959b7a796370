package spl.idstring.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Auxiliary substance (irregular amino acid, polymer) referenced by chain substitutions.
 */
public final class Polymer extends CanonicalEntity {

    static final Comparator<Polymer> ORDER = Comparator
            .comparing((Polymer polymer) -> polymer.value().orElse(null), Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(Polymer::code);

    private final String code;
    private final String value;
    private final List<ConnectionPoint> connectionPoints;
    private final Quantity quantity;

    public Polymer(String code, String value, List<ConnectionPoint> connectionPoints, Quantity quantity) {
        this.code = Objects.requireNonNull(code, "code");
        this.value = value;
        this.connectionPoints = connectionPoints == null
                ? List.of()
                : connectionPoints.stream().sorted().collect(Collectors.toUnmodifiableList());
        this.quantity = quantity;
    }

    public String code() {
        return code;
    }

    /**
     * Chemical structure descriptor, absent when the document gives none.
     */
    public Optional<String> value() {
        return Optional.ofNullable(value);
    }

    public List<ConnectionPoint> connectionPoints() {
        return connectionPoints;
    }

    public Optional<Quantity> quantity() {
        return Optional.ofNullable(quantity);
    }

    @Override
    public Optional<Object> attribute(String name) {
        return switch (name) {
            case "name" -> Optional.of(name());
            case "code" -> Optional.of(code);
            case "value" -> Optional.of(value().orElse(""));
            case "connection_points" -> Optional.of(connectionPoints.stream()
                    .map(ConnectionPoint::toString)
                    .collect(Collectors.joining(",")));
            case "quantity" -> Optional.of(quantity().map(Object::toString).orElse(""));
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return "Polymer[" + (isNamed() ? name() : code) + "]";
    }
}
