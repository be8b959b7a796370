package spl.idstring.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Polypeptide chain of the main substance.
 */
public final class Chain extends CanonicalEntity {

    static final Comparator<Chain> ORDER = Comparator.comparing(Chain::value).thenComparing(Chain::localId);

    private final String localId;
    private final String value;

    public Chain(String localId, String value) {
        this.localId = Objects.requireNonNull(localId, "localId");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String localId() {
        return localId;
    }

    /**
     * Amino acid sequence.
     */
    public String value() {
        return value;
    }

    @Override
    public Optional<Object> attribute(String name) {
        return switch (name) {
            case "name" -> Optional.of(name());
            case "value" -> Optional.of(value);
            case "local_id" -> Optional.of(localId);
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return "Chain[" + (isNamed() ? name() : localId) + "]";
    }
}
