package spl.idstring.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * One bond of a substitution: a polymer connection point joined to a chain position.
 * The name is the one of the owning {@link Substitution}.
 */
public final class SubstitutionPoint extends CanonicalEntity implements Comparable<SubstitutionPoint> {

    private static final Comparator<SubstitutionPoint> ORDER = Comparator
            .comparing(SubstitutionPoint::polymerName)
            .thenComparingInt(SubstitutionPoint::connectionPoint)
            .thenComparing(SubstitutionPoint::chainName)
            .thenComparingInt(SubstitutionPoint::position);

    private final Polymer polymer;
    private final int connectionPoint;
    private final Chain chain;
    private final int position;

    public SubstitutionPoint(Polymer polymer, int connectionPoint, Chain chain, int position) {
        this.polymer = Objects.requireNonNull(polymer, "polymer");
        this.connectionPoint = connectionPoint;
        this.chain = Objects.requireNonNull(chain, "chain");
        this.position = position;
    }

    public Polymer polymer() {
        return polymer;
    }

    public String polymerName() {
        return polymer.name();
    }

    /**
     * Position on the polymer.
     */
    public int connectionPoint() {
        return connectionPoint;
    }

    public Chain chain() {
        return chain;
    }

    public String chainName() {
        return chain.name();
    }

    /**
     * Position on the chain.
     */
    public int position() {
        return position;
    }

    public String value() {
        return chainName() + ":" + position + ":" + polymerName() + ":" + connectionPoint;
    }

    @Override
    public int compareTo(SubstitutionPoint other) {
        return ORDER.compare(this, other);
    }

    @Override
    public Optional<Object> attribute(String name) {
        return switch (name) {
            case "name" -> Optional.of(name());
            case "polymer" -> Optional.of(polymerName());
            case "connection_point" -> Optional.of(connectionPoint);
            case "chain" -> Optional.of(chainName());
            case "position" -> Optional.of(position);
            case "value" -> Optional.of(value());
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return "SubstitutionPoint[" + value() + "]";
    }
}
