package spl.idstring.model;

import java.util.Comparator;

/**
 * Amino and carboxyl group positions through which a polymer attaches to a chain.
 */
public record ConnectionPoint(int aminoGroup, int carboxylGroup) implements Comparable<ConnectionPoint> {

    private static final Comparator<ConnectionPoint> ORDER = Comparator
            .comparingInt(ConnectionPoint::aminoGroup)
            .thenComparingInt(ConnectionPoint::carboxylGroup);

    @Override
    public int compareTo(ConnectionPoint other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "N" + aminoGroup + "C" + carboxylGroup;
    }
}
