package spl.idstring.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import spl.idstring.template.AttributeSource;

/**
 * Glycan attached at a chain position.
 */
public final class AttachmentPoint implements AttributeSource, Comparable<AttachmentPoint> {

    private static final Comparator<AttachmentPoint> ORDER = Comparator
            .comparing(AttachmentPoint::glycanCode)
            .thenComparing(AttachmentPoint::chainName)
            .thenComparingInt(AttachmentPoint::position);

    private final String glycanCode;
    private final Chain chain;
    private final int position;

    public AttachmentPoint(String glycanCode, Chain chain, int position) {
        this.glycanCode = Objects.requireNonNull(glycanCode, "glycanCode");
        this.chain = Objects.requireNonNull(chain, "chain");
        this.position = position;
    }

    public String glycanCode() {
        return glycanCode;
    }

    public Chain chain() {
        return chain;
    }

    public String chainName() {
        return chain.name();
    }

    public int position() {
        return position;
    }

    public String value() {
        return chainName() + ":" + position + ":" + glycanCode;
    }

    @Override
    public int compareTo(AttachmentPoint other) {
        return ORDER.compare(this, other);
    }

    @Override
    public Optional<Object> attribute(String name) {
        return switch (name) {
            case "glycan" -> Optional.of(glycanCode);
            case "chain" -> Optional.of(chainName());
            case "position" -> Optional.of(position);
            case "value" -> Optional.of(value());
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return "AttachmentPoint[" + value() + "]";
    }
}
