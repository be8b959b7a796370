package spl.idstring.model;

import java.util.List;

/**
 * Entity categories of the canonical model.
 */
public enum Category {
    CHAINS("chains"),
    POLYMERS("polymers"),
    SUBSTITUTIONS("substitutions"),
    ATTACHMENTS("attachments");

    /**
     * Order in which {@link ProteinModel#accept(ModelVisitor)} presents the categories. Consumers composing one string
     * from several categories rely on it never changing.
     */
    public static final List<Category> VISIT_ORDER = List.of(CHAINS, POLYMERS, SUBSTITUTIONS, ATTACHMENTS);

    private final String key;

    Category(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
