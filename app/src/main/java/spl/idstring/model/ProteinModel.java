package spl.idstring.model;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spl.idstring.document.SplDocument;

/**
 * Canonical model of a protein substance document. Chains and polymers are loaded first so that modifications can
 * resolve their references against completed lookups.
 */
public final class ProteinModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProteinModel.class);

    private final Chains chains;
    private final Polymers polymers;
    private final Modifications modifications;

    public ProteinModel(Chains chains, Polymers polymers, Modifications modifications) {
        this.chains = Objects.requireNonNull(chains, "chains");
        this.polymers = Objects.requireNonNull(polymers, "polymers");
        this.modifications = Objects.requireNonNull(modifications, "modifications");
    }

    public static ProteinModel load(SplDocument document) {
        Objects.requireNonNull(document, "document");
        Chains chains = Chains.load(document);
        Polymers polymers = Polymers.load(document);
        Modifications modifications = Modifications.load(document, chains.lookup(), polymers.lookup());
        LOGGER.debug("Canonicalized {}: {} chain(s), {} polymer(s), {} substitution point(s), {} attachment(s)",
                document.source(), chains.size(), polymers.size(),
                modifications.substitutionPoints().size(), modifications.attachments().size());
        return new ProteinModel(chains, polymers, modifications);
    }

    /**
     * Presents each category to {@code visitor} in {@link Category#VISIT_ORDER}.
     */
    public void accept(ModelVisitor visitor) {
        Objects.requireNonNull(visitor, "visitor");
        for (Category category : Category.VISIT_ORDER) {
            switch (category) {
                case CHAINS -> visitor.visitChains(chains.items());
                case POLYMERS -> visitor.visitPolymers(polymers.items());
                case SUBSTITUTIONS -> visitor.visitSubstitutions(modifications.substitutionPoints());
                case ATTACHMENTS -> visitor.visitAttachments(modifications.attachments());
            }
        }
    }

    public Modifications modifications() {
        return modifications;
    }
}
