package spl.idstring.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Node;
import spl.idstring.document.DocumentQueryService;
import spl.idstring.document.SplDocument;

/**
 * Chain modifications of the main substance: polymer substitutions (grouped per modification) and glycan attachments.
 * Chain and polymer references are resolved through the lookups of already canonicalized collections.
 */
public final class Modifications {

    static final String MOIETY_PATH = "./x:moiety[x:code[@code='C118425']]/x:partMoiety";
    static final String CODE_PATH = "./x:code/@code";
    static final String SUBSTITUTION_BOND_PATH = "./x:bond[x:code[@code='C118426']]";
    static final String ATTACHMENT_BOND_PATH = "./x:bond[x:code[@code='C14050']]";
    static final String DISTAL_ID_PATH = "./x:distalMoiety/x:id/@extension";
    static final String POSITION_PATH = "./x:positionNumber/@value";

    static final String NAME_PREFIX = "sub";

    private static final Logger LOGGER = LoggerFactory.getLogger(Modifications.class);

    private final List<Substitution> substitutions;
    private final List<SubstitutionPoint> substitutionPoints;
    private final List<AttachmentPoint> attachments;

    private Modifications(List<Substitution> substitutions, List<AttachmentPoint> attachments) {
        this.substitutions = List.copyOf(substitutions);
        List<SubstitutionPoint> points = new ArrayList<>();
        for (Substitution substitution : this.substitutions) {
            points.addAll(substitution.points());
        }
        this.substitutionPoints = List.copyOf(points);
        this.attachments = List.copyOf(attachments);
    }

    public static Modifications load(SplDocument document, EntityLookup<Chain> chains, EntityLookup<Polymer> polymers) {
        Objects.requireNonNull(chains, "chains");
        Objects.requireNonNull(polymers, "polymers");
        DocumentQueryService query = document.query();
        List<Substitution> substitutions = new ArrayList<>();
        List<AttachmentPoint> attachments = new ArrayList<>();

        for (Node moiety : query.select(document.substance(), MOIETY_PATH)) {
            String code = query.requireValue(moiety, CODE_PATH, "modification substance code");

            List<Node> substitutionBonds = query.select(moiety, SUBSTITUTION_BOND_PATH);
            if (!substitutionBonds.isEmpty()) {
                Polymer polymer = polymers.require(code);
                List<SubstitutionPoint> points = new ArrayList<>();
                for (Node bond : substitutionBonds) {
                    Chain chain = chains.require(query.requireValue(bond, DISTAL_ID_PATH, "bond distal moiety id"));
                    List<Integer> positions = Fields.positions(query.values(bond, POSITION_PATH), 2, "substitution position");
                    points.add(new SubstitutionPoint(polymer, positions.get(0), chain, positions.get(1)));
                }
                substitutions.add(new Substitution(points));
            }

            for (Node bond : query.select(moiety, ATTACHMENT_BOND_PATH)) {
                Chain chain = chains.require(query.requireValue(bond, DISTAL_ID_PATH, "bond distal moiety id"));
                List<Integer> positions = Fields.positions(query.values(bond, POSITION_PATH), 1, "attachment position");
                attachments.add(new AttachmentPoint(code, chain, positions.get(0)));
            }
        }
        LOGGER.debug("Loaded {} substitution(s) and {} attachment(s) from {}",
                substitutions.size(), attachments.size(), document.source());
        return of(substitutions, attachments);
    }

    /**
     * Sorts and names already extracted modifications.
     */
    public static Modifications of(List<Substitution> substitutions, List<AttachmentPoint> attachments) {
        List<Substitution> sortedSubstitutions = new ArrayList<>(substitutions);
        sortedSubstitutions.sort(Comparator.naturalOrder());
        for (int i = 0; i < sortedSubstitutions.size(); i++) {
            sortedSubstitutions.get(i).assignName(NAME_PREFIX + i);
        }
        List<AttachmentPoint> sortedAttachments = new ArrayList<>(attachments);
        sortedAttachments.sort(Comparator.naturalOrder());
        return new Modifications(sortedSubstitutions, sortedAttachments);
    }

    public List<Substitution> substitutions() {
        return substitutions;
    }

    /**
     * Points of all substitutions, group by group in canonical order.
     */
    public List<SubstitutionPoint> substitutionPoints() {
        return substitutionPoints;
    }

    public List<AttachmentPoint> attachments() {
        return attachments;
    }
}
