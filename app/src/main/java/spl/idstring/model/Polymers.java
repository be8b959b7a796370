package spl.idstring.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import spl.idstring.document.DocumentQueryService;
import spl.idstring.document.MissingFieldException;
import spl.idstring.document.SplDocument;

/**
 * Auxiliary substances of the document, sorted by {@code (value, code)} and named {@code poly0..n}.
 */
public final class Polymers {

    static final String CODE_PATH = "./x:code/@code";
    static final String MOIETY_CODE_PATH = "./x:asSpecializedKind/x:generalizedMaterialKind/x:code/@code";
    static final String CONNECTION_POINT_PATH = "./x:moiety[x:code[@code='C118427']]";
    static final String POSITION_PATH = "./x:positionNumber/@value";
    static final String QUANTITY_PATH = "./x:quantity";
    static final String NUMERATOR_PATH = "./x:numerator";
    static final String DENOMINATOR_PATH = "./x:denominator";

    static final String NAME_PREFIX = "poly";

    private static final Logger LOGGER = LoggerFactory.getLogger(Polymers.class);

    private final List<Polymer> polymers;
    private final EntityLookup<Polymer> lookup;

    private Polymers(List<Polymer> polymers) {
        this.polymers = List.copyOf(polymers);
        this.lookup = EntityLookup.index("polymer", this.polymers, Polymer::code);
    }

    public static Polymers load(SplDocument document) {
        DocumentQueryService query = document.query();
        List<Polymer> polymers = new ArrayList<>();
        for (Element substance : document.otherSubstances()) {
            String code = query.requireValue(substance, CODE_PATH, "auxiliary substance code");
            Node moiety = structuralMoiety(query, substance);
            polymers.add(new Polymer(code,
                    ChemicalStructure.read(query, moiety).orElse(null),
                    connectionPoints(query, substance),
                    quantity(query, moiety).orElse(null)));
        }
        LOGGER.debug("Loaded {} polymer(s) from {}", polymers.size(), document.source());
        return of(polymers);
    }

    /**
     * Sorts and names already extracted polymers.
     */
    public static Polymers of(List<Polymer> unsorted) {
        List<Polymer> sorted = new ArrayList<>(unsorted);
        sorted.sort(Polymer.ORDER);
        for (int i = 0; i < sorted.size(); i++) {
            sorted.get(i).assignName(NAME_PREFIX + i);
        }
        return new Polymers(sorted);
    }

    public List<Polymer> items() {
        return polymers;
    }

    /**
     * Polymers by document-local code.
     */
    public EntityLookup<Polymer> lookup() {
        return lookup;
    }

    public int size() {
        return polymers.size();
    }

    // The substance names its structural moiety by code; the moiety is the one whose part carries that code.
    private static Node structuralMoiety(DocumentQueryService query, Node substance) {
        String moietyCode = query.requireValue(substance, MOIETY_CODE_PATH, "structural moiety code");
        String path = "./x:moiety[x:partMoiety/x:code[@code=" + Fields.literal(moietyCode) + "]]";
        return query.requireNode(substance, path, "structural moiety " + moietyCode);
    }

    private static List<ConnectionPoint> connectionPoints(DocumentQueryService query, Node substance) {
        List<ConnectionPoint> points = new ArrayList<>();
        for (Node node : query.select(substance, CONNECTION_POINT_PATH)) {
            List<Integer> positions = Fields.positions(query.values(node, POSITION_PATH), 2, "connection point position");
            points.add(new ConnectionPoint(positions.get(0), positions.get(1)));
        }
        return points;
    }

    private static Optional<Quantity> quantity(DocumentQueryService query, Node moiety) {
        List<Node> quantities = query.select(moiety, QUANTITY_PATH);
        if (quantities.isEmpty()) {
            return Optional.empty();
        }
        Node quantity = quantities.get(0);
        Element numerator = (Element) query.requireNode(quantity, NUMERATOR_PATH, "quantity numerator");
        Element denominator = (Element) query.requireNode(quantity, DENOMINATOR_PATH, "quantity denominator");
        String denominatorValue = requireAttribute(denominator, "value", "quantity denominator value");
        String unit = requireAttribute(denominator, "unit", "quantity unit");

        if (numerator.hasAttribute("value")) {
            return Optional.of(new PointQuantity(numerator.getAttribute("value").strip(), denominatorValue, unit));
        }
        Element low = (Element) query.requireNode(numerator, "./x:low", "quantity low bound");
        Element high = (Element) query.requireNode(numerator, "./x:high", "quantity high bound");
        return Optional.of(new QuantityRange(
                requireAttribute(low, "value", "quantity low bound value"), isInclusive(low),
                requireAttribute(high, "value", "quantity high bound value"), isInclusive(high),
                denominatorValue, unit));
    }

    private static String requireAttribute(Element element, String attribute, String field) {
        if (!element.hasAttribute(attribute)) {
            throw new MissingFieldException(field);
        }
        return element.getAttribute(attribute).strip();
    }

    private static boolean isInclusive(Element bound) {
        return !"false".equals(bound.getAttribute("inclusive").strip());
    }
}
