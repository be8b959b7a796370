package spl.idstring.model;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Node;
import spl.idstring.document.DocumentQueryService;
import spl.idstring.document.SplDocument;

/**
 * Protein chains of the main substance, sorted by {@code (value, localId)} and named {@code chain0..n}.
 */
public final class Chains {

    static final String MOIETY_PATH = "./x:moiety[x:code[@code='C118424']]";
    static final String LOCAL_ID_PATH = "./x:partMoiety/x:id/@extension";
    static final String SEQUENCE_PATH = "./x:subjectOf/x:characteristic[x:code[@code='C103240']]"
            + "/x:value[@mediaType='application/x-aa-seq']/text()";

    static final String NAME_PREFIX = "chain";

    private static final Logger LOGGER = LoggerFactory.getLogger(Chains.class);

    private final List<Chain> chains;
    private final EntityLookup<Chain> lookup;

    private Chains(List<Chain> chains) {
        this.chains = List.copyOf(chains);
        this.lookup = EntityLookup.index("chain", this.chains, Chain::localId);
    }

    public static Chains load(SplDocument document) {
        DocumentQueryService query = document.query();
        List<Chain> chains = new ArrayList<>();
        for (Node moiety : query.select(document.substance(), MOIETY_PATH)) {
            String localId = query.requireValue(moiety, LOCAL_ID_PATH, "chain local id");
            String sequence = query.requireValue(moiety, SEQUENCE_PATH, "chain amino acid sequence");
            chains.add(new Chain(localId, sequence));
        }
        LOGGER.debug("Loaded {} chain(s) from {}", chains.size(), document.source());
        return of(chains);
    }

    /**
     * Sorts and names already extracted chains.
     */
    public static Chains of(List<Chain> unsorted) {
        List<Chain> sorted = new ArrayList<>(unsorted);
        sorted.sort(Chain.ORDER);
        for (int i = 0; i < sorted.size(); i++) {
            sorted.get(i).assignName(NAME_PREFIX + i);
        }
        return new Chains(sorted);
    }

    public List<Chain> items() {
        return chains;
    }

    /**
     * Chains by document-local id.
     */
    public EntityLookup<Chain> lookup() {
        return lookup;
    }

    public int size() {
        return chains.size();
    }
}
