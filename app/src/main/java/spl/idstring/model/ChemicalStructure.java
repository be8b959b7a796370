package spl.idstring.model;

import java.util.List;
import java.util.Optional;
import org.w3c.dom.Node;
import spl.idstring.document.DocumentQueryService;

/**
 * Media types a moiety may describe its structure with, in order of preference.
 */
enum ChemicalStructure {
    INCHI_KEY("application/x-inchi-key"),
    INCHI("application/x-inchi"),
    MDL_MOLFILE("application/x-mdl-molfile"),
    AMINO_ACID_SEQUENCE("application/x-aa-seq"),
    NUCLEIC_ACID_SEQUENCE("application/x-na-seq");

    private final String mediaType;

    ChemicalStructure(String mediaType) {
        this.mediaType = mediaType;
    }

    String path() {
        return "./x:subjectOf/x:characteristic[x:code[@code='C103240']]/x:value[@mediaType='" + mediaType + "']/text()";
    }

    /**
     * First structure value the moiety carries, trying media types in preference order.
     */
    static Optional<String> read(DocumentQueryService query, Node moiety) {
        for (ChemicalStructure structure : values()) {
            List<String> values = query.values(moiety, structure.path());
            if (!values.isEmpty()) {
                return Optional.of(values.get(0));
            }
        }
        return Optional.empty();
    }
}
