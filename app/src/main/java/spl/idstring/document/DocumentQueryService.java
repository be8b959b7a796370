package spl.idstring.document;

import java.util.List;
import org.w3c.dom.Node;

/**
 * Evaluates path expressions relative to a node of the SPL document. Results come back in document order and are
 * empty when nothing matches. Queried nodes are never modified.
 */
public interface DocumentQueryService {

    List<Node> select(Node context, String path);

    /**
     * String values of the matched attributes, text nodes or elements, with surrounding whitespace removed.
     */
    List<String> values(Node context, String path);

    default Node requireNode(Node context, String path, String field) {
        return requireSingle(select(context, path), field);
    }

    default String requireValue(Node context, String path, String field) {
        return requireSingle(values(context, path), field);
    }

    private static <T> T requireSingle(List<T> matches, String field) {
        if (matches.isEmpty()) {
            throw new MissingFieldException(field);
        }
        if (matches.size() > 1) {
            throw new DocumentStructureException(capitalize(field) + " must be unique, found " + matches.size());
        }
        return matches.get(0);
    }

    private static String capitalize(String field) {
        return field.isEmpty() ? field : Character.toUpperCase(field.charAt(0)) + field.substring(1);
    }
}
