package spl.idstring.model;

import java.util.ArrayList;
import java.util.List;
import spl.idstring.document.DocumentStructureException;
import spl.idstring.document.MissingFieldException;

final class Fields {

    private Fields() {
    }

    /**
     * Parses position numbers, requiring exactly {@code expected} of them.
     */
    static List<Integer> positions(List<String> raw, int expected, String field) {
        if (raw.size() != expected) {
            throw new MissingFieldException(field, expected, raw.size());
        }
        List<Integer> positions = new ArrayList<>(raw.size());
        for (String value : raw) {
            try {
                positions.add(Integer.parseInt(value));
            } catch (NumberFormatException ex) {
                throw new DocumentStructureException("Invalid " + field + ": '" + value + "'", ex);
            }
        }
        return positions;
    }

    /**
     * Quotes {@code value} for use as an XPath string literal.
     */
    static String literal(String value) {
        if (value.indexOf('\'') < 0) {
            return "'" + value + "'";
        }
        if (value.indexOf('"') < 0) {
            return "\"" + value + "\"";
        }
        throw new DocumentStructureException("Code cannot be used in a path expression: " + value);
    }
}
