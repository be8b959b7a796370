package spl.idstring.document;

/**
 * A mandatory field is absent, or present with a cardinality other than expected.
 */
public class MissingFieldException extends DocumentStructureException {

    private final String field;

    public MissingFieldException(String field) {
        super("Missing " + field);
        this.field = field;
    }

    public MissingFieldException(String field, int expected, int actual) {
        super("Expecting exactly " + expected + " " + field + (expected == 1 ? "" : "s") + ", found " + actual);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
