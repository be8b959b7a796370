package spl.idstring.model;

/**
 * Raised when a bond refers to a chain or polymer key that the document does not define.
 */
public class CrossReferenceException extends RuntimeException {

    private final String kind;
    private final String key;

    public CrossReferenceException(String kind, String key) {
        super("Undefined " + kind + " reference: " + key);
        this.kind = kind;
        this.key = key;
    }

    public String kind() {
        return kind;
    }

    public String key() {
        return key;
    }
}
