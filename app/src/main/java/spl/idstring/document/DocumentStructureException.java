package spl.idstring.document;

/**
 * Raised when a mandatory element or attribute of the SPL document is missing or not unique.
 */
public class DocumentStructureException extends RuntimeException {

    public DocumentStructureException(String message) {
        super(message);
    }

    public DocumentStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
