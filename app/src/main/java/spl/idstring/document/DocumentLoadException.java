package spl.idstring.document;

/**
 * Runtime exception for documents that cannot be read or are not well-formed XML.
 */
public class DocumentLoadException extends RuntimeException {

    public DocumentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
