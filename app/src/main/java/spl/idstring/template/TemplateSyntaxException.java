package spl.idstring.template;

/**
 * Raised when a template string cannot be parsed or refers to an unusable transform.
 */
public class TemplateSyntaxException extends RuntimeException {

    private final int offset;

    public TemplateSyntaxException(String message, int offset) {
        super(offset >= 0 ? message + " at offset " + offset : message);
        this.offset = offset;
    }

    public TemplateSyntaxException(String message) {
        this(message, -1);
    }

    /**
     * Character offset of the failure in the template string, or {@code -1} when the failure is not positional.
     */
    public int offset() {
        return offset;
    }
}
