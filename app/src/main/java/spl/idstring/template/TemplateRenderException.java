package spl.idstring.template;

/**
 * Raised by strict rendering when a variable cannot be resolved from the context.
 */
public class TemplateRenderException extends RuntimeException {

    private final String variableName;

    public TemplateRenderException(String variableName) {
        super("Unresolved template variable: " + variableName);
        this.variableName = variableName;
    }

    public String variableName() {
        return variableName;
    }
}
