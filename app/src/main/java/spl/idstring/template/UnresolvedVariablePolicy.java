package spl.idstring.template;

/**
 * What the renderer does with a variable that is absent from the context.
 */
public enum UnresolvedVariablePolicy {
    /** Emit the placeholder {@code {{ name }}} unchanged. */
    PLACEHOLDER,
    /** Raise {@link TemplateRenderException}. */
    FAIL
}
