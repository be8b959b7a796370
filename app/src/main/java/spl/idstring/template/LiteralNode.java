package spl.idstring.template;

import java.util.Map;
import java.util.Objects;

/**
 * Run of text emitted verbatim.
 */
public record LiteralNode(String text) implements TemplateNode {

    public LiteralNode {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String render(Map<String, ?> context, UnresolvedVariablePolicy policy) {
        return text;
    }
}
