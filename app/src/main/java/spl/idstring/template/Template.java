package spl.idstring.template;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed template string. Immutable; parse once and render against any number of contexts.
 */
public final class Template {

    private final String source;
    private final List<TemplateNode> nodes;

    private Template(String source, List<TemplateNode> nodes) {
        this.source = source;
        this.nodes = nodes;
    }

    /**
     * Parses {@code source}.
     *
     * @throws TemplateSyntaxException when the template is malformed
     */
    public static Template parse(String source) {
        return new Template(source, TemplateParser.parse(source));
    }

    public String source() {
        return source;
    }

    /**
     * Checks that every transform is known and receives the number of parameters it expects.
     *
     * @throws TemplateSyntaxException on the first offending transform
     */
    public Template validate() {
        for (TemplateNode node : nodes) {
            if (node instanceof VariableNode variableNode) {
                variableNode.variable().transforms().forEach(Transform::validate);
            }
        }
        return this;
    }

    public String render(Map<String, ?> context, UnresolvedVariablePolicy policy) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(policy, "policy");
        StringBuilder builder = new StringBuilder();
        for (TemplateNode node : nodes) {
            builder.append(node.render(context, policy));
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return source;
    }
}
