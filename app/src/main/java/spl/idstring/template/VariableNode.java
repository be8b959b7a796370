package spl.idstring.template;

import java.util.Map;
import java.util.Objects;

/**
 * Variable reference resolved against the rendering context.
 */
public record VariableNode(Variable variable) implements TemplateNode {

    public VariableNode {
        Objects.requireNonNull(variable, "variable");
    }

    @Override
    public String render(Map<String, ?> context, UnresolvedVariablePolicy policy) {
        if (!context.containsKey(variable.name())) {
            if (policy == UnresolvedVariablePolicy.FAIL) {
                throw new TemplateRenderException(variable.name());
            }
            return variable.placeholder();
        }
        Object value = context.get(variable.name());
        for (Transform transform : variable.transforms()) {
            value = transform.apply(value);
        }
        return Values.render(value, Values.DEFAULT_SEPARATOR);
    }
}
