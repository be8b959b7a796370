package spl.idstring.template;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One rendering of a {@link TemplateDefinition} with its own attribute values.
 */
public final class TemplateInstance implements Renderable {

    private final TemplateDefinition definition;
    private final UnresolvedVariablePolicy policy;
    private final Map<String, Object> values = new LinkedHashMap<>();

    TemplateInstance(TemplateDefinition definition, UnresolvedVariablePolicy policy) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Copies every declared attribute the source provides. Attributes the source does not declare are skipped and
     * later render as placeholders.
     */
    public TemplateInstance load(AttributeSource source) {
        Objects.requireNonNull(source, "source");
        for (String name : definition.attributes()) {
            source.attribute(name).ifPresent(value -> values.put(name, value));
        }
        return this;
    }

    @Override
    public String render() {
        return definition.template().render(values, policy);
    }

    @Override
    public String toString() {
        return render();
    }
}
