package spl.idstring.template;

import java.util.List;
import java.util.Objects;

/**
 * Named template together with the attributes an instance reads from its source.
 */
public record TemplateDefinition(String name, List<String> attributes, Template template) {

    public TemplateDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Template name must not be blank");
        }
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        Objects.requireNonNull(template, "template");
    }

    public static TemplateDefinition of(String name, List<String> attributes, String template) {
        return new TemplateDefinition(name, attributes, Template.parse(template).validate());
    }

    public TemplateInstance newInstance(UnresolvedVariablePolicy policy) {
        return new TemplateInstance(this, policy);
    }
}
