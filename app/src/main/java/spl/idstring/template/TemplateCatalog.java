package spl.idstring.template;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of named template definitions, assembled once at startup.
 */
public final class TemplateCatalog {

    private final Map<String, TemplateDefinition> definitions;

    public TemplateCatalog(Collection<TemplateDefinition> definitions) {
        Map<String, TemplateDefinition> byName = new LinkedHashMap<>();
        for (TemplateDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate template definition: " + definition.name());
            }
        }
        this.definitions = Map.copyOf(byName);
    }

    public Optional<TemplateDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public TemplateDefinition definition(String name) {
        return find(name).orElseThrow(() -> new IllegalStateException("Template not defined: " + name));
    }

    public Set<String> names() {
        return definitions.keySet();
    }

    /**
     * @throws IllegalStateException naming the first required template that is missing
     */
    public TemplateCatalog requireAll(Collection<String> names) {
        for (String name : names) {
            definition(name);
        }
        return this;
    }
}
