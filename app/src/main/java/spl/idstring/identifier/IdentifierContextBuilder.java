package spl.idstring.identifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import spl.idstring.model.AttachmentPoint;
import spl.idstring.model.Category;
import spl.idstring.model.Chain;
import spl.idstring.model.ModelVisitor;
import spl.idstring.model.Polymer;
import spl.idstring.model.SubstitutionPoint;
import spl.idstring.template.AttributeSource;
import spl.idstring.template.TemplateCatalog;
import spl.idstring.template.TemplateDefinition;
import spl.idstring.template.TemplateInstance;
import spl.idstring.template.UnresolvedVariablePolicy;

/**
 * Turns the canonical entities into template instances and collects them, per category, into the rendering context
 * of the identifier template.
 */
public class IdentifierContextBuilder implements ModelVisitor {

    public static final String CHAIN_TEMPLATE = "chain";
    public static final String POLYMER_TEMPLATE = "polymer";
    public static final String SUBSTITUTION_TEMPLATE = "substitution";
    public static final String ATTACHMENT_TEMPLATE = "attachment";

    private final TemplateCatalog catalog;
    private final UnresolvedVariablePolicy policy;
    private final Map<String, Object> context = new LinkedHashMap<>();

    public IdentifierContextBuilder(TemplateCatalog catalog) {
        this(catalog, UnresolvedVariablePolicy.PLACEHOLDER);
    }

    public IdentifierContextBuilder(TemplateCatalog catalog, UnresolvedVariablePolicy policy) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public static String templateName(Category category) {
        return switch (category) {
            case CHAINS -> CHAIN_TEMPLATE;
            case POLYMERS -> POLYMER_TEMPLATE;
            case SUBSTITUTIONS -> SUBSTITUTION_TEMPLATE;
            case ATTACHMENTS -> ATTACHMENT_TEMPLATE;
        };
    }

    @Override
    public void visitChains(List<Chain> chains) {
        collect(Category.CHAINS, chains);
    }

    @Override
    public void visitPolymers(List<Polymer> polymers) {
        collect(Category.POLYMERS, polymers);
    }

    @Override
    public void visitSubstitutions(List<SubstitutionPoint> points) {
        collect(Category.SUBSTITUTIONS, points);
    }

    @Override
    public void visitAttachments(List<AttachmentPoint> attachments) {
        collect(Category.ATTACHMENTS, attachments);
    }

    public Map<String, Object> context() {
        return Collections.unmodifiableMap(context);
    }

    private void collect(Category category, List<? extends AttributeSource> items) {
        TemplateDefinition definition = catalog.definition(templateName(category));
        List<TemplateInstance> instances = new ArrayList<>(items.size());
        for (AttributeSource item : items) {
            instances.add(definition.newInstance(policy).load(item));
        }
        context.put(category.key(), List.copyOf(instances));
    }
}
