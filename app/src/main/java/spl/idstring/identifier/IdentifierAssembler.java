package spl.idstring.identifier;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spl.idstring.document.SplDocument;
import spl.idstring.model.ProteinModel;
import spl.idstring.template.Template;
import spl.idstring.template.TemplateCatalog;
import spl.idstring.template.UnresolvedVariablePolicy;

/**
 * Produces the identifier string of a document: canonicalize, build the context, render the identifier template.
 */
public class IdentifierAssembler {

    public static final String IDENTIFIER_TEMPLATE = "protein_identifier";

    private static final Logger LOGGER = LoggerFactory.getLogger(IdentifierAssembler.class);

    private final TemplateCatalog catalog;
    private final Template identifierTemplate;
    private final UnresolvedVariablePolicy policy;

    public IdentifierAssembler(TemplateCatalog catalog) {
        this(catalog, UnresolvedVariablePolicy.PLACEHOLDER);
    }

    public IdentifierAssembler(TemplateCatalog catalog, UnresolvedVariablePolicy policy) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.policy = Objects.requireNonNull(policy, "policy");
        catalog.requireAll(requiredTemplates());
        this.identifierTemplate = catalog.definition(IDENTIFIER_TEMPLATE).template().validate();
    }

    /**
     * Names of every template the assembler renders with.
     */
    public static List<String> requiredTemplates() {
        return List.of(IDENTIFIER_TEMPLATE,
                IdentifierContextBuilder.CHAIN_TEMPLATE,
                IdentifierContextBuilder.POLYMER_TEMPLATE,
                IdentifierContextBuilder.SUBSTITUTION_TEMPLATE,
                IdentifierContextBuilder.ATTACHMENT_TEMPLATE);
    }

    public String assemble(SplDocument document) {
        return assemble(ProteinModel.load(document));
    }

    public String assemble(ProteinModel model) {
        IdentifierContextBuilder contextBuilder = new IdentifierContextBuilder(catalog, policy);
        model.accept(contextBuilder);
        String identifier = identifierTemplate.render(contextBuilder.context(), policy);
        LOGGER.debug("Rendered identifier of {} characters", identifier.length());
        return identifier;
    }
}
