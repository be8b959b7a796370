package spl.idstring.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import spl.idstring.template.UnresolvedVariablePolicy;

/**
 * Immutable runtime configuration assembled once from CLI arguments and environment values.
 *
 * @param document SPL document to identify
 * @param templates template configuration file; the bundled catalog is used when empty
 */
public record Config(
        Path document,
        Optional<Path> templates,
        LogFormat logFormat,
        UnresolvedVariablePolicy unresolvedVariablePolicy,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(document, "document");
        templates = templates == null ? Optional.empty() : templates;
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        unresolvedVariablePolicy = unresolvedVariablePolicy == null
                ? UnresolvedVariablePolicy.PLACEHOLDER
                : unresolvedVariablePolicy;
    }
}
