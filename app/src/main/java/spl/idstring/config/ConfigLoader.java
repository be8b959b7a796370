package spl.idstring.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import spl.idstring.cli.CliArguments;
import spl.idstring.template.UnresolvedVariablePolicy;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * CLI values win over environment values.
 */
public class ConfigLoader {

    static final String ENV_TEMPLATES = "IDSTRING_TEMPLATES";
    static final String ENV_STRICT = "IDSTRING_STRICT";
    static final String ENV_VERBOSE = "IDSTRING_VERBOSE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.document() == null) {
            throw new IllegalArgumentException("document path must be provided");
        }
        Optional<Path> templates = resolveTemplates(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        UnresolvedVariablePolicy policy = resolveFlag(arguments.strict(), ENV_STRICT)
                ? UnresolvedVariablePolicy.FAIL
                : UnresolvedVariablePolicy.PLACEHOLDER;
        boolean verbose = resolveFlag(arguments.verbose(), ENV_VERBOSE);
        return new Config(arguments.document(), templates, logFormat, policy, verbose);
    }

    private Optional<Path> resolveTemplates(CliArguments arguments) {
        if (arguments.templates() != null) {
            return Optional.of(arguments.templates());
        }
        return environmentReader.get(ENV_TEMPLATES)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::toPath);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveFlag(boolean cliValue, String envKey) {
        if (cliValue) {
            return true;
        }
        return environmentReader.get(envKey)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static Path toPath(String raw) {
        try {
            return Path.of(raw);
        } catch (InvalidPathException ex) {
            throw new IllegalArgumentException(ENV_TEMPLATES + " is not a valid path: " + raw, ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
