package spl.idstring.cli;

import java.nio.file.Path;
import picocli.CommandLine;
import spl.idstring.config.LogFormat;

@CommandLine.Command(name = "spl-idstring", mixinStandardHelpOptions = true, version = "spl-idstring 1.0.0",
        description = "Prints the canonical identifier string of an SPL substance document")
public class CliArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "DOCUMENT", description = "SPL XML document to identify")
    private Path document;

    @CommandLine.Option(names = "--templates", paramLabel = "FILE",
            description = "Template configuration (JSON); defaults to the bundled templates")
    private Path templates;

    @CommandLine.Option(names = "--log-format", converter = LogFormatConverter.class, description = "Log format: text or json")
    private LogFormat logFormat;

    @CommandLine.Option(names = "--strict", description = "Fail on template variables missing from the context instead of keeping their placeholders")
    private boolean strict;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log canonicalization details")
    private boolean verbose;

    public Path document() {
        return document;
    }

    public Path templates() {
        return templates;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean strict() {
        return strict;
    }

    public boolean verbose() {
        return verbose;
    }
}
