package spl.idstring.cli;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import spl.idstring.config.Config;
import spl.idstring.config.ConfigLoader;
import spl.idstring.config.EnvironmentReader;
import spl.idstring.config.TemplateCatalogLoader;
import spl.idstring.document.DocumentLoadException;
import spl.idstring.document.DocumentStructureException;
import spl.idstring.document.SplDocument;
import spl.idstring.identifier.IdentifierAssembler;
import spl.idstring.logging.LoggingConfigurator;
import spl.idstring.model.CrossReferenceException;
import spl.idstring.template.TemplateCatalog;
import spl.idstring.template.TemplateRenderException;
import spl.idstring.template.TemplateSyntaxException;

/**
 * Entry point: reads one SPL document and prints its identifier string on standard output.
 * Each kind of failure maps to its own exit code; nothing is printed on standard output when a run fails.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_UNEXPECTED = 1;
    static final int EXIT_DOCUMENT_STRUCTURE = 3;
    static final int EXIT_CROSS_REFERENCE = 4;
    static final int EXIT_TEMPLATE_SYNTAX = 5;
    static final int EXIT_TEMPLATE_RENDER = 6;
    static final int EXIT_DOCUMENT_LOAD = 7;
    static final int EXIT_CONFIGURATION = 8;

    static final String MDC_DOCUMENT = "document";

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final TemplateCatalogLoader catalogLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new TemplateCatalogLoader(),
                new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    CliApplication(ConfigLoader configLoader, TemplateCatalogLoader catalogLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.catalogLoader = catalogLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            return fail(EXIT_CONFIGURATION, ex);
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());

        MDC.put(MDC_DOCUMENT, config.document().toString());
        try {
            TemplateCatalog catalog = catalogLoader.load(config.templates());
            IdentifierAssembler assembler = new IdentifierAssembler(catalog, config.unresolvedVariablePolicy());
            String identifier = assembler.assemble(SplDocument.read(config.document()));
            out.println(identifier);
            out.flush();
            LOGGER.debug("Identified {}", config.document());
            return EXIT_OK;
        } catch (RuntimeException ex) {
            return fail(exitCodeFor(ex), ex);
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
    }

    static int exitCodeFor(RuntimeException ex) {
        if (ex instanceof DocumentStructureException) {
            return EXIT_DOCUMENT_STRUCTURE;
        }
        if (ex instanceof CrossReferenceException) {
            return EXIT_CROSS_REFERENCE;
        }
        if (ex instanceof TemplateSyntaxException) {
            return EXIT_TEMPLATE_SYNTAX;
        }
        if (ex instanceof TemplateRenderException) {
            return EXIT_TEMPLATE_RENDER;
        }
        if (ex instanceof DocumentLoadException) {
            return EXIT_DOCUMENT_LOAD;
        }
        if (ex instanceof UncheckedIOException || ex instanceof IllegalArgumentException || ex instanceof IllegalStateException) {
            return EXIT_CONFIGURATION;
        }
        return EXIT_UNEXPECTED;
    }

    private int fail(int exitCode, RuntimeException ex) {
        if (exitCode == EXIT_UNEXPECTED) {
            LOGGER.error("Unexpected failure", ex);
        } else {
            LOGGER.debug("Run failed with exit code {}", exitCode, ex);
        }
        err.println("error: " + ex.getMessage());
        err.flush();
        return exitCode;
    }
}
