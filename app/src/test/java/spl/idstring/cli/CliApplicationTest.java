package spl.idstring.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static spl.idstring.document.SplXml.bond;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import spl.idstring.config.ConfigLoader;
import spl.idstring.config.TemplateCatalogLoader;
import spl.idstring.document.SplXml;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void printsIdentifierOfDocument() throws IOException {
        Path document = write("substance.xml", SplXml.substance()
                .chain("c1", "MKV")
                .attachment("G1", bond("c1", 4))
                .xml());

        int exitCode = application(Map.of()).run(new String[] {document.toString()});

        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).isEqualTo("/chains=chain0:MKV/poly=/sub=/att=G1:chain0:4");
    }

    @Test
    void usesTemplatesFromOption() throws IOException {
        Path document = write("substance.xml", SplXml.substance().chain("c1", "MKV").xml());
        Path templates = write("templates.json", "{"
                + "\"protein_identifier\": {\"template\": \"{{ chains|join:\\\",\\\" }}|{{ extra }}\"},"
                + "\"chain\": {\"attributes\": [\"value\"], \"template\": \"{{ value }}\"},"
                + "\"polymer\": {\"template\": \"\"},"
                + "\"substitution\": {\"template\": \"\"},"
                + "\"attachment\": {\"template\": \"\"}}");

        int exitCode = application(Map.of()).run(new String[] {"--templates", templates.toString(), document.toString()});

        assertThat(exitCode).isZero();
        assertThat(out.toString().strip()).isEqualTo("MKV|{{ extra }}");
    }

    @Test
    void strictModeFailsOnUnresolvedVariable() throws IOException {
        Path document = write("substance.xml", SplXml.substance().chain("c1", "MKV").xml());
        Path templates = write("templates.json", "{"
                + "\"protein_identifier\": {\"template\": \"{{ extra }}\"},"
                + "\"chain\": {\"template\": \"\"},"
                + "\"polymer\": {\"template\": \"\"},"
                + "\"substitution\": {\"template\": \"\"},"
                + "\"attachment\": {\"template\": \"\"}}");

        int exitCode = application(Map.of("IDSTRING_STRICT", "true"))
                .run(new String[] {"--templates", templates.toString(), document.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_TEMPLATE_RENDER);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).contains("Unresolved template variable: extra");
    }

    @Test
    void malformedTemplateExitsWithSyntaxCode() throws IOException {
        Path document = write("substance.xml", SplXml.substance().xml());
        Path templates = write("templates.json", "{\"protein_identifier\": {\"template\": \"{{ chains\"}}");

        int exitCode = application(Map.of()).run(new String[] {"--templates", templates.toString(), document.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_TEMPLATE_SYNTAX);
        assertThat(err.toString()).contains("Missing closing '}}'");
    }

    @Test
    void undefinedChainExitsWithCrossReferenceCode() throws IOException {
        Path document = write("substance.xml", SplXml.substance()
                .chain("c1", "MKV")
                .attachment("G1", bond("c2", 4))
                .xml());

        int exitCode = application(Map.of()).run(new String[] {document.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_CROSS_REFERENCE);
        assertThat(err.toString()).contains("Undefined chain reference: c2");
    }

    @Test
    void missingFieldExitsWithStructureCode() throws IOException {
        Path document = write("substance.xml", SplXml.substance()
                .mainMoiety("<moiety><code code=\"C118424\"/><partMoiety><id extension=\"c1\"/></partMoiety></moiety>")
                .xml());

        int exitCode = application(Map.of()).run(new String[] {document.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_DOCUMENT_STRUCTURE);
        assertThat(err.toString()).contains("Missing chain amino acid sequence");
    }

    @Test
    void malformedDocumentExitsWithLoadCode() throws IOException {
        Path document = write("substance.xml", "<document>");

        int exitCode = application(Map.of()).run(new String[] {document.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_DOCUMENT_LOAD);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void missingTemplateFileExitsWithConfigurationCode() throws IOException {
        Path document = write("substance.xml", SplXml.substance().xml());

        int exitCode = application(Map.of())
                .run(new String[] {"--templates", tempDir.resolve("absent.json").toString(), document.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_CONFIGURATION);
    }

    @Test
    void invalidLogFormatIsRejectedAsUsageError() {
        int exitCode = application(Map.of()).run(new String[] {"--log-format", "xml", "substance.xml"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Unsupported log format");
    }

    @Test
    void missingDocumentArgumentIsUsageError() {
        int exitCode = application(Map.of()).run(new String[0]);

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("DOCUMENT");
    }

    @Test
    void helpPrintsUsage() {
        int exitCode = application(Map.of()).run(new String[] {"--help"});

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("spl-idstring").contains("--templates");
    }

    private CliApplication application(Map<String, String> environment) {
        return new CliApplication(new ConfigLoader(key -> Optional.ofNullable(environment.get(key))),
                new TemplateCatalogLoader(), new PrintWriter(out), new PrintWriter(err));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }
}
