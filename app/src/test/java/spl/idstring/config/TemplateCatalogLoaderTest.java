package spl.idstring.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import spl.idstring.identifier.IdentifierAssembler;
import spl.idstring.template.TemplateCatalog;
import spl.idstring.template.TemplateSyntaxException;

class TemplateCatalogLoaderTest {

    @TempDir
    Path tempDir;

    private final TemplateCatalogLoader loader = new TemplateCatalogLoader();

    @Test
    void bundledCatalogDefinesEveryRequiredTemplate() {
        TemplateCatalog catalog = loader.load(Optional.empty());

        assertThat(catalog.names()).containsAll(IdentifierAssembler.requiredTemplates());
        assertThat(catalog.definition("chain").attributes()).containsExactly("name", "value");
    }

    @Test
    void readsCatalogFromFile() throws IOException {
        Path file = tempDir.resolve("templates.json");
        Files.writeString(file, "{\"chain\": {\"attributes\": [\"value\"], \"template\": \"{{ value|sort }}\"},"
                + " \"polymer\": {\"template\": \"-\"}}");

        TemplateCatalog catalog = loader.load(Optional.of(file));

        assertThat(catalog.names()).containsExactlyInAnyOrder("chain", "polymer");
        assertThat(catalog.definition("polymer").attributes()).isEmpty();
        assertThat(catalog.definition("chain").template().source()).isEqualTo("{{ value|sort }}");
    }

    @Test
    void rejectsInvalidJson() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"chain\": ");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void rejectsTemplateWithoutTemplateString() throws IOException {
        Path file = tempDir.resolve("shape.json");
        Files.writeString(file, "{\"chain\": {\"attributes\": [\"name\"]}}");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'chain' lacks a string 'template'");
    }

    @Test
    void reportsSyntaxErrorsWhileLoading() throws IOException {
        Path file = tempDir.resolve("syntax.json");
        Files.writeString(file, "{\"chain\": {\"template\": \"{{ name|shuffle }}\"}}");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessage("Unknown transform: shuffle");
    }

    @Test
    void missingFileIsAnIoFailure() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.json")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("absent.json");
    }
}
