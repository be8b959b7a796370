package spl.idstring.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SplDocumentTest {

    @TempDir
    Path tempDir;

    @Test
    void locatesMainAndAuxiliarySubstances() {
        SplDocument document = SplXml.substance()
                .chain("c1", "ABC")
                .polymer("P1", "KEY1")
                .polymer("P2", "KEY2")
                .document();

        assertThat(document.substance().getLocalName()).isEqualTo("identifiedSubstance");
        assertThat(document.query().requireValue(document.substance(), "./x:code/@code", "substance code"))
                .isEqualTo("MAIN0001");
        assertThat(document.otherSubstances()).hasSize(2);
        assertThat(document.source()).isEqualTo("<string>");
    }

    @Test
    void readsDocumentFromFile() throws IOException {
        Path file = tempDir.resolve("substance.xml");
        Files.writeString(file, SplXml.substance().chain("c1", "ABC").xml(), StandardCharsets.UTF_8);

        SplDocument document = SplDocument.read(file);

        assertThat(document.source()).isEqualTo(file.toString());
        assertThat(document.otherSubstances()).isEmpty();
    }

    @Test
    void rejectsMalformedXml() {
        assertThatThrownBy(() -> SplDocument.parse("<document><code></document>"))
                .isInstanceOf(DocumentLoadException.class)
                .hasMessageContaining("not well-formed");
    }

    @Test
    void reportsUnreadableFile() {
        assertThatThrownBy(() -> SplDocument.read(tempDir.resolve("absent.xml")))
                .isInstanceOf(DocumentLoadException.class)
                .hasMessageContaining("absent.xml");
    }

    @Test
    void rejectsDocumentWithoutIndexingCode() {
        SplDocument document = SplDocument.parse(
                "<document xmlns=\"urn:hl7-org:v3\"><code code=\"34391-3\"/></document>");

        assertThatThrownBy(document::substance)
                .isInstanceOf(DocumentStructureException.class)
                .hasMessage("Document element must be present and unique, found 0");
    }

    @Test
    void ignoresElementsOutsideTheNamespace() {
        SplDocument document = SplDocument.parse("<document><code code=\"64124-1\"/></document>");

        assertThatThrownBy(document::document).isInstanceOf(DocumentStructureException.class);
    }

    @Test
    void refusesDoctypeDeclarations() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE document [<!ENTITY x \"y\">]>"
                + "<document xmlns=\"urn:hl7-org:v3\">&x;</document>";

        assertThatThrownBy(() -> SplDocument.parse(xml)).isInstanceOf(DocumentLoadException.class);
    }
}
