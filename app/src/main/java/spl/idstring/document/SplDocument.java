package spl.idstring.document;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parsed SPL substance document with navigation to its main and auxiliary substance elements.
 */
public final class SplDocument {

    public static final String NAMESPACE = "urn:hl7-org:v3";
    public static final Map<String, String> NAMESPACES = Map.of("x", NAMESPACE);

    static final String DOCUMENT_PATH = "/x:document[x:code[@code='64124-1']]";
    static final String SECTION_PATH =
            "./x:component/x:structuredBody/x:component/x:section[x:code[@code='48779-3']]";
    static final String MAIN_SUBSTANCE_PATH =
            "./x:subject/x:identifiedSubstance/x:identifiedSubstance[x:code[@codeSystem='2.16.840.1.113883.4.9']]";
    static final String OTHER_SUBSTANCE_PATH =
            "./x:subject/x:identifiedSubstance/x:identifiedSubstance[x:code[@codeSystem!='2.16.840.1.113883.4.9']]";

    private static final Logger LOGGER = LoggerFactory.getLogger(SplDocument.class);

    private final String source;
    private final Document dom;
    private final DocumentQueryService query;

    private Element document;
    private Element section;
    private Element substance;
    private List<Element> otherSubstances;

    private SplDocument(String source, Document dom) {
        this.source = source;
        this.dom = dom;
        this.query = new XPathQueryService(NAMESPACES);
    }

    public static SplDocument read(Path path) {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (IOException ex) {
            throw new DocumentLoadException("Failed to read document: " + path, ex);
        }
    }

    public static SplDocument parse(String xml) {
        Objects.requireNonNull(xml, "xml");
        return parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "<string>");
    }

    public static SplDocument parse(InputStream in, String source) {
        try {
            DocumentBuilder builder = newDocumentBuilderFactory().newDocumentBuilder();
            builder.setErrorHandler(new StrictErrorHandler(source));
            return new SplDocument(source, builder.parse(in));
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser is not configurable", ex);
        } catch (SAXException ex) {
            throw new DocumentLoadException("Document is not well-formed XML: " + source, ex);
        } catch (IOException ex) {
            throw new DocumentLoadException("Failed to read document: " + source, ex);
        }
    }

    public String source() {
        return source;
    }

    public DocumentQueryService query() {
        return query;
    }

    /**
     * Root {@code document} element carrying the substance indexing code.
     */
    public Element document() {
        if (document == null) {
            document = unique(dom, DOCUMENT_PATH, "Document element");
        }
        return document;
    }

    public Element section() {
        if (section == null) {
            section = unique(document(), SECTION_PATH, "Section element");
        }
        return section;
    }

    /**
     * The substance the document identifies (coded in the UNII system).
     */
    public Element substance() {
        if (substance == null) {
            substance = unique(section(), MAIN_SUBSTANCE_PATH, "Main substance element");
        }
        return substance;
    }

    /**
     * Auxiliary substances such as irregular amino acid polymers; possibly empty.
     */
    public List<Element> otherSubstances() {
        if (otherSubstances == null) {
            otherSubstances = query.select(section(), OTHER_SUBSTANCE_PATH).stream()
                    .map(Element.class::cast)
                    .toList();
        }
        return otherSubstances;
    }

    private Element unique(Node context, String path, String description) {
        List<Node> nodes = query.select(context, path);
        if (nodes.size() != 1) {
            throw new DocumentStructureException(description + " must be present and unique, found " + nodes.size());
        }
        return (Element) nodes.get(0);
    }

    private static DocumentBuilderFactory newDocumentBuilderFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setCoalescing(true);
        factory.setIgnoringComments(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setExpandEntityReferences(false);
        return factory;
    }

    private record StrictErrorHandler(String source) implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            LOGGER.warn("XML warning in {} at line {}: {}", source, exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
