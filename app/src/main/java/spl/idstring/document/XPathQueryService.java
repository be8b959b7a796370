package spl.idstring.document;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.xml.namespace.NamespaceContext;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.w3c.dom.Text;

/**
 * {@link DocumentQueryService} backed by the JDK XPath 1.0 engine. Compiled expressions are cached per instance;
 * instances are not thread-safe.
 */
public class XPathQueryService implements DocumentQueryService {

    private final XPath xpath;
    private final Map<String, XPathExpression> compiled = new HashMap<>();

    public XPathQueryService(Map<String, String> namespaces) {
        Objects.requireNonNull(namespaces, "namespaces");
        this.xpath = XPathFactory.newInstance().newXPath();
        this.xpath.setNamespaceContext(new PrefixNamespaceContext(Map.copyOf(namespaces)));
    }

    @Override
    public List<Node> select(Node context, String path) {
        Objects.requireNonNull(context, "context");
        NodeList nodeList;
        try {
            nodeList = (NodeList) compile(path).evaluate(context, XPathConstants.NODESET);
        } catch (XPathExpressionException ex) {
            throw new IllegalArgumentException("Failed to evaluate path expression: " + path, ex);
        }
        List<Node> nodes = new ArrayList<>(nodeList.getLength());
        for (int i = 0; i < nodeList.getLength(); i++) {
            nodes.add(nodeList.item(i));
        }
        return nodes;
    }

    @Override
    public List<String> values(Node context, String path) {
        List<String> values = new ArrayList<>();
        for (Node node : select(context, path)) {
            values.add(stringValue(node).strip());
        }
        return values;
    }

    private XPathExpression compile(String path) {
        XPathExpression expression = compiled.get(path);
        if (expression == null) {
            try {
                expression = xpath.compile(path);
            } catch (XPathExpressionException ex) {
                throw new IllegalArgumentException("Invalid path expression: " + path, ex);
            }
            compiled.put(path, expression);
        }
        return expression;
    }

    private static String stringValue(Node node) {
        if (node instanceof Attr attr) {
            return attr.getValue();
        }
        if (node instanceof Text text) {
            return text.getData();
        }
        String content = node.getTextContent();
        return content == null ? "" : content;
    }

    private record PrefixNamespaceContext(Map<String, String> namespaces) implements NamespaceContext {

        @Override
        public String getNamespaceURI(String prefix) {
            return namespaces.getOrDefault(prefix, javax.xml.XMLConstants.NULL_NS_URI);
        }

        @Override
        public String getPrefix(String namespaceUri) {
            return namespaces.entrySet().stream()
                    .filter(entry -> entry.getValue().equals(namespaceUri))
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElse(null);
        }

        @Override
        public Iterator<String> getPrefixes(String namespaceUri) {
            return namespaces.entrySet().stream()
                    .filter(entry -> entry.getValue().equals(namespaceUri))
                    .map(Map.Entry::getKey)
                    .iterator();
        }
    }
}
