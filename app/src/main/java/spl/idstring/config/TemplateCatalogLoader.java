package spl.idstring.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spl.idstring.template.TemplateCatalog;
import spl.idstring.template.TemplateDefinition;
import spl.idstring.template.TemplateSyntaxException;

/**
 * Reads the template configuration: a JSON object mapping template names to
 * {@code {"attributes": [...], "template": "..."}}. Every template is parsed and validated while loading.
 */
public class TemplateCatalogLoader {

    public static final String DEFAULT_RESOURCE = "/templates.json";

    static final String ATTRIBUTES_FIELD = "attributes";
    static final String TEMPLATE_FIELD = "template";

    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateCatalogLoader.class);

    private final ObjectMapper objectMapper;

    public TemplateCatalogLoader() {
        this(new ObjectMapper());
    }

    public TemplateCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TemplateCatalog load(Optional<Path> path) {
        return path.map(this::load).orElseGet(this::loadDefault);
    }

    public TemplateCatalog loadDefault() {
        try (InputStream in = TemplateCatalogLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Bundled template configuration not found: " + DEFAULT_RESOURCE);
            }
            return read(in, "classpath:" + DEFAULT_RESOURCE);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read bundled template configuration", ex);
        }
    }

    public TemplateCatalog load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read template configuration: " + path, ex);
        }
    }

    /**
     * @throws IllegalArgumentException when the configuration is not shaped as expected
     * @throws TemplateSyntaxException when a template string is malformed
     */
    TemplateCatalog read(InputStream in, String source) throws IOException {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Template configuration is not valid JSON: " + source, ex);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Template configuration must be a JSON object: " + source);
        }
        List<TemplateDefinition> definitions = new ArrayList<>();
        for (Iterator<Map.Entry<String, JsonNode>> fields = root.fields(); fields.hasNext(); ) {
            Map.Entry<String, JsonNode> field = fields.next();
            definitions.add(definition(field.getKey(), field.getValue(), source));
        }
        TemplateCatalog catalog = new TemplateCatalog(definitions);
        LOGGER.debug("Loaded templates {} from {}", catalog.names(), source);
        return catalog;
    }

    private TemplateDefinition definition(String name, JsonNode node, String source) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Template '" + name + "' must be a JSON object in " + source);
        }
        JsonNode template = node.get(TEMPLATE_FIELD);
        if (template == null || !template.isTextual()) {
            throw new IllegalArgumentException("Template '" + name + "' lacks a string '" + TEMPLATE_FIELD + "' in " + source);
        }
        List<String> attributes = new ArrayList<>();
        JsonNode attributeNodes = node.get(ATTRIBUTES_FIELD);
        if (attributeNodes != null) {
            if (!attributeNodes.isArray()) {
                throw new IllegalArgumentException("Template '" + name + "' '" + ATTRIBUTES_FIELD + "' must be an array in " + source);
            }
            for (JsonNode attribute : attributeNodes) {
                if (!attribute.isTextual()) {
                    throw new IllegalArgumentException("Template '" + name + "' attribute names must be strings in " + source);
                }
                attributes.add(attribute.asText());
            }
        }
        return TemplateDefinition.of(name, attributes, template.asText());
    }
}
