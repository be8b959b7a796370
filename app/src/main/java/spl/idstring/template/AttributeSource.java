package spl.idstring.template;

import java.util.Optional;

/**
 * Exposes named attribute values to a {@link TemplateInstance}.
 * An attribute the source does not declare is reported as {@link Optional#empty()}.
 */
@FunctionalInterface
public interface AttributeSource {

    Optional<Object> attribute(String name);
}
