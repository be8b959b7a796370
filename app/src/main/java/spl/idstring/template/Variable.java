package spl.idstring.template;

import java.util.List;
import java.util.Objects;

/**
 * Variable reference with its ordered transform pipeline.
 */
public record Variable(String name, List<Transform> transforms) {

    public Variable {
        Objects.requireNonNull(name, "name");
        transforms = transforms == null ? List.of() : List.copyOf(transforms);
    }

    public String placeholder() {
        return "{{ " + name + " }}";
    }
}
