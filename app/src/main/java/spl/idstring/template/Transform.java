package spl.idstring.template;

import java.util.List;
import java.util.Objects;

/**
 * A transform applied to a variable value: function name plus its string parameters.
 */
public record Transform(String name, List<String> parameters) {

    public Transform {
        Objects.requireNonNull(name, "name");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public Object apply(Object value) {
        return TransformFunction.resolve(name).apply(value, parameters);
    }

    void validate() {
        TransformFunction.resolve(name).checkParameters(parameters);
    }
}
