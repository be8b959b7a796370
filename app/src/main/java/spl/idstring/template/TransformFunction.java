package spl.idstring.template;

import java.util.ArrayList;
import java.util.List;

/**
 * Functions available in a variable's transform pipeline.
 * Both pass non-list values through unchanged.
 */
enum TransformFunction {

    SORT("sort", 0) {
        @Override
        Object apply(Object value, List<String> parameters) {
            checkParameters(parameters);
            if (!(value instanceof List<?> list)) {
                return value;
            }
            List<Object> sorted = new ArrayList<>(list);
            sorted.sort(Values.NATURAL_ORDER);
            return sorted;
        }
    },

    JOIN("join", 1) {
        @Override
        Object apply(Object value, List<String> parameters) {
            checkParameters(parameters);
            if (!(value instanceof List<?>)) {
                return value;
            }
            return Values.render(value, parameters.get(0));
        }
    };

    private final String functionName;
    private final int arity;

    TransformFunction(String functionName, int arity) {
        this.functionName = functionName;
        this.arity = arity;
    }

    abstract Object apply(Object value, List<String> parameters);

    void checkParameters(List<String> parameters) {
        if (parameters.size() != arity) {
            throw new TemplateSyntaxException("Transform '" + functionName + "' expects " + arity
                    + " parameter(s) but got " + parameters.size());
        }
    }

    static TransformFunction resolve(String name) {
        for (TransformFunction function : values()) {
            if (function.functionName.equals(name)) {
                return function;
            }
        }
        throw new TemplateSyntaxException("Unknown transform: " + name);
    }
}
