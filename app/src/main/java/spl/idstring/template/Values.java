package spl.idstring.template;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Conversion of context values to text and their natural ordering.
 */
final class Values {

    static final String DEFAULT_SEPARATOR = ";";

    /**
     * Strings compare as strings, integers numerically, everything else by rendered text.
     */
    static final Comparator<Object> NATURAL_ORDER = Values::compare;

    private Values() {
    }

    static String render(Object value, String separator) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof List<?> list) {
            return list.stream()
                    .map(element -> render(element, DEFAULT_SEPARATOR))
                    .collect(Collectors.joining(separator));
        }
        if (value instanceof Renderable renderable) {
            return renderable.render();
        }
        return value.toString();
    }

    private static int compare(Object left, Object right) {
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        if (left instanceof Integer a && right instanceof Integer b) {
            return Integer.compare(a, b);
        }
        return render(left, DEFAULT_SEPARATOR).compareTo(render(right, DEFAULT_SEPARATOR));
    }
}
