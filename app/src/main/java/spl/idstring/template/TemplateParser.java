package spl.idstring.template;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass parser turning a template string into literal and variable nodes.
 *
 * <p>Variables are written {@code {{ name|transform:param,param|transform }}}. A parameter may be enclosed in
 * double quotes to include {@code |}, {@code ,} or spaces literally. The parser is a small state machine:
 * end of input is only legal while scanning literal text.
 */
final class TemplateParser {

    static final String OPEN = "{{ ";
    static final String CLOSE = " }}";

    private static final char PIPE = '|';
    private static final char SPACE = ' ';
    private static final char COLON = ':';
    private static final char COMMA = ',';
    private static final char QUOTE = '"';

    enum State {
        SCAN_LITERAL,
        SCAN_NAME,
        SCAN_TRANSFORM_NAME,
        SCAN_PARAM
    }

    private final String input;
    private final List<TemplateNode> nodes = new ArrayList<>();

    private State state = State.SCAN_LITERAL;
    private int offset;
    private int variableStart;
    private String variableName;
    private List<Transform> transforms;
    private String transformName;
    private List<String> parameters;

    private TemplateParser(String input) {
        this.input = input;
    }

    static List<TemplateNode> parse(String input) {
        if (input == null) {
            throw new TemplateSyntaxException("Template string must not be null");
        }
        return new TemplateParser(input).run();
    }

    private List<TemplateNode> run() {
        while (offset < input.length()) {
            switch (state) {
                case SCAN_LITERAL -> scanLiteral();
                case SCAN_NAME -> scanName();
                case SCAN_TRANSFORM_NAME -> scanTransformName();
                case SCAN_PARAM -> scanParameter();
            }
        }
        if (state != State.SCAN_LITERAL) {
            throw new TemplateSyntaxException("Missing closing '" + CLOSE.trim() + "' for variable", variableStart);
        }
        return List.copyOf(nodes);
    }

    private void scanLiteral() {
        int open = input.indexOf(OPEN, offset);
        if (open < 0) {
            nodes.add(new LiteralNode(input.substring(offset)));
            offset = input.length();
            return;
        }
        if (open > offset) {
            nodes.add(new LiteralNode(input.substring(offset, open)));
        }
        variableStart = open;
        variableName = null;
        transforms = new ArrayList<>();
        offset = open + OPEN.length();
        state = State.SCAN_NAME;
    }

    private void scanName() {
        int start = offset;
        String name = readUntil(PIPE, SPACE);
        if (name.isEmpty()) {
            throw new TemplateSyntaxException("Empty variable name", start);
        }
        variableName = name;
        if (atEnd()) {
            return;
        }
        if (current() == PIPE) {
            offset++;
            state = State.SCAN_TRANSFORM_NAME;
        } else {
            closeVariable();
        }
    }

    private void scanTransformName() {
        int start = offset;
        String name = readUntil(PIPE, SPACE, COLON);
        if (name.isEmpty()) {
            throw new TemplateSyntaxException("Empty transform name", start);
        }
        transformName = name;
        parameters = new ArrayList<>();
        if (atEnd()) {
            return;
        }
        switch (current()) {
            case COLON -> {
                offset++;
                state = State.SCAN_PARAM;
            }
            case PIPE -> {
                finishTransform();
                offset++;
            }
            default -> {
                finishTransform();
                closeVariable();
            }
        }
    }

    private void scanParameter() {
        int start = offset;
        String parameter;
        if (current() == QUOTE) {
            int closingQuote = input.indexOf(QUOTE, offset + 1);
            if (closingQuote < 0) {
                throw new TemplateSyntaxException("Unterminated quoted parameter", start);
            }
            parameter = input.substring(offset + 1, closingQuote);
            offset = closingQuote + 1;
            if (!atEnd() && current() != PIPE && current() != COMMA && current() != SPACE) {
                throw new TemplateSyntaxException("Unexpected character '" + current() + "' after quoted parameter", offset);
            }
        } else {
            parameter = readUntil(PIPE, SPACE, COMMA);
            if (parameter.isEmpty()) {
                throw new TemplateSyntaxException("Empty parameter for transform '" + transformName + "'", start);
            }
            int quote = parameter.indexOf(QUOTE);
            if (quote >= 0) {
                throw new TemplateSyntaxException("Unexpected quote inside unquoted parameter", start + quote);
            }
        }
        if (atEnd()) {
            return;
        }
        parameters.add(parameter);
        switch (current()) {
            case COMMA -> offset++;
            case PIPE -> {
                finishTransform();
                offset++;
                state = State.SCAN_TRANSFORM_NAME;
            }
            default -> {
                finishTransform();
                closeVariable();
            }
        }
    }

    private void finishTransform() {
        transforms.add(new Transform(transformName, parameters));
        transformName = null;
        parameters = null;
    }

    private void closeVariable() {
        if (!input.startsWith(CLOSE, offset)) {
            throw new TemplateSyntaxException("Expected '" + CLOSE.trim() + "' after variable expression", offset);
        }
        nodes.add(new VariableNode(new Variable(variableName, transforms)));
        offset += CLOSE.length();
        state = State.SCAN_LITERAL;
    }

    private String readUntil(char... stops) {
        int start = offset;
        while (!atEnd() && !isStop(current(), stops)) {
            offset++;
        }
        return input.substring(start, offset);
    }

    private static boolean isStop(char ch, char[] stops) {
        for (char stop : stops) {
            if (ch == stop) {
                return true;
            }
        }
        return false;
    }

    private boolean atEnd() {
        return offset >= input.length();
    }

    private char current() {
        return input.charAt(offset);
    }
}
