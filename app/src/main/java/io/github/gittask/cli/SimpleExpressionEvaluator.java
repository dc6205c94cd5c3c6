package io.github.gittask.cli;

import io.github.gittask.exception.ValidationException;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Recursive-descent evaluator for conditions such as {@code priority == "HIGH" && !(estimate > 3)}. Supports
 * {@code || && ! == != < <= > >=}, parentheses, quoted strings, numbers, {@code true}/{@code false} and variable
 * names. Comparisons are numeric when both sides are numbers; an unknown variable is the empty string.
 */
public class SimpleExpressionEvaluator implements ExpressionEvaluator {

    @Override
    public boolean test(String expression, Map<String, String> variables) throws ValidationException {
        var parser = new Parser(expression, variables);
        Object value = parser.parseOr();
        parser.skipSpaces();
        if (!parser.atEnd()) {
            throw parser.error("Unexpected input");
        }
        return truthy(value);
    }

    static boolean truthy(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Double d) {
            return d != 0;
        }
        return !value.toString().isEmpty();
    }

    private static final class Parser {
        private final String text;
        private final Map<String, String> variables;
        private int pos;

        Parser(String text, Map<String, String> variables) {
            this.text = text;
            this.variables = variables;
        }

        ValidationException error(String message) {
            return new ValidationException(message + " at position " + pos + " in '" + text + "'");
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        void skipSpaces() {
            while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        boolean accept(String token) {
            skipSpaces();
            if (text.startsWith(token, pos)) {
                pos += token.length();
                return true;
            }
            return false;
        }

        Object parseOr() throws ValidationException {
            Object left = parseAnd();
            while (accept("||")) {
                Object right = parseAnd();
                left = truthy(left) || truthy(right);
            }
            return left;
        }

        Object parseAnd() throws ValidationException {
            Object left = parseComparison();
            while (accept("&&")) {
                Object right = parseComparison();
                left = truthy(left) && truthy(right);
            }
            return left;
        }

        Object parseComparison() throws ValidationException {
            Object left = parseUnary();
            // two-character operators first
            for (String op : new String[] {"==", "!=", "<=", ">=", "<", ">"}) {
                if (accept(op)) {
                    return compare(op, left, parseUnary());
                }
            }
            return left;
        }

        Object parseUnary() throws ValidationException {
            skipSpaces();
            if (!text.startsWith("!=", pos) && accept("!")) {
                return !truthy(parseUnary());
            }
            return parsePrimary();
        }

        Object parsePrimary() throws ValidationException {
            skipSpaces();
            if (atEnd()) {
                throw error("Unexpected end of expression");
            }
            char c = text.charAt(pos);
            if (c == '(') {
                pos++;
                Object value = parseOr();
                if (!accept(")")) {
                    throw error("Missing )");
                }
                return value;
            }
            if (c == '"' || c == '\'') {
                return parseString(c);
            }
            if (Character.isDigit(c) || (c == '-' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
                int start = pos++;
                while (!atEnd() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
                    pos++;
                }
                try {
                    return Double.parseDouble(text.substring(start, pos));
                } catch (NumberFormatException e) {
                    throw error("Malformed number");
                }
            }
            if (Character.isLetter(c) || c == '_') {
                int start = pos;
                while (!atEnd() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_'
                        || text.charAt(pos) == '.')) {
                    pos++;
                }
                String name = text.substring(start, pos);
                if (name.equals("true") || name.equals("false")) {
                    return Boolean.parseBoolean(name);
                }
                return variables.getOrDefault(name, "");
            }
            throw error("Unexpected character '" + c + "'");
        }

        String parseString(char quote) throws ValidationException {
            var sb = new StringBuilder();
            pos++;
            while (!atEnd() && text.charAt(pos) != quote) {
                char c = text.charAt(pos++);
                if (c == '\\' && !atEnd()) {
                    c = text.charAt(pos++);
                }
                sb.append(c);
            }
            if (atEnd()) {
                throw error("Unterminated string");
            }
            pos++;
            return sb.toString();
        }

        private static Object compare(String op, Object left, Object right) {
            @Nullable Double l = asNumber(left);
            @Nullable Double r = asNumber(right);
            int cmp;
            if (l != null && r != null) {
                cmp = Double.compare(l, r);
            } else {
                cmp = asString(left).compareTo(asString(right));
            }
            return switch (op) {
                case "==" -> cmp == 0;
                case "!=" -> cmp != 0;
                case "<" -> cmp < 0;
                case "<=" -> cmp <= 0;
                case ">" -> cmp > 0;
                default -> cmp >= 0;
            };
        }

        private static @Nullable Double asNumber(Object value) {
            if (value instanceof Double d) {
                return d;
            }
            if (value instanceof Boolean) {
                return null;
            }
            try {
                return Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }

        private static String asString(Object value) {
            if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString(d.longValue());
            }
            return value.toString();
        }
    }
}
