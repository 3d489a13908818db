package work.lcod.session.resource;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A single line of a requirement program, e.g. {@code package.name == 'bluez' and package.version >= 5}.
 *
 * <p>Every expression references exactly one resource (the id of the resource job). It holds for a
 * resource list when at least one record satisfies it; a record lacking a referenced attribute never
 * does.
 */
public final class ResourceExpression {
    private final String text;
    private final String resourceId;
    private final Node root;

    public ResourceExpression(String text) {
        this.text = Objects.requireNonNull(text, "text").strip();
        var parser = new Parser(this.text, tokenize(this.text));
        this.root = parser.parseExpression();
        if (parser.resourceIds.isEmpty()) {
            throw new ResourceProgramException(this.text, "expression did not reference any resources");
        }
        if (parser.resourceIds.size() > 1) {
            throw new ResourceProgramException(this.text, "expression referenced multiple resources " + parser.resourceIds);
        }
        this.resourceId = parser.resourceIds.iterator().next();
    }

    public String text() {
        return text;
    }

    public String resourceId() {
        return resourceId;
    }

    public boolean evaluate(List<ResourceRecord> records) {
        if (records == null) {
            return false;
        }
        for (var record : records) {
            try {
                if (truthy(root.eval(record))) {
                    return true;
                }
            } catch (MissingAttributeException ex) {
                // this record cannot satisfy the expression
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ResourceExpression expr && expr.text.equals(text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }

    private interface Node {
        Object eval(ResourceRecord record);
    }

    private enum TokenType { IDENT, STRING, NUMBER, OP, KEYWORD, LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, END }

    private record Token(TokenType type, String text) {}

    private static final class MissingAttributeException extends RuntimeException {
        MissingAttributeException(String attribute) {
            super(attribute, null, false, false);
        }
    }

    private static List<Token> tokenize(String text) {
        var tokens = new ArrayList<Token>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '\'' || c == '"') {
                var sb = new StringBuilder();
                int j = i + 1;
                while (j < text.length() && text.charAt(j) != c) {
                    char ch = text.charAt(j);
                    if (ch == '\\' && j + 1 < text.length()) {
                        j++;
                        ch = text.charAt(j);
                    }
                    sb.append(ch);
                    j++;
                }
                if (j >= text.length()) {
                    throw new ResourceProgramException(text, "unterminated string literal");
                }
                tokens.add(new Token(TokenType.STRING, sb.toString()));
                i = j + 1;
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < text.length() && Character.isDigit(text.charAt(i + 1)))) {
                int j = i + 1;
                while (j < text.length() && (Character.isDigit(text.charAt(j)) || text.charAt(j) == '.')) {
                    j++;
                }
                tokens.add(new Token(TokenType.NUMBER, text.substring(i, j)));
                i = j;
            } else if (Character.isLetter(c) || c == '_') {
                int j = i + 1;
                while (j < text.length() && isIdentifierPart(text.charAt(j))) {
                    j++;
                }
                String word = text.substring(i, j);
                boolean keyword = "and".equals(word) || "or".equals(word) || "not".equals(word) || "in".equals(word);
                tokens.add(new Token(keyword ? TokenType.KEYWORD : TokenType.IDENT, word));
                i = j;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")"));
                i++;
            } else if (c == '[') {
                tokens.add(new Token(TokenType.LBRACKET, "["));
                i++;
            } else if (c == ']') {
                tokens.add(new Token(TokenType.RBRACKET, "]"));
                i++;
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ","));
                i++;
            } else if (c == '=' || c == '!' || c == '<' || c == '>') {
                boolean twoChar = i + 1 < text.length() && text.charAt(i + 1) == '=';
                String op = twoChar ? text.substring(i, i + 2) : String.valueOf(c);
                if ("=".equals(op) || "!".equals(op)) {
                    throw new ResourceProgramException(text, "unsupported operator '" + op + "'");
                }
                tokens.add(new Token(TokenType.OP, op));
                i += op.length();
            } else {
                throw new ResourceProgramException(text, "unexpected character '" + c + "'");
            }
        }
        tokens.add(new Token(TokenType.END, ""));
        return tokens;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == ':' || c == '-';
    }

    private static final class Parser {
        private final String text;
        private final List<Token> tokens;
        private final Set<String> resourceIds = new LinkedHashSet<>();
        private int pos;

        Parser(String text, List<Token> tokens) {
            this.text = text;
            this.tokens = tokens;
        }

        Node parseExpression() {
            var node = parseOr();
            if (peek().type() != TokenType.END) {
                throw error("unexpected '" + peek().text() + "'");
            }
            return node;
        }

        private Node parseOr() {
            var left = parseAnd();
            while (isKeyword("or")) {
                pos++;
                var l = left;
                var r = parseAnd();
                left = record -> truthy(l.eval(record)) || truthy(r.eval(record));
            }
            return left;
        }

        private Node parseAnd() {
            var left = parseNot();
            while (isKeyword("and")) {
                pos++;
                var l = left;
                var r = parseNot();
                left = record -> truthy(l.eval(record)) && truthy(r.eval(record));
            }
            return left;
        }

        private Node parseNot() {
            if (isKeyword("not")) {
                pos++;
                var inner = parseNot();
                return record -> !truthy(inner.eval(record));
            }
            return parseComparison();
        }

        private Node parseComparison() {
            var left = parseOperand();
            String op;
            if (peek().type() == TokenType.OP) {
                op = next().text();
            } else if (isKeyword("in")) {
                pos++;
                op = "in";
            } else if (isKeyword("not") && tokens.get(pos + 1).type() == TokenType.KEYWORD && "in".equals(tokens.get(pos + 1).text())) {
                pos += 2;
                op = "not in";
            } else {
                return left;
            }
            var right = parseOperand();
            String operator = op;
            return record -> compare(operator, left.eval(record), right.eval(record));
        }

        private Node parseOperand() {
            var token = next();
            switch (token.type()) {
                case IDENT -> {
                    int dot = token.text().lastIndexOf('.');
                    if (dot <= 0 || dot == token.text().length() - 1) {
                        throw error("bare name '" + token.text() + "' is not allowed, use resource.attribute");
                    }
                    String resource = token.text().substring(0, dot);
                    String attribute = token.text().substring(dot + 1);
                    resourceIds.add(resource);
                    return record -> record.get(attribute).orElseThrow(() -> new MissingAttributeException(attribute));
                }
                case STRING -> {
                    String value = token.text();
                    return record -> value;
                }
                case NUMBER -> {
                    var value = parseNumber(token.text());
                    return record -> value;
                }
                case LPAREN -> {
                    var first = parseOr();
                    if (peek().type() == TokenType.COMMA) {
                        var items = new ArrayList<Node>();
                        items.add(first);
                        while (peek().type() == TokenType.COMMA) {
                            pos++;
                            if (peek().type() == TokenType.RPAREN) {
                                break;
                            }
                            items.add(parseOr());
                        }
                        expect(TokenType.RPAREN);
                        return listNode(items);
                    }
                    expect(TokenType.RPAREN);
                    return first;
                }
                case LBRACKET -> {
                    var items = new ArrayList<Node>();
                    while (peek().type() != TokenType.RBRACKET) {
                        items.add(parseOr());
                        if (peek().type() != TokenType.COMMA) {
                            break;
                        }
                        pos++;
                    }
                    expect(TokenType.RBRACKET);
                    return listNode(items);
                }
                default -> throw error("unexpected '" + token.text() + "'");
            }
        }

        private BigDecimal parseNumber(String raw) {
            try {
                return new BigDecimal(raw);
            } catch (NumberFormatException ex) {
                throw error("malformed number '" + raw + "'");
            }
        }

        private Node listNode(List<Node> items) {
            return record -> {
                var values = new ArrayList<Object>(items.size());
                for (var item : items) {
                    values.add(item.eval(record));
                }
                return values;
            };
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private Token next() {
            var token = tokens.get(pos);
            if (token.type() != TokenType.END) {
                pos++;
            }
            return token;
        }

        private boolean isKeyword(String word) {
            var token = peek();
            return token.type() == TokenType.KEYWORD && word.equals(token.text());
        }

        private void expect(TokenType type) {
            var token = next();
            if (token.type() != type) {
                throw error("expected " + type.name().toLowerCase() + " but found '" + token.text() + "'");
            }
        }

        private ResourceProgramException error(String message) {
            return new ResourceProgramException(text, message);
        }
    }

    private static Object compare(String op, Object left, Object right) {
        return switch (op) {
            case "==" -> valueEquals(left, right);
            case "!=" -> !valueEquals(left, right);
            case "<" -> order(left, right) < 0;
            case "<=" -> order(left, right) <= 0;
            case ">" -> order(left, right) > 0;
            case ">=" -> order(left, right) >= 0;
            case "in" -> contains(right, left);
            case "not in" -> !contains(right, left);
            default -> throw new IllegalStateException("Unknown operator " + op);
        };
    }

    private static boolean valueEquals(Object left, Object right) {
        if (left instanceof BigDecimal || right instanceof BigDecimal) {
            var l = asNumber(left);
            var r = asNumber(right);
            if (l != null && r != null) {
                return l.compareTo(r) == 0;
            }
        }
        return Objects.equals(asText(left), asText(right));
    }

    private static int order(Object left, Object right) {
        var l = asNumber(left);
        var r = asNumber(right);
        if (l != null && r != null) {
            return l.compareTo(r);
        }
        return asText(left).compareTo(asText(right));
    }

    private static boolean contains(Object container, Object item) {
        if (container instanceof List<?> list) {
            for (var element : list) {
                if (valueEquals(item, element)) {
                    return true;
                }
            }
            return false;
        }
        return asText(container).contains(asText(item));
    }

    private static BigDecimal asNumber(Object value) {
        if (value instanceof BigDecimal number) {
            return number;
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return new BigDecimal(str.strip());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static String asText(Object value) {
        if (value instanceof BigDecimal number) {
            return number.toPlainString();
        }
        return String.valueOf(value);
    }

    private static boolean truthy(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String str) {
            return !str.isEmpty();
        }
        if (value instanceof BigDecimal number) {
            return number.signum() != 0;
        }
        if (value instanceof List<?> list) {
            return !list.isEmpty();
        }
        return value != null;
    }
}
