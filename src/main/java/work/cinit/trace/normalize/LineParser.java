package work.cinit.trace.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.cinit.trace.shared.CLiterals;
import work.cinit.trace.shared.ExtractionException;

/**
 * Parses rendered normalized lines back into statements. Used for override replacement text, so it
 * also accepts the C spellings {@code &&}, {@code ||} and {@code !}.
 */
public final class LineParser {
    public static final String INVALID_LINE = "invalid-line";

    private static final Pattern TOKEN = Pattern.compile(
        "\\s*(?:"
            + "(?<number>0[xX][0-9a-fA-F']+[uUlL]*|(?:\\d[\\d']*\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?[fFuUlL]*)"
            + "|(?<string>\"(?:[^\"\\\\]|\\\\.)*\")"
            + "|(?<char>'(?:[^'\\\\]|\\\\.)+')"
            + "|(?<name>[A-Za-z_][A-Za-z0-9_]*)"
            + "|(?<op>->|<<|>>|<=|>=|==|!=|&&|\\|\\||[-+*/%<>&|^~!=()\\[\\],.:])"
            + ")"
    );

    private final String source;
    private final List<String> tokens = new ArrayList<>();
    private final List<Kind> kinds = new ArrayList<>();
    private int position;

    private LineParser(String source) {
        this.source = source;
        tokenize();
    }

    /**
     * Parses one or more statements separated by newlines or top-level semicolons.
     */
    public static List<Statement> parseStatements(String text, int line) {
        var statements = new ArrayList<Statement>();
        for (var part : splitStatements(text)) {
            String trimmed = part.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (trimmed.startsWith("#")) {
                statements.add(new Statement.InertLine(trimmed.substring(1).strip(), line));
                continue;
            }
            statements.add(new LineParser(trimmed).statement(line));
        }
        return statements;
    }

    public static Expr parseExpression(String text) {
        var parser = new LineParser(text.strip());
        var expr = parser.conditional();
        parser.expectEnd();
        return expr;
    }

    /**
     * Extracts the condition from an {@code if (...):} or {@code while (...):} header.
     */
    public static Expr parseCondition(String header) {
        String text = header.strip();
        if (text.endsWith(":")) {
            text = text.substring(0, text.length() - 1).strip();
        }
        if (text.startsWith("if ")) {
            text = text.substring(3);
        } else if (text.startsWith("while ")) {
            text = text.substring(6);
        }
        return parseExpression(text);
    }

    private Statement statement(int line) {
        var target = conditional();
        if (peekIs("=")) {
            position++;
            if (!(target instanceof Expr.Name) && !(target instanceof Expr.Subscript) && !(target instanceof Expr.Field)) {
                throw error("Cannot assign to " + target.render());
            }
            var value = conditional();
            expectEnd();
            return new Statement.Assignment(target, value, line);
        }
        expectEnd();
        return new Statement.ExpressionStatement(target, line);
    }

    private Expr conditional() {
        var value = binary(Operator.OR.precedence());
        if (peekIs("if")) {
            position++;
            var condition = binary(Operator.OR.precedence());
            expect("else");
            var otherwise = conditional();
            return new Expr.Conditional(condition, value, otherwise);
        }
        return value;
    }

    private Expr binary(int minimum) {
        var left = prefix();
        while (true) {
            var op = peekOperator();
            if (op == null || op.precedence() < minimum) {
                return left;
            }
            position++;
            var right = binary(op.precedence() + 1);
            left = new Expr.Binary(op, left, right);
        }
    }

    private Expr prefix() {
        if (peekIs("not") || peekIs("!")) {
            position++;
            return new Expr.Unary("not", binary(Operator.NOT_PRECEDENCE + 1));
        }
        return unary();
    }

    private Expr unary() {
        if (peekIs("-") || peekIs("+") || peekIs("~")) {
            String op = tokens.get(position++);
            var operand = unary();
            if ("-".equals(op) && operand instanceof Expr.IntLit literal) {
                return new Expr.IntLit(-literal.value());
            }
            if ("-".equals(op) && operand instanceof Expr.FloatLit literal) {
                return new Expr.FloatLit(-literal.value());
            }
            return new Expr.Unary(op, operand);
        }
        return postfix(primary());
    }

    private Expr postfix(Expr expr) {
        while (true) {
            if (peekIs("(")) {
                position++;
                var arguments = new ArrayList<Expr>();
                if (!peekIs(")")) {
                    do {
                        arguments.add(conditional());
                    } while (accept(","));
                }
                expect(")");
                expr = new Expr.Call(expr, arguments);
            } else if (peekIs("[")) {
                position++;
                var index = conditional();
                expect("]");
                expr = new Expr.Subscript(expr, index);
            } else if (peekIs(".") || peekIs("->")) {
                boolean arrow = tokens.get(position++).equals("->");
                if (peekKind() != Kind.NAME) {
                    throw error("Expected field name");
                }
                expr = new Expr.Field(expr, tokens.get(position++), arrow);
            } else {
                return expr;
            }
        }
    }

    private Expr literal(String token, Kind kind) {
        if (kind == Kind.NUMBER) {
            Number number = CLiterals.parseNumber(token);
            return number instanceof Double d ? new Expr.FloatLit(d) : new Expr.IntLit(number.longValue());
        }
        if (kind == Kind.CHAR) {
            return new Expr.IntLit(CLiterals.decodeChar(token));
        }
        var builder = new StringBuilder(CLiterals.decodeString(token));
        while (peekKind() == Kind.STRING) {
            builder.append(CLiterals.decodeString(tokens.get(position++)));
        }
        return new Expr.StrLit(builder.toString());
    }

    private Expr primary() {
        if (position >= tokens.size()) {
            throw error("Unexpected end of line");
        }
        String token = tokens.get(position);
        Kind kind = kinds.get(position);
        position++;
        if (kind == Kind.NUMBER || kind == Kind.STRING || kind == Kind.CHAR) {
            try {
                return literal(token, kind);
            } catch (IllegalArgumentException ex) {
                throw error("Malformed literal " + token);
            }
        }
        switch (kind) {
            case NAME -> {
                return switch (token) {
                    case "True", "true" -> new Expr.BoolLit(true);
                    case "False", "false" -> new Expr.BoolLit(false);
                    case "None" -> Expr.NoneLit.INSTANCE;
                    default -> new Expr.Name(token);
                };
            }
            default -> {
                if ("(".equals(token)) {
                    var inner = conditional();
                    expect(")");
                    return inner;
                }
                if ("[".equals(token)) {
                    var elements = new ArrayList<Expr>();
                    while (!peekIs("]")) {
                        elements.add(conditional());
                        if (!accept(",")) {
                            break;
                        }
                    }
                    expect("]");
                    return new Expr.ListLit(elements);
                }
                throw error("Unexpected token '" + token + "'");
            }
        }
    }

    private Operator peekOperator() {
        if (position >= tokens.size()) {
            return null;
        }
        var kind = kinds.get(position);
        if (kind != Kind.OP && kind != Kind.NAME) {
            return null;
        }
        String token = tokens.get(position);
        if (kind == Kind.NAME && !token.equals("and") && !token.equals("or")) {
            return null;
        }
        return Operator.fromC(token).orElse(null);
    }

    private boolean peekIs(String token) {
        return position < tokens.size() && tokens.get(position).equals(token) && kinds.get(position) != Kind.STRING;
    }

    private Kind peekKind() {
        return position < tokens.size() ? kinds.get(position) : null;
    }

    private boolean accept(String token) {
        if (peekIs(token)) {
            position++;
            return true;
        }
        return false;
    }

    private void expect(String token) {
        if (!accept(token)) {
            throw error("Expected '" + token + "'");
        }
    }

    private void expectEnd() {
        if (position < tokens.size()) {
            throw error("Unexpected trailing '" + tokens.get(position) + "'");
        }
    }

    private ExtractionException error(String message) {
        return new ExtractionException(INVALID_LINE, message + " in normalized line: " + source);
    }

    private void tokenize() {
        Matcher matcher = TOKEN.matcher(source);
        int offset = 0;
        while (offset < source.length()) {
            if (source.substring(offset).isBlank()) {
                break;
            }
            matcher.region(offset, source.length());
            if (!matcher.lookingAt()) {
                throw error("Unexpected character at offset " + offset);
            }
            if (matcher.group("number") != null) {
                add(matcher.group("number"), Kind.NUMBER);
            } else if (matcher.group("string") != null) {
                add(matcher.group("string"), Kind.STRING);
            } else if (matcher.group("char") != null) {
                add(matcher.group("char"), Kind.CHAR);
            } else if (matcher.group("name") != null) {
                add(matcher.group("name"), Kind.NAME);
            } else {
                add(matcher.group("op"), Kind.OP);
            }
            offset = matcher.end();
        }
    }

    private void add(String token, Kind kind) {
        tokens.add(token);
        kinds.add(kind);
    }

    static List<String> splitStatements(String text) {
        var parts = new ArrayList<String>();
        var current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                current.append(ch);
                if (ch == '\\' && i + 1 < text.length()) {
                    current.append(text.charAt(++i));
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '#' && current.toString().isBlank()) {
                int end = text.indexOf('\n', i);
                end = end < 0 ? text.length() : end;
                current.append(text, i, end);
                i = end - 1;
                continue;
            }
            switch (ch) {
                case '"', '\'' -> {
                    quote = ch;
                    current.append(ch);
                }
                case '(', '[' -> {
                    depth++;
                    current.append(ch);
                }
                case ')', ']' -> {
                    depth--;
                    current.append(ch);
                }
                case ';', '\n' -> {
                    if (depth > 0 && ch == ';') {
                        current.append(ch);
                    } else {
                        parts.add(current.toString());
                        current.setLength(0);
                    }
                }
                default -> current.append(ch);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    private enum Kind {
        NUMBER,
        STRING,
        CHAR,
        NAME,
        OP
    }
}
