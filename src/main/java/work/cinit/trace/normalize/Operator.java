package work.cinit.trace.normalize;

import java.util.Optional;

/**
 * Binary operators of the normalized language, with their binding strength for rendering and parsing.
 */
public enum Operator {
    OR("or", 1),
    AND("and", 2),
    EQ("==", 4),
    NE("!=", 4),
    LT("<", 4),
    LE("<=", 4),
    GT(">", 4),
    GE(">=", 4),
    BIT_OR("|", 5),
    BIT_XOR("^", 6),
    BIT_AND("&", 7),
    SHL("<<", 8),
    SHR(">>", 8),
    ADD("+", 9),
    SUB("-", 9),
    MUL("*", 10),
    DIV("/", 10),
    MOD("%", 10);

    /** Binding strength of prefix operators ({@code -x}, {@code ~x}); {@code not} binds at 3. */
    public static final int UNARY_PRECEDENCE = 11;
    public static final int NOT_PRECEDENCE = 3;

    private final String symbol;
    private final int precedence;

    Operator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    public boolean isComparison() {
        return precedence == 4;
    }

    /** Spelling used between operands: logical operators are padded with spaces. */
    public String spelled() {
        return isLogical() ? " " + symbol + " " : symbol;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        for (var op : values()) {
            if (op.symbol.equals(symbol)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }

    /** Maps a C operator token; {@code &&} and {@code ||} become the logical operators. */
    public static Optional<Operator> fromC(String token) {
        return switch (token) {
            case "&&" -> Optional.of(AND);
            case "||" -> Optional.of(OR);
            default -> fromSymbol(token);
        };
    }
}
