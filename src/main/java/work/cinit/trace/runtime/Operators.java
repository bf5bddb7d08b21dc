package work.cinit.trace.runtime;

import java.util.Objects;
import work.cinit.trace.normalize.Operator;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.value.SymbolicValue;
import work.cinit.trace.value.SymbolicValue.ConstantRef;
import work.cinit.trace.value.SymbolicValue.FloatLiteral;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.SymbolRef;
import work.cinit.trace.value.SymbolicValue.TextLiteral;

/**
 * Arithmetic, bitwise and comparison operators over concrete values, following C integer semantics
 * (64-bit, truncating division). Logical operators short-circuit in the evaluator, not here.
 */
public final class Operators {
    private Operators() {}

    public static Object binary(Operator op, Object left, Object right) {
        if (op == Operator.EQ || op == Operator.NE) {
            boolean equal = equal(left, right);
            return NativeLiteral.of(op == Operator.EQ ? equal : !equal);
        }
        if (left instanceof FloatLiteral || right instanceof FloatLiteral) {
            return floating(op, left, right);
        }
        long a = operand(op, left);
        long b = operand(op, right);
        return switch (op) {
            case ADD -> NativeLiteral.of(a + b);
            case SUB -> NativeLiteral.of(a - b);
            case MUL -> NativeLiteral.of(a * b);
            case DIV -> NativeLiteral.of(a / nonZero(b));
            case MOD -> NativeLiteral.of(a % nonZero(b));
            case SHL -> NativeLiteral.of(a << b);
            case SHR -> NativeLiteral.of(a >> b);
            case BIT_AND -> NativeLiteral.of(a & b);
            case BIT_OR -> NativeLiteral.of(a | b);
            case BIT_XOR -> NativeLiteral.of(a ^ b);
            case LT -> NativeLiteral.of(a < b);
            case LE -> NativeLiteral.of(a <= b);
            case GT -> NativeLiteral.of(a > b);
            case GE -> NativeLiteral.of(a >= b);
            default -> throw ExtractionException.invalidOperation("Operator " + op.symbol() + " is evaluated lazily");
        };
    }

    public static Object unary(String op, Object operand) {
        if ("not".equals(op)) {
            var truth = Values.truthiness(operand)
                .orElseThrow(() -> ExtractionException.invalidOperation("Cannot negate symbolic value " + Values.describe(operand)));
            return NativeLiteral.of(!truth);
        }
        if (operand instanceof FloatLiteral floating) {
            return switch (op) {
                case "-" -> new FloatLiteral(-floating.value());
                case "+" -> floating;
                default -> throw ExtractionException.invalidOperation("Operator " + op + " needs an integer operand");
            };
        }
        long value = Values.requireInteger(operand, "Operand of " + op);
        return switch (op) {
            case "-" -> NativeLiteral.of(-value);
            case "+" -> NativeLiteral.of(value);
            case "~" -> NativeLiteral.of(~value);
            default -> throw ExtractionException.invalidOperation("Unknown unary operator " + op);
        };
    }

    /**
     * Equality between concrete values, symbols and text; numbers compare by value.
     */
    static boolean equal(Object left, Object right) {
        var a = Values.number(left);
        var b = Values.number(right);
        if (a.isPresent() && b.isPresent()) {
            return a.getAsDouble() == b.getAsDouble();
        }
        if (comparable(left) && comparable(right)) {
            return Objects.equals(unwrap(left), unwrap(right));
        }
        throw ExtractionException.invalidOperation(
            "Cannot compare " + Values.describe(left) + " with " + Values.describe(right)
        );
    }

    private static boolean comparable(Object value) {
        return value instanceof NativeLiteral || value instanceof SymbolRef || value instanceof ConstantRef;
    }

    private static SymbolicValue unwrap(Object value) {
        return value instanceof ConstantRef constant ? constant.value() : (SymbolicValue) value;
    }

    private static Object floating(Operator op, Object left, Object right) {
        double a = Values.number(left).orElseThrow(() -> notNumeric(op, left));
        double b = Values.number(right).orElseThrow(() -> notNumeric(op, right));
        return switch (op) {
            case ADD -> new FloatLiteral(a + b);
            case SUB -> new FloatLiteral(a - b);
            case MUL -> new FloatLiteral(a * b);
            case DIV -> new FloatLiteral(a / b);
            case LT -> NativeLiteral.of(a < b);
            case LE -> NativeLiteral.of(a <= b);
            case GT -> NativeLiteral.of(a > b);
            case GE -> NativeLiteral.of(a >= b);
            default -> throw ExtractionException.invalidOperation("Operator " + op.symbol() + " needs integer operands");
        };
    }

    private static long operand(Operator op, Object value) {
        if (value instanceof TextLiteral) {
            throw ExtractionException.invalidOperation("Pointer arithmetic on string literal with " + op.symbol());
        }
        return Values.integer(value).orElseThrow(() -> notNumeric(op, value));
    }

    private static long nonZero(long divisor) {
        if (divisor == 0) {
            throw ExtractionException.invalidOperation("Division by zero");
        }
        return divisor;
    }

    private static ExtractionException notNumeric(Operator op, Object value) {
        return ExtractionException.invalidOperation(
            "Operand of " + op.symbol() + " is not a concrete number: " + Values.describe(value)
        );
    }
}
