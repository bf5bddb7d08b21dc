package work.cinit.trace.runtime;

import java.util.Optional;
import work.cinit.trace.value.SymbolicValue;
import work.cinit.trace.value.SymbolicValue.BoolLiteral;
import work.cinit.trace.value.SymbolicValue.ConstantRef;
import work.cinit.trace.value.SymbolicValue.FloatLiteral;
import work.cinit.trace.value.SymbolicValue.IntLiteral;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.PrimitiveCall;
import work.cinit.trace.value.SymbolicValue.SymbolRef;
import work.cinit.trace.value.SymbolicValue.TextLiteral;

/**
 * Reduces a value to the literal a declared variable can take as its default.
 */
public final class Folding {
    private Folding() {}

    /**
     * Unwraps the canonical {@code t}/{@code nil} symbols and the boxed fixnum, float and string
     * constructors, then returns the value if it is a scalar literal or a constant reference.
     */
    public static Optional<SymbolicValue> reduce(SymbolicValue value) {
        var simplified = unwrap(value);
        if (simplified instanceof BoolLiteral
            || simplified instanceof IntLiteral
            || simplified instanceof FloatLiteral
            || simplified instanceof TextLiteral
            || simplified instanceof ConstantRef) {
            return Optional.of(simplified);
        }
        return Optional.empty();
    }

    private static SymbolicValue unwrap(SymbolicValue value) {
        if (value instanceof SymbolRef symbol) {
            return switch (symbol.lispName()) {
                case "t" -> NativeLiteral.TRUE;
                case "nil" -> NativeLiteral.FALSE;
                default -> symbol;
            };
        }
        if (value instanceof PrimitiveCall call && !call.arguments().isEmpty()) {
            var first = call.arguments().get(0);
            switch (call.function()) {
                case "make_fixnum" -> {
                    if (first instanceof IntLiteral || first instanceof ConstantRef constant && constant.value() instanceof IntLiteral) {
                        return first;
                    }
                }
                case "make_float" -> {
                    if (first instanceof FloatLiteral) {
                        return first;
                    }
                }
                case "make_string" -> {
                    if (first instanceof TextLiteral) {
                        return first;
                    }
                }
                default -> {
                }
            }
        }
        return value;
    }
}
