package work.cinit.trace.runtime;

import java.util.ArrayList;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.value.SymbolicValue;
import work.cinit.trace.value.SymbolicValue.ArrayLiteral;
import work.cinit.trace.value.SymbolicValue.BoolLiteral;
import work.cinit.trace.value.SymbolicValue.ConstantRef;
import work.cinit.trace.value.SymbolicValue.FloatLiteral;
import work.cinit.trace.value.SymbolicValue.IntLiteral;
import work.cinit.trace.value.SymbolicValue.TextLiteral;
import work.cinit.trace.value.SymbolicValue.Undefined;
import work.cinit.trace.value.SymbolicValues;

/**
 * Conversions over evaluator runtime values: symbolic values, routine-local arrays and records, and
 * helpers.
 */
public final class Values {
    private Values() {}

    public static String describe(Object value) {
        if (value instanceof SymbolicValue symbolic) {
            return SymbolicValues.render(symbolic);
        }
        if (value instanceof Helper) {
            return "<callable>";
        }
        return String.valueOf(value);
    }

    public static OptionalLong integer(Object value) {
        if (value instanceof IntLiteral literal) {
            return OptionalLong.of(literal.value());
        }
        if (value instanceof BoolLiteral bool) {
            return OptionalLong.of(bool.value() ? 1 : 0);
        }
        if (value instanceof ConstantRef constant) {
            return integer(constant.value());
        }
        return OptionalLong.empty();
    }

    public static OptionalDouble number(Object value) {
        if (value instanceof FloatLiteral floating) {
            return OptionalDouble.of(floating.value());
        }
        var integer = integer(value);
        return integer.isPresent() ? OptionalDouble.of(integer.getAsLong()) : OptionalDouble.empty();
    }

    public static long requireInteger(Object value, String what) {
        return integer(value).orElseThrow(
            () -> ExtractionException.invalidOperation(what + " must be a concrete integer, got " + describe(value))
        );
    }

    public static String requireText(Object value, String what) {
        if (value instanceof TextLiteral text) {
            return text.value();
        }
        if (value instanceof ConstantRef constant && constant.value() instanceof TextLiteral text) {
            return text.value();
        }
        throw ExtractionException.invalidOperation(what + " must be a concrete string, got " + describe(value));
    }

    /** Empty when the value is symbolic. */
    public static Optional<Boolean> truthiness(Object value) {
        if (value instanceof BoolLiteral bool) {
            return Optional.of(bool.value());
        }
        if (value instanceof FloatLiteral floating) {
            return Optional.of(floating.value() != 0.0);
        }
        var integer = integer(value);
        if (integer.isPresent()) {
            return Optional.of(integer.getAsLong() != 0);
        }
        if (value instanceof Undefined || value == null) {
            return Optional.of(false);
        }
        if (value instanceof TextLiteral || value instanceof ArrayLiteral
            || value instanceof ArrayValue || value instanceof RecordValue || value instanceof Helper) {
            return Optional.of(true);
        }
        return Optional.empty();
    }

    public static SymbolicValue toSymbolic(Object value) {
        if (value == null) {
            return Undefined.INSTANCE;
        }
        if (value instanceof SymbolicValue symbolic) {
            return symbolic;
        }
        if (value instanceof ArrayValue array) {
            var elements = new ArrayList<SymbolicValue>(array.size());
            for (var element : array.elements()) {
                elements.add(toSymbolic(element));
            }
            return new ArrayLiteral(elements);
        }
        throw ExtractionException.invalidOperation("Value cannot be captured symbolically: " + describe(value));
    }
}
