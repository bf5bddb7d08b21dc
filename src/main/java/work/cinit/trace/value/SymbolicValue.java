package work.cinit.trace.value;

import java.util.List;
import java.util.Objects;

/**
 * Immutable value produced while partially evaluating an initialization routine.
 *
 * <p>The variant is closed: every implementation is declared in this file. Nodes that stand for an
 * effect ({@link Effect}) carry an arena handle assigned by the evaluator; two structurally identical
 * calls built separately therefore stay distinct.</p>
 */
public interface SymbolicValue {

    /**
     * Value that may appear as a standalone statement of a routine trace.
     */
    interface Effect extends SymbolicValue {
        int handle();
    }

    /**
     * Concrete terminal value; never evaluated further.
     */
    interface NativeLiteral extends SymbolicValue {
        BoolLiteral TRUE = new BoolLiteral(true);
        BoolLiteral FALSE = new BoolLiteral(false);
        IntLiteral ZERO = new IntLiteral(0);

        static BoolLiteral of(boolean value) {
            return value ? TRUE : FALSE;
        }

        static IntLiteral of(long value) {
            return new IntLiteral(value);
        }

        static TextLiteral of(String value) {
            return new TextLiteral(value);
        }
    }

    record BoolLiteral(boolean value) implements NativeLiteral {}

    record IntLiteral(long value) implements NativeLiteral {}

    record FloatLiteral(double value) implements NativeLiteral {}

    record TextLiteral(String value) implements NativeLiteral {
        public TextLiteral {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Snapshot of a routine-local array at the moment it was captured by another value.
     */
    record ArrayLiteral(List<SymbolicValue> elements) implements NativeLiteral {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Slot that was never written (an unset array element or an uninitialized local).
     */
    enum Undefined implements NativeLiteral {
        INSTANCE
    }

    /**
     * Text handed to the code emitter as is (for example a host-runtime expression).
     */
    record Verbatim(String text) implements NativeLiteral {}

    /**
     * Named constant resolved while the catalog was built.
     */
    record ConstantRef(String name, NativeLiteral value) implements SymbolicValue {}

    /**
     * Reference to a declared variable, by its lisp-visible name.
     */
    record DeclaredVariableRef(String lispName) implements SymbolicValue {}

    /**
     * Reference to a plain global binding, or to a routine-local binding when {@code local} is set.
     */
    record RawGlobalRef(String cName, boolean local) implements SymbolicValue {}

    /**
     * Reference to an interned symbol, by its lisp-visible name.
     */
    record SymbolRef(String lispName) implements SymbolicValue {}

    /**
     * Call to a catalogued callable subroutine, by its lisp-visible name.
     */
    record CompositeCall(int handle, String function, List<SymbolicValue> arguments) implements Effect {
        public CompositeCall {
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * Call to a recognized runtime helper function.
     */
    record PrimitiveCall(int handle, String function, List<SymbolicValue> arguments) implements Effect {
        public PrimitiveCall {
            arguments = List.copyOf(arguments);
        }
    }

    record DeclaredVariableAssignment(int handle, String lispName, SymbolicValue value) implements Effect {}

    record RawGlobalAssignment(int handle, String cName, SymbolicValue value, boolean local) implements Effect {}
}
