package work.cinit.trace.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.cinit.trace.value.SymbolicValue.CompositeCall;
import work.cinit.trace.value.SymbolicValue.ConstantRef;
import work.cinit.trace.value.SymbolicValue.DeclaredVariableAssignment;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.PrimitiveCall;
import work.cinit.trace.value.SymbolicValue.RawGlobalAssignment;
import work.cinit.trace.value.SymbolicValue.RawGlobalRef;
import work.cinit.trace.value.SymbolicValue.SymbolRef;

class SymbolicValuesTest {
    @Test
    void rendersLispFormsAndPrimitives() {
        var string = new PrimitiveCall(1, "make_string", List.of(NativeLiteral.of("a\"b"), NativeLiteral.of(3L)));
        var form = new CompositeCall(2, "put", List.of(new SymbolRef("foo"), new SymbolRef("bar"), string));

        assertEquals("(put 'foo 'bar make_string(\"a\\\"b\", 3))", SymbolicValues.render(form));
        assertEquals("local tem = (put 'foo 'bar make_string(\"a\\\"b\", 3))",
            SymbolicValues.render(new RawGlobalAssignment(3, "tem", form, true)));
        assertEquals("$foo-limit = MOST_POSITIVE_FIXNUM",
            SymbolicValues.render(new DeclaredVariableAssignment(4, "foo-limit", new ConstantRef("MOST_POSITIVE_FIXNUM", NativeLiteral.of(1L)))));
    }

    @Test
    void structurallyEqualCallsStayDistinct() {
        var first = new CompositeCall(1, "foo", List.of());
        var second = new CompositeCall(2, "foo", List.of());

        assertEquals(SymbolicValues.render(first), SymbolicValues.render(second));
        assertFalse(first.equals(second));
    }

    @Test
    void serializesWithKinds() {
        var assignment = new RawGlobalAssignment(1, "foo_table", new RawGlobalRef("alloc_cache", false), false);

        assertEquals(Map.of(
            "kind", "set-global",
            "cName", "foo_table",
            "local", false,
            "value", Map.of("kind", "global", "cName", "alloc_cache", "local", false)
        ), SymbolicValues.toSerializableMap(assignment));
    }

    @Test
    void documentationIsSerializedWhenPresent() {
        var entry = new TraceEntry(new CompositeCall(1, "foo", List.of(NativeLiteral.TRUE)), "Turn foo on.");

        assertEquals("Turn foo on.", entry.toSerializableMap().get("doc"));
        assertFalse(TraceEntry.of(new SymbolRef("t")).toSerializableMap().containsKey("doc"));
    }
}
