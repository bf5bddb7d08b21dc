package work.cinit.trace.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.cinit.trace.value.SymbolicValue.CompositeCall;
import work.cinit.trace.value.SymbolicValue.DeclaredVariableAssignment;
import work.cinit.trace.value.SymbolicValue.DeclaredVariableRef;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.RawGlobalAssignment;
import work.cinit.trace.value.SymbolicValue.RawGlobalRef;
import work.cinit.trace.value.TraceEntry;

class EffectLedgerTest {
    @Test
    void retractedCallsLeaveNoTrace() {
        var ledger = new EffectLedger();
        var inner = new CompositeCall(ledger.nextHandle(), "foo", List.of());
        ledger.register(inner);
        var outer = new CompositeCall(ledger.nextHandle(), "bar", List.of(inner));
        ledger.register(outer);

        assertTrue(ledger.retract(inner));
        assertFalse(ledger.retract(inner));
        assertFalse(ledger.isPending(inner));
        assertTrue(ledger.isPending(outer));
        assertEquals(List.of("(bar (foo))"), ledger.retained().stream().map(TraceEntry::render).toList());
    }

    @Test
    void appendedAssignmentsAreNeverPending() {
        var ledger = new EffectLedger();
        var assignment = new DeclaredVariableAssignment(ledger.nextHandle(), "foo-limit", NativeLiteral.of(1L));
        ledger.append(assignment);

        assertFalse(ledger.retract(assignment));
        assertEquals(1, ledger.retained().size());
    }

    @Test
    void inertAssignmentsAreDropped() {
        var ledger = new EffectLedger();
        ledger.append(new RawGlobalAssignment(ledger.nextHandle(), "n", NativeLiteral.of(1L), true));
        ledger.append(new RawGlobalAssignment(ledger.nextHandle(), "foo_table", new RawGlobalRef("foo_table", false), false));
        ledger.append(new DeclaredVariableAssignment(ledger.nextHandle(), "foo-list", new DeclaredVariableRef("foo-list")));
        ledger.append(new RawGlobalAssignment(ledger.nextHandle(), "foo_table", NativeLiteral.of(2L), false));

        assertEquals(List.of("foo_table = 2"), ledger.retained().stream().map(TraceEntry::render).toList());
    }

    @Test
    void documentationGoesToTheFirstDocumentableEffect() {
        var ledger = new EffectLedger();
        ledger.append(new RawGlobalAssignment(ledger.nextHandle(), "foo_table", NativeLiteral.of(2L), false));
        int mark = ledger.size();
        ledger.append(new RawGlobalAssignment(ledger.nextHandle(), "foo_cache", NativeLiteral.of(3L), false));
        ledger.register(new CompositeCall(ledger.nextHandle(), "foo", List.of()));
        ledger.document(mark, "Set up foo.");

        var entries = ledger.retained();
        assertNull(entries.get(0).documentation());
        assertNull(entries.get(1).documentation());
        assertEquals("Set up foo.", entries.get(2).documentation());
    }
}
