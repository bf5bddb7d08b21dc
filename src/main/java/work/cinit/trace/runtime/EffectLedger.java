package work.cinit.trace.runtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import work.cinit.trace.value.SymbolicValue;
import work.cinit.trace.value.SymbolicValue.CompositeCall;
import work.cinit.trace.value.SymbolicValue.DeclaredVariableAssignment;
import work.cinit.trace.value.SymbolicValue.DeclaredVariableRef;
import work.cinit.trace.value.SymbolicValue.Effect;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.PrimitiveCall;
import work.cinit.trace.value.SymbolicValue.RawGlobalAssignment;
import work.cinit.trace.value.SymbolicValue.RawGlobalRef;
import work.cinit.trace.value.TraceEntry;

/**
 * Arena of the effects one routine produced, in program order.
 *
 * <p>Effect nodes are addressed by integer handles. Calls are registered as pending; a pending call
 * that is later consumed by another value is retracted, leaving an empty slot. Assignments are
 * appended without being pending and are never retracted.</p>
 */
public final class EffectLedger {
    private int nextHandle = 1;
    private final List<Effect> slots = new ArrayList<>();
    private final List<String> documentation = new ArrayList<>();
    private final Map<Integer, Integer> pending = new HashMap<>();

    public int nextHandle() {
        return nextHandle++;
    }

    public void register(Effect effect) {
        pending.put(effect.handle(), slots.size());
        append(effect);
    }

    public void append(Effect effect) {
        slots.add(effect);
        documentation.add(null);
    }

    public boolean retract(Effect effect) {
        Integer index = pending.remove(effect.handle());
        if (index == null) {
            return false;
        }
        slots.set(index, null);
        return true;
    }

    public boolean isPending(Effect effect) {
        return pending.containsKey(effect.handle());
    }

    public int size() {
        return slots.size();
    }

    /**
     * Attaches {@code text} to the first documentable effect appended at or after {@code fromIndex}.
     */
    public void document(int fromIndex, String text) {
        for (int i = Math.max(fromIndex, 0); i < slots.size(); i++) {
            var effect = slots.get(i);
            if (effect instanceof DeclaredVariableAssignment || effect instanceof CompositeCall || effect instanceof PrimitiveCall) {
                if (documentation.get(i) == null) {
                    documentation.set(i, text);
                }
                return;
            }
        }
    }

    /**
     * The surviving effects: retracted slots, inert local assignments and self-assignments are dropped.
     */
    public List<TraceEntry> retained() {
        var entries = new ArrayList<TraceEntry>();
        for (int i = 0; i < slots.size(); i++) {
            var effect = slots.get(i);
            if (effect == null || isInert(effect)) {
                continue;
            }
            entries.add(new TraceEntry(effect, documentation.get(i)));
        }
        return entries;
    }

    static boolean isInert(SymbolicValue effect) {
        if (effect instanceof RawGlobalAssignment assignment) {
            if (assignment.local() && assignment.value() instanceof NativeLiteral) {
                return true;
            }
            return assignment.value() instanceof RawGlobalRef ref
                && ref.cName().equals(assignment.cName())
                && ref.local() == assignment.local();
        }
        if (effect instanceof DeclaredVariableAssignment assignment) {
            return assignment.value() instanceof DeclaredVariableRef ref && ref.lispName().equals(assignment.lispName());
        }
        return false;
    }
}
