package work.cinit.trace.config;

import java.util.List;
import java.util.Map;
import java.util.Set;
import work.cinit.trace.value.SymbolicValue.CompositeCall;
import work.cinit.trace.value.SymbolicValue.PrimitiveCall;
import work.cinit.trace.value.TraceEntry;

/**
 * Drops the run of calls at the start of a trace whose function is one of {@code functions}, such as
 * a save/restore pair wrapped around a nested initialization call. Stops at the first other entry.
 */
public record LeadingCallStripper(Set<String> functions) implements StatementRewriter {
    public LeadingCallStripper {
        functions = Set.copyOf(functions);
    }

    @Override
    public List<TraceEntry> rewrite(List<TraceEntry> statements, Map<String, Object> finalState) {
        int start = 0;
        while (start < statements.size() && strips(statements.get(start))) {
            start++;
        }
        return List.copyOf(statements.subList(start, statements.size()));
    }

    private boolean strips(TraceEntry entry) {
        if (entry.value() instanceof CompositeCall call) {
            return functions.contains(call.function());
        }
        if (entry.value() instanceof PrimitiveCall call) {
            return functions.contains(call.function());
        }
        return false;
    }
}
