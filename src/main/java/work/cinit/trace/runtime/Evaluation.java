package work.cinit.trace.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.cinit.trace.value.TraceEntry;

/**
 * Outcome of evaluating one routine: the retained statements and the final bindings by name.
 */
public record Evaluation(List<TraceEntry> statements, Map<String, Object> finalState) {
    public Evaluation {
        statements = List.copyOf(statements);
        finalState = Collections.unmodifiableMap(new LinkedHashMap<>(finalState));
    }
}
