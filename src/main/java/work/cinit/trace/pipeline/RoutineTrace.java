package work.cinit.trace.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.cinit.trace.value.TraceEntry;

/**
 * Retained statements of one initialization routine, in program order.
 */
public record RoutineTrace(String name, String unit, List<TraceEntry> statements, boolean handImplemented) {
    public RoutineTrace {
        Objects.requireNonNull(name, "name");
        statements = List.copyOf(statements);
    }

    public List<String> render() {
        var lines = new ArrayList<String>(statements.size());
        for (var entry : statements) {
            lines.add(entry.render());
        }
        return lines;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", name);
        map.put("unit", unit);
        map.put("handImplemented", handImplemented);
        var serialized = new ArrayList<Map<String, Object>>(statements.size());
        for (var entry : statements) {
            serialized.add(entry.toSerializableMap());
        }
        map.put("statements", serialized);
        return map;
    }
}
