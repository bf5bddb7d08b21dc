package work.cinit.trace.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.cinit.trace.catalog.FactCatalog;

/**
 * Routine traces in init-call order, with the catalog whose variable defaults they filled in.
 */
public record ExtractionResult(FactCatalog catalog, List<RoutineTrace> routines) {
    public ExtractionResult {
        routines = List.copyOf(routines);
    }

    public Optional<RoutineTrace> routine(String name) {
        return routines.stream().filter(trace -> trace.name().equals(name)).findFirst();
    }

    public int statementCount() {
        return routines.stream().mapToInt(trace -> trace.statements().size()).sum();
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("catalog", catalog.toSerializableMap());
        var traces = new ArrayList<Map<String, Object>>(routines.size());
        for (var trace : routines) {
            traces.add(trace.toSerializableMap());
        }
        map.put("routines", traces);
        return map;
    }
}
