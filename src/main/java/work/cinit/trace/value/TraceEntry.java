package work.cinit.trace.value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One retained statement of a routine trace, with the source comment that documented it (if any).
 */
public record TraceEntry(SymbolicValue value, String documentation) {
    public TraceEntry {
        Objects.requireNonNull(value, "value");
    }

    public static TraceEntry of(SymbolicValue value) {
        return new TraceEntry(value, null);
    }

    public String render() {
        return SymbolicValues.render(value);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>(SymbolicValues.toSerializableMap(value));
        if (documentation != null && !documentation.isBlank()) {
            map.put("doc", documentation);
        }
        return map;
    }
}
