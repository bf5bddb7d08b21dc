package work.cinit.trace.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.cinit.trace.shared.ExtractionException;

/**
 * Mutable routine-local struct with named fields.
 */
public final class RecordValue {
    private final Map<String, Object> fields = new LinkedHashMap<>();

    public Object get(String field) {
        if (!fields.containsKey(field)) {
            throw ExtractionException.invalidOperation("Field " + field + " was never assigned");
        }
        return fields.get(field);
    }

    public void set(String field, Object value) {
        fields.put(field, value);
    }

    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String toString() {
        return "record" + fields;
    }
}
