package work.cinit.trace.runtime;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Name bindings of one routine evaluation. Explicit bindings win, then previously resolved names,
 * then the resolver stages in order.
 */
public final class Environment {
    private final List<ResolverStage> stages;
    private final Map<String, Object> bindings = new LinkedHashMap<>();
    private final Map<String, Object> resolved = new HashMap<>();
    private final Set<String> locals = new HashSet<>();

    public Environment(List<ResolverStage> stages) {
        this.stages = List.copyOf(stages);
    }

    public Object lookup(String name) {
        if (bindings.containsKey(name)) {
            return bindings.get(name);
        }
        if (resolved.containsKey(name)) {
            return resolved.get(name);
        }
        for (var stage : stages) {
            var hit = stage.resolve(name);
            if (hit.isPresent()) {
                resolved.put(name, hit.get());
                return hit.get();
            }
        }
        throw new UnresolvedNameException(name);
    }

    public void bind(String name, Object value) {
        bindings.put(name, value);
    }

    /** Marks {@code name} as a routine-local binding that shadows any global of the same name. */
    public void declareLocal(String name) {
        locals.add(name);
    }

    public boolean isLocal(String name) {
        return locals.contains(name);
    }

    public Map<String, Object> bindings() {
        return Collections.unmodifiableMap(bindings);
    }
}
