package work.cinit.trace.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stores helpers by the C name they are called under.
 */
public final class HelperRegistry {
    private final Map<String, Helper> helpers = new LinkedHashMap<>();

    public HelperRegistry register(String name, Helper helper) {
        helpers.put(name, helper);
        return this;
    }

    public Optional<Helper> get(String name) {
        return Optional.ofNullable(helpers.get(name));
    }
}
