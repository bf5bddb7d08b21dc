package work.cinit.trace.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings of one extraction run: the startup call order, extra primitive names, excluded routines
 * and per-routine settings.
 */
public record ExtractionSettings(
    List<String> initCalls,
    Set<String> primitives,
    Set<String> excluded,
    Map<String, RoutineSettings> routines
) {
    public ExtractionSettings {
        initCalls = List.copyOf(initCalls);
        primitives = Collections.unmodifiableSet(new LinkedHashSet<>(primitives));
        excluded = Collections.unmodifiableSet(new LinkedHashSet<>(excluded));
        routines = Collections.unmodifiableMap(new LinkedHashMap<>(routines));
    }

    public static ExtractionSettings empty() {
        return new ExtractionSettings(List.of(), Set.of(), Set.of(), Map.of());
    }

    public RoutineSettings routine(String name) {
        return routines.getOrDefault(name, RoutineSettings.empty());
    }

    public boolean isExcluded(String name) {
        return excluded.contains(name);
    }

    public Set<String> handImplemented() {
        var names = new LinkedHashSet<String>();
        routines.forEach((name, settings) -> {
            if (settings.handImplemented()) {
                names.add(name);
            }
        });
        return names;
    }

    /** Returns a copy whose settings for {@code name} are replaced. */
    public ExtractionSettings withRoutine(String name, RoutineSettings settings) {
        var copy = new LinkedHashMap<>(routines);
        copy.put(name, settings);
        return new ExtractionSettings(initCalls, primitives, excluded, copy);
    }

    public ExtractionSettings withInitCalls(List<String> calls) {
        return new ExtractionSettings(calls, primitives, excluded, routines);
    }
}
