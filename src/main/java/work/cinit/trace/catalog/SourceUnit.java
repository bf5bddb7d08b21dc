package work.cinit.trace.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Facts gathered from one source unit (one C file) of the analyzed program.
 */
public record SourceUnit(
    String name,
    Map<String, NamedConstant> constants,
    List<DeclaredVariable> variables,
    List<SlotVariable> slotVariables,
    List<RawGlobal> globals,
    List<Subroutine> subroutines
) {
    public SourceUnit {
        Objects.requireNonNull(name, "name");
        constants = constants == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(constants));
        variables = variables == null ? List.of() : List.copyOf(variables);
        slotVariables = slotVariables == null ? List.of() : List.copyOf(slotVariables);
        globals = globals == null ? List.of() : List.copyOf(globals);
        subroutines = subroutines == null ? List.of() : List.copyOf(subroutines);
    }
}
