package work.cinit.trace.catalog;

import java.util.List;

/**
 * Arity-checked callable exposed to the target runtime.
 */
public record Subroutine(
    String lispName,
    String cName,
    String symbolCName,
    int minArgs,
    int maxArgs,
    List<String> parameters,
    String documentation
) {
    /** Receives its arguments unevaluated. */
    public static final int UNEVALLED = -1;
    /** Receives any number of evaluated arguments as a count plus an array. */
    public static final int MANY = -2;

    public Subroutine {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (minArgs < 0) {
            throw new CatalogInconsistencyException("Negative minimum arity for " + cName);
        }
        if (maxArgs >= 0 && maxArgs < minArgs) {
            throw new CatalogInconsistencyException(
                "Subroutine " + cName + " has max args " + maxArgs + " below min args " + minArgs
            );
        }
        if (maxArgs < MANY) {
            throw new CatalogInconsistencyException("Unknown arity sentinel " + maxArgs + " for " + cName);
        }
    }

    public boolean isVariadic() {
        return maxArgs == MANY;
    }

    public boolean isUnevaluated() {
        return maxArgs == UNEVALLED;
    }

    public boolean accepts(int count) {
        if (maxArgs < 0) {
            return count >= minArgs || isUnevaluated();
        }
        return count >= minArgs && count <= maxArgs;
    }

    public static int parseArity(String raw) {
        return switch (raw.trim()) {
            case "MANY" -> MANY;
            case "UNEVALLED" -> UNEVALLED;
            default -> Integer.parseInt(raw.trim());
        };
    }
}
