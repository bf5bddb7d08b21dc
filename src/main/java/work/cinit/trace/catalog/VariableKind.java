package work.cinit.trace.catalog;

import java.util.Locale;

/**
 * Value kind of a declared variable, as given by the macro that declared it.
 */
public enum VariableKind {
    BOOLEAN,
    INTEGER,
    GENERIC,
    CONTEXT_SLOT;

    public static VariableKind from(String value) {
        if (value == null || value.isBlank()) {
            return GENERIC;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "bool", "boolean" -> BOOLEAN;
            case "int", "integer" -> INTEGER;
            case "lisp", "generic", "object" -> GENERIC;
            case "kboard", "context", "context-slot" -> CONTEXT_SLOT;
            default -> throw new CatalogInconsistencyException("Unsupported variable kind: " + value);
        };
    }
}
