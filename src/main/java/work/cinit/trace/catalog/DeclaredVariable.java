package work.cinit.trace.catalog;

import java.util.Objects;
import java.util.Optional;
import work.cinit.trace.value.SymbolicValue;

/**
 * Global binding visible to the target runtime's scripting layer.
 *
 * <p>The default value is the only catalog field written during evaluation. It is set by the first
 * routine whose assignment folds to a literal and is never replaced afterwards.</p>
 */
public final class DeclaredVariable {
    private final String lispName;
    private final String cName;
    private final VariableKind kind;
    private final String documentation;
    private SymbolicValue defaultValue;

    public DeclaredVariable(String lispName, String cName, VariableKind kind, String documentation) {
        this.lispName = Objects.requireNonNull(lispName, "lispName");
        this.cName = Objects.requireNonNull(cName, "cName");
        this.kind = kind == null ? VariableKind.GENERIC : kind;
        this.documentation = documentation;
    }

    public String lispName() {
        return lispName;
    }

    public String cName() {
        return cName;
    }

    public VariableKind kind() {
        return kind;
    }

    public String documentation() {
        return documentation;
    }

    public Optional<SymbolicValue> defaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    /**
     * Records {@code literal} as the default when none is set yet.
     *
     * @return true when the literal is now (or already was) the default, false when a different
     *     default exists and the assignment has to stay an explicit statement
     */
    public boolean offerDefault(SymbolicValue literal) {
        Objects.requireNonNull(literal, "literal");
        if (defaultValue == null) {
            defaultValue = literal;
            return true;
        }
        return defaultValue.equals(literal);
    }
}
