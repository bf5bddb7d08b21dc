package work.cinit.trace.catalog;

/**
 * Declared variable with one slot per owning container or context instance.
 */
public record SlotVariable(String lispName, String cName, Scope scope, int slotIndex, String predicate, String documentation) {
    public SlotVariable {
        if (slotIndex < 0) {
            throw new CatalogInconsistencyException("Negative slot index for " + lispName + ": " + slotIndex);
        }
    }

    public enum Scope {
        CONTAINER,
        CONTEXT
    }
}
