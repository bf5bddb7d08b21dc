package work.cinit.trace.catalog;

import work.cinit.trace.value.SymbolicValue.IntLiteral;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.TextLiteral;

/**
 * Constant resolved while the catalog was built; the value is an integer or a text literal.
 */
public record NamedConstant(String name, NativeLiteral value) {
    public NamedConstant {
        if (!(value instanceof IntLiteral) && !(value instanceof TextLiteral)) {
            throw new CatalogInconsistencyException("Constant " + name + " must be an integer or a string");
        }
    }
}
