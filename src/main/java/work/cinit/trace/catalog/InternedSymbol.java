package work.cinit.trace.catalog;

/**
 * Interned atom with a fixed index in the symbol table.
 */
public record InternedSymbol(String lispName, String cName, int index) {}
