package work.cinit.trace.catalog;

/**
 * Plain global binding without declared-variable semantics.
 */
public record RawGlobal(String cName, boolean unitLocal) {}
