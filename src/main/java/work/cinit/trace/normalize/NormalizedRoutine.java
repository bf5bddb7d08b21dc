package work.cinit.trace.normalize;

import java.util.List;

/**
 * Normalized statements of one routine. Hand-implemented routines carry a single manual marker.
 */
public record NormalizedRoutine(String name, String unit, List<Statement> statements, boolean handImplemented) {
    public NormalizedRoutine {
        statements = List.copyOf(statements);
    }

    public List<String> listing() {
        return Statement.listing(statements);
    }
}
