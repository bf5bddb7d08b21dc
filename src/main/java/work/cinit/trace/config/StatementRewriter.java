package work.cinit.trace.config;

import java.util.List;
import java.util.Map;
import work.cinit.trace.value.TraceEntry;

/**
 * End-of-routine structural post-processing of a trace.
 */
@FunctionalInterface
public interface StatementRewriter {
    /**
     * @param statements retained statements, in program order
     * @param finalState the routine's bindings when evaluation finished
     * @return the statements to keep for the routine
     */
    List<TraceEntry> rewrite(List<TraceEntry> statements, Map<String, Object> finalState);

    default StatementRewriter andThen(StatementRewriter next) {
        return (statements, finalState) -> next.rewrite(rewrite(statements, finalState), finalState);
    }
}
