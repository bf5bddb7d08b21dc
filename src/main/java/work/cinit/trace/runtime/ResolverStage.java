package work.cinit.trace.runtime;

import java.util.Optional;

/**
 * One tier of name resolution. Stages are tried in priority order; the first hit wins.
 */
@FunctionalInterface
public interface ResolverStage {
    Optional<Object> resolve(String name);
}
