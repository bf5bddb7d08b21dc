package work.cinit.trace.runtime;

import java.util.List;

/**
 * Callable value reachable through name resolution: a catalogued subroutine, a runtime helper
 * rewrite, an intrinsic or an injected override.
 */
@FunctionalInterface
public interface Helper {
    Object invoke(EvaluationContext ctx, List<Object> arguments);

    /**
     * Whether a call consumes the arguments' pending effects and registers an effect result that is
     * not pending any more.
     */
    default boolean tracksEffects() {
        return true;
    }

    static Helper untracked(Helper helper) {
        return new Helper() {
            @Override
            public Object invoke(EvaluationContext ctx, List<Object> arguments) {
                return helper.invoke(ctx, arguments);
            }

            @Override
            public boolean tracksEffects() {
                return false;
            }
        };
    }
}
