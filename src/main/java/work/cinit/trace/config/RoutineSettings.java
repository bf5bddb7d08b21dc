package work.cinit.trace.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.cinit.trace.normalize.OverrideRule;
import work.cinit.trace.runtime.Injection;

/**
 * Operator-supplied configuration for one initialization routine.
 */
public record RoutineSettings(
    List<OverrideRule> overrides,
    Map<String, Injection> injections,
    Optional<StatementRewriter> rewriter,
    boolean handImplemented
) {
    private static final RoutineSettings EMPTY = builder().build();

    public RoutineSettings {
        overrides = List.copyOf(overrides);
        injections = Collections.unmodifiableMap(new LinkedHashMap<>(injections));
        Objects.requireNonNull(rewriter, "rewriter");
    }

    public static RoutineSettings empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<OverrideRule> overrides = new ArrayList<>();
        private final Map<String, Injection> injections = new LinkedHashMap<>();
        private StatementRewriter rewriter;
        private boolean handImplemented;

        public Builder override(OverrideRule rule) {
            overrides.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public Builder inject(String name, Injection injection) {
            injections.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(injection, "injection"));
            return this;
        }

        /** Chains {@code next} after any rewriter already set. */
        public Builder rewriter(StatementRewriter next) {
            Objects.requireNonNull(next, "rewriter");
            this.rewriter = rewriter == null ? next : rewriter.andThen(next);
            return this;
        }

        public Builder handImplemented(boolean handImplemented) {
            this.handImplemented = handImplemented;
            return this;
        }

        public RoutineSettings build() {
            return new RoutineSettings(overrides, injections, Optional.ofNullable(rewriter), handImplemented);
        }
    }
}
