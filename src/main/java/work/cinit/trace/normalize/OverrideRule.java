package work.cinit.trace.normalize;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Hand-authored patch for one normalized line: deletes lines matching {@code pattern}, or replaces
 * every match with {@code replacement} (Java regex replacement syntax).
 */
public record OverrideRule(Pattern pattern, String replacement) {
    public OverrideRule {
        Objects.requireNonNull(pattern, "pattern");
    }

    public static OverrideRule delete(String regex) {
        return new OverrideRule(Pattern.compile(regex), null);
    }

    public static OverrideRule replace(String regex, String replacement) {
        return new OverrideRule(Pattern.compile(regex), Objects.requireNonNull(replacement, "replacement"));
    }

    public boolean deletes() {
        return replacement == null;
    }
}
