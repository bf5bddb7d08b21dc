package work.cinit.trace.normalize;

import java.util.List;

/**
 * Applies override rules to rendered lines. The first rule whose pattern is found in the line wins;
 * later rules are never tried.
 */
public final class LineOverrides {
    private LineOverrides() {}

    public static Line apply(String line, List<OverrideRule> rules) {
        if (rules == null) {
            return new Line(line, Outcome.UNCHANGED);
        }
        for (var rule : rules) {
            var matcher = rule.pattern().matcher(line);
            if (!matcher.find()) {
                continue;
            }
            if (rule.deletes()) {
                return new Line(line, Outcome.DELETED);
            }
            return new Line(matcher.replaceAll(rule.replacement()), Outcome.REPLACED);
        }
        return new Line(line, Outcome.UNCHANGED);
    }

    public record Line(String text, Outcome outcome) {}

    public enum Outcome {
        UNCHANGED,
        DELETED,
        REPLACED
    }
}
