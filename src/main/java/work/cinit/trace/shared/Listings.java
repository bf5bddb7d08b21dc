package work.cinit.trace.shared;

import java.util.List;

/**
 * Formats normalized routine lines for diagnostics.
 */
public final class Listings {
    private Listings() {}

    public static String numbered(List<String> lines) {
        var builder = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            builder.append(String.format("%4d: %s%n", i + 1, lines.get(i)));
        }
        return builder.toString();
    }
}
