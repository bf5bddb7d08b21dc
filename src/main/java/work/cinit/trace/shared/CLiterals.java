package work.cinit.trace.shared;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Decodes C literal spellings (numbers, strings, chars, comments) into Java values.
 */
public final class CLiterals {
    private CLiterals() {}

    /**
     * Parses an integer or floating literal, honoring hex, octal and binary prefixes and the
     * {@code u}/{@code l}/{@code f} suffixes. Malformed spellings raise {@link NumberFormatException}.
     */
    public static Number parseNumber(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new NumberFormatException("Empty numeric literal");
        }
        String text = raw.trim().replace("'", "");
        String lower = text.toLowerCase(Locale.ROOT);
        boolean hex = lower.startsWith("0x");
        boolean floating = hex ? lower.contains("p") : lower.contains(".") || lower.contains("e");
        if (floating) {
            while (lower.endsWith("f") || lower.endsWith("l")) {
                lower = lower.substring(0, lower.length() - 1);
            }
            return Double.parseDouble(lower);
        }
        boolean unsigned = false;
        while (lower.endsWith("u") || lower.endsWith("l")) {
            unsigned |= lower.endsWith("u");
            lower = lower.substring(0, lower.length() - 1);
        }
        if (hex) {
            return Long.parseUnsignedLong(lower.substring(2), 16);
        }
        if (lower.startsWith("0b")) {
            return integer(lower.substring(2), 2, unsigned);
        }
        if (lower.length() > 1 && lower.startsWith("0")) {
            return integer(lower.substring(1), 8, unsigned);
        }
        return integer(lower, 10, unsigned);
    }

    private static long integer(String digits, int radix, boolean unsigned) {
        return unsigned ? Long.parseUnsignedLong(digits, radix) : Long.parseLong(digits, radix);
    }

    public static String decodeString(String literal) {
        String body = stripQuotes(literal, '"');
        return unescape(body);
    }

    public static long decodeChar(String literal) {
        String decoded = unescape(stripQuotes(literal, '\''));
        if (decoded.isEmpty()) {
            throw new IllegalArgumentException("Empty character literal: " + literal);
        }
        return decoded.codePointAt(0);
    }

    /** Text as the C runtime sees it: UTF-8 bytes. */
    public static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    public static String quote(String value) {
        var builder = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\t' -> builder.append("\\t");
                case '\r' -> builder.append("\\r");
                case '\0' -> builder.append("\\0");
                default -> {
                    if (ch < 0x20) {
                        builder.append(String.format("\\x%02x", (int) ch));
                    } else {
                        builder.append(ch);
                    }
                }
            }
        }
        return builder.append('"').toString();
    }

    /**
     * Strips comment delimiters and dedents continuation lines, keeping the first line as written.
     */
    public static String trimComment(String comment) {
        String doc = comment == null ? "" : comment.strip();
        if (doc.startsWith("/*") || doc.startsWith("//")) {
            doc = doc.substring(2);
        }
        if (doc.endsWith("*/")) {
            doc = doc.substring(0, doc.length() - 2);
        }
        int newline = doc.indexOf('\n');
        if (newline >= 0) {
            doc = doc.substring(0, newline) + "\n" + dedent(doc.substring(newline + 1));
        }
        return doc.strip();
    }

    private static String dedent(String text) {
        String[] lines = text.split("\n", -1);
        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank()) continue;
            int indent = 0;
            while (indent < line.length() && (line.charAt(indent) == ' ' || line.charAt(indent) == '\t')) {
                indent++;
            }
            common = Math.min(common, indent);
        }
        if (common == Integer.MAX_VALUE || common == 0) {
            return text;
        }
        var builder = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            builder.append(line.isBlank() ? "" : line.substring(common));
            if (i < lines.length - 1) {
                builder.append('\n');
            }
        }
        return builder.toString();
    }

    private static String stripQuotes(String literal, char quote) {
        String text = literal == null ? "" : literal.strip();
        int start = text.indexOf(quote);
        int end = text.lastIndexOf(quote);
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Malformed literal: " + literal);
        }
        return text.substring(start + 1, end);
    }

    private static String unescape(String body) {
        var builder = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (ch != '\\' || i + 1 >= body.length()) {
                builder.append(ch);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> builder.append('\n');
                case 't' -> builder.append('\t');
                case 'r' -> builder.append('\r');
                case 'a' -> builder.append('\u0007');
                case 'b' -> builder.append('\b');
                case 'f' -> builder.append('\f');
                case 'v' -> builder.append('\u000b');
                case 'e' -> builder.append('\u001b');
                case 'x' -> {
                    int end = i + 1;
                    while (end < body.length() && Character.digit(body.charAt(end), 16) >= 0) {
                        end++;
                    }
                    if (end == i + 1) {
                        throw new IllegalArgumentException("Escape \\x without hex digits");
                    }
                    builder.append((char) Integer.parseInt(body.substring(i + 1, end), 16));
                    i = end - 1;
                }
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i;
                        while (end < body.length() && end < i + 3 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        builder.append((char) Integer.parseInt(body.substring(i, end), 8));
                        i = end - 1;
                    } else if (next == '\n') {
                        // line continuation
                    } else {
                        builder.append(next);
                    }
                }
            }
        }
        return builder.toString();
    }
}
