package work.cinit.trace.syntax;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Loads routine syntax trees dumped by an external C parser.
 *
 * <p>The document is a list (or an object with a {@code routines} list) of
 * {@code { name, unit, definition }} entries. Each node is
 * {@code { type, text?, named?, field?, line?, children? }}.</p>
 */
public final class SyntaxTreeLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final Set<String> KEYWORDS = Set.of(
        "if", "else", "for", "while", "do", "return", "sizeof", "break", "continue", "switch",
        "case", "default", "goto", "struct", "enum", "union", "static", "const", "extern", "volatile"
    );

    private SyntaxTreeLoader() {}

    public static List<RoutineSource> load(Path path) {
        try (var in = Files.newInputStream(path)) {
            var fileName = path.getFileName();
            boolean json = fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".json");
            return parse(in, json);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read syntax trees: " + path, ex);
        }
    }

    public static List<RoutineSource> parse(InputStream in, boolean json) throws IOException {
        return fromTree((json ? JSON_MAPPER : YAML_MAPPER).readTree(in));
    }

    public static List<RoutineSource> fromTree(JsonNode root) throws IOException {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        var entries = root.isObject() ? root.path("routines") : root;
        if (!entries.isArray()) {
            throw new IOException("Syntax tree document must hold a list of routines");
        }
        var routines = new ArrayList<RoutineSource>();
        for (var entry : entries) {
            var name = entry.path("name").asText("");
            if (name.isBlank()) {
                throw new IOException("Routine entry without a name: " + entry);
            }
            var definition = entry.get("definition");
            if (definition == null || !definition.isObject()) {
                throw new IOException("Routine " + name + " has no definition tree");
            }
            routines.add(new RoutineSource(name, entry.path("unit").asText(null), toNode(definition, null)));
        }
        return routines;
    }

    public static TreeNode toNode(JsonNode node, String inheritedField) throws IOException {
        if (!node.isObject() || !node.hasNonNull("type")) {
            throw new IOException("Syntax node must be an object with a type: " + node);
        }
        String type = node.get("type").asText();
        boolean named = node.has("named") ? node.get("named").asBoolean() : isNamedType(type);
        String field = node.hasNonNull("field") ? node.get("field").asText() : inheritedField;
        String text = node.hasNonNull("text") ? node.get("text").asText() : null;
        int line = node.path("line").asInt(0);
        var children = new ArrayList<SyntaxNode>();
        for (var child : node.path("children")) {
            children.add(toNode(child, null));
        }
        return new TreeNode(type, text, named, field, line, children);
    }

    static boolean isNamedType(String type) {
        if (type.isEmpty() || KEYWORDS.contains(type)) {
            return false;
        }
        char first = type.charAt(0);
        return Character.isLetter(first) || first == '_';
    }
}
