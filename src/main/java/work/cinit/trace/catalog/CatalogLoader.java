package work.cinit.trace.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;

/**
 * Loads a fact catalog from a YAML or JSON document.
 *
 * <pre>
 * constants: { NAME: 42 }
 * symbols:
 *   c-names: [Qnil, Qt]
 *   lisp-names: [nil, t]
 * units:
 *   - name: data.c
 *     constants: {...}
 *     variables: [{ lisp: ..., c: ..., kind: bool|int|lisp|kboard, doc: ... }]
 *     slot-variables: [{ lisp: ..., c: ..., scope: container|context, slot: 3 }]
 *     globals: [{ c: ..., static: true }]
 *     subroutines: [{ lisp: ..., c: ..., symbol: ..., min: 1, max: MANY, params: [...] }]
 * </pre>
 */
public final class CatalogLoader {
    private static final Logger LOG = LogManager.getLogger(CatalogLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private CatalogLoader() {}

    public static FactCatalog load(Path path) {
        try (var in = Files.newInputStream(path)) {
            var catalog = parse(in, isJson(path));
            LOG.debug("Loaded catalog {} ({} units, {} symbols)", path, catalog.units().size(), catalog.symbols().size());
            return catalog;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read catalog: " + path, ex);
        }
    }

    public static FactCatalog parse(InputStream in, boolean json) throws IOException {
        var root = (json ? JSON_MAPPER : YAML_MAPPER).readTree(in);
        return fromTree(root);
    }

    public static FactCatalog fromTree(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new FactCatalog(List.of(), Map.of(), List.of());
        }
        if (!root.isObject()) {
            throw new CatalogInconsistencyException("Catalog root must be an object");
        }
        var constants = readConstants(root.get("constants"));
        var symbols = readSymbols(root.get("symbols"));
        var units = new ArrayList<SourceUnit>();
        var unitsNode = root.get("units");
        if (unitsNode != null && unitsNode.isArray()) {
            for (var unitNode : unitsNode) {
                units.add(readUnit(unitNode));
            }
        }
        return new FactCatalog(units, constants, symbols);
    }

    static boolean isJson(Path path) {
        var fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private static SourceUnit readUnit(JsonNode node) {
        String name = requiredText(node, "name", "unit");
        var variables = new ArrayList<DeclaredVariable>();
        for (var item : items(node, "variables")) {
            variables.add(new DeclaredVariable(
                requiredText(item, "lisp", "variable"),
                requiredText(item, "c", "variable"),
                VariableKind.from(text(item, "kind")),
                text(item, "doc")
            ));
        }
        var slots = new ArrayList<SlotVariable>();
        for (var item : items(node, "slot-variables")) {
            String scope = text(item, "scope");
            slots.add(new SlotVariable(
                requiredText(item, "lisp", "slot variable"),
                requiredText(item, "c", "slot variable"),
                "context".equalsIgnoreCase(scope) || "kboard".equalsIgnoreCase(scope)
                    ? SlotVariable.Scope.CONTEXT
                    : SlotVariable.Scope.CONTAINER,
                item.path("slot").asInt(-1),
                text(item, "predicate"),
                text(item, "doc")
            ));
        }
        var globals = new ArrayList<RawGlobal>();
        for (var item : items(node, "globals")) {
            globals.add(new RawGlobal(requiredText(item, "c", "global"), item.path("static").asBoolean(false)));
        }
        var subroutines = new ArrayList<Subroutine>();
        for (var item : items(node, "subroutines")) {
            var params = new ArrayList<String>();
            for (var param : item.path("params")) {
                params.add(param.asText());
            }
            String cName = requiredText(item, "c", "subroutine");
            subroutines.add(new Subroutine(
                requiredText(item, "lisp", "subroutine"),
                cName,
                item.hasNonNull("symbol") ? item.get("symbol").asText() : "S" + cName.substring(1),
                arity(item.get("min"), 0),
                arity(item.get("max"), params.size()),
                params,
                text(item, "doc")
            ));
        }
        return new SourceUnit(name, readConstants(node.get("constants")), variables, slots, globals, subroutines);
    }

    private static Map<String, NamedConstant> readConstants(JsonNode node) {
        var constants = new LinkedHashMap<String, NamedConstant>();
        if (node == null || !node.isObject()) {
            return constants;
        }
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            var value = entry.getValue();
            if (value.isIntegralNumber()) {
                constants.put(entry.getKey(), new NamedConstant(entry.getKey(), NativeLiteral.of(value.longValue())));
            } else if (value.isTextual()) {
                constants.put(entry.getKey(), new NamedConstant(entry.getKey(), NativeLiteral.of(value.textValue())));
            } else {
                throw new CatalogInconsistencyException("Constant " + entry.getKey() + " must be an integer or a string");
            }
        }
        return constants;
    }

    private static List<InternedSymbol> readSymbols(JsonNode node) {
        var symbols = new ArrayList<InternedSymbol>();
        if (node == null || node.isNull()) {
            return symbols;
        }
        var cNames = node.path("c-names");
        var lispNames = node.path("lisp-names");
        if (cNames.size() != lispNames.size()) {
            throw new CatalogInconsistencyException(
                "Symbol tables differ in length: " + cNames.size() + " c-names, " + lispNames.size() + " lisp-names"
            );
        }
        for (int i = 0; i < cNames.size(); i++) {
            symbols.add(new InternedSymbol(lispNames.get(i).asText(), cNames.get(i).asText(), i));
        }
        return symbols;
    }

    private static int arity(JsonNode node, int fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isNumber()) {
            return node.intValue();
        }
        try {
            return Subroutine.parseArity(node.asText());
        } catch (NumberFormatException ex) {
            throw new CatalogInconsistencyException("Invalid arity: " + node.asText());
        }
    }

    private static Iterable<JsonNode> items(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String requiredText(JsonNode node, String field, String what) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            throw new CatalogInconsistencyException("Missing '" + field + "' on " + what + ": " + node);
        }
        return value;
    }
}
