package work.cinit.trace.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.cinit.trace.normalize.OverrideRule;
import work.cinit.trace.runtime.Injection;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.value.SymbolicValue;
import work.cinit.trace.value.SymbolicValue.ArrayLiteral;
import work.cinit.trace.value.SymbolicValue.FloatLiteral;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.RawGlobalRef;
import work.cinit.trace.value.SymbolicValue.SymbolRef;
import work.cinit.trace.value.SymbolicValue.Verbatim;

/**
 * Reads {@link ExtractionSettings} from a TOML document.
 *
 * <pre>
 * init-calls = ["init_alloc_once", "syms_of_data"]
 * primitives = ["make_hash_table"]
 * excluded = ["init_display"]
 *
 * [routines.syms_of_data]
 * overrides = [{ match = "^staticpro\\(" }, { match = "Qfoo", replace = "Qbar" }]
 * strip-leading-calls = ["record_unwind_current_buffer"]
 *
 * [routines.syms_of_data.inject]
 * path_separator = { verbatim = "File.pathSeparator" }
 * defsubr = { noop = true }
 * </pre>
 */
public final class SettingsLoader {
    private static final Logger LOG = LogManager.getLogger(SettingsLoader.class);

    public static final String INVALID_SETTINGS = "invalid-settings";

    private SettingsLoader() {}

    public static ExtractionSettings load(Path path) {
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read settings: " + path, ex);
        }
    }

    public static ExtractionSettings parse(String source) {
        TomlParseResult result = Toml.parse(source);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new ExtractionException(INVALID_SETTINGS, "Invalid settings: " + errors);
        }
        return fromToml(result);
    }

    public static ExtractionSettings fromToml(TomlTable root) {
        var initCalls = strings(root, "init-calls");
        var primitives = new LinkedHashSet<>(strings(root, "primitives"));
        var excluded = new LinkedHashSet<>(strings(root, "excluded"));
        var routines = new LinkedHashMap<String, RoutineSettings>();
        var table = root.getTable("routines");
        if (table != null) {
            for (String name : table.keySet()) {
                var section = table.get(List.of(name));
                if (!(section instanceof TomlTable routineTable)) {
                    throw invalid("routines." + name + " must be a table");
                }
                routines.put(name, routine(name, routineTable));
            }
        }
        LOG.debug("Loaded settings: {} init calls, {} routine sections", initCalls.size(), routines.size());
        return new ExtractionSettings(initCalls, primitives, excluded, routines);
    }

    private static RoutineSettings routine(String name, TomlTable table) {
        var builder = RoutineSettings.builder();
        var hand = table.get(List.of("hand-implemented"));
        if (hand != null) {
            if (!(hand instanceof Boolean flag)) {
                throw invalid(name + ".hand-implemented must be a boolean");
            }
            builder.handImplemented(flag);
        }

        var overrides = table.get(List.of("overrides"));
        if (overrides != null) {
            for (Object item : array(name + ".overrides", overrides).toList()) {
                builder.override(override(name, item));
            }
        }

        var inject = table.get(List.of("inject"));
        if (inject != null) {
            if (!(inject instanceof TomlTable injections)) {
                throw invalid(name + ".inject must be a table");
            }
            for (String key : injections.keySet()) {
                builder.inject(key, injection(name + ".inject." + key, injections.get(List.of(key))));
            }
        }

        var strip = strings(table, "strip-leading-calls");
        if (!strip.isEmpty()) {
            builder.rewriter(new LeadingCallStripper(Set.copyOf(strip)));
        }
        return builder.build();
    }

    private static OverrideRule override(String routine, Object item) {
        if (!(item instanceof TomlTable rule) || !(rule.get(List.of("match")) instanceof String match)) {
            throw invalid(routine + ".overrides entries need a 'match' string");
        }
        try {
            var replace = rule.get(List.of("replace"));
            if (replace == null) {
                return OverrideRule.delete(match);
            }
            if (!(replace instanceof String replacement)) {
                throw invalid(routine + ".overrides 'replace' must be a string");
            }
            return OverrideRule.replace(match, replacement);
        } catch (PatternSyntaxException ex) {
            throw new ExtractionException(INVALID_SETTINGS, "Invalid override pattern in " + routine + ": " + ex.getDescription(), ex);
        }
    }

    static Injection injection(String where, Object raw) {
        if (!(raw instanceof TomlTable table)) {
            return Injection.value(literal(where, raw));
        }
        if (table.size() == 0) {
            throw invalid(where + " is an empty table");
        }
        var args = table.get(List.of("args"));
        List<SymbolicValue> fixed = args == null ? null : literals(where + ".args", array(where + ".args", args));
        if (table.get(List.of("symbol")) instanceof String symbol) {
            return Injection.symbol(symbol);
        }
        if (table.get(List.of("verbatim")) instanceof String text) {
            return Injection.verbatim(text);
        }
        if (table.get(List.of("global")) instanceof String global) {
            return Injection.global(global);
        }
        if (table.get(List.of("primitive")) instanceof String function) {
            return Injection.primitive(function, fixed);
        }
        if (table.get(List.of("form")) instanceof String function) {
            return Injection.form(function, fixed);
        }
        if (table.contains(List.of("returns"))) {
            return Injection.returns(literal(where + ".returns", table.get(List.of("returns"))));
        }
        if (Boolean.TRUE.equals(table.get(List.of("identity")))) {
            return Injection.identity();
        }
        if (Boolean.TRUE.equals(table.get(List.of("noop")))) {
            return Injection.noop();
        }
        if (Boolean.TRUE.equals(table.get(List.of("assign-variable")))) {
            return Injection.assignVariable();
        }
        throw invalid(where + " has no recognized injection kind (keys: " + table.keySet() + ")");
    }

    static SymbolicValue literal(String where, Object raw) {
        if (raw instanceof String text) {
            return NativeLiteral.of(text);
        }
        if (raw instanceof Long number) {
            return NativeLiteral.of(number.longValue());
        }
        if (raw instanceof Double number) {
            return new FloatLiteral(number);
        }
        if (raw instanceof Boolean flag) {
            return NativeLiteral.of(flag.booleanValue());
        }
        if (raw instanceof TomlArray array) {
            return new ArrayLiteral(literals(where, array));
        }
        if (raw instanceof TomlTable table) {
            if (table.get(List.of("symbol")) instanceof String symbol) {
                return new SymbolRef(symbol);
            }
            if (table.get(List.of("verbatim")) instanceof String text) {
                return new Verbatim(text);
            }
            if (table.get(List.of("global")) instanceof String global) {
                return new RawGlobalRef(global, false);
            }
        }
        throw invalid(where + ": unsupported value " + raw);
    }

    private static List<SymbolicValue> literals(String where, TomlArray array) {
        var values = new ArrayList<SymbolicValue>(array.size());
        for (int i = 0; i < array.size(); i++) {
            values.add(literal(where + "[" + i + "]", array.get(i)));
        }
        return values;
    }

    private static List<String> strings(TomlTable table, String key) {
        var raw = table.get(List.of(key));
        if (raw == null) {
            return List.of();
        }
        var array = array(key, raw);
        var values = new ArrayList<String>(array.size());
        for (Object item : array.toList()) {
            if (!(item instanceof String text)) {
                throw invalid(key + " must list strings, found " + item);
            }
            values.add(text);
        }
        return values;
    }

    private static TomlArray array(String where, Object raw) {
        if (!(raw instanceof TomlArray array)) {
            throw invalid(where + " must be an array");
        }
        return array;
    }

    private static ExtractionException invalid(String message) {
        return new ExtractionException(INVALID_SETTINGS, message);
    }
}
