package work.cinit.trace.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.cinit.trace.runtime.Helper;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.support.Catalogs;
import work.cinit.trace.value.SymbolicValue.ArrayLiteral;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.SymbolRef;
import work.cinit.trace.value.SymbolicValue.Verbatim;

class SettingsLoaderTest {
    @Test
    void loadsFixtureSettings() {
        var settings = SettingsLoader.load(Catalogs.FIXTURES.resolve("settings.toml"));

        assertEquals(List.of("init_foo", "syms_of_data", "init_display", "init_missing"), settings.initCalls());
        assertTrue(settings.isExcluded("init_display"));
        assertFalse(settings.isExcluded("init_foo"));

        var initFoo = settings.routine("init_foo");
        assertEquals(1, initFoo.overrides().size());
        assertTrue(initFoo.overrides().get(0).deletes());
        assertEquals("^defsubr\\(", initFoo.overrides().get(0).pattern().pattern());

        var injection = settings.routine("syms_of_data").injections().get("path_separator");
        assertEquals(new Verbatim("File.pathSeparator"), injection.materialize(null));
    }

    @Test
    void unknownRoutinesGetEmptySettings() {
        var settings = SettingsLoader.parse("");

        assertTrue(settings.initCalls().isEmpty());
        assertTrue(settings.routine("init_anything").overrides().isEmpty());
        assertTrue(settings.routine("init_anything").rewriter().isEmpty());
    }

    @Test
    void readsEveryInjectionKind() {
        var settings = SettingsLoader.parse("""
            primitives = ["make_hash_table"]

            [routines.init_all]
            hand-implemented = true
            strip-leading-calls = ["record_unwind_current_buffer"]
            overrides = [{ match = "Qfoo", replace = "Qbar" }]

            [routines.init_all.inject]
            limit = 4
            name = "emacs"
            sizes = [1, 2]
            sym = { symbol = "foo" }
            keep = { identity = true }
            skip = { noop = true }
            setter = { assign-variable = true }
            load_path = { form = "list", args = [{ symbol = "foo" }] }
            getenv = { returns = "/tmp" }
            path_max = { primitive = "path_max" }
            """);

        assertEquals(Set.of("make_hash_table"), settings.primitives());
        assertEquals(Set.of("init_all"), settings.handImplemented());

        var routine = settings.routine("init_all");
        assertFalse(routine.overrides().get(0).deletes());
        assertInstanceOf(LeadingCallStripper.class, routine.rewriter().orElseThrow());

        var injections = routine.injections();
        assertEquals(NativeLiteral.of(4L), injections.get("limit").materialize(null));
        assertEquals(NativeLiteral.of("emacs"), injections.get("name").materialize(null));
        assertEquals(new ArrayLiteral(List.of(NativeLiteral.of(1L), NativeLiteral.of(2L))), injections.get("sizes").materialize(null));
        assertEquals(new SymbolRef("foo"), injections.get("sym").materialize(null));
        for (var callable : List.of("keep", "skip", "setter", "load_path", "getenv", "path_max")) {
            assertInstanceOf(Helper.class, injections.get(callable).materialize(null), callable);
        }
        assertFalse(((Helper) injections.get("skip").materialize(null)).tracksEffects());
    }

    @Test
    void rejectsMalformedSettings() {
        assertEquals(SettingsLoader.INVALID_SETTINGS,
            assertThrows(ExtractionException.class, () -> SettingsLoader.parse("init-calls = [")).code());
        assertEquals(SettingsLoader.INVALID_SETTINGS,
            assertThrows(ExtractionException.class, () -> SettingsLoader.parse("init-calls = \"init_foo\"")).code());
        assertEquals(SettingsLoader.INVALID_SETTINGS,
            assertThrows(ExtractionException.class, () -> SettingsLoader.parse("[routines.a]\noverrides = [{ replace = \"x\" }]")).code());
        assertEquals(SettingsLoader.INVALID_SETTINGS,
            assertThrows(ExtractionException.class, () -> SettingsLoader.parse("[routines.a]\noverrides = [{ match = \"(\" }]")).code());
        assertEquals(SettingsLoader.INVALID_SETTINGS,
            assertThrows(ExtractionException.class, () -> SettingsLoader.parse("[routines.a.inject]\nx = { unknown = 1 }")).code());
    }

    @Test
    void missingFileIsReported() {
        var error = assertThrows(IllegalStateException.class, () -> SettingsLoader.load(Catalogs.FIXTURES.resolve("missing.toml")));
        assertTrue(error.getMessage().startsWith("Failed to read settings"));
    }
}
