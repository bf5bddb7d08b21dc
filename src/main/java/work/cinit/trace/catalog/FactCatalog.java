package work.cinit.trace.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.cinit.trace.value.SymbolicValues;

/**
 * Read-only index over every source unit's facts plus the global constant and symbol tables.
 *
 * <p>Construction validates the structural assumptions the evaluator relies on, so an inconsistent
 * catalog fails here rather than in the middle of a routine.</p>
 */
public final class FactCatalog {
    private final List<SourceUnit> units;
    private final Map<String, NamedConstant> globalConstants;
    private final List<InternedSymbol> symbols;
    private final Map<String, InternedSymbol> symbolsByCName = new HashMap<>();
    private final Map<String, DeclaredVariable> variablesByCName = new HashMap<>();
    private final Map<String, DeclaredVariable> variablesByLispName = new HashMap<>();
    private final Map<String, Subroutine> subroutinesByCName = new HashMap<>();
    private final Map<String, RawGlobal> sharedGlobals = new HashMap<>();
    private final Map<String, SourceUnit> unitsByName = new LinkedHashMap<>();

    public FactCatalog(List<SourceUnit> units, Map<String, NamedConstant> globalConstants, List<InternedSymbol> symbols) {
        this.units = units == null ? List.of() : List.copyOf(units);
        this.globalConstants = globalConstants == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(globalConstants));
        this.symbols = symbols == null ? List.of() : List.copyOf(symbols);
        index();
    }

    private void index() {
        for (int i = 0; i < symbols.size(); i++) {
            var symbol = symbols.get(i);
            if (symbol.index() != i) {
                throw new CatalogInconsistencyException(
                    "Symbol " + symbol.cName() + " has index " + symbol.index() + " but sits at position " + i
                );
            }
            symbolsByCName.put(symbol.cName(), symbol);
        }
        for (var unit : units) {
            if (unitsByName.put(unit.name(), unit) != null) {
                throw new CatalogInconsistencyException("Duplicate source unit: " + unit.name());
            }
            for (var variable : unit.variables()) {
                if (variablesByCName.put(variable.cName(), variable) != null) {
                    throw new CatalogInconsistencyException(
                        "Declared variable " + variable.cName() + " is declared in more than one unit"
                    );
                }
                variablesByLispName.put(variable.lispName(), variable);
            }
            for (var subroutine : unit.subroutines()) {
                subroutinesByCName.put(subroutine.cName(), subroutine);
            }
            for (var global : unit.globals()) {
                if (!global.unitLocal()) {
                    sharedGlobals.put(global.cName(), global);
                }
            }
        }
    }

    public List<SourceUnit> units() {
        return units;
    }

    public Optional<SourceUnit> unit(String name) {
        return Optional.ofNullable(unitsByName.get(name));
    }

    public Map<String, NamedConstant> globalConstants() {
        return globalConstants;
    }

    public List<InternedSymbol> symbols() {
        return symbols;
    }

    /** Unit-local constants shadow global ones. */
    public Optional<NamedConstant> constant(String unit, String name) {
        var local = unit == null ? null : unitsByName.get(unit);
        if (local != null && local.constants().containsKey(name)) {
            return Optional.of(local.constants().get(name));
        }
        return Optional.ofNullable(globalConstants.get(name));
    }

    public Optional<InternedSymbol> symbol(String cName) {
        return Optional.ofNullable(symbolsByCName.get(cName));
    }

    /** Static globals are only visible from their own unit. */
    public Optional<RawGlobal> rawGlobal(String unit, String cName) {
        var local = unit == null ? null : unitsByName.get(unit);
        if (local != null) {
            for (var global : local.globals()) {
                if (global.cName().equals(cName)) {
                    return Optional.of(global);
                }
            }
        }
        return Optional.ofNullable(sharedGlobals.get(cName));
    }

    public Optional<Subroutine> subroutine(String cName) {
        return Optional.ofNullable(subroutinesByCName.get(cName));
    }

    public Optional<DeclaredVariable> declaredVariable(String cName) {
        return Optional.ofNullable(variablesByCName.get(cName));
    }

    public Optional<DeclaredVariable> declaredVariableByLispName(String lispName) {
        return Optional.ofNullable(variablesByLispName.get(lispName));
    }

    /**
     * JSON-ready projection of the resolved catalog, including the defaults baked in during evaluation.
     */
    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        var constants = new LinkedHashMap<String, Object>();
        globalConstants.forEach((name, constant) -> constants.put(name, SymbolicValues.toSerializableMap(constant.value())));
        map.put("constants", constants);
        var symbolNames = new ArrayList<String>(symbols.size());
        for (var symbol : symbols) {
            symbolNames.add(symbol.lispName());
        }
        map.put("symbols", symbolNames);
        var unitList = new ArrayList<Map<String, Object>>();
        for (var unit : units) {
            unitList.add(serializeUnit(unit));
        }
        map.put("units", unitList);
        return map;
    }

    private static Map<String, Object> serializeUnit(SourceUnit unit) {
        var map = new LinkedHashMap<String, Object>();
        map.put("name", unit.name());
        var variables = new ArrayList<Map<String, Object>>();
        for (var variable : unit.variables()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("lispName", variable.lispName());
            entry.put("cName", variable.cName());
            entry.put("kind", variable.kind().name().toLowerCase(Locale.ROOT));
            variable.defaultValue().ifPresent(value -> entry.put("default", SymbolicValues.toSerializableMap(value)));
            if (variable.documentation() != null) {
                entry.put("doc", variable.documentation());
            }
            variables.add(entry);
        }
        map.put("variables", variables);
        var slots = new ArrayList<Map<String, Object>>();
        for (var slot : unit.slotVariables()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("lispName", slot.lispName());
            entry.put("cName", slot.cName());
            entry.put("scope", slot.scope().name().toLowerCase(Locale.ROOT));
            entry.put("slot", slot.slotIndex());
            if (slot.predicate() != null) {
                entry.put("predicate", slot.predicate());
            }
            slots.add(entry);
        }
        map.put("slotVariables", slots);
        var subroutines = new ArrayList<Map<String, Object>>();
        for (var subroutine : unit.subroutines()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("lispName", subroutine.lispName());
            entry.put("cName", subroutine.cName());
            entry.put("minArgs", subroutine.minArgs());
            entry.put("maxArgs", subroutine.maxArgs());
            entry.put("parameters", subroutine.parameters());
            subroutines.add(entry);
        }
        map.put("subroutines", subroutines);
        return map;
    }
}
