package work.cinit.trace.runtime;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.cinit.trace.catalog.FactCatalog;
import work.cinit.trace.catalog.Subroutine;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.value.SymbolicValue.ArrayLiteral;
import work.cinit.trace.value.SymbolicValue.DeclaredVariableRef;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.RawGlobalRef;
import work.cinit.trace.value.SymbolicValue.SymbolRef;

/**
 * Factories for the resolver stages, listed in resolution priority order.
 */
public final class ResolverStages {
    private ResolverStages() {}

    /** Unit-local constants, then global ones, as plain literals. */
    public static ResolverStage constants(FactCatalog catalog, String unit) {
        return name -> catalog.constant(unit, name).map(constant -> constant.value());
    }

    public static ResolverStage symbols(FactCatalog catalog) {
        return name -> catalog.symbol(name).map(symbol -> new SymbolRef(symbol.lispName()));
    }

    public static ResolverStage rawGlobals(FactCatalog catalog, String unit) {
        return name -> catalog.rawGlobal(unit, name).map(global -> new RawGlobalRef(global.cName(), false));
    }

    public static ResolverStage subroutines(FactCatalog catalog) {
        return name -> catalog.subroutine(name).map(ResolverStages::subroutineCall);
    }

    public static ResolverStage helpers(HelperRegistry registry) {
        return name -> registry.get(name).map(helper -> helper);
    }

    /**
     * Boolean and integer variables resolve to their default, or to zero while none is set; generic
     * variables resolve to a reference.
     */
    public static ResolverStage declaredVariables(FactCatalog catalog) {
        return name -> catalog.declaredVariable(name).map(variable -> switch (variable.kind()) {
            case BOOLEAN -> variable.defaultValue().orElse(NativeLiteral.FALSE);
            case INTEGER -> variable.defaultValue().orElse(NativeLiteral.ZERO);
            default -> new DeclaredVariableRef(variable.lispName());
        });
    }

    public static ResolverStage injections(EvaluationContext ctx, Map<String, Injection> injections) {
        return name -> {
            var injection = injections.get(name);
            return injection == null ? Optional.empty() : Optional.ofNullable(injection.materialize(ctx));
        };
    }

    public static ResolverStage intrinsics(HelperRegistry registry, FactCatalog catalog) {
        return name -> {
            var constant = Intrinsics.constant(name, catalog);
            return constant.isPresent() ? constant : registry.get(name).map(helper -> helper);
        };
    }

    /**
     * Call helper for a subroutine. A fully variadic subroutine called with a count and an array
     * receives the array's first {@code count} elements; fixed-arity calls are checked.
     */
    static Helper subroutineCall(Subroutine subroutine) {
        return (ctx, arguments) -> {
            List<?> actual = arguments;
            if (subroutine.isVariadic() && arguments.size() == 2) {
                var count = Values.integer(arguments.get(0));
                var array = arguments.get(1);
                if (count.isPresent()) {
                    if (count.getAsLong() == 0 && (isArray(array) || Values.integer(array).orElse(-1) == 0)) {
                        actual = List.of();
                    } else if (isArray(array)) {
                        actual = prefix(subroutine, Values.toSymbolic(array), count.getAsLong());
                    }
                }
            }
            if (!subroutine.accepts(actual.size())) {
                throw ExtractionException.invalidOperation(
                    subroutine.cName() + " takes " + arityText(subroutine) + " arguments, got " + actual.size()
                );
            }
            return ctx.composite(subroutine.lispName(), actual);
        };
    }

    private static boolean isArray(Object value) {
        return value instanceof ArrayValue || value instanceof ArrayLiteral;
    }

    private static List<?> prefix(Subroutine subroutine, Object snapshot, long count) {
        var elements = ((ArrayLiteral) snapshot).elements();
        if (count < 0 || count > elements.size()) {
            throw ExtractionException.invalidOperation(
                subroutine.cName() + " called with count " + count + " over an array of " + elements.size()
            );
        }
        return elements.subList(0, (int) count);
    }

    private static String arityText(Subroutine subroutine) {
        if (subroutine.maxArgs() < 0) {
            return "at least " + subroutine.minArgs();
        }
        return subroutine.minArgs() == subroutine.maxArgs()
            ? Integer.toString(subroutine.minArgs())
            : subroutine.minArgs() + ".." + subroutine.maxArgs();
    }
}
