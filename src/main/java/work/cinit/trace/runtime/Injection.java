package work.cinit.trace.runtime;

import java.util.List;
import java.util.Objects;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.value.SymbolicValue;
import work.cinit.trace.value.SymbolicValue.DeclaredVariableRef;
import work.cinit.trace.value.SymbolicValue.RawGlobalRef;
import work.cinit.trace.value.SymbolicValue.SymbolRef;
import work.cinit.trace.value.SymbolicValue.Undefined;
import work.cinit.trace.value.SymbolicValue.Verbatim;

/**
 * Per-routine override of a name, materialized once when the routine first references it.
 */
@FunctionalInterface
public interface Injection {
    Object materialize(EvaluationContext ctx);

    static Injection value(SymbolicValue value) {
        Objects.requireNonNull(value, "value");
        return ctx -> value;
    }

    static Injection helper(Helper helper) {
        Objects.requireNonNull(helper, "helper");
        return ctx -> helper;
    }

    static Injection symbol(String lispName) {
        return value(new SymbolRef(lispName));
    }

    static Injection verbatim(String text) {
        return value(new Verbatim(text));
    }

    static Injection global(String cName) {
        return value(new RawGlobalRef(cName, false));
    }

    /** Redirects calls to a primitive; with fixed arguments the call-site arguments are ignored. */
    static Injection primitive(String function, List<SymbolicValue> fixedArguments) {
        return helper((ctx, arguments) -> ctx.primitive(function, fixedArguments == null ? arguments : fixedArguments));
    }

    /** Redirects calls to a composite form; with fixed arguments the call-site arguments are ignored. */
    static Injection form(String function, List<SymbolicValue> fixedArguments) {
        return helper((ctx, arguments) -> ctx.composite(function, fixedArguments == null ? arguments : fixedArguments));
    }

    static Injection returns(SymbolicValue result) {
        return helper((ctx, arguments) -> result);
    }

    static Injection identity() {
        return helper((ctx, arguments) -> {
            if (arguments.isEmpty()) {
                throw ExtractionException.invalidOperation("Identity override called without arguments");
            }
            return arguments.get(0);
        });
    }

    static Injection noop() {
        return helper(Helper.untracked((ctx, arguments) -> Undefined.INSTANCE));
    }

    /**
     * {@code (variable, value)} assignment through a symbol or a variable reference, with the same
     * default-folding rule as a direct assignment.
     */
    static Injection assignVariable() {
        return helper(Helper.untracked((ctx, arguments) -> {
            if (arguments.size() != 2) {
                throw ExtractionException.invalidOperation("Variable assignment override takes 2 arguments, got " + arguments.size());
            }
            var target = arguments.get(0);
            String lispName;
            if (target instanceof SymbolRef symbol) {
                lispName = symbol.lispName();
            } else if (target instanceof DeclaredVariableRef ref) {
                lispName = ref.lispName();
            } else {
                throw ExtractionException.invalidOperation("Cannot assign through " + Values.describe(target));
            }
            var variable = ctx.catalog().declaredVariableByLispName(lispName).orElseThrow(
                () -> ExtractionException.invalidOperation("No declared variable named " + lispName)
            );
            ctx.assignVariable(variable.cName(), variable, arguments.get(1));
            return Undefined.INSTANCE;
        }));
    }
}
