package work.cinit.trace.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.cinit.trace.catalog.DeclaredVariable;
import work.cinit.trace.catalog.FactCatalog;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.value.SymbolicValue;
import work.cinit.trace.value.SymbolicValue.CompositeCall;
import work.cinit.trace.value.SymbolicValue.DeclaredVariableAssignment;
import work.cinit.trace.value.SymbolicValue.DeclaredVariableRef;
import work.cinit.trace.value.SymbolicValue.Effect;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.PrimitiveCall;
import work.cinit.trace.value.SymbolicValue.RawGlobalAssignment;
import work.cinit.trace.value.SymbolicValue.RawGlobalRef;
import work.cinit.trace.value.SymbolicValue.SymbolRef;
import work.cinit.trace.value.SymbolicValues;

/**
 * State of one routine evaluation, handed to every helper: bindings, the effect ledger and the
 * factories that build effect nodes.
 */
public final class EvaluationContext {
    private static final Logger LOG = LogManager.getLogger(EvaluationContext.class);

    private final FactCatalog catalog;
    private final String routine;
    private final String unit;
    private final EffectLedger ledger;
    private Environment environment;

    public EvaluationContext(FactCatalog catalog, String routine, String unit, EffectLedger ledger) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.routine = routine;
        this.unit = unit;
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    void attach(Environment environment) {
        this.environment = environment;
    }

    public FactCatalog catalog() {
        return catalog;
    }

    public String routine() {
        return routine;
    }

    public String unit() {
        return unit;
    }

    public EffectLedger ledger() {
        return ledger;
    }

    public Environment environment() {
        if (environment == null) {
            throw new IllegalStateException("Evaluation context has no environment yet");
        }
        return environment;
    }

    public Object lookup(String name) {
        return environment().lookup(name);
    }

    public CompositeCall composite(String function, List<?> arguments) {
        var call = new CompositeCall(ledger.nextHandle(), function, capture(arguments));
        ledger.register(call);
        return call;
    }

    public PrimitiveCall primitive(String function, List<?> arguments) {
        var call = new PrimitiveCall(ledger.nextHandle(), function, capture(arguments));
        ledger.register(call);
        return call;
    }

    public Object call(Object callee, List<Object> arguments) {
        if (!(callee instanceof Helper helper)) {
            throw ExtractionException.invalidOperation("Not callable: " + Values.describe(callee));
        }
        var result = helper.invoke(this, arguments);
        if (helper.tracksEffects()) {
            for (var argument : arguments) {
                consume(argument);
            }
            if (result instanceof CompositeCall || result instanceof PrimitiveCall) {
                var effect = (Effect) result;
                if (!ledger.isPending(effect)) {
                    ledger.register(effect);
                }
            }
        }
        return result;
    }

    public void consume(Object value) {
        if (value instanceof Effect effect) {
            ledger.retract(effect);
        }
        if (value instanceof SymbolicValue symbolic) {
            for (var child : SymbolicValues.children(symbolic)) {
                consume(child);
            }
        }
    }

    /** Locals shadow declared variables, which shadow raw globals. */
    public void assign(String name, Object value) {
        if (environment().isLocal(name)) {
            assignLocal(name, value);
            return;
        }
        var variable = catalog.declaredVariable(name);
        if (variable.isPresent()) {
            assignVariable(name, variable.get(), value);
            return;
        }
        if (catalog.rawGlobal(unit, name).isPresent()) {
            var captured = Values.toSymbolic(value);
            consume(captured);
            ledger.append(new RawGlobalAssignment(ledger.nextHandle(), name, captured, false));
            environment().bind(name, new RawGlobalRef(name, false));
            return;
        }
        assignLocal(name, value);
    }

    /**
     * Assigns a declared variable. The first value that folds to a literal becomes its default and
     * emits nothing; anything else is appended as an explicit assignment.
     */
    public void assignVariable(String cName, DeclaredVariable variable, Object value) {
        var captured = Values.toSymbolic(value);
        consume(captured);
        var folded = Folding.reduce(captured);
        if (folded.isPresent() && variable.offerDefault(folded.get())) {
            LOG.debug("Default of {} folded to {}", variable.lispName(), SymbolicValues.render(folded.get()));
            environment().bind(cName, folded.get());
            return;
        }
        ledger.append(new DeclaredVariableAssignment(ledger.nextHandle(), variable.lispName(), captured));
        environment().bind(cName, new DeclaredVariableRef(variable.lispName()));
    }

    public void assignLocal(String name, Object value) {
        environment().declareLocal(name);
        consume(value);
        // literals, symbols and host values are bound as is
        if (value instanceof SymbolicValue symbolic && !(symbolic instanceof NativeLiteral) && !(symbolic instanceof SymbolRef)) {
            ledger.append(new RawGlobalAssignment(ledger.nextHandle(), name, symbolic, true));
            environment().bind(name, new RawGlobalRef(name, true));
            return;
        }
        environment().bind(name, value);
    }

    private List<SymbolicValue> capture(List<?> arguments) {
        var captured = new ArrayList<SymbolicValue>(arguments.size());
        for (var argument : arguments) {
            var value = Values.toSymbolic(argument);
            consume(value);
            captured.add(value);
        }
        return captured;
    }
}
