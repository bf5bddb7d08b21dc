package work.cinit.trace.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.cinit.trace.catalog.FactCatalog;
import work.cinit.trace.normalize.Expr;
import work.cinit.trace.normalize.NormalizedRoutine;
import work.cinit.trace.normalize.Operator;
import work.cinit.trace.normalize.Statement;
import work.cinit.trace.shared.CLiterals;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.value.SymbolicValue.ArrayLiteral;
import work.cinit.trace.value.SymbolicValue.FloatLiteral;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.TextLiteral;
import work.cinit.trace.value.SymbolicValue.Undefined;

/**
 * Executes normalized routines against the catalog and produces their traces.
 *
 * <p>One evaluator is shared by every routine of a run. Its helper registries are fixed at
 * construction; bindings and the effect ledger are created per routine. Declared-variable defaults
 * written by one routine are visible to the routines evaluated after it.</p>
 */
public final class SymbolicEvaluator {
    private static final Logger LOG = LogManager.getLogger(SymbolicEvaluator.class);

    public static final int MAX_LOOP_ITERATIONS = 1_000_000;
    public static final String ITERATION_LIMIT = "iteration-limit";

    private final FactCatalog catalog;
    private final HelperRegistry helpers;
    private final HelperRegistry intrinsics;

    public SymbolicEvaluator(FactCatalog catalog) {
        this(catalog, Set.of());
    }

    public SymbolicEvaluator(FactCatalog catalog, Set<String> extraPrimitives) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.helpers = RuntimeHelpers.register(new HelperRegistry(), extraPrimitives);
        this.intrinsics = Intrinsics.register(new HelperRegistry());
    }

    public Evaluation evaluate(NormalizedRoutine routine) {
        return evaluate(routine, Map.of());
    }

    public Evaluation evaluate(NormalizedRoutine routine, Map<String, Injection> injections) {
        var ledger = new EffectLedger();
        var ctx = new EvaluationContext(catalog, routine.name(), routine.unit(), ledger);
        var environment = new Environment(List.of(
            ResolverStages.constants(catalog, routine.unit()),
            ResolverStages.symbols(catalog),
            ResolverStages.rawGlobals(catalog, routine.unit()),
            ResolverStages.subroutines(catalog),
            ResolverStages.helpers(helpers),
            ResolverStages.declaredVariables(catalog),
            ResolverStages.injections(ctx, injections),
            ResolverStages.intrinsics(intrinsics, catalog)
        ));
        ctx.attach(environment);
        new Execution(ctx).run(routine.statements());
        var retained = ledger.retained();
        LOG.debug("Evaluated {}: {} ledger slots, {} retained", routine.name(), ledger.size(), retained.size());
        return new Evaluation(retained, environment.bindings());
    }

    /** Statement walk of one routine. */
    private static final class Execution {
        private final EvaluationContext ctx;
        private String pendingDocumentation;

        Execution(EvaluationContext ctx) {
            this.ctx = ctx;
        }

        void run(List<Statement> statements) {
            for (var statement : statements) {
                if (statement instanceof Statement.Comment comment) {
                    pendingDocumentation = comment.text();
                    continue;
                }
                if (statement instanceof Statement.InertLine) {
                    pendingDocumentation = null;
                    continue;
                }
                var documentation = pendingDocumentation;
                pendingDocumentation = null;
                int mark = ctx.ledger().size();
                execute(statement);
                if (documentation != null && documents(statement)) {
                    ctx.ledger().document(mark, documentation);
                }
            }
        }

        private static boolean documents(Statement statement) {
            return statement instanceof Statement.ExpressionStatement
                || statement instanceof Statement.Assignment
                || statement instanceof Statement.Declaration;
        }

        private void execute(Statement statement) {
            if (statement instanceof Statement.ExpressionStatement expression) {
                evaluate(expression.expression());
            } else if (statement instanceof Statement.Assignment assignment) {
                var value = evaluate(assignment.value());
                store(assignment.target(), value);
            } else if (statement instanceof Statement.Declaration declaration) {
                var value = evaluate(declaration.valueExpression());
                ctx.environment().declareLocal(declaration.name());
                ctx.assignLocal(declaration.name(), value);
            } else if (statement instanceof Statement.Branch branch) {
                run(condition(branch.condition()) ? branch.then() : branch.otherwise());
            } else if (statement instanceof Statement.Loop loop) {
                int iterations = 0;
                while (condition(loop.condition())) {
                    if (++iterations > MAX_LOOP_ITERATIONS) {
                        throw new ExtractionException(ITERATION_LIMIT,
                            "Loop 'while " + loop.condition().render() + "' ran more than " + MAX_LOOP_ITERATIONS + " iterations");
                    }
                    run(loop.body());
                }
            } else if (statement instanceof Statement.ManualRoutine manual) {
                ctx.primitive(manual.routine(), List.of());
            } else if (!(statement instanceof Statement.RoutineHeader)) {
                throw new IllegalArgumentException("Unknown statement: " + statement);
            }
        }

        private void store(Expr target, Object value) {
            if (target instanceof Expr.Name name) {
                ctx.assign(name.id(), value);
            } else if (target instanceof Expr.Subscript subscript) {
                var container = evaluate(subscript.target());
                long index = Values.requireInteger(evaluate(subscript.index()), "Array index");
                if (!(container instanceof ArrayValue array)) {
                    throw ExtractionException.invalidOperation("Cannot store into element of " + Values.describe(container));
                }
                array.set(index, value);
            } else if (target instanceof Expr.Field field) {
                record(field.target()).set(field.name(), value);
            } else {
                throw ExtractionException.invalidOperation("Cannot assign to " + target.render());
            }
        }

        private RecordValue record(Expr target) {
            var container = evaluate(target);
            if (container instanceof RecordValue record) {
                return record;
            }
            if (container == Undefined.INSTANCE && target instanceof Expr.Name name && ctx.environment().isLocal(name.id())) {
                var record = new RecordValue();
                ctx.environment().bind(name.id(), record);
                return record;
            }
            throw ExtractionException.invalidOperation("Cannot store a field of " + Values.describe(container));
        }

        private boolean condition(Expr condition) {
            var value = evaluate(condition);
            return Values.truthiness(value)
                .orElseThrow(() -> new NonConcreteConditionException(condition.render(), value));
        }

        Object evaluate(Expr expr) {
            if (expr instanceof Expr.Name name) {
                return ctx.lookup(name.id());
            }
            if (expr instanceof Expr.IntLit literal) {
                return NativeLiteral.of(literal.value());
            }
            if (expr instanceof Expr.FloatLit literal) {
                return new FloatLiteral(literal.value());
            }
            if (expr instanceof Expr.StrLit literal) {
                return new TextLiteral(literal.value());
            }
            if (expr instanceof Expr.BoolLit literal) {
                return NativeLiteral.of(literal.value());
            }
            if (expr == Expr.NoneLit.INSTANCE) {
                return Undefined.INSTANCE;
            }
            if (expr instanceof Expr.Call call) {
                var callee = evaluate(call.function());
                var arguments = new ArrayList<Object>(call.arguments().size());
                for (var argument : call.arguments()) {
                    arguments.add(evaluate(argument));
                }
                return ctx.call(callee, arguments);
            }
            if (expr instanceof Expr.Unary unary) {
                return Operators.unary(unary.operator(), evaluate(unary.operand()));
            }
            if (expr instanceof Expr.Binary binary) {
                return binary(binary);
            }
            if (expr instanceof Expr.Conditional conditional) {
                return condition(conditional.condition())
                    ? evaluate(conditional.then())
                    : evaluate(conditional.otherwise());
            }
            if (expr instanceof Expr.Subscript subscript) {
                return element(evaluate(subscript.target()), evaluate(subscript.index()));
            }
            if (expr instanceof Expr.Field field) {
                var container = evaluate(field.target());
                if (container instanceof RecordValue record) {
                    return record.get(field.name());
                }
                throw ExtractionException.invalidOperation("Cannot read field " + field.name() + " of " + Values.describe(container));
            }
            if (expr instanceof Expr.ListLit list) {
                var elements = new ArrayList<Object>(list.elements().size());
                for (var element : list.elements()) {
                    elements.add(evaluate(element));
                }
                return new ArrayValue(elements);
            }
            throw new IllegalArgumentException("Unknown expression: " + expr);
        }

        // and/or yield the deciding operand, so `x = a || b` keeps b's value when a is false.
        private Object binary(Expr.Binary binary) {
            if (binary.operator() == Operator.AND || binary.operator() == Operator.OR) {
                var left = evaluate(binary.left());
                boolean truth = Values.truthiness(left)
                    .orElseThrow(() -> new NonConcreteConditionException(binary.left().render(), left));
                boolean decided = binary.operator() == Operator.AND ? !truth : truth;
                return decided ? left : evaluate(binary.right());
            }
            return Operators.binary(binary.operator(), evaluate(binary.left()), evaluate(binary.right()));
        }

        private static Object element(Object container, Object index) {
            long position = Values.requireInteger(index, "Array index");
            if (container instanceof ArrayValue array) {
                return array.get(position);
            }
            if (container instanceof ArrayLiteral array) {
                if (position < 0 || position >= array.elements().size()) {
                    throw ExtractionException.invalidOperation("Index " + position + " out of bounds for " + array.elements().size() + " elements");
                }
                return array.elements().get((int) position);
            }
            if (container instanceof TextLiteral text) {
                var bytes = CLiterals.bytes(text.value());
                if (position == bytes.length) {
                    return NativeLiteral.ZERO;
                }
                if (position < 0 || position > bytes.length) {
                    throw ExtractionException.invalidOperation("Index " + position + " out of bounds for string of " + bytes.length + " bytes");
                }
                return NativeLiteral.of(bytes[(int) position] & 0xff);
            }
            throw ExtractionException.invalidOperation("Cannot index " + Values.describe(container));
        }
    }
}
