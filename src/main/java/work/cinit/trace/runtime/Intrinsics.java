package work.cinit.trace.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.cinit.trace.catalog.FactCatalog;
import work.cinit.trace.shared.CLiterals;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.value.SymbolicValue.ArrayLiteral;
import work.cinit.trace.value.SymbolicValue.ConstantRef;
import work.cinit.trace.value.SymbolicValue.IntLiteral;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.SymbolRef;
import work.cinit.trace.value.SymbolicValue.TextLiteral;
import work.cinit.trace.value.SymbolicValue.Undefined;

/**
 * Lowest-priority names: C idioms the normalizer leaves as marker calls, plus a few evaluator controls.
 */
public final class Intrinsics {
    private Intrinsics() {}

    public static HelperRegistry register(HelperRegistry registry) {
        registry.register("ARRAYELTS", (ctx, args) -> {
            var target = single("ARRAYELTS", args);
            if (target instanceof ArrayValue array) {
                return NativeLiteral.of((long) array.size());
            }
            if (target instanceof ArrayLiteral array) {
                return NativeLiteral.of((long) array.elements().size());
            }
            throw ExtractionException.invalidOperation("ARRAYELTS needs an array, got " + Values.describe(target));
        });
        registry.register("sizeof", (ctx, args) -> ctx.primitive("sizeof", List.of(single("sizeof", args))));
        registry.register("c_pointer", (ctx, args) -> second("c_pointer", args));
        registry.register("c_cast", (ctx, args) -> second("c_cast", args));
        registry.register("c_array", Intrinsics::array);
        registry.register("CALLN", (ctx, args) -> {
            if (args.isEmpty()) {
                throw ExtractionException.invalidOperation("CALLN needs a function");
            }
            return ctx.call(args.get(0), new ArrayList<>(args.subList(1, args.size())));
        });
        registry.register("CALLMANY", (ctx, args) -> {
            if (args.size() != 2) {
                throw ExtractionException.invalidOperation("CALLMANY takes a function and an array");
            }
            return ctx.call(args.get(0), elements(args.get(1)));
        });
        registry.register("void", Helper.untracked((ctx, args) -> Undefined.INSTANCE));
        registry.register("PE_CONSTANT", Helper.untracked((ctx, args) -> {
            var name = Values.requireText(single("PE_CONSTANT", args), "Constant name");
            var constant = ctx.catalog().constant(ctx.unit(), name);
            if (constant.isEmpty()) {
                return ctx.lookup(name);
            }
            if (constant.get().value() instanceof IntLiteral) {
                return new ConstantRef(name, constant.get().value());
            }
            return constant.get().value();
        }));
        registry.register("PRUNE_SIDE_EFFECT", Helper.untracked((ctx, args) -> {
            var value = single("PRUNE_SIDE_EFFECT", args);
            ctx.consume(value);
            return value;
        }));
        return registry;
    }

    /**
     * Intrinsic names bound to plain values rather than callables.
     */
    public static Optional<Object> constant(String name, FactCatalog catalog) {
        return switch (name) {
            case "NULL" -> Optional.of(NativeLiteral.ZERO);
            case "lispsym" -> {
                var symbols = new ArrayList<Object>(catalog.symbols().size());
                for (var symbol : catalog.symbols()) {
                    symbols.add(new SymbolRef(symbol.lispName()));
                }
                yield Optional.of(new ArrayValue(symbols));
            }
            default -> Optional.empty();
        };
    }

    private static Object array(EvaluationContext ctx, List<Object> args) {
        if (args.size() != 2) {
            throw ExtractionException.invalidOperation("c_array takes a size and an initializer");
        }
        long size = Values.requireInteger(args.get(0), "Array size");
        if (size < 0 || size > Integer.MAX_VALUE) {
            throw ExtractionException.invalidOperation("Invalid array size " + size);
        }
        var array = ArrayValue.ofSize((int) size);
        var initializer = args.get(1);
        if (initializer instanceof Undefined) {
            return array;
        }
        List<Object> values;
        if (initializer instanceof TextLiteral text) {
            var codes = new ArrayList<Object>();
            for (byte b : CLiterals.bytes(text.value())) {
                codes.add(NativeLiteral.of((long) (b & 0xff)));
            }
            codes.add(NativeLiteral.ZERO);
            values = codes;
        } else {
            values = elements(initializer);
        }
        for (int i = 0; i < Math.min(values.size(), size); i++) {
            array.set(i, values.get(i));
        }
        return array;
    }

    private static List<Object> elements(Object value) {
        if (value instanceof ArrayValue array) {
            return new ArrayList<>(array.elements());
        }
        if (value instanceof ArrayLiteral array) {
            return new ArrayList<>(array.elements());
        }
        throw ExtractionException.invalidOperation("Expected an array, got " + Values.describe(value));
    }

    private static Object single(String name, List<Object> args) {
        if (args.size() != 1) {
            throw ExtractionException.invalidOperation(name + " takes 1 argument, got " + args.size());
        }
        return args.get(0);
    }

    private static Object second(String name, List<Object> args) {
        if (args.size() != 2) {
            throw ExtractionException.invalidOperation(name + " takes 2 arguments, got " + args.size());
        }
        return args.get(1);
    }
}
