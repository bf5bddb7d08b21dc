package work.cinit.trace.runtime;

import java.util.List;
import java.util.Set;
import work.cinit.trace.shared.CLiterals;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.SymbolicValue.SymbolRef;

/**
 * Recognized runtime helper functions: rewrites that restate a helper as a higher-level form, and
 * plain primitives kept as calls.
 */
public final class RuntimeHelpers {
    public static final Set<String> DEFAULT_PRIMITIVES = Set.of(
        "make_string",
        "make_vector",
        "make_float",
        "make_fixnum",
        "make_symbol_constant",
        "make_symbol_special",
        "set_char_table_purpose",
        "set_char_table_defalt",
        "char_table_set_range",
        "decode_env_path"
    );

    private RuntimeHelpers() {}

    public static HelperRegistry register(HelperRegistry registry, Set<String> extraPrimitives) {
        for (var name : DEFAULT_PRIMITIVES) {
            registry.register(name, primitive(name));
        }
        for (var name : extraPrimitives) {
            registry.register(name, primitive(name));
        }

        registry.register("make_pure_string", (ctx, args) -> {
            arity("make_pure_string", args, 4);
            return ctx.primitive("make_string", List.of(args.get(0), args.get(1)));
        });
        registry.register("build_pure_c_string", RuntimeHelpers::buildString);
        registry.register("build_string", RuntimeHelpers::buildString);
        registry.register("build_unibyte_string", (ctx, args) -> {
            arity("build_unibyte_string", args, 1);
            String text = Values.requireText(args.get(0), "build_unibyte_string argument");
            return ctx.primitive("make_string", List.of(args.get(0), NativeLiteral.of((long) CLiterals.bytes(text).length)));
        });

        registry.register("intern", RuntimeHelpers::intern);
        registry.register("intern_c_string", RuntimeHelpers::intern);

        registry.register("pure_cons", (ctx, args) -> {
            arity("pure_cons", args, 2);
            return ctx.composite("cons", args);
        });
        registry.register("pure_list", (ctx, args) -> ctx.composite("list", args));
        for (int n = 1; n <= 4; n++) {
            int expected = n;
            registry.register("list" + n, (ctx, args) -> {
                arity("list" + expected, args, expected);
                return ctx.composite("list", args);
            });
        }
        registry.register("listn", (ctx, args) -> {
            if (args.isEmpty()) {
                throw ExtractionException.invalidOperation("listn needs an element count");
            }
            long count = Values.requireInteger(args.get(0), "listn count");
            if (count != args.size() - 1) {
                throw ExtractionException.invalidOperation("listn announces " + count + " elements but got " + (args.size() - 1));
            }
            return ctx.composite("list", args.subList(1, args.size()));
        });
        registry.register("nconc2", (ctx, args) -> {
            arity("nconc2", args, 2);
            return ctx.composite("nconc", args);
        });

        registry.register("make_pure_vector", RuntimeHelpers::nilVector);
        registry.register("make_nil_vector", RuntimeHelpers::nilVector);
        registry.register("ASET", (ctx, args) -> {
            arity("ASET", args, 3);
            return ctx.composite("aset", args);
        });
        registry.register("AREF", (ctx, args) -> {
            arity("AREF", args, 2);
            return ctx.composite("aref", args);
        });
        registry.register("CHAR_TABLE_SET", (ctx, args) -> {
            arity("CHAR_TABLE_SET", args, 3);
            return ctx.primitive("char_table_set", args);
        });
        return registry;
    }

    private static Helper primitive(String name) {
        return (ctx, args) -> ctx.primitive(name, args);
    }

    private static Object buildString(EvaluationContext ctx, List<Object> args) {
        arity("build_string", args, 1);
        String text = Values.requireText(args.get(0), "build_string argument");
        long length = CLiterals.bytes(text).length;
        return ctx.primitive("make_string", List.of(args.get(0), NativeLiteral.of(length)));
    }

    private static Object intern(EvaluationContext ctx, List<Object> args) {
        if (args.isEmpty()) {
            throw ExtractionException.invalidOperation("intern needs a symbol name");
        }
        return new SymbolRef(Values.requireText(args.get(0), "Interned name"));
    }

    private static Object nilVector(EvaluationContext ctx, List<Object> args) {
        arity("make_nil_vector", args, 1);
        return ctx.primitive("make_vector", List.of(args.get(0), new SymbolRef("nil")));
    }

    private static void arity(String name, List<Object> args, int expected) {
        if (args.size() != expected) {
            throw ExtractionException.invalidOperation(name + " takes " + expected + " arguments, got " + args.size());
        }
    }
}
