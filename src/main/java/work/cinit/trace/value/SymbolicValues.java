package work.cinit.trace.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.cinit.trace.shared.CLiterals;
import work.cinit.trace.value.SymbolicValue.ArrayLiteral;
import work.cinit.trace.value.SymbolicValue.BoolLiteral;
import work.cinit.trace.value.SymbolicValue.CompositeCall;
import work.cinit.trace.value.SymbolicValue.ConstantRef;
import work.cinit.trace.value.SymbolicValue.DeclaredVariableAssignment;
import work.cinit.trace.value.SymbolicValue.DeclaredVariableRef;
import work.cinit.trace.value.SymbolicValue.FloatLiteral;
import work.cinit.trace.value.SymbolicValue.IntLiteral;
import work.cinit.trace.value.SymbolicValue.PrimitiveCall;
import work.cinit.trace.value.SymbolicValue.RawGlobalAssignment;
import work.cinit.trace.value.SymbolicValue.RawGlobalRef;
import work.cinit.trace.value.SymbolicValue.SymbolRef;
import work.cinit.trace.value.SymbolicValue.TextLiteral;
import work.cinit.trace.value.SymbolicValue.Undefined;
import work.cinit.trace.value.SymbolicValue.Verbatim;

/**
 * Structural helpers over {@link SymbolicValue}: child traversal, one-line rendering and JSON projection.
 */
public final class SymbolicValues {
    private SymbolicValues() {}

    public static List<SymbolicValue> children(SymbolicValue value) {
        if (value instanceof CompositeCall call) {
            return call.arguments();
        }
        if (value instanceof PrimitiveCall call) {
            return call.arguments();
        }
        if (value instanceof ArrayLiteral array) {
            return array.elements();
        }
        if (value instanceof DeclaredVariableAssignment assignment) {
            return List.of(assignment.value());
        }
        if (value instanceof RawGlobalAssignment assignment) {
            return List.of(assignment.value());
        }
        if (value instanceof ConstantRef constant) {
            return List.of(constant.value());
        }
        return List.of();
    }

    /**
     * Compact rendering used in listings, logs and tests: composite calls print as lisp forms,
     * declared variables with a {@code $} prefix, symbols quoted.
     */
    public static String render(SymbolicValue value) {
        if (value instanceof BoolLiteral bool) {
            return Boolean.toString(bool.value());
        }
        if (value instanceof IntLiteral integer) {
            return Long.toString(integer.value());
        }
        if (value instanceof FloatLiteral floating) {
            return Double.toString(floating.value());
        }
        if (value instanceof TextLiteral text) {
            return CLiterals.quote(text.value());
        }
        if (value instanceof ArrayLiteral array) {
            return "[" + join(array.elements(), ", ") + "]";
        }
        if (value instanceof Undefined) {
            return "undefined";
        }
        if (value instanceof Verbatim verbatim) {
            return "<" + verbatim.text() + ">";
        }
        if (value instanceof ConstantRef constant) {
            return constant.name();
        }
        if (value instanceof DeclaredVariableRef variable) {
            return "$" + variable.lispName();
        }
        if (value instanceof RawGlobalRef global) {
            return global.cName();
        }
        if (value instanceof SymbolRef symbol) {
            return "'" + symbol.lispName();
        }
        if (value instanceof CompositeCall call) {
            return call.arguments().isEmpty()
                ? "(" + call.function() + ")"
                : "(" + call.function() + " " + join(call.arguments(), " ") + ")";
        }
        if (value instanceof PrimitiveCall call) {
            return call.function() + "(" + join(call.arguments(), ", ") + ")";
        }
        if (value instanceof DeclaredVariableAssignment assignment) {
            return "$" + assignment.lispName() + " = " + render(assignment.value());
        }
        if (value instanceof RawGlobalAssignment assignment) {
            return (assignment.local() ? "local " : "") + assignment.cName() + " = " + render(assignment.value());
        }
        throw new IllegalArgumentException("Unknown symbolic value: " + value);
    }

    public static Map<String, Object> toSerializableMap(SymbolicValue value) {
        var map = new LinkedHashMap<String, Object>();
        if (value instanceof BoolLiteral bool) {
            map.put("kind", "bool");
            map.put("value", bool.value());
        } else if (value instanceof IntLiteral integer) {
            map.put("kind", "int");
            map.put("value", integer.value());
        } else if (value instanceof FloatLiteral floating) {
            map.put("kind", "float");
            map.put("value", floating.value());
        } else if (value instanceof TextLiteral text) {
            map.put("kind", "text");
            map.put("value", text.value());
        } else if (value instanceof ArrayLiteral array) {
            map.put("kind", "array");
            map.put("elements", serializeAll(array.elements()));
        } else if (value instanceof Undefined) {
            map.put("kind", "undefined");
        } else if (value instanceof Verbatim verbatim) {
            map.put("kind", "verbatim");
            map.put("text", verbatim.text());
        } else if (value instanceof ConstantRef constant) {
            map.put("kind", "constant");
            map.put("name", constant.name());
            map.put("value", toSerializableMap(constant.value()));
        } else if (value instanceof DeclaredVariableRef variable) {
            map.put("kind", "variable");
            map.put("lispName", variable.lispName());
        } else if (value instanceof RawGlobalRef global) {
            map.put("kind", "global");
            map.put("cName", global.cName());
            map.put("local", global.local());
        } else if (value instanceof SymbolRef symbol) {
            map.put("kind", "symbol");
            map.put("lispName", symbol.lispName());
        } else if (value instanceof CompositeCall call) {
            map.put("kind", "form");
            map.put("function", call.function());
            map.put("arguments", serializeAll(call.arguments()));
        } else if (value instanceof PrimitiveCall call) {
            map.put("kind", "primitive");
            map.put("function", call.function());
            map.put("arguments", serializeAll(call.arguments()));
        } else if (value instanceof DeclaredVariableAssignment assignment) {
            map.put("kind", "set-variable");
            map.put("lispName", assignment.lispName());
            map.put("value", toSerializableMap(assignment.value()));
        } else if (value instanceof RawGlobalAssignment assignment) {
            map.put("kind", "set-global");
            map.put("cName", assignment.cName());
            map.put("local", assignment.local());
            map.put("value", toSerializableMap(assignment.value()));
        } else {
            throw new IllegalArgumentException("Unknown symbolic value: " + value);
        }
        return map;
    }

    private static List<Map<String, Object>> serializeAll(List<SymbolicValue> values) {
        var list = new ArrayList<Map<String, Object>>(values.size());
        for (var value : values) {
            list.add(toSerializableMap(value));
        }
        return list;
    }

    private static String join(List<SymbolicValue> values, String separator) {
        var builder = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) builder.append(separator);
            builder.append(render(values.get(i)));
        }
        return builder.toString();
    }
}
