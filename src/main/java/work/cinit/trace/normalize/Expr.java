package work.cinit.trace.normalize;

import java.util.List;
import java.util.Objects;
import work.cinit.trace.shared.CLiterals;

/**
 * Expression of the normalized language. Every variant renders to one canonical line of text,
 * which is what override rules match against.
 */
public interface Expr {

    String render();

    /** Binding strength used to decide where parentheses are needed. */
    default int precedence() {
        return 100;
    }

    static Name name(String id) {
        return new Name(id);
    }

    static Call call(String function, Expr... arguments) {
        return new Call(new Name(function), List.of(arguments));
    }

    record Name(String id) implements Expr {
        public Name {
            Objects.requireNonNull(id, "id");
        }

        @Override
        public String render() {
            return id;
        }
    }

    record IntLit(long value) implements Expr {
        @Override
        public String render() {
            return Long.toString(value);
        }

        @Override
        public int precedence() {
            return value < 0 ? Operator.UNARY_PRECEDENCE : 100;
        }
    }

    record FloatLit(double value) implements Expr {
        @Override
        public String render() {
            return Double.toString(value);
        }

        @Override
        public int precedence() {
            return value < 0 ? Operator.UNARY_PRECEDENCE : 100;
        }
    }

    record StrLit(String value) implements Expr {
        public StrLit {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return CLiterals.quote(value);
        }
    }

    record BoolLit(boolean value) implements Expr {
        @Override
        public String render() {
            return value ? "True" : "False";
        }
    }

    enum NoneLit implements Expr {
        INSTANCE;

        @Override
        public String render() {
            return "None";
        }
    }

    record Call(Expr function, List<Expr> arguments) implements Expr {
        public Call {
            Objects.requireNonNull(function, "function");
            arguments = List.copyOf(arguments);
        }

        /** Callee name when the function is a plain name, otherwise null. */
        public String functionName() {
            return function instanceof Name name ? name.id() : null;
        }

        @Override
        public String render() {
            var builder = new StringBuilder(wrap(function, 100)).append('(');
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) builder.append(',');
                builder.append(arguments.get(i).render());
            }
            return builder.append(')').toString();
        }
    }

    /** Prefix operator: {@code -}, {@code +}, {@code ~} or {@code not}. */
    record Unary(String operator, Expr operand) implements Expr {
        @Override
        public String render() {
            if ("not".equals(operator)) {
                return "not " + wrap(operand, Operator.NOT_PRECEDENCE);
            }
            return operator + wrap(operand, Operator.UNARY_PRECEDENCE);
        }

        @Override
        public int precedence() {
            return "not".equals(operator) ? Operator.NOT_PRECEDENCE : Operator.UNARY_PRECEDENCE;
        }
    }

    record Binary(Operator operator, Expr left, Expr right) implements Expr {
        @Override
        public String render() {
            // left-associative: the right operand needs parentheses at equal strength
            return wrap(left, operator.precedence()) + operator.spelled() + wrap(right, operator.precedence() + 1);
        }

        @Override
        public int precedence() {
            return operator.precedence();
        }
    }

    /** Inline conditional, evaluated eagerly where it appears. */
    record Conditional(Expr condition, Expr then, Expr otherwise) implements Expr {
        @Override
        public String render() {
            return "(" + then.render() + " if " + condition.render() + " else " + otherwise.render() + ")";
        }
    }

    record Subscript(Expr target, Expr index) implements Expr {
        @Override
        public String render() {
            return wrap(target, 100) + "[" + index.render() + "]";
        }
    }

    record Field(Expr target, String name, boolean arrow) implements Expr {
        @Override
        public String render() {
            return wrap(target, 100) + (arrow ? "->" : ".") + name;
        }
    }

    record ListLit(List<Expr> elements) implements Expr {
        public ListLit {
            elements = List.copyOf(elements);
        }

        @Override
        public String render() {
            var builder = new StringBuilder("[");
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) builder.append(',');
                builder.append(elements.get(i).render());
            }
            return builder.append(']').toString();
        }
    }

    private static String wrap(Expr expr, int minimum) {
        String text = expr.render();
        return expr.precedence() < minimum ? "(" + text + ")" : text;
    }
}
