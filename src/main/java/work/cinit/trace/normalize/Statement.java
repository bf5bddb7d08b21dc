package work.cinit.trace.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Statement of the normalized language.
 *
 * <p>{@link #render()} gives the one-line header of a statement; nested bodies of branches and loops
 * are laid out by {@link #listing(List)} with four-space indentation.</p>
 */
public interface Statement {

    String render();

    /** One-based source line the statement came from, or 0. */
    int line();

    record ExpressionStatement(Expr expression, int line) implements Statement {
        public ExpressionStatement {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public String render() {
            return expression.render();
        }
    }

    record Assignment(Expr target, Expr value, int line) implements Statement {
        public Assignment {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return target.render() + "=" + value.render();
        }
    }

    record Branch(Expr condition, List<Statement> then, List<Statement> otherwise, int line) implements Statement {
        public Branch {
            Objects.requireNonNull(condition, "condition");
            then = List.copyOf(then);
            otherwise = otherwise == null ? List.of() : List.copyOf(otherwise);
        }

        @Override
        public String render() {
            return "if (" + condition.render() + "):";
        }
    }

    /** Loop that runs while its condition holds; the condition must evaluate to a concrete value. */
    record Loop(Expr condition, List<Statement> body, int line) implements Statement {
        public Loop {
            Objects.requireNonNull(condition, "condition");
            body = List.copyOf(body);
        }

        @Override
        public String render() {
            return "while (" + condition.render() + "):";
        }
    }

    /**
     * Local declaration. With a size it builds a fresh array filled from the initializer.
     */
    record Declaration(String name, Expr size, Expr initializer, int line) implements Statement {
        public Declaration {
            Objects.requireNonNull(name, "name");
        }

        public boolean isArray() {
            return size != null;
        }

        /** Value expression the declaration binds. */
        public Expr valueExpression() {
            Expr init = initializer == null ? Expr.NoneLit.INSTANCE : initializer;
            return isArray() ? Expr.call("c_array", size, init) : init;
        }

        @Override
        public String render() {
            return name + "=" + valueExpression().render();
        }
    }

    record Comment(String text, int line) implements Statement {
        public Comment {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String render() {
            return "# " + text.replace("\n", "\n# ");
        }
    }

    /**
     * Line removed by an override, or a {@code #} line of a replacement. Shown in listings only; it
     * evaluates to nothing and never documents the statement after it.
     */
    record InertLine(String text, int line) implements Statement {
        public InertLine {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String render() {
            return "# " + text.replace("\n", "\n# ");
        }
    }

    /** Marks the start of an inlined routine in listings; evaluates to nothing. */
    record RoutineHeader(String signature) implements Statement {
        @Override
        public String render() {
            return "### " + signature + " ###";
        }

        @Override
        public int line() {
            return 0;
        }
    }

    /** Stands for a routine implemented by hand in the host runtime. */
    record ManualRoutine(String routine) implements Statement {
        @Override
        public String render() {
            return "# manual implementation: " + routine;
        }

        @Override
        public int line() {
            return 0;
        }
    }

    static List<String> listing(List<Statement> statements) {
        var lines = new ArrayList<String>();
        appendListing(lines, statements, "");
        return lines;
    }

    private static void appendListing(List<String> lines, List<Statement> statements, String indent) {
        for (var statement : statements) {
            for (var part : statement.render().split("\n", -1)) {
                lines.add(indent + part);
            }
            if (statement instanceof Branch branch) {
                appendListing(lines, branch.then(), indent + "    ");
                if (!branch.otherwise().isEmpty()) {
                    lines.add(indent + "else:");
                    appendListing(lines, branch.otherwise(), indent + "    ");
                }
            } else if (statement instanceof Loop loop) {
                appendListing(lines, loop.body(), indent + "    ");
            }
        }
    }
}
