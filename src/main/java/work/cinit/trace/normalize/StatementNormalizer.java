package work.cinit.trace.normalize;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.cinit.trace.catalog.CatalogInconsistencyException;
import work.cinit.trace.normalize.Statement.Assignment;
import work.cinit.trace.normalize.Statement.Branch;
import work.cinit.trace.normalize.Statement.Comment;
import work.cinit.trace.normalize.Statement.Declaration;
import work.cinit.trace.normalize.Statement.ExpressionStatement;
import work.cinit.trace.normalize.Statement.InertLine;
import work.cinit.trace.normalize.Statement.Loop;
import work.cinit.trace.normalize.Statement.ManualRoutine;
import work.cinit.trace.normalize.Statement.RoutineHeader;
import work.cinit.trace.shared.CLiterals;
import work.cinit.trace.syntax.RoutineSource;
import work.cinit.trace.syntax.SyntaxNode;

/**
 * Turns parsed routine bodies into flat normalized statement lists.
 *
 * <p>Zero-argument calls to other known routines are inlined at the call site. Results are memoized
 * per routine name, and a routine that ends up inlining itself is rejected as a catalog
 * inconsistency.</p>
 */
public final class StatementNormalizer {
    private static final Logger LOG = LogManager.getLogger(StatementNormalizer.class);

    private final Map<String, RoutineSource> routines = new LinkedHashMap<>();
    private final Map<String, List<OverrideRule>> overrides;
    private final Set<String> handImplemented;
    private final Map<String, NormalizedRoutine> cache = new HashMap<>();
    private final Set<String> inProgress = new LinkedHashSet<>();

    public StatementNormalizer(
        Collection<RoutineSource> sources,
        Map<String, List<OverrideRule>> overrides,
        Set<String> handImplemented
    ) {
        for (var source : sources) {
            routines.put(source.name(), source);
        }
        this.overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
        this.handImplemented = handImplemented == null ? Set.of() : Set.copyOf(handImplemented);
    }

    public boolean knows(String routine) {
        return routines.containsKey(routine) || handImplemented.contains(routine);
    }

    public NormalizedRoutine normalize(String routine) {
        var cached = cache.get(routine);
        if (cached != null) {
            return cached;
        }
        var source = routines.get(routine);
        if (handImplemented.contains(routine)) {
            var manual = new NormalizedRoutine(
                routine,
                source == null ? null : source.unit(),
                List.of(new ManualRoutine(routine)),
                true
            );
            cache.put(routine, manual);
            return manual;
        }
        if (source == null) {
            throw new IllegalArgumentException("Unknown routine: " + routine);
        }
        if (!inProgress.add(routine)) {
            throw new CatalogInconsistencyException(
                "Routine " + routine + " inlines itself through " + String.join(" -> ", inProgress) + " -> " + routine
            );
        }
        var frame = new RoutineFrame(overrides.getOrDefault(routine, List.of()));
        try {
            frame.block(source.body(), frame.output);
            var normalized = new NormalizedRoutine(routine, source.unit(), frame.output, false);
            cache.put(routine, normalized);
            return normalized;
        } finally {
            inProgress.remove(routine);
        }
    }

    private final class RoutineFrame {
        private final List<OverrideRule> rules;
        private final List<Statement> output = new ArrayList<>();

        RoutineFrame(List<OverrideRule> rules) {
            this.rules = rules;
        }

        void block(SyntaxNode node, List<Statement> out) {
            if (node.is("compound_statement")) {
                for (var child : node.namedChildren()) {
                    statement(child, out);
                }
            } else {
                statement(node, out);
            }
        }

        private List<Statement> nested(SyntaxNode node) {
            var statements = new ArrayList<Statement>();
            if (node != null) {
                block(node, statements);
            }
            return statements;
        }

        void statement(SyntaxNode node, List<Statement> out) {
            switch (node.type()) {
                case "compound_statement" -> block(node, out);
                case "preproc_call" -> {
                }
                case "comment" -> emit(out, new Comment(CLiterals.trimComment(node.text()), node.line()));
                case "expression_statement" -> {
                    var operands = operands(node);
                    if (!operands.isEmpty()) {
                        expressionStatement(operands.get(0), out);
                    }
                }
                case "declaration" -> declaration(node, out);
                case "enum_specifier" -> enumerators(node, out);
                case "if_statement" -> ifStatement(node, out);
                case "while_statement" -> {
                    var condition = loopCondition(node.child("condition"), out);
                    if (condition != null) {
                        out.add(new Loop(condition, nested(node.child("body")), node.line()));
                    }
                }
                case "do_statement" -> {
                    var body = nested(node.child("body"));
                    out.addAll(body);
                    var condition = loopCondition(node.child("condition"), out);
                    if (condition != null) {
                        out.add(new Loop(condition, body, node.line()));
                    }
                }
                case "for_statement" -> forStatement(node, out);
                default -> throw unrecognized(node);
            }
        }

        private void ifStatement(SyntaxNode node, List<Statement> out) {
            var condition = expression(required(node, "condition"), out);
            var header = LineOverrides.apply("if (" + condition.render() + "):", rules);
            switch (header.outcome()) {
                case DELETED -> {
                    LOG.debug("Override deleted branch '{}'", header.text());
                    out.add(new InertLine(header.text(), node.line()));
                    return;
                }
                case REPLACED -> condition = LineParser.parseCondition(header.text());
                default -> {
                }
            }
            var then = nested(node.child("consequence"));
            var alternative = node.child("alternative");
            if (alternative != null && alternative.is("else_clause")) {
                var inner = operands(alternative);
                alternative = inner.isEmpty() ? null : inner.get(0);
            }
            out.add(new Branch(condition, then, nested(alternative), node.line()));
        }

        private void forStatement(SyntaxNode node, List<Statement> out) {
            var initializer = node.child("initializer");
            if (initializer != null) {
                if (initializer.is("declaration")) {
                    declaration(initializer, out);
                } else {
                    expressionStatement(initializer, out);
                }
            }
            var conditionNode = node.child("condition");
            Expr condition = conditionNode == null ? new Expr.BoolLit(true) : loopCondition(conditionNode, out);
            if (condition == null) {
                return;
            }
            var body = nested(node.child("body"));
            var update = node.child("update");
            if (update != null) {
                expressionStatement(update, body);
            }
            out.add(new Loop(condition, body, node.line()));
        }

        /** Returns null when an override deleted the loop. */
        private Expr loopCondition(SyntaxNode node, List<Statement> out) {
            if (node == null) {
                return new Expr.BoolLit(true);
            }
            var hoisted = new ArrayList<Statement>();
            var condition = expression(node, hoisted);
            if (!hoisted.isEmpty()) {
                throw new UnrecognizedConstructException(
                    "loop_condition_side_effect",
                    node.text(),
                    node.line(),
                    Statement.listing(output)
                );
            }
            var header = LineOverrides.apply("while (" + condition.render() + "):", rules);
            return switch (header.outcome()) {
                case DELETED -> {
                    LOG.debug("Override deleted loop '{}'", header.text());
                    out.add(new InertLine(header.text(), node.line()));
                    yield null;
                }
                case REPLACED -> LineParser.parseCondition(header.text());
                default -> condition;
            };
        }

        private void expressionStatement(SyntaxNode node, List<Statement> out) {
            switch (node.type()) {
                case "assignment_expression" -> assignment(node, out);
                case "update_expression" -> increment(node, out);
                case "comma_expression" -> {
                    expressionStatement(required(node, "left"), out);
                    expressionStatement(required(node, "right"), out);
                }
                case "parenthesized_expression" -> expressionStatement(single(node), out);
                case "call_expression" -> {
                    String callee = inlineTarget(node);
                    if (callee != null) {
                        inline(callee, node, out);
                    } else {
                        emit(out, new ExpressionStatement(expression(node, out), node.line()));
                    }
                }
                default -> emit(out, new ExpressionStatement(expression(node, out), node.line()));
            }
        }

        private String inlineTarget(SyntaxNode call) {
            var function = call.child("function");
            var arguments = call.child("arguments");
            if (function == null || !function.is("identifier")) {
                return null;
            }
            if (arguments != null && !operands(arguments).isEmpty()) {
                return null;
            }
            return knows(function.text()) ? function.text() : null;
        }

        private void inline(String callee, SyntaxNode call, List<Statement> out) {
            var line = LineOverrides.apply(callee + "()", rules);
            if (line.outcome() == LineOverrides.Outcome.DELETED) {
                out.add(new InertLine(line.text(), call.line()));
                return;
            }
            if (line.outcome() == LineOverrides.Outcome.REPLACED) {
                out.addAll(LineParser.parseStatements(line.text(), call.line()));
                return;
            }
            LOG.debug("Inlining routine {}", callee);
            var inlined = normalize(callee);
            var source = routines.get(callee);
            out.add(new RoutineHeader(source == null ? callee : source.signature()));
            out.addAll(inlined.statements());
        }

        /** Emits the assignment and returns its target. */
        private Expr assignment(SyntaxNode node, List<Statement> out) {
            var target = lvalue(required(node, "left"), out);
            var value = expression(required(node, "right"), out);
            var operatorNode = node.child("operator");
            String operator = operatorNode == null ? "=" : operatorNode.text();
            if (!"=".equals(operator)) {
                var op = Operator.fromC(operator.substring(0, operator.length() - 1))
                    .orElseThrow(() -> unrecognized(node));
                value = new Expr.Binary(op, target, value);
            }
            emit(out, new Assignment(target, value, node.line()));
            return target;
        }

        /** Emits {@code x=x±1} and returns the expression standing for the value at the use site. */
        private Expr increment(SyntaxNode node, List<Statement> out) {
            var argument = required(node, "argument");
            var operatorNode = node.child("operator");
            if (operatorNode == null) {
                for (var child : node.children()) {
                    if (!child.isNamed()) {
                        operatorNode = child;
                    }
                }
            }
            if (operatorNode == null) {
                throw unrecognized(node);
            }
            boolean increment = "++".equals(operatorNode.text());
            boolean prefix = node.children().indexOf(operatorNode) < node.children().indexOf(argument);
            var target = lvalue(argument, out);
            var step = new Expr.IntLit(1);
            emit(out, new Assignment(target, new Expr.Binary(increment ? Operator.ADD : Operator.SUB, target, step), node.line()));
            if (prefix) {
                return target;
            }
            return new Expr.Binary(increment ? Operator.SUB : Operator.ADD, target, step);
        }

        private Expr lvalue(SyntaxNode node, List<Statement> out) {
            var expr = expression(node, out);
            if (expr instanceof Expr.Name || expr instanceof Expr.Subscript || expr instanceof Expr.Field) {
                return expr;
            }
            throw unrecognized(node);
        }

        Expr expression(SyntaxNode node, List<Statement> out) {
            return switch (node.type()) {
                case "identifier", "field_identifier" -> new Expr.Name(node.text().strip());
                case "null" -> new Expr.Name("NULL");
                case "true" -> new Expr.BoolLit(true);
                case "false" -> new Expr.BoolLit(false);
                case "number_literal", "string_literal", "char_literal" -> literal(node);
                case "concatenated_string" -> {
                    var builder = new StringBuilder();
                    for (var part : operands(node)) {
                        if (!part.is("string_literal")) {
                            throw unrecognized(part);
                        }
                        builder.append(((Expr.StrLit) literal(part)).value());
                    }
                    yield new Expr.StrLit(builder.toString());
                }
                case "parenthesized_expression" -> expression(single(node), out);
                case "call_expression" -> {
                    var function = expression(required(node, "function"), out);
                    var arguments = new ArrayList<Expr>();
                    var argumentList = node.child("arguments");
                    if (argumentList != null) {
                        for (var argument : operands(argumentList)) {
                            arguments.add(expression(argument, out));
                        }
                    }
                    yield new Expr.Call(function, arguments);
                }
                case "binary_expression" -> {
                    var left = expression(required(node, "left"), out);
                    var operatorNode = required(node, "operator");
                    var op = Operator.fromC(operatorNode.text().strip()).orElseThrow(() -> unrecognized(node));
                    yield new Expr.Binary(op, left, expression(required(node, "right"), out));
                }
                case "unary_expression" -> {
                    String operator = required(node, "operator").text().strip();
                    var operand = expression(required(node, "argument"), out);
                    yield switch (operator) {
                        case "!" -> new Expr.Unary("not", operand);
                        case "-" -> operand instanceof Expr.IntLit literal
                            ? new Expr.IntLit(-literal.value())
                            : operand instanceof Expr.FloatLit floating
                                ? new Expr.FloatLit(-floating.value())
                                : new Expr.Unary("-", operand);
                        case "+", "~" -> new Expr.Unary(operator, operand);
                        default -> throw unrecognized(node);
                    };
                }
                case "update_expression" -> increment(node, out);
                case "assignment_expression" -> assignment(node, out);
                case "conditional_expression" -> {
                    var condition = expression(required(node, "condition"), out);
                    var then = expression(required(node, "consequence"), out);
                    yield new Expr.Conditional(condition, then, expression(required(node, "alternative"), out));
                }
                case "comma_expression" -> {
                    expressionStatement(required(node, "left"), out);
                    yield expression(required(node, "right"), out);
                }
                case "pointer_expression" -> {
                    String operator = required(node, "operator").text().strip();
                    if (!"*".equals(operator) && !"&".equals(operator)) {
                        throw unrecognized(node);
                    }
                    yield Expr.call("c_pointer", new Expr.StrLit(operator), expression(required(node, "argument"), out));
                }
                case "cast_expression" -> Expr.call(
                    "c_cast",
                    new Expr.StrLit(required(node, "type").text().strip()),
                    expression(required(node, "value"), out)
                );
                case "sizeof_expression" -> {
                    var value = node.child("value");
                    yield value != null
                        ? Expr.call("sizeof", expression(value, out))
                        : Expr.call("sizeof", new Expr.StrLit(required(node, "type").text().strip()));
                }
                case "subscript_expression" -> new Expr.Subscript(
                    expression(required(node, "argument"), out),
                    expression(required(node, "index"), out)
                );
                case "field_expression" -> {
                    var operatorNode = node.child("operator");
                    boolean arrow = operatorNode != null && "->".equals(operatorNode.text().strip());
                    yield new Expr.Field(
                        expression(required(node, "argument"), out),
                        required(node, "field").text().strip(),
                        arrow
                    );
                }
                case "initializer_list" -> {
                    var elements = new ArrayList<Expr>();
                    for (var element : operands(node)) {
                        elements.add(expression(element, out));
                    }
                    yield new Expr.ListLit(elements);
                }
                default -> throw unrecognized(node);
            };
        }

        private Expr literal(SyntaxNode node) {
            try {
                return switch (node.type()) {
                    case "number_literal" -> {
                        Number number = CLiterals.parseNumber(node.text());
                        yield number instanceof Double d ? new Expr.FloatLit(d) : new Expr.IntLit(number.longValue());
                    }
                    case "string_literal" -> new Expr.StrLit(CLiterals.decodeString(node.text()));
                    default -> new Expr.IntLit(CLiterals.decodeChar(node.text()));
                };
            } catch (IllegalArgumentException ex) {
                throw unrecognized(node);
            }
        }

        private void declaration(SyntaxNode node, List<Statement> out) {
            var type = node.child("type");
            if (type != null && type.is("enum_specifier") && type.child("body") != null) {
                enumerators(type, out);
            }
            for (var declarator : node.childrenByField("declarator")) {
                SyntaxNode valueNode = null;
                SyntaxNode sizeNode = null;
                boolean array = false;
                var current = declarator;
                if (current.is("init_declarator")) {
                    valueNode = current.child("value");
                    current = required(current, "declarator");
                }
                while (current != null && !current.is("identifier")) {
                    switch (current.type()) {
                        case "array_declarator" -> {
                            if (array) {
                                throw unrecognized(declarator);
                            }
                            array = true;
                            sizeNode = current.child("size");
                            current = current.child("declarator");
                        }
                        case "pointer_declarator", "parenthesized_declarator" -> current = current.child("declarator") != null
                            ? current.child("declarator")
                            : single(current);
                        case "function_declarator" -> current = null;
                        default -> throw unrecognized(current);
                    }
                }
                if (current == null) {
                    continue;
                }
                var value = valueNode == null ? null : expression(valueNode, out);
                Expr size = null;
                if (array) {
                    if (sizeNode != null) {
                        size = expression(sizeNode, out);
                    } else if (value instanceof Expr.ListLit list) {
                        size = new Expr.IntLit(list.elements().size());
                    } else if (value instanceof Expr.StrLit text) {
                        size = new Expr.IntLit(CLiterals.bytes(text.value()).length + 1L);
                    } else {
                        throw unrecognized(declarator);
                    }
                }
                emit(out, new Declaration(current.text().strip(), size, value, node.line()));
            }
        }

        private void enumerators(SyntaxNode enumSpecifier, List<Statement> out) {
            var body = enumSpecifier.child("body");
            if (body == null) {
                return;
            }
            String previous = null;
            for (var enumerator : operands(body)) {
                if (!enumerator.is("enumerator")) {
                    throw unrecognized(enumerator);
                }
                String name = required(enumerator, "name").text().strip();
                var valueNode = enumerator.child("value");
                Expr value;
                if (valueNode != null) {
                    value = expression(valueNode, out);
                } else if (previous == null) {
                    value = new Expr.IntLit(0);
                } else {
                    value = new Expr.Binary(Operator.ADD, new Expr.Name(previous), new Expr.IntLit(1));
                }
                emit(out, new Assignment(new Expr.Name(name), value, enumerator.line()));
                previous = name;
            }
        }

        private void emit(List<Statement> out, Statement statement) {
            String text = statement.render();
            var line = LineOverrides.apply(text, rules);
            switch (line.outcome()) {
                case UNCHANGED -> out.add(statement);
                case DELETED -> {
                    LOG.debug("Override deleted '{}'", text);
                    String deleted = statement instanceof Comment comment ? comment.text() : text;
                    out.add(new InertLine(deleted, statement.line()));
                }
                case REPLACED -> {
                    LOG.debug("Override rewrote '{}' as '{}'", text, line.text());
                    out.addAll(LineParser.parseStatements(line.text(), statement.line()));
                }
            }
        }

        private SyntaxNode required(SyntaxNode node, String field) {
            var child = node.child(field);
            if (child == null) {
                throw unrecognized(node);
            }
            return child;
        }

        private SyntaxNode single(SyntaxNode node) {
            var operands = operands(node);
            if (operands.size() != 1) {
                throw unrecognized(node);
            }
            return operands.get(0);
        }

        private UnrecognizedConstructException unrecognized(SyntaxNode node) {
            String text = node.text().replace('\n', ' ');
            if (text.length() > 120) {
                text = text.substring(0, 117) + "...";
            }
            return new UnrecognizedConstructException(node.type(), text, node.line(), Statement.listing(output));
        }
    }

    private static List<SyntaxNode> operands(SyntaxNode node) {
        var operands = new ArrayList<SyntaxNode>();
        for (var child : node.namedChildren()) {
            if (!child.is("comment")) {
                operands.add(child);
            }
        }
        return operands;
    }
}
