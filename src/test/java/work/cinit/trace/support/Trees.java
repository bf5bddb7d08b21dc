package work.cinit.trace.support;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import work.cinit.trace.syntax.RoutineSource;
import work.cinit.trace.syntax.SyntaxNode;
import work.cinit.trace.syntax.TreeNode;

/**
 * Builders for tree-sitter shaped C syntax nodes, so tests can state routine bodies compactly.
 */
public final class Trees {
    private Trees() {}

    public static TreeNode node(String type, SyntaxNode... children) {
        return new TreeNode(type, null, true, null, 0, Arrays.asList(children));
    }

    public static TreeNode leaf(String type, String text) {
        return new TreeNode(type, text, true, null, 0, List.of());
    }

    /** Anonymous token such as an operator or punctuation. */
    public static TreeNode token(String text) {
        return new TreeNode(text, null, false, null, 0, List.of());
    }

    public static TreeNode field(String name, TreeNode node) {
        return node.withField(name);
    }

    public static TreeNode id(String name) {
        return leaf("identifier", name);
    }

    public static TreeNode num(long value) {
        return leaf("number_literal", Long.toString(value));
    }

    public static TreeNode num(String raw) {
        return leaf("number_literal", raw);
    }

    /** String literal; {@code text} is the unquoted content, escapes written as in C source. */
    public static TreeNode str(String text) {
        return leaf("string_literal", "\"" + text + "\"");
    }

    public static TreeNode chr(String text) {
        return leaf("char_literal", "'" + text + "'");
    }

    public static TreeNode call(String function, TreeNode... arguments) {
        return call(id(function), arguments);
    }

    public static TreeNode call(TreeNode function, TreeNode... arguments) {
        var list = new ArrayList<SyntaxNode>();
        list.add(token("("));
        list.addAll(Arrays.asList(arguments));
        list.add(token(")"));
        return node(
            "call_expression",
            field("function", function),
            field("arguments", new TreeNode("argument_list", null, true, null, 0, list))
        );
    }

    public static TreeNode assign(TreeNode left, TreeNode right) {
        return assign(left, "=", right);
    }

    public static TreeNode assign(TreeNode left, String operator, TreeNode right) {
        return node("assignment_expression", field("left", left), field("operator", token(operator)), field("right", right));
    }

    public static TreeNode binary(TreeNode left, String operator, TreeNode right) {
        return node("binary_expression", field("left", left), field("operator", token(operator)), field("right", right));
    }

    public static TreeNode unary(String operator, TreeNode argument) {
        return node("unary_expression", field("operator", token(operator)), field("argument", argument));
    }

    public static TreeNode postfix(TreeNode argument, String operator) {
        return node("update_expression", field("argument", argument), field("operator", token(operator)));
    }

    public static TreeNode prefix(String operator, TreeNode argument) {
        return node("update_expression", field("operator", token(operator)), field("argument", argument));
    }

    public static TreeNode subscript(TreeNode argument, TreeNode index) {
        return node("subscript_expression", field("argument", argument), token("["), field("index", index), token("]"));
    }

    public static TreeNode ternary(TreeNode condition, TreeNode consequence, TreeNode alternative) {
        return node(
            "conditional_expression",
            field("condition", condition),
            token("?"),
            field("consequence", consequence),
            token(":"),
            field("alternative", alternative)
        );
    }

    public static TreeNode parens(TreeNode inner) {
        return node("parenthesized_expression", token("("), inner, token(")"));
    }

    public static TreeNode stmt(TreeNode expression) {
        return node("expression_statement", expression, token(";"));
    }

    public static TreeNode block(TreeNode... statements) {
        var children = new ArrayList<SyntaxNode>();
        children.add(token("{"));
        children.addAll(Arrays.asList(statements));
        children.add(token("}"));
        return new TreeNode("compound_statement", null, true, null, 0, children);
    }

    public static TreeNode comment(String text) {
        return leaf("comment", text);
    }

    public static TreeNode ifStatement(TreeNode condition, TreeNode consequence) {
        return node("if_statement", token("if"), field("condition", parens(condition)), field("consequence", consequence));
    }

    public static TreeNode ifStatement(TreeNode condition, TreeNode consequence, TreeNode alternative) {
        return node(
            "if_statement",
            token("if"),
            field("condition", parens(condition)),
            field("consequence", consequence),
            field("alternative", node("else_clause", token("else"), alternative))
        );
    }

    public static TreeNode whileStatement(TreeNode condition, TreeNode body) {
        return node("while_statement", token("while"), field("condition", parens(condition)), field("body", body));
    }

    public static TreeNode forStatement(TreeNode initializer, TreeNode condition, TreeNode update, TreeNode body) {
        var children = new ArrayList<SyntaxNode>();
        children.add(token("for"));
        children.add(token("("));
        if (initializer != null) children.add(field("initializer", initializer));
        children.add(token(";"));
        if (condition != null) children.add(field("condition", condition));
        children.add(token(";"));
        if (update != null) children.add(field("update", update));
        children.add(token(")"));
        children.add(field("body", body));
        return new TreeNode("for_statement", null, true, null, 0, children);
    }

    /** {@code type name = value;}, or {@code type name;} when {@code value} is null. */
    public static TreeNode declaration(String type, String name, TreeNode value) {
        TreeNode declarator = value == null
            ? field("declarator", id(name))
            : field("declarator", node("init_declarator", field("declarator", id(name)), token("="), field("value", value)));
        return node("declaration", field("type", leaf("primitive_type", type)), declarator, token(";"));
    }

    /** {@code type name[size] = value;}; {@code size} or {@code value} may be null. */
    public static TreeNode arrayDeclaration(String type, String name, TreeNode size, TreeNode value) {
        var array = size == null
            ? node("array_declarator", field("declarator", id(name)), token("["), token("]"))
            : node("array_declarator", field("declarator", id(name)), token("["), field("size", size), token("]"));
        TreeNode declarator = value == null
            ? field("declarator", array)
            : field("declarator", node("init_declarator", field("declarator", array), token("="), field("value", value)));
        return node("declaration", field("type", leaf("primitive_type", type)), declarator, token(";"));
    }

    public static TreeNode list(TreeNode... elements) {
        var children = new ArrayList<SyntaxNode>();
        children.add(token("{"));
        children.addAll(Arrays.asList(elements));
        children.add(token("}"));
        return new TreeNode("initializer_list", null, true, null, 0, children);
    }

    public static TreeNode function(String name, TreeNode... statements) {
        return node(
            "function_definition",
            field("type", leaf("primitive_type", "void")),
            field("declarator", node(
                "function_declarator",
                field("declarator", id(name)),
                field("parameters", leaf("parameter_list", "(void)"))
            )),
            field("body", block(statements))
        );
    }

    public static RoutineSource routine(String name, String unit, TreeNode... statements) {
        return new RoutineSource(name, unit, function(name, statements));
    }
}
