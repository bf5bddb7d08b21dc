package work.cinit.trace.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.cinit.trace.support.Trees.arrayDeclaration;
import static work.cinit.trace.support.Trees.assign;
import static work.cinit.trace.support.Trees.binary;
import static work.cinit.trace.support.Trees.call;
import static work.cinit.trace.support.Trees.comment;
import static work.cinit.trace.support.Trees.declaration;
import static work.cinit.trace.support.Trees.field;
import static work.cinit.trace.support.Trees.forStatement;
import static work.cinit.trace.support.Trees.id;
import static work.cinit.trace.support.Trees.ifStatement;
import static work.cinit.trace.support.Trees.leaf;
import static work.cinit.trace.support.Trees.list;
import static work.cinit.trace.support.Trees.node;
import static work.cinit.trace.support.Trees.num;
import static work.cinit.trace.support.Trees.postfix;
import static work.cinit.trace.support.Trees.routine;
import static work.cinit.trace.support.Trees.stmt;
import static work.cinit.trace.support.Trees.str;
import static work.cinit.trace.support.Trees.subscript;
import static work.cinit.trace.support.Trees.token;
import static work.cinit.trace.support.Trees.whileStatement;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.cinit.trace.catalog.FactCatalog;
import work.cinit.trace.normalize.OverrideRule;
import work.cinit.trace.normalize.StatementNormalizer;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.support.Catalogs;
import work.cinit.trace.syntax.TreeNode;
import work.cinit.trace.value.SymbolicValue.DeclaredVariableAssignment;
import work.cinit.trace.value.SymbolicValue.NativeLiteral;
import work.cinit.trace.value.TraceEntry;

class SymbolicEvaluatorTest {
    private static Evaluation evaluate(FactCatalog catalog, Map<String, Injection> injections, TreeNode... body) {
        var normalizer = new StatementNormalizer(List.of(routine("init", "data.c", body)), Map.of(), Set.of());
        return new SymbolicEvaluator(catalog).evaluate(normalizer.normalize("init"), injections);
    }

    private static List<String> trace(TreeNode... body) {
        return rendered(evaluate(Catalogs.standard(), Map.of(), body));
    }

    private static List<String> rendered(Evaluation evaluation) {
        return evaluation.statements().stream().map(TraceEntry::render).toList();
    }

    private static TreeNode dot(TreeNode target, String name) {
        return node("field_expression", field("argument", target), field("operator", token(".")), field("field", leaf("field_identifier", name)));
    }

    @Test
    void firstLiteralBecomesTheDefaultAndLaterReadsSeeIt() {
        var catalog = Catalogs.standard();
        var evaluation = evaluate(catalog, Map.of(),
            stmt(assign(id("Vfoo_limit"), call("make_fixnum", num(42)))),
            stmt(call("Ffoo", id("Vfoo_limit")))
        );

        assertEquals(List.of("(foo 42)"), rendered(evaluation));
        assertEquals(NativeLiteral.of(42L), catalog.declaredVariable("Vfoo_limit").orElseThrow().defaultValue().orElseThrow());
    }

    @Test
    void laterDifferentAssignmentIsExplicit() {
        assertEquals(List.of(
            "$foo-limit = make_fixnum(43)",
            "(foo $foo-limit)"
        ), trace(
            stmt(assign(id("Vfoo_limit"), call("make_fixnum", num(42)))),
            stmt(assign(id("Vfoo_limit"), call("make_fixnum", num(43)))),
            stmt(call("Ffoo", id("Vfoo_limit")))
        ));
    }

    @Test
    void repeatingTheDefaultEmitsNothing() {
        assertEquals(List.of(), trace(
            stmt(assign(id("Vfoo_limit"), call("make_fixnum", num(42)))),
            stmt(assign(id("Vfoo_limit"), num(42)))
        ));
    }

    @Test
    void truthSymbolsFoldToBooleans() {
        var catalog = Catalogs.standard();
        evaluate(catalog, Map.of(), stmt(assign(id("Vfoo_list"), id("Qt"))));

        assertEquals(NativeLiteral.TRUE, catalog.declaredVariable("Vfoo_list").orElseThrow().defaultValue().orElseThrow());
    }

    @Test
    void nonFoldableValueIsAssignedExplicitly() {
        assertEquals(
            List.of("$foo-list = (list 't make_string(\"foo\", 3))"),
            trace(stmt(assign(id("Vfoo_list"), call("list2", id("Qt"), call("build_pure_c_string", str("foo"))))))
        );
    }

    @Test
    void nestedCallsAppearOnlyInsideTheirParent() {
        assertEquals(
            List.of("(put 'foo 'bar (foo make_fixnum(1)))"),
            trace(stmt(call("Fput", id("Qfoo"), id("Qbar"), call("Ffoo", call("make_fixnum", num(1))))))
        );
    }

    @Test
    void boundedLoopsUnrollInOrder() {
        assertEquals(List.of(
            "(put 'foo 'bar make_fixnum(0))",
            "(put 'foo 'bar make_fixnum(1))",
            "(put 'foo 'bar make_fixnum(2))"
        ), trace(
            forStatement(
                assign(id("i"), num(0)),
                binary(id("i"), "<", id("FOO_SLOTS")),
                postfix(id("i"), "++"),
                stmt(call("Fput", id("Qfoo"), id("Qbar"), call("make_fixnum", id("i"))))
            )
        ));
    }

    @Test
    void scalarVariablesStartAtZero() {
        var catalog = Catalogs.standard();
        var evaluation = evaluate(catalog, Map.of(),
            ifStatement(id("foo_enabled"), stmt(call("Ffoo", id("Qt")))),
            stmt(assign(id("foo_count"), binary(id("foo_count"), "+", num(5))))
        );

        assertEquals(List.of(), rendered(evaluation));
        assertEquals(NativeLiteral.of(5L), catalog.declaredVariable("foo_count").orElseThrow().defaultValue().orElseThrow());
    }

    @Test
    void rawGlobalsAreAlwaysAssignedExplicitly() {
        assertEquals(List.of(
            "foo_table = (cons 'nil 'nil)",
            "foo_table = 3"
        ), trace(
            stmt(assign(id("foo_table"), call("Fcons", id("Qnil"), id("Qnil")))),
            stmt(assign(id("foo_table"), num(3)))
        ));
    }

    @Test
    void compositeLocalsAreTracedAndLiteralLocalsAreNot() {
        assertEquals(List.of(
            "local tem = (foo 't)",
            "(put 'foo 'bar tem)",
            "(foo 2)"
        ), trace(
            stmt(assign(id("tem"), call("Ffoo", id("Qt")))),
            stmt(call("Fput", id("Qfoo"), id("Qbar"), id("tem"))),
            stmt(assign(id("n"), num(2))),
            stmt(call("Ffoo", id("n")))
        ));
    }

    @Test
    void countAndArrayCallsAreUnpacked() {
        assertEquals(List.of("(plus 'foo make_fixnum(1))", "(plus)"), trace(
            arrayDeclaration("Lisp_Object", "args", num(2), null),
            stmt(assign(subscript(id("args"), num(0)), id("Qfoo"))),
            stmt(assign(subscript(id("args"), num(1)), call("make_fixnum", num(1)))),
            stmt(call("Fplus", num(2), id("args"))),
            stmt(call("Fplus", num(0), id("NULL")))
        ));
    }

    @Test
    void callnForwardsItsArguments() {
        assertEquals(
            List.of("(plus make_fixnum(1) make_fixnum(2))"),
            trace(stmt(call("CALLN", id("Fplus"), call("make_fixnum", num(1)), call("make_fixnum", num(2)))))
        );
    }

    @Test
    void fixedArityIsChecked() {
        var error = assertThrows(ExtractionException.class, () -> trace(stmt(call("Ffoo", id("Qt"), id("Qnil")))));
        assertEquals(ExtractionException.INVALID_OPERATION, error.code());
    }

    @Test
    void unresolvedNamesAreReported() {
        var error = assertThrows(UnresolvedNameException.class, () -> trace(stmt(call("Ffoo", id("Vnowhere")))));
        assertEquals("Vnowhere", error.name());
    }

    @Test
    void symbolicConditionsAreRejected() {
        assertThrows(NonConcreteConditionException.class, () -> trace(
            whileStatement(call("Ffoo", id("Qt")), stmt(call("Ffoo", id("Qnil"))))
        ));
        assertThrows(NonConcreteConditionException.class, () -> trace(
            ifStatement(call("Ffoo", id("Qt")), stmt(call("Ffoo", id("Qnil"))))
        ));
    }

    @Test
    void logicalOperatorsShortCircuit() {
        assertEquals(List.of(), trace(
            ifStatement(binary(num(0), "&&", call("Ffoo", id("Qt"))), stmt(call("Ffoo", id("Qnil"))))
        ));
    }

    @Test
    void commentsDocumentTheFollowingAssignment() {
        var evaluation = evaluate(Catalogs.standard(), Map.of(),
            comment("/* The foo limit.  */"),
            stmt(assign(id("Vfoo_limit"), call("Ffoo", id("Qt"))))
        );

        var entry = evaluation.statements().get(0);
        assertInstanceOf(DeclaredVariableAssignment.class, entry.value());
        assertEquals("The foo limit.", entry.documentation());
    }

    @Test
    void deletedLinesDocumentNothing() {
        var normalizer = new StatementNormalizer(
            List.of(routine("init", "data.c",
                stmt(call("defsubr", node("pointer_expression", field("operator", token("&")), field("argument", id("Sfoo"))))),
                stmt(call("Ffoo", id("Qt"))),
                comment("/* Registers foo.  */"),
                stmt(call("defsubr", node("pointer_expression", field("operator", token("&")), field("argument", id("Sbar"))))),
                stmt(call("Ffoo", id("Qnil")))
            )),
            Map.of("init", List.of(OverrideRule.delete("^defsubr\\("))),
            Set.of()
        );

        var entries = new SymbolicEvaluator(Catalogs.standard()).evaluate(normalizer.normalize("init")).statements();
        assertEquals(List.of("(foo 't)", "(foo 'nil)"), entries.stream().map(TraceEntry::render).toList());
        assertNull(entries.get(0).documentation());
        assertNull(entries.get(1).documentation());
    }

    @Test
    void injectionsResolvePerRoutine() {
        var evaluation = evaluate(Catalogs.standard(), Map.of(
                "path_separator", Injection.verbatim("File.pathSeparator"),
                "staticpro", Injection.noop(),
                "getenv", Injection.returns(NativeLiteral.of("/home"))
            ),
            stmt(call("staticpro", node("pointer_expression", field("operator", token("&")), field("argument", id("Vfoo_limit"))))),
            stmt(call("Ffoo", id("path_separator"))),
            stmt(call("Ffoo", call("getenv", str("HOME"))))
        );

        assertEquals(List.of("(foo <File.pathSeparator>)", "(foo \"/home\")"), rendered(evaluation));
    }

    @Test
    void assignVariableInjectionFoldsLikeAnAssignment() {
        var catalog = Catalogs.standard();
        var evaluation = evaluate(catalog, Map.of("SET_SYMBOL_VAL", Injection.assignVariable()),
            stmt(call("SET_SYMBOL_VAL", call("intern_c_string", str("foo-count")), num(9)))
        );

        assertEquals(List.of(), rendered(evaluation));
        assertEquals(NativeLiteral.of(9L), catalog.declaredVariable("foo_count").orElseThrow().defaultValue().orElseThrow());
    }

    @Test
    void constantsResolveToLiteralsUnlessReferencedByName() {
        assertEquals(List.of(
            "(foo 2305843009213693951)",
            "(foo MOST_POSITIVE_FIXNUM)"
        ), trace(
            stmt(call("Ffoo", id("MOST_POSITIVE_FIXNUM"))),
            stmt(call("Ffoo", call("PE_CONSTANT", str("MOST_POSITIVE_FIXNUM"))))
        ));
    }

    @Test
    void pruneSideEffectDropsTheCall() {
        assertEquals(List.of(), trace(stmt(call("PRUNE_SIDE_EFFECT", call("Ffoo", id("Qt"))))));
    }

    @Test
    void postfixUpdateYieldsThePreviousValue() {
        assertEquals(List.of("(foo 1)", "(foo 2)"), trace(
            stmt(assign(id("n"), num(1))),
            stmt(assign(id("x"), postfix(id("n"), "++"))),
            stmt(call("Ffoo", id("x"))),
            stmt(call("Ffoo", id("n")))
        ));
    }

    @Test
    void localStructFieldsHoldValues() {
        assertEquals(List.of("(foo 7)"), trace(
            declaration("struct_conf", "conf", null),
            stmt(assign(dot(id("conf"), "size"), num(7))),
            stmt(call("Ffoo", dot(id("conf"), "size")))
        ));
    }

    @Test
    void arrayHelpersSeeLocalArrays() {
        assertEquals(List.of("(foo 3)", "(foo 98)"), trace(
            arrayDeclaration("int", "sizes", null, list(num(1), num(2), num(3))),
            stmt(call("Ffoo", call("ARRAYELTS", id("sizes")))),
            arrayDeclaration("char", "name", null, str("abc")),
            stmt(call("Ffoo", subscript(id("name"), num(1))))
        ));
    }

    @Test
    void textIsIndexedByUtf8Bytes() {
        assertEquals(List.of("(foo 195)", "(foo 195)", "(foo make_string(\"\u00e9\", 2))"), trace(
            arrayDeclaration("char", "name", null, str("\u00e9")),
            stmt(call("Ffoo", subscript(id("name"), num(0)))),
            stmt(call("Ffoo", subscript(str("\u00e9"), num(0)))),
            stmt(call("Ffoo", call("build_unibyte_string", str("\u00e9"))))
        ));
    }

    @Test
    void finalStateExposesBindings() {
        var evaluation = evaluate(Catalogs.standard(), Map.of(), stmt(assign(id("n"), num(4))));

        assertEquals(NativeLiteral.of(4L), evaluation.finalState().get("n"));
        assertTrue(evaluation.statements().isEmpty());
    }
}
