package work.cinit.trace.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.cinit.trace.shared.ExtractionException;

class LineParserTest {
    @Test
    void parsesRenderedAssignmentsBack() {
        var statements = LineParser.parseStatements("Vfoo=make_fixnum(42)", 7);

        assertEquals(1, statements.size());
        var assignment = assertInstanceOf(Statement.Assignment.class, statements.get(0));
        assertEquals(new Expr.Name("Vfoo"), assignment.target());
        assertEquals(Expr.call("make_fixnum", new Expr.IntLit(42)), assignment.value());
        assertEquals(7, assignment.line());
    }

    @Test
    void rendersWhatItParses() {
        for (var line : List.of(
            "x=(a if c else b)",
            "arr[i]=f(i,\"text\")",
            "i=i+1",
            "y=(a+b)*c",
            "z=a-(b-c)",
            "ok=not a and b or c",
            "p->next=q.value",
            "v=[1,2,-3]"
        )) {
            assertEquals(line, LineParser.parseStatements(line, 0).get(0).render());
        }
    }

    @Test
    void splitsOnSemicolonsAndNewlinesOutsideStrings() {
        var statements = LineParser.parseStatements("a=1; b=f(\"x;y\")\n# replaced\nc=2", 0);

        assertEquals(4, statements.size());
        assertEquals("b=f(\"x;y\")", statements.get(1).render());
        assertInstanceOf(Statement.InertLine.class, statements.get(2));
    }

    @Test
    void acceptsCSpellingsOfOperatorsAndLiterals() {
        assertEquals("not x and y", LineParser.parseExpression("!x && y").render());
        assertEquals("65", LineParser.parseExpression("'A'").render());
        assertEquals("\"ab\"", LineParser.parseExpression("\"a\" \"b\"").render());
        assertEquals("True", LineParser.parseExpression("true").render());
        assertEquals("None", LineParser.parseExpression("None").render());
        assertEquals("255", LineParser.parseExpression("0xff").render());
    }

    @Test
    void extractsConditionsFromHeaders() {
        assertEquals("i<3", LineParser.parseCondition("while (i<3):").render());
        assertEquals("x==0", LineParser.parseCondition("if (x==0):").render());
    }

    @Test
    void rejectsTrailingGarbage() {
        var error = assertThrows(ExtractionException.class, () -> LineParser.parseExpression("f(x))"));
        assertEquals(LineParser.INVALID_LINE, error.code());
    }

    @Test
    void rejectsAssignmentToACall() {
        assertThrows(ExtractionException.class, () -> LineParser.parseStatements("f(x)=1", 0));
    }
}
