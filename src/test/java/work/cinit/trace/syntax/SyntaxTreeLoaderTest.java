package work.cinit.trace.syntax;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.cinit.trace.support.Catalogs;

class SyntaxTreeLoaderTest {
    @Test
    void loadsRoutinesFromJson() {
        var routines = SyntaxTreeLoader.load(Catalogs.FIXTURES.resolve("trees.json"));

        assertEquals(List.of("init_foo", "syms_of_data", "init_display"), routines.stream().map(RoutineSource::name).toList());
        var initFoo = routines.get(0);
        assertEquals("data.c", initFoo.unit());
        assertEquals("compound_statement", initFoo.body().type());
        assertEquals("init_foo (void)", initFoo.signature());
        var comment = initFoo.body().namedChildren().get(0);
        assertEquals("comment", comment.type());
        assertEquals(3, comment.line());
    }

    @Test
    void loadsYamlListsAndInfersNamedness() throws IOException {
        var yaml = """
            - name: init_x
              unit: x.c
              definition:
                type: expression_statement
                children:
                  - type: assignment_expression
                    children:
                      - {type: identifier, text: x, field: left}
                      - {type: "=", field: operator}
                      - {type: number_literal, text: "1", field: right}
                  - type: ";"
            """;
        var routines = SyntaxTreeLoader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), false);

        var statement = routines.get(0).body();
        assertEquals("expression_statement", statement.type());
        assertEquals(1, statement.namedChildren().size());
        var assignment = statement.namedChildren().get(0);
        assertEquals("x", assignment.child("left").text());
        assertFalse(assignment.child("operator").isNamed());
        assertEquals("x = 1", assignment.text());
    }

    @Test
    void keywordsAreAnonymous() {
        assertFalse(SyntaxTreeLoader.isNamedType("if"));
        assertFalse(SyntaxTreeLoader.isNamedType("{"));
        assertTrue(SyntaxTreeLoader.isNamedType("identifier"));
        assertTrue(SyntaxTreeLoader.isNamedType("_declarator"));
    }

    @Test
    void rejectsEntriesWithoutDefinition() {
        var json = "[{\"name\": \"init_x\"}]";
        assertThrows(IOException.class, () ->
            SyntaxTreeLoader.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), true));
    }
}
