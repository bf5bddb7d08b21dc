package work.cinit.trace.syntax;

import java.util.Objects;

/**
 * Parsed definition of one initialization routine together with the source unit it lives in.
 */
public record RoutineSource(String name, String unit, SyntaxNode definition) {
    public RoutineSource {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(definition, "definition");
    }

    /** The function body, or the definition itself when it is not a function_definition node. */
    public SyntaxNode body() {
        if (definition.is("function_definition")) {
            var body = definition.child("body");
            return body == null ? definition : body;
        }
        return definition;
    }

    /** Declarator text of the definition, flattened onto one line. */
    public String signature() {
        var declarator = definition.child("declarator");
        if (declarator == null) {
            return name;
        }
        return declarator.text().replace('\n', ' ');
    }
}
