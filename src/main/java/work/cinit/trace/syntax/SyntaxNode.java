package work.cinit.trace.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of one node of a concrete C syntax tree, shaped like tree-sitter's C grammar.
 */
public interface SyntaxNode {
    String type();

    /** Source text covered by the node. */
    String text();

    boolean isNamed();

    /** Name of the field under which this node sits in its parent, or null. */
    String field();

    /** One-based start line, or 0 when unknown. */
    int line();

    List<SyntaxNode> children();

    default List<SyntaxNode> namedChildren() {
        var named = new ArrayList<SyntaxNode>();
        for (var child : children()) {
            if (child.isNamed()) {
                named.add(child);
            }
        }
        return named;
    }

    default SyntaxNode child(String fieldName) {
        for (var child : children()) {
            if (fieldName.equals(child.field())) {
                return child;
            }
        }
        return null;
    }

    default List<SyntaxNode> childrenByField(String fieldName) {
        var matches = new ArrayList<SyntaxNode>();
        for (var child : children()) {
            if (fieldName.equals(child.field())) {
                matches.add(child);
            }
        }
        return matches;
    }

    default boolean is(String nodeType) {
        return nodeType.equals(type());
    }
}
