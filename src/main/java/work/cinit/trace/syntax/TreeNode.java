package work.cinit.trace.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Immutable {@link SyntaxNode} built from a dumped tree.
 *
 * <p>When no text was recorded for an inner node it is rebuilt from the children, joined by single
 * spaces. Anonymous leaves (punctuation, operators, keywords) default their text to their type.</p>
 */
public record TreeNode(String type, String recordedText, boolean isNamed, String field, int line, List<SyntaxNode> children)
    implements SyntaxNode {

    public TreeNode {
        Objects.requireNonNull(type, "type");
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public String text() {
        if (recordedText != null) {
            return recordedText;
        }
        if (children.isEmpty()) {
            return isNamed ? "" : type;
        }
        var builder = new StringBuilder();
        for (var child : children) {
            if (builder.length() > 0) builder.append(' ');
            builder.append(child.text());
        }
        return builder.toString();
    }

    public TreeNode withField(String fieldName) {
        return new TreeNode(type, recordedText, isNamed, fieldName, line, children);
    }

    @Override
    public String toString() {
        return type + "[" + text() + "]";
    }
}
