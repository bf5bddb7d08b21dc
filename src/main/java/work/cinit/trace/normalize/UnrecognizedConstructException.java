package work.cinit.trace.normalize;

import java.util.List;
import work.cinit.trace.shared.ExtractionException;

/**
 * Raised when a syntax shape has no normalization rule. Carries the listing normalized so far.
 */
public final class UnrecognizedConstructException extends ExtractionException {
    public static final String CODE = "unrecognized-construct";

    private final String nodeType;
    private final String nodeText;
    private final List<String> partialListing;

    public UnrecognizedConstructException(String nodeType, String nodeText, int line, List<String> partialListing) {
        super(CODE, "Unrecognized construct " + nodeType + (line > 0 ? " at line " + line : "") + ": " + nodeText);
        this.nodeType = nodeType;
        this.nodeText = nodeText;
        this.partialListing = partialListing == null ? List.of() : List.copyOf(partialListing);
    }

    public String nodeType() {
        return nodeType;
    }

    public String nodeText() {
        return nodeText;
    }

    public List<String> partialListing() {
        return partialListing;
    }
}
