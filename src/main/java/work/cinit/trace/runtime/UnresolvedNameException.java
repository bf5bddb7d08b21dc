package work.cinit.trace.runtime;

import work.cinit.trace.shared.ExtractionException;

public final class UnresolvedNameException extends ExtractionException {
    public static final String CODE = "unresolved-name";

    private final String name;

    public UnresolvedNameException(String name) {
        super(CODE, "Unresolved name: " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
