package work.cinit.trace.catalog;

import work.cinit.trace.shared.ExtractionException;

/**
 * Raised when a structural assumption about the fact catalog does not hold.
 */
public final class CatalogInconsistencyException extends ExtractionException {
    public static final String CODE = "catalog-inconsistency";

    public CatalogInconsistencyException(String message) {
        super(CODE, message);
    }
}
