package work.cinit.trace.pipeline;

import java.util.List;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.shared.Listings;

/**
 * Failure of one routine, with the normalized listing that was being processed.
 */
public final class RoutineExtractionException extends ExtractionException {
    public static final String ROUTINE_FAILED = "routine-failed";

    private final String routine;
    private final String unit;
    private final List<String> listing;

    public RoutineExtractionException(String routine, String unit, List<String> listing, RuntimeException cause) {
        super(
            cause instanceof ExtractionException extraction ? extraction.code() : ROUTINE_FAILED,
            "Failed to extract " + routine + (unit == null ? "" : " (" + unit + ")") + ": " + cause.getMessage(),
            cause
        );
        this.routine = routine;
        this.unit = unit;
        this.listing = List.copyOf(listing);
    }

    public String routine() {
        return routine;
    }

    public String unit() {
        return unit;
    }

    public List<String> listing() {
        return listing;
    }

    public String numberedListing() {
        return Listings.numbered(listing);
    }
}
