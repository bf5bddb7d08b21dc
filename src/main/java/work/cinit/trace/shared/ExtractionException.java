package work.cinit.trace.shared;

/**
 * Extraction failure carrying a stable error code next to the message.
 */
public class ExtractionException extends RuntimeException {
    public static final String INVALID_OPERATION = "invalid-operation";

    private final String code;

    public ExtractionException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ExtractionException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ExtractionException invalidOperation(String message) {
        return new ExtractionException(INVALID_OPERATION, message);
    }
}
