package parsing;

/**
 * Raised when a source file cannot be read, does not parse, or lacks the requested method.
 */
public class SourceReadException extends RuntimeException {

    public SourceReadException(String message) {
        super(message);
    }

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
