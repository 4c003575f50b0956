package dev.larder.schema;

/**
 * Raised when a page carries no usable structured recipe data.
 */
public class ParseFailureException extends RuntimeException {

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
