package io.surfworks.graphmatch.pattern;

/**
 * Exception thrown when a pattern is declared or used incorrectly.
 *
 * <p>Covers duplicate or empty names, constraints registered for unknown
 * entities, empty patterns and unresolvable match roots. These are mistakes
 * in the calling code and are not retried.
 */
public class PatternGraphException extends RuntimeException {

    public PatternGraphException(String message) {
        super(message);
    }

    public PatternGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
