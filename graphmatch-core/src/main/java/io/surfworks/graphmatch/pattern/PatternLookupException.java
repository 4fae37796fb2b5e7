package io.surfworks.graphmatch.pattern;

/**
 * Exception thrown when a name is looked up that was never declared or never bound.
 */
public class PatternLookupException extends RuntimeException {

    private final String name;

    public PatternLookupException(String message, String name) {
        super(message);
        this.name = name;
    }

    /**
     * Returns the name that could not be resolved.
     */
    public String getName() {
        return name;
    }
}
