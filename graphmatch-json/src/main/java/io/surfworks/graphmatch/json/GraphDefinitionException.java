package io.surfworks.graphmatch.json;

/**
 * Exception thrown when a JSON graph or pattern definition is malformed.
 */
public class GraphDefinitionException extends RuntimeException {

    private final String element;

    public GraphDefinitionException(String message, String element) {
        super(element == null ? message : message + " (at " + element + ")");
        this.element = element;
    }

    public GraphDefinitionException(String message, Throwable cause) {
        super(message, cause);
        this.element = null;
    }

    /**
     * Returns the path of the offending JSON element, e.g. {@code nodes[2].inputs}, or null.
     */
    public String getElement() {
        return element;
    }
}
