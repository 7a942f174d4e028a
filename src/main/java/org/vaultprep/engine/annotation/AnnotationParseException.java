package org.vaultprep.engine.annotation;

/**
 * Exception thrown when an annotation document cannot be read.
 * Includes the character offset when the failure is a JSON syntax error.
 */
public class AnnotationParseException extends RuntimeException {

    private final int position;

    public AnnotationParseException(String message) {
        super(message);
        this.position = -1;
    }

    public AnnotationParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }

    public boolean hasPosition() {
        return position >= 0;
    }
}
