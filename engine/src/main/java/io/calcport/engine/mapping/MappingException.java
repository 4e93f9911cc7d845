package io.calcport.engine.mapping;

/**
 * Base class for rejected identifier-table edits.
 */
public class MappingException extends RuntimeException {

    public MappingException(String message) {
        super(message);
    }
}
