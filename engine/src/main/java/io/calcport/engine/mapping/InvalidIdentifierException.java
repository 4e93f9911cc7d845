package io.calcport.engine.mapping;

/**
 * Thrown when a requested identifier is malformed or reserved.
 */
public class InvalidIdentifierException extends MappingException {

    private final String identifier;

    public InvalidIdentifierException(String identifier, String reason) {
        super("Invalid identifier '" + identifier + "': " + reason);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
