package io.calcport.engine.mapping;

import io.calcport.engine.diagnostic.Diagnostic;

/**
 * Thrown when a rename would give two fields the same identifier.
 */
public class NamingConflictException extends MappingException {

    private final String identifier;
    private final String owner;
    private final String requester;

    public NamingConflictException(String identifier, String owner, String requester) {
        super("Identifier '" + identifier + "' is already used by field '" + owner + "'");
        this.identifier = identifier;
        this.owner = owner;
        this.requester = requester;
    }

    public String identifier() {
        return identifier;
    }

    public String owner() {
        return owner;
    }

    public String requester() {
        return requester;
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.namingConflict(identifier, owner, requester);
    }
}
