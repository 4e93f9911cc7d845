package io.calcport.engine.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checks a mapping's identifier against the table it lives in.
 */
public final class IdentifierValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private IdentifierValidator() {
    }

    public static boolean isWellFormed(String identifier) {
        return identifier != null && IDENTIFIER.matcher(identifier).matches();
    }

    /**
     * Why {@code identifier} can not stand on its own, ignoring uniqueness.
     */
    public static Optional<String> syntaxProblem(String identifier, ReservedWords reservedWords) {
        if (identifier == null || identifier.isEmpty()) {
            return Optional.of("identifier is empty");
        }
        if (!isWellFormed(identifier)) {
            return Optional.of("must match [A-Za-z_][A-Za-z0-9_]*");
        }
        if (reservedWords.isKeyword(identifier)) {
            return Optional.of("'" + identifier + "' is a reserved word of " + reservedWords.dialect().name());
        }
        if (reservedWords.isRuntimeName(identifier)) {
            return Optional.of("'" + identifier + "' is reserved for runtime containers");
        }
        return Optional.empty();
    }

    /**
     * Every reason the mapping for {@code sourceKey} is invalid in {@code table}.
     */
    public static List<String> problems(IdentifierTable table, IdentifierMapping mapping) {
        List<String> problems = new ArrayList<>();
        syntaxProblem(mapping.targetIdentifier(), table.reservedWords()).ifPresent(problems::add);
        if (!mapping.isUnresolved()) {
            table.owners(mapping.targetIdentifier()).stream()
                    .filter(owner -> !owner.equals(mapping.sourceKey()))
                    .forEach(owner -> problems.add("'" + mapping.targetIdentifier()
                            + "' is also used by field '" + owner + "'"));
        }
        return problems;
    }
}
