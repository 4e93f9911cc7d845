package io.calcport.engine.mapping;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when an imported mapping list is rejected. Lists every offending record.
 */
public class MappingImportException extends MappingException {

    /**
     * @param index     Position of the record in the imported list
     * @param sourceKey The record's source key, possibly null
     * @param reason    Why it was rejected
     */
    public record Problem(int index, String sourceKey, String reason) {
        @Override
        public String toString() {
            return "#" + index + " [" + sourceKey + "]: " + reason;
        }
    }

    private final List<Problem> problems;

    public MappingImportException(List<Problem> problems) {
        super("Rejected mapping import: " + problems.stream()
                .map(Problem::toString)
                .collect(Collectors.joining("; ")));
        this.problems = List.copyOf(problems);
    }

    public List<Problem> problems() {
        return problems;
    }
}
