package io.calcport.engine.diagnostic;

/**
 * Location of a construct inside calculation source text.
 *
 * @param line   1-based line number
 * @param column 0-based character position within the line
 * @param offset 0-based character offset from the start of the source
 */
public record SourcePosition(int line, int column, int offset) {

    public static final SourcePosition UNKNOWN = new SourcePosition(-1, -1, -1);

    public static SourcePosition of(int line, int column, int offset) {
        return new SourcePosition(line, column, offset);
    }

    public boolean isKnown() {
        return line >= 0 && column >= 0;
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "?";
    }
}
