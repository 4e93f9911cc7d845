package io.calcport.calc.dsl;

/**
 * Binary operators of the calculation language, grouped by how they lower.
 */
public enum BinaryOperator {
    ADD("+", Category.ARITHMETIC),
    SUBTRACT("-", Category.ARITHMETIC),
    MULTIPLY("*", Category.ARITHMETIC),
    DIVIDE("/", Category.ARITHMETIC),
    MODULO("%", Category.ARITHMETIC),
    EQUAL("=", Category.COMPARISON),
    NOT_EQUAL("!=", Category.COMPARISON),
    LESS_THAN("<", Category.COMPARISON),
    LESS_OR_EQUAL("<=", Category.COMPARISON),
    GREATER_THAN(">", Category.COMPARISON),
    GREATER_OR_EQUAL(">=", Category.COMPARISON),
    AND("AND", Category.LOGICAL),
    OR("OR", Category.LOGICAL);

    public enum Category {
        ARITHMETIC,
        COMPARISON,
        LOGICAL
    }

    private final String symbol;
    private final Category category;

    BinaryOperator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String symbol() {
        return symbol;
    }

    public Category category() {
        return category;
    }

    /**
     * Maps a source operator token ({@code ==}, {@code <>}, ...) to its operator.
     */
    public static BinaryOperator fromToken(String token) {
        return switch (token.toUpperCase()) {
            case "+" -> ADD;
            case "-" -> SUBTRACT;
            case "*" -> MULTIPLY;
            case "/" -> DIVIDE;
            case "%" -> MODULO;
            case "=", "==" -> EQUAL;
            case "!=", "<>" -> NOT_EQUAL;
            case "<" -> LESS_THAN;
            case "<=" -> LESS_OR_EQUAL;
            case ">" -> GREATER_THAN;
            case ">=" -> GREATER_OR_EQUAL;
            case "AND" -> AND;
            case "OR" -> OR;
            default -> throw new IllegalArgumentException("Unknown binary operator: " + token);
        };
    }
}
