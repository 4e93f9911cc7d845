package io.calcport.engine.transpiler;

import io.calcport.engine.plan.AggregateExpression;
import io.calcport.engine.plan.ArithmeticExpression;
import io.calcport.engine.plan.CaseExpression;
import io.calcport.engine.plan.CastExpression;
import io.calcport.engine.plan.ColumnReference;
import io.calcport.engine.plan.ComparisonExpression;
import io.calcport.engine.plan.ConcatExpression;
import io.calcport.engine.plan.Expression;
import io.calcport.engine.plan.ExpressionVisitor;
import io.calcport.engine.plan.FixedScopeExpression;
import io.calcport.engine.plan.FunctionExpression;
import io.calcport.engine.plan.Literal;
import io.calcport.engine.plan.LogicalExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders plan expressions as SQL text for one dialect.
 *
 * <p>Column names are always quoted through the dialect; the synthetic aliases
 * of level-of-detail scopes ({@code lod1}, {@code lod1_rows}) and the row alias
 * are emitted bare.
 */
public final class SQLGenerator implements ExpressionVisitor<String> {

    private final SQLDialect dialect;

    public SQLGenerator(SQLDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    public String generate(Expression expression) {
        return expression.accept(this);
    }

    public SQLDialect dialect() {
        return dialect;
    }

    @Override
    public String visitColumnReference(ColumnReference columnRef) {
        if (!columnRef.isQualified()) {
            return dialect.quoteIdentifier(columnRef.columnName());
        }
        return columnRef.tableAlias() + "." + dialect.quoteIdentifier(columnRef.columnName());
    }

    @Override
    public String visitLiteral(Literal literal) {
        return switch (literal.literalType()) {
            case STRING -> dialect.quoteStringLiteral((String) literal.value());
            case INTEGER -> String.valueOf(literal.value());
            case DOUBLE -> formatDouble(((Number) literal.value()).doubleValue());
            case BOOLEAN -> dialect.formatBoolean((Boolean) literal.value());
            case NULL -> dialect.formatNull();
            case DATE -> dialect.formatDate((String) literal.value());
            case TIMESTAMP -> dialect.formatTimestamp((String) literal.value());
        };
    }

    @Override
    public String visitArithmetic(ArithmeticExpression arithmetic) {
        String left = arithmetic.left().accept(this);
        String right = arithmetic.right().accept(this);
        return "(" + left + " " + arithmetic.sqlOperator() + " " + right + ")";
    }

    @Override
    public String visitComparison(ComparisonExpression comparison) {
        String left = comparison.left().accept(this);
        String op = comparison.operator().toSql();

        // IS NULL / IS NOT NULL are unary
        if (comparison.operator().isUnary()) {
            return "(" + left + " " + op + ")";
        }

        String right = comparison.right().accept(this);
        return "(" + left + " " + op + " " + right + ")";
    }

    @Override
    public String visitLogical(LogicalExpression logical) {
        return switch (logical.operator()) {
            case NOT -> "(NOT " + logical.operands().get(0).accept(this) + ")";
            case AND -> logical.operands().stream()
                    .map(e -> e.accept(this))
                    .collect(Collectors.joining(" AND ", "(", ")"));
            case OR -> logical.operands().stream()
                    .map(e -> e.accept(this))
                    .collect(Collectors.joining(" OR ", "(", ")"));
        };
    }

    @Override
    public String visitConcat(ConcatExpression concat) {
        return concat.parts().stream()
                .map(e -> e.accept(this))
                .collect(Collectors.joining(" || ", "(", ")"));
    }

    @Override
    public String visitFunctionCall(FunctionExpression functionCall) {
        return functionCall.arguments().stream()
                .map(e -> e.accept(this))
                .collect(Collectors.joining(", ", functionCall.functionName() + "(", ")"));
    }

    @Override
    public String visitAggregate(AggregateExpression aggregate) {
        String arg = aggregate.argument().accept(this);
        String funcName = aggregate.function().sql();

        if (aggregate.function() == AggregateExpression.AggregateFunction.COUNT_DISTINCT) {
            return funcName + " " + arg + ")"; // COUNT(DISTINCT col)
        }
        return funcName + "(" + arg + ")";
    }

    @Override
    public String visitCast(CastExpression cast) {
        return "CAST(" + cast.source().accept(this) + " AS " + dialect.typeName(cast.targetType()) + ")";
    }

    @Override
    public String visitCase(CaseExpression caseExpr) {
        var sb = new StringBuilder("CASE");
        for (CaseExpression.When when : caseExpr.whens()) {
            sb.append(" WHEN ").append(when.condition().accept(this));
            sb.append(" THEN ").append(when.result().accept(this));
        }
        sb.append(" ELSE ").append(caseExpr.elseValue().accept(this));
        sb.append(" END");
        return sb.toString();
    }

    @Override
    public String visitFixedScope(FixedScopeExpression scope) {
        String groups = scope.groupsAlias();
        String value = dialect.quoteIdentifier(FixedScopeExpression.VALUE_COLUMN);

        List<String> selected = new ArrayList<>();
        List<String> groupBy = new ArrayList<>();
        List<String> correlation = new ArrayList<>();
        for (int i = 0; i < scope.keys().size(); i++) {
            FixedScopeExpression.Key key = scope.keys().get(i);
            String keyColumn = dialect.quoteIdentifier(FixedScopeExpression.KEY_COLUMN_PREFIX + i);
            String inner = key.inner().accept(this);
            selected.add(inner + " AS " + keyColumn);
            groupBy.add(inner);
            correlation.add(groups + "." + keyColumn + " IS NOT DISTINCT FROM " + key.outer().accept(this));
        }
        selected.add(scope.aggregate().accept(this) + " AS " + value);

        var sb = new StringBuilder("(SELECT ");
        sb.append(groups).append('.').append(value);
        sb.append(" FROM (SELECT ").append(String.join(", ", selected));
        sb.append(" FROM ").append(scope.sourceRelation()).append(" AS ").append(scope.rowsAlias());
        if (!groupBy.isEmpty()) {
            sb.append(" GROUP BY ").append(String.join(", ", groupBy));
        }
        sb.append(") AS ").append(groups);
        if (!correlation.isEmpty()) {
            sb.append(" WHERE ").append(String.join(" AND ", correlation));
        }
        sb.append(')');
        return sb.toString();
    }

    private static String formatDouble(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value) + ".0";
        }
        return String.valueOf(value);
    }
}
