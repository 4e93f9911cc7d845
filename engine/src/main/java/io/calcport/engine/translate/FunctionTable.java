package io.calcport.engine.translate;

import io.calcport.calc.dsl.CalcExpression;
import io.calcport.calc.dsl.FunctionCall;
import io.calcport.calc.dsl.LiteralExpr;
import io.calcport.engine.diagnostic.Diagnostic;
import io.calcport.engine.model.DataType;
import io.calcport.engine.plan.AggregateExpression;
import io.calcport.engine.plan.AggregateExpression.AggregateFunction;
import io.calcport.engine.plan.ArithmeticExpression;
import io.calcport.engine.plan.CaseExpression;
import io.calcport.engine.plan.CastExpression;
import io.calcport.engine.plan.ComparisonExpression;
import io.calcport.engine.plan.Expression;
import io.calcport.engine.plan.FunctionExpression;
import io.calcport.engine.plan.Literal;
import io.calcport.engine.plan.LogicalExpression;
import io.calcport.engine.plan.SqlType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Static registry of the calculation functions that lower to DuckDB SQL.
 *
 * <p>Each entry carries its accepted arity and a lowering from already-lowered
 * arguments to a plan expression. Names are upper case; lookup is
 * case-insensitive. Anything not registered is unsupported.
 */
public final class FunctionTable {

    public enum Category {
        AGGREGATE,
        MATH,
        STRING,
        CONVERSION,
        DATE,
        LOGICAL
    }

    @FunctionalInterface
    public interface Lowering {
        Expression lower(FunctionContext ctx);
    }

    public record FunctionSpec(String name, Category category, int minArity, int maxArity, Lowering lowering) {
        public boolean accepts(int arity) {
            return arity >= minArity && arity <= maxArity;
        }

        public String arityDescription() {
            if (minArity == maxArity) {
                return minArity + (minArity == 1 ? " argument" : " arguments");
            }
            return minArity + " to " + maxArity + " arguments";
        }
    }

    /**
     * What a lowering sees: the call, its lowered arguments, the division rule
     * and where to report problems.
     */
    public record FunctionContext(
            FunctionCall call,
            List<Expression> arguments,
            BiFunction<Expression, Expression, Expression> divider,
            Consumer<Diagnostic> diagnostics) {

        public Expression arg(int index) {
            return arguments.get(index);
        }

        public int arity() {
            return arguments.size();
        }

        public Expression divide(Expression left, Expression right) {
            return divider.apply(left, right);
        }

        public Expression fail(String message) {
            diagnostics.accept(Diagnostic.argumentError(message, call.position(), call.name()));
            return Literal.nullValue();
        }
    }

    // Table calculations depend on the consumer's partitioning and are not lowered
    private static final Set<String> TABLE_CALCULATIONS = Set.of(
            "RUNNING_SUM", "RUNNING_AVG", "RUNNING_COUNT", "RUNNING_MIN", "RUNNING_MAX",
            "WINDOW_SUM", "WINDOW_AVG", "WINDOW_COUNT", "WINDOW_MIN", "WINDOW_MAX",
            "WINDOW_MEDIAN", "WINDOW_STDEV", "WINDOW_VAR", "RANK", "RANK_DENSE", "RANK_MODIFIED",
            "RANK_UNIQUE", "RANK_PERCENTILE", "INDEX", "FIRST", "LAST", "SIZE", "LOOKUP",
            "PREVIOUS_VALUE", "TOTAL");

    private static final Set<String> DATE_PARTS = Set.of(
            "year", "quarter", "month", "week", "day", "hour", "minute", "second");

    private static final Map<String, FunctionSpec> REGISTRY = new TreeMap<>();

    static {
        // ===== Aggregates =====
        aggregate("SUM", AggregateFunction.SUM);
        aggregate("AVG", AggregateFunction.AVG);
        aggregate("COUNT", AggregateFunction.COUNT);
        aggregate("COUNTD", AggregateFunction.COUNT_DISTINCT);
        aggregate("MEDIAN", AggregateFunction.MEDIAN);
        aggregate("STDEV", AggregateFunction.STDDEV_SAMP);
        aggregate("STDEVP", AggregateFunction.STDDEV_POP);
        aggregate("VAR", AggregateFunction.VAR_SAMP);
        aggregate("VARP", AggregateFunction.VAR_POP);
        register("MIN", Category.AGGREGATE, 1, 2, ctx -> minMax(ctx, AggregateFunction.MIN, "least"));
        register("MAX", Category.AGGREGATE, 1, 2, ctx -> minMax(ctx, AggregateFunction.MAX, "greatest"));
        register("ATTR", Category.AGGREGATE, 1, 1, FunctionTable::attr);

        // ===== Math =====
        for (String[] fn : new String[][]{
                {"ABS", "abs"}, {"CEILING", "ceil"}, {"FLOOR", "floor"}, {"SIGN", "sign"}}) {
            register(fn[0], Category.MATH, 1, 1,
                    ctx -> call(fn[1], passthroughNumeric(ctx.arg(0)), ctx.arguments()));
        }
        for (String[] fn : new String[][]{{"SQRT", "sqrt"}, {"EXP", "exp"}, {"LN", "ln"}}) {
            register(fn[0], Category.MATH, 1, 1, ctx -> call(fn[1], SqlType.DOUBLE, ctx.arguments()));
        }
        register("ROUND", Category.MATH, 1, 2,
                ctx -> call("round", passthroughNumeric(ctx.arg(0)), ctx.arguments()));
        register("POWER", Category.MATH, 2, 2, ctx -> call("pow", SqlType.DOUBLE, ctx.arguments()));
        register("LOG", Category.MATH, 1, 2, ctx -> ctx.arity() == 1
                ? call("log10", SqlType.DOUBLE, ctx.arguments())
                : ctx.divide(FunctionExpression.of("ln", SqlType.DOUBLE, ctx.arg(0)),
                        FunctionExpression.of("ln", SqlType.DOUBLE, ctx.arg(1))));
        register("DIV", Category.MATH, 2, 2, ctx -> new CastExpression(
                FunctionExpression.of("trunc", SqlType.DOUBLE, ctx.divide(ctx.arg(0), ctx.arg(1))),
                SqlType.BIGINT));
        register("ZN", Category.MATH, 1, 1, ctx -> FunctionExpression.of(
                "coalesce", passthroughNumeric(ctx.arg(0)), ctx.arg(0), Literal.integer(0)));

        // ===== Strings =====
        register("LEN", Category.STRING, 1, 1, ctx -> call("length", SqlType.BIGINT, ctx.arguments()));
        for (String[] fn : new String[][]{
                {"LOWER", "lower"}, {"UPPER", "upper"}, {"TRIM", "trim"}, {"LTRIM", "ltrim"}, {"RTRIM", "rtrim"}}) {
            register(fn[0], Category.STRING, 1, 1, ctx -> call(fn[1], SqlType.VARCHAR, ctx.arguments()));
        }
        for (String[] fn : new String[][]{
                {"CONTAINS", "contains"}, {"STARTSWITH", "starts_with"}, {"ENDSWITH", "ends_with"}}) {
            register(fn[0], Category.STRING, 2, 2, ctx -> call(fn[1], SqlType.BOOLEAN, ctx.arguments()));
        }
        register("REPLACE", Category.STRING, 3, 3, ctx -> call("replace", SqlType.VARCHAR, ctx.arguments()));
        register("SPLIT", Category.STRING, 3, 3, ctx -> call("split_part", SqlType.VARCHAR, ctx.arguments()));
        register("LEFT", Category.STRING, 2, 2, ctx -> call("left", SqlType.VARCHAR, ctx.arguments()));
        register("RIGHT", Category.STRING, 2, 2, ctx -> call("right", SqlType.VARCHAR, ctx.arguments()));
        register("MID", Category.STRING, 2, 3, ctx -> call("substring", SqlType.VARCHAR, ctx.arguments()));
        register("FIND", Category.STRING, 2, 2, ctx -> call("strpos", SqlType.BIGINT, ctx.arguments()));

        // ===== Type conversion =====
        register("STR", Category.CONVERSION, 1, 1, ctx -> new CastExpression(ctx.arg(0), SqlType.VARCHAR));
        register("INT", Category.CONVERSION, 1, 1, ctx -> new CastExpression(
                ctx.arg(0).type() == SqlType.VARCHAR
                        ? ctx.arg(0)
                        : FunctionExpression.of("trunc", SqlType.DOUBLE, ctx.arg(0)),
                SqlType.BIGINT));
        register("FLOAT", Category.CONVERSION, 1, 1, ctx -> new CastExpression(ctx.arg(0), SqlType.DOUBLE));
        register("DATE", Category.CONVERSION, 1, 1, ctx -> new CastExpression(ctx.arg(0), SqlType.DATE));

        // ===== Dates =====
        register("TODAY", Category.DATE, 0, 0, ctx -> FunctionExpression.of("today", SqlType.DATE));
        register("NOW", Category.DATE, 0, 0, ctx -> FunctionExpression.of("now", SqlType.TIMESTAMP));
        for (String fn : List.of("YEAR", "QUARTER", "MONTH", "WEEK", "DAY")) {
            register(fn, Category.DATE, 1, 1,
                    ctx -> call(fn.toLowerCase(Locale.ROOT), SqlType.BIGINT, ctx.arguments()));
        }
        register("DATEPART", Category.DATE, 2, 2, ctx -> datePart(ctx)
                .<Expression>map(part -> FunctionExpression.of("date_part", SqlType.BIGINT,
                        Literal.string(part), ctx.arg(1)))
                .orElse(Literal.nullValue()));
        register("DATETRUNC", Category.DATE, 2, 2, ctx -> datePart(ctx)
                .<Expression>map(part -> FunctionExpression.of("date_trunc", temporal(ctx.arg(1)),
                        Literal.string(part), ctx.arg(1)))
                .orElse(Literal.nullValue()));
        register("DATEDIFF", Category.DATE, 3, 3, ctx -> datePart(ctx)
                .<Expression>map(part -> FunctionExpression.of("date_diff", SqlType.BIGINT,
                        Literal.string(part), ctx.arg(1), ctx.arg(2)))
                .orElse(Literal.nullValue()));
        register("DATEADD", Category.DATE, 3, 3, ctx -> datePart(ctx)
                .<Expression>map(part -> FunctionExpression.of("date_add", SqlType.TIMESTAMP,
                        ctx.arg(2), interval(part, ctx.arg(1))))
                .orElse(Literal.nullValue()));

        // ===== Logical =====
        register("IIF", Category.LOGICAL, 3, 4, FunctionTable::iif);
        register("ISNULL", Category.LOGICAL, 1, 1, ctx -> ComparisonExpression.isNull(ctx.arg(0)));
        register("IFNULL", Category.LOGICAL, 2, 2,
                ctx -> FunctionExpression.of("coalesce", firstKnown(ctx.arguments()), ctx.arg(0), ctx.arg(1)));
    }

    private FunctionTable() {
    }

    public static Optional<FunctionSpec> lookup(String name) {
        return Optional.ofNullable(REGISTRY.get(name.toUpperCase(Locale.ROOT)));
    }

    public static boolean isTableCalculation(String name) {
        return TABLE_CALCULATIONS.contains(name.toUpperCase(Locale.ROOT));
    }

    public static Set<String> names() {
        return Collections.unmodifiableSet(REGISTRY.keySet());
    }

    private static void register(String name, Category category, int min, int max, Lowering lowering) {
        REGISTRY.put(name, new FunctionSpec(name, category, min, max, lowering));
    }

    private static void aggregate(String name, AggregateFunction function) {
        register(name, Category.AGGREGATE, 1, 1, ctx -> aggregateOf(ctx, function, ctx.arg(0)));
    }

    private static Expression aggregateOf(FunctionContext ctx, AggregateFunction function, Expression argument) {
        if (argument.isAggregate()) {
            return ctx.fail(ctx.call().name() + " cannot aggregate an aggregate");
        }
        return AggregateExpression.of(function, argument);
    }

    private static Expression minMax(FunctionContext ctx, AggregateFunction aggregate, String scalar) {
        if (ctx.arity() == 1) {
            return aggregateOf(ctx, aggregate, ctx.arg(0));
        }
        return call(scalar, firstKnown(ctx.arguments()), ctx.arguments());
    }

    /**
     * The value when every row of the group agrees, NULL otherwise.
     */
    private static Expression attr(FunctionContext ctx) {
        Expression arg = ctx.arg(0);
        if (arg.isAggregate()) {
            return ctx.fail("ATTR cannot aggregate an aggregate");
        }
        Expression min = AggregateExpression.of(AggregateFunction.MIN, arg);
        Expression max = AggregateExpression.of(AggregateFunction.MAX, arg);
        return CaseExpression.of(ComparisonExpression.notDistinct(min, max), min,
                CastExpression.typedNull(min.type()));
    }

    /**
     * IIF(test, then, else[, unknown]): a NULL test yields the unknown value, or NULL.
     */
    private static Expression iif(FunctionContext ctx) {
        Expression test = ctx.arg(0);
        Expression otherwise = ctx.arity() == 4
                ? ctx.arg(3)
                : CastExpression.typedNull(firstKnown(List.of(ctx.arg(1), ctx.arg(2))));
        return new CaseExpression(List.of(
                new CaseExpression.When(test, ctx.arg(1)),
                new CaseExpression.When(LogicalExpression.not(test), ctx.arg(2))),
                otherwise);
    }

    /**
     * The first argument must be a string literal naming a date part.
     */
    private static Optional<String> datePart(FunctionContext ctx) {
        CalcExpression first = ctx.call().argument(0);
        if (first instanceof LiteralExpr literal && literal.dataType() == DataType.STRING) {
            String part = ((String) literal.value()).toLowerCase(Locale.ROOT);
            if (DATE_PARTS.contains(part)) {
                return Optional.of(part);
            }
            ctx.fail("Unknown date part '" + literal.value() + "' in " + ctx.call().name()
                    + ", expected one of " + new TreeSet<>(DATE_PARTS));
            return Optional.empty();
        }
        ctx.fail(ctx.call().name() + " expects a date part string literal as its first argument");
        return Optional.empty();
    }

    private static Expression interval(String part, Expression amount) {
        return switch (part) {
            case "year" -> FunctionExpression.of("to_years", SqlType.UNKNOWN, amount);
            case "quarter" -> FunctionExpression.of("to_months", SqlType.UNKNOWN,
                    ArithmeticExpression.multiply(amount, Literal.integer(3)));
            case "month" -> FunctionExpression.of("to_months", SqlType.UNKNOWN, amount);
            case "week" -> FunctionExpression.of("to_weeks", SqlType.UNKNOWN, amount);
            case "day" -> FunctionExpression.of("to_days", SqlType.UNKNOWN, amount);
            case "hour" -> FunctionExpression.of("to_hours", SqlType.UNKNOWN, amount);
            case "minute" -> FunctionExpression.of("to_minutes", SqlType.UNKNOWN, amount);
            default -> FunctionExpression.of("to_seconds", SqlType.UNKNOWN, amount);
        };
    }

    private static FunctionExpression call(String sqlName, SqlType returnType, List<Expression> arguments) {
        return new FunctionExpression(sqlName, new ArrayList<>(arguments), returnType);
    }

    private static SqlType passthroughNumeric(Expression arg) {
        SqlType type = arg.type();
        return type.isNumeric() ? type : SqlType.DOUBLE;
    }

    private static SqlType temporal(Expression arg) {
        SqlType type = arg.type();
        return type.isTemporal() ? type : SqlType.TIMESTAMP;
    }

    private static SqlType firstKnown(List<Expression> arguments) {
        return arguments.stream()
                .map(Expression::type)
                .filter(t -> t != SqlType.UNKNOWN)
                .findFirst()
                .orElse(SqlType.VARCHAR);
    }
}
