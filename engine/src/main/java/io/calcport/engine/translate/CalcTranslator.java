package io.calcport.engine.translate;

import io.calcport.calc.dsl.BinaryExpression;
import io.calcport.calc.dsl.CalcExpression;
import io.calcport.calc.dsl.CalcExpressionVisitor;
import io.calcport.calc.dsl.ConditionalExpression;
import io.calcport.calc.dsl.ErrorExpression;
import io.calcport.calc.dsl.FieldReference;
import io.calcport.calc.dsl.FunctionCall;
import io.calcport.calc.dsl.LevelOfDetailExpression;
import io.calcport.calc.dsl.LiteralExpr;
import io.calcport.calc.dsl.UnaryExpression;
import io.calcport.engine.diagnostic.Diagnostic;
import io.calcport.engine.diagnostic.DiagnosticKind;
import io.calcport.engine.diagnostic.SourcePosition;
import io.calcport.engine.mapping.IdentifierMapping;
import io.calcport.engine.mapping.IdentifierTable;
import io.calcport.engine.model.FieldKind;
import io.calcport.engine.plan.ArithmeticExpression;
import io.calcport.engine.plan.CaseExpression;
import io.calcport.engine.plan.CastExpression;
import io.calcport.engine.plan.ColumnReference;
import io.calcport.engine.plan.ComparisonExpression;
import io.calcport.engine.plan.ComparisonExpression.ComparisonOperator;
import io.calcport.engine.plan.ConcatExpression;
import io.calcport.engine.plan.Expression;
import io.calcport.engine.plan.FixedScopeExpression;
import io.calcport.engine.plan.FunctionExpression;
import io.calcport.engine.plan.Literal;
import io.calcport.engine.plan.LogicalExpression;
import io.calcport.engine.plan.LogicalExpression.LogicalOperator;
import io.calcport.engine.plan.SqlType;
import io.calcport.engine.transpiler.SQLDialect;
import io.calcport.engine.transpiler.SQLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Lowers a parsed calculation to a DuckDB SQL expression.
 *
 * <p>Lowering never stops at the first problem: an unresolved field, an
 * unknown function or a bad argument list is reported and replaced by
 * {@code NULL}, and the rest of the tree is still lowered.
 *
 * <p>Column references at the top level are unqualified. Inside a
 * level-of-detail scope they are qualified with that scope's row alias, and
 * the scope correlates with the enclosing rows through
 * {@link TranslatorOptions#rowAlias()} (top level) or the enclosing scope's
 * row alias.
 */
public final class CalcTranslator {

    private static final Logger log = LoggerFactory.getLogger(CalcTranslator.class);

    private final SQLGenerator generator;
    private final TranslatorOptions options;

    public CalcTranslator(SQLDialect dialect, TranslatorOptions options) {
        this.generator = new SQLGenerator(dialect);
        this.options = options;
    }

    /**
     * Translates one calculation.
     *
     * @param ast               The parsed formula
     * @param table             Identifiers for every field the formula may reference
     * @param alreadyTranslated Calculations translated earlier in this request, by source key
     */
    public TranslationResult translate(CalcExpression ast, IdentifierTable table,
                                       Map<String, UpstreamCalculation> alreadyTranslated) {
        Set<Diagnostic> diagnostics = new LinkedHashSet<>();
        Set<String> consumed = new LinkedHashSet<>();
        Lowering lowering = new Lowering(table, alreadyTranslated, 0, "", diagnostics::add, consumed);

        Expression plan;
        String sql;
        try {
            plan = ast.accept(lowering);
            sql = generator.generate(plan);
        } catch (StackOverflowError e) {
            // inlined upstream chains can nest far deeper than any one formula
            log.debug("Lowering overflowed the stack after {} diagnostic(s)", diagnostics.size());
            diagnostics.add(Diagnostic.expressionTooDeep(
                    "Expression with inlined upstream calculations nests too deeply to translate",
                    SourcePosition.UNKNOWN));
            plan = placeholder();
            sql = generator.generate(plan);
        }
        log.debug("Lowered to {} with {} diagnostic(s)", sql, diagnostics.size());
        return new TranslationResult(sql, plan, consumed, new ArrayList<>(diagnostics));
    }

    public TranslatorOptions options() {
        return options;
    }

    /**
     * One lowering pass at a fixed scope depth.
     */
    private final class Lowering implements CalcExpressionVisitor<Expression> {
        private final IdentifierTable table;
        private final Map<String, UpstreamCalculation> upstream;
        private final int depth;
        private final String qualifier;
        private final Consumer<Diagnostic> diagnostics;
        private final Set<String> consumed;

        Lowering(IdentifierTable table, Map<String, UpstreamCalculation> upstream, int depth,
                 String qualifier, Consumer<Diagnostic> diagnostics, Set<String> consumed) {
            this.table = table;
            this.upstream = upstream;
            this.depth = depth;
            this.qualifier = qualifier;
            this.diagnostics = diagnostics;
            this.consumed = consumed;
        }

        @Override
        public Expression visitLiteral(LiteralExpr literal) {
            if (literal.isNull()) {
                return Literal.nullValue();
            }
            return switch (literal.dataType()) {
                case STRING -> Literal.string((String) literal.value());
                case INTEGER -> Literal.integer((Long) literal.value());
                case REAL -> Literal.decimal((Double) literal.value());
                case BOOLEAN -> Literal.bool((Boolean) literal.value());
                case DATE -> Literal.date((String) literal.value());
                case DATETIME -> Literal.timestamp((String) literal.value());
            };
        }

        @Override
        public Expression visitFieldReference(FieldReference reference) {
            if (!reference.isResolved()) {
                diagnostics.accept(Diagnostic.unresolvedField(reference.name(), reference.position()));
                return placeholder();
            }
            Optional<IdentifierMapping> mapping = table.get(reference.sourceKey());
            if (mapping.isEmpty() || mapping.get().isUnresolved()) {
                diagnostics.accept(Diagnostic.of(DiagnosticKind.UNRESOLVED_FIELD,
                        "Field [" + reference.name() + "] has no identifier", reference.position(),
                        reference.name()));
                return placeholder();
            }
            IdentifierMapping m = mapping.get();
            if (m.kind() != FieldKind.CALCULATION) {
                consumed.add(m.targetIdentifier());
                return column(m.targetIdentifier(), SqlType.fromDataType(m.dataType()));
            }

            UpstreamCalculation calc = upstream.get(m.sourceKey());
            if (calc == null) {
                diagnostics.accept(Diagnostic.upstreamFailed(m.sourceKey(), reference.position()));
                return placeholder();
            }
            if (options.referenceCalculationsByIdentifier()) {
                consumed.add(calc.identifier());
                return column(calc.identifier(), calc.plan().type());
            }
            if (qualifier.isEmpty()) {
                consumed.addAll(calc.consumedIdentifiers());
                return calc.plan();
            }
            // Upstream problems were reported when it was translated
            return calc.ast().accept(new Lowering(table, upstream, depth, qualifier, d -> { }, consumed));
        }

        @Override
        public Expression visitBinary(BinaryExpression binary) {
            Expression left = binary.left().accept(this);
            Expression right = binary.right().accept(this);
            return switch (binary.operator()) {
                case ADD -> left.type() == SqlType.VARCHAR || right.type() == SqlType.VARCHAR
                        ? concat(left, right)
                        : new ArithmeticExpression(left, ArithmeticExpression.Operator.ADD, right);
                case SUBTRACT -> ArithmeticExpression.subtract(left, right);
                case MULTIPLY -> ArithmeticExpression.multiply(left, right);
                case DIVIDE -> divide(left, right, binary.position());
                case MODULO -> new ArithmeticExpression(left, ArithmeticExpression.Operator.MODULO, right);
                case EQUAL -> ComparisonExpression.of(left, ComparisonOperator.EQUALS, right);
                case NOT_EQUAL -> ComparisonExpression.of(left, ComparisonOperator.NOT_EQUALS, right);
                case LESS_THAN -> ComparisonExpression.of(left, ComparisonOperator.LESS_THAN, right);
                case LESS_OR_EQUAL -> ComparisonExpression.of(left, ComparisonOperator.LESS_THAN_OR_EQUALS, right);
                case GREATER_THAN -> ComparisonExpression.of(left, ComparisonOperator.GREATER_THAN, right);
                case GREATER_OR_EQUAL ->
                        ComparisonExpression.of(left, ComparisonOperator.GREATER_THAN_OR_EQUALS, right);
                case AND -> logical(LogicalOperator.AND, left, right);
                case OR -> logical(LogicalOperator.OR, left, right);
            };
        }

        @Override
        public Expression visitUnary(UnaryExpression unary) {
            Expression operand = unary.operand().accept(this);
            return switch (unary.operator()) {
                case NEGATE -> ArithmeticExpression.subtract(Literal.integer(0), operand);
                case NOT -> LogicalExpression.not(operand);
            };
        }

        @Override
        public Expression visitFunctionCall(FunctionCall call) {
            List<Expression> arguments = new ArrayList<>(call.arity());
            for (CalcExpression argument : call.arguments()) {
                arguments.add(argument.accept(this));
            }

            Optional<FunctionTable.FunctionSpec> spec = FunctionTable.lookup(call.name());
            if (spec.isEmpty()) {
                if (FunctionTable.isTableCalculation(call.name())) {
                    diagnostics.accept(Diagnostic.of(DiagnosticKind.UNSUPPORTED_FUNCTION,
                            "Table calculation " + call.name() + " depends on the view's partitioning"
                                    + " and has no SQL translation", call.position(), call.name()));
                } else {
                    diagnostics.accept(Diagnostic.unsupportedFunction(call.name(), call.position()));
                }
                return placeholder();
            }
            if (!spec.get().accepts(call.arity())) {
                diagnostics.accept(Diagnostic.argumentError(
                        call.name() + " expects " + spec.get().arityDescription() + ", got " + call.arity(),
                        call.position(), call.name()));
                return placeholder();
            }
            return spec.get().lowering().lower(new FunctionTable.FunctionContext(
                    call, arguments, (l, r) -> divide(l, r, call.position()), diagnostics));
        }

        @Override
        public Expression visitConditional(ConditionalExpression conditional) {
            List<CaseExpression.When> whens = new ArrayList<>();
            for (ConditionalExpression.Branch branch : conditional.branches()) {
                whens.add(new CaseExpression.When(branch.condition().accept(this), branch.result().accept(this)));
            }
            Expression otherwise;
            if (conditional.hasElse()) {
                otherwise = conditional.elseResult().accept(this);
            } else {
                SqlType type = whens.stream()
                        .map(w -> w.result().type())
                        .filter(t -> t != SqlType.UNKNOWN)
                        .findFirst()
                        .orElse(SqlType.VARCHAR);
                otherwise = CastExpression.typedNull(type);
            }
            return new CaseExpression(whens, otherwise);
        }

        @Override
        public Expression visitLevelOfDetail(LevelOfDetailExpression lod) {
            int scopeDepth = depth + 1;
            if (lod.scope() != LevelOfDetailExpression.Scope.FIXED) {
                diagnostics.accept(Diagnostic.contextDependentScope(lod.scope().name(), lod.position()));
            }

            Lowering inner = new Lowering(table, upstream, scopeDepth,
                    FixedScopeExpression.rowsAlias(scopeDepth), diagnostics, consumed);
            String outerQualifier = depth == 0 ? options.rowAlias() : FixedScopeExpression.rowsAlias(depth);
            Lowering outer = new Lowering(table, upstream, depth, outerQualifier, d -> { }, consumed);

            List<FixedScopeExpression.Key> keys = new ArrayList<>();
            for (FieldReference dimension : lod.dimensions()) {
                Expression innerKey = dimension.accept(inner);
                // EXCLUDE lowers over the whole table
                if (lod.scope() != LevelOfDetailExpression.Scope.EXCLUDE) {
                    keys.add(new FixedScopeExpression.Key(innerKey, dimension.accept(outer)));
                }
            }

            Expression body = lod.aggregate().accept(inner);
            if (!body.isAggregate()) {
                diagnostics.accept(Diagnostic.argumentError(
                        "Level of detail expression must aggregate, e.g. SUM([Sales])",
                        lod.position(), lod.scope().name()));
                return placeholder();
            }
            return new FixedScopeExpression(scopeDepth, options.sourceRelation(), keys, body);
        }

        @Override
        public Expression visitError(ErrorExpression error) {
            diagnostics.accept(Diagnostic.syntaxError(error.message(), error.position()));
            return placeholder();
        }

        private Expression column(String identifier, SqlType type) {
            return ColumnReference.of(qualifier, identifier, type);
        }

        private Expression divide(Expression left, Expression right, SourcePosition position) {
            if (options.guardDivision()) {
                return ArithmeticExpression.divide(left,
                        FunctionExpression.of("nullif", right.type(), right, Literal.integer(0)));
            }
            diagnostics.accept(Diagnostic.divideByZeroUnchecked(position));
            return ArithmeticExpression.divide(left, right);
        }
    }

    private static Expression placeholder() {
        return Literal.nullValue();
    }

    private static Expression concat(Expression left, Expression right) {
        List<Expression> parts = new ArrayList<>();
        for (Expression e : List.of(left, right)) {
            if (e instanceof ConcatExpression nested) {
                parts.addAll(nested.parts());
            } else {
                parts.add(e);
            }
        }
        return new ConcatExpression(parts);
    }

    private static Expression logical(LogicalOperator operator, Expression left, Expression right) {
        List<Expression> operands = new ArrayList<>();
        for (Expression e : List.of(left, right)) {
            if (e instanceof LogicalExpression nested && nested.operator() == operator) {
                operands.addAll(nested.operands());
            } else {
                operands.add(e);
            }
        }
        return new LogicalExpression(operator, operands);
    }
}
