package io.calcport.calc.dsl.antlr;

import io.calcport.calc.dsl.BinaryExpression;
import io.calcport.calc.dsl.BinaryOperator;
import io.calcport.calc.dsl.CalcExpression;
import io.calcport.calc.dsl.ConditionalExpression;
import io.calcport.calc.dsl.ErrorExpression;
import io.calcport.calc.dsl.FieldReference;
import io.calcport.calc.dsl.FunctionCall;
import io.calcport.calc.dsl.LevelOfDetailExpression;
import io.calcport.calc.dsl.LiteralExpr;
import io.calcport.calc.dsl.UnaryExpression;
import io.calcport.engine.diagnostic.Diagnostic;
import io.calcport.engine.diagnostic.SourcePosition;
import io.calcport.engine.model.DataType;
import io.calcport.engine.model.Field;
import io.calcport.engine.model.FieldCatalog;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * ANTLR visitor that converts the parse tree into the {@link CalcExpression} AST.
 *
 * Every visit method is total: when ANTLR's error recovery leaves a child
 * missing, the builder substitutes an {@link ErrorExpression} and keeps going,
 * so one malformed sub-expression never hides errors elsewhere in the formula.
 *
 * One instance per parse; not thread-safe.
 */
public class CalcAstBuilder extends CalculationBaseVisitor<CalcExpression> {

    private static final DateTimeFormatter DATE_TIME_INPUT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd[ ]['T']HH:mm[:ss]", Locale.ROOT);
    private static final DateTimeFormatter DATE_TIME_OUTPUT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    private final FieldCatalog knownFields;
    private final Set<String> references = new LinkedHashSet<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<Diagnostic> placeholderDiagnostics = new ArrayList<>();

    public CalcAstBuilder(FieldCatalog knownFields) {
        this.knownFields = knownFields;
    }

    /**
     * Builds the AST for a (possibly partial) parse tree.
     */
    public CalcExpression build(ParserRuleContext ctx) {
        if (ctx == null) {
            return placeholder(SourcePosition.UNKNOWN, "Missing expression");
        }
        CalcExpression result = ctx.accept(this);
        return result != null ? result : placeholder(position(ctx), "Could not parse '" + ctx.getText() + "'");
    }

    /**
     * @return raw names of resolved fields, in first-use order
     */
    public Set<String> references() {
        return references;
    }

    /**
     * @return diagnostics the builder raised itself (unknown fields, bad literals)
     */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * @return syntax errors for placeholders created without a listener report
     */
    public List<Diagnostic> placeholderDiagnostics() {
        return placeholderDiagnostics;
    }

    // ========================================
    // ENTRY POINT
    // ========================================

    @Override
    public CalcExpression visitCalculation(CalculationParser.CalculationContext ctx) {
        return build(ctx.expression());
    }

    // ========================================
    // OPERATORS
    // ========================================

    @Override
    public CalcExpression visitPrimaryExpression(CalculationParser.PrimaryExpressionContext ctx) {
        return build(ctx.primary());
    }

    @Override
    public CalcExpression visitNegateExpression(CalculationParser.NegateExpressionContext ctx) {
        CalcExpression operand = build(ctx.expression());
        SourcePosition pos = position(ctx);
        // Fold "-5" into a literal so it renders as a plain number
        if (operand instanceof LiteralExpr lit && lit.dataType() == DataType.INTEGER) {
            return LiteralExpr.integer(-((Long) lit.value()), pos);
        }
        if (operand instanceof LiteralExpr lit && lit.dataType() == DataType.REAL) {
            return LiteralExpr.real(-((Double) lit.value()), pos);
        }
        return new UnaryExpression(UnaryExpression.Operator.NEGATE, operand, pos);
    }

    @Override
    public CalcExpression visitMultiplicativeExpression(CalculationParser.MultiplicativeExpressionContext ctx) {
        return binary(ctx, ctx.op, ctx.left, ctx.right);
    }

    @Override
    public CalcExpression visitAdditiveExpression(CalculationParser.AdditiveExpressionContext ctx) {
        return binary(ctx, ctx.op, ctx.left, ctx.right);
    }

    @Override
    public CalcExpression visitComparisonExpression(CalculationParser.ComparisonExpressionContext ctx) {
        return binary(ctx, ctx.op, ctx.left, ctx.right);
    }

    @Override
    public CalcExpression visitNotExpression(CalculationParser.NotExpressionContext ctx) {
        return new UnaryExpression(UnaryExpression.Operator.NOT, build(ctx.expression()), position(ctx));
    }

    @Override
    public CalcExpression visitAndExpression(CalculationParser.AndExpressionContext ctx) {
        return new BinaryExpression(BinaryOperator.AND, build(ctx.left), build(ctx.right), position(ctx));
    }

    @Override
    public CalcExpression visitOrExpression(CalculationParser.OrExpressionContext ctx) {
        return new BinaryExpression(BinaryOperator.OR, build(ctx.left), build(ctx.right), position(ctx));
    }

    private CalcExpression binary(ParserRuleContext ctx, Token op,
            CalculationParser.ExpressionContext left, CalculationParser.ExpressionContext right) {
        CalcExpression l = build(left);
        CalcExpression r = build(right);
        if (op == null) {
            return placeholder(position(ctx), "Missing operator");
        }
        return new BinaryExpression(BinaryOperator.fromToken(op.getText()), l, r, position(ctx));
    }

    // ========================================
    // PRIMARY EXPRESSIONS
    // ========================================

    @Override
    public CalcExpression visitParenthesized(CalculationParser.ParenthesizedContext ctx) {
        return build(ctx.expression());
    }

    /**
     * IF c1 THEN r1 [ELSEIF c2 THEN r2]* [ELSE e] END, branches kept in written order.
     */
    @Override
    public CalcExpression visitIfThen(CalculationParser.IfThenContext ctx) {
        List<ConditionalExpression.Branch> branches = new ArrayList<>();
        List<CalculationParser.ExpressionContext> parts = ctx.expression();
        branches.add(new ConditionalExpression.Branch(build(at(parts, 0)), build(at(parts, 1))));

        for (CalculationParser.ElseIfBranchContext elseIf : ctx.elseIfBranch()) {
            List<CalculationParser.ExpressionContext> e = elseIf.expression();
            branches.add(new ConditionalExpression.Branch(build(at(e, 0)), build(at(e, 1))));
        }

        CalcExpression elseResult = ctx.elseBranch() != null ? build(ctx.elseBranch().expression()) : null;
        return new ConditionalExpression(branches, elseResult, position(ctx));
    }

    /**
     * CASE x WHEN v1 THEN r1 ... [ELSE e] END, desugared to the ordered
     * conditional IF x = v1 THEN r1 ELSEIF x = v2 THEN r2 ... END.
     */
    @Override
    public CalcExpression visitCaseWhen(CalculationParser.CaseWhenContext ctx) {
        CalcExpression subject = build(ctx.expression());
        List<ConditionalExpression.Branch> branches = new ArrayList<>();

        for (CalculationParser.WhenBranchContext when : ctx.whenBranch()) {
            List<CalculationParser.ExpressionContext> e = when.expression();
            CalcExpression value = build(at(e, 0));
            CalcExpression test = new BinaryExpression(BinaryOperator.EQUAL, subject, value, position(when));
            branches.add(new ConditionalExpression.Branch(test, build(at(e, 1))));
        }
        if (branches.isEmpty()) {
            return placeholder(position(ctx), "CASE requires at least one WHEN branch");
        }

        CalcExpression elseResult = ctx.elseBranch() != null ? build(ctx.elseBranch().expression()) : null;
        return new ConditionalExpression(branches, elseResult, position(ctx));
    }

    /**
     * {FIXED|INCLUDE|EXCLUDE [dim1], [dim2] : aggregate}, or {aggregate} as
     * shorthand for FIXED over the whole table.
     */
    @Override
    public CalcExpression visitLevelOfDetail(CalculationParser.LevelOfDetailContext ctx) {
        LevelOfDetailExpression.Scope scope = LevelOfDetailExpression.Scope.FIXED;
        List<FieldReference> dimensions = new ArrayList<>();

        CalculationParser.LodHeaderContext header = ctx.lodHeader();
        if (header != null) {
            scope = scope(header.lodScope());
            for (CalculationParser.FieldReferenceContext dim : header.fieldReference()) {
                fieldReference(dim).ifPresent(dimensions::add);
            }
        }

        CalcExpression aggregate = build(ctx.expression());
        return new LevelOfDetailExpression(scope, dimensions, aggregate, position(ctx));
    }

    @Override
    public CalcExpression visitFunctionCall(CalculationParser.FunctionCallContext ctx) {
        String name = ctx.IDENTIFIER().getText().toUpperCase(Locale.ROOT);
        List<CalcExpression> args = new ArrayList<>();
        if (ctx.argumentList() != null) {
            for (CalculationParser.ExpressionContext arg : ctx.argumentList().expression()) {
                args.add(build(arg));
            }
        }
        return new FunctionCall(name, args, position(ctx));
    }

    @Override
    public CalcExpression visitField(CalculationParser.FieldContext ctx) {
        Optional<FieldReference> ref = fieldReference(ctx.fieldReference());
        return ref.isPresent() ? ref.get() : placeholder(position(ctx), "Malformed field reference");
    }

    @Override
    public CalcExpression visitLiteralValue(CalculationParser.LiteralValueContext ctx) {
        CalculationParser.LiteralContext lit = ctx.literal();
        if (lit == null || lit.getStart() == null) {
            return placeholder(position(ctx), "Missing literal");
        }
        Token token = lit.getStart();
        SourcePosition pos = position(token);
        String text = token.getText();

        return switch (token.getType()) {
            case CalculationLexer.STRING -> LiteralExpr.string(unquote(text), pos);
            case CalculationLexer.INTEGER_LITERAL -> integerLiteral(text, pos);
            case CalculationLexer.DECIMAL_LITERAL -> decimalLiteral(text, pos);
            case CalculationLexer.DATE_LITERAL -> dateLiteral(text, pos);
            case CalculationLexer.TRUE -> LiteralExpr.bool(true, pos);
            case CalculationLexer.FALSE -> LiteralExpr.bool(false, pos);
            case CalculationLexer.NULL -> LiteralExpr.nullValue(pos);
            default -> placeholder(pos, "Unexpected literal '" + text + "'");
        };
    }

    // ========================================
    // HELPERS
    // ========================================

    /**
     * Resolves [Field] or [Datasource].[Field] against the catalog. The last
     * bracketed part names the field.
     */
    private Optional<FieldReference> fieldReference(CalculationParser.FieldReferenceContext ctx) {
        if (ctx == null || ctx.FIELD().isEmpty()) {
            return Optional.empty();
        }
        List<TerminalNode> parts = ctx.FIELD();
        TerminalNode last = parts.get(parts.size() - 1);
        String name = unbracket(last.getText());
        SourcePosition pos = position(ctx);

        Optional<Field> field = knownFields.resolve(name);
        if (field.isPresent()) {
            references.add(field.get().rawName());
            return Optional.of(FieldReference.resolved(name, field.get().rawName(), pos));
        }
        diagnostics.add(Diagnostic.unresolvedField(name, pos));
        return Optional.of(FieldReference.unresolved(name, pos));
    }

    private static LevelOfDetailExpression.Scope scope(CalculationParser.LodScopeContext ctx) {
        if (ctx == null || ctx.getStart() == null) {
            return LevelOfDetailExpression.Scope.FIXED;
        }
        return switch (ctx.getStart().getType()) {
            case CalculationLexer.INCLUDE -> LevelOfDetailExpression.Scope.INCLUDE;
            case CalculationLexer.EXCLUDE -> LevelOfDetailExpression.Scope.EXCLUDE;
            default -> LevelOfDetailExpression.Scope.FIXED;
        };
    }

    private CalcExpression integerLiteral(String text, SourcePosition pos) {
        try {
            return LiteralExpr.integer(Long.parseLong(text), pos);
        } catch (NumberFormatException e) {
            return decimalLiteral(text, pos);
        }
    }

    /**
     * Numbers beyond the range of a double have no SQL literal.
     */
    private CalcExpression decimalLiteral(String text, SourcePosition pos) {
        double value = Double.parseDouble(text);
        if (Double.isFinite(value)) {
            return LiteralExpr.real(value, pos);
        }
        Diagnostic diagnostic = Diagnostic.syntaxError("Numeric literal " + text + " is out of range", pos);
        diagnostics.add(diagnostic);
        return new ErrorExpression(diagnostic.message(), pos);
    }

    /**
     * #2024-01-15# becomes a DATE literal, #2024-01-15 10:30:00# a DATETIME literal.
     */
    private CalcExpression dateLiteral(String text, SourcePosition pos) {
        String inner = text.substring(1, text.length() - 1).strip();
        try {
            return new LiteralExpr(LocalDate.parse(inner).toString(), DataType.DATE, pos);
        } catch (DateTimeParseException notADate) {
            try {
                LocalDateTime dateTime = LocalDateTime.parse(inner, DATE_TIME_INPUT);
                return new LiteralExpr(DATE_TIME_OUTPUT.format(dateTime), DataType.DATETIME, pos);
            } catch (DateTimeParseException notADateTime) {
                Diagnostic diagnostic = Diagnostic.syntaxError("Unrecognized date literal " + text, pos);
                diagnostics.add(diagnostic);
                return new ErrorExpression(diagnostic.message(), pos);
            }
        }
    }

    private ErrorExpression placeholder(SourcePosition pos, String message) {
        placeholderDiagnostics.add(Diagnostic.syntaxError(message, pos));
        return new ErrorExpression(message, pos);
    }

    private static <T> T at(List<T> list, int index) {
        return index < list.size() ? list.get(index) : null;
    }

    private static String unquote(String text) {
        char quote = text.charAt(0);
        String body = text.substring(1, text.length() - 1);
        return body.replace(String.valueOf(quote) + quote, String.valueOf(quote));
    }

    private static String unbracket(String text) {
        String body = text.startsWith("[") && text.endsWith("]") ? text.substring(1, text.length() - 1) : text;
        return body.replace("]]", "]");
    }

    private static SourcePosition position(ParserRuleContext ctx) {
        return ctx == null ? SourcePosition.UNKNOWN : position(ctx.getStart());
    }

    private static SourcePosition position(Token token) {
        if (token == null) {
            return SourcePosition.UNKNOWN;
        }
        return SourcePosition.of(token.getLine(), token.getCharPositionInLine(), token.getStartIndex());
    }
}
