package io.calcport.calc.dsl;

import io.calcport.calc.dsl.antlr.CalcAstBuilder;
import io.calcport.calc.dsl.antlr.CalculationLexer;
import io.calcport.calc.dsl.antlr.CalculationParser;
import io.calcport.engine.diagnostic.Diagnostic;
import io.calcport.engine.diagnostic.SourcePosition;
import io.calcport.engine.model.FieldCatalog;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Calculation-language parser using the ANTLR-generated lexer and parser.
 *
 * Never throws on malformed input. ANTLR's default recovery keeps parsing past
 * an error, the error listener records every syntax error as a diagnostic, and
 * {@link CalcAstBuilder} turns whatever could not be recognised into
 * {@link ErrorExpression} nodes. Field references are resolved against the
 * supplied catalog while the tree is built.
 *
 * Formulas nesting deeper than {@value #MAX_NESTING} levels are rejected with an
 * expression-too-deep diagnostic before the parser runs.
 *
 * Stateless and safe to call from several threads; each call builds its own
 * lexer, parser and builder.
 */
public final class CalcParser {

    private static final Logger log = LoggerFactory.getLogger(CalcParser.class);

    /** Deepest bracket, brace or IF/CASE nesting accepted. */
    public static final int MAX_NESTING = 128;

    private CalcParser() {
        // Static utility class
    }

    /**
     * Parses one calculation formula.
     *
     * Examples:
     * - SUM([Profit]) / SUM([Sales])
     * - IF [Sales] > 100 THEN "High" ELSEIF [Sales] > 10 THEN "Mid" ELSE "Low" END
     * - {FIXED [Region] : SUM([Sales])}
     *
     * @param sourceText  the formula
     * @param knownFields fields the formula may reference
     * @return the AST, the referenced field keys and every diagnostic
     */
    public static ParseResult parse(String sourceText, FieldCatalog knownFields) {
        Objects.requireNonNull(knownFields, "Known fields cannot be null");
        String source = sourceText == null ? "" : sourceText;

        ErrorListener errors = new ErrorListener();
        CalculationLexer lexer = new CalculationLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        Token tooDeep = firstTooDeep(tokens.getTokens());
        if (tooDeep != null) {
            return tooDeep(source, errors.diagnostics, position(tooDeep));
        }

        CalculationParser parser = new CalculationParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        CalcAstBuilder builder = new CalcAstBuilder(knownFields);
        CalcExpression ast;
        try {
            ast = builder.build(parser.calculation());
        } catch (StackOverflowError e) {
            // unary chains such as NOT NOT NOT ... are not counted as nesting
            return tooDeep(source, errors.diagnostics, SourcePosition.UNKNOWN);
        }

        List<Diagnostic> diagnostics = new ArrayList<>(errors.diagnostics);
        if (diagnostics.isEmpty()) {
            // Recovery produced a placeholder without the listener being told
            diagnostics.addAll(builder.placeholderDiagnostics());
        }
        diagnostics.addAll(builder.diagnostics());
        diagnostics.sort((a, b) -> Integer.compare(order(a.position()), order(b.position())));

        if (!diagnostics.isEmpty()) {
            log.debug("Parsed '{}' with {} diagnostic(s): {}", source, diagnostics.size(), diagnostics);
        }
        return new ParseResult(ast, builder.references(), diagnostics);
    }

    /**
     * The token that opens one level more than {@link #MAX_NESTING}, or null.
     */
    static Token firstTooDeep(List<Token> tokens) {
        int depth = 0;
        for (Token token : tokens) {
            switch (token.getType()) {
                case CalculationLexer.LPAREN, CalculationLexer.LBRACE, CalculationLexer.IF, CalculationLexer.CASE -> {
                    depth++;
                    if (depth > MAX_NESTING) {
                        return token;
                    }
                }
                case CalculationLexer.RPAREN, CalculationLexer.RBRACE, CalculationLexer.END -> depth = Math.max(0, depth - 1);
                default -> {
                }
            }
        }
        return null;
    }

    private static ParseResult tooDeep(String source, List<Diagnostic> lexerErrors, SourcePosition position) {
        String message = "Expression nests deeper than " + MAX_NESTING + " levels";
        log.debug("Rejected '{}': {}", abbreviate(source), message);
        List<Diagnostic> diagnostics = new ArrayList<>(lexerErrors);
        diagnostics.add(Diagnostic.expressionTooDeep(message, position));
        return new ParseResult(new ErrorExpression(message, position), Set.of(), diagnostics);
    }

    private static String abbreviate(String source) {
        return source.length() <= 80 ? source : source.substring(0, 80) + "...";
    }

    private static SourcePosition position(Token token) {
        return SourcePosition.of(token.getLine(), token.getCharPositionInLine(), token.getStartIndex());
    }

    private static int order(SourcePosition position) {
        return position.isKnown() ? position.line() * 100_000 + position.column() : Integer.MAX_VALUE;
    }

    /**
     * Error listener that records ANTLR errors as syntax-error diagnostics.
     */
    private static class ErrorListener extends BaseErrorListener {

        private final List<Diagnostic> diagnostics = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            int offset = offendingSymbol instanceof Token token ? token.getStartIndex() : -1;
            diagnostics.add(Diagnostic.syntaxError(msg, SourcePosition.of(line, charPositionInLine, offset)));
        }
    }
}
