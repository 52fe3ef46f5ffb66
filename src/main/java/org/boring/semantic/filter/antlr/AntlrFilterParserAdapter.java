package org.boring.semantic.filter.antlr;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.boring.semantic.filter.FilterCondition;
import org.boring.semantic.filter.FilterParseException;

/**
 * ANTLR-based parser for string filter expressions.
 *
 * Uses FilterExpressionLexer/FilterExpressionParser generated from FilterExpression.g4.
 */
public final class AntlrFilterParserAdapter {

    private AntlrFilterParserAdapter() {
        // Static utility class
    }

    /**
     * Parses a filter expression such as {@code status = 'paid' and amount >= 100}.
     *
     * @param text The filter expression
     * @return The structured condition
     * @throws FilterParseException if parsing fails
     */
    public static FilterCondition parse(String text) {
        if (text == null || text.isBlank()) {
            throw new FilterParseException("Filter expression is empty");
        }
        FilterExpressionLexer lexer = new FilterExpressionLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ErrorListener(text));

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        FilterExpressionParser parser = new FilterExpressionParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ErrorListener(text));

        FilterExpressionParser.FilterContext tree = parser.filter();
        return new FilterAstBuilder().visit(tree);
    }

    /**
     * Error listener that converts ANTLR errors to FilterParseException.
     */
    private static class ErrorListener extends BaseErrorListener {
        private final String text;

        ErrorListener(String text) {
            this.text = text;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            throw new FilterParseException(
                    "Invalid filter expression '" + text + "' at position " + charPositionInLine + " - " + msg);
        }
    }
}
