package org.hpn.exceptions;

/**
 * Malformed rate or guard expression text.
 */
public class ExpressionParseException extends EngineException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "EXPRESSION_PARSE_ERROR";

    private final String expression;
    private final int errorPosition;

    public ExpressionParseException(String message, String expression, int errorPosition) {
        super(message, null, ERROR_CODE);
        this.expression = expression;
        this.errorPosition = errorPosition;
    }

    public String getExpression() {
        return expression;
    }

    public int getErrorPosition() {
        return errorPosition;
    }

    /**
     * Get a snippet around the error position for debugging
     */
    public String getExpressionSnippet() {
        if (expression == null || errorPosition < 0) {
            return null;
        }

        int start = Math.max(0, errorPosition - 20);
        int end = Math.min(expression.length(), errorPosition + 20);

        StringBuilder snippet = new StringBuilder();
        if (start > 0) snippet.append("...");
        snippet.append(expression, start, end);
        if (end < expression.length()) snippet.append("...");

        return snippet.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ExpressionParseException: ").append(getMessage());
        if (errorPosition >= 0) {
            sb.append(" at position ").append(errorPosition);
        }
        String snippet = getExpressionSnippet();
        if (snippet != null) {
            sb.append(" near '").append(snippet).append("'");
        }
        return sb.toString();
    }
}
