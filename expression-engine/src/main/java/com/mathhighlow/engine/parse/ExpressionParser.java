package com.mathhighlow.engine.parse;

import com.mathhighlow.engine.model.Expression;
import com.mathhighlow.engine.model.OperatorType;

/**
 * Reads an expression from text in the display syntax, e.g. {@code "√4 × 3 + 2"}.
 *
 * <p>Roots may also be written {@code r} or {@code sqrt}; operators may use the ASCII forms
 * {@code * x / -}. Numbers are whole card values, so decimals are rejected. Whitespace is
 * optional. A trailing operator is kept so that partial input parses; completeness is the
 * validator's concern.
 */
public class ExpressionParser {

    public Expression parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Expression text must not be null");
        }

        Expression expression = new Expression();
        int pos = 0;
        int length = text.length();

        while (true) {
            pos = skipWhitespace(text, pos);
            if (pos >= length) {
                break;
            }

            if (expression.expectingNumber()) {
                boolean rooted = false;
                int afterRoot = matchRoot(text, pos);
                if (afterRoot > pos) {
                    rooted = true;
                    pos = skipWhitespace(text, afterRoot);
                }

                int end = pos;
                while (end < length && Character.isDigit(text.charAt(end))) {
                    end++;
                }
                if (end == pos) {
                    throw unexpected(text, pos, "number");
                }
                if (end < length && text.charAt(end) == '.') {
                    throw new IllegalArgumentException(String.format(
                            "Numbers must be whole card values: found '.' at position %d in \"%s\"", end, text));
                }
                try {
                    expression.addNumber(Integer.parseInt(text.substring(pos, end)), rooted);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid number '" + text.substring(pos, end)
                            + "' at position " + pos, e);
                }
                pos = end;
            } else {
                String symbol = String.valueOf(text.charAt(pos));
                try {
                    expression.addOperator(OperatorType.fromSymbol(symbol));
                } catch (IllegalArgumentException e) {
                    throw unexpected(text, pos, "operator");
                }
                pos++;
            }
        }

        return expression;
    }

    private static int matchRoot(String text, int pos) {
        if (text.charAt(pos) == '√') {
            return pos + 1;
        }
        if (text.regionMatches(true, pos, "sqrt", 0, 4)) {
            return pos + 4;
        }
        if (text.charAt(pos) == 'r' || text.charAt(pos) == 'R') {
            return pos + 1;
        }
        return pos;
    }

    private static int skipWhitespace(String text, int pos) {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static IllegalArgumentException unexpected(String text, int pos, String expected) {
        return new IllegalArgumentException(String.format("Expected %s at position %d but found '%c' in \"%s\"",
                expected, pos, text.charAt(pos), text));
    }
}
