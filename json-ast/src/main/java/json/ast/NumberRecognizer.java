package json.ast;

import java.util.Objects;

/// Recognizes a JSON number per RFC 8259:
/// `-? (0 | [1-9][0-9]*) (. [0-9]+)? ([eE] [+-]? [0-9]+)?`.
///
/// The node keeps the digit runs as text; nothing is converted here.
public final class NumberRecognizer {

    private NumberRecognizer() {
    }

    /// Recognizes the number starting at `offset`.
    /// @param text the full input text
    /// @param offset the offset of the sign or first digit
    /// @return the number node, ending after the last digit
    /// @throws JsonAstParseException on a leading zero or an empty digit run
    public static JsonAst.NumberNode recognize(String text, int offset) {
        Objects.requireNonNull(text, "text must not be null");
        final var cursor = new JsonCursor(text, offset);

        boolean negative = false;
        if (cursor.current() == '-') {
            negative = true;
            cursor.advance();
        }

        final String integer;
        if (cursor.current() == '0') {
            cursor.advance();
            integer = "0";
        } else if (JsonChars.isDigitNonZero(cursor.current())) {
            integer = digits(cursor);
        } else {
            throw cursor.fail(JsonAstParseException.Kind.INVALID_NUMBER, "invalid number");
        }

        String fraction = "";
        if (cursor.current() == '.') {
            cursor.advance();
            if (!JsonChars.isDigit(cursor.current())) {
                throw cursor.fail(JsonAstParseException.Kind.INVALID_FRACTION, "invalid fractional parameter");
            }
            fraction = digits(cursor);
        }

        boolean exponentNegative = false;
        String exponent = "";
        if (cursor.current() == 'e' || cursor.current() == 'E') {
            cursor.advance();
            if (cursor.current() == '-') {
                exponentNegative = true;
                cursor.advance();
            } else if (cursor.current() == '+') {
                cursor.advance();
            }
            if (!JsonChars.isDigit(cursor.current())) {
                throw cursor.fail(JsonAstParseException.Kind.INVALID_EXPONENT, "invalid exponent parameter");
            }
            exponent = digits(cursor);
        }

        return new JsonAst.NumberNode(negative, integer, fraction, exponentNegative, exponent,
                offset, cursor.offset());
    }

    private static String digits(JsonCursor cursor) {
        final int begin = cursor.offset();
        while (JsonChars.isDigit(cursor.current())) {
            cursor.advance();
        }
        return cursor.text().substring(begin, cursor.offset());
    }
}
