package json.ast;

import java.util.Objects;

/// Recognizes a JSON string: `"` then characters or escapes, then `"`.
///
/// Escapes are resolved into [JsonAst.StringNode#content()]. A unicode escape yields
/// exactly one UTF-16 code unit; surrogate pairs stay as two adjacent units.
public final class StringRecognizer {

    private StringRecognizer() {
    }

    /// Recognizes the string starting at `offset`.
    /// @param text the full input text
    /// @param offset the offset of the opening quote
    /// @return the string node, ending after the closing quote
    /// @throws JsonAstParseException if the text at `offset` is not a valid string
    public static JsonAst.StringNode recognize(String text, int offset) {
        Objects.requireNonNull(text, "text must not be null");
        final var cursor = new JsonCursor(text, offset);
        cursor.expect('"');
        final var content = new StringBuilder();
        while (true) {
            final int c = cursor.current();
            if (c == '"') {
                break;
            } else if (c == '\\') {
                cursor.advance();
                content.append(escape(cursor));
            } else if (c == JsonCursor.END) {
                throw cursor.fail(JsonAstParseException.Kind.UNTERMINATED_STRING, "unterminated string");
            } else {
                content.append((char) c);
                cursor.advance();
            }
        }
        cursor.expect('"');
        return new JsonAst.StringNode(content.toString(), offset, cursor.offset());
    }

    // Cursor sits on the character after the backslash.
    private static char escape(JsonCursor cursor) {
        final int c = cursor.current();
        if (c == 'u') {
            cursor.advance();
            return unicode(cursor);
        }
        final char resolved = switch (c) {
            case '"' -> '"';
            case '\\' -> '\\';
            case '/' -> '/';
            case 'b' -> '\b';
            case 'f' -> '\f';
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            default -> throw cursor.fail(JsonAstParseException.Kind.INVALID_ESCAPE,
                    "invalid escape character: " + cursor.describeCurrent());
        };
        cursor.advance();
        return resolved;
    }

    private static char unicode(JsonCursor cursor) {
        int code = 0;
        for (int i = 0; i < 4; i++) {
            final int c = cursor.current();
            if (!JsonChars.isHexDigit(c)) {
                throw cursor.fail(JsonAstParseException.Kind.INVALID_UNICODE_ESCAPE,
                        "invalid unicode escape: " + cursor.describeCurrent());
            }
            code = (code << 4) | Character.digit(c, 16);
            cursor.advance();
        }
        return (char) code;
    }
}
