package json.ast;

import java.util.Objects;

/// Mutable scan position over the input text.
///
/// Recognizers move the cursor one character at a time with [#advance()] and
/// [#expect(char)]. The only way to move further in one step is [#advanceTo(JsonAst)],
/// which snaps the cursor to the end of a node produced by a nested recognizer.
final class JsonCursor {

    /// Returned by [#current()] at end of input.
    static final int END = -1;

    private final String text;
    private int offset;

    JsonCursor(String text, int offset) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside text of length " + text.length());
        }
        this.offset = offset;
    }

    String text() {
        return text;
    }

    int offset() {
        return offset;
    }

    /// The character at the offset, or [#END].
    int current() {
        return offset < text.length() ? text.charAt(offset) : END;
    }

    boolean atEnd() {
        return offset >= text.length();
    }

    void advance() {
        offset++;
    }

    /// Consumes `expected` or fails without moving.
    void expect(char expected) {
        if (current() != expected) {
            if (atEnd()) {
                throw fail(JsonAstParseException.Kind.UNEXPECTED_CHARACTER,
                        "expected " + expected + " but got end of input at " + offset);
            }
            throw fail(JsonAstParseException.Kind.UNEXPECTED_CHARACTER,
                    "expected " + expected + " but got " + (char) current() + " at " + offset);
        }
        advance();
    }

    void skipWhitespace() {
        while (JsonChars.isWhitespace(current())) {
            advance();
        }
    }

    /// Moves the cursor to the end of a node recognized from the current position.
    <T extends JsonAst> T advanceTo(T node) {
        offset = node.end();
        return node;
    }

    /// Describes the current character for error messages.
    String describeCurrent() {
        return atEnd() ? "end of input" : String.valueOf((char) current());
    }

    JsonAstParseException fail(JsonAstParseException.Kind kind, String detail) {
        return new JsonAstParseException(kind, detail, text, offset);
    }
}
