package json.ast;

import java.util.Objects;

/// Recognizes the literals `true` and `false`.
public final class BooleanRecognizer {

    private BooleanRecognizer() {
    }

    /// Recognizes the boolean literal starting at `offset`.
    /// @throws JsonAstParseException if the lookahead is neither `t` nor `f`, or the literal is misspelt
    public static JsonAst.BooleanNode recognize(String text, int offset) {
        Objects.requireNonNull(text, "text must not be null");
        final var cursor = new JsonCursor(text, offset);
        final boolean value;
        if (cursor.current() == 't') {
            cursor.advance();
            cursor.expect('r');
            cursor.expect('u');
            cursor.expect('e');
            value = true;
        } else if (cursor.current() == 'f') {
            cursor.advance();
            cursor.expect('a');
            cursor.expect('l');
            cursor.expect('s');
            cursor.expect('e');
            value = false;
        } else {
            throw cursor.fail(JsonAstParseException.Kind.INVALID_BOOLEAN, "invalid boolean");
        }
        return new JsonAst.BooleanNode(value, offset, cursor.offset());
    }
}
