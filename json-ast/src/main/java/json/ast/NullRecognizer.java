package json.ast;

import java.util.Objects;

/// Recognizes the literal `null`.
public final class NullRecognizer {

    private NullRecognizer() {
    }

    /// Recognizes `null` starting at `offset`.
    /// @throws JsonAstParseException at the first character that deviates from the literal
    public static JsonAst.NullNode recognize(String text, int offset) {
        Objects.requireNonNull(text, "text must not be null");
        final var cursor = new JsonCursor(text, offset);
        cursor.expect('n');
        cursor.expect('u');
        cursor.expect('l');
        cursor.expect('l');
        return new JsonAst.NullNode(offset, cursor.offset());
    }
}
