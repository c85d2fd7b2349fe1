package json.ast;

import java.util.ArrayList;
import java.util.Objects;

/// Recognizes a JSON array: `[` then an optional comma-separated run of values, then `]`.
public final class ArrayRecognizer {

    private ArrayRecognizer() {
    }

    /// Recognizes the array starting at `offset`.
    /// @param text the full input text
    /// @param offset the offset of the opening bracket
    /// @return the array node, ending after the closing bracket
    /// @throws JsonAstParseException if the text at `offset` is not a valid array
    public static JsonAst.ArrayNode recognize(String text, int offset) {
        Objects.requireNonNull(text, "text must not be null");
        final var cursor = new JsonCursor(text, offset);
        final var elements = new ArrayList<JsonAst.Node>();

        cursor.expect('[');
        cursor.skipWhitespace();
        if (JsonChars.isValueStart(cursor.current())) {
            while (true) {
                elements.add(ValueDispatcher.recognize(cursor));
                if (cursor.current() != ',') {
                    break;
                }
                cursor.advance();
            }
        }
        cursor.expect(']');
        return new JsonAst.ArrayNode(elements, offset, cursor.offset());
    }
}
