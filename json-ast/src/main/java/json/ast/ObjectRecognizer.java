package json.ast;

import java.util.ArrayList;
import java.util.Objects;

/// Recognizes a JSON object: `{` then an optional comma-separated run of
/// `string : value` properties, then `}`.
///
/// After a comma the next property must start with `"`, so a trailing comma fails
/// on the closing brace.
public final class ObjectRecognizer {

    private ObjectRecognizer() {
    }

    /// Recognizes the object starting at `offset`.
    /// @param text the full input text
    /// @param offset the offset of the opening brace
    /// @return the object node, ending after the closing brace
    /// @throws JsonAstParseException if the text at `offset` is not a valid object
    public static JsonAst.ObjectNode recognize(String text, int offset) {
        Objects.requireNonNull(text, "text must not be null");
        final var cursor = new JsonCursor(text, offset);
        final var properties = new ArrayList<JsonAst.Property>();

        cursor.expect('{');
        cursor.skipWhitespace();
        if (cursor.current() == '"') {
            while (true) {
                properties.add(property(cursor));
                if (cursor.current() == '}') {
                    break;
                }
                cursor.expect(',');
                cursor.skipWhitespace();
            }
        }
        cursor.expect('}');
        return new JsonAst.ObjectNode(properties, offset, cursor.offset());
    }

    // The dispatcher leaves the cursor past any whitespace that follows the value.
    private static JsonAst.Property property(JsonCursor cursor) {
        final var key = cursor.advanceTo(StringRecognizer.recognize(cursor.text(), cursor.offset()));
        cursor.skipWhitespace();
        cursor.expect(':');
        final var value = ValueDispatcher.recognize(cursor);
        return new JsonAst.Property(key, value, key.start(), value.end());
    }
}
