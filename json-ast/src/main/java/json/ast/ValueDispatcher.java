package json.ast;

import java.util.Objects;
import java.util.logging.Logger;

/// Routes the lookahead character to the recognizer for that value production.
///
/// Whitespace is skipped on both sides of the value, so containers can call the
/// dispatcher back-to-back without handling inter-value whitespace themselves.
public final class ValueDispatcher {

    private static final Logger LOG = Logger.getLogger(ValueDispatcher.class.getName());

    private ValueDispatcher() {
    }

    /// Recognizes one value, with optional surrounding whitespace, starting at `offset`.
    /// The returned node's span excludes the whitespace.
    /// @param text the full input text
    /// @param offset where leading whitespace (or the value itself) begins
    /// @return the value node
    /// @throws JsonAstParseException if no value starts after the whitespace, or the value is malformed
    public static JsonAst.Node recognize(String text, int offset) {
        Objects.requireNonNull(text, "text must not be null");
        return recognize(new JsonCursor(text, offset));
    }

    /// Recognizes one value and leaves `cursor` after the whitespace that follows it.
    static JsonAst.Node recognize(JsonCursor cursor) {
        cursor.skipWhitespace();
        final var text = cursor.text();
        final int offset = cursor.offset();
        final int c = cursor.current();
        final JsonAst.Node value;
        if (c == '{') {
            value = cursor.advanceTo(ObjectRecognizer.recognize(text, offset));
        } else if (c == '[') {
            value = cursor.advanceTo(ArrayRecognizer.recognize(text, offset));
        } else if (c == '"') {
            value = cursor.advanceTo(StringRecognizer.recognize(text, offset));
        } else if (c == '-' || JsonChars.isDigit(c)) {
            value = cursor.advanceTo(NumberRecognizer.recognize(text, offset));
        } else if (c == 't' || c == 'f') {
            value = cursor.advanceTo(BooleanRecognizer.recognize(text, offset));
        } else if (c == 'n') {
            value = cursor.advanceTo(NullRecognizer.recognize(text, offset));
        } else {
            throw cursor.fail(JsonAstParseException.Kind.INVALID_VALUE, "invalid value");
        }
        LOG.finer(() -> "Recognized " + value.kind() + " [" + value.start() + ", " + value.end() + ")");
        cursor.skipWhitespace();
        return value;
    }
}
