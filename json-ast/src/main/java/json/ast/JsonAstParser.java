package json.ast;

import java.util.Objects;
import java.util.logging.Logger;

/// Strict JSON parser producing a [JsonAst] with source spans.
///
/// Accepts exactly the RFC 8259 grammar: one value, optionally surrounded by
/// whitespace. No comments, trailing commas, single quotes, leading `+`, leading
/// zeros or bare dots. Duplicate object keys are kept in the tree.
///
/// Usage:
/// ```java
/// JsonAst.Node root = JsonAstParser.parse("{\"a\":1,\"b\":[2,3]}");
/// JsonAst.ObjectNode object = (JsonAst.ObjectNode) root;
/// int keyStart = object.properties().get(0).key().start();
/// ```
///
/// Recursion follows the nesting depth of the document and is bounded only by the
/// thread's stack.
public final class JsonAstParser {

    private static final Logger LOG = Logger.getLogger(JsonAstParser.class.getName());

    private JsonAstParser() {
    }

    /// Parses a complete JSON document.
    /// @param text the document text
    /// @return the root value node
    /// @throws NullPointerException if text is null
    /// @throws JsonAstParseException if the text is not exactly one valid JSON value
    public static JsonAst.Node parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.fine(() -> "Parsing JSON document of length " + text.length());
        final var cursor = new JsonCursor(text, 0);
        final var root = ValueDispatcher.recognize(cursor);
        if (!cursor.atEnd()) {
            throw cursor.fail(JsonAstParseException.Kind.TRAILING_CONTENT,
                    "unexpected character at " + cursor.offset());
        }
        LOG.finer(() -> "Parsed root " + root.kind() + " [" + root.start() + ", " + root.end() + ")");
        return root;
    }
}
