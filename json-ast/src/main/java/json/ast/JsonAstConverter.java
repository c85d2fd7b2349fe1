package json.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Converts a [JsonAst.Node] tree into plain Java values.
///
/// | Node | Value |
/// |------|-------|
/// | object | unmodifiable `Map<String, Object>` in document order |
/// | array | unmodifiable `List<Object>` |
/// | string | `String` |
/// | number | `Double` (or `BigDecimal`, see [NumberMode]) |
/// | boolean | `Boolean` |
/// | null | `null` |
///
/// Duplicate object keys resolve last-write-wins: the key keeps the position of its
/// first occurrence and the value of its last.
public final class JsonAstConverter {

    private static final Logger LOG = Logger.getLogger(JsonAstConverter.class.getName());

    /// How number nodes are converted.
    public enum NumberMode {
        /// Parse the reassembled lexeme as a binary64 `Double`. Precision beyond
        /// what a double can represent is lost.
        DOUBLE,
        /// Build an exact `BigDecimal` from the decomposed lexical form. A non-zero
        /// number whose scale overflows `int` raises `ArithmeticException`.
        BIG_DECIMAL
    }

    private JsonAstConverter() {
    }

    /// Converts using [NumberMode#DOUBLE].
    /// @param node the root of the tree to convert
    /// @return the converted value, `null` for a null node
    /// @throws NullPointerException if node is null
    public static Object toValue(JsonAst.Node node) {
        return toValue(node, NumberMode.DOUBLE);
    }

    /// Converts with an explicit number mode.
    /// @param node the root of the tree to convert
    /// @param numberMode how to convert number nodes
    /// @return the converted value, `null` for a null node
    /// @throws NullPointerException if node or numberMode is null
    /// @throws ArithmeticException in [NumberMode#BIG_DECIMAL] mode, if an exponent puts a
    ///         non-zero number outside the range a `BigDecimal` can represent
    public static Object toValue(JsonAst.Node node, NumberMode numberMode) {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(numberMode, "numberMode must not be null");
        LOG.fine(() -> "Converting " + node.kind() + " with number mode " + numberMode);
        return convert(node, numberMode);
    }

    static Object convert(JsonAst node, NumberMode numberMode) {
        if (node instanceof JsonAst.BooleanNode bool) {
            return bool.value();
        } else if (node instanceof JsonAst.NullNode) {
            return null;
        } else if (node instanceof JsonAst.StringNode string) {
            return string.content();
        } else if (node instanceof JsonAst.NumberNode numeric) {
            return number(numeric, numberMode);
        } else if (node instanceof JsonAst.ObjectNode object) {
            final Map<String, Object> members = new LinkedHashMap<>();
            for (final var property : object.properties()) {
                members.put(property.key().content(), convert(property.value(), numberMode));
            }
            return Collections.unmodifiableMap(members);
        } else if (node instanceof JsonAst.ArrayNode array) {
            final List<Object> elements = new ArrayList<>(array.elements().size());
            for (final var element : array.elements()) {
                elements.add(convert(element, numberMode));
            }
            return Collections.unmodifiableList(elements);
        }
        throw new IllegalStateException("unknown ast type: " + node.kind());
    }

    private static Object number(JsonAst.NumberNode number, NumberMode numberMode) {
        return switch (numberMode) {
            case DOUBLE -> Double.parseDouble(number.lexeme());
            case BIG_DECIMAL -> number.toBigDecimal();
        };
    }
}
