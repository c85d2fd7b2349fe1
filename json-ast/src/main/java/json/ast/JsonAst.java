package json.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Position-annotated AST for a JSON document.
///
/// Every element carries a half-open `[start, end)` span of UTF-16 offsets into the
/// text it was parsed from. The span covers the element's own production (quotes,
/// brackets and braces included) and never the whitespace around it.
///
/// The tree is immutable. [JsonAstParser] builds it in a single pass; the
/// [JsonAstConverter] and [JsonAstTraverser] only read it.
///
/// ## Element Types
/// - [Node]: one of the six JSON values ([ObjectNode], [ArrayNode], [StringNode],
///   [NumberNode], [BooleanNode], [NullNode])
/// - [Property]: a `key : value` entry of an object, spanning key through value
public sealed interface JsonAst permits JsonAst.Node, JsonAst.Property {

    /// Offset of the first character of this element.
    int start();

    /// Offset immediately after the last character of this element.
    int end();

    /// The tag of this element.
    Kind kind();

    /// Returns the slice of `text` that this element was recognized from.
    /// @param text the text originally passed to the parser
    /// @return the source substring `[start, end)`
    default String source(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return text.substring(start(), end());
    }

    /// Element tags, one per variant.
    enum Kind {
        OBJECT,
        PROPERTY,
        ARRAY,
        STRING,
        NUMBER,
        BOOLEAN,
        NULL
    }

    /// A JSON value.
    sealed interface Node extends JsonAst
            permits ObjectNode, ArrayNode, StringNode, NumberNode, BooleanNode, NullNode {}

    /// An object: properties in source order. Duplicate keys are kept.
    record ObjectNode(List<Property> properties, int start, int end) implements Node {
        public ObjectNode {
            Objects.requireNonNull(properties, "properties must not be null");
            properties = List.copyOf(properties);
            JsonAst.checkSpan(start, end);
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }

        /// Keys in document order, duplicates included.
        public List<String> keys() {
            final var keys = new ArrayList<String>(properties.size());
            for (final var property : properties) {
                keys.add(property.key().content());
            }
            return List.copyOf(keys);
        }
    }

    /// An object entry. Its span starts at the key's opening quote and ends where the value ends.
    record Property(StringNode key, Node value, int start, int end) implements JsonAst {
        public Property {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
            JsonAst.checkSpan(start, end);
        }

        @Override
        public Kind kind() {
            return Kind.PROPERTY;
        }
    }

    /// An array: elements in source order.
    record ArrayNode(List<Node> elements, int start, int end) implements Node {
        public ArrayNode {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = List.copyOf(elements);
            JsonAst.checkSpan(start, end);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }
    }

    /// A string with every escape sequence already resolved.
    record StringNode(String content, int start, int end) implements Node {
        public StringNode {
            Objects.requireNonNull(content, "content must not be null");
            JsonAst.checkSpan(start, end);
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }
    }

    /// A number kept in its decomposed lexical form.
    ///
    /// @param negative whether a leading `-` was present
    /// @param integer the integer digits, never empty
    /// @param fraction the digits after `.`, empty when absent
    /// @param exponentNegative whether the exponent carried a `-`
    /// @param exponent the exponent digits, empty when absent
    record NumberNode(
            boolean negative,
            String integer,
            String fraction,
            boolean exponentNegative,
            String exponent,
            int start,
            int end
    ) implements Node {
        public NumberNode {
            Objects.requireNonNull(integer, "integer must not be null");
            Objects.requireNonNull(fraction, "fraction must not be null");
            Objects.requireNonNull(exponent, "exponent must not be null");
            JsonAst.checkSpan(start, end);
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        /// Reassembles the number as `[-]integer[.fraction][e[-]exponent]`.
        /// An explicit `+` on the exponent is not reproduced.
        public String lexeme() {
            final var sb = new StringBuilder();
            if (negative) {
                sb.append('-');
            }
            sb.append(integer);
            if (!fraction.isEmpty()) {
                sb.append('.').append(fraction);
            }
            if (!exponent.isEmpty()) {
                sb.append('e');
                if (exponentNegative) {
                    sb.append('-');
                }
                sb.append(exponent);
            }
            return sb.toString();
        }

        /// True when neither a fraction nor an exponent was present.
        public boolean isIntegral() {
            return fraction.isEmpty() && exponent.isEmpty();
        }

        /// The exact decimal value of the lexeme, built from the digit runs.
        /// A zero significand yields zero whatever the exponent.
        /// @throws ArithmeticException if the scale falls outside the `int` range
        public BigDecimal toBigDecimal() {
            final var magnitude = new BigInteger(integer + fraction);
            final var unscaled = negative ? magnitude.negate() : magnitude;
            if (exponent.isEmpty()) {
                return new BigDecimal(unscaled, fraction.length());
            }
            if (magnitude.signum() == 0) {
                return BigDecimal.ZERO;
            }
            final var power = new BigInteger(exponent);
            final var scale = BigInteger.valueOf(fraction.length())
                    .subtract(exponentNegative ? power.negate() : power);
            if (scale.bitLength() >= Integer.SIZE) {
                throw new ArithmeticException("exponent out of range for BigDecimal: " + lexeme());
            }
            return new BigDecimal(unscaled, scale.intValue());
        }
    }

    /// `true` or `false`.
    record BooleanNode(boolean value, int start, int end) implements Node {
        public BooleanNode {
            JsonAst.checkSpan(start, end);
        }

        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }
    }

    /// `null`.
    record NullNode(int start, int end) implements Node {
        public NullNode {
            JsonAst.checkSpan(start, end);
        }

        @Override
        public Kind kind() {
            return Kind.NULL;
        }
    }

    private static void checkSpan(int start, int end) {
        if (start < 0 || start > end) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
    }
}
