package json.ast;

import java.util.List;
import java.util.Objects;

/// One edge of a traversal path: the container that owns the visited element and
/// the key or index under which it appears.
public sealed interface JsonAstPathStep permits JsonAstPathStep.Member, JsonAstPathStep.Index {

    /// The object or array containing the visited element.
    JsonAst.Node owner();

    /// The property key (`String`) or element index (`Integer`).
    Object key();

    /// Object member step. Used for both the property and its value.
    record Member(JsonAst.ObjectNode owner, String name) implements JsonAstPathStep {
        public Member {
            Objects.requireNonNull(owner, "owner must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public Object key() {
            return name;
        }
    }

    /// Array element step.
    record Index(JsonAst.ArrayNode owner, int index) implements JsonAstPathStep {
        public Index {
            Objects.requireNonNull(owner, "owner must not be null");
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative: " + index);
            }
        }

        @Override
        public Object key() {
            return index;
        }
    }

    /// Renders a path as an RFC 6901 JSON Pointer. The empty path is `""`.
    /// @param path steps from the traversal root
    /// @return the pointer, with `~` and `/` in keys escaped as `~0` and `~1`
    static String toPointer(List<JsonAstPathStep> path) {
        Objects.requireNonNull(path, "path must not be null");
        final var sb = new StringBuilder();
        for (final var step : path) {
            sb.append('/');
            if (step instanceof Member member) {
                sb.append(member.name().replace("~", "~0").replace("/", "~1"));
            } else {
                sb.append(((Index) step).index());
            }
        }
        return sb.toString();
    }
}
