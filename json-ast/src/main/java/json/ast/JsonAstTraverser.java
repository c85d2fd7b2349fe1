package json.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Depth-first, pre-order walk over a [JsonAst].
///
/// For each object property the [JsonAst.Property] is visited first, then its value;
/// both get the same [JsonAstPathStep.Member] as the last path step. Array elements
/// are visited with a [JsonAstPathStep.Index]. A visitor returning `false` prunes the
/// children of that element; siblings are still visited.
///
/// The walk holds no state between calls and never modifies the tree.
public final class JsonAstTraverser {

    private static final Logger LOG = Logger.getLogger(JsonAstTraverser.class.getName());

    private JsonAstTraverser() {
    }

    /// Walks the tree rooted at `start`.
    /// @param start a value node or a property
    /// @param visitor the callback, invoked once per element
    /// @throws NullPointerException if start or visitor is null
    public static void traverse(JsonAst start, JsonAstVisitor visitor) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(visitor, "visitor must not be null");
        LOG.fine(() -> "Traversing from " + start.kind() + " [" + start.start() + ", " + start.end() + ")");
        walk(start, visitor, List.of());
    }

    private static void walk(JsonAst node, JsonAstVisitor visitor, List<JsonAstPathStep> path) {
        if (!visitor.visit(node, path)) {
            LOG.finer(() -> "Pruned " + node.kind() + " at " + JsonAstPathStep.toPointer(path));
            return;
        }
        if (node instanceof JsonAst.ObjectNode object) {
            for (final var property : object.properties()) {
                final var childPath = extend(path, new JsonAstPathStep.Member(object, property.key().content()));
                walk(property, visitor, childPath);
                walk(property.value(), visitor, childPath);
            }
        } else if (node instanceof JsonAst.ArrayNode array) {
            final var elements = array.elements();
            for (int i = 0; i < elements.size(); i++) {
                walk(elements.get(i), visitor, extend(path, new JsonAstPathStep.Index(array, i)));
            }
        }
    }

    private static List<JsonAstPathStep> extend(List<JsonAstPathStep> path, JsonAstPathStep step) {
        final var extended = new ArrayList<JsonAstPathStep>(path.size() + 1);
        extended.addAll(path);
        extended.add(step);
        return List.copyOf(extended);
    }
}
