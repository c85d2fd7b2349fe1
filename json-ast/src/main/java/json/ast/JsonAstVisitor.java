package json.ast;

import java.util.List;

/// Callback for [JsonAstTraverser]. Called once per visited element in pre-order.
@FunctionalInterface
public interface JsonAstVisitor {

    /// Visits one element.
    /// @param node the object property or value being visited
    /// @param path steps from the traversal start to `node`; empty for the start itself
    /// @return `false` to skip the children of `node`, `true` to descend
    boolean visit(JsonAst node, List<JsonAstPathStep> path);
}
