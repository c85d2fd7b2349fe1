package json.ast;

import java.util.List;

/// Entry points for parsing JSON into a span-annotated tree and consuming it.
///
/// ```java
/// JsonAst.Node root = JsonAsts.parse("{\"a\":1,\"b\":[2,3]}");
/// Object value = JsonAsts.toValue(root);           // {a=1.0, b=[2.0, 3.0]}
/// JsonAsts.traverse(root, (node, path) -> {
///     System.out.println(JsonAsts.pointer(path) + " " + node.kind());
///     return true;
/// });
/// ```
public final class JsonAsts {

    private JsonAsts() {
    }

    /// Parses `text` as exactly one JSON value.
    /// @throws JsonAstParseException on any grammar violation
    /// @see JsonAstParser#parse(String)
    public static JsonAst.Node parse(String text) {
        return JsonAstParser.parse(text);
    }

    /// Converts a tree to plain Java values with numbers as `Double`.
    /// @see JsonAstConverter#toValue(JsonAst.Node)
    public static Object toValue(JsonAst.Node node) {
        return JsonAstConverter.toValue(node);
    }

    /// Walks a tree in document order.
    /// @see JsonAstTraverser#traverse(JsonAst, JsonAstVisitor)
    public static void traverse(JsonAst start, JsonAstVisitor visitor) {
        JsonAstTraverser.traverse(start, visitor);
    }

    /// Renders a traversal path as a JSON Pointer.
    public static String pointer(List<JsonAstPathStep> path) {
        return JsonAstPathStep.toPointer(path);
    }
}
