package json.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Usage examples for the three entry points, as shown in the class documentation.
class JsonAstsTest extends JsonAstLoggingConfig {

    private static final Logger LOG = Logger.getLogger(JsonAstsTest.class.getName());

    @Test
    void testParseConvertTraverse() {
        LOG.info(() -> "TEST: testParseConvertTraverse");
        final var root = JsonAsts.parse("{\"a\":1,\"b\":[2,3]}");
        assertThat(JsonAsts.toValue(root)).isEqualTo(Map.of("a", 1.0, "b", List.of(2.0, 3.0)));

        final var pointers = new ArrayList<String>();
        JsonAsts.traverse(root, (node, path) -> {
            if (node instanceof JsonAst.NumberNode) {
                pointers.add(JsonAsts.pointer(path));
            }
            return true;
        });
        assertThat(pointers).containsExactly("/a", "/b/0", "/b/1");
    }

    @Test
    void testLocateOffendingPropertyBySpan() {
        LOG.info(() -> "TEST: testLocateOffendingPropertyBySpan");
        final var text = "{\n  \"name\": \"x\",\n  \"port\": \"8080\"\n}";
        final var root = JsonAsts.parse(text);
        final var found = new ArrayList<JsonAst.Property>();
        JsonAsts.traverse(root, (node, path) -> {
            if (node instanceof JsonAst.Property property
                    && property.key().content().equals("port")
                    && property.value().kind() != JsonAst.Kind.NUMBER) {
                found.add(property);
            }
            return true;
        });
        assertThat(found).hasSize(1);
        assertThat(found.get(0).value().source(text)).isEqualTo("\"8080\"");
        assertThat(found.get(0).source(text)).isEqualTo("\"port\": \"8080\"");
    }

    @Test
    void testInvalidInputSurfacesParseException() {
        LOG.info(() -> "TEST: testInvalidInputSurfacesParseException");
        assertThatThrownBy(() -> JsonAsts.parse("{\"a\":1}x"))
                .isInstanceOf(JsonAstParseException.class)
                .hasMessage("unexpected character at 7. Location: line 1, column 8.");
    }

    @Test
    void testPackageLoggerFollowsConfiguredLevel() {
        LOG.info(() -> "TEST: testPackageLoggerFollowsConfiguredLevel");
        final Logger packageLogger = LOG.getParent();
        assertThat(packageLogger.getName()).isEqualTo("json.ast");
        final String configured = System.getProperty("java.util.logging.ConsoleHandler.level");
        final Level expected = configured == null ? Level.INFO : Level.parse(configured.trim().toUpperCase(Locale.ROOT));
        assertThat(packageLogger.getLevel()).isEqualTo(expected);
    }
}
