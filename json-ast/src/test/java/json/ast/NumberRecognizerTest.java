package json.ast;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Tests for number recognition into the decomposed lexical form.
class NumberRecognizerTest extends JsonAstLoggingConfig {

    private static final Logger LOG = Logger.getLogger(NumberRecognizerTest.class.getName());

    @Test
    void testFullyDecomposedNumber() {
        LOG.info(() -> "TEST: testFullyDecomposedNumber");
        final var node = NumberRecognizer.recognize("-123.456e-7", 0);
        assertThat(node.negative()).isTrue();
        assertThat(node.integer()).isEqualTo("123");
        assertThat(node.fraction()).isEqualTo("456");
        assertThat(node.exponentNegative()).isTrue();
        assertThat(node.exponent()).isEqualTo("7");
        assertThat(node.start()).isZero();
        assertThat(node.end()).isEqualTo(11);
        assertThat(node.lexeme()).isEqualTo("-123.456e-7");
        assertThat(node.isIntegral()).isFalse();
    }

    @Test
    void testIntegersKeepEmptyOptionalParts() {
        LOG.info(() -> "TEST: testIntegersKeepEmptyOptionalParts");
        final var zero = NumberRecognizer.recognize("0", 0);
        assertThat(zero.integer()).isEqualTo("0");
        assertThat(zero.fraction()).isEmpty();
        assertThat(zero.exponent()).isEmpty();
        assertThat(zero.negative()).isFalse();
        assertThat(zero.isIntegral()).isTrue();

        final var big = NumberRecognizer.recognize("12345678901234567890123", 0);
        assertThat(big.integer()).isEqualTo("12345678901234567890123");
        assertThat(big.toBigDecimal()).isEqualTo(new BigDecimal("12345678901234567890123"));
    }

    @Test
    void testExponentSignsAndCase() {
        LOG.info(() -> "TEST: testExponentSignsAndCase");
        final var plus = NumberRecognizer.recognize("-123.456E+2", 0);
        assertThat(plus.exponentNegative()).isFalse();
        assertThat(plus.exponent()).isEqualTo("2");
        assertThat(plus.end()).isEqualTo(11);
        assertThat(plus.lexeme()).isEqualTo("-123.456e2");

        final var bare = NumberRecognizer.recognize("1e10", 0);
        assertThat(bare.exponent()).isEqualTo("10");
        assertThat(bare.fraction()).isEmpty();
    }

    @Test
    void testStopsAtFirstNonNumberCharacter() {
        LOG.info(() -> "TEST: testStopsAtFirstNonNumberCharacter");
        final var text = "[10.5,2]";
        final var node = NumberRecognizer.recognize(text, 1);
        assertThat(node.start()).isEqualTo(1);
        assertThat(node.end()).isEqualTo(5);
        assertThat(node.source(text)).isEqualTo("10.5");
    }

    @Test
    void testLeadingZeroOnlyConsumesTheZero() {
        LOG.info(() -> "TEST: testLeadingZeroOnlyConsumesTheZero");
        // the recognizer stops after "0"; the driver rejects the leftover "1"
        final var node = NumberRecognizer.recognize("01", 0);
        assertThat(node.integer()).isEqualTo("0");
        assertThat(node.end()).isEqualTo(1);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "-      | INVALID_NUMBER   | invalid number",
            "-a     | INVALID_NUMBER   | invalid number",
            ".      | INVALID_NUMBER   | invalid number",
            "+1     | INVALID_NUMBER   | invalid number",
            "1.     | INVALID_FRACTION | invalid fractional parameter",
            "1.e5   | INVALID_FRACTION | invalid fractional parameter",
            "1e     | INVALID_EXPONENT | invalid exponent parameter",
            "1e-    | INVALID_EXPONENT | invalid exponent parameter",
            "1E+    | INVALID_EXPONENT | invalid exponent parameter",
            "1ex    | INVALID_EXPONENT | invalid exponent parameter"
    })
    void testInvalidNumbers(String input, JsonAstParseException.Kind kind, String detail) {
        LOG.info(() -> "TEST: testInvalidNumbers " + input);
        assertThatThrownBy(() -> NumberRecognizer.recognize(input, 0))
                .isInstanceOf(JsonAstParseException.class)
                .satisfies(e -> {
                    final var ex = (JsonAstParseException) e;
                    assertThat(ex.kind()).isEqualTo(kind);
                    assertThat(ex.detail()).isEqualTo(detail);
                });
    }

    @ParameterizedTest
    @ValueSource(strings = {"01", "00", "-01", "1.", ".5", "1e", "1e-", "1e+", "-", "+1", "0x10", "1.0.0"})
    void testInvalidNumbersRejectedByParser(String input) {
        LOG.info(() -> "TEST: testInvalidNumbersRejectedByParser " + input);
        assertThatThrownBy(() -> JsonAstParser.parse(input)).isInstanceOf(JsonAstParseException.class);
    }
}
