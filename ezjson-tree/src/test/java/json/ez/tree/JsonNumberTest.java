package json.ez.tree;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Tests for `JsonNumber` text validation and on-demand conversion.
class JsonNumberTest extends JsonTreeTestBase {

    @Test
    void testToLongAcceptsPlainIntegers() {
        assertThat(JsonNumber.of("42").toLong()).isEqualTo(42L);
        assertThat(JsonNumber.of("-0").toLong()).isEqualTo(0L);
        assertThat(JsonNumber.of("9223372036854775807").toLong()).isEqualTo(Long.MAX_VALUE);
        assertThat(JsonNumber.of("-9223372036854775808").toLong()).isEqualTo(Long.MIN_VALUE);
    }

    @Test
    void testToLongRejectsFractionsExponentsAndOverflow() {
        assertThatThrownBy(() -> JsonNumber.of("12.34").toLong()).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> JsonNumber.of("2.0").toLong()).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> JsonNumber.of("1e3").toLong()).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> JsonNumber.of("9223372036854775808").toLong())
                .isInstanceOf(NumberFormatException.class);
    }

    @Test
    void testToDouble() {
        assertThat(JsonNumber.of("12.34").toDouble()).isEqualTo(12.34);
        assertThat(JsonNumber.of("3").toDouble()).isEqualTo(3.0);
        assertThat(JsonNumber.of("6.02E23").toDouble()).isEqualTo(6.02E23);
        assertThat(JsonNumber.of("1e-400").toDouble()).isEqualTo(0.0);
    }

    @Test
    void testToDoubleRejectsOverflow() {
        assertThatThrownBy(() -> JsonNumber.of("1e400").toDouble())
                .isInstanceOf(NumberFormatException.class)
                .hasMessageContaining("1e400");
    }

    @Test
    void testToBigDecimalIsExact() {
        assertThat(JsonNumber.of("0.1000000000000000055511151231257827").toBigDecimal())
                .isEqualTo(new BigDecimal("0.1000000000000000055511151231257827"));
    }

    @Test
    void testFactoriesProduceJsonText() {
        assertThat(JsonNumber.of(-17L).text()).isEqualTo("-17");
        assertThat(JsonNumber.of(12.5).text()).isEqualTo("12.5");
        assertThat(JsonNumber.of(1.0E10).text()).isEqualTo("1.0E10");
    }

    @Test
    void testInvalidTextIsRejected() {
        assertThatThrownBy(() -> JsonNumber.of("+1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonNumber.of("01")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonNumber.of("1.")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonNumber.of(" 1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonNumber.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JsonNumber.of(Double.POSITIVE_INFINITY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEqualityFollowsText() {
        assertThat(JsonNumber.of("1.0")).isNotEqualTo(JsonNumber.of("1"));
        assertThat(JsonNumber.of("1")).isEqualTo(JsonNumber.of(1L));
        assertThat(JsonNumber.of("1")).hasToString("1");
    }
}
