package json.ez.tree;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Tests for decoding JSON text into a `JsonValue` tree.
class JsonDecoderTest extends JsonTreeTestBase {

    @Test
    void testDecodesEveryValueKind() {
        final var doc = Json.parse("{\"n\":null,\"b\":true,\"i\":7,\"s\":\"x\",\"a\":[false],\"o\":{}}");

        assertThat(doc).isInstanceOf(JsonObject.class);
        final var members = ((JsonObject) doc).members();
        assertThat(members.get("n")).isEqualTo(JsonNull.of());
        assertThat(members.get("b")).isEqualTo(JsonBoolean.TRUE);
        assertThat(members.get("i")).isEqualTo(JsonNumber.of(7));
        assertThat(members.get("s")).isEqualTo(JsonString.of("x"));
        assertThat(members.get("a")).isEqualTo(JsonArray.of(List.of(JsonBoolean.FALSE)));
        assertThat(members.get("o")).isEqualTo(new JsonObject(java.util.Map.of()));
    }

    @Test
    void testScalarDocuments() {
        assertThat(Json.parse("null")).isSameAs(JsonNull.of());
        assertThat(Json.parse(" false ")).isEqualTo(JsonBoolean.FALSE);
        assertThat(Json.parse("\"only\"")).isEqualTo(JsonString.of("only"));
        assertThat(Json.parse("-0.5e+3")).isEqualTo(JsonNumber.of("-0.5e+3"));
    }

    @Test
    void testNumbersKeepTheirSourceText() {
        final var doc = (JsonArray) Json.parse("[12345678901234567890.123456789, 1.0, 1E400, 0.1]");

        assertThat(doc.elements()).extracting(Object::toString)
                .containsExactly("12345678901234567890.123456789", "1.0", "1E400", "0.1");
        final var big = (JsonNumber) doc.elements().get(0);
        assertThat(big.toBigDecimal()).isEqualByComparingTo(new BigDecimal("12345678901234567890.123456789"));
    }

    @Test
    void testLongNumberLiteralIsKeptWhole() {
        final String digits = "1" + "0".repeat(1200);
        final var doc = (JsonArray) Json.parse("[" + digits + ", -" + digits + ".5]");

        assertThat(doc.elements()).extracting(Object::toString)
                .containsExactly(digits, "-" + digits + ".5");
        assertThat(((JsonNumber) doc.elements().get(0)).toBigDecimal())
                .isEqualByComparingTo(BigDecimal.TEN.pow(1200));
    }

    @Test
    void testArrayOrderIsPreserved() {
        final var doc = (JsonArray) Json.parse("[3, 1, 2]");
        assertThat(doc.elements()).containsExactly(JsonNumber.of(3), JsonNumber.of(1), JsonNumber.of(2));
    }

    @Test
    void testDuplicateMemberKeepsLastValue() {
        final var doc = (JsonObject) Json.parse("{\"k\":1,\"k\":\"two\"}");
        assertThat(doc.members()).hasSize(1);
        assertThat(doc.members().get("k")).isEqualTo(JsonString.of("two"));
    }

    @Test
    void testEscapesAreDecoded() {
        final var doc = Json.parse("\"tab\\tquote\\\" \\u2603\"");
        assertThat(doc).isEqualTo(JsonString.of("tab\tquote\" \u2603"));
    }

    @Test
    void testBytesAreDecodedAsUtf8() {
        final byte[] bytes = "{\"name\":\"Zoë\"}".getBytes(StandardCharsets.UTF_8);
        final var doc = (JsonObject) Json.parse(bytes);
        assertThat(doc.members().get("name")).isEqualTo(JsonString.of("Zoë"));
    }

    @Test
    void testStreamIsDecodedAndLeftOpen() {
        final var closed = new boolean[1];
        final InputStream in = new ByteArrayInputStream("[true]".getBytes(StandardCharsets.UTF_8)) {
            @Override
            public void close() throws IOException {
                closed[0] = true;
                super.close();
            }
        };

        assertThat(Json.parse(in)).isEqualTo(JsonArray.of(List.of(JsonBoolean.TRUE)));
        assertThat(closed[0]).isFalse();
    }

    @Test
    void testEmptyInputIsRejected() {
        assertThatThrownBy(() -> Json.parse("   "))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("No JSON value found");
    }

    @Test
    void testTrailingValueIsRejected() {
        assertThatThrownBy(() -> Json.parse("[1] 2"))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("Unexpected content after the JSON value");
        assertThatThrownBy(() -> Json.parse("{} x"))
                .isInstanceOf(JsonParseException.class);
    }

    @Test
    void testMalformedInputReportsLocation() {
        assertThatThrownBy(() -> Json.parse("{\n  \"a\": }"))
                .isInstanceOf(JsonParseException.class)
                .satisfies(e -> {
                    final var ex = (JsonParseException) e;
                    assertThat(ex.line()).isEqualTo(2);
                    assertThat(ex.column()).isPositive();
                    assertThat(ex.getMessage()).contains("at line 2");
                    assertThat(ex.getCause()).isNotNull();
                });
    }

    @Test
    void testNonStandardSyntaxIsRejected() {
        for (String bad : List.of("[1,]", "01", "NaN", "{'a':1}", "[1 2]", "{\"a\" 1}", "\"open")) {
            assertThatThrownBy(() -> Json.parse(bad))
                    .as(bad)
                    .isInstanceOf(JsonParseException.class);
        }
    }

    @Test
    void testNestingDepthIsLimited() {
        final int limit = Json.maxDepth();
        final String ok = "[".repeat(limit / 2) + "]".repeat(limit / 2);
        final String tooDeep = "[".repeat(limit + 1) + "]".repeat(limit + 1);

        assertThat(Json.parse(ok)).isInstanceOf(JsonArray.class);
        assertThatThrownBy(() -> Json.parse(tooDeep)).isInstanceOf(JsonParseException.class);
    }

    @Test
    void testNullInputThrowsNpe() {
        assertThatThrownBy(() -> Json.parse((String) null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Json.parse((byte[]) null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Json.parse((InputStream) null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testMaxDepthPropertyParsing() {
        assertThat(Json.parseMaxDepth(null)).isEqualTo(Json.DEFAULT_MAX_DEPTH);
        assertThat(Json.parseMaxDepth(" 64 ")).isEqualTo(64);
        assertThat(Json.parseMaxDepth("0")).isEqualTo(Json.DEFAULT_MAX_DEPTH);
        assertThat(Json.parseMaxDepth("deep")).isEqualTo(Json.DEFAULT_MAX_DEPTH);
    }
}
