package json.ez.tree;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamReadFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.logging.Logger;

/// Decodes JSON text into a `JsonValue` tree.
///
/// Input must be a single JSON value as defined by RFC 8259; anything but
/// whitespace after that value is rejected. Numbers keep their source text
/// (see {@link JsonNumber}) and their length is not limited. When an object declares the same member name more
/// than once, the last declaration wins.
///
/// The maximum nesting depth defaults to 1000 and can be changed with the
/// system property {@value #MAX_DEPTH_PROPERTY}, read once when this class is
/// initialised.
///
/// ## Example Usage
/// ```java
/// JsonValue doc = Json.parse("{\"big\":12345678901234567890.5}");
/// JsonNumber big = (JsonNumber) ((JsonObject) doc).members().get("big");
/// big.toBigDecimal(); // exact
/// ```
///
/// @spec https://datatracker.ietf.org/doc/html/rfc8259 RFC 8259: The JavaScript
///       Object Notation (JSON) Data Interchange Format
public final class Json {

    private static final Logger LOG = Logger.getLogger(Json.class.getName());

    /// System property holding the maximum nesting depth of a document.
    public static final String MAX_DEPTH_PROPERTY = "json.ez.tree.max.depth";

    static final int DEFAULT_MAX_DEPTH = StreamReadConstraints.DEFAULT_MAX_DEPTH;

    private static final int MAX_DEPTH = parseMaxDepth(System.getProperty(MAX_DEPTH_PROPERTY));

    private static final JsonFactory FACTORY = new JsonFactoryBuilder()
            .streamReadConstraints(StreamReadConstraints.builder()
                    .maxNestingDepth(MAX_DEPTH)
                    .maxNumberLength(Integer.MAX_VALUE)
                    .build())
            .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
            .build();

    private Json() {
        throw new AssertionError("Json cannot be instantiated");
    }

    /// Decodes a JSON document held in a `String`.
    ///
    /// @param in the JSON text. Non-null.
    /// @return the decoded value
    /// @throws JsonParseException if `in` is not a single well-formed JSON value
    /// @throws NullPointerException if `in` is `null`
    public static JsonValue parse(String in) {
        Objects.requireNonNull(in, "in must not be null");
        LOG.fine(() -> "Decoding " + in.length() + " chars");
        try (JsonParser parser = FACTORY.createParser(in)) {
            return readDocument(parser);
        } catch (JsonProcessingException e) {
            throw translate(e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /// Decodes a JSON document held in a byte array. The encoding (UTF-8,
    /// UTF-16 or UTF-32) is detected from the first bytes.
    ///
    /// @param in the encoded JSON text. Non-null.
    /// @return the decoded value
    /// @throws JsonParseException if `in` is not a single well-formed JSON value
    /// @throws NullPointerException if `in` is `null`
    public static JsonValue parse(byte[] in) {
        Objects.requireNonNull(in, "in must not be null");
        LOG.fine(() -> "Decoding " + in.length + " bytes");
        try (JsonParser parser = FACTORY.createParser(in)) {
            return readDocument(parser);
        } catch (JsonProcessingException e) {
            throw translate(e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /// Decodes a JSON document read from a stream. The stream is read up to the
    /// end of the document and is not closed.
    ///
    /// @param in the encoded JSON text. Non-null.
    /// @return the decoded value
    /// @throws JsonParseException if the content is not a single well-formed JSON value
    /// @throws UncheckedIOException if reading the stream fails
    /// @throws NullPointerException if `in` is `null`
    public static JsonValue parse(InputStream in) {
        Objects.requireNonNull(in, "in must not be null");
        LOG.fine(() -> "Decoding stream " + in.getClass().getSimpleName());
        try (JsonParser parser = FACTORY.createParser(in)) {
            return readDocument(parser);
        } catch (JsonProcessingException e) {
            throw translate(e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /// {@return the maximum nesting depth in effect}
    public static int maxDepth() {
        return MAX_DEPTH;
    }

    static int parseMaxDepth(String propertyValue) {
        if (propertyValue == null) {
            LOG.fine(() -> "Max depth not specified, using default: " + DEFAULT_MAX_DEPTH);
            return DEFAULT_MAX_DEPTH;
        }
        final int depth;
        try {
            depth = Integer.parseInt(propertyValue.trim());
        } catch (NumberFormatException e) {
            return invalidMaxDepth(propertyValue);
        }
        if (depth <= 0) {
            return invalidMaxDepth(propertyValue);
        }
        LOG.fine(() -> "Max depth set to " + depth + " via system property");
        return depth;
    }

    private static int invalidMaxDepth(String propertyValue) {
        LOG.warning(() -> "Invalid value for " + MAX_DEPTH_PROPERTY + ": " + propertyValue
                + ". Using default: " + DEFAULT_MAX_DEPTH);
        return DEFAULT_MAX_DEPTH;
    }

    private static JsonValue readDocument(JsonParser parser) throws IOException {
        final JsonToken first = parser.nextToken();
        if (first == null) {
            throw error("No JSON value found", parser.currentLocation());
        }
        final JsonValue root = readValue(parser, first);
        final JsonToken trailing = parser.nextToken();
        if (trailing != null) {
            throw error("Unexpected content after the JSON value: " + trailing, parser.currentTokenLocation());
        }
        return root;
    }

    private static JsonValue readValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw error("Unexpected end of input", parser.currentLocation());
        }
        return switch (token) {
            case START_OBJECT -> readObject(parser);
            case START_ARRAY -> readArray(parser);
            case VALUE_STRING -> new JsonString(parser.getText());
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> new JsonNumber(parser.getText());
            case VALUE_TRUE -> JsonBoolean.TRUE;
            case VALUE_FALSE -> JsonBoolean.FALSE;
            case VALUE_NULL -> JsonNull.of();
            default -> throw error("Unexpected token " + token, parser.currentTokenLocation());
        };
    }

    private static JsonObject readObject(JsonParser parser) throws IOException {
        final var members = new LinkedHashMap<String, JsonValue>();
        JsonToken token;
        while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
            final String name = parser.currentName();
            final JsonValue value = readValue(parser, parser.nextToken());
            if (members.put(name, value) != null) {
                LOG.finer(() -> "Duplicate member \"" + name + "\", keeping the last value");
            }
        }
        if (token != JsonToken.END_OBJECT) {
            throw error("Unterminated object", parser.currentLocation());
        }
        return new JsonObject(members);
    }

    private static JsonArray readArray(JsonParser parser) throws IOException {
        final var elements = new ArrayList<JsonValue>();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(readValue(parser, token));
        }
        return new JsonArray(elements);
    }

    private static JsonParseException translate(JsonProcessingException e) {
        final JsonLocation location = e.getLocation();
        final String message = e.getOriginalMessage();
        LOG.fine(() -> "Decoding failed: " + message);
        if (location == null) {
            return new JsonParseException(message, e);
        }
        return new JsonParseException(message, location.getLineNr(), location.getColumnNr(), e);
    }

    private static JsonParseException error(String message, JsonLocation location) {
        return new JsonParseException(message, location.getLineNr(), location.getColumnNr(), null);
    }
}
