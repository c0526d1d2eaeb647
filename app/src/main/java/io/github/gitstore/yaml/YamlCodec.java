package io.github.gitstore.yaml;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdScalarSerializer;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;
import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.events.ScalarEvent;

/**
 * Serializes values to and from YAML text.
 *
 * <p>The schema is the safe default one plus the implicit {@link TimestampType}. Output never uses anchors or
 * aliases: structurally identical values are written out in full so that version control diffs stay readable. Map
 * entries are sorted by key for the same reason.
 *
 * <p>A string that would read back as another type (a timestamp, a number, a boolean) is written quoted. On the way
 * in, only plain untagged scalars are resolved to timestamps.
 */
public final class YamlCodec {
    public static final YamlCodec instance = new YamlCodec();

    private final YAMLMapper mapper;

    public YamlCodec() {
        var factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .disable(YAMLGenerator.Feature.USE_NATIVE_OBJECT_ID)
                .disable(YAMLGenerator.Feature.USE_NATIVE_TYPE_ID)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .stringQuotingChecker(new TimestampQuotingChecker())
                .build();

        var timestamps = new SimpleModule("yaml-timestamps");
        timestamps.addSerializer(Instant.class, new InstantSerializer());
        timestamps.addSerializer(Date.class, new DateSerializer());
        timestamps.addDeserializer(Instant.class, new InstantDeserializer());

        this.mapper = YAMLMapper.builder(factory)
                .addModule(timestamps)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }

    /** The underlying mapper, for type conversions that must agree with the YAML representation. */
    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Parses a YAML document into plain values: maps, lists, strings, numbers, booleans and {@link Instant}s.
     *
     * @return the parsed value, or null for an empty document
     */
    public @Nullable Object parse(String text) throws JsonProcessingException {
        if (text.isBlank()) {
            return null;
        }
        try (var parser = (YAMLParser) mapper.getFactory().createParser(text)) {
            if (parser.nextToken() == null) {
                return null;
            }
            return readValue(parser);
        } catch (JsonProcessingException e) {
            throw e;
        } catch (IOException e) {
            throw JsonMappingException.fromUnexpectedIOE(e);
        }
    }

    private static @Nullable Object readValue(YAMLParser parser) throws IOException {
        var token = parser.currentToken();
        switch (token) {
            case START_OBJECT: {
                var map = new LinkedHashMap<String, Object>();
                while (parser.nextToken() == JsonToken.FIELD_NAME) {
                    var name = parser.currentName();
                    parser.nextToken();
                    map.put(name, readValue(parser));
                }
                return map;
            }
            case START_ARRAY: {
                var list = new ArrayList<@Nullable Object>();
                while (parser.nextToken() != JsonToken.END_ARRAY) {
                    list.add(readValue(parser));
                }
                return list;
            }
            case VALUE_STRING: {
                var text = parser.getText();
                return isPlainScalar(parser) ? resolveTimestamp(text) : text;
            }
            case VALUE_NUMBER_INT:
            case VALUE_NUMBER_FLOAT:
                return parser.getNumberValue();
            case VALUE_TRUE:
                return Boolean.TRUE;
            case VALUE_FALSE:
                return Boolean.FALSE;
            case VALUE_NULL:
                return null;
            case VALUE_EMBEDDED_OBJECT:
                return parser.getEmbeddedObject();
            default:
                throw new JsonMappingException(parser, "Unexpected YAML token " + token);
        }
    }

    // quoted or explicitly tagged scalars are always strings
    private static boolean isPlainScalar(YAMLParser parser) {
        return parser.getEvent() instanceof ScalarEvent scalar && scalar.isPlain() && scalar.getTag() == null;
    }

    private static Object resolveTimestamp(String scalar) {
        if (!TimestampType.matches(scalar)) {
            return scalar;
        }
        return TimestampType.parse(scalar).<Object>map(i -> i).orElse(scalar);
    }

    /** Parses a YAML document into {@code type}. */
    @SuppressWarnings("unchecked")
    public <T> @Nullable T parse(String text, JavaType type) throws JsonProcessingException {
        var raw = parse(text);
        if (raw == null) {
            return null;
        }
        if (isPlainStructure(type) && type.getRawClass().isInstance(raw)) {
            // converting would turn resolved timestamps back into strings
            return (T) raw;
        }
        return mapper.convertValue(raw, type);
    }

    private static boolean isPlainStructure(JavaType type) {
        if (type.isJavaLangObject()) {
            return true;
        }
        if (type.isMapLikeType() || type.isCollectionLikeType()) {
            var content = type.getContentType();
            return content == null || content.isJavaLangObject();
        }
        return false;
    }

    public <T> @Nullable T parse(String text, Class<T> type) throws JsonProcessingException {
        return parse(text, mapper.constructType(type));
    }

    public String dump(Object data) throws JsonProcessingException {
        if (data == null) {
            throw new IllegalArgumentException("Attempt to write invalid data (null)");
        }
        return mapper.writeValueAsString(data);
    }

    /** Converts an object into its YAML-level structure (usually a map of plain values). */
    public Map<String, Object> toMap(Object value) {
        return mapper.convertValue(value, mapper.getTypeFactory().constructMapType(LinkedHashMap.class, String.class,
                Object.class));
    }

    public <T> T fromMap(Map<String, Object> map, JavaType type) {
        return mapper.convertValue(map, type);
    }

    private static final class InstantSerializer extends StdScalarSerializer<Instant> {
        InstantSerializer() {
            super(Instant.class);
        }

        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            writeTimestamp(value, gen);
        }
    }

    private static final class DateSerializer extends StdScalarSerializer<Date> {
        DateSerializer() {
            super(Date.class);
        }

        @Override
        public void serialize(Date value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            writeTimestamp(value.toInstant(), gen);
        }
    }

    /**
     * Timestamps go out as plain scalars so they resolve back to timestamps; the quoting checker would quote them if
     * they were written as strings. Other generators (token buffers during conversion) get the text form.
     */
    private static void writeTimestamp(Instant value, JsonGenerator gen) throws IOException {
        var text = TimestampType.format(value);
        if (gen instanceof YAMLGenerator) {
            gen.writeNumber(text);
        } else {
            gen.writeString(text);
        }
    }

    private static final class TimestampQuotingChecker extends StringQuotingChecker {
        private static final long serialVersionUID = 1L;

        @Override
        public boolean needToQuoteName(String name) {
            return StringQuotingChecker.Default.instance().needToQuoteName(name);
        }

        @Override
        public boolean needToQuoteValue(String value) {
            return TimestampType.matches(value) || StringQuotingChecker.Default.instance().needToQuoteValue(value);
        }
    }

    private static final class InstantDeserializer extends StdScalarDeserializer<Instant> {
        InstantDeserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() != null && p.currentToken().isNumeric()) {
                return Instant.ofEpochMilli(p.getLongValue());
            }
            var text = p.getValueAsString();
            if (text == null) {
                return (Instant) ctxt.handleUnexpectedToken(Instant.class, p);
            }
            return TimestampType.parse(text.trim())
                    .orElseThrow(() -> ctxt.weirdStringException(text, Instant.class, "not a YAML timestamp"));
        }
    }
}
