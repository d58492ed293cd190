package org.janelia.coreg.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Jackson mappers shared by all serialized types.
 * Types are mapped through their fields (getters and setters are ignored unless annotated)
 * so that derived accessors do not leak into verdict and summary files.
 */
public class JsonUtils {

    public static DefaultPrettyPrinter getArraysOnNewLinePrettyPrinter() {
        final DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentArraysWith(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE);
        return printer;
    }

    public static final ObjectMapper FAST_MAPPER = new ObjectMapper().
            setSerializationInclusion(JsonInclude.Include.NON_NULL).
            setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY).
            setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE).
            configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final ObjectMapper MAPPER = FAST_MAPPER.copy().
            setDefaultPrettyPrinter(getArraysOnNewLinePrettyPrinter()).
            enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Reader and writer for one value type.
     * Malformed JSON is reported as an {@link IllegalArgumentException},
     * only failures to read a file are reported as {@link IOException}.
     */
    public static class Helper<T> {

        private final ObjectReader reader;
        private final ObjectWriter writer;

        public Helper(final Class<T> valueType) {
            this(MAPPER, valueType);
        }

        public Helper(final ObjectMapper mapper,
                      final Class<T> valueType) {
            this.reader = mapper.readerFor(valueType);
            this.writer = mapper.writerFor(valueType);
        }

        public String toJson(final T value)
                throws IllegalArgumentException {
            try {
                return writer.writeValueAsString(value);
            } catch (final JsonProcessingException e) {
                throw new IllegalArgumentException("failed to serialize " + value, e);
            }
        }

        public T fromJson(final String json)
                throws IllegalArgumentException {
            try {
                return reader.readValue(json);
            } catch (final JsonProcessingException e) {
                throw new IllegalArgumentException("failed to parse JSON, " + e.getOriginalMessage(), e);
            }
        }

        public T fromJson(final Reader json)
                throws IllegalArgumentException {
            try {
                return reader.readValue(json);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to parse JSON, " + e.getMessage(), e);
            }
        }

        /**
         * @throws IOException
         *   if the file cannot be read.
         *
         * @throws IllegalArgumentException
         *   if the file does not contain valid JSON for this helper's type.
         */
        public T load(final Path path)
                throws IOException, IllegalArgumentException {
            try (final Reader json = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                return reader.readValue(json);
            } catch (final JsonProcessingException e) {
                throw new IllegalArgumentException("failed to parse " + path + ", " + e.getOriginalMessage(), e);
            }
        }
    }

}
