package com.maestro.ensemblespec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.maestro.ensemblespec.model.EnsembleDefinition;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of ensemble specifications.
 * JSON excludes null values when serializing; unknown properties are ignored when reading.
 */
public final class EnsembleSpecJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private EnsembleSpecJson() {
    }

    /**
     * Deserializes an ensemble specification from a JSON string.
     *
     * @param json the JSON string (e.g. from file or API)
     * @return the parsed {@link EnsembleDefinition}
     * @throws UncheckedIOException on parse failure
     */
    public static EnsembleDefinition fromJson(String json) {
        try {
            return MAPPER.readValue(json, EnsembleDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes an ensemble specification to a JSON string (nulls excluded).
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(EnsembleDefinition definition) {
        try {
            return MAPPER.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Pretty-printed variant of {@link #toJson(EnsembleDefinition)}. */
    public static String toJsonPretty(EnsembleDefinition definition) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
