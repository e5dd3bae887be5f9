package io.mdpath.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mdpath.core.pipeline.PipelineResult;
import io.mdpath.core.visit.PatientRecord;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/// Utility class for reading patient records and writing pipeline results as JSON.
///
/// ### Usage
/// {@snippet :
/// List<PatientRecord> records = MdpathSerializer.readPatients(json);
/// PipelineResult result = pipeline.run(records);
/// String snapshot = MdpathSerializer.toJson(result);
/// }
///
/// Input may be a top-level array of patients or an object with a `patients` array.
///
/// @implNote Thread-safe. The ObjectMapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see MdpathJacksonModule for the registered type handlers
public final class MdpathSerializer {

    private static final TypeReference<List<PatientRecord>> PATIENT_LIST = new TypeReference<>() {};

    private MdpathSerializer() {}

    /// Reads patient records from JSON text.
    ///
    /// @param json JSON string, not null
    /// @return patient records in document order, never null
    /// @throws IllegalArgumentException if the JSON cannot be parsed into records
    public static List<PatientRecord> readPatients(String json) {
        ObjectMapper mapper = createMapper();
        try {
            return toRecords(mapper, mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize patient records: " + e.getMessage(), e);
        }
    }

    /// Reads patient records from a stream.
    ///
    /// @param input JSON stream, not null, not closed by this method
    /// @return patient records in document order, never null
    /// @throws IOException if the stream cannot be read
    /// @throws IllegalArgumentException if the JSON cannot be parsed into records
    public static List<PatientRecord> readPatients(InputStream input) throws IOException {
        ObjectMapper mapper = createMapper();
        JsonNode root;
        try {
            root = mapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize patient records: " + e.getMessage(), e);
        }
        return toRecords(mapper, root);
    }

    private static List<PatientRecord> toRecords(ObjectMapper mapper, JsonNode root) {
        JsonNode patients = root != null && root.isObject() ? root.get("patients") : root;
        if (patients == null || !patients.isArray()) {
            throw new IllegalArgumentException(
                    "Expected an array of patients or an object with a 'patients' array");
        }
        try {
            return mapper.readerFor(PATIENT_LIST).readValue(patients);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize patient records: " + e.getMessage(), e);
        }
    }

    /// Serializes a pipeline result to pretty-printed JSON.
    ///
    /// @param result the result to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(PipelineResult result) {
        try {
            return createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize pipeline result: " + e.getMessage(), e);
        }
    }

    /// Serializes a pipeline result to a JSON tree.
    ///
    /// @param result the result to serialize, not null
    /// @return JSON tree, never null
    public static JsonNode toJsonTree(PipelineResult result) {
        ObjectMapper mapper = createMapper();
        return mapper.valueToTree(result);
    }

    /// Creates an ObjectMapper configured for mdpath serialization.
    ///
    /// Registers:
    /// - `MdpathJacksonModule` for input records and result types
    /// - `JavaTimeModule` for the `Instant` fields of run statistics
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled; extraction output may carry extra fields
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new MdpathJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
