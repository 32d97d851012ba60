package io.flowcheck.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.flowcheck.core.report.FlowReport;

/// Serializes and deserializes flow reports to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = FlowReportSerializer.toJson(report);
/// FlowReport restored = FlowReportSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. A mapper is created per call via `createMapper()`.
/// Cache the mapper for high-throughput use.
/// @see FlowCheckJacksonModule for the registered bindings
public final class FlowReportSerializer {

    private FlowReportSerializer() {}

    /// Serializes a report to pretty-printed JSON.
    ///
    /// @param report the report, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(FlowReport report) {
        try {
            return createMapper().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize flow report: " + e.getMessage(), e);
        }
    }

    /// Deserializes a report from JSON.
    ///
    /// @param json JSON text, not null
    /// @return the report, never null
    /// @throws IllegalArgumentException if the text is not a valid report
    public static FlowReport fromJson(String json) {
        try {
            return createMapper().readValue(json, FlowReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize flow report: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for flow reports.
    ///
    /// Registers:
    /// - `FlowCheckJacksonModule` for the report bindings
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new FlowCheckJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
