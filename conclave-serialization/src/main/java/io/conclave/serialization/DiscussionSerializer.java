package io.conclave.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.conclave.core.state.DiscussionSnapshot;

/// Utility class for serializing discussion checkpoints to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = DiscussionSerializer.toJson(snapshot);
/// DiscussionSnapshot restored = DiscussionSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see ConclaveJacksonModule for the registered type handlers
public final class DiscussionSerializer {

    private DiscussionSerializer() {}

    /// Serializes a snapshot to pretty-printed JSON.
    ///
    /// @param snapshot the snapshot to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(DiscussionSnapshot snapshot) {
        try {
            return createMapper().writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize discussion snapshot: " + e.getMessage(), e);
        }
    }

    /// Deserializes a snapshot from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized snapshot, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static DiscussionSnapshot fromJson(String json) {
        try {
            return createMapper().readValue(json, DiscussionSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize discussion snapshot: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Conclave types.
    ///
    /// Registers:
    /// - `ConclaveJacksonModule` for scorecards, worker results and history
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new ConclaveJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
