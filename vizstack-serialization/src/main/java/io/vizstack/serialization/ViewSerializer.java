package io.vizstack.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.vizstack.core.fragment.View;

/// Utility class for serializing and deserializing assembled views to/from JSON.
///
/// The JSON form is what a renderer consumes: the root id plus the flat fragment table, with
/// every child reference written as an id string.
///
/// ### Usage
/// {@snippet :
/// // Serialize
/// String json = ViewSerializer.toJson(view);
///
/// // Deserialize
/// View restored = ViewSerializer.fromJson(json);
///
/// // Custom ObjectMapper
/// ObjectMapper mapper = ViewSerializer.createMapper();
/// }
///
/// @implNote Thread-safe. A new `ObjectMapper` is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see VizstackJacksonModule for the registered type handlers
public final class ViewSerializer {

    private ViewSerializer() {}

    /// Serializes a view to pretty-printed JSON.
    ///
    /// @param view the view to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(View view) {
        try {
            return createMapper().writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize view: " + e.getMessage(), e);
        }
    }

    /// Deserializes a view from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized view, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static View fromJson(String json) {
        try {
            return createMapper().readValue(json, View.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize view: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for view serialization.
    ///
    /// Registers:
    /// - `VizstackJacksonModule` for the view, fragment and id types
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - indented output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new VizstackJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
