package io.narrata.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.narrata.core.flow.FlowGraph;
import io.narrata.core.variable.VariableStore;

/// Utility class for serializing and deserializing Narrata flows and variables to/from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = FlowSerializer.toJson(flow);
/// FlowGraph restored = FlowSerializer.fromJson(json);
///
/// VariableStore variables = FlowSerializer.variablesFromJson(Files.readString(file));
/// }
///
/// Flow files may write conditions and instructions as expression text:
/// {@snippet lang=json :
/// {"id": "c1", "type": "condition", "condition": "mc.jaime.health < 50"}
/// }
///
/// @implNote Thread-safe. The ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see NarrataJacksonModule for the registered type handlers
public final class FlowSerializer {

    private FlowSerializer() {}

    /// Serializes a flow to pretty-printed JSON.
    ///
    /// @param flow the flow to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(FlowGraph flow) {
        try {
            return createMapper().writeValueAsString(flow);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize flow: " + e.getMessage(), e);
        }
    }

    /// Deserializes a flow from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized flow, never null
    /// @throws IllegalArgumentException if the JSON is malformed, a node type
    ///         is unknown or an expression does not parse
    public static FlowGraph fromJson(String json) {
        try {
            return createMapper().readValue(json, FlowGraph.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize flow: " + e.getMessage(), e);
        }
    }

    /// Serializes variables to a pretty-printed JSON array.
    ///
    /// @param variables the variables to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String variablesToJson(VariableStore variables) {
        try {
            return createMapper().writeValueAsString(variables);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize variables: " + e.getMessage(), e);
        }
    }

    /// Deserializes variables from a JSON array.
    ///
    /// @param json JSON string, not null
    /// @return deserialized variables, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static VariableStore variablesFromJson(String json) {
        try {
            return createMapper().readValue(json, VariableStore.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize variables: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Narrata serialization.
    ///
    /// Registers:
    /// - `NarrataJacksonModule` for flows, nodes, expressions and variables
    /// - `JavaTimeModule` for date variables and session export timestamps
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Dates written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new NarrataJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
