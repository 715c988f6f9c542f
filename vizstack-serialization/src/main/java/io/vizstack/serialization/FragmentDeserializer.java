package io.vizstack.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.vizstack.core.fragment.Fragment;
import io.vizstack.core.fragment.FragmentId;
import io.vizstack.core.fragment.FragmentType;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Deserializes a `Fragment` using the `"type"` discriminator field.
///
/// Contents are read as plain maps and lists. The fields that hold child references are then
/// rebuilt as `FragmentId`s, so that a fragment read back equals the one that was written:
///
/// ```
/// Type            Reference fields
/// ───────────────┼──────────────────────────────
/// FlowLayout      │ elements[]
/// SequenceLayout  │ elements[]
/// SwitchLayout    │ modes[]
/// KeyValueLayout  │ entries[].key, entries[].value
/// GridLayout      │ cells{}.fragmentId
/// DagLayout       │ nodes{}.fragmentId
/// ```
///
/// @implNote Package-private. Registered by {@link VizstackJacksonModule}.
/// @see FragmentSerializer for the inverse operation
class FragmentDeserializer extends StdDeserializer<Fragment> {

    @Serial private static final long serialVersionUID = -7310884526651953271L;

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_MAP =
            new TypeReference<>() {};

    FragmentDeserializer() {
        super(Fragment.class);
    }

    /// Reads `"type"`, `"contents"` and `"meta"` and rebuilds the reference fields.
    ///
    /// @param p the JSON parser positioned at the start of the fragment object, not null
    /// @param ctxt the deserialization context, not null
    /// @return the constructed `Fragment`, never null
    /// @throws IOException if `"type"` is absent or unrecognized, a reference field has the
    ///     wrong shape, or the stream cannot be read
    @Override
    public Fragment deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw JsonMappingException.from(p, "Fragment is missing its \"type\" field");
        }
        try {
            FragmentType type = FragmentType.fromWireName(typeNode.asText());
            Map<String, Object> contents = readMap(mapper, root.get("contents"));
            Map<String, Object> meta = readMap(mapper, root.get("meta"));
            rebuildReferences(type, contents);
            return new Fragment(type, contents, meta);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Invalid fragment: " + e.getMessage(), e);
        }
    }

    private static void rebuildReferences(FragmentType type, Map<String, Object> contents) {
        switch (type) {
            case FLOW_LAYOUT, SEQUENCE_LAYOUT ->
                    contents.computeIfPresent("elements", (k, v) -> toIds(v));
            case SWITCH_LAYOUT -> contents.computeIfPresent("modes", (k, v) -> toIds(v));
            case KEY_VALUE_LAYOUT -> {
                for (Object entry : asList(contents.get("entries"))) {
                    Map<String, Object> pair = asMap(entry);
                    pair.computeIfPresent("key", (k, v) -> toId(v));
                    pair.computeIfPresent("value", (k, v) -> toId(v));
                }
            }
            case GRID_LAYOUT -> rebuildNamedIds(contents.get("cells"));
            case DAG_LAYOUT -> rebuildNamedIds(contents.get("nodes"));
            default -> {} // primitives carry no references
        }
    }

    private static Map<String, Object> readMap(ObjectMapper mapper, JsonNode node) {
        if (node == null || node.isNull()) {
            return new LinkedHashMap<>();
        }
        return mapper.convertValue(node, OBJECT_MAP);
    }

    private static void rebuildNamedIds(Object named) {
        if (named == null) {
            return;
        }
        for (Object entry : asMap(named).values()) {
            asMap(entry).computeIfPresent("fragmentId", (k, v) -> toId(v));
        }
    }

    private static List<FragmentId> toIds(Object value) {
        List<Object> raw = asList(value);
        List<FragmentId> ids = new ArrayList<>(raw.size());
        for (Object element : raw) {
            ids.add(toId(element));
        }
        return ids;
    }

    private static FragmentId toId(Object value) {
        if (!(value instanceof String id)) {
            throw new IllegalArgumentException("Expected fragment id string, got " + value);
        }
        return FragmentId.of(id);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Expected JSON object, got " + value);
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Expected JSON array, got " + value);
        }
        return (List<Object>) value;
    }
}
