package io.vizstack.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.vizstack.core.fragment.Fragment;
import io.vizstack.core.fragment.FragmentId;
import io.vizstack.core.fragment.View;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/// Deserializes a `View`, keeping the order of the fragment table.
///
/// @implNote Package-private. Registered by {@link VizstackJacksonModule}.
/// @see ViewJsonSerializer for the inverse operation
class ViewJsonDeserializer extends StdDeserializer<View> {

    @Serial private static final long serialVersionUID = 2258137404481962659L;

    ViewJsonDeserializer() {
        super(View.class);
    }

    /// Reads `"rootId"` and every entry of `"fragments"`.
    ///
    /// @param p the JSON parser positioned at the start of the view object, not null
    /// @param ctxt the deserialization context, not null
    /// @return the constructed `View`, never null
    /// @throws IOException if a field is missing or the root fragment is not in the table
    @Override
    public View deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode rootId = root.get("rootId");
        JsonNode table = root.get("fragments");
        if (rootId == null || !rootId.isTextual() || table == null || !table.isObject()) {
            throw JsonMappingException.from(p, "View requires \"rootId\" and \"fragments\"");
        }

        try {
            Map<FragmentId, Fragment> fragments = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = table.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                fragments.put(
                        FragmentId.of(field.getKey()),
                        mapper.treeToValue(field.getValue(), Fragment.class));
            }
            return new View(FragmentId.of(rootId.asText()), fragments);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(p, "Invalid view: " + e.getMessage(), e);
        }
    }
}
