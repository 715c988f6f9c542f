package io.vizstack.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.vizstack.core.fragment.Fragment;
import io.vizstack.core.fragment.FragmentId;
import io.vizstack.core.fragment.View;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a `View` as `{"rootId": ..., "fragments": {id: fragment, ...}}`.
///
/// Fragments are written in table order, root first, so that the same view always produces
/// the same bytes.
///
/// @implNote Package-private. Registered by {@link VizstackJacksonModule}.
/// @see ViewJsonDeserializer for the inverse operation
class ViewJsonSerializer extends StdSerializer<View> {

    @Serial private static final long serialVersionUID = 1864329450719226372L;

    ViewJsonSerializer() {
        super(View.class);
    }

    @Override
    public void serialize(View view, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("rootId", view.rootId().value());
        gen.writeObjectFieldStart("fragments");
        for (Map.Entry<FragmentId, Fragment> entry : view.fragments().entrySet()) {
            provider.defaultSerializeField(entry.getKey().value(), entry.getValue(), gen);
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }
}
