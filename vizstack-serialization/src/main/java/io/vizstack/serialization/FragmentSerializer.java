package io.vizstack.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.vizstack.core.fragment.Fragment;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `Fragment` as `{"type": ..., "contents": {...}, "meta": {...}}`.
///
/// `type` is the kind's wire tag, e.g. `"SequenceLayout"`. Contents are written generically;
/// child references appear as plain id strings through {@link FragmentIdSerializer}.
///
/// @implNote Package-private. Registered by {@link VizstackJacksonModule}.
/// @see FragmentDeserializer for the inverse operation
class FragmentSerializer extends StdSerializer<Fragment> {

    @Serial private static final long serialVersionUID = 6049318827516401193L;

    FragmentSerializer() {
        super(Fragment.class);
    }

    @Override
    public void serialize(Fragment fragment, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", fragment.type().wireName());
        provider.defaultSerializeField("contents", fragment.contents(), gen);
        provider.defaultSerializeField("meta", fragment.meta(), gen);
        gen.writeEndObject();
    }
}
