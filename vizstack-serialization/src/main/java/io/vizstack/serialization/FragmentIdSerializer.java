package io.vizstack.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.vizstack.core.fragment.FragmentId;
import java.io.IOException;
import java.io.Serial;

/// Writes a `FragmentId` as its plain string value, both as a value and as a map key.
///
/// @implNote Package-private. Registered by {@link VizstackJacksonModule} twice, once as value
/// serializer and once as key serializer.
class FragmentIdSerializer extends StdSerializer<FragmentId> {

    @Serial private static final long serialVersionUID = 3361845770297710845L;

    private final boolean asKey;

    FragmentIdSerializer(boolean asKey) {
        super(FragmentId.class);
        this.asKey = asKey;
    }

    @Override
    public void serialize(FragmentId id, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (asKey) {
            gen.writeFieldName(id.value());
        } else {
            gen.writeString(id.value());
        }
    }
}
