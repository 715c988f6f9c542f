package io.vizstack.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.vizstack.core.fragment.FragmentId;
import java.io.IOException;
import java.io.Serial;

/// Reads a `FragmentId` from a JSON string.
///
/// @implNote Package-private. Registered by {@link VizstackJacksonModule}.
class FragmentIdDeserializer extends StdDeserializer<FragmentId> {

    @Serial private static final long serialVersionUID = -1502716237743964183L;

    FragmentIdDeserializer() {
        super(FragmentId.class);
    }

    @Override
    public FragmentId deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.VALUE_STRING) {
            return (FragmentId) ctxt.handleUnexpectedToken(FragmentId.class, p);
        }
        String text = p.getText();
        try {
            return FragmentId.of(text);
        } catch (IllegalArgumentException e) {
            throw ctxt.weirdStringException(text, FragmentId.class, e.getMessage());
        }
    }

    /// Reads a `FragmentId` map key, as used by the fragment table of a view.
    static final class Key extends KeyDeserializer {

        @Override
        public Object deserializeKey(String key, DeserializationContext ctxt) throws IOException {
            try {
                return FragmentId.of(key);
            } catch (IllegalArgumentException e) {
                throw ctxt.weirdKeyException(FragmentId.class, key, e.getMessage());
            }
        }
    }
}
