package io.vizstack.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.vizstack.core.fragment.Fragment;
import io.vizstack.core.fragment.FragmentId;
import io.vizstack.core.fragment.View;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Vizstack serialization configuration in one place.
///
/// Registered pairs:
/// - `FragmentId` as a plain string, both as value and as map key
/// - `Fragment` as `{type, contents, meta}`, discriminated by `"type"` when read
/// - `View` as `{rootId, fragments}`
///
/// @implNote All registrations are explicit. No annotations on the core types and no
/// classpath scanning.
/// @see ViewSerializer for the convenience factory API
public class VizstackJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5283117709240391678L;

    public VizstackJacksonModule() {
        super("VizstackJacksonModule");

        addSerializer(FragmentId.class, new FragmentIdSerializer(false));
        addDeserializer(FragmentId.class, new FragmentIdDeserializer());
        addKeySerializer(FragmentId.class, new FragmentIdSerializer(true));
        addKeyDeserializer(FragmentId.class, new FragmentIdDeserializer.Key());

        addSerializer(Fragment.class, new FragmentSerializer());
        addDeserializer(Fragment.class, new FragmentDeserializer());

        addSerializer(View.class, new ViewJsonSerializer());
        addDeserializer(View.class, new ViewJsonDeserializer());
    }
}
