package io.vizstack.core.fragment;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// An image loaded by the renderer from a file path.
///
/// Contents: `filePath`, exactly as given. The path is not resolved or checked here; the
/// renderer decides how to load it.
public final class ImagePrimitive extends FragmentAssembler {

    private final String filePath;

    private ImagePrimitive(String filePath) {
        this.filePath = Objects.requireNonNull(filePath, "filePath must not be null");
    }

    public static ImagePrimitive of(String filePath) {
        return new ImagePrimitive(filePath);
    }

    public String getFilePath() {
        return filePath;
    }

    @Override
    public ImagePrimitive meta(String key, Object value) {
        super.meta(key, value);
        return this;
    }

    @Override
    public FragmentType getFragmentType() {
        return FragmentType.IMAGE_PRIMITIVE;
    }

    @Override
    public Assembly assemble(FragmentIdResolver resolver) {
        Map<String, Object> contents = new LinkedHashMap<>();
        contents.put("filePath", filePath);
        return Assembly.leaf(fragment(contents));
    }
}
