package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

/**
 * Image location (URL or stored path).
 */
public class ImageField extends FieldBase {

    public ImageField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "ImageUpload";
    }
}
