package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

public class VideoField extends FieldBase {

    public VideoField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "VideoEmbed";
    }
}
