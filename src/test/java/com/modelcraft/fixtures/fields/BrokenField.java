package com.modelcraft.fixtures.fields;

import com.modelcraft.fields.FieldBase;
import com.modelcraft.metadata.FieldDescriptor;

public class BrokenField extends FieldBase {

    public BrokenField(FieldDescriptor descriptor) {
        super(descriptor);
        throw new IllegalStateException("cannot be built");
    }

    @Override
    public String uiComponent() {
        return "Nothing";
    }
}
