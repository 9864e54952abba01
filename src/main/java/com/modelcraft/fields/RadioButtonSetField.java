package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;

public class RadioButtonSetField extends EnumField {

    public RadioButtonSetField(FieldDescriptor descriptor) {
        super(descriptor);
    }

    @Override
    public String uiComponent() {
        return "RadioButtonSet";
    }
}
