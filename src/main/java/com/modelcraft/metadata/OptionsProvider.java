package com.modelcraft.metadata;

import java.util.Map;

/**
 * Source of choices for an enum-like field whose schema names it in {@code optionsProvider}.
 */
public interface OptionsProvider {

    /** The name schemas refer to. */
    String name();

    /** Value to label, in display order. */
    Map<String, String> options();
}
