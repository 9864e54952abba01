package com.modelcraft.model;

/**
 * Id of the user on whose behalf records are written, for the {@code *_by} audit fields.
 */
@FunctionalInterface
public interface CurrentUserProvider {

    String SYSTEM_USER = "system";

    CurrentUserProvider SYSTEM = () -> SYSTEM_USER;

    /** May return null when nobody is authenticated; callers fall back to {@link #SYSTEM_USER}. */
    String currentUserId();
}
