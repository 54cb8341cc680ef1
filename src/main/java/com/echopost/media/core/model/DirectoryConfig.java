package com.echopost.media.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Custom directory scope as resolved from the user's preferences.
 */
public record DirectoryConfig(boolean enabled, Set<String> paths) {
    public DirectoryConfig {
        paths = paths == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(paths));
    }

    public static DirectoryConfig disabled() {
        return new DirectoryConfig(false, Set.of());
    }

    public boolean restrictsScope() {
        return enabled && !paths.isEmpty();
    }
}
