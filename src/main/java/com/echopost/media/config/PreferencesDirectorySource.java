package com.echopost.media.config;

import com.echopost.media.core.model.DirectoryConfig;
import com.echopost.media.core.source.DirectorySource;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.prefs.Preferences;

/**
 * Reads the custom-directory preferences written by the settings screen.
 * The engine never writes to this node.
 */
public final class PreferencesDirectorySource implements DirectorySource {
    static final String ROOT_NODE = "com/echopost/media";
    static final String KEY_ENABLED = "custom.directories.enabled";
    static final String KEY_PATHS = "custom.directories";

    private final Preferences delegate;

    public PreferencesDirectorySource(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesDirectorySource global() {
        return new PreferencesDirectorySource(Preferences.userRoot().node(ROOT_NODE));
    }

    @Override
    public DirectoryConfig load() {
        boolean enabled = delegate.getBoolean(KEY_ENABLED, false);
        String raw = delegate.get(KEY_PATHS, null);
        if (raw == null || raw.isBlank()) {
            return new DirectoryConfig(enabled, Set.of());
        }
        Set<String> paths = new LinkedHashSet<>();
        for (String line : raw.split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                paths.add(trimmed);
            }
        }
        return new DirectoryConfig(enabled, paths);
    }
}
