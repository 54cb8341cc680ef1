package com.echopost.media.core.source;

import com.echopost.media.core.model.DirectoryConfig;

/**
 * Supplies the user's enabled custom directories.
 */
@FunctionalInterface
public interface DirectorySource {

    DirectoryConfig load();

    static DirectorySource none() {
        return DirectoryConfig::disabled;
    }
}
