package com.echopost.media.core.scan;

import com.echopost.media.core.model.DirectoryConfig;
import com.echopost.media.core.model.MediaQuery;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Where a scan looks: every default album, or only albums backing specific directories.
 */
public record ScanScope(Set<String> directories) {
    public ScanScope {
        directories = directories == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(directories));
    }

    public static ScanScope allAlbums() {
        return new ScanScope(Set.of());
    }

    public static ScanScope directories(Collection<String> directories) {
        return new ScanScope(new LinkedHashSet<>(directories));
    }

    public static ScanScope directory(String directory) {
        return new ScanScope(Set.of(directory));
    }

    /**
     * The query's own directory wins; otherwise enabled custom directories restrict the scan.
     */
    public static ScanScope forQuery(MediaQuery query, DirectoryConfig directoryConfig) {
        if (query.directoryScope() != null) {
            return directory(query.directoryScope());
        }
        if (directoryConfig != null && directoryConfig.restrictsScope()) {
            return directories(directoryConfig.paths());
        }
        return allAlbums();
    }

    public boolean isAllAlbums() {
        return directories.isEmpty();
    }
}
