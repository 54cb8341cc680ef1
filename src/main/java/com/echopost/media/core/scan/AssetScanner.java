package com.echopost.media.core.scan;

import com.echopost.media.core.model.AssetAlbum;
import com.echopost.media.core.model.RawAssetHandle;
import com.echopost.media.core.source.AssetFilter;
import com.echopost.media.core.source.MediaIndex;
import com.echopost.media.core.source.MediaIndexException;
import com.echopost.media.logging.AppLogger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Enumerates raw assets from the media index for a scope and filter, newest first.
 * An album that fails mid-scan is skipped; the scan never throws for index errors.
 */
public final class AssetScanner {

    private static final Logger LOGGER = AppLogger.get();

    static final Comparator<RawAssetHandle> NEWEST_FIRST =
        Comparator.comparing(RawAssetHandle::creationTime).reversed();

    private final MediaIndex index;
    private final int pageSize;

    public AssetScanner(MediaIndex index, int pageSize) {
        this.index = Objects.requireNonNull(index, "index");
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.pageSize = pageSize;
    }

    public List<RawAssetHandle> scan(ScanScope scope, AssetFilter filter) {
        if (!index.isAvailable()) {
            LOGGER.info("Media index unavailable; scan returns no assets");
            return List.of();
        }

        List<AssetAlbum> albums;
        try {
            albums = index.listAlbums(filter);
        } catch (MediaIndexException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not list albums: " + e.getMessage(), e);
            return List.of();
        }
        if (albums.isEmpty()) {
            return List.of();
        }

        List<RawAssetHandle> assets = new ArrayList<>();
        for (AssetAlbum album : selectAlbums(scope, albums)) {
            try {
                for (RawAssetHandle handle : index.listAssets(album, filter, 0, pageSize)) {
                    if (filter.matches(handle)) {
                        assets.add(handle);
                    }
                }
            } catch (MediaIndexException | RuntimeException e) {
                LOGGER.warning("Skipping album '" + album.name() + "': " + e.getMessage());
            }
        }
        assets.sort(NEWEST_FIRST);
        return assets;
    }

    /**
     * Albums matching the scope's directories. When none of them exists the first
     * album is used instead.
     */
    static List<AssetAlbum> selectAlbums(ScanScope scope, List<AssetAlbum> albums) {
        if (scope.isAllAlbums()) {
            return albums;
        }
        List<AssetAlbum> selected = new ArrayList<>();
        for (AssetAlbum album : albums) {
            for (String directory : scope.directories()) {
                if (matches(album, directory)) {
                    selected.add(album);
                    break;
                }
            }
        }
        if (selected.isEmpty()) {
            AssetAlbum fallback = albums.get(0);
            LOGGER.fine(() -> "No album for " + scope.directories() + "; falling back to '" + fallback.name() + "'");
            selected.add(fallback);
        }
        return selected;
    }

    static boolean matches(AssetAlbum album, String directory) {
        if (directory == null || directory.isBlank()) {
            return false;
        }
        String wanted = stripTrailingSeparators(directory.trim());
        if (album.path() != null && samePath(album.path(), wanted)) {
            return true;
        }
        return album.name().equalsIgnoreCase(lastSegment(wanted));
    }

    private static boolean samePath(String albumPath, String wanted) {
        try {
            return Path.of(albumPath).normalize().equals(Path.of(wanted).normalize());
        } catch (RuntimeException e) {
            return stripTrailingSeparators(albumPath).toLowerCase(Locale.ROOT).equals(wanted.toLowerCase(Locale.ROOT));
        }
    }

    private static String lastSegment(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String stripTrailingSeparators(String path) {
        String result = path;
        while (result.length() > 1 && (result.endsWith("/") || result.endsWith("\\"))) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
