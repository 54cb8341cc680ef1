package com.echopost.media.core.source;

import com.echopost.media.core.model.AssetAlbum;
import com.echopost.media.core.model.RawAssetHandle;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Query capability of the device media index (photo library, media store, or an indexed folder tree).
 * Implementations are read-only from the engine's point of view.
 */
public interface MediaIndex {

    /**
     * Whether this index can serve queries on the current device.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Lists the default album set, limited to albums that can hold assets matching {@code filter}.
     */
    List<AssetAlbum> listAlbums(AssetFilter filter) throws MediaIndexException;

    /**
     * Returns the assets of {@code album} matching {@code filter}, newest first,
     * restricted to positions {@code [start, end)} of that ordering.
     */
    List<RawAssetHandle> listAssets(AssetAlbum album, AssetFilter filter, int start, int end)
        throws MediaIndexException;

    /**
     * Resolves the live file backing {@code handle}; empty when the index cannot provide one.
     */
    Optional<Path> resolveFile(RawAssetHandle handle) throws IOException;
}
