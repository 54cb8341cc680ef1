package com.echopost.media.core.source;

import com.echopost.media.core.model.AssetAlbum;
import com.echopost.media.core.model.RawAssetHandle;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Index used where no device media library exists. Every query is empty.
 */
public final class UnsupportedMediaIndex implements MediaIndex {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public List<AssetAlbum> listAlbums(AssetFilter filter) {
        return List.of();
    }

    @Override
    public List<RawAssetHandle> listAssets(AssetAlbum album, AssetFilter filter, int start, int end) {
        return List.of();
    }

    @Override
    public Optional<Path> resolveFile(RawAssetHandle handle) {
        return Optional.empty();
    }
}
