package com.echopost.media.core.model;

import java.util.Objects;

/**
 * An album (or indexed directory) exposed by the media index.
 *
 * @param id    index-assigned identity
 * @param name  display name, usually the last path segment
 * @param path  backing directory, or {@code null} when the index does not expose one
 */
public record AssetAlbum(String id, String name, String path) {
    public AssetAlbum {
        Objects.requireNonNull(id, "id");
        name = Objects.requireNonNullElse(name, "");
    }
}
