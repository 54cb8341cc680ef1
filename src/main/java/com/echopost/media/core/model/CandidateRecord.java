package com.echopost.media.core.model;

import java.util.Objects;

/**
 * A media item that survived enumeration, filtering and metadata resolution.
 */
public record CandidateRecord(String id, String fileUri, String mimeType, DeviceMetadata deviceMetadata) {
    public CandidateRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(fileUri, "fileUri");
        Objects.requireNonNull(mimeType, "mimeType");
        Objects.requireNonNull(deviceMetadata, "deviceMetadata");
    }

    public static CandidateRecord of(RawAssetHandle handle, String fileUri, String mimeType, long fileSizeBytes) {
        return new CandidateRecord(handle.id(), fileUri, mimeType, DeviceMetadata.from(handle, fileSizeBytes));
    }

    public CandidateRecord withFileUri(String uri) {
        return new CandidateRecord(id, uri, mimeType, deviceMetadata);
    }

    public boolean isPhoto() {
        return mimeType.startsWith("image/");
    }
}
