package com.echopost.media.core.scan;

import com.echopost.media.core.model.RawAssetHandle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses assets seen in several albums to one entry per id, newest first.
 */
public final class AssetDeduplicator {

    private AssetDeduplicator() {
    }

    public static List<RawAssetHandle> dedupe(List<RawAssetHandle> handles) {
        if (handles == null || handles.isEmpty()) {
            return List.of();
        }
        Map<String, RawAssetHandle> unique = new LinkedHashMap<>();
        for (RawAssetHandle handle : handles) {
            unique.putIfAbsent(handle.id(), handle);
        }
        List<RawAssetHandle> result = new ArrayList<>(unique.values());
        result.sort(AssetScanner.NEWEST_FIRST);
        return result;
    }
}
