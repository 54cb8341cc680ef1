package com.echopost.media.core.scan;

import com.echopost.media.core.model.RawAssetHandle;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.echopost.media.testing.FakeMediaIndex.photo;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TermFilterTest {

    private static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");

    private final List<RawAssetHandle> library = List.of(
        photo("1", T0, "Sunset_Beach.jpg"),
        photo("2", T0, "IMG_0001.jpg"),
        photo("3", T0, "beach day.png"),
        photo("4", T0, "sunset at the beach.jpg")
    );

    @Test
    void matchesAnyTermIgnoringCase() {
        List<RawAssetHandle> kept = TermFilter.filter(library, List.of("sunset"), "sunset");

        assertEquals(List.of("1", "4"), ids(kept));
    }

    @Test
    void keepsSunsetShotAndDropsMountains() {
        List<RawAssetHandle> kept = TermFilter.filter(List.of(
            photo("s", T0, "IMG_sunset_beach.jpg"),
            photo("m", T0, "IMG_mountains.jpg")
        ), List.of("sunset"), "sunset beach");

        assertEquals(List.of("s"), ids(kept));
    }

    @Test
    void matchesWholeQueryPhrase() {
        List<RawAssetHandle> kept = TermFilter.filter(library, List.of("xyz"), "at the beach");

        assertEquals(List.of("4"), ids(kept));
    }

    @Test
    void emptyOrBlankTermsKeepEverything() {
        assertEquals(library, TermFilter.filter(library, List.of(), "anything"));
        assertEquals(library, TermFilter.filter(library, List.of(" ", ""), ""));
    }

    @Test
    void preservesInputOrder() {
        List<RawAssetHandle> kept = TermFilter.filter(library, List.of("BEACH"), "");

        assertEquals(List.of("1", "3", "4"), ids(kept));
    }

    private static List<String> ids(List<RawAssetHandle> handles) {
        return handles.stream().map(RawAssetHandle::id).toList();
    }
}
