package com.echopost.media;

import com.echopost.media.config.EngineSettings;
import com.echopost.media.core.model.CandidateRecord;
import com.echopost.media.core.model.DateRange;
import com.echopost.media.core.model.DirectoryConfig;
import com.echopost.media.core.model.FailureReason;
import com.echopost.media.core.model.MediaKind;
import com.echopost.media.core.model.MediaQuery;
import com.echopost.media.core.model.RawAssetHandle;
import com.echopost.media.core.model.ValidationResult;
import com.echopost.media.core.source.DirectorySource;
import com.echopost.media.core.source.LocalMediaFileSystem;
import com.echopost.media.core.source.UnsupportedMediaIndex;
import com.echopost.media.testing.FakeMediaIndex;
import com.echopost.media.testing.MediaFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static com.echopost.media.testing.FakeMediaIndex.photo;
import static com.echopost.media.testing.FakeMediaIndex.video;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MediaResolutionEngineTest {

    private static final Instant T0 = Instant.parse("2024-06-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private final FakeMediaIndex index = new FakeMediaIndex();

    @Test
    void collapsesDuplicatesAcrossAlbums() throws IOException {
        List<RawAssetHandle> unique = new ArrayList<>();
        for (int i = 0; i < 130; i++) {
            unique.add(mappedPhoto("p" + i, T0.plusSeconds(i), String.format("IMG_%04d.jpg", i)));
        }
        List<RawAssetHandle> thirdAlbum = new ArrayList<>(unique.subList(100, 130));
        thirdAlbum.addAll(unique.subList(0, 20));
        index.addAlbum("Camera", unique.subList(0, 50));
        index.addAlbum("WhatsApp Images", unique.subList(50, 100));
        index.addAlbum("Favourites", thirdAlbum);

        AtomicInteger batches = new AtomicInteger();
        List<CandidateRecord> candidates = engine(DirectorySource.none())
            .findCandidates(MediaQuery.everything(), (batchIndex, batchCount, emitted, dropped) -> batches.incrementAndGet());

        assertEquals(130, candidates.size());
        assertTrue(candidates.stream().allMatch(c -> c.mimeType().startsWith("image/")));
        Set<String> ids = new HashSet<>();
        candidates.forEach(c -> ids.add(c.id()));
        assertEquals(130, ids.size());
        assertEquals("p129", candidates.get(0).id());
        assertEquals("p0", candidates.get(129).id());
        assertEquals(26, batches.get());
    }

    @Test
    void filtersByTermsKindAndDate() throws IOException {
        index.addAlbum("Camera", List.of(
            mappedPhoto("s1", T0, "sunset_beach.jpg"),
            mappedPhoto("s2", T0.minus(Duration.ofDays(40)), "sunset_old.jpg"),
            mappedPhoto("c1", T0, "cat.jpg"),
            mappedVideo("v1", T0, "sunset_timelapse.mp4", Duration.ofSeconds(40))
        ));
        DateRange june = new DateRange(Instant.parse("2024-06-01T00:00:00Z"), Instant.parse("2024-06-30T23:59:59Z"));
        MediaQuery query = new MediaQuery(List.of("sunset"), "sunset", june, MediaKind.PHOTO, null);

        List<CandidateRecord> candidates = engine(DirectorySource.none()).findCandidates(query);

        assertEquals(List.of("s1"), candidates.stream().map(CandidateRecord::id).toList());
    }

    @Test
    void customDirectoriesRestrictScopeUnlessQueryNamesOne() throws IOException {
        index.addAlbum("Camera", "/sdcard/DCIM/Camera", List.of(mappedPhoto("cam", T0, "cam.jpg")));
        index.addAlbum("Screenshots", "/sdcard/Pictures/Screenshots", List.of(mappedPhoto("shot", T0, "shot.jpg")));
        DirectorySource custom = () -> new DirectoryConfig(true, Set.of("/sdcard/Pictures/Screenshots"));
        MediaResolutionEngine engine = engine(custom);

        assertEquals(List.of("shot"), ids(engine.findCandidates(MediaQuery.everything())));
        assertEquals(List.of("cam"),
            ids(engine.findCandidates(MediaQuery.everything().withDirectoryScope("/sdcard/DCIM/Camera"))));
    }

    @Test
    void brokenDirectorySourceFallsBackToAllAlbums() throws IOException {
        index.addAlbum("Camera", List.of(mappedPhoto("cam", T0, "cam.jpg")));
        index.addAlbum("Screenshots", List.of(mappedPhoto("shot", T0.plusSeconds(1), "shot.jpg")));
        DirectorySource broken = () -> {
            throw new IllegalStateException("preferences store locked");
        };

        assertEquals(List.of("shot", "cam"), ids(engine(broken).findCandidates(MediaQuery.everything())));
    }

    @Test
    void unavailableIndexYieldsNoCandidates() throws IOException {
        index.addAlbum("Camera", List.of(mappedPhoto("cam", T0, "cam.jpg")));
        index.setAvailable(false);

        assertTrue(engine(DirectorySource.none()).findCandidates(MediaQuery.everything()).isEmpty());
    }

    @Test
    void unsupportedIndexAnswersEverythingEmpty() {
        MediaResolutionEngine engine = new MediaResolutionEngine(new UnsupportedMediaIndex(),
            new LocalMediaFileSystem(), DirectorySource.none(), EngineSettings.defaults());

        assertTrue(engine.findCandidates(MediaQuery.ofKind(MediaKind.VIDEO)).isEmpty());
        assertFalse(engine.findLatestPhoto(null).isPresent());
        assertEquals(FailureReason.NOT_FOUND,
            engine.validate(tempDir.resolve("missing.jpg").toUri().toString()).failureReason());
    }

    @Test
    void validatedCandidatesDropFilesThatFailInspection() throws IOException {
        RawAssetHandle good = mappedPhoto("good", T0, "good.jpg");
        RawAssetHandle fake = photo("fake", T0.plusSeconds(1), "fake.jpg");
        index.mapFile("fake", Files.writeString(tempDir.resolve("fake.jpg"), "text pretending to be a jpeg"));
        index.addAlbum("Camera", List.of(good, fake));
        MediaResolutionEngine engine = engine(DirectorySource.none());

        assertEquals(2, engine.findCandidates(MediaQuery.everything()).size());
        assertEquals(List.of("good"), ids(engine.findValidatedCandidates(MediaQuery.everything())));
    }

    @Test
    void latestPhotoSkipsUnusableNewestAsset() throws IOException {
        index.addAlbum("Camera", List.of(
            mappedPhoto("older", T0, "older.jpg"),
            mappedPhoto("broken", T0.plusSeconds(60), "broken.jpg"),
            mappedVideo("clip", T0.plusSeconds(120), "clip.mp4", Duration.ofSeconds(5))
        ));
        index.failOn("broken");

        Optional<CandidateRecord> latest = engine(DirectorySource.none()).findLatestPhoto(null);

        assertTrue(latest.isPresent());
        assertEquals("older", latest.get().id());
    }

    @Test
    void latestPhotoIsEmptyWithoutPhotos() {
        index.addAlbum("Camera", List.of());

        assertFalse(engine(DirectorySource.none()).findLatestPhoto("/sdcard/DCIM/Camera").isPresent());
    }

    @Test
    void validatesStoredReferences() throws IOException {
        index.addAlbum("Camera", List.of(mappedPhoto("a", T0, "a.jpg")));
        MediaResolutionEngine engine = engine(DirectorySource.none());
        CandidateRecord record = engine.findCandidates(MediaQuery.everything()).get(0);

        assertTrue(engine.validate(record).isValid());
        Files.delete(tempDir.resolve("a.jpg"));
        ValidationResult result = engine.validate(record.fileUri());
        assertEquals(FailureReason.NOT_FOUND, result.failureReason());
        assertEquals(1, engine.validateAll(List.of(record.fileUri())).size());
    }

    private MediaResolutionEngine engine(DirectorySource directories) {
        return new MediaResolutionEngine(index, new LocalMediaFileSystem(), directories, EngineSettings.defaults());
    }

    private RawAssetHandle mappedPhoto(String id, Instant created, String name) throws IOException {
        index.mapFile(id, MediaFixtures.jpeg(tempDir, name));
        return photo(id, created, name);
    }

    private RawAssetHandle mappedVideo(String id, Instant created, String name, Duration length) throws IOException {
        index.mapFile(id, MediaFixtures.write(tempDir, name, MediaFixtures.MP4_BYTES));
        return video(id, created, name, length);
    }

    private static List<String> ids(List<CandidateRecord> records) {
        return records.stream().map(CandidateRecord::id).toList();
    }
}
