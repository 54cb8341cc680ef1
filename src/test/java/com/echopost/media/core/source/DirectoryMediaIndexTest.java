package com.echopost.media.core.source;

import com.echopost.media.core.model.AssetAlbum;
import com.echopost.media.core.model.DateRange;
import com.echopost.media.core.model.MediaKind;
import com.echopost.media.core.model.RawAssetHandle;
import com.echopost.media.core.scan.AssetScanner;
import com.echopost.media.core.scan.ScanScope;
import com.echopost.media.testing.MediaFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectoryMediaIndexTest {

    private static final AssetFilter ANY = AssetFilter.unrestricted(Duration.ofMinutes(15));
    private static final Instant BASE = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void exposesRootAndVisibleSubdirectoriesAsAlbums() throws Exception {
        Files.createDirectories(tempDir.resolve("Screenshots"));
        Files.createDirectories(tempDir.resolve("camera"));
        Files.createDirectories(tempDir.resolve(".thumbnails"));
        Files.createDirectories(tempDir.resolve("__MACOSX"));

        List<AssetAlbum> albums = new DirectoryMediaIndex(List.of(tempDir)).listAlbums(ANY);

        assertEquals(3, albums.size());
        assertEquals(tempDir.toAbsolutePath().normalize().toString(), albums.get(0).path());
        assertEquals("camera", albums.get(1).name());
        assertEquals("Screenshots", albums.get(2).name());
    }

    @Test
    void listsSupportedFilesNewestFirstWithStableIds() throws Exception {
        Path camera = tempDir.resolve("Camera");
        MediaFixtures.touch(MediaFixtures.jpeg(camera, "old.jpg"), BASE);
        MediaFixtures.touch(MediaFixtures.jpeg(camera, "new.jpg"), BASE.plusSeconds(60));
        MediaFixtures.touch(MediaFixtures.write(camera, "clip.mp4", MediaFixtures.MP4_BYTES), BASE.plusSeconds(30));
        Files.writeString(camera.resolve("notes.txt"), "not media");
        MediaFixtures.jpeg(camera, ".hidden.jpg");

        DirectoryMediaIndex index = new DirectoryMediaIndex(List.of(tempDir));
        AssetAlbum album = albumNamed(index, "Camera");

        List<RawAssetHandle> assets = index.listAssets(album, ANY, 0, 10);

        assertEquals(List.of("new.jpg", "clip.mp4", "old.jpg"), assets.stream().map(RawAssetHandle::title).toList());
        assertEquals(MediaKind.VIDEO, assets.get(1).kind());
        assertEquals(BASE.plusSeconds(60), assets.get(0).creationTime());

        RawAssetHandle fromRoot = index.listAssets(index.listAlbums(ANY).get(0), ANY, 0, 10).get(0);
        assertEquals(assets.get(0).id(), fromRoot.id());
    }

    @Test
    void appliesFilterAndPaging() throws Exception {
        Path camera = tempDir.resolve("Camera");
        for (int i = 0; i < 5; i++) {
            MediaFixtures.touch(MediaFixtures.jpeg(camera, "p" + i + ".jpg"), BASE.plusSeconds(i * 3600L));
        }
        MediaFixtures.touch(MediaFixtures.write(camera, "v.mp4", MediaFixtures.MP4_BYTES), BASE);

        DirectoryMediaIndex index = new DirectoryMediaIndex(List.of(camera));
        AssetAlbum album = index.listAlbums(ANY).get(0);
        AssetFilter photosInWindow = new AssetFilter(
            new DateRange(BASE.plusSeconds(3600), BASE.plusSeconds(3 * 3600)), MediaKind.PHOTO, Duration.ofMinutes(15));

        assertEquals(List.of("p3.jpg", "p2.jpg", "p1.jpg"),
            index.listAssets(album, photosInWindow, 0, 10).stream().map(RawAssetHandle::title).toList());
        assertEquals(List.of("p1.jpg"),
            index.listAssets(album, photosInWindow, 2, 10).stream().map(RawAssetHandle::title).toList());
        assertTrue(index.listAssets(album, photosInWindow, 5, 10).isEmpty());
    }

    @Test
    void readsPhotoDimensions() throws Exception {
        Path camera = Files.createDirectories(tempDir.resolve("Camera"));
        ImageIO.write(new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB), "png", camera.resolve("tiny.png").toFile());

        DirectoryMediaIndex index = new DirectoryMediaIndex(List.of(camera));
        RawAssetHandle handle = index.listAssets(index.listAlbums(ANY).get(0), ANY, 0, 1).get(0);

        assertEquals(3, handle.width());
        assertEquals(2, handle.height());
    }

    @Test
    void readsVideoLengthAndDropsVideosOverTheCap() throws Exception {
        Path camera = tempDir.resolve("Camera");
        MediaFixtures.touch(MediaFixtures.mp4(camera, "lecture.mp4", Duration.ofMinutes(40)), BASE.plusSeconds(60));
        MediaFixtures.touch(MediaFixtures.mp4(camera, "clip.mp4", Duration.ofSeconds(30)), BASE);

        DirectoryMediaIndex index = new DirectoryMediaIndex(List.of(camera));
        List<RawAssetHandle> assets = index.listAssets(index.listAlbums(ANY).get(0), ANY, 0, 10);

        assertEquals(List.of("clip.mp4"), assets.stream().map(RawAssetHandle::title).toList());
        assertEquals(Duration.ofSeconds(30), assets.get(0).duration());

        AssetFilter longer = AssetFilter.unrestricted(Duration.ofHours(1));
        List<RawAssetHandle> all = index.listAssets(index.listAlbums(longer).get(0), longer, 0, 10);
        assertEquals(Duration.ofMinutes(40), all.get(0).duration());
    }

    @Test
    void scannerOverFoldersSkipsOverlongVideos() throws Exception {
        Path camera = tempDir.resolve("Camera");
        MediaFixtures.touch(MediaFixtures.mp4(camera, "movie.mp4", Duration.ofMinutes(40)), BASE.plusSeconds(120));
        MediaFixtures.touch(MediaFixtures.jpeg(camera, "still.jpg"), BASE.plusSeconds(60));
        MediaFixtures.touch(MediaFixtures.mp4(camera, "short.mp4", Duration.ofSeconds(12)), BASE);

        List<RawAssetHandle> scanned = new AssetScanner(new DirectoryMediaIndex(List.of(tempDir)), 100)
            .scan(ScanScope.allAlbums(), ANY);

        assertFalse(scanned.stream().anyMatch(handle -> handle.title().equals("movie.mp4")));
        assertTrue(scanned.stream().anyMatch(handle -> handle.title().equals("short.mp4")));
        assertTrue(scanned.stream().allMatch(handle -> handle.duration().compareTo(Duration.ofMinutes(15)) <= 0));
    }

    @Test
    void photoWithoutEmbeddedMetadataHasNoLocationOrOrientation() throws Exception {
        Path camera = tempDir.resolve("Camera");
        MediaFixtures.jpeg(camera, "plain.jpg");

        DirectoryMediaIndex index = new DirectoryMediaIndex(List.of(camera));
        RawAssetHandle handle = index.listAssets(index.listAlbums(ANY).get(0), ANY, 0, 1).get(0);

        assertTrue(handle.optionalLocation().isEmpty());
        assertEquals(0, handle.orientation());
        assertEquals(Duration.ZERO, handle.duration());
    }

    @Test
    void resolvesFileFromHandle() throws Exception {
        Path file = MediaFixtures.jpeg(tempDir.resolve("Camera"), "a.jpg");
        DirectoryMediaIndex index = new DirectoryMediaIndex(List.of(tempDir));
        RawAssetHandle handle = index.listAssets(albumNamed(index, "Camera"), ANY, 0, 1).get(0);

        assertEquals(Optional.of(file.toAbsolutePath()), index.resolveFile(handle).map(Path::toAbsolutePath));

        Files.delete(file);
        assertTrue(index.resolveFile(handle).isEmpty());
    }

    @Test
    void missingRootsAreSkippedAndVanishedAlbumsFail() throws Exception {
        Path missing = tempDir.resolve("gone");
        DirectoryMediaIndex index = new DirectoryMediaIndex(List.of(missing));

        assertFalse(index.isAvailable());
        assertTrue(index.listAlbums(ANY).isEmpty());

        AssetAlbum stale = new AssetAlbum("x", "gone", missing.toString());
        assertThrows(MediaIndexException.class, () -> index.listAssets(stale, ANY, 0, 10));
    }

    private static AssetAlbum albumNamed(DirectoryMediaIndex index, String name) throws MediaIndexException {
        return index.listAlbums(ANY).stream()
            .filter(album -> album.name().equals(name))
            .findFirst()
            .orElseThrow();
    }
}
