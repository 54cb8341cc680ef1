package com.echopost.media.core.source;

import com.echopost.media.core.format.FormatClassifier;
import com.echopost.media.core.format.FormatVerdict;
import com.echopost.media.core.model.AssetAlbum;
import com.echopost.media.core.model.MediaKind;
import com.echopost.media.core.model.RawAssetHandle;
import com.echopost.media.logging.AppLogger;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Device-backed index over plain folders. Each configured root and each of its
 * immediate sub-directories is exposed as an album, so an asset can appear in
 * more than one album; its id is derived from the real path and stays stable.
 * Video length, GPS position and orientation come from the file's embedded metadata.
 */
public final class DirectoryMediaIndex implements MediaIndex {

    private static final Logger LOGGER = AppLogger.get();
    private static final int DEFAULT_SCAN_DEPTH = 4;

    private final List<Path> roots;
    private final int maxDepth;

    public DirectoryMediaIndex(List<Path> roots) {
        this(roots, DEFAULT_SCAN_DEPTH);
    }

    public DirectoryMediaIndex(List<Path> roots, int maxDepth) {
        this.roots = List.copyOf(roots);
        this.maxDepth = Math.max(1, maxDepth);
    }

    @Override
    public boolean isAvailable() {
        return roots.stream().anyMatch(Files::isDirectory);
    }

    @Override
    public List<AssetAlbum> listAlbums(AssetFilter filter) throws MediaIndexException {
        List<AssetAlbum> albums = new ArrayList<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                LOGGER.fine(() -> "Skipping missing media root " + root);
                continue;
            }
            albums.add(toAlbum(root));
            File[] subs = root.toFile().listFiles(File::isDirectory);
            if (subs == null) {
                throw new MediaIndexException("Cannot list media root " + root);
            }
            List<File> children = new ArrayList<>(List.of(subs));
            children.sort(Comparator.comparing(File::getName, String.CASE_INSENSITIVE_ORDER));
            for (File sub : children) {
                if (!isHidden(sub.getName())) {
                    albums.add(toAlbum(sub.toPath()));
                }
            }
        }
        return albums;
    }

    @Override
    public List<RawAssetHandle> listAssets(AssetAlbum album, AssetFilter filter, int start, int end)
        throws MediaIndexException {
        if (album.path() == null) {
            return List.of();
        }
        Path dir = Path.of(album.path());
        List<IndexedFile> files = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(dir, maxDepth)) {
            Iterator<Path> it = stream.filter(Files::isRegularFile).iterator();
            while (it.hasNext()) {
                Path file = it.next();
                if (isHidden(file.getFileName().toString())) {
                    continue;
                }
                FormatVerdict verdict = FormatClassifier.classify(file.getFileName().toString());
                if (!verdict.supported()) {
                    continue;
                }
                IndexedFile indexed = IndexedFile.read(file, verdict.kind());
                if (indexed != null && indexed.passes(filter)) {
                    files.add(indexed);
                }
            }
        } catch (IOException | UncheckedIOException e) {
            throw new MediaIndexException("Failed to enumerate album " + album.name(), e);
        }

        files.sort(Comparator.comparing(IndexedFile::creationTime).reversed());
        int from = Math.min(Math.max(0, start), files.size());
        int to = Math.min(Math.max(from, end), files.size());

        List<RawAssetHandle> page = new ArrayList<>(to - from);
        for (IndexedFile file : files.subList(from, to)) {
            try {
                page.add(file.toHandle());
            } catch (IOException e) {
                throw new MediaIndexException("Failed to read asset " + file.path(), e);
            }
        }
        return page;
    }

    @Override
    public Optional<Path> resolveFile(RawAssetHandle handle) {
        if (handle.relativePath() == null || handle.title().isEmpty()) {
            return Optional.empty();
        }
        Path file = Path.of(handle.relativePath()).resolve(handle.title());
        return Files.isRegularFile(file) ? Optional.of(file) : Optional.empty();
    }

    private static AssetAlbum toAlbum(Path dir) {
        Path absolute = dir.toAbsolutePath().normalize();
        Path name = absolute.getFileName();
        return new AssetAlbum(absolute.toString(), name == null ? absolute.toString() : name.toString(), absolute.toString());
    }

    private static boolean isHidden(String name) {
        return name.startsWith(".") || name.equalsIgnoreCase("__MACOSX");
    }

    private static String stableId(Path file) throws IOException {
        String real = file.toRealPath().toString();
        return UUID.nameUUIDFromBytes(real.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static int[] readDimensions(Path file) {
        try (ImageInputStream in = ImageIO.createImageInputStream(file.toFile())) {
            if (in == null) {
                return new int[]{0, 0};
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return new int[]{0, 0};
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                return new int[]{reader.getWidth(0), reader.getHeight(0)};
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.FINE, e, () -> "Could not read dimensions of " + file);
            return new int[]{0, 0};
        }
    }

    /**
     * @param embedded metadata read while filtering; {@code null} for photos until a handle is built
     */
    private record IndexedFile(Path path, MediaKind kind, Instant creationTime, EmbeddedMetadata embedded) {

        static IndexedFile read(Path file, MediaKind kind) {
            try {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                Instant created = attrs.creationTime().toInstant();
                Instant modified = attrs.lastModifiedTime().toInstant();
                // some file systems report the epoch or the copy time as creation time
                Instant effective = created.equals(Instant.EPOCH) || created.isAfter(modified) ? modified : created;
                EmbeddedMetadata embedded = kind == MediaKind.VIDEO ? EmbeddedMetadataReader.read(file) : null;
                return new IndexedFile(file, kind, effective, embedded);
            } catch (IOException e) {
                LOGGER.log(Level.FINE, e, () -> "Skipping unreadable media file " + file);
                return null;
            }
        }

        boolean passes(AssetFilter filter) {
            if (filter.kind() != null && filter.kind() != kind) {
                return false;
            }
            if (filter.dateRange() != null && !filter.dateRange().contains(creationTime)) {
                return false;
            }
            return embedded == null || embedded.duration().compareTo(filter.maxVideoDuration()) <= 0;
        }

        RawAssetHandle toHandle() throws IOException {
            int[] dims = kind == MediaKind.PHOTO ? readDimensions(path) : new int[]{0, 0};
            EmbeddedMetadata metadata = embedded != null ? embedded : EmbeddedMetadataReader.read(path);
            Path parent = path.toAbsolutePath().getParent();
            return new RawAssetHandle(
                stableId(path),
                kind,
                creationTime,
                metadata.location(),
                dims[0],
                dims[1],
                metadata.duration(),
                metadata.orientation(),
                path.getFileName().toString(),
                parent == null ? null : parent.toString()
            );
        }
    }
}
