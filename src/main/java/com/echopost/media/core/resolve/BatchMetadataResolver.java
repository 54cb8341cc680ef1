package com.echopost.media.core.resolve;

import com.echopost.media.config.EngineSettings;
import com.echopost.media.core.concurrent.BatchListener;
import com.echopost.media.core.concurrent.BoundedBatchRunner;
import com.echopost.media.core.format.FormatClassifier;
import com.echopost.media.core.format.FormatVerdict;
import com.echopost.media.core.model.CandidateRecord;
import com.echopost.media.core.model.RawAssetHandle;
import com.echopost.media.core.source.MediaFileSystem;
import com.echopost.media.core.source.MediaIndex;
import com.echopost.media.core.source.MediaUris;
import com.echopost.media.logging.AppLogger;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Turns raw asset handles into {@link CandidateRecord}s. Items are resolved in
 * sequential batches with a per-item timeout; any item that fails, times out,
 * is empty or has an unsupported format is left out. {@link #resolve} never throws.
 */
public final class BatchMetadataResolver {

    private static final Logger LOGGER = AppLogger.get();

    private final MediaIndex index;
    private final MediaFileSystem fileSystem;
    private final BoundedBatchRunner runner;
    private final boolean placeholderFallback;

    public BatchMetadataResolver(MediaIndex index, MediaFileSystem fileSystem, EngineSettings settings) {
        this.index = Objects.requireNonNull(index, "index");
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
        this.runner = new BoundedBatchRunner(settings.batchSize(), settings.itemTimeout(), "media-resolve");
        this.placeholderFallback = settings.placeholderFallback();
    }

    public List<CandidateRecord> resolve(List<RawAssetHandle> handles) {
        return resolve(handles, BatchListener.NONE);
    }

    public List<CandidateRecord> resolve(List<RawAssetHandle> handles, BatchListener listener) {
        if (handles == null || handles.isEmpty()) {
            return List.of();
        }
        List<CandidateRecord> records = runner.run(handles, this::resolveItem, (handle, cause) -> {
            LOGGER.fine(() -> "Dropping asset " + handle.id() + ": " + cause);
            return Optional.empty();
        }, listener);
        LOGGER.info("Resolved " + records.size() + " of " + handles.size() + " assets");
        return records;
    }

    Optional<CandidateRecord> resolveItem(RawAssetHandle handle) throws IOException {
        Optional<Path> file = index.resolveFile(handle);
        if (file.isEmpty()) {
            return placeholderFallback ? placeholder(handle) : Optional.empty();
        }
        Path path = file.get();
        Path name = path.getFileName();
        FormatVerdict verdict = FormatClassifier.classify(name == null ? path.toString() : name.toString());
        if (!verdict.supported()) {
            LOGGER.fine(() -> "Unsupported format for asset " + handle.id() + ": " + path);
            return Optional.empty();
        }
        if (!fileSystem.exists(path) || !fileSystem.isReadable(path)) {
            LOGGER.fine(() -> "Asset file not readable: " + path);
            return Optional.empty();
        }
        long size = fileSystem.size(path);
        if (size <= 0) {
            LOGGER.fine(() -> "Asset file is empty: " + path);
            return Optional.empty();
        }
        return Optional.of(CandidateRecord.of(handle, MediaUris.toUri(path), verdict.mimeType(), size));
    }

    /**
     * Best-effort record for an asset whose file the index would not hand out.
     * The synthesized path may not exist, so the size is reported as 0.
     */
    private Optional<CandidateRecord> placeholder(RawAssetHandle handle) {
        String name = handle.title().isEmpty() ? handle.id() : handle.title();
        FormatVerdict verdict = FormatClassifier.classify(name);
        if (!verdict.supported()) {
            return Optional.empty();
        }
        try {
            Path synthesized = handle.relativePath() == null
                ? Path.of(name)
                : Path.of(handle.relativePath()).resolve(name);
            LOGGER.fine(() -> "No file for asset " + handle.id() + "; using placeholder " + synthesized);
            return Optional.of(CandidateRecord.of(handle, MediaUris.toUri(synthesized), verdict.mimeType(), 0));
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }
}
