package com.echopost.media;

import com.echopost.media.config.EngineSettings;
import com.echopost.media.core.concurrent.BatchListener;
import com.echopost.media.core.model.CandidateRecord;
import com.echopost.media.core.model.DirectoryConfig;
import com.echopost.media.core.model.MediaKind;
import com.echopost.media.core.model.MediaQuery;
import com.echopost.media.core.model.RawAssetHandle;
import com.echopost.media.core.model.ValidationResult;
import com.echopost.media.core.resolve.BatchMetadataResolver;
import com.echopost.media.core.scan.AssetDeduplicator;
import com.echopost.media.core.scan.AssetScanner;
import com.echopost.media.core.scan.ScanScope;
import com.echopost.media.core.scan.TermFilter;
import com.echopost.media.core.source.AssetFilter;
import com.echopost.media.core.source.DirectorySource;
import com.echopost.media.core.source.MediaFileSystem;
import com.echopost.media.core.source.MediaIndex;
import com.echopost.media.core.validate.MediaUriValidator;
import com.echopost.media.logging.AppLogger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the media resolution pipeline:
 * scan, deduplicate, filter by terms, resolve metadata, and optionally validate.
 * <p>
 * Instances are built explicitly from their collaborators and hold no per-query state,
 * so one engine can serve concurrent callers.
 */
public final class MediaResolutionEngine {

    private static final Logger LOGGER = AppLogger.get();

    private final DirectorySource directorySource;
    private final EngineSettings settings;
    private final AssetScanner scanner;
    private final BatchMetadataResolver resolver;
    private final MediaUriValidator validator;

    public MediaResolutionEngine(MediaIndex index,
                                 MediaFileSystem fileSystem,
                                 DirectorySource directorySource,
                                 EngineSettings settings) {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(fileSystem, "fileSystem");
        this.directorySource = Objects.requireNonNull(directorySource, "directorySource");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.scanner = new AssetScanner(index, settings.albumPageSize());
        this.resolver = new BatchMetadataResolver(index, fileSystem, settings);
        this.validator = new MediaUriValidator(index, fileSystem, settings);
    }

    public List<CandidateRecord> findCandidates(MediaQuery query) {
        return findCandidates(query, BatchListener.NONE);
    }

    public List<CandidateRecord> findCandidates(MediaQuery query, BatchListener listener) {
        Objects.requireNonNull(query, "query");
        List<RawAssetHandle> unique = AssetDeduplicator.dedupe(scanner.scan(scopeFor(query), filterFor(query)));
        List<RawAssetHandle> matching = TermFilter.filter(unique, query.terms(), query.originalQuery());
        LOGGER.info("Query '" + query.originalQuery() + "': " + unique.size() + " unique assets, "
            + matching.size() + " after term filter");
        return resolver.resolve(matching, listener);
    }

    /**
     * Like {@link #findCandidates(MediaQuery)} but drops entries whose files no longer validate.
     */
    public List<CandidateRecord> findValidatedCandidates(MediaQuery query) {
        return validator.retainValid(findCandidates(query));
    }

    /**
     * Newest photo in {@code directory}, or across all albums when it is {@code null}.
     */
    public Optional<CandidateRecord> findLatestPhoto(String directory) {
        MediaQuery query = MediaQuery.ofKind(MediaKind.PHOTO).withDirectoryScope(directory);
        List<RawAssetHandle> unique = AssetDeduplicator.dedupe(scanner.scan(scopeFor(query), filterFor(query)));
        // resolve one at a time so an unusable newest file falls through to the next
        for (RawAssetHandle handle : unique) {
            List<CandidateRecord> resolved = resolver.resolve(List.of(handle));
            if (!resolved.isEmpty()) {
                return Optional.of(resolved.get(0));
            }
        }
        return Optional.empty();
    }

    public ValidationResult validate(String uri) {
        return validator.validate(uri);
    }

    public ValidationResult validate(CandidateRecord previous) {
        return validator.validate(previous);
    }

    public List<ValidationResult> validateAll(List<String> uris) {
        return validator.validateAll(uris);
    }

    private ScanScope scopeFor(MediaQuery query) {
        DirectoryConfig directories;
        try {
            directories = directorySource.load();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Directory preferences unavailable; scanning default albums", e);
            directories = DirectoryConfig.disabled();
        }
        return ScanScope.forQuery(query, directories);
    }

    private AssetFilter filterFor(MediaQuery query) {
        return new AssetFilter(query.dateRange(), query.mediaKind(), settings.maxVideoDuration());
    }
}
