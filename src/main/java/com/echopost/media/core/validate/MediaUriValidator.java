package com.echopost.media.core.validate;

import com.echopost.media.config.EngineSettings;
import com.echopost.media.core.concurrent.BatchListener;
import com.echopost.media.core.concurrent.BoundedBatchRunner;
import com.echopost.media.core.format.FormatClassifier;
import com.echopost.media.core.format.FormatVerdict;
import com.echopost.media.core.format.MediaHeaderInspector;
import com.echopost.media.core.model.CandidateRecord;
import com.echopost.media.core.model.FailureReason;
import com.echopost.media.core.model.MediaKind;
import com.echopost.media.core.model.RawAssetHandle;
import com.echopost.media.core.model.RecoveryMethod;
import com.echopost.media.core.model.ValidationResult;
import com.echopost.media.core.scan.AssetDeduplicator;
import com.echopost.media.core.scan.AssetScanner;
import com.echopost.media.core.scan.ScanScope;
import com.echopost.media.core.source.AssetFilter;
import com.echopost.media.core.source.MediaFileSystem;
import com.echopost.media.core.source.MediaIndex;
import com.echopost.media.core.source.MediaUris;
import com.echopost.media.logging.AppLogger;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Confirms that a stored media reference still points at a live, readable,
 * non-empty file of a supported format, and tries to relocate it through the
 * media index when it does not. Holds no state between calls.
 */
public final class MediaUriValidator {

    private static final Logger LOGGER = AppLogger.get();

    private static final Pattern COUNTER_SUFFIX = Pattern.compile("(_\\d{1,2}|\\s*\\(\\d+\\))$");
    private static final Pattern COPY_SUFFIX = Pattern.compile("(_copy|\\s+copy)$", Pattern.CASE_INSENSITIVE);
    // camera prefixes such as IMG or DSC alone do not identify a file
    private static final int MIN_PATTERN_LENGTH = 4;

    private final MediaIndex index;
    private final MediaFileSystem fileSystem;
    private final AssetScanner scanner;
    private final BoundedBatchRunner runner;
    private final Duration maxVideoDuration;
    private final boolean verifyImageHeaders;
    private final boolean recoveryEnabled;

    public MediaUriValidator(MediaIndex index, MediaFileSystem fileSystem, EngineSettings settings) {
        this.index = Objects.requireNonNull(index, "index");
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
        this.scanner = new AssetScanner(index, settings.albumPageSize());
        this.runner = new BoundedBatchRunner(settings.batchSize(), settings.itemTimeout(), "media-validate");
        this.maxVideoDuration = settings.maxVideoDuration();
        this.verifyImageHeaders = settings.verifyImageHeaders();
        this.recoveryEnabled = settings.recoveryEnabled();
    }

    public ValidationResult validate(String uri) {
        return validate(uri, null);
    }

    /**
     * Validates a previously produced record. Its creation time and size enable
     * metadata-based recovery in addition to file-name matching.
     */
    public ValidationResult validate(CandidateRecord previous) {
        return validate(previous.fileUri(), previous);
    }

    /**
     * Validates references in bounded batches. Results follow input order; a
     * reference whose validation times out is reported as not found.
     */
    public List<ValidationResult> validateAll(List<String> uris) {
        return runner.run(uris,
            uri -> Optional.of(validate(uri)),
            (uri, cause) -> Optional.of(ValidationResult.failed(uri, FailureReason.NOT_FOUND)),
            BatchListener.NONE);
    }

    /**
     * Keeps only records that still validate, rewritten to their effective URI.
     */
    public List<CandidateRecord> retainValid(List<CandidateRecord> records) {
        List<CandidateRecord> kept = runner.run(records, record -> {
            ValidationResult result = validate(record);
            if (!result.isValid()) {
                LOGGER.fine(() -> "Dropping " + record.fileUri() + ": " + result.failureReason());
                return Optional.empty();
            }
            return Optional.of(result.wasRecovered() ? record.withFileUri(result.effectiveUri()) : record);
        });
        if (kept.size() < records.size()) {
            LOGGER.info("Validation removed " + (records.size() - kept.size()) + " of " + records.size() + " candidates");
        }
        return kept;
    }

    private ValidationResult validate(String uri, CandidateRecord previous) {
        Optional<Path> parsed = MediaUris.toPath(uri);
        if (parsed.isEmpty()) {
            LOGGER.fine(() -> "Unparseable media reference: " + uri);
            return ValidationResult.failed(String.valueOf(uri), FailureReason.NOT_FOUND);
        }
        Path path = parsed.get();
        try {
            if (fileSystem.exists(path)) {
                return inspect(path)
                    .map(reason -> ValidationResult.failed(uri, reason))
                    .orElseGet(() -> ValidationResult.live(uri));
            }
            if (!recoveryEnabled) {
                return ValidationResult.failed(uri, FailureReason.NOT_FOUND);
            }
            return recover(uri, path, previous);
        } catch (AccessDeniedException | SecurityException e) {
            return ValidationResult.failed(uri, FailureReason.PERMISSION_DENIED);
        } catch (IOException e) {
            LOGGER.fine(() -> "I/O error validating " + uri + ": " + e.getMessage());
            return ValidationResult.failed(uri, FailureReason.NOT_FOUND);
        }
    }

    /**
     * @return the reason the live file cannot be used, or empty when it is fine
     */
    private Optional<FailureReason> inspect(Path path) throws IOException {
        if (!fileSystem.isReadable(path)) {
            return Optional.of(FailureReason.PERMISSION_DENIED);
        }
        if (fileSystem.size(path) <= 0) {
            return Optional.of(FailureReason.EMPTY);
        }
        FormatVerdict verdict = FormatClassifier.classify(fileNameOf(path));
        if (!verdict.supported()) {
            return Optional.of(FailureReason.UNSUPPORTED);
        }
        if (verifyImageHeaders && verdict.kind() == MediaKind.PHOTO) {
            byte[] header = fileSystem.readHeader(path, MediaHeaderInspector.HEADER_LENGTH);
            if (!MediaHeaderInspector.matches(header, verdict.mimeType())) {
                return Optional.of(FailureReason.UNSUPPORTED);
            }
        }
        return Optional.empty();
    }

    private ValidationResult recover(String uri, Path missing, CandidateRecord previous) {
        String fileName = fileNameOf(missing);
        List<RawAssetHandle> assets = AssetDeduplicator.dedupe(
            scanner.scan(ScanScope.allAlbums(), AssetFilter.unrestricted(maxVideoDuration)));
        if (assets.isEmpty()) {
            return ValidationResult.failed(uri, FailureReason.NOT_FOUND);
        }

        Optional<ValidationResult> found = attempt(uri, assets, RecoveryMethod.EXACT_FILENAME,
            handle -> handle.title().equals(fileName), null);
        if (found.isEmpty()) {
            found = attempt(uri, assets, RecoveryMethod.FILENAME_PATTERN, patternMatcher(fileName), null);
        }
        if (found.isEmpty() && previous != null) {
            found = attempt(uri, assets, RecoveryMethod.METADATA,
                handle -> handle.creationTime().equals(previous.deviceMetadata().creationTime()),
                previous.deviceMetadata().fileSizeBytes());
        }
        return found.orElseGet(() -> {
            LOGGER.fine(() -> "No recovery candidate for " + uri);
            return ValidationResult.failed(uri, FailureReason.NOT_FOUND);
        });
    }

    /**
     * First asset accepted by {@code matcher} whose file resolves and is usable.
     * An unsupported match ends the search with {@link FailureReason#UNSUPPORTED};
     * a candidate that cannot be read is skipped.
     */
    private Optional<ValidationResult> attempt(String uri,
                                               List<RawAssetHandle> assets,
                                               RecoveryMethod method,
                                               Predicate<RawAssetHandle> matcher,
                                               Long expectedSize) {
        for (RawAssetHandle handle : assets) {
            if (!matcher.test(handle)) {
                continue;
            }
            try {
                Optional<Path> file = index.resolveFile(handle);
                if (file.isEmpty() || !fileSystem.exists(file.get())) {
                    continue;
                }
                Path candidate = file.get();
                if (expectedSize != null && fileSystem.size(candidate) != expectedSize) {
                    continue;
                }
                Optional<FailureReason> problem = inspect(candidate);
                if (problem.isPresent()) {
                    if (problem.get() == FailureReason.UNSUPPORTED) {
                        return Optional.of(ValidationResult.failed(uri, FailureReason.UNSUPPORTED));
                    }
                    continue;
                }
                String recovered = MediaUris.toUri(candidate);
                LOGGER.info("Recovered " + uri + " as " + recovered + " (" + method + ")");
                return Optional.of(ValidationResult.recovered(uri, recovered, method));
            } catch (IOException | SecurityException e) {
                LOGGER.fine(() -> "Skipping recovery candidate " + handle.id() + ": " + e);
            }
        }
        return Optional.empty();
    }

    /**
     * Matches titles that are a copy of the missing file, or of which the missing
     * file is a copy. Two different copies of a third name do not match each other.
     */
    static Predicate<RawAssetHandle> patternMatcher(String fileName) {
        String extension = extensionOf(fileName);
        String base = baseNameOf(fileName).trim().toLowerCase(Locale.ROOT);
        String stripped = stripCopySuffix(base);
        if (stripped.length() < MIN_PATTERN_LENGTH) {
            return handle -> false;
        }
        return handle -> {
            String title = handle.title();
            if (title.equals(fileName) || !extensionOf(title).equals(extension)) {
                return false;
            }
            String candidate = baseNameOf(title).trim().toLowerCase(Locale.ROOT);
            return stripped.equals(candidate) || stripCopySuffix(candidate).equals(base);
        };
    }

    /**
     * Removes one duplicate counter ({@code _1}, {@code (2)}) and one copy marker
     * ({@code _copy}, {@code " Copy"}) from the end of a base name.
     */
    static String stripCopySuffix(String baseName) {
        String stripped = COUNTER_SUFFIX.matcher(baseName.trim()).replaceFirst("");
        return COPY_SUFFIX.matcher(stripped).replaceFirst("").trim();
    }

    private static String fileNameOf(Path path) {
        Path name = path.getFileName();
        return name == null ? "" : name.toString();
    }

    private static String baseNameOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
