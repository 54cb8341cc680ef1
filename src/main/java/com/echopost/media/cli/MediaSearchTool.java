package com.echopost.media.cli;

import com.echopost.media.MediaResolutionEngine;
import com.echopost.media.config.EngineSettings;
import com.echopost.media.config.PreferencesDirectorySource;
import com.echopost.media.core.json.CandidateJsonWriter;
import com.echopost.media.core.json.MediaQueryJsonReader;
import com.echopost.media.core.model.CandidateRecord;
import com.echopost.media.core.model.MediaQuery;
import com.echopost.media.core.source.DirectoryMediaIndex;
import com.echopost.media.core.source.DirectorySource;
import com.echopost.media.core.source.LocalMediaFileSystem;
import com.echopost.media.core.source.MediaIndex;
import com.echopost.media.core.source.UnsupportedMediaIndex;
import com.echopost.media.logging.AppLogger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs a parsed media query against local folders and prints the candidates as JSON.
 * <pre>
 * MediaSearchTool &lt;query.json&gt; &lt;albumRoot&gt;... [--validate] [--use-preferences]
 * </pre>
 */
public final class MediaSearchTool {

    private static final Logger LOGGER = AppLogger.get();

    private MediaSearchTool() {}

    public static void main(String[] args) throws IOException {
        int code = run(args, System.out);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out) throws IOException {
        boolean validate = false;
        boolean usePreferences = false;
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            switch (arg) {
                case "--validate" -> validate = true;
                case "--use-preferences" -> usePreferences = true;
                default -> positional.add(arg);
            }
        }
        if (positional.size() < 2) {
            out.println("usage: MediaSearchTool <query.json> <albumRoot>... [--validate] [--use-preferences]");
            return 2;
        }

        Path queryFile = Path.of(positional.get(0));
        MediaQuery query;
        try {
            query = MediaQueryJsonReader.systemDefault().read(Files.readString(queryFile));
        } catch (IllegalArgumentException e) {
            LOGGER.severe("Invalid query in " + queryFile + ": " + e.getMessage());
            return 1;
        }

        List<Path> roots = new ArrayList<>();
        for (String root : positional.subList(1, positional.size())) {
            roots.add(Path.of(root));
        }

        MediaIndex index = new DirectoryMediaIndex(roots);
        if (!index.isAvailable()) {
            LOGGER.warning("None of the album roots exists: " + roots);
            index = new UnsupportedMediaIndex();
        }
        DirectorySource directories = usePreferences ? PreferencesDirectorySource.global() : DirectorySource.none();
        MediaResolutionEngine engine = new MediaResolutionEngine(
            index,
            new LocalMediaFileSystem(),
            directories,
            EngineSettings.load()
        );

        List<CandidateRecord> candidates = validate
            ? engine.findValidatedCandidates(query)
            : engine.findCandidates(query);
        out.println(CandidateJsonWriter.toJson(candidates).toString(2));
        return 0;
    }
}
