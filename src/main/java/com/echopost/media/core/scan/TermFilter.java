package com.echopost.media.core.scan;

import com.echopost.media.core.model.RawAssetHandle;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keeps assets whose title contains any search term, or the whole original query,
 * ignoring case. Plain substring matching; no tokenizing.
 */
public final class TermFilter {

    private TermFilter() {
    }

    public static List<RawAssetHandle> filter(List<RawAssetHandle> handles, List<String> terms, String originalQuery) {
        List<String> needles = normalizedTerms(terms);
        if (needles.isEmpty()) {
            return handles;
        }
        String phrase = originalQuery == null ? "" : originalQuery.trim().toLowerCase(Locale.ROOT);

        List<RawAssetHandle> kept = new ArrayList<>();
        for (RawAssetHandle handle : handles) {
            if (matches(handle.title().toLowerCase(Locale.ROOT), needles, phrase)) {
                kept.add(handle);
            }
        }
        return kept;
    }

    private static boolean matches(String title, List<String> needles, String phrase) {
        for (String needle : needles) {
            if (title.contains(needle)) {
                return true;
            }
        }
        return !phrase.isEmpty() && title.contains(phrase);
    }

    // blank terms would match every title
    private static List<String> normalizedTerms(List<String> terms) {
        List<String> out = new ArrayList<>();
        if (terms == null) {
            return out;
        }
        for (String term : terms) {
            if (term != null && !term.isBlank()) {
                out.add(term.trim().toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }
}
