package com.echopost.media.core.json;

import com.echopost.media.core.model.DateRange;
import com.echopost.media.core.model.MediaKind;
import com.echopost.media.core.model.MediaQuery;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the query object emitted by the natural-language parser.
 * <p>
 * Dates may be instants, offset date-times, local date-times or plain dates; values
 * without an offset are read in the reader's zone. A plain end date covers that whole day.
 */
public final class MediaQueryJsonReader {

    private final ZoneId zone;

    public MediaQueryJsonReader(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public static MediaQueryJsonReader systemDefault() {
        return new MediaQueryJsonReader(ZoneId.systemDefault());
    }

    public MediaQuery read(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Query JSON is empty");
        }
        try {
            return read(new JSONObject(json));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed query JSON: " + e.getMessage(), e);
        }
    }

    public MediaQuery read(JSONObject root) {
        List<String> terms = readTerms(root.optJSONArray("terms"));
        String originalQuery = root.optString("original_query", "");
        DateRange dateRange = readDateRange(root.optJSONObject("date_range"));
        MediaKind kind = MediaKind.fromLabel(optionalString(root, "media_type")).orElse(null);
        String directory = optionalString(root, "directory");

        if (originalQuery.isEmpty() && !terms.isEmpty()) {
            originalQuery = String.join(" ", terms);
        }
        return new MediaQuery(terms, originalQuery, dateRange, kind, directory);
    }

    private static List<String> readTerms(JSONArray array) {
        List<String> terms = new ArrayList<>();
        if (array == null) {
            return terms;
        }
        for (int i = 0; i < array.length(); i++) {
            String term = array.optString(i, "").trim();
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        return terms;
    }

    private DateRange readDateRange(JSONObject node) {
        if (node == null) {
            return null;
        }
        String start = optionalString(node, "start");
        String end = optionalString(node, "end");
        if (start == null || end == null) {
            throw new IllegalArgumentException("date_range needs both start and end");
        }
        return new DateRange(parseInstant(start, false), parseInstant(end, true));
    }

    Instant parseInstant(String value, boolean endOfRange) {
        String text = value.trim();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            // try the next representation
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the next representation
        }
        try {
            return LocalDateTime.parse(text).atZone(zone).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the next representation
        }
        try {
            LocalDate date = LocalDate.parse(text);
            if (endOfRange) {
                return date.plusDays(1).atStartOfDay(zone).toInstant().minusNanos(1);
            }
            return date.atStartOfDay(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unrecognised date: " + value, e);
        }
    }

    private static String optionalString(JSONObject node, String key) {
        if (!node.has(key) || node.isNull(key)) {
            return null;
        }
        String value = node.optString(key, "").trim();
        return value.isEmpty() ? null : value;
    }
}
