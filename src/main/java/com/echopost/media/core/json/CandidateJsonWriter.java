package com.echopost.media.core.json;

import com.echopost.media.core.model.CandidateRecord;
import com.echopost.media.core.model.DeviceMetadata;
import com.echopost.media.core.model.ValidationResult;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Serializes candidates and validation outcomes for the selection layer.
 */
public final class CandidateJsonWriter {

    private CandidateJsonWriter() {
    }

    public static JSONArray toJson(List<CandidateRecord> records) {
        JSONArray array = new JSONArray();
        for (CandidateRecord record : records) {
            array.put(toJson(record));
        }
        return array;
    }

    public static JSONObject toJson(CandidateRecord record) {
        DeviceMetadata meta = record.deviceMetadata();
        JSONObject metadata = new JSONObject();
        metadata.put("creation_time", meta.creationTime().toString());
        metadata.put("latitude", nullable(meta.latitude()));
        metadata.put("longitude", nullable(meta.longitude()));
        metadata.put("width", meta.width());
        metadata.put("height", meta.height());
        metadata.put("file_size_bytes", meta.fileSizeBytes());
        metadata.put("duration", nullable(meta.durationSeconds()));
        metadata.put("orientation", meta.orientation());

        JSONObject json = new JSONObject();
        json.put("id", record.id());
        json.put("file_uri", record.fileUri());
        json.put("mime_type", record.mimeType());
        json.put("device_metadata", metadata);
        return json;
    }

    public static JSONObject toJson(ValidationResult result) {
        JSONObject json = new JSONObject();
        json.put("is_valid", result.isValid());
        json.put("original_uri", result.originalUri());
        json.put("effective_uri", result.effectiveUri());
        json.put("failure_reason", result.failureReason() == null ? JSONObject.NULL : result.failureReason().label());
        json.put("recovery_method", result.recoveryMethod() == null ? JSONObject.NULL : result.recoveryMethod().name());
        return json;
    }

    private static Object nullable(Object value) {
        return value == null ? JSONObject.NULL : value;
    }
}
