package com.phillippitts.dictation.service.stt.local.whisper;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Extracts the transcript from a whisper.cpp server {@code response_format=json} body.
 * Safe against malformed input: falls back to empty text.
 */
final class WhisperJsonParser {

    private WhisperJsonParser() {}

    /**
     * @param json server response
     * @return top-level {@code text}, or the joined segment texts, trimmed; empty on malformed input
     */
    static String extractText(String json) {
        if (json == null || json.isBlank()) {
            return "";
        }
        try {
            JSONObject obj = new JSONObject(json);

            // Prefer top-level text if present
            if (obj.has("text")) {
                return obj.optString("text", "").trim();
            }

            JSONArray segs = obj.optJSONArray("segments");
            if (segs == null) {
                return "";
            }
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < segs.length(); i++) {
                JSONObject seg = segs.optJSONObject(i);
                if (seg == null) {
                    continue;
                }
                String t = seg.optString("text", "").trim();
                if (!t.isEmpty()) {
                    if (sb.length() > 0) {
                        sb.append(' ');
                    }
                    sb.append(t);
                }
            }
            return sb.toString();
        } catch (JSONException e) {
            return "";
        }
    }

    /**
     * @return true if the body parses as a JSON object
     */
    static boolean isJsonObject(String json) {
        if (json == null || json.isBlank()) {
            return false;
        }
        try {
            new JSONObject(json);
            return true;
        } catch (JSONException e) {
            return false;
        }
    }
}
