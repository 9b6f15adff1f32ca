package com.phillippitts.dictation.service.stt.streaming;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Locale;
import java.util.Optional;

/**
 * Parses streaming endpoint messages and builds the client control messages.
 * Malformed input is logged and dropped.
 */
final class StreamingMessageParser {

    private static final Logger LOG = LogManager.getLogger(StreamingMessageParser.class);

    static final String KEEP_ALIVE = new JSONObject().put("type", "KeepAlive").toString();
    static final String FINALIZE = new JSONObject().put("type", "Finalize").toString();
    static final String CLOSE_STREAM = new JSONObject().put("type", "CloseStream").toString();

    private StreamingMessageParser() {}

    static Optional<ServerMessage> parse(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JSONObject obj = new JSONObject(json);
            String type = obj.optString("type", "");
            switch (type) {
                case "Results":
                    return Optional.of(new ServerMessage(ServerMessage.Type.RESULTS, firstTranscript(obj),
                            obj.optBoolean("is_final", false), obj.optBoolean("from_finalize", false),
                            null, ""));
                case "Metadata":
                    return Optional.of(new ServerMessage(ServerMessage.Type.METADATA, "", false, false,
                            obj.optString("request_id", null), ""));
                case "SpeechStarted":
                    return Optional.of(simple(ServerMessage.Type.SPEECH_STARTED));
                case "UtteranceEnd":
                    return Optional.of(simple(ServerMessage.Type.UTTERANCE_END));
                case "Error":
                    String description = obj.optString("description", "");
                    if (description.isBlank()) {
                        description = obj.optString("message", "Streaming server error");
                    }
                    return Optional.of(new ServerMessage(ServerMessage.Type.ERROR, "", false, false,
                            null, description));
                default:
                    return Optional.of(simple(ServerMessage.Type.UNKNOWN));
            }
        } catch (JSONException e) {
            LOG.warn("Dropping malformed streaming message ({} chars): {}", json.length(), e.getMessage());
            return Optional.empty();
        }
    }

    private static String firstTranscript(JSONObject obj) {
        JSONObject channel = obj.optJSONObject("channel");
        if (channel == null) {
            return "";
        }
        JSONArray alternatives = channel.optJSONArray("alternatives");
        if (alternatives == null || alternatives.isEmpty()) {
            return "";
        }
        JSONObject first = alternatives.optJSONObject(0);
        return first == null ? "" : first.optString("transcript", "");
    }

    private static ServerMessage simple(ServerMessage.Type type) {
        return new ServerMessage(type, "", false, false, null, "");
    }

    /**
     * @return true if an error description indicates a rejected credential
     */
    static boolean isAuthenticationError(String description) {
        if (description == null) {
            return false;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        return lower.contains("401") || lower.contains("unauthorized") || lower.contains("invalid credentials")
                || lower.contains("token expired");
    }
}
