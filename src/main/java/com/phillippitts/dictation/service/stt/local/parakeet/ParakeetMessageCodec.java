package com.phillippitts.dictation.service.stt.local.parakeet;

import org.json.JSONException;
import org.json.JSONObject;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Wire format of the sherpa-onnx offline WebSocket server.
 *
 * <p>Request: one binary message {@code [int32LE sampleRate][int32LE byteLength][float32LE samples]}.
 * Response: one text message, JSON with a {@code text} field (older builds answer plain text).
 */
final class ParakeetMessageCodec {

    /** Text message telling the server the client is done with the connection. */
    static final String DONE = "Done";

    private static final int HEADER_BYTES = 8;

    private ParakeetMessageCodec() {}

    static byte[] encode(int sampleRate, byte[] float32Samples) {
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + float32Samples.length).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(sampleRate);
        buffer.putInt(float32Samples.length);
        buffer.put(float32Samples);
        return buffer.array();
    }

    /**
     * @return the {@code text} field of a JSON response, or the raw response, trimmed
     */
    static String decodeText(String response) {
        if (response == null || response.isBlank()) {
            return "";
        }
        try {
            return new JSONObject(response).optString("text", "").trim();
        } catch (JSONException e) {
            return response.trim();
        }
    }
}
