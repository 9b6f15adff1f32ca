package com.phillippitts.dictation.service.stt.streaming;

/**
 * A decoded message from the streaming endpoint. Fields not carried by the message type are
 * empty or false.
 *
 * @param type         message kind
 * @param transcript   first alternative's transcript (Results only)
 * @param isFinal      whether the segment is final (Results only)
 * @param fromFinalize whether the final was forced by a Finalize request (Results only)
 * @param requestId    server session id (Metadata only, may be null)
 * @param description  error description (Error only)
 */
record ServerMessage(
        Type type,
        String transcript,
        boolean isFinal,
        boolean fromFinalize,
        String requestId,
        String description
) {

    enum Type {
        METADATA,
        RESULTS,
        SPEECH_STARTED,
        UTTERANCE_END,
        ERROR,
        UNKNOWN
    }

    /**
     * @return true for messages that prove the server is decoding audio on this socket
     */
    boolean isTranscriptBearing() {
        return type == Type.RESULTS;
    }
}
