package com.phillippitts.dictation.service.stt.streaming;

import com.phillippitts.dictation.exception.StreamingException;

/**
 * Receives transcript updates from a {@link StreamingSession}. Callbacks run on the session's event
 * loop and must not block.
 */
public interface StreamingListener {

    StreamingListener NOOP = new StreamingListener() {};

    /** Interim hypothesis for the utterance in progress. */
    default void onPartialTranscript(String text) {}

    /** Accumulated final transcript, after a new final segment arrived. */
    default void onFinalTranscript(String accumulatedText) {}

    /** Server-reported or connection-level failure. */
    default void onError(StreamingException error) {}
}
