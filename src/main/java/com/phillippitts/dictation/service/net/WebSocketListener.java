package com.phillippitts.dictation.service.net;

/**
 * Callbacks for one client WebSocket. Invoked on the transport's threads; implementations hand
 * events to their own executor.
 */
public interface WebSocketListener {

    /** A complete text message arrived. */
    void onText(WebSocketChannel channel, String text);

    /** The peer closed the connection (or acknowledged our close). */
    void onClose(WebSocketChannel channel, int statusCode, String reason);

    /** The connection failed after it was opened. */
    void onError(WebSocketChannel channel, Throwable error);
}
