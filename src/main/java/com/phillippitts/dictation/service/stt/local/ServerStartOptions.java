package com.phillippitts.dictation.service.stt.local;

/**
 * Per-start parameters of a local inference server. Starting with different options restarts a
 * running server.
 *
 * @param language default language passed on the command line, or null for the configured one
 * @param threads  thread count override; 0 uses the configured value
 */
public record ServerStartOptions(String language, int threads) {

    public ServerStartOptions {
        if (threads < 0) {
            throw new IllegalArgumentException("threads must not be negative, got: " + threads);
        }
    }

    public static ServerStartOptions defaults() {
        return new ServerStartOptions(null, 0);
    }
}
