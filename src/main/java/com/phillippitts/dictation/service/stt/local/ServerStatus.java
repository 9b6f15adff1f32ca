package com.phillippitts.dictation.service.stt.local;

import com.phillippitts.dictation.domain.ServerProcessState;

/**
 * Snapshot of a local inference server for status endpoints and health checks.
 *
 * @param backend         backend id
 * @param binaryAvailable whether the configured CPU binary exists and is executable
 * @param state           lifecycle state
 * @param port            listening port, or -1 when not running
 * @param modelPath       loaded model, or null when not running
 * @param gpu             whether the running process is the GPU binary
 */
public record ServerStatus(
        String backend,
        boolean binaryAvailable,
        ServerProcessState state,
        int port,
        String modelPath,
        boolean gpu
) {}
