package com.phillippitts.dictation.service.stt.local;

import com.phillippitts.dictation.exception.ErrorCode;
import com.phillippitts.dictation.exception.TranscriptionExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;

/**
 * Finds a free loopback port in a fixed range by binding a probe socket.
 */
final class PortAllocator {

    private static final Logger LOG = LogManager.getLogger(PortAllocator.class);

    private PortAllocator() {}

    /**
     * @return first port in {@code [start, end]} that can be bound on 127.0.0.1
     * @throws com.phillippitts.dictation.exception.TranscriptionException with
     *         {@link ErrorCode#RESOURCE_EXHAUSTED} when every port is taken
     */
    static int findFreePort(int start, int end, String backend) {
        for (int port = start; port <= end; port++) {
            if (isFree(port)) {
                return port;
            }
            LOG.debug("Port {} in use; trying next", port);
        }
        throw TranscriptionExceptionBuilder.create("No free port in range " + start + "-" + end)
                .backend(backend)
                .errorCode(ErrorCode.RESOURCE_EXHAUSTED)
                .build();
    }

    static boolean isFree(int port) {
        try (ServerSocket socket = new ServerSocket(port, 1, InetAddress.getLoopbackAddress())) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
