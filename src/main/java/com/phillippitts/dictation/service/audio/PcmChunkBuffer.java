package com.phillippitts.dictation.service.audio;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, bounded list of PCM chunks.
 *
 * <p>Used as the cold-start buffer (audio captured while a socket opens) and as the liveness replay
 * buffer. Unlike a ring buffer it never drops old audio: once full, new chunks are refused and a
 * warning is logged once per fill, so the start of the utterance is preserved.
 */
public final class PcmChunkBuffer {

    private static final Logger LOG = LogManager.getLogger(PcmChunkBuffer.class);

    private final String name;
    private final int capacityBytes;
    private final List<byte[]> chunks = new ArrayList<>();
    private int sizeBytes = 0;
    private boolean overflowLogged = false;

    public PcmChunkBuffer(String name, int capacityBytes) {
        if (capacityBytes <= 0) {
            throw new IllegalArgumentException("capacityBytes must be positive");
        }
        this.name = name;
        this.capacityBytes = capacityBytes;
    }

    /**
     * Appends a chunk if it fits.
     *
     * @return false if the chunk was dropped because the buffer is full
     */
    public synchronized boolean offer(byte[] chunk) {
        if (chunk == null || chunk.length == 0) {
            return true;
        }
        if (sizeBytes + chunk.length > capacityBytes) {
            if (!overflowLogged) {
                LOG.warn("Buffer '{}' full at {}B; dropping further audio until drained", name, sizeBytes);
                overflowLogged = true;
            }
            return false;
        }
        chunks.add(chunk);
        sizeBytes += chunk.length;
        return true;
    }

    /**
     * Removes and returns all chunks in arrival order.
     */
    public synchronized List<byte[]> drain() {
        List<byte[]> out = new ArrayList<>(chunks);
        clear();
        return out;
    }

    public synchronized void clear() {
        chunks.clear();
        sizeBytes = 0;
        overflowLogged = false;
    }

    public synchronized int chunkCount() {
        return chunks.size();
    }

    public synchronized int sizeBytes() {
        return sizeBytes;
    }

    public synchronized boolean isEmpty() {
        return chunks.isEmpty();
    }

    public int capacityBytes() {
        return capacityBytes;
    }
}
