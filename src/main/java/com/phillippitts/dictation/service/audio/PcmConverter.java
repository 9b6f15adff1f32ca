package com.phillippitts.dictation.service.audio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Sample format conversions for backends that expect floating point audio.
 */
public final class PcmConverter {

    private PcmConverter() {}

    /**
     * Converts PCM16LE samples to float32LE samples in [-1.0, 1.0).
     * A trailing odd byte is ignored.
     *
     * @param pcm16 PCM16LE payload
     * @return float32LE payload (twice the length of the whole samples)
     */
    public static byte[] pcm16ToFloat32(byte[] pcm16) {
        Objects.requireNonNull(pcm16, "pcm16 must not be null");
        int samples = pcm16.length / 2;
        ByteBuffer in = ByteBuffer.wrap(pcm16).order(ByteOrder.LITTLE_ENDIAN);
        ByteBuffer out = ByteBuffer.allocate(samples * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < samples; i++) {
            out.putFloat(in.getShort() / 32768.0f);
        }
        return out.array();
    }
}
