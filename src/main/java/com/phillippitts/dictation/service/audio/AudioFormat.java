package com.phillippitts.dictation.service.audio;

import java.time.Duration;

/**
 * Single source of truth for the PCM format handed to every backend.
 * Required: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    /** Required sample rate in Hz. */
    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    /** Required bits per sample. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Required number of channels (mono). */
    public static final int REQUIRED_CHANNELS = 1;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    /** Bytes per second at required format. */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /**
     * @return number of PCM bytes covering the duration at the given sample rate
     */
    public static int bytesFor(Duration duration, int sampleRate) {
        long bytes = duration.toMillis() * sampleRate * REQUIRED_BLOCK_ALIGN / 1000L;
        return (int) Math.min(bytes, Integer.MAX_VALUE);
    }

    /**
     * @return zero-filled PCM16 frame of the given length (digital silence)
     */
    public static byte[] silence(Duration duration, int sampleRate) {
        return new byte[bytesFor(duration, sampleRate)];
    }
}
