package com.phillippitts.dictation.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

import static com.phillippitts.dictation.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.dictation.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.dictation.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.dictation.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Wraps raw PCM16LE mono audio in a minimal RIFF/WAVE container for multipart upload.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * @param pcm        raw PCM16LE mono audio
     * @param sampleRate sample rate of the payload in Hz
     * @return WAV bytes (44-byte header followed by the payload)
     */
    public static byte[] toWav(byte[] pcm, int sampleRate) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive");
        }
        ByteArrayOutputStream os = new ByteArrayOutputStream(WAV_HEADER_SIZE + pcm.length);
        try {
            os.write(new byte[] { 'R', 'I', 'F', 'F' });
            writeLEInt(os, 36 + pcm.length);
            os.write(new byte[] { 'W', 'A', 'V', 'E' });

            os.write(new byte[] { 'f', 'm', 't', ' ' });
            writeLEInt(os, 16);                       // PCM fmt chunk size
            writeLEShort(os, (short) 1);              // PCM
            writeLEShort(os, (short) REQUIRED_CHANNELS);
            writeLEInt(os, sampleRate);
            writeLEInt(os, sampleRate * REQUIRED_BLOCK_ALIGN);
            writeLEShort(os, (short) REQUIRED_BLOCK_ALIGN);
            writeLEShort(os, (short) REQUIRED_BITS_PER_SAMPLE);

            os.write(new byte[] { 'd', 'a', 't', 'a' });
            writeLEInt(os, pcm.length);
            os.write(pcm);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new IllegalStateException("Failed to build WAV payload", e);
        }
        return os.toByteArray();
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
