package com.phillippitts.dictation.service.stt.local.whisper;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Encoded multipart/form-data body.
 *
 * <p><b>Usage:</b>
 * <pre>
 * MultipartBody body = MultipartBody.builder()
 *         .file("file", "audio.wav", "audio/wav", wavBytes)
 *         .field("language", "auto")
 *         .field("response_format", "json")
 *         .build();
 * </pre>
 */
public final class MultipartBody {

    private static final String CRLF = "\r\n";

    private final String boundary;
    private final byte[] bytes;

    private MultipartBody(String boundary, byte[] bytes) {
        this.boundary = boundary;
        this.bytes = bytes;
    }

    public static Builder builder() {
        return new Builder("----DictationBoundary" + Long.toHexString(ThreadLocalRandom.current().nextLong()));
    }

    public String contentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    public String boundary() {
        return boundary;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public static final class Builder {
        private final String boundary;
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        private Builder(String boundary) {
            this.boundary = boundary;
        }

        public Builder field(String name, String value) {
            Objects.requireNonNull(name, "name");
            write("--" + boundary + CRLF);
            write("Content-Disposition: form-data; name=\"" + name + "\"" + CRLF + CRLF);
            write((value == null ? "" : value) + CRLF);
            return this;
        }

        public Builder file(String name, String fileName, String contentType, byte[] content) {
            Objects.requireNonNull(content, "content");
            write("--" + boundary + CRLF);
            write("Content-Disposition: form-data; name=\"" + name + "\"; filename=\"" + fileName + "\"" + CRLF);
            write("Content-Type: " + contentType + CRLF + CRLF);
            out.writeBytes(content);
            write(CRLF);
            return this;
        }

        public MultipartBody build() {
            write("--" + boundary + "--" + CRLF);
            return new MultipartBody(boundary, out.toByteArray());
        }

        private void write(String s) {
            out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
        }
    }
}
