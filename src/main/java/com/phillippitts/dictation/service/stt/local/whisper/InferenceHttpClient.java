package com.phillippitts.dictation.service.stt.local.whisper;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Interface for the HTTP calls made to a local inference server. This abstraction allows
 * mocking HTTP calls in tests.
 *
 * <p>Production code uses {@link JdkInferenceHttpClient}.
 */
public interface InferenceHttpClient {

    /**
     * Performs an HTTP GET request.
     *
     * @param uri     target
     * @param timeout request timeout
     * @return the response from the server
     * @throws IOException if no response was received
     */
    HttpResult get(URI uri, Duration timeout) throws IOException;

    /**
     * Performs a multipart/form-data POST request.
     *
     * @param uri     target
     * @param body    encoded multipart body
     * @param timeout request timeout
     * @return the response from the server
     * @throws IOException if no response was received
     */
    HttpResult postMultipart(URI uri, MultipartBody body, Duration timeout) throws IOException;

    /**
     * Response from an HTTP request.
     *
     * @param statusCode HTTP status code
     * @param body       response body (may be empty)
     */
    record HttpResult(int statusCode, String body) {

        /** Returns true if the status code indicates success (2xx). */
        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
