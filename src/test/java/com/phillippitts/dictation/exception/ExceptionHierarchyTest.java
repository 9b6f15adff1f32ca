package com.phillippitts.dictation.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void backendExceptionCarriesCodeAndCause() {
        IOException cause = new IOException("socket closed");
        DictationBackendException ex = new DictationBackendException("connect failed", ErrorCode.TRANSIENT, cause);

        assertThat(ex.getMessage()).isEqualTo("connect failed");
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.TRANSIENT);
        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex.isCancellation()).isFalse();
    }

    @Test
    void cancellationIsDistinguishedFromFailure() {
        OperationCancelledException ex = new OperationCancelledException("Download cancelled");

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.CANCELLED);
        assertThat(ex.isCancellation()).isTrue();
        assertThat(new StreamingException("cancelled", ErrorCode.CANCELLED).isCancellation()).isTrue();
    }

    @Test
    void modelNotFoundExceptionShouldIncludePath() {
        ModelNotFoundException ex = new ModelNotFoundException("/models/whisper/base/ggml-base.bin");

        assertThat(ex.getMessage()).contains("/models/whisper/base/ggml-base.bin");
        assertThat(ex.getModelPath()).isEqualTo("/models/whisper/base/ggml-base.bin");
        assertThat(ex).isInstanceOf(DictationBackendException.class);
    }

    @Test
    void transcriptionExceptionShouldIncludeBackendName() {
        TranscriptionException ex = new TranscriptionException("server not ready", "parakeet", ErrorCode.NOT_READY);

        assertThat(ex.getMessage()).contains("server not ready").contains("parakeet");
        assertThat(ex.getBackendName()).isEqualTo("parakeet");
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.NOT_READY);
    }

    @Test
    void transcriptionExceptionDefaultsToUnknownBackend() {
        TranscriptionException ex = new TranscriptionException("failed");

        assertThat(ex.getBackendName()).isEqualTo("unknown");
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.PROCESS_LIFECYCLE);
    }

    @Test
    void builderAppendsDiagnostics() {
        RuntimeException cause = new RuntimeException("exited");
        TranscriptionException ex = TranscriptionExceptionBuilder.create("Server exited before ready")
                .backend("whisper")
                .exitCode(1)
                .durationMs(250)
                .metadata("stderr", "failed to load model")
                .cause(cause)
                .build();

        assertThat(ex.getMessage())
                .contains("Server exited before ready")
                .contains("exitCode=1")
                .contains("durationMs=250")
                .contains("stderr=failed to load model")
                .contains("backend: whisper");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void downloadExceptionMapsFailureToErrorCode() {
        assertThat(new DownloadException("reset", DownloadFailure.CONNECTION_RESET).getErrorCode())
                .isEqualTo(ErrorCode.TRANSIENT);
        assertThat(new DownloadException("HTTP 404", DownloadFailure.HTTP_STATUS, 404, null).getErrorCode())
                .isEqualTo(ErrorCode.HTTP_STATUS);
        assertThat(new DownloadException("small", DownloadFailure.FILE_TOO_SMALL).getErrorCode())
                .isEqualTo(ErrorCode.CORRUPTION);
        assertThat(new DownloadException("disk", DownloadFailure.IO).getErrorCode())
                .isEqualTo(ErrorCode.RESOURCE_EXHAUSTED);
    }

    @Test
    void onlyTransportFailuresAreRetryable() {
        assertThat(DownloadFailure.CONNECTION_RESET.isRetryable()).isTrue();
        assertThat(DownloadFailure.TIMEOUT.isRetryable()).isTrue();
        assertThat(DownloadFailure.DNS.isRetryable()).isTrue();
        assertThat(DownloadFailure.PREMATURE_CLOSE.isRetryable()).isTrue();
        assertThat(DownloadFailure.INCOMPLETE.isRetryable()).isTrue();
        assertThat(DownloadFailure.HTTP_STATUS.isRetryable()).isFalse();
        assertThat(DownloadFailure.TOO_MANY_REDIRECTS.isRetryable()).isFalse();
        assertThat(DownloadFailure.FILE_TOO_SMALL.isRetryable()).isFalse();
    }

    @Test
    void insufficientDiskSpaceReportsShortfall() {
        long mb = 1024L * 1024L;
        InsufficientDiskSpaceException ex = new InsufficientDiskSpaceException(Paths.get("/models"), 500 * mb, 120 * mb);

        assertThat(ex.getShortfallBytes()).isEqualTo(380 * mb);
        assertThat(ex.getMessage()).contains("short by 380 MB");
    }

    @Test
    void installationFailureNamesModel() {
        ModelInstallationException ex = new ModelInstallationException("tdt-v3", "Extracted model is incomplete");

        assertThat(ex.getMessage()).contains("tdt-v3");
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.CORRUPTION);
    }
}
