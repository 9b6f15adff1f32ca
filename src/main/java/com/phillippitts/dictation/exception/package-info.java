/**
 * Application-specific exception hierarchy.
 *
 * <p>Every failure that crosses a component boundary is a
 * {@link com.phillippitts.dictation.exception.DictationBackendException} carrying an
 * {@link com.phillippitts.dictation.exception.ErrorCode}. Callers branch on the code, not on the
 * message text.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.dictation.exception.StreamingException} - remote real-time session
 *       failures (authentication, protocol, unexpected close)</li>
 *   <li>{@link com.phillippitts.dictation.exception.TranscriptionException} - local inference
 *       server start, request and stop failures, built with
 *       {@link com.phillippitts.dictation.exception.TranscriptionExceptionBuilder}</li>
 *   <li>{@link com.phillippitts.dictation.exception.DownloadException} - download failures
 *       classified by {@link com.phillippitts.dictation.exception.DownloadFailure}</li>
 *   <li>{@link com.phillippitts.dictation.exception.InsufficientDiskSpaceException} - preflight
 *       refusal carrying the shortfall</li>
 *   <li>{@link com.phillippitts.dictation.exception.ModelInstallationException} - validation or
 *       extraction failures</li>
 *   <li>{@link com.phillippitts.dictation.exception.ModelNotFoundException} - unknown model id or
 *       missing artifacts</li>
 *   <li>{@link com.phillippitts.dictation.exception.OperationCancelledException} - explicit
 *       cancellation, never retried</li>
 * </ul>
 *
 * @see com.phillippitts.dictation.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.dictation.exception;
