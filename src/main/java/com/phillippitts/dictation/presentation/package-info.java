/**
 * Presentation layer: the control API used by the local UI process.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for status, servers and models</li>
 *   <li>{@code presentation.exception} - error code to HTTP status mapping</li>
 * </ul>
 *
 * <p>Controllers are thin adapters over {@link com.phillippitts.dictation.context.SttBackendContext};
 * they never throw HTTP-specific exceptions.
 *
 * @see com.phillippitts.dictation.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.dictation.presentation;
