/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - per control API request, set by
 *       {@link com.phillippitts.dictation.config.logging.MdcFilter}</li>
 *   <li>{@code userId} - optional caller identity</li>
 *   <li>{@code backend} - backend family, set by the server managers and the provisioner while
 *       they work on a request</li>
 * </ul>
 *
 * <p>Log Format (see {@code log4j2-spring.xml}):
 * <pre>
 * 2026-10-17 15:42:32.529 [thread-name] [requestId] [backend] LEVEL logger.name - message
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.dictation.config.logging;
