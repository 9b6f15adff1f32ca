/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping (by {@link com.phillippitts.dictation.exception.ErrorCode}):
 * <ul>
 *   <li>CANCELLED → 409 Conflict</li>
 *   <li>RESOURCE_EXHAUSTED → 507 Insufficient Storage</li>
 *   <li>NOT_READY → 503 Service Unavailable</li>
 *   <li>AUTHENTICATION → 401 Unauthorized</li>
 *   <li>TRANSIENT, HTTP_STATUS, PROTOCOL → 502 Bad Gateway</li>
 *   <li>{@link com.phillippitts.dictation.exception.ModelNotFoundException} → 404 Not Found</li>
 *   <li>everything else → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "RESOURCE_EXHAUSTED",
 *   "message": "Insufficient disk space",
 *   "details": "Insufficient disk space in /models/whisper: need 1800 MB, have 400 MB (short by 1400 MB)",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.dictation.presentation.exception;
