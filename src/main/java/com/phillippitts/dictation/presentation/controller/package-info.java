/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /ping} - liveness and MDC logging check</li>
 *   <li>{@code GET /api/backend/status} - streaming session and local server snapshot</li>
 *   <li>{@code POST /api/servers/{backend}/start?model=} and {@code POST /api/servers/{backend}/stop}</li>
 *   <li>{@code GET /api/models/{backend}} - catalog models with download status</li>
 *   <li>{@code POST|DELETE /api/models/{backend}/{modelId}/download} - start or cancel provisioning</li>
 *   <li>{@code DELETE /api/models/{backend}/{modelId}} - remove an installed model</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.dictation.presentation.controller;
