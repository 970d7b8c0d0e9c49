/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/pipeline/jobs} - submit a user's track list (202 + job token)</li>
 *   <li>{@code GET /api/pipeline/jobs/{token}} - poll job state, message, progress and result</li>
 *   <li>{@code GET /api/tracks/{trackId}/similar} - nearest stored tracks</li>
 *   <li>{@code GET|DELETE /api/tracks/{trackId}/embedding} - existence check and removal</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; exceptions are translated by
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.trackembed.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.trackembed.presentation.controller;
