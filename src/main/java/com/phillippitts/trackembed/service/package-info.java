/**
 * Service layer.
 *
 * <ul>
 *   <li>{@code service.preview} - preview URL resolution and download</li>
 *   <li>{@code service.audio} - transcoding and WAV format checks</li>
 *   <li>{@code service.embedding} - model invocation, hidden-state reduction, artifact output</li>
 *   <li>{@code service.index} - vector index client with retry and reconnect</li>
 *   <li>{@code service.pipeline} - job lifecycle and orchestration</li>
 *   <li>{@code service.process} - external process execution</li>
 * </ul>
 */
package com.phillippitts.trackembed.service;
