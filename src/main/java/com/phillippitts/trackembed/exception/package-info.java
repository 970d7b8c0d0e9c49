/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.trackembed.exception.TrackEmbedException}
 * so the REST boundary and the job runner can handle them uniformly.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.trackembed.exception.InvalidAudioException} - a clip could not be
 *       decoded or transcoded into the model format (per-track)</li>
 *   <li>{@link com.phillippitts.trackembed.exception.InvalidEmbeddingException} - vector length does
 *       not match the collection dimensionality, or a component is NaN or infinite (local
 *       validation, never retried)</li>
 *   <li>{@link com.phillippitts.trackembed.exception.EmbeddingModelException} - inference failed for
 *       one clip (per-track)</li>
 *   <li>{@link com.phillippitts.trackembed.exception.ExternalProcessException} - an external tool
 *       failed to start, timed out or exited non-zero</li>
 *   <li>{@link com.phillippitts.trackembed.exception.PreviewResolutionException} - the preview
 *       resolver is unreachable (fails the fetch stage)</li>
 *   <li>{@link com.phillippitts.trackembed.exception.VectorIndexException} - an index operation
 *       exhausted its retries</li>
 *   <li>{@link com.phillippitts.trackembed.exception.VectorIndexConnectionException} - the index
 *       could not be connected to or prepared (fatal for the pipeline)</li>
 *   <li>{@link com.phillippitts.trackembed.exception.PipelineJobNotFoundException} - unknown or
 *       already released job token</li>
 * </ul>
 *
 * @see com.phillippitts.trackembed.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.trackembed.exception;
