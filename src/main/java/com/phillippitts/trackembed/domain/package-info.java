/**
 * Immutable domain types shared by the pipeline, the index client and the REST layer.
 *
 * <p>Key concepts:
 * <ul>
 *   <li>{@link com.phillippitts.trackembed.domain.TrackDescriptor} - canonical saved track</li>
 *   <li>{@link com.phillippitts.trackembed.domain.JobStage} - job state machine with progress mapping</li>
 *   <li>{@link com.phillippitts.trackembed.domain.JobStatus} - pollable job view</li>
 *   <li>{@link com.phillippitts.trackembed.domain.EmbeddingRecord} and
 *       {@link com.phillippitts.trackembed.domain.SimilarTrack} - index contents</li>
 * </ul>
 */
package com.phillippitts.trackembed.domain;
