/**
 * HTTP translation of domain exceptions.
 *
 * <p>Status mapping:
 * <ul>
 *   <li>400 - validation failures, bad parameters, wrong-dimension embeddings</li>
 *   <li>404 - unknown job tokens, tracks without a stored embedding</li>
 *   <li>503 - vector index unreachable, pipeline pool saturated</li>
 *   <li>500 - anything else</li>
 * </ul>
 */
package com.phillippitts.trackembed.presentation.exception;
