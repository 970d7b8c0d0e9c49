/**
 * Spring configuration: executors with MDC propagation, pool metrics, vector index wiring
 * and the pipeline bean graph.
 *
 * <p>Pipeline collaborators are plain classes wired here as {@code @Bean}s so they stay
 * constructible in unit tests without a Spring context.
 */
package com.phillippitts.trackembed.config;
