/**
 * Logging support: request-scoped Log4j2 ThreadContext population.
 */
package com.phillippitts.trackembed.config.logging;
