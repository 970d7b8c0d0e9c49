/**
 * Vector index access. {@link com.phillippitts.trackembed.service.index.VectorIndexClient} applies
 * the retry policy and replaces the transport after connection failures; the transport speaks
 * the Qdrant REST API.
 */
package com.phillippitts.trackembed.service.index;
