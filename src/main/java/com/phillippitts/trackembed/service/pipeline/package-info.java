/**
 * Library processing jobs.
 *
 * <p>A job moves PENDING, STARTED, PROCESSING, DOWNLOADING, CONVERTING, EMBEDDING and ends in
 * COMPLETED or FAILED. Per-track failures are logged and skipped; only structural failures
 * (no tracks, preview fetch failure, index unreachable) fail the job. Jobs live in memory and
 * are released once a terminal status has been read.
 */
package com.phillippitts.trackembed.service.pipeline;
