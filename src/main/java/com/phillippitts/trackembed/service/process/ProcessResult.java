package com.phillippitts.trackembed.service.process;

/**
 * Output of an external process that exited with status 0.
 *
 * @param stdout captured standard output (capped)
 * @param stderr captured standard error (capped)
 * @param durationMs wall-clock run time
 */
public record ProcessResult(String stdout, String stderr, long durationMs) {}
