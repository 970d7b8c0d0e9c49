/**
 * Audio normalization to the model input format (24 kHz, mono, 16-bit PCM WAV, at most 15 s).
 */
package com.phillippitts.trackembed.service.audio;
