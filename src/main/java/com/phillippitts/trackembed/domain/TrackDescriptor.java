package com.phillippitts.trackembed.domain;

import java.util.Objects;

/**
 * Canonical description of one saved track.
 *
 * @param id         opaque external track id (identity)
 * @param name       track title
 * @param artist     primary artist name
 * @param durationMs track duration in milliseconds (0 when unknown)
 * @param previewUrl direct preview clip URL, or {@code null} when it must be resolved
 */
public record TrackDescriptor(
        String id,
        String name,
        String artist,
        long durationMs,
        String previewUrl
) {

    public static final String UNKNOWN_ARTIST = "Unknown Artist";
    public static final String UNKNOWN_TRACK = "Unknown Track";

    /**
     * @throws NullPointerException if id, name or artist is null
     * @throws IllegalArgumentException if id is blank or duration is negative
     */
    public TrackDescriptor {
        Objects.requireNonNull(id, "Track id must not be null");
        Objects.requireNonNull(name, "Track name must not be null");
        Objects.requireNonNull(artist, "Track artist must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Track id must not be blank");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("Duration must not be negative, got: " + durationMs);
        }
        if (previewUrl != null && previewUrl.isBlank()) {
            previewUrl = null;
        }
    }

    public boolean hasPreviewUrl() {
        return previewUrl != null;
    }

    /**
     * Human-readable key used to resolve a missing preview URL and to name the downloaded file.
     *
     * @return {@code "name - artist"}
     */
    public String displayKey() {
        return name + " - " + artist;
    }

    public TrackDescriptor withPreviewUrl(String url) {
        return new TrackDescriptor(id, name, artist, durationMs, url);
    }
}
