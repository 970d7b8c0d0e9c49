package com.phillippitts.trackembed.service.pipeline;

import com.phillippitts.trackembed.domain.TrackDescriptor;
import com.phillippitts.trackembed.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Normalizes loosely-typed track payloads into {@link TrackDescriptor}s.
 *
 * <p>Known payload shapes, tried in this order for the artist:
 * <ol>
 *   <li>{@link Shape#FLAT_ARTISTS}: {@code {"artists": [{"name": ...}] | ["..."]}}</li>
 *   <li>{@link Shape#NESTED_TRACK}: {@code {"track": {"artists": [...], "name": ...}}}</li>
 *   <li>{@link Shape#LEGACY_ARTIST}: {@code {"artist": "..."}}</li>
 * </ol>
 * Anything else gets {@value TrackDescriptor#UNKNOWN_ARTIST}. The name is read from {@code name},
 * then {@code track.name}, else {@value TrackDescriptor#UNKNOWN_TRACK}. Non-object entries and
 * entries without an id are dropped; one bad record never fails the batch.
 */
public class TrackPayloadNormalizer {

    private static final Logger LOG = LogManager.getLogger(TrackPayloadNormalizer.class);

    /**
     * Payload variants, detected by the fields present.
     */
    public enum Shape {
        FLAT_ARTISTS,
        NESTED_TRACK,
        LEGACY_ARTIST,
        UNKNOWN;

        static Shape detect(Map<?, ?> payload) {
            if (payload.get("artists") instanceof List<?> artists && !artists.isEmpty()) {
                return FLAT_ARTISTS;
            }
            if (payload.get("track") instanceof Map<?, ?> nested && nested.containsKey("artists")) {
                return NESTED_TRACK;
            }
            if (payload.get("artist") instanceof String) {
                return LEGACY_ARTIST;
            }
            return UNKNOWN;
        }
    }

    /**
     * @param rawTracks decoded JSON values, normally maps
     * @return canonical descriptors for every entry that could be read, in input order
     */
    public List<TrackDescriptor> normalize(List<?> rawTracks) {
        List<TrackDescriptor> out = new ArrayList<>(rawTracks.size());
        for (Object raw : rawTracks) {
            if (!(raw instanceof Map<?, ?> payload)) {
                LOG.warn("Skipping invalid track entry of type {}",
                        raw == null ? "null" : raw.getClass().getSimpleName());
                continue;
            }
            try {
                normalizeOne(payload).ifPresent(out::add);
            } catch (RuntimeException e) {
                LOG.error("Error processing track {}: {}", LogSanitizer.forLog(String.valueOf(payload.get("id"))),
                        e.getMessage());
            }
        }
        return out;
    }

    Optional<TrackDescriptor> normalizeOne(Map<?, ?> payload) {
        Map<?, ?> nested = payload.get("track") instanceof Map<?, ?> m ? m : Map.of();

        String id = firstText(payload.get("id"), nested.get("id"));
        if (id == null) {
            LOG.warn("Skipping track without id");
            return Optional.empty();
        }
        String name = firstText(payload.get("name"), nested.get("name"));
        String artist = artistOf(Shape.detect(payload), payload, nested);
        long durationMs = Math.max(0L, firstLong(payload.get("duration_ms"), nested.get("duration_ms")));
        String previewUrl = firstText(payload.get("preview_url"), nested.get("preview_url"));

        return Optional.of(new TrackDescriptor(id,
                name != null ? name : TrackDescriptor.UNKNOWN_TRACK,
                artist != null ? artist : TrackDescriptor.UNKNOWN_ARTIST,
                durationMs,
                previewUrl));
    }

    private static String artistOf(Shape shape, Map<?, ?> payload, Map<?, ?> nested) {
        switch (shape) {
            case FLAT_ARTISTS:
                return firstArtist(payload.get("artists"));
            case NESTED_TRACK:
                return firstArtist(nested.get("artists"));
            case LEGACY_ARTIST:
                return text(payload.get("artist"));
            default:
                return null;
        }
    }

    private static String firstArtist(Object artists) {
        if (!(artists instanceof List<?> list) || list.isEmpty()) {
            return null;
        }
        Object first = list.get(0);
        if (first instanceof Map<?, ?> artist) {
            return text(artist.get("name"));
        }
        return text(first);
    }

    private static String firstText(Object... candidates) {
        for (Object c : candidates) {
            String t = text(c);
            if (t != null) {
                return t;
            }
        }
        return null;
    }

    private static String text(Object value) {
        if (value instanceof String s && !s.isBlank()) {
            return s;
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        return null;
    }

    private static long firstLong(Object... candidates) {
        for (Object c : candidates) {
            if (c instanceof Number n) {
                return n.longValue();
            }
            if (c instanceof String s) {
                try {
                    return Long.parseLong(s.trim());
                } catch (NumberFormatException e) {
                    LOG.debug("Ignoring non-numeric duration '{}'", LogSanitizer.forLog(s));
                }
            }
        }
        return 0L;
    }
}
