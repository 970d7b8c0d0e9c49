package com.phillippitts.trackembed.service.preview;

import com.phillippitts.trackembed.domain.TrackDescriptor;
import com.phillippitts.trackembed.exception.PreviewResolutionException;

import java.util.List;
import java.util.Map;

/**
 * Resolves preview clip URLs for tracks that arrived without one.
 */
public interface PreviewResolver {

    /**
     * Looks up preview URLs by {@link TrackDescriptor#displayKey()}.
     *
     * @param tracks tracks to resolve
     * @return mapping from {@code "name - artist"} to URL; tracks without a preview are absent
     * @throws PreviewResolutionException if the resolution mechanism is unreachable as a whole
     */
    Map<String, String> resolve(List<TrackDescriptor> tracks);
}
