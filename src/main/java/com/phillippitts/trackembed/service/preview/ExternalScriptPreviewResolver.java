package com.phillippitts.trackembed.service.preview;

import com.phillippitts.trackembed.config.properties.PreviewProperties;
import com.phillippitts.trackembed.domain.TrackDescriptor;
import com.phillippitts.trackembed.exception.ExternalProcessException;
import com.phillippitts.trackembed.exception.PreviewResolutionException;
import com.phillippitts.trackembed.service.process.ExternalProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Resolves preview URLs by running an external script.
 *
 * <p>The script runs in a private temporary directory. It reads {@code tracks.json}
 * ({@code [{"name": ..., "artist": ...}]}) and must write {@code preview_urls.json}
 * ({@code {"name - artist": url | null}}).
 */
public class ExternalScriptPreviewResolver implements PreviewResolver {

    private static final Logger LOG = LogManager.getLogger(ExternalScriptPreviewResolver.class);
    private static final String TOOL = "preview-resolver";
    static final String TRACKS_FILE = "tracks.json";
    static final String RESULT_FILE = "preview_urls.json";

    private final ExternalProcessRunner runner;
    private final PreviewProperties props;

    public ExternalScriptPreviewResolver(ExternalProcessRunner runner, PreviewProperties props) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public Map<String, String> resolve(List<TrackDescriptor> tracks) {
        if (tracks.isEmpty()) {
            return Map.of();
        }
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("preview-resolve-");
            Files.writeString(workDir.resolve(TRACKS_FILE), toRequest(tracks).toString(2), StandardCharsets.UTF_8);

            runner.run(TOOL, props.getResolverCommand(), workDir, props.getResolverTimeout());

            Path result = workDir.resolve(RESULT_FILE);
            if (!Files.isRegularFile(result)) {
                throw new PreviewResolutionException("Resolver produced no " + RESULT_FILE);
            }
            Map<String, String> urls = parse(Files.readString(result, StandardCharsets.UTF_8));
            LOG.info("Resolved previews for {} of {} tracks", urls.size(), tracks.size());
            return urls;
        } catch (ExternalProcessException e) {
            throw new PreviewResolutionException("Preview resolver failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new PreviewResolutionException("Preview resolver I/O error: " + e.getMessage(), e);
        } catch (JSONException e) {
            throw new PreviewResolutionException("Preview resolver returned malformed JSON: " + e.getMessage(), e);
        } finally {
            deleteRecursively(workDir);
        }
    }

    static JSONArray toRequest(List<TrackDescriptor> tracks) {
        JSONArray arr = new JSONArray();
        for (TrackDescriptor t : tracks) {
            JSONObject obj = new JSONObject();
            obj.put("name", t.name());
            obj.put("artist", t.artist());
            arr.put(obj);
        }
        return arr;
    }

    static Map<String, String> parse(String json) {
        JSONObject obj = new JSONObject(json);
        Map<String, String> urls = new HashMap<>();
        for (String key : obj.keySet()) {
            String url = obj.optString(key, null);
            if (obj.isNull(key) || url == null || url.isBlank()) {
                continue;
            }
            urls.put(key, url);
        }
        return urls;
    }

    private static void deleteRecursively(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    LOG.debug("Could not delete {}: {}", p, e.toString());
                }
            });
        } catch (IOException e) {
            LOG.warn("Could not clean up resolver directory {}: {}", dir, e.toString());
        }
    }
}
