package com.phillippitts.trackembed.service.preview;

import com.phillippitts.trackembed.config.properties.PreviewProperties;
import com.phillippitts.trackembed.domain.TrackDescriptor;
import com.phillippitts.trackembed.exception.PreviewResolutionException;
import com.phillippitts.trackembed.service.process.ExternalProcessRunner;
import com.phillippitts.trackembed.testutil.TestProcesses.ProcessBehavior;
import com.phillippitts.trackembed.testutil.TestProcesses.ScriptedProcessFactory;
import org.json.JSONArray;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalScriptPreviewResolverTest {

    private static final List<TrackDescriptor> TRACKS = List.of(
            new TrackDescriptor("t1", "Song A", "Artist", 0, null),
            new TrackDescriptor("t2", "Song B", "Artist", 0, null));

    @Test
    void passesTracksFileAndReadsResult() {
        AtomicReference<String> request = new AtomicReference<>();
        AtomicReference<Path> workDir = new AtomicReference<>();
        ScriptedProcessFactory factory = new ScriptedProcessFactory((cmd, dir) -> {
            workDir.set(dir);
            request.set(Files.readString(dir.resolve("tracks.json")));
            Files.writeString(dir.resolve("preview_urls.json"),
                    "{\"Song A - Artist\": \"http://cdn/a.mp3\", \"Song B - Artist\": null, \"x\": \"\"}");
            return ProcessBehavior.ok("");
        });
        ExternalScriptPreviewResolver resolver =
                new ExternalScriptPreviewResolver(new ExternalProcessRunner(factory), new PreviewProperties());

        Map<String, String> urls = resolver.resolve(TRACKS);

        assertThat(urls).containsExactly(Map.entry("Song A - Artist", "http://cdn/a.mp3"));
        JSONArray sent = new JSONArray(request.get());
        assertThat(sent.length()).isEqualTo(2);
        assertThat(sent.getJSONObject(1).getString("name")).isEqualTo("Song B");
        assertThat(sent.getJSONObject(1).getString("artist")).isEqualTo("Artist");
        assertThat(workDir.get()).doesNotExist();
    }

    @Test
    void scriptFailureIsResolutionFailure() {
        ExternalScriptPreviewResolver resolver = new ExternalScriptPreviewResolver(
                new ExternalProcessRunner(ScriptedProcessFactory.always(ProcessBehavior.exit(1, "ECONNREFUSED"))),
                new PreviewProperties());

        assertThatThrownBy(() -> resolver.resolve(TRACKS))
                .isInstanceOf(PreviewResolutionException.class)
                .hasMessageContaining("ECONNREFUSED");
    }

    @Test
    void missingResultFileIsResolutionFailure() {
        ExternalScriptPreviewResolver resolver = new ExternalScriptPreviewResolver(
                new ExternalProcessRunner(ScriptedProcessFactory.always(ProcessBehavior.ok(""))),
                new PreviewProperties());

        assertThatThrownBy(() -> resolver.resolve(TRACKS))
                .isInstanceOf(PreviewResolutionException.class)
                .hasMessageContaining("preview_urls.json");
    }

    @Test
    void malformedResultIsResolutionFailure() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory((cmd, dir) -> {
            Files.writeString(dir.resolve("preview_urls.json"), "[not an object");
            return ProcessBehavior.ok("");
        });
        ExternalScriptPreviewResolver resolver =
                new ExternalScriptPreviewResolver(new ExternalProcessRunner(factory), new PreviewProperties());

        assertThatThrownBy(() -> resolver.resolve(TRACKS))
                .isInstanceOf(PreviewResolutionException.class)
                .hasMessageContaining("malformed JSON");
    }

    @Test
    void emptyInputSkipsScript() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.always(ProcessBehavior.ok(""));
        ExternalScriptPreviewResolver resolver =
                new ExternalScriptPreviewResolver(new ExternalProcessRunner(factory), new PreviewProperties());

        assertThat(resolver.resolve(List.of())).isEmpty();
        assertThat(factory.commands()).isEmpty();
    }
}
