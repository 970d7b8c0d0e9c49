package com.phillippitts.trackembed.config;

import com.phillippitts.trackembed.config.properties.AudioNormalizationProperties;
import com.phillippitts.trackembed.config.properties.EmbeddingModelProperties;
import com.phillippitts.trackembed.config.properties.PipelineProperties;
import com.phillippitts.trackembed.config.properties.PreviewProperties;
import com.phillippitts.trackembed.service.audio.AudioNormalizer;
import com.phillippitts.trackembed.service.audio.WavInspector;
import com.phillippitts.trackembed.service.embedding.EmbeddingArtifactWriter;
import com.phillippitts.trackembed.service.embedding.EmbeddingModel;
import com.phillippitts.trackembed.service.embedding.EmbeddingReducer;
import com.phillippitts.trackembed.service.embedding.ExternalProcessEmbeddingModel;
import com.phillippitts.trackembed.service.index.VectorIndexClientProvider;
import com.phillippitts.trackembed.service.metrics.PipelineMetrics;
import com.phillippitts.trackembed.service.pipeline.JobTimeoutWatchdog;
import com.phillippitts.trackembed.service.pipeline.LibraryPipelineOrchestrator;
import com.phillippitts.trackembed.service.pipeline.PipelineJobRegistry;
import com.phillippitts.trackembed.service.pipeline.PipelineJobRunner;
import com.phillippitts.trackembed.service.pipeline.TrackPayloadNormalizer;
import com.phillippitts.trackembed.service.preview.ExternalScriptPreviewResolver;
import com.phillippitts.trackembed.service.preview.OkHttpPreviewDownloader;
import com.phillippitts.trackembed.service.preview.PreviewDownloader;
import com.phillippitts.trackembed.service.preview.PreviewFetcher;
import com.phillippitts.trackembed.service.preview.PreviewResolver;
import com.phillippitts.trackembed.service.process.ExternalProcessRunner;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Wires the pipeline stages and the job runner.
 *
 * <p>The embedding model is created once here and shared read-only by every job.
 */
@Configuration
public class PipelineConfig {

    private static final Logger LOG = LogManager.getLogger(PipelineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExternalProcessRunner externalProcessRunner() {
        return new ExternalProcessRunner();
    }

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient();
    }

    @Bean
    public PreviewResolver previewResolver(ExternalProcessRunner runner, PreviewProperties props) {
        return new ExternalScriptPreviewResolver(runner, props);
    }

    @Bean
    public PreviewDownloader previewDownloader(OkHttpClient okHttpClient, PreviewProperties props) {
        return new OkHttpPreviewDownloader(okHttpClient, props.getDownloadTimeout());
    }

    @Bean
    public PreviewFetcher previewFetcher(PreviewResolver resolver, PreviewDownloader downloader,
                                         @Qualifier("downloadExecutor") ThreadPoolTaskExecutor downloadExecutor,
                                         PreviewProperties props) {
        return new PreviewFetcher(resolver, downloader, downloadExecutor, props.getFileExtension());
    }

    @Bean
    public AudioNormalizer audioNormalizer(ExternalProcessRunner runner, WavInspector inspector,
                                           AudioNormalizationProperties props) {
        return new AudioNormalizer(runner, inspector, props);
    }

    @Bean
    public EmbeddingModel embeddingModel(ExternalProcessRunner runner, EmbeddingModelProperties props) {
        EmbeddingModel model = new ExternalProcessEmbeddingModel(runner, props);
        LOG.info("Embedding model command: {}", model.name());
        return model;
    }

    @Bean
    public EmbeddingReducer embeddingReducer() {
        return new EmbeddingReducer();
    }

    @Bean
    public EmbeddingArtifactWriter embeddingArtifactWriter(PipelineProperties props) {
        return new EmbeddingArtifactWriter(props.getArtifactDir());
    }

    @Bean
    public TrackPayloadNormalizer trackPayloadNormalizer() {
        return new TrackPayloadNormalizer();
    }

    @Bean
    public LibraryPipelineOrchestrator libraryPipelineOrchestrator(TrackPayloadNormalizer payloadNormalizer,
                                                                   PreviewFetcher fetcher,
                                                                   AudioNormalizer audioNormalizer,
                                                                   EmbeddingModel embeddingModel,
                                                                   EmbeddingReducer reducer,
                                                                   VectorIndexClientProvider indexClient,
                                                                   EmbeddingArtifactWriter artifactWriter,
                                                                   PipelineProperties props,
                                                                   PipelineMetrics metrics) {
        return new LibraryPipelineOrchestrator(payloadNormalizer, fetcher, audioNormalizer, embeddingModel,
                reducer, indexClient, artifactWriter, props, metrics);
    }

    @Bean
    public PipelineJobRegistry pipelineJobRegistry(Clock clock) {
        return new PipelineJobRegistry(clock);
    }

    @Bean
    public PipelineJobRunner pipelineJobRunner(PipelineJobRegistry registry,
                                               LibraryPipelineOrchestrator orchestrator,
                                               @Qualifier("pipelineExecutor") ThreadPoolTaskExecutor pipelineExecutor,
                                               PipelineMetrics metrics) {
        return new PipelineJobRunner(registry, orchestrator, pipelineExecutor, metrics);
    }

    @Bean
    public JobTimeoutWatchdog jobTimeoutWatchdog(PipelineJobRegistry registry, PipelineProperties props,
                                                 PipelineMetrics metrics, Clock clock) {
        return new JobTimeoutWatchdog(registry, props, metrics, clock);
    }
}
