package com.phillippitts.trackembed;

import com.phillippitts.trackembed.config.properties.AudioNormalizationProperties;
import com.phillippitts.trackembed.config.properties.EmbeddingModelProperties;
import com.phillippitts.trackembed.config.properties.PipelineProperties;
import com.phillippitts.trackembed.config.properties.PreviewProperties;
import com.phillippitts.trackembed.config.properties.ThreadPoolProperties;
import com.phillippitts.trackembed.config.properties.VectorIndexProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        PipelineProperties.class,
        PreviewProperties.class,
        AudioNormalizationProperties.class,
        EmbeddingModelProperties.class,
        VectorIndexProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class TrackEmbedApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackEmbedApplication.class, args);
    }

}
