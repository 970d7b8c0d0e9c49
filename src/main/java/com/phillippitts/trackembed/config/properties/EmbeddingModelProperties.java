package com.phillippitts.trackembed.config.properties;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the external embedding model runner.
 *
 * <p>The command is a template: {@code {input}} is replaced with the normalized WAV path and
 * {@code {output}} with the file the runner must write the hidden-state tensor to.
 *
 * <pre>
 * pipeline.model.command=python3,scripts/hidden_states.py,--model,m-a-p/MERT-v1-330M,{input},{output}
 * pipeline.model.timeout=5m
 * </pre>
 */
@ConfigurationProperties(prefix = "pipeline.model")
@Validated
public class EmbeddingModelProperties {

    public static final String INPUT_PLACEHOLDER = "{input}";
    public static final String OUTPUT_PLACEHOLDER = "{output}";

    @NotEmpty(message = "Embedding model command must not be empty")
    private List<String> command = new ArrayList<>(List.of(
            "python3", "scripts/hidden_states.py", INPUT_PLACEHOLDER, OUTPUT_PLACEHOLDER));

    @NotNull
    private Duration timeout = Duration.ofMinutes(5);

    public List<String> getCommand() {
        return command;
    }

    public void setCommand(List<String> command) {
        this.command = command;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
