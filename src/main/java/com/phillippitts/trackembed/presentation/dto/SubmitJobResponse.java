package com.phillippitts.trackembed.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param jobToken opaque token for status polling
 */
public record SubmitJobResponse(@JsonProperty("job_token") String jobToken) {
}
