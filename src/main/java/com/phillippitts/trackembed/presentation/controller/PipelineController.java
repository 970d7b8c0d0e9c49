package com.phillippitts.trackembed.presentation.controller;

import com.phillippitts.trackembed.presentation.dto.JobStatusResponse;
import com.phillippitts.trackembed.presentation.dto.SubmitJobRequest;
import com.phillippitts.trackembed.presentation.dto.SubmitJobResponse;
import com.phillippitts.trackembed.service.pipeline.PipelineJobRunner;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Asynchronous job submission and status polling.
 */
@RestController
@RequestMapping("/api/pipeline/jobs")
class PipelineController {

    private static final Logger LOG = LogManager.getLogger(PipelineController.class);

    private final PipelineJobRunner runner;

    PipelineController(PipelineJobRunner runner) {
        this.runner = runner;
    }

    @PostMapping
    ResponseEntity<SubmitJobResponse> submit(@Valid @RequestBody SubmitJobRequest request) {
        ThreadContext.put("userId", request.userId());
        LOG.info("Job submission with {} tracks", request.tracks().size());
        String token = runner.submit(request.userId(), request.tracks());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SubmitJobResponse(token));
    }

    /**
     * A terminal status is returned once; the job is released afterwards.
     */
    @GetMapping("/{token}")
    ResponseEntity<JobStatusResponse> status(@PathVariable String token) {
        return ResponseEntity.ok(JobStatusResponse.from(runner.status(token)));
    }
}
