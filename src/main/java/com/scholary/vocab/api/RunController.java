package com.scholary.vocab.api;

import com.scholary.vocab.config.PipelineProperties;
import com.scholary.vocab.job.JobRepository;
import com.scholary.vocab.pipeline.PipelineOrchestrator;
import com.scholary.vocab.pipeline.PipelineRun;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for flashcard runs.
 *
 * <ul>
 *   <li>POST starts a run and returns its ID immediately
 *   <li>GET polls a run's phase, term progress and report
 *   <li>DELETE requests cancellation
 * </ul>
 *
 * <p>Submitted paths are confined to {@code pipeline.workDir}.
 */
@RestController
@RequestMapping("/api/runs")
@Tag(name = "Runs", description = "Vocabulary to flashcard pipeline runs")
public class RunController {

  private static final Logger LOGGER = LoggerFactory.getLogger(RunController.class);

  private final PipelineOrchestrator orchestrator;
  private final JobRepository jobRepository;
  private final Path workDir;

  public RunController(
      PipelineOrchestrator orchestrator,
      JobRepository jobRepository,
      PipelineProperties properties) {
    this.orchestrator = orchestrator;
    this.jobRepository = jobRepository;
    this.workDir = Path.of(properties.workDir());
  }

  @PostMapping
  @Operation(
      summary = "Start run",
      description = "Start an asynchronous flashcard run and return its ID for status polling")
  public ResponseEntity<AsyncJobResponse> start(@Valid @RequestBody RunSubmission submission) {
    LOGGER.info("Run request: input={}, output={}", submission.input(), submission.output());

    PipelineRun run = orchestrator.start(submission.toRunRequest(workDir));
    jobRepository.save(run);

    return ResponseEntity.accepted()
        .body(new AsyncJobResponse(run.getRunId(), "/api/runs/" + run.getRunId()));
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get run status", description = "Check the progress of a run")
  public ResponseEntity<JobStatusResponse> status(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(run -> ResponseEntity.ok(JobStatusResponse.of(run)))
        .orElse(ResponseEntity.notFound().build());
  }

  @DeleteMapping("/{id}")
  @Operation(
      summary = "Cancel run",
      description = "Stop starting new terms; no table is written for a cancelled run")
  public ResponseEntity<JobStatusResponse> cancel(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            run -> {
              boolean accepted = run.cancel();
              LOGGER.info("Cancel request: runId={}, accepted={}", id, accepted);
              return accepted
                  ? ResponseEntity.accepted().body(JobStatusResponse.of(run))
                  : ResponseEntity.status(409).body(JobStatusResponse.of(run));
            })
        .orElse(ResponseEntity.notFound().build());
  }
}
