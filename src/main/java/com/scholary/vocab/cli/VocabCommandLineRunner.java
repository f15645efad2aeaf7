package com.scholary.vocab.cli;

import com.scholary.vocab.pipeline.PipelineOrchestrator;
import com.scholary.vocab.pipeline.RunPhase;
import com.scholary.vocab.pipeline.RunReport;
import com.scholary.vocab.pipeline.RunRequest;
import com.scholary.vocab.pipeline.TermFailure;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once from the command line.
 *
 * <pre>
 * --input=vocab.txt --output=vocab.csv [--start-index=N] [--previous=old-vocab.txt]
 *     [--deck=Russian] [--notetype=Basic]
 * </pre>
 *
 * <p>Does nothing unless {@code --input} is given, so the same jar also serves the REST API.
 */
@Component
public class VocabCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(VocabCommandLineRunner.class);

  static final String INPUT = "input";
  static final String OUTPUT = "output";
  static final String START_INDEX = "start-index";
  static final String PREVIOUS = "previous";
  static final String DECK = "deck";
  static final String NOTE_TYPE = "notetype";

  private final PipelineOrchestrator orchestrator;

  private int exitCode;

  public VocabCommandLineRunner(PipelineOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  /** Whether the raw arguments ask for a one-off command-line run. */
  public static boolean isCommandLineRun(String[] args) {
    return Arrays.stream(args)
        .anyMatch(arg -> arg.equals("--" + INPUT) || arg.startsWith("--" + INPUT + "="));
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!args.containsOption(INPUT)) {
      return;
    }

    RunRequest request = toRunRequest(args);
    RunReport report = orchestrator.run(request);

    for (TermFailure failure : report.failures()) {
      LOGGER.warn("Skipped '{}': {} ({})", failure.term(), failure.kind(), failure.message());
    }
    if (report.phase() == RunPhase.DONE) {
      LOGGER.info(
          "Wrote {} cards to {} ({} skipped, {} cached translations, {} cached audio)",
          report.recordsWritten(),
          report.output(),
          report.failures().size(),
          report.translationCacheHits(),
          report.audioCacheHits());
      exitCode = 0;
    } else {
      LOGGER.error("Run ended in {}: {}", report.phase(), report.error());
      exitCode = 1;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  static RunRequest toRunRequest(ApplicationArguments args) {
    String input = single(args, INPUT);
    String output = single(args, OUTPUT);
    if (input == null || output == null) {
      throw new IllegalArgumentException("Both --input and --output are required");
    }
    String startIndex = single(args, START_INDEX);
    String previous = single(args, PREVIOUS);

    return new RunRequest(
        Path.of(input),
        Path.of(output),
        startIndex == null ? null : parseIndex(startIndex),
        previous == null ? null : Path.of(previous),
        single(args, DECK),
        single(args, NOTE_TYPE));
  }

  private static Integer parseIndex(String value) {
    try {
      return Integer.valueOf(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--start-index must be a number: " + value, e);
    }
  }

  private static String single(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    String value = values.get(values.size() - 1);
    return value.isBlank() ? null : value;
  }
}
