package com.scholary.vocab.pipeline;

import com.scholary.vocab.audio.AudioAsset;
import com.scholary.vocab.audio.AudioFileNamer;
import com.scholary.vocab.audio.AudioFileStore;
import com.scholary.vocab.cache.CacheStatistics;
import com.scholary.vocab.cache.TranslationCache;
import com.scholary.vocab.config.PipelineProperties;
import com.scholary.vocab.gateway.GatewayAuthenticationException;
import com.scholary.vocab.logging.StructuredLogger;
import com.scholary.vocab.record.FlashcardRecord;
import com.scholary.vocab.record.IncompleteRecordException;
import com.scholary.vocab.record.RecordAssembler;
import com.scholary.vocab.script.AudioScriptBuilder;
import com.scholary.vocab.script.PronunciationScript;
import com.scholary.vocab.script.VoiceConfig;
import com.scholary.vocab.speech.SpeechGateway;
import com.scholary.vocab.speech.SpeechProperties;
import com.scholary.vocab.table.ImportHeader;
import com.scholary.vocab.table.TableWriter;
import com.scholary.vocab.table.UnsafeFieldValueException;
import com.scholary.vocab.term.Term;
import com.scholary.vocab.term.TermParser;
import com.scholary.vocab.translation.TranslationGateway;
import com.scholary.vocab.translation.TranslationResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives a vocabulary file through translation, synthesis and assembly into a flashcard table.
 *
 * <p>A run goes through these phases:
 *
 * <ol>
 *   <li>PARSING: read the distinct terms, minus those already in the previous input
 *   <li>RESOLVING: translate, build the drill script and synthesize audio for every term,
 *       concurrently on the term executor
 *   <li>ASSEMBLING: in input order, name and write the audio of every resolved term and build its
 *       record
 *   <li>WRITING: write the table
 * </ol>
 *
 * <p>A failing term is reported and left out; the rest of the run carries on. The run itself fails
 * only when the input cannot be read, credentials are refused, or audio or table files cannot be
 * written.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final int PROGRESS_LOG_INTERVAL = 10;

  private final TermParser termParser;
  private final TranslationGateway translationGateway;
  private final SpeechGateway speechGateway;
  private final AudioScriptBuilder scriptBuilder;
  private final RecordAssembler recordAssembler;
  private final TableWriter tableWriter;
  private final TranslationCache translationCache;
  private final VoiceConfig voiceConfig;
  private final PipelineProperties properties;
  private final AudioFileStore audioFileStore;
  private final String audioExtension;
  private final Executor termExecutor;
  private final Executor runExecutor;
  private final Semaphore workerPermits;

  public PipelineOrchestrator(
      TermParser termParser,
      TranslationGateway translationGateway,
      SpeechGateway speechGateway,
      AudioScriptBuilder scriptBuilder,
      RecordAssembler recordAssembler,
      TableWriter tableWriter,
      TranslationCache translationCache,
      VoiceConfig voiceConfig,
      PipelineProperties properties,
      SpeechProperties speechProperties,
      @Qualifier("termExecutor") Executor termExecutor,
      @Qualifier("runExecutor") Executor runExecutor) {

    this.termParser = termParser;
    this.translationGateway = translationGateway;
    this.speechGateway = speechGateway;
    this.scriptBuilder = scriptBuilder;
    this.recordAssembler = recordAssembler;
    this.tableWriter = tableWriter;
    this.translationCache = translationCache;
    this.voiceConfig = voiceConfig;
    this.properties = properties;
    this.audioFileStore = new AudioFileStore(Path.of(properties.audioDir()));
    this.audioExtension = speechProperties.audioEncoding().extension();
    this.termExecutor = termExecutor;
    this.runExecutor = runExecutor;
    this.workerPermits = new Semaphore(properties.workerThreads());
  }

  /**
   * Run the pipeline on the calling thread.
   *
   * @return the report; a fatal error yields phase FAILED rather than an exception
   */
  public RunReport run(RunRequest request) {
    PipelineRun run = new PipelineRun(newRunId(), request);
    execute(run);
    return run.await();
  }

  /**
   * Start the pipeline on the run executor.
   *
   * @return a handle to observe or cancel the run
   */
  public PipelineRun start(RunRequest request) {
    PipelineRun run = new PipelineRun(newRunId(), request);
    CompletableFuture.runAsync(() -> execute(run), runExecutor);
    LOGGER.info("Submitted run: runId={}, input={}", run.getRunId(), request.input());
    return run;
  }

  private void execute(PipelineRun run) {
    RunRequest request = run.getRequest();
    StructuredLogger.setRunContext(run.getRunId(), String.valueOf(request.input()));
    long translationHitsBefore = hitCount(translationGateway);
    long audioHitsBefore = hitCount(speechGateway);
    List<TermFailure> failures = new ArrayList<>();

    try {
      LOGGER.info("Starting run: input={}, output={}", request.input(), request.output());

      run.setPhase(RunPhase.PARSING);
      List<Term> terms = readNewTerms(request);
      run.setTerms(terms);
      LOGGER.info("Parsed {} terms", terms.size());

      run.setPhase(RunPhase.RESOLVING);
      List<TermOutcome> outcomes = resolveAll(run, terms);
      rethrowFatal(outcomes);
      outcomes.stream().filter(TermOutcome::isFailed).map(TermOutcome::failure).forEach(failures::add);

      if (run.isCancelled()) {
        finishCancelled(run, failures, translationHitsBefore, audioHitsBefore);
        return;
      }

      run.setPhase(RunPhase.ASSEMBLING);
      List<FlashcardRecord> records = assemble(run, request, outcomes, failures);

      if (run.isCancelled()) {
        finishCancelled(run, failures, translationHitsBefore, audioHitsBefore);
        return;
      }

      run.setPhase(RunPhase.WRITING);
      tableWriter.write(records, request.output(), importHeader(request));
      translationCache.flush();

      failures.sort((a, b) -> Integer.compare(a.index(), b.index()));
      RunReport report =
          new RunReport(
              run.getRunId(),
              RunPhase.DONE,
              request.output(),
              records.size(),
              failures,
              records.stream().map(FlashcardRecord::audioFilename).collect(Collectors.toList()),
              hitCount(translationGateway) - translationHitsBefore,
              hitCount(speechGateway) - audioHitsBefore,
              null);
      structuredLogger.logRunSummary(
          run.getRunId(),
          RunPhase.DONE.name(),
          records.size(),
          failures.size(),
          String.valueOf(request.output()));
      run.complete(report);

    } catch (RuntimeException e) {
      LOGGER.error("Run failed: runId={}, error={}", run.getRunId(), e.getMessage(), e);
      flushAfterFailure(e);
      failures.sort((a, b) -> Integer.compare(a.index(), b.index()));
      structuredLogger.logRunSummary(
          run.getRunId(), RunPhase.FAILED.name(), 0, failures.size(), "none");
      run.complete(RunReport.failed(run.getRunId(), describe(e), failures));
    } finally {
      StructuredLogger.clearRunContext();
    }
  }

  private List<Term> readNewTerms(RunRequest request) {
    List<Term> terms = termParser.parseAll(request.input());
    Path previous = request.previousInput();
    if (previous == null) {
      return terms;
    }
    if (!Files.exists(previous)) {
      LOGGER.info("Previous input {} does not exist, every term is new", previous);
      return terms;
    }

    Set<String> known =
        termParser.parseAll(previous).stream().map(Term::text).collect(Collectors.toSet());
    List<Term> fresh =
        terms.stream().filter(term -> !known.contains(term.text())).collect(Collectors.toList());
    LOGGER.info(
        "Incremental run: {} terms in input, {} already in {}, {} new",
        terms.size(),
        terms.size() - fresh.size(),
        previous,
        fresh.size());
    return fresh;
  }

  private List<TermOutcome> resolveAll(PipelineRun run, List<Term> terms) {
    AtomicInteger settled = new AtomicInteger();
    AtomicInteger failed = new AtomicInteger();
    List<CompletableFuture<TermOutcome>> futures = new ArrayList<>(terms.size());

    for (int i = 0; i < terms.size(); i++) {
      int index = i;
      Term term = terms.get(i);
      CompletableFuture<TermOutcome> future =
          submit(run, index, term)
              .handle(
                  (outcome, error) -> {
                    TermOutcome result = outcome != null ? outcome : settle(run, index, term, error);
                    if (result.isFailed()) {
                      failed.incrementAndGet();
                    }
                    int done = settled.incrementAndGet();
                    if (done % PROGRESS_LOG_INTERVAL == 0 || done == terms.size()) {
                      structuredLogger.logRunProgress(
                          run.getRunId(),
                          RunPhase.RESOLVING.name(),
                          done,
                          terms.size(),
                          failed.get());
                    }
                    return result;
                  });
      futures.add(future);
    }

    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
  }

  /**
   * Hand one term to the term executor once a worker permit is free.
   *
   * <p>The term timeout starts when a worker picks the term up, so time spent waiting for a permit
   * or in the executor queue does not count against it. The permit is held until the worker
   * returns, even when the term has already timed out.
   */
  private CompletableFuture<TermOutcome> submit(PipelineRun run, int index, Term term) {
    try {
      workerPermits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting for a term worker");
    }

    CompletableFuture<TermOutcome> result = new CompletableFuture<>();
    try {
      termExecutor.execute(
          () -> {
            result.orTimeout(properties.termTimeoutSeconds(), TimeUnit.SECONDS);
            try {
              result.complete(resolve(run, index, term));
            } catch (RuntimeException e) {
              result.completeExceptionally(e);
            } finally {
              workerPermits.release();
            }
          });
    } catch (RejectedExecutionException e) {
      workerPermits.release();
      throw e;
    }
    return result;
  }

  private TermOutcome resolve(PipelineRun run, int index, Term term) {
    long startTime = System.currentTimeMillis();

    checkNotStopped(run);
    enter(run, index, TermState.TRANSLATING);
    structuredLogger.logTermStarted(index, term.text());
    TranslationResult translation = translationGateway.translate(term);

    checkNotStopped(run);
    enter(run, index, TermState.SYNTHESIZING);
    PronunciationScript script = scriptBuilder.build(term, translation, voiceConfig);
    byte[] audio = speechGateway.synthesize(script);

    enter(run, index, TermState.RESOLVED);
    structuredLogger.logTermResolved(
        index, term.text(), System.currentTimeMillis() - startTime, audio.length);
    return TermOutcome.resolved(index, term, translation, script, audio);
  }

  /** Move a term on, unless it has already been settled as timed out. */
  private static void enter(PipelineRun run, int index, TermState next) {
    if (!run.transition(index, next)) {
      throw new CancellationException("Term already settled, skipping " + next);
    }
  }

  private static void checkNotStopped(PipelineRun run) {
    if (run.shouldStop()) {
      throw new CancellationException("Run stopped before this term was processed");
    }
  }

  /** Turn a per-term error into a failure, or a fatal outcome that stops the run. */
  private TermOutcome settle(PipelineRun run, int index, Term term, Throwable error) {
    Throwable cause = unwrap(error);
    Optional<FailureKind> kind = FailureKind.of(cause);
    if (kind.isEmpty()) {
      run.abort();
      RuntimeException fatal =
          cause instanceof RuntimeException
              ? (RuntimeException) cause
              : new IllegalStateException("Term failed unexpectedly: " + term.text(), cause);
      return TermOutcome.fatal(index, term, fatal);
    }
    return TermOutcome.failed(index, term, fail(run, index, term, kind.get(), cause));
  }

  private TermFailure fail(
      PipelineRun run, int index, Term term, FailureKind kind, Throwable cause) {
    run.transition(index, TermState.FAILED);
    String message =
        cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    structuredLogger.logTermFailed(index, term.text(), kind.name(), message);
    return new TermFailure(index, term.text(), kind, message);
  }

  private List<FlashcardRecord> assemble(
      PipelineRun run, RunRequest request, List<TermOutcome> outcomes, List<TermFailure> failures) {

    int startIndex =
        request.startIndex() != null
            ? request.startIndex()
            : audioFileStore.nextAvailableIndex(
                properties.soundfilePrefix(), properties.baseIndex());
    AudioFileNamer namer = new AudioFileNamer(startIndex, properties.indexWidth(), audioExtension);

    List<FlashcardRecord> records = new ArrayList<>();
    for (TermOutcome outcome : outcomes) {
      if (outcome.isFailed()) {
        continue;
      }
      Term term = outcome.term();
      TranslationResult translation = outcome.translation();
      try {
        recordAssembler.checkComplete(term, translation, outcome.audio());
        tableWriter.validate(
            term.text(), translation.romanized(), translation.translated(), term.notes());
      } catch (IncompleteRecordException | UnsafeFieldValueException e) {
        FailureKind kind = FailureKind.of(e).orElseThrow();
        failures.add(fail(run, outcome.index(), term, kind, e));
        continue;
      }

      AudioAsset asset =
          new AudioAsset(
              namer.next(properties.soundfilePrefix()), outcome.audio(), outcome.script());
      audioFileStore.write(asset);
      records.add(recordAssembler.assemble(term, translation, asset, term.notes()));
      run.transition(outcome.index(), TermState.ASSEMBLED);
    }

    LOGGER.info(
        "Assembled {} records, audio {} to {}",
        records.size(),
        records.isEmpty() ? "none" : records.get(0).audioFilename(),
        records.isEmpty() ? "none" : records.get(records.size() - 1).audioFilename());
    return records;
  }

  private void finishCancelled(
      PipelineRun run, List<TermFailure> failures, long translationHits, long audioHits) {
    translationCache.flush();
    failures.sort((a, b) -> Integer.compare(a.index(), b.index()));
    structuredLogger.logRunSummary(
        run.getRunId(), RunPhase.CANCELLED.name(), 0, failures.size(), "none");
    run.complete(
        new RunReport(
            run.getRunId(),
            RunPhase.CANCELLED,
            null,
            0,
            failures,
            List.of(),
            hitCount(translationGateway) - translationHits,
            hitCount(speechGateway) - audioHits,
            null));
  }

  private ImportHeader importHeader(RunRequest request) {
    String noteType = request.noteType() != null ? request.noteType() : properties.noteType();
    String deck = request.deck() != null ? request.deck() : properties.deck();
    return new ImportHeader(noteType, deck);
  }

  /** Keep what was already paid for even when the run fails. */
  private void flushAfterFailure(RuntimeException failure) {
    try {
      translationCache.flush();
    } catch (RuntimeException e) {
      LOGGER.error("Failed to flush translation cache after run failure", e);
      failure.addSuppressed(e);
    }
  }

  private static void rethrowFatal(List<TermOutcome> outcomes) {
    for (TermOutcome outcome : outcomes) {
      if (outcome.isFatal()) {
        throw outcome.fatal();
      }
    }
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String describe(RuntimeException e) {
    if (e instanceof GatewayAuthenticationException) {
      return "Authentication failed: " + e.getMessage();
    }
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private static long hitCount(Object gateway) {
    return gateway instanceof CacheStatistics ? ((CacheStatistics) gateway).hitCount() : 0;
  }

  private static String newRunId() {
    return UUID.randomUUID().toString();
  }
}
