package com.eyelevel.paperprocessor.service.pipeline;

import com.eyelevel.paperprocessor.config.PaperProcessingConfig;
import com.eyelevel.paperprocessor.exception.MainFileNotFoundException;
import com.eyelevel.paperprocessor.model.CompilationOutcome;
import com.eyelevel.paperprocessor.model.ErrorType;
import com.eyelevel.paperprocessor.model.FileSet;
import com.eyelevel.paperprocessor.model.PipelineStage;
import com.eyelevel.paperprocessor.model.PipelineStatus;
import com.eyelevel.paperprocessor.model.ProcessingRequest;
import com.eyelevel.paperprocessor.model.ProcessingResult;
import com.eyelevel.paperprocessor.model.RenderedArtifact;
import com.eyelevel.paperprocessor.model.StageOutcome;
import com.eyelevel.paperprocessor.model.StageOutcome.StageCall;
import com.eyelevel.paperprocessor.service.archive.SourceArchiveExtractor;
import com.eyelevel.paperprocessor.service.download.ArxivSourceDownloader;
import com.eyelevel.paperprocessor.service.download.DownloadRetryListener;
import com.eyelevel.paperprocessor.service.latex.LatexCompiler;
import com.eyelevel.paperprocessor.service.latex.LatexTextExtractor;
import com.eyelevel.paperprocessor.service.latex.MainFileResolver;
import com.eyelevel.paperprocessor.service.rendering.RenderedArtifactReader;
import com.eyelevel.paperprocessor.service.validation.PaperIdValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;

/**
 * Runs papers through the processing pipeline: validate, download, extract, resolve the main file, extract
 * text and, on request, compile and read the rendered PDF.
 * <p>
 * Each stage is bounded by its own slot pool, sized from configuration, and all downloads share one rate
 * limiter. A stage error ends the run with a failed {@link ProcessingResult}; it never escapes to the caller
 * and never affects other runs. Compilation and rendered-artifact errors do not fail the run at all: they are
 * recorded in {@link ProcessingResult#getCompilationError()}.
 */
@Slf4j
@Service
public class PaperPipelineService {

    static final String PIPELINE_COUNTER = "paper.pipeline";
    static final String STAGE_TIMER = "paper.pipeline.stage";

    private final PaperIdValidator validator;
    private final ArxivSourceDownloader downloader;
    private final SourceArchiveExtractor extractor;
    private final MainFileResolver mainFileResolver;
    private final LatexTextExtractor textExtractor;
    private final LatexCompiler compiler;
    private final RenderedArtifactReader renderedArtifactReader;
    private final RetryTemplate downloadRetryTemplate;
    private final AsyncTaskExecutor taskExecutor;
    private final MeterRegistry meterRegistry;
    private final PaperProcessingConfig config;

    private final Semaphore downloadSlots;
    private final Semaphore extractionSlots;
    private final Semaphore compilationSlots;

    public PaperPipelineService(PaperIdValidator validator,
                                ArxivSourceDownloader downloader,
                                SourceArchiveExtractor extractor,
                                MainFileResolver mainFileResolver,
                                LatexTextExtractor textExtractor,
                                LatexCompiler compiler,
                                @Qualifier("renderedArtifactReader") RenderedArtifactReader renderedArtifactReader,
                                @Qualifier("downloadRetryTemplate") RetryTemplate downloadRetryTemplate,
                                @Qualifier("pipelineTaskExecutor") AsyncTaskExecutor taskExecutor,
                                MeterRegistry meterRegistry,
                                PaperProcessingConfig config) {
        this.validator = validator;
        this.downloader = downloader;
        this.extractor = extractor;
        this.mainFileResolver = mainFileResolver;
        this.textExtractor = textExtractor;
        this.compiler = compiler;
        this.renderedArtifactReader = renderedArtifactReader;
        this.downloadRetryTemplate = downloadRetryTemplate;
        this.taskExecutor = taskExecutor;
        this.meterRegistry = meterRegistry;
        this.config = config;
        this.downloadSlots = new Semaphore(config.getDownload().getMaxConcurrent(), true);
        this.extractionSlots = new Semaphore(config.getExtraction().getMaxConcurrent(), true);
        this.compilationSlots = new Semaphore(config.getCompilation().getMaxConcurrent(), true);
    }

    /**
     * Runs one paper through the pipeline on the calling thread.
     *
     * @param request The paper to process.
     * @return The result; stage errors are reported in it rather than thrown.
     */
    public ProcessingResult process(final ProcessingRequest request) {
        final long start = System.currentTimeMillis();
        ProcessingResult result;
        try {
            result = run(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Processing was interrupted.", request.id());
            result = ProcessingResult.failure(request.id(), ErrorType.INTERNAL, "Processing was interrupted");
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error while processing paper.", request.id(), e);
            result = ProcessingResult.failure(request.id(), ErrorType.INTERNAL, "Unexpected error: " + e.getMessage());
        }

        meterRegistry.counter(PIPELINE_COUNTER, "outcome", result.isSuccess() ? "success" : "failure").increment();
        log.info("[{}] Processing finished in {} ms. Success: {}, files: {}, rendered artifact: {}.", request.id(),
                System.currentTimeMillis() - start, result.isSuccess(), result.getFileCount(),
                result.isRenderedArtifactProduced());
        return result;
    }

    /**
     * Schedules {@link #process(ProcessingRequest)} on the pipeline worker pool.
     * Cancelling the returned future with interruption releases any slot the run holds and removes its
     * temporary files.
     */
    public Future<ProcessingResult> submit(final ProcessingRequest request) {
        return taskExecutor.submit(() -> process(request));
    }

    /**
     * Processes a batch concurrently and returns one result per ID, in input order.
     * A failing, rejected or cancelled item yields a failed result for that item only.
     */
    public List<ProcessingResult> processMany(final List<String> ids, final boolean includeRenderedArtifact) {
        log.info("Processing batch of {} paper(s). Rendered artifacts requested: {}.", ids.size(),
                includeRenderedArtifact);
        final List<Future<ProcessingResult>> futures = new ArrayList<>(ids.size());
        for (String id : ids) {
            final ProcessingRequest request = new ProcessingRequest(id == null ? "" : id, includeRenderedArtifact);
            try {
                futures.add(submit(request));
            } catch (TaskRejectedException e) {
                log.error("[{}] Pipeline worker pool rejected the task.", id, e);
                futures.add(CompletableFuture.completedFuture(
                        ProcessingResult.failure(request.id(), ErrorType.INTERNAL, "Processing capacity exhausted")));
            }
        }

        final List<ProcessingResult> results = new ArrayList<>(ids.size());
        for (int i = 0; i < futures.size(); i++) {
            final String id = ids.get(i) == null ? "" : ids.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                final Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("[{}] Processing task failed.", id, cause);
                results.add(ProcessingResult.failure(id, ErrorType.INTERNAL, "Processing failed: " + cause.getMessage()));
            } catch (CancellationException e) {
                log.warn("[{}] Processing task was cancelled.", id);
                results.add(ProcessingResult.failure(id, ErrorType.INTERNAL, "Processing was cancelled"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Batch interrupted; cancelling {} outstanding item(s).", futures.size() - i);
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(true);
                    final String pending = ids.get(j) == null ? "" : ids.get(j);
                    results.add(ProcessingResult.failure(pending, ErrorType.INTERNAL, "Processing was interrupted"));
                }
                break;
            }
        }
        return results;
    }

    /**
     * @return The configured limits, currently free slots per stage and the pipeline counters.
     */
    public PipelineStatus status() {
        final PipelineStatus.Limits limits = new PipelineStatus.Limits(
                config.getDownload().getMaxConcurrent(),
                config.getExtraction().getMaxConcurrent(),
                config.getCompilation().getMaxConcurrent(),
                config.getDownload().getRequestsPerSecond(),
                config.getExtraction().getMaxFiles());
        final PipelineStatus.Slots slots = new PipelineStatus.Slots(
                downloadSlots.availablePermits(),
                extractionSlots.availablePermits(),
                compilationSlots.availablePermits());

        final Map<String, Double> counters = new LinkedHashMap<>();
        counters.put("processed.success", count(PIPELINE_COUNTER, "outcome", "success"));
        counters.put("processed.failure", count(PIPELINE_COUNTER, "outcome", "failure"));
        counters.put("downloads.success", count(ArxivSourceDownloader.DOWNLOAD_COUNTER, "status", "success"));
        counters.put("downloads.error", count(ArxivSourceDownloader.DOWNLOAD_COUNTER, "status", "error"));
        return new PipelineStatus(limits, slots, counters);
    }

    private ProcessingResult run(final ProcessingRequest request) throws InterruptedException {
        final StageOutcome<String> validated = runStage(PipelineStage.VALIDATING, request.id(),
                () -> validator.requireValid(request.id()));
        if (!(validated instanceof StageOutcome.Success<String> validId)) {
            return failed(request.id(), validated);
        }
        final String paperId = validId.value();
        log.info("[{}] Processing paper. Rendered artifact requested: {}.", paperId,
                request.includeRenderedArtifact());

        final StageOutcome<byte[]> downloaded = runStage(PipelineStage.DOWNLOADING, paperId,
                () -> withSlot(downloadSlots, () -> download(paperId)));
        if (!(downloaded instanceof StageOutcome.Success<byte[]> archive)) {
            return failed(paperId, downloaded);
        }

        final StageOutcome<FileSet> extracted = runStage(PipelineStage.EXTRACTING, paperId,
                () -> withSlot(extractionSlots,
                        () -> extractor.extract(archive.value(), config.getExtraction().getMaxFiles(), paperId)));
        if (!(extracted instanceof StageOutcome.Success<FileSet> extractedFiles)) {
            return failed(paperId, extracted);
        }
        final FileSet files = extractedFiles.value();

        final StageOutcome<String> resolved = runStage(PipelineStage.RESOLVING, paperId,
                () -> mainFileResolver.resolve(files).orElseThrow(() -> new MainFileNotFoundException(
                        "No main .tex file found among " + files.size() + " extracted file(s)")));
        if (!(resolved instanceof StageOutcome.Success<String> mainFile)) {
            return failed(paperId, resolved);
        }
        log.info("[{}] Main file is '{}'.", paperId, mainFile.value());

        final StageOutcome<String> text = runStage(PipelineStage.EXTRACTING_TEXT, paperId,
                () -> textExtractor.toText(files.text(mainFile.value()).orElse("")));
        if (!(text instanceof StageOutcome.Success<String> extractedText)) {
            return failed(paperId, text);
        }

        final ProcessingResult result = ProcessingResult.success(paperId, mainFile.value(), extractedText.value(),
                files.size());
        if (!request.includeRenderedArtifact()) {
            return result;
        }
        return withRenderedArtifact(result, files, mainFile.value(), paperId);
    }

    /**
     * Compiles the sources and reads the PDF. Failures here are recorded on the result without failing it.
     */
    private ProcessingResult withRenderedArtifact(final ProcessingResult result, final FileSet files,
                                                  final String mainFile, final String paperId)
            throws InterruptedException {
        final Duration timeout = Duration.ofSeconds(config.getCompilation().getTimeoutSeconds());
        final StageOutcome<CompilationOutcome> compiled = runStage(PipelineStage.COMPILING, paperId,
                () -> withSlot(compilationSlots, () -> compiler.compile(files, mainFile, timeout, paperId)));

        if (compiled instanceof StageOutcome.Failure<CompilationOutcome> failure) {
            return result.withCompilationError(failure.error().getMessage());
        }
        final CompilationOutcome outcome = ((StageOutcome.Success<CompilationOutcome>) compiled).value();
        if (outcome instanceof CompilationOutcome.Failure compileFailure) {
            return result.withCompilationError(compileFailure.kind() + ": " + compileFailure.message());
        }

        final byte[] pdf = ((CompilationOutcome.Success) outcome).pdf();
        final StageOutcome<RenderedArtifact> read = runStage(PipelineStage.READING_ARTIFACT, paperId,
                () -> renderedArtifactReader.read(pdf));
        if (read instanceof StageOutcome.Success<RenderedArtifact> artifact) {
            return result.withRenderedArtifact(artifact.value(), pdf.length);
        }
        final StageOutcome.Failure<RenderedArtifact> readFailure = (StageOutcome.Failure<RenderedArtifact>) read;
        return result.withCompilationError(readFailure.error().getMessage());
    }

    private byte[] download(final String paperId) throws InterruptedException {
        final Duration timeout = Duration.ofSeconds(config.getDownload().getTimeoutSeconds());
        try {
            return downloadRetryTemplate.execute(context -> {
                context.setAttribute(DownloadRetryListener.PAPER_ID_ATTRIBUTE, paperId);
                return downloader.fetch(paperId, timeout);
            });
        } catch (BackOffInterruptedException e) {
            throw new InterruptedException("Interrupted while waiting to retry the download");
        }
    }

    private <T> StageOutcome<T> runStage(final PipelineStage stage, final String paperId, final StageCall<T> call)
            throws InterruptedException {
        final Timer.Sample sample = Timer.start(meterRegistry);
        final StageOutcome<T> outcome = StageOutcome.attempt(stage, call);
        sample.stop(meterRegistry.timer(STAGE_TIMER, "stage", stage.metricTag(),
                "outcome", outcome instanceof StageOutcome.Success ? "success" : "failure"));
        if (outcome instanceof StageOutcome.Failure<T> failure) {
            log.warn("[{}] Stage {} failed: {}", paperId, stage, failure.error().getMessage());
        }
        return outcome;
    }

    private static <T> T withSlot(final Semaphore slots, final StageCall<T> call) throws InterruptedException {
        slots.acquire();
        try {
            return call.call();
        } finally {
            slots.release();
        }
    }

    private static ProcessingResult failed(final String paperId, final StageOutcome<?> outcome) {
        final StageOutcome.Failure<?> failure = (StageOutcome.Failure<?>) outcome;
        return ProcessingResult.failure(paperId, failure.error().getErrorType(), failure.error().getMessage());
    }

    private double count(final String name, final String tagKey, final String tagValue) {
        final Counter counter = meterRegistry.find(name).tag(tagKey, tagValue).counter();
        return counter == null ? 0.0 : counter.count();
    }
}
