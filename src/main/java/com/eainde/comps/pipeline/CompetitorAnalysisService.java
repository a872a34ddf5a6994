package com.eainde.comps.pipeline;

import com.eainde.comps.cache.FingerprintCache;
import com.eainde.comps.cache.RequestFingerprint;
import com.eainde.comps.chunk.SheetChunker;
import com.eainde.comps.classify.ClassificationOutcome;
import com.eainde.comps.classify.CompetitorClassifier;
import com.eainde.comps.extraction.ChunkExtraction;
import com.eainde.comps.extraction.ExtractionOrchestrator;
import com.eainde.comps.merge.CandidateMerger;
import com.eainde.comps.merge.MergeOutcome;
import com.eainde.comps.model.AnalysisResult;
import com.eainde.comps.model.CacheStats;
import com.eainde.comps.model.Candidate;
import com.eainde.comps.model.Chunk;
import com.eainde.comps.model.FileIssue;
import com.eainde.comps.model.FileReference;
import com.eainde.comps.model.SelectedSheet;
import com.eainde.comps.resolve.CopilotFilePathExtractor;
import com.eainde.comps.resolve.FileResolutionException;
import com.eainde.comps.resolve.FileResolver;
import com.eainde.comps.sheet.NoMatchingSheetException;
import com.eainde.comps.sheet.SheetSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of a competitor analysis: resolve, fingerprint, then serve from cache or run
 * the pipeline once per fingerprint.
 *
 * <h3>Pipeline (cache miss):</h3>
 * <pre>
 * PREPARE:  per file, on the worker pool → select sheet → chunk
 * EXTRACT:  per chunk, on the worker pool → raw candidates (lost chunks degrade to none)
 *           ── single wait for every file and chunk ──
 * MERGE:    candidates in file/chunk order → de-duplicated, capped
 * CLASSIFY: one model call → verified / to cross-check
 * ASSEMBLE: AnalysisResult(cached=false) → cache
 * </pre>
 *
 * <p>Per-file and per-chunk failures are recorded and never abort the batch, unless lost
 * chunks leave no candidate at all ({@link ExtractionFailureException}). The caller
 * waits up to {@code comps.pipeline.request-timeout}; a computation that outlives the
 * caller still populates the cache.</p>
 */
@Service
public class CompetitorAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(CompetitorAnalysisService.class);

    static final String MDC_ANALYSIS_ID = "analysisId";
    static final String MDC_FINGERPRINT = "fingerprint";

    static final String NO_FILES_REASONING = "No files were provided for analysis.";
    static final String NO_COPILOT_PATHS_REASONING = "No file paths found in Copilot response.";

    private final FileResolver fileResolver;
    private final SheetSelector sheetSelector;
    private final SheetChunker chunker;
    private final ExtractionOrchestrator extractor;
    private final CandidateMerger merger;
    private final CompetitorClassifier classifier;
    private final FingerprintCache cache;
    private final CopilotFilePathExtractor pathExtractor;
    private final Executor workers;
    private final Duration requestTimeout;

    public CompetitorAnalysisService(FileResolver fileResolver,
                                     SheetSelector sheetSelector,
                                     SheetChunker chunker,
                                     ExtractionOrchestrator extractor,
                                     CandidateMerger merger,
                                     CompetitorClassifier classifier,
                                     FingerprintCache cache,
                                     CopilotFilePathExtractor pathExtractor,
                                     @Qualifier("extractionWorkers") Executor workers,
                                     @Value("${comps.pipeline.request-timeout:PT15M}") Duration requestTimeout) {
        this.fileResolver = fileResolver;
        this.sheetSelector = sheetSelector;
        this.chunker = chunker;
        this.extractor = extractor;
        this.merger = merger;
        this.classifier = classifier;
        this.cache = cache;
        this.pathExtractor = pathExtractor;
        this.workers = workers;
        this.requestTimeout = requestTimeout;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Analyzes the referenced files for competitors of the target company.
     *
     * @param targetCompany  non-blank company name
     * @param fileReferences ordered references; null or empty gives an empty result
     * @throws IllegalArgumentException                                       blank target company
     * @throws NoUsableFilesException                                         no referenced file could be used
     * @throws ExtractionFailureException                                     lost chunks left no candidates at all
     * @throws com.eainde.comps.classify.ClassificationFailureException classification failed
     * @throws AnalysisTimeoutException                                       caller-side timeout
     */
    public AnalysisResult analyze(String targetCompany, List<String> fileReferences) {
        if (targetCompany == null || targetCompany.isBlank()) {
            throw new IllegalArgumentException("target_company must not be blank");
        }
        String target = targetCompany.strip();
        List<String> references = fileReferences == null ? List.of() : fileReferences;

        String analysisId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_ANALYSIS_ID, analysisId);
        try {
            log.info("Starting analysis for '{}' with {} file reference(s)", target, references.size());

            List<FileReference> files = resolveAll(references);
            String fingerprint = RequestFingerprint.compute(target, files);
            MDC.put(MDC_FINGERPRINT, fingerprint.substring(0, 12));

            CompletableFuture<AnalysisResult> future =
                    cache.getOrCompute(fingerprint, () -> compute(target, files));
            return await(future);
        } finally {
            MDC.remove(MDC_FINGERPRINT);
            MDC.remove(MDC_ANALYSIS_ID);
        }
    }

    /**
     * Analyzes the files named in a Copilot search answer ({@code Full Path: ...} lines).
     */
    public AnalysisResult analyzeCopilotResponse(String targetCompany, String copilotResponse) {
        if (targetCompany == null || targetCompany.isBlank()) {
            throw new IllegalArgumentException("target_company must not be blank");
        }
        List<CopilotFilePathExtractor.ExtractedPath> paths = pathExtractor.extract(copilotResponse);
        if (paths.isEmpty()) {
            log.warn("No file paths found in Copilot response for '{}'", targetCompany);
            return AnalysisResult.empty(targetCompany.strip(), NO_COPILOT_PATHS_REASONING,
                    0, 0, List.of(), List.of());
        }
        log.info("Found {} file path(s) in Copilot response", paths.size());
        return analyze(targetCompany, paths.stream().map(CopilotFilePathExtractor.ExtractedPath::relativePath).toList());
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    // =========================================================================
    //  Resolution
    // =========================================================================

    private List<FileReference> resolveAll(List<String> references) {
        List<FileReference> files = new ArrayList<>(references.size());
        for (int i = 0; i < references.size(); i++) {
            String reference = references.get(i);
            try {
                files.add(fileResolver.resolve(reference));
            } catch (FileResolutionException e) {
                log.warn("File {}/{} could not be resolved: {} ({})",
                        i + 1, references.size(), reference, e.getMessage());
                files.add(FileReference.unresolved(reference, e.getMessage()));
            }
        }
        return files;
    }

    private AnalysisResult await(CompletableFuture<AnalysisResult> future) {
        try {
            return future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Analysis still running after {}; caller released", requestTimeout);
            throw new AnalysisTimeoutException(requestTimeout, e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for analysis", e);
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) return runtime;
        if (cause instanceof Error error) throw error;
        return new IllegalStateException("Analysis failed", cause);
    }

    // =========================================================================
    //  Computation (runs once per fingerprint)
    // =========================================================================

    AnalysisResult compute(String target, List<FileReference> files) {
        long start = System.nanoTime();
        int totalFiles = files.size();
        if (totalFiles == 0) {
            log.info("No files referenced; returning empty result");
            return AnalysisResult.empty(target, NO_FILES_REASONING, 0, 0, List.of(), List.of());
        }

        // ── STEP 1: PREPARE + EXTRACT on the worker pool ────────────────
        List<CompletableFuture<FileOutcome>> perFile = new ArrayList<>(totalFiles);
        for (FileReference file : files) {
            if (!file.isResolved()) {
                perFile.add(CompletableFuture.completedFuture(
                        FileOutcome.failed(file.displayName(), file.failureReason())));
                continue;
            }
            perFile.add(CompletableFuture.supplyAsync(() -> prepare(file), workers)
                    .thenCompose(outcome -> extractAll(outcome, target)));
        }

        // ── STEP 2: single wait for every file and chunk ────────────────
        CompletableFuture.allOf(perFile.toArray(new CompletableFuture[0])).join();
        List<FileOutcome> outcomes = perFile.stream().map(CompletableFuture::join).toList();

        List<FileIssue> failed = new ArrayList<>();
        List<FileIssue> incomplete = new ArrayList<>();
        List<Candidate> candidates = new ArrayList<>();
        for (FileOutcome outcome : outcomes) {
            if (outcome.isFailed()) {
                failed.add(outcome.failure());
                continue;
            }
            candidates.addAll(outcome.candidates());
            FileIssue issue = outcome.incompleteIssue();
            if (issue != null) incomplete.add(issue);
        }
        int processed = totalFiles - failed.size();
        log.info("Extraction finished: {}/{} files processed, {} failed, {} incomplete, {} raw candidates",
                processed, totalFiles, failed.size(), incomplete.size(), candidates.size());

        if (processed == 0) {
            throw new NoUsableFilesException(failed);
        }
        if (candidates.isEmpty() && !incomplete.isEmpty()) {
            log.error("No candidates extracted and {} file(s) lost chunks", incomplete.size());
            throw new ExtractionFailureException(failed, incomplete);
        }

        // ── STEP 3: MERGE ──────────────────────────────────────────────
        MergeOutcome merged = merger.merge(candidates);

        // ── STEP 4: CLASSIFY ───────────────────────────────────────────
        ClassificationOutcome classified = classifier.classify(target, merged.candidates());

        // ── STEP 5: ASSEMBLE ───────────────────────────────────────────
        String reasoning = classified.reasoning();
        if (merged.isCapped()) {
            reasoning = reasoning.isEmpty() ? merged.dropNote() : reasoning + " " + merged.dropNote();
        }

        AnalysisResult result = AnalysisResult.of(target, classified.verified(), classified.toCrosscheck(),
                reasoning, processed, totalFiles, failed, incomplete);
        log.info("Analysis complete in {} ms: {} verified, {} to cross-check",
                (System.nanoTime() - start) / 1_000_000, result.verifiedCount(), result.crosscheckCount());
        return result;
    }

    private FileOutcome prepare(FileReference file) {
        try {
            SelectedSheet sheet = sheetSelector.select(file);
            List<Chunk> chunks = chunker.chunk(sheet);
            return FileOutcome.prepared(file.displayName(), sheet.sheetName(), chunks);
        } catch (NoMatchingSheetException e) {
            log.warn("Skipping {}: {}", file.displayName(), e.getMessage());
            return FileOutcome.failed(file.displayName(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to prepare {}", file.displayName(), e);
            return FileOutcome.failed(file.displayName(), "Preparation failed: " + e.getMessage());
        }
    }

    private CompletableFuture<FileOutcome> extractAll(FileOutcome outcome, String target) {
        if (outcome.isFailed() || outcome.chunks().isEmpty()) {
            return CompletableFuture.completedFuture(outcome);
        }

        List<CompletableFuture<ChunkExtraction>> perChunk = new ArrayList<>(outcome.chunks().size());
        for (Chunk chunk : outcome.chunks()) {
            perChunk.add(CompletableFuture.supplyAsync(() -> extractor.extract(chunk, target), workers)
                    .exceptionally(e -> {
                        log.error("Extraction of {} failed unexpectedly", chunk, e);
                        return ChunkExtraction.failure(chunk, "unexpected error: " + e.getMessage());
                    }));
        }
        return CompletableFuture.allOf(perChunk.toArray(new CompletableFuture[0]))
                .thenApply(v -> outcome.withExtractions(perChunk.stream().map(CompletableFuture::join).toList()));
    }
}
