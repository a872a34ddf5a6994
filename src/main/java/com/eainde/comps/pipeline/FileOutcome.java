package com.eainde.comps.pipeline;

import com.eainde.comps.extraction.ChunkExtraction;
import com.eainde.comps.model.Candidate;
import com.eainde.comps.model.Chunk;
import com.eainde.comps.model.FileIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What happened to one referenced file: failed before extraction, or prepared and extracted.
 *
 * @param fileName      display name used in issues
 * @param sheetName     selected sheet, null when failed
 * @param chunks        chunks of the selected sheet
 * @param extractions   one entry per chunk once extraction has run
 * @param failureReason why the file failed, null when prepared
 */
record FileOutcome(
        String fileName,
        String sheetName,
        List<Chunk> chunks,
        List<ChunkExtraction> extractions,
        String failureReason
) {

    FileOutcome {
        chunks = List.copyOf(chunks);
        extractions = List.copyOf(extractions);
    }

    static FileOutcome failed(String fileName, String reason) {
        return new FileOutcome(fileName, null, List.of(), List.of(), reason);
    }

    static FileOutcome prepared(String fileName, String sheetName, List<Chunk> chunks) {
        return new FileOutcome(fileName, sheetName, chunks, List.of(), null);
    }

    FileOutcome withExtractions(List<ChunkExtraction> extractions) {
        return new FileOutcome(fileName, sheetName, chunks, extractions, failureReason);
    }

    boolean isFailed() {
        return failureReason != null;
    }

    FileIssue failure() {
        return new FileIssue(fileName, failureReason);
    }

    /** Candidates in chunk order. */
    List<Candidate> candidates() {
        return extractions.stream()
                .flatMap(e -> e.candidates().stream())
                .toList();
    }

    List<ChunkExtraction> lostChunks() {
        return extractions.stream().filter(e -> !e.isSuccess()).toList();
    }

    /**
     * Issue describing the lost chunks, or null when every chunk was extracted.
     */
    FileIssue incompleteIssue() {
        List<ChunkExtraction> lost = lostChunks();
        if (lost.isEmpty()) return null;
        String reasons = lost.stream().map(ChunkExtraction::failureReason).collect(Collectors.joining("; "));
        return new FileIssue(fileName, String.format("%d of %d chunk(s) could not be extracted: %s",
                lost.size(), chunks.size(), reasons));
    }
}
