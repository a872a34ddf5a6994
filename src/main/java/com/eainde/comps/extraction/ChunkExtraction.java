package com.eainde.comps.extraction;

import com.eainde.comps.model.Candidate;
import com.eainde.comps.model.Chunk;

import java.util.List;

/**
 * Outcome of extracting one chunk: the raw candidates, or the reason the chunk was lost.
 *
 * <p>A failed chunk carries no candidates; the file it belongs to is still processed but
 * reported as incomplete.</p>
 */
public record ChunkExtraction(
        Chunk chunk,
        List<Candidate> candidates,
        String failureReason
) {

    public ChunkExtraction {
        candidates = List.copyOf(candidates);
    }

    public static ChunkExtraction success(Chunk chunk, List<Candidate> candidates) {
        return new ChunkExtraction(chunk, candidates, null);
    }

    public static ChunkExtraction failure(Chunk chunk, String reason) {
        return new ChunkExtraction(chunk, List.of(), reason);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
