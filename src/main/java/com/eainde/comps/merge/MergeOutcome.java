package com.eainde.comps.merge;

import com.eainde.comps.model.MergedCandidate;

import java.util.List;

/**
 * Merged candidates in first-seen order plus what the cap removed.
 *
 * @param candidates   merged candidates, at most the configured cap
 * @param distinctSeen distinct normalized names before the cap was applied
 * @param dropped      how many distinct names the cap removed
 */
public record MergeOutcome(
        List<MergedCandidate> candidates,
        int distinctSeen,
        int dropped
) {

    public MergeOutcome {
        candidates = List.copyOf(candidates);
    }

    public boolean isCapped() {
        return dropped > 0;
    }

    /**
     * Note for the result's reasoning text, or null when nothing was dropped.
     */
    public String dropNote() {
        if (!isCapped()) return null;
        return String.format("%d of %d distinct candidates were dropped to stay within the limit of %d "
                        + "(lowest occurrence counts first).",
                dropped, distinctSeen, candidates.size());
    }
}
