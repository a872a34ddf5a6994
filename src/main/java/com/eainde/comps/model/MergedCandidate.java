package com.eainde.comps.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A de-duplicated company name aggregated from one or more raw extractions.
 *
 * @param name            display name: first-seen occurrence, whitespace collapsed, casing kept
 * @param normalizedKey   merge key: trimmed, whitespace collapsed, NFKC, case-folded
 * @param sourceFileIds   files the name was seen in, in first-seen order
 * @param occurrenceCount total number of raw occurrences across chunks and files
 */
public record MergedCandidate(
        String name,
        String normalizedKey,
        Set<String> sourceFileIds,
        int occurrenceCount
) {

    public MergedCandidate {
        sourceFileIds = Collections.unmodifiableSet(new LinkedHashSet<>(sourceFileIds));
    }
}
