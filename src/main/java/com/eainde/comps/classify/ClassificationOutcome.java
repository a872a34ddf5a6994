package com.eainde.comps.classify;

import com.eainde.comps.model.ClassifiedCompany;

import java.util.List;

/**
 * Bucketed classifier output.
 *
 * @param verified     score at or above the threshold, descending score
 * @param toCrosscheck score below the threshold, descending score
 * @param reasoning    model's industry analysis followed by any notes about dropped entries
 */
public record ClassificationOutcome(
        List<ClassifiedCompany> verified,
        List<ClassifiedCompany> toCrosscheck,
        String reasoning
) {

    public ClassificationOutcome {
        verified = List.copyOf(verified);
        toCrosscheck = List.copyOf(toCrosscheck);
    }

    public static ClassificationOutcome empty(String reasoning) {
        return new ClassificationOutcome(List.of(), List.of(), reasoning);
    }
}
