package com.eainde.comps.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A candidate company scored against the target company by the classifier.
 *
 * @param name   display name of the merged candidate
 * @param score  competitive overlap, 0-100 inclusive
 * @param reason one-line justification returned by the model
 */
public record ClassifiedCompany(
        @JsonProperty("name")   String name,
        @JsonProperty("score")  int score,
        @JsonProperty("reason") String reason
) {

    public ClassifiedCompany {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within 0-100, got " + score);
        }
    }
}
