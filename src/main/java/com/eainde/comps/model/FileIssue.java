package com.eainde.comps.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A file that failed (or only partially succeeded) and why.
 */
public record FileIssue(
        @JsonProperty("file")   String file,
        @JsonProperty("reason") String reason
) {}
