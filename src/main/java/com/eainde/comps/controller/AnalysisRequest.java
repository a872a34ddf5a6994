package com.eainde.comps.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /analyze}. Either file references or a Copilot answer naming the files.
 *
 * @param targetCompany   company to find competitors for
 * @param fileReferences  explicit file references, used when present
 * @param copilotResponse free text containing {@code Full Path: ...} lines
 */
public record AnalysisRequest(
        @JsonProperty("target_company")   String targetCompany,
        @JsonProperty("file_references")  List<String> fileReferences,
        @JsonProperty("copilot_response") String copilotResponse
) {}
