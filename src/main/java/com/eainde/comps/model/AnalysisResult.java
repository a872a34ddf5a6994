package com.eainde.comps.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final output of one competitor analysis.
 *
 * <p>Immutable. The same instance is stored as the cache value; a cache hit hands out
 * {@link #withCached(boolean) a copy} with {@code cached = true}.</p>
 *
 * @param targetCompany       company the candidates were classified against
 * @param verifiedCompetitors score &gt;= threshold, descending score
 * @param toCrosscheck        score &lt; threshold, descending score
 * @param verifiedCount       size of {@code verifiedCompetitors}
 * @param crosscheckCount     size of {@code toCrosscheck}
 * @param reasoning           model's industry analysis plus pipeline notes (cap, unscored names)
 * @param filesProcessed      files whose sheet was selected and chunked
 * @param totalFilesFound     file references in the request
 * @param failedFiles         files that could not be resolved, decoded or matched to a sheet
 * @param incompleteFiles     processed files where at least one chunk's extraction was lost
 * @param cached              true when served from the cache
 */
public record AnalysisResult(
        @JsonProperty("target_company")       String targetCompany,
        @JsonProperty("verified_competitors") List<ClassifiedCompany> verifiedCompetitors,
        @JsonProperty("to_crosscheck")        List<ClassifiedCompany> toCrosscheck,
        @JsonProperty("verified_count")       int verifiedCount,
        @JsonProperty("crosscheck_count")     int crosscheckCount,
        @JsonProperty("reasoning")            String reasoning,
        @JsonProperty("files_processed")      int filesProcessed,
        @JsonProperty("total_files_found")    int totalFilesFound,
        @JsonProperty("failed_files")         List<FileIssue> failedFiles,
        @JsonProperty("incomplete_files")     List<FileIssue> incompleteFiles,
        @JsonProperty("cached")               boolean cached
) {

    public AnalysisResult {
        verifiedCompetitors = List.copyOf(verifiedCompetitors);
        toCrosscheck = List.copyOf(toCrosscheck);
        failedFiles = List.copyOf(failedFiles);
        incompleteFiles = List.copyOf(incompleteFiles);
    }

    public static AnalysisResult of(String targetCompany,
                                    List<ClassifiedCompany> verified,
                                    List<ClassifiedCompany> crosscheck,
                                    String reasoning,
                                    int filesProcessed,
                                    int totalFilesFound,
                                    List<FileIssue> failedFiles,
                                    List<FileIssue> incompleteFiles) {
        return new AnalysisResult(targetCompany, verified, crosscheck,
                verified.size(), crosscheck.size(), reasoning,
                filesProcessed, totalFilesFound, failedFiles, incompleteFiles, false);
    }

    /**
     * A result with no classified companies, e.g. when nothing was extracted.
     */
    public static AnalysisResult empty(String targetCompany, String reasoning,
                                       int filesProcessed, int totalFilesFound,
                                       List<FileIssue> failedFiles,
                                       List<FileIssue> incompleteFiles) {
        return of(targetCompany, List.of(), List.of(), reasoning,
                filesProcessed, totalFilesFound, failedFiles, incompleteFiles);
    }

    public AnalysisResult withCached(boolean cached) {
        if (this.cached == cached) return this;
        return new AnalysisResult(targetCompany, verifiedCompetitors, toCrosscheck,
                verifiedCount, crosscheckCount, reasoning, filesProcessed, totalFilesFound,
                failedFiles, incompleteFiles, cached);
    }
}
