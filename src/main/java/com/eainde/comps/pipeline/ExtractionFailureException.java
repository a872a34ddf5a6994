package com.eainde.comps.pipeline;

import com.eainde.comps.model.FileIssue;

import java.util.List;

/**
 * Files were prepared but extraction lost chunks and nothing was extracted from the rest.
 * Raised instead of returning an empty result, so an outage is not cached as "no competitors".
 */
public class ExtractionFailureException extends RuntimeException {

    private final List<FileIssue> failedFiles;
    private final List<FileIssue> incompleteFiles;

    public ExtractionFailureException(List<FileIssue> failedFiles, List<FileIssue> incompleteFiles) {
        super("No candidates could be extracted: " + incompleteFiles.size()
                + " file(s) lost chunks to extraction failures");
        this.failedFiles = List.copyOf(failedFiles);
        this.incompleteFiles = List.copyOf(incompleteFiles);
    }

    public List<FileIssue> getFailedFiles() {
        return failedFiles;
    }

    public List<FileIssue> getIncompleteFiles() {
        return incompleteFiles;
    }
}
