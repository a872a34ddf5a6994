package com.eainde.comps.pipeline;

import com.eainde.comps.model.FileIssue;

import java.util.List;

/**
 * Files were referenced but none of them could be resolved and prepared.
 */
public class NoUsableFilesException extends RuntimeException {

    private final List<FileIssue> failedFiles;

    public NoUsableFilesException(List<FileIssue> failedFiles) {
        super("None of the " + failedFiles.size() + " referenced file(s) could be processed: " + failedFiles);
        this.failedFiles = List.copyOf(failedFiles);
    }

    public List<FileIssue> getFailedFiles() {
        return failedFiles;
    }
}
