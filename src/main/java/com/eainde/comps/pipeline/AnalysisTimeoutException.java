package com.eainde.comps.pipeline;

import java.time.Duration;

/**
 * The caller stopped waiting. The analysis itself keeps running and will still be cached.
 */
public class AnalysisTimeoutException extends RuntimeException {

    public AnalysisTimeoutException(Duration timeout, Throwable cause) {
        super("Analysis did not finish within " + timeout + "; the result will be cached when it completes", cause);
    }
}
