package com.eainde.comps.config;

import com.eainde.comps.cache.FingerprintCache;
import com.eainde.comps.chunk.SheetChunker;
import com.eainde.comps.thread.MdcAwareExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Thread pools, chunker and result cache for the analysis pipeline.
 *
 * <pre>
 *   analysisExecutor   one task per in-flight fingerprint (runs the whole pipeline)
 *   extractionWorkers  file preparation and chunk extraction, shared by all analyses
 * </pre>
 */
@Configuration
public class PipelineConfig {

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor analysisExecutor(@Value("${comps.pipeline.analysis-threads:4}") int threads) {
        return new MdcAwareExecutor("analysis", threads);
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor extractionWorkers(@Value("${comps.pipeline.worker-threads:4}") int threads) {
        return new MdcAwareExecutor("extract", threads);
    }

    @Bean
    public SheetChunker sheetChunker(@Value("${comps.chunking.context-window-tokens:1000000}") long contextWindowTokens,
                                     @Value("${comps.chunking.chars-per-token:4}") int charsPerToken,
                                     @Value("${comps.chunking.budget-ratio:0.8}") double budgetRatio) {
        return SheetChunker.builder()
                .contextWindowTokens(contextWindowTokens)
                .charsPerToken(charsPerToken)
                .budgetRatio(budgetRatio)
                .build();
    }

    @Bean(destroyMethod = "clear")
    public FingerprintCache fingerprintCache(@Value("${comps.cache.ttl:PT48H}") Duration ttl,
                                             @Value("${comps.cache.max-entries:100}") long maxEntries,
                                             @Qualifier("analysisExecutor") MdcAwareExecutor analysisExecutor) {
        return new FingerprintCache(ttl, maxEntries, analysisExecutor);
    }
}
