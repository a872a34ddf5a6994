package com.eainde.comps.controller;

import com.eainde.comps.model.AnalysisResult;
import com.eainde.comps.model.CacheStats;
import com.eainde.comps.pipeline.CompetitorAnalysisService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class AnalysisController {

    private final CompetitorAnalysisService analysisService;

    public AnalysisController(CompetitorAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("status", "online", "service", "Competitor Analysis API");
    }

    @PostMapping("/analyze")
    public AnalysisResult analyze(@RequestBody AnalysisRequest request) {
        boolean hasReferences = request.fileReferences() != null && !request.fileReferences().isEmpty();
        boolean hasCopilot = request.copilotResponse() != null && !request.copilotResponse().isBlank();

        if (!hasReferences && hasCopilot) {
            return analysisService.analyzeCopilotResponse(request.targetCompany(), request.copilotResponse());
        }
        return analysisService.analyze(request.targetCompany(), request.fileReferences());
    }

    @GetMapping("/cache/stats")
    public CacheStats cacheStats() {
        return analysisService.cacheStats();
    }
}
