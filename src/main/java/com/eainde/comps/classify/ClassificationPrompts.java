package com.eainde.comps.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Prompt text for the single classification call.
 */
final class ClassificationPrompts {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final String TEMPLATE = """
            You are a business analyst expert specializing in competitive analysis.

            TARGET COMPANY: %1$s

            EXTRACTED COMPANY CANDIDATES:
            %2$s

            TASK: Classify these candidates based on their competitive relationship with %1$s.

            ═══════════════════════════════════════════════════════════
            RULES
            ═══════════════════════════════════════════════════════════
            1. STRICTLY use ONLY the companies provided in the list above. DO NOT add any new companies.
               Copy each name exactly as it appears in the list.
            2. Assign a Confidence Score (integer 0-100) representing the strength of the competitive overlap.
               - 90-100: Direct competitor (same core products/services, same market).
               - 70-89: Strong competitor (significant overlap).
               - 50-69: Moderate/Indirect competitor or substitute.
               - <50: Low relevance or different industry.
            3. Score EVERY company in the list exactly once.

            ═══════════════════════════════════════════════════════════
            RESPONSE FORMAT
            ═══════════════════════════════════════════════════════════
            {
                "classifications": [
                    {"name": "Company A", "score": 95, "reason": "..."},
                    {"name": "Company C", "score": 45, "reason": "..."}
                ],
                "reasoning": "Brief analysis of the industry context."
            }

            CRITICAL: Provide ONLY valid JSON response, no additional text, no markdown formatting.""";

    private ClassificationPrompts() {
    }

    static String forCandidates(String targetCompany, List<String> names) {
        String list;
        try {
            list = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(names);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize candidate names", e);
        }
        return TEMPLATE.formatted(targetCompany, list);
    }
}
