package com.eainde.comps.extraction;

import com.eainde.comps.model.Chunk;

/**
 * Prompt text for the per-chunk company-name extraction call.
 */
final class ExtractionPrompts {

    private static final String HEADER = """
            === SHEET: %s (file %s, rows %d-%d, part %d of %d) ===
            """;

    private static final String TARGET_CONTEXT = """

            TARGET COMPANY CONTEXT: %1$s
            IMPORTANT: Use your knowledge of %1$s's industry, products, and market to filter the extracted companies.
            Only extract companies that operate in the SAME or CLOSELY RELATED business as %1$s.
            Exclude companies from completely different industries or product categories.

            """;

    private static final String TASK = """
            TASK: Extract ALL company names from the data above that are potential competitors or comparable companies.

            ═══════════════════════════════════════════════════════════
            INSTRUCTIONS
            ═══════════════════════════════════════════════════════════
            - Look for columns containing company names, targets, acquirers, sellers, or similar identifiers
            - Extract only actual company names (exclude headers, totals, averages, summaries)
            - Ignore entries like "N/A", "TBD", "Others", "Mean", "Total", "Average", "Median"
            - Include ALL companies found in this part of the spreadsheet
            - Return the results as a JSON object with the following structure:
            {
                "companies": ["Company 1", "Company 2", ...],
                "count": <number of unique companies>
            }

            CRITICAL: Provide ONLY valid JSON response, no additional text, no markdown formatting, no explanations.""";

    private ExtractionPrompts() {
    }

    static String forChunk(Chunk chunk, String targetCompany) {
        return HEADER.formatted(chunk.sheetName(), chunk.fileId(), chunk.startRow(), chunk.endRow(),
                        chunk.chunkIndex() + 1, chunk.totalChunks())
                + chunk.text()
                + "\n"
                + TARGET_CONTEXT.formatted(targetCompany)
                + TASK;
    }
}
