package com.eainde.comps.extraction;

import com.eainde.comps.ai.JsonSchemaConverter;
import com.eainde.comps.ai.ResilientGenerationCaller;
import com.eainde.comps.ai.TextGenerationException;
import com.eainde.comps.model.Candidate;
import com.eainde.comps.model.Chunk;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pulls raw company names out of one chunk with a single structured model call.
 *
 * <p>The response must be an object whose {@code companies} field is an array of strings;
 * anything else is a malformed response and is retried. Blank entries and summary labels
 * such as {@code Total} or {@code Median} are dropped. When every attempt fails the chunk
 * comes back as a {@link ChunkExtraction#failure failure} with no candidates.</p>
 */
@Service
public class ExtractionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ExtractionOrchestrator.class);

    static final JsonSchema EXTRACTION_SCHEMA =
            JsonSchemaConverter.fromClasspath("CompanyExtraction", "schemas/extraction.json");

    /** Row labels that spreadsheets use for aggregates and placeholders, compared lower-case. */
    private static final Set<String> SUMMARY_LABELS = Set.of(
            "n/a", "na", "n.a.", "tbd", "tba", "-", "--", "others", "other",
            "mean", "median", "total", "totals", "average", "avg", "sum");

    private final ResilientGenerationCaller caller;

    public ExtractionOrchestrator(ResilientGenerationCaller caller) {
        this.caller = caller;
    }

    /**
     * Extracts candidate names from one chunk.
     *
     * @param chunk         the chunk to send
     * @param targetCompany company the candidates should compete with; used to focus the prompt
     * @return candidates tagged with the chunk's file and index, or a failure after retries
     */
    public ChunkExtraction extract(Chunk chunk, String targetCompany) {
        String prompt = ExtractionPrompts.forChunk(chunk, targetCompany);
        long start = System.nanoTime();

        try {
            List<String> names = caller.call("extract " + chunk, prompt, EXTRACTION_SCHEMA,
                    ExtractionOrchestrator::readCompanies);

            List<Candidate> candidates = new ArrayList<>(names.size());
            for (String name : names) {
                if (isUsableName(name)) {
                    candidates.add(new Candidate(name, chunk.fileId(), chunk.chunkIndex()));
                }
            }
            log.info("{}: {} candidates ({} returned) in {} ms",
                    chunk, candidates.size(), names.size(), elapsedMillis(start));
            return ChunkExtraction.success(chunk, candidates);

        } catch (TextGenerationException e) {
            log.error("{}: extraction lost after {} ms ({}: {})",
                    chunk, elapsedMillis(start), e.getKind(), e.getMessage());
            return ChunkExtraction.failure(chunk,
                    String.format("chunk %d/%d (rows %d-%d): %s",
                            chunk.chunkIndex() + 1, chunk.totalChunks(), chunk.startRow(), chunk.endRow(),
                            e.getKind()));
        }
    }

    // =========================================================================
    //  Validation
    // =========================================================================

    /**
     * Strict reader for the extraction response.
     *
     * @throws TextGenerationException MALFORMED when the shape is wrong
     */
    static List<String> readCompanies(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw TextGenerationException.malformed("Extraction response is not a JSON object");
        }
        JsonNode companies = root.get("companies");
        if (companies == null || !companies.isArray()) {
            throw TextGenerationException.malformed("Extraction response has no 'companies' array");
        }

        List<String> names = new ArrayList<>(companies.size());
        for (JsonNode entry : companies) {
            if (entry.isNull()) continue;
            if (!entry.isTextual()) {
                throw TextGenerationException.malformed("Non-string entry in 'companies': " + entry);
            }
            names.add(entry.asText());
        }

        JsonNode count = root.get("count");
        if (count != null && count.canConvertToInt() && count.asInt() != names.size()) {
            log.debug("Extraction count {} differs from {} names returned", count.asInt(), names.size());
        }
        return names;
    }

    static boolean isUsableName(String name) {
        if (name == null || name.isBlank()) return false;
        String label = name.strip().toLowerCase(Locale.ROOT);
        return !SUMMARY_LABELS.contains(label);
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
