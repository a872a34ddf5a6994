package com.eainde.comps.classify;

import com.eainde.comps.ai.JsonSchemaConverter;
import com.eainde.comps.ai.ResilientGenerationCaller;
import com.eainde.comps.ai.TextGenerationException;
import com.eainde.comps.merge.CandidateMerger;
import com.eainde.comps.model.ClassifiedCompany;
import com.eainde.comps.model.MergedCandidate;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores merged candidates against the target company in one model call and buckets them.
 *
 * <h3>Validation:</h3>
 * <p>Every entry needs a non-blank name and an integral score in 0-100, otherwise the whole
 * response is malformed and retried. Names that are not among the candidates are discarded
 * (the model may not invent companies); when a name is scored twice the first entry wins.
 * Candidates the model skipped are left out of the result and counted in the reasoning.</p>
 *
 * <h3>Bucketing:</h3>
 * <pre>
 *   score &gt;= verified-threshold → verified_competitors
 *   score &lt;  verified-threshold → to_crosscheck
 * </pre>
 * <p>Both buckets sort by descending score; equal scores keep merge order.</p>
 */
@Service
public class CompetitorClassifier {

    private static final Logger log = LoggerFactory.getLogger(CompetitorClassifier.class);

    static final JsonSchema CLASSIFICATION_SCHEMA =
            JsonSchemaConverter.fromClasspath("CompetitorClassification", "schemas/classification.json");

    static final String NO_CANDIDATES_REASONING =
            "No candidate companies were extracted from the provided files.";

    private final ResilientGenerationCaller caller;
    private final int verifiedThreshold;

    public CompetitorClassifier(ResilientGenerationCaller caller,
                                @Value("${comps.classification.verified-threshold:70}") int verifiedThreshold) {
        if (verifiedThreshold < 0 || verifiedThreshold > 100) {
            throw new IllegalArgumentException("verified-threshold must be within 0-100");
        }
        this.caller = caller;
        this.verifiedThreshold = verifiedThreshold;
    }

    /**
     * @throws ClassificationFailureException when the call fails on every attempt
     */
    public ClassificationOutcome classify(String targetCompany, List<MergedCandidate> candidates) {
        if (candidates.isEmpty()) {
            log.info("No candidates to classify for '{}'; skipping model call", targetCompany);
            return ClassificationOutcome.empty(NO_CANDIDATES_REASONING);
        }

        List<String> names = candidates.stream().map(MergedCandidate::name).toList();
        String prompt = ClassificationPrompts.forCandidates(targetCompany, names);
        log.info("Classifying {} candidates against '{}'", candidates.size(), targetCompany);

        RawClassification raw;
        try {
            raw = caller.call("classify " + candidates.size() + " candidates", prompt,
                    CLASSIFICATION_SCHEMA, CompetitorClassifier::readClassification);
        } catch (TextGenerationException e) {
            throw new ClassificationFailureException(
                    "Classification failed after " + caller.policy().maxAttempts() + " attempts: "
                            + e.getKind() + " - " + e.getMessage(), e);
        }

        return bucket(candidates, raw);
    }

    // =========================================================================
    //  Post-processing
    // =========================================================================

    ClassificationOutcome bucket(List<MergedCandidate> candidates, RawClassification raw) {
        Map<String, Integer> mergeOrder = new HashMap<>();
        Map<String, MergedCandidate> byKey = new HashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            mergeOrder.put(candidates.get(i).normalizedKey(), i);
            byKey.put(candidates.get(i).normalizedKey(), candidates.get(i));
        }

        Map<String, ClassifiedCompany> scored = new LinkedHashMap<>();
        int unknown = 0;
        int duplicates = 0;
        for (RawEntry entry : raw.entries()) {
            String key = CandidateMerger.normalizeKey(entry.name());
            MergedCandidate candidate = byKey.get(key);
            if (candidate == null) {
                unknown++;
                log.debug("Discarding classification for unknown company '{}'", entry.name());
                continue;
            }
            if (scored.containsKey(key)) {
                duplicates++;
                continue;
            }
            scored.put(key, new ClassifiedCompany(candidate.name(), entry.score(), entry.reason()));
        }

        Comparator<Map.Entry<String, ClassifiedCompany>> order =
                Comparator.comparingInt((Map.Entry<String, ClassifiedCompany> e) -> e.getValue().score())
                        .reversed()
                        .thenComparingInt(e -> mergeOrder.get(e.getKey()));

        List<ClassifiedCompany> verified = new ArrayList<>();
        List<ClassifiedCompany> crosscheck = new ArrayList<>();
        scored.entrySet().stream().sorted(order).forEach(e -> {
            ClassifiedCompany company = e.getValue();
            (company.score() >= verifiedThreshold ? verified : crosscheck).add(company);
        });

        int unscored = candidates.size() - scored.size();
        if (unknown > 0 || duplicates > 0 || unscored > 0) {
            log.warn("Classification: {} scored, {} unscored, {} unknown names discarded, {} duplicates",
                    scored.size(), unscored, unknown, duplicates);
        }
        log.info("Classification done: {} verified, {} to cross-check (threshold {})",
                verified.size(), crosscheck.size(), verifiedThreshold);

        StringBuilder reasoning = new StringBuilder(raw.reasoning());
        if (unscored > 0) {
            appendNote(reasoning, unscored + " candidate(s) were not scored by the classifier and are omitted.");
        }
        if (unknown > 0) {
            appendNote(reasoning, unknown + " classification(s) for companies outside the candidate list were discarded.");
        }
        return new ClassificationOutcome(verified, crosscheck, reasoning.toString());
    }

    private static void appendNote(StringBuilder reasoning, String note) {
        if (reasoning.length() > 0) reasoning.append(' ');
        reasoning.append(note);
    }

    // =========================================================================
    //  Validation
    // =========================================================================

    record RawEntry(String name, int score, String reason) {}

    record RawClassification(List<RawEntry> entries, String reasoning) {}

    /**
     * Strict reader for the classification response.
     *
     * @throws TextGenerationException MALFORMED when the shape or a score is invalid
     */
    static RawClassification readClassification(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw TextGenerationException.malformed("Classification response is not a JSON object");
        }
        JsonNode items = root.get("classifications");
        if (items == null || !items.isArray()) {
            throw TextGenerationException.malformed("Classification response has no 'classifications' array");
        }

        List<RawEntry> entries = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            if (!item.isObject()) {
                throw TextGenerationException.malformed("Classification entry is not an object: " + item);
            }
            JsonNode name = item.get("name");
            if (name == null || !name.isTextual() || name.asText().isBlank()) {
                throw TextGenerationException.malformed("Classification entry without a name: " + item);
            }
            entries.add(new RawEntry(name.asText(), readScore(item.get("score"), name.asText()),
                    item.hasNonNull("reason") ? item.get("reason").asText() : ""));
        }

        String reasoning = root.hasNonNull("reasoning") ? root.get("reasoning").asText().strip() : "";
        return new RawClassification(entries, reasoning);
    }

    private static int readScore(JsonNode score, String name) {
        if (score == null || !score.isNumber()) {
            throw TextGenerationException.malformed("Score for '" + name + "' is not a number: " + score);
        }
        double value = score.asDouble();
        if (value != Math.rint(value)) {
            throw TextGenerationException.malformed("Score for '" + name + "' is not integral: " + value);
        }
        if (value < 0 || value > 100) {
            throw TextGenerationException.malformed("Score for '" + name + "' is out of range: " + value);
        }
        return (int) value;
    }
}
