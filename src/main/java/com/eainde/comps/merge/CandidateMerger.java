package com.eainde.comps.merge;

import com.eainde.comps.model.Candidate;
import com.eainde.comps.model.MergedCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Folds raw candidates from every chunk of every file into one de-duplicated list.
 *
 * <h3>Keying:</h3>
 * <pre>
 *   "  Pepsi  Co "  → trim, collapse whitespace → "Pepsi Co"
 *                   → NFKC                      → "Pepsi Co"
 *                   → lower case (ROOT)         → "pepsi co"   (key)
 * </pre>
 * <p>The display name is the first occurrence with whitespace collapsed and its casing kept.
 * Source file ids accumulate in the order they were first seen; occurrence counts add up.</p>
 *
 * <h3>Cap:</h3>
 * <p>Past {@code comps.merge.max-candidates} distinct names, the ones seen most often are kept
 * (earlier first-seen wins ties) and emitted in their original first-seen order.</p>
 */
@Component
public class CandidateMerger {

    private static final Logger log = LoggerFactory.getLogger(CandidateMerger.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxCandidates;

    public CandidateMerger(@Value("${comps.merge.max-candidates:2000}") int maxCandidates) {
        if (maxCandidates < 1) throw new IllegalArgumentException("max-candidates must be >= 1");
        this.maxCandidates = maxCandidates;
    }

    public MergeOutcome merge(List<Candidate> candidates) {
        Map<String, Accumulator> byKey = new LinkedHashMap<>();

        for (Candidate candidate : candidates) {
            String display = collapseWhitespace(candidate.rawName());
            if (display.isEmpty()) continue;

            String key = normalizeKey(display);
            Accumulator acc = byKey.computeIfAbsent(key, k -> new Accumulator(display, k, byKey.size()));
            acc.fileIds.add(candidate.sourceFileId());
            acc.count++;
        }

        List<Accumulator> kept = new ArrayList<>(byKey.values());
        int dropped = 0;
        if (kept.size() > maxCandidates) {
            dropped = kept.size() - maxCandidates;
            kept.sort(Comparator.comparingInt((Accumulator a) -> a.count).reversed()
                    .thenComparingInt(a -> a.firstSeen));
            kept = new ArrayList<>(kept.subList(0, maxCandidates));
            kept.sort(Comparator.comparingInt(a -> a.firstSeen));
            log.warn("{} distinct candidates exceed the limit of {}; dropped {}",
                    byKey.size(), maxCandidates, dropped);
        }

        List<MergedCandidate> merged = new ArrayList<>(kept.size());
        for (Accumulator acc : kept) {
            merged.add(new MergedCandidate(acc.name, acc.key, acc.fileIds, acc.count));
        }

        log.info("Merged {} raw candidates into {} distinct names", candidates.size(), merged.size());
        return new MergeOutcome(merged, byKey.size(), dropped);
    }

    /**
     * Merge key: trimmed, whitespace collapsed, NFKC-normalized, case-folded.
     *
     * <p>Upper-casing before lower-casing folds {@code ß} with {@code SS} and a
     * non-final {@code σ} with {@code ς}.</p>
     */
    public static String normalizeKey(String name) {
        String collapsed = collapseWhitespace(name);
        String nfkc = Normalizer.normalize(collapsed, Normalizer.Form.NFKC);
        // NFKC can turn compatibility spaces into plain ones
        return collapseWhitespace(nfkc).toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
    }

    static String collapseWhitespace(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text.strip()).replaceAll(" ");
    }

    int maxCandidates() {
        return maxCandidates;
    }

    private static final class Accumulator {
        final String name;
        final String key;
        final int firstSeen;
        final Set<String> fileIds = new LinkedHashSet<>();
        int count;

        Accumulator(String name, String key, int firstSeen) {
            this.name = name;
            this.key = key;
            this.firstSeen = firstSeen;
        }
    }
}
