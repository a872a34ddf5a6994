package com.eainde.comps.merge;

import com.eainde.comps.model.Candidate;
import com.eainde.comps.model.MergedCandidate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateMergerTest {

    private final CandidateMerger merger = new CandidateMerger(2000);

    @Test
    void merge_shouldFoldCaseAndWhitespaceVariantsIntoFirstSeenName() {
        // GIVEN
        List<Candidate> raw = List.of(
                new Candidate("PepsiCo", "a.xlsx", 0),
                new Candidate("pepsico ", "b.xlsx", 0),
                new Candidate("Nestlé", "a.xlsx", 1));

        // WHEN
        MergeOutcome outcome = merger.merge(raw);

        // THEN
        assertThat(outcome.candidates()).hasSize(2);
        MergedCandidate pepsi = outcome.candidates().get(0);
        assertThat(pepsi.name()).isEqualTo("PepsiCo");
        assertThat(pepsi.normalizedKey()).isEqualTo("pepsico");
        assertThat(pepsi.occurrenceCount()).isEqualTo(2);
        assertThat(pepsi.sourceFileIds()).containsExactly("a.xlsx", "b.xlsx");
        assertThat(outcome.candidates().get(1).name()).isEqualTo("Nestlé");
        assertThat(outcome.isCapped()).isFalse();
        assertThat(outcome.dropNote()).isNull();
    }

    @Test
    void merge_shouldCollapseInnerWhitespaceInDisplayName() {
        MergeOutcome outcome = merger.merge(List.of(
                new Candidate("  Keurig   Dr\tPepper ", "a.xlsx", 0),
                new Candidate("KEURIG DR PEPPER", "a.xlsx", 2)));

        assertThat(outcome.candidates()).singleElement().satisfies(c -> {
            assertThat(c.name()).isEqualTo("Keurig Dr Pepper");
            assertThat(c.sourceFileIds()).containsExactly("a.xlsx");
            assertThat(c.occurrenceCount()).isEqualTo(2);
        });
    }

    @Test
    void merge_shouldApplyNfkcBeforeComparing() {
        // full-width letters and a no-break space fold to their ASCII forms
        MergeOutcome outcome = merger.merge(List.of(
                new Candidate("Ｄａｎｏｎｅ\u00A0SA", "a.xlsx", 0),
                new Candidate("danone sa", "b.xlsx", 0)));

        assertThat(outcome.candidates()).hasSize(1);
        assertThat(outcome.candidates().get(0).normalizedKey()).isEqualTo("danone sa");
    }

    @Test
    void merge_shouldSkipBlankNames() {
        MergeOutcome outcome = merger.merge(List.of(
                new Candidate("   ", "a.xlsx", 0),
                new Candidate("Unilever", "a.xlsx", 0)));

        assertThat(outcome.candidates()).extracting(MergedCandidate::name).containsExactly("Unilever");
    }

    @Test
    void merge_shouldBeStableWhenFedItsOwnOutput() {
        MergeOutcome first = merger.merge(List.of(
                new Candidate("Coca-Cola", "a.xlsx", 0),
                new Candidate("coca-cola", "a.xlsx", 1),
                new Candidate("Monster Beverage", "b.xlsx", 0)));

        List<Candidate> again = new ArrayList<>();
        for (MergedCandidate c : first.candidates()) {
            again.add(new Candidate(c.name(), c.sourceFileIds().iterator().next(), 0));
        }
        MergeOutcome second = merger.merge(again);

        assertThat(second.candidates()).extracting(MergedCandidate::normalizedKey)
                .containsExactlyElementsOf(first.candidates().stream().map(MergedCandidate::normalizedKey).toList());
    }

    @Test
    void merge_shouldKeepMostFrequentWithinCapInFirstSeenOrder() {
        // GIVEN a cap of 2 and three distinct names; "B" is seen least often
        CandidateMerger capped = new CandidateMerger(2);
        List<Candidate> raw = List.of(
                new Candidate("A", "f1", 0),
                new Candidate("B", "f1", 0),
                new Candidate("C", "f1", 0),
                new Candidate("C", "f2", 0),
                new Candidate("A", "f2", 0));

        // WHEN
        MergeOutcome outcome = capped.merge(raw);

        // THEN
        assertThat(outcome.candidates()).extracting(MergedCandidate::name).containsExactly("A", "C");
        assertThat(outcome.distinctSeen()).isEqualTo(3);
        assertThat(outcome.dropped()).isEqualTo(1);
        assertThat(outcome.dropNote()).startsWith("1 of 3 distinct candidates were dropped");
    }

    @Test
    void merge_shouldBreakCapTiesByFirstSeen() {
        CandidateMerger capped = new CandidateMerger(1);

        MergeOutcome outcome = capped.merge(List.of(
                new Candidate("Later", "f1", 1),
                new Candidate("Earlier", "f1", 0)));

        assertThat(outcome.candidates()).extracting(MergedCandidate::name).containsExactly("Later");
    }

    @Test
    void normalizeKey_shouldTrimCollapseAndLowerCase() {
        assertThat(CandidateMerger.normalizeKey("  Pepsi  Co ")).isEqualTo("pepsi co");
        assertThat(CandidateMerger.normalizeKey("ÉCLAIR")).isEqualTo("éclair");
    }

    @Test
    void normalizeKey_shouldFoldCaseBeyondSimpleLowerCasing() {
        assertThat(CandidateMerger.normalizeKey("Straße")).isEqualTo(CandidateMerger.normalizeKey("STRASSE"));
        assertThat(CandidateMerger.normalizeKey("σοφιασ")).isEqualTo(CandidateMerger.normalizeKey("ΣΟΦΙΑΣ"));
    }

    @Test
    void merge_shouldCombineNames_thatDifferOnlyBySharpS() {
        MergeOutcome outcome = merger.merge(List.of(
                new Candidate("Straße Holdings", "f1", 0),
                new Candidate("STRASSE HOLDINGS", "f2", 0)));

        assertThat(outcome.candidates()).extracting(MergedCandidate::name).containsExactly("Straße Holdings");
    }

    @Test
    void constructor_shouldRejectNonPositiveCap() {
        assertThatThrownBy(() -> new CandidateMerger(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
