package com.eainde.comps.classify;

import com.eainde.comps.ai.ResilientGenerationCaller;
import com.eainde.comps.ai.RetryPolicy;
import com.eainde.comps.ai.TextGenerationClient;
import com.eainde.comps.ai.TextGenerationException;
import com.eainde.comps.merge.CandidateMerger;
import com.eainde.comps.model.ClassifiedCompany;
import com.eainde.comps.model.MergedCandidate;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompetitorClassifierTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private TextGenerationClient client;

    private CompetitorClassifier classifier;

    @BeforeEach
    void setUp() {
        ResilientGenerationCaller caller = new ResilientGenerationCaller(client, RetryPolicy.defaults(), d -> { });
        classifier = new CompetitorClassifier(caller, 70);
    }

    private static MergedCandidate candidate(String name) {
        return new MergedCandidate(name, CandidateMerger.normalizeKey(name), Set.of("comps.xlsx"), 1);
    }

    @Test
    void classify_shouldSplitAtThresholdAndSortByScore() throws Exception {
        // GIVEN
        List<MergedCandidate> candidates = List.of(
                candidate("Danone"), candidate("Coca-Cola"), candidate("Keurig Dr Pepper"));
        when(client.generate(anyString(), any())).thenReturn(MAPPER.readTree("""
                {
                  "classifications": [
                    {"name": "Danone", "score": 40, "reason": "Dairy overlap only"},
                    {"name": "Keurig Dr Pepper", "score": 70, "reason": "Beverages"},
                    {"name": "Coca-Cola", "score": 95, "reason": "Direct beverage rival"}
                  ],
                  "reasoning": "PepsiCo sells beverages and snacks."
                }
                """));

        // WHEN
        ClassificationOutcome outcome = classifier.classify("PepsiCo", candidates);

        // THEN
        assertThat(outcome.verified()).extracting(ClassifiedCompany::name, ClassifiedCompany::score)
                .containsExactly(
                        tuple("Coca-Cola", 95),
                        tuple("Keurig Dr Pepper", 70));
        assertThat(outcome.toCrosscheck()).extracting(ClassifiedCompany::name).containsExactly("Danone");
        assertThat(outcome.reasoning()).isEqualTo("PepsiCo sells beverages and snacks.");
    }

    @Test
    void classify_shouldPutEveryCandidateNameInPrompt() throws Exception {
        when(client.generate(anyString(), any())).thenReturn(MAPPER.readTree(
                "{\"classifications\": [], \"reasoning\": \"\"}"));

        classifier.classify("PepsiCo", List.of(candidate("Coca-Cola"), candidate("Red Bull")));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(client).generate(prompt.capture(), any());
        assertThat(prompt.getValue()).contains("PepsiCo", "\"Coca-Cola\"", "\"Red Bull\"");
    }

    @Test
    void classify_shouldNotCallModel_whenNoCandidates() {
        ClassificationOutcome outcome = classifier.classify("PepsiCo", List.of());

        assertThat(outcome.verified()).isEmpty();
        assertThat(outcome.toCrosscheck()).isEmpty();
        assertThat(outcome.reasoning()).isEqualTo(CompetitorClassifier.NO_CANDIDATES_REASONING);
        verifyNoInteractions(client);
    }

    @Test
    void classify_shouldThrowClassificationFailure_whenScoresStayInvalid() throws Exception {
        when(client.generate(anyString(), any())).thenReturn(MAPPER.readTree("""
                {"classifications": [{"name": "Coca-Cola", "score": 140, "reason": "?"}], "reasoning": "x"}
                """));

        assertThatThrownBy(() -> classifier.classify("PepsiCo", List.of(candidate("Coca-Cola"))))
                .isInstanceOf(ClassificationFailureException.class)
                .hasMessageContaining("MALFORMED")
                .hasCauseInstanceOf(TextGenerationException.class);
        verify(client, times(3)).generate(anyString(), any());
    }

    @Test
    void bucket_shouldDiscardUnknownNamesAndKeepFirstDuplicate() {
        List<MergedCandidate> candidates = List.of(candidate("Coca-Cola"), candidate("Monster Beverage"));
        CompetitorClassifier.RawClassification raw = new CompetitorClassifier.RawClassification(List.of(
                new CompetitorClassifier.RawEntry("coca-cola", 90, "first"),
                new CompetitorClassifier.RawEntry("Coca-Cola", 10, "second"),
                new CompetitorClassifier.RawEntry("Made Up Inc", 99, "invented")), "Analysis.");

        ClassificationOutcome outcome = classifier.bucket(candidates, raw);

        assertThat(outcome.verified()).containsExactly(new ClassifiedCompany("Coca-Cola", 90, "first"));
        assertThat(outcome.toCrosscheck()).isEmpty();
        assertThat(outcome.reasoning())
                .startsWith("Analysis.")
                .contains("1 candidate(s) were not scored")
                .contains("1 classification(s) for companies outside the candidate list were discarded");
    }

    @Test
    void bucket_shouldKeepMergeOrderForEqualScores() {
        List<MergedCandidate> candidates = List.of(candidate("Alpha"), candidate("Beta"), candidate("Gamma"));
        CompetitorClassifier.RawClassification raw = new CompetitorClassifier.RawClassification(List.of(
                new CompetitorClassifier.RawEntry("Gamma", 50, ""),
                new CompetitorClassifier.RawEntry("Alpha", 50, ""),
                new CompetitorClassifier.RawEntry("Beta", 50, "")), "");

        ClassificationOutcome outcome = classifier.bucket(candidates, raw);

        assertThat(outcome.toCrosscheck()).extracting(ClassifiedCompany::name)
                .containsExactly("Alpha", "Beta", "Gamma");
    }

    @Test
    void readClassification_shouldRejectInvalidEntries() throws Exception {
        assertThatThrownBy(() -> CompetitorClassifier.readClassification(MAPPER.readTree(
                "{\"classifications\": [{\"name\": \"\", \"score\": 10}]}")))
                .isInstanceOf(TextGenerationException.class);
        assertThatThrownBy(() -> CompetitorClassifier.readClassification(MAPPER.readTree(
                "{\"classifications\": [{\"name\": \"A\", \"score\": \"high\"}]}")))
                .isInstanceOf(TextGenerationException.class);
        assertThatThrownBy(() -> CompetitorClassifier.readClassification(MAPPER.readTree(
                "{\"classifications\": [{\"name\": \"A\", \"score\": 72.5}]}")))
                .isInstanceOf(TextGenerationException.class);
        assertThatThrownBy(() -> CompetitorClassifier.readClassification(MAPPER.readTree(
                "{\"reasoning\": \"no list\"}")))
                .isInstanceOf(TextGenerationException.class);
    }

    @Test
    void readClassification_shouldAcceptIntegralDoublesAndMissingReason() throws Exception {
        CompetitorClassifier.RawClassification raw = CompetitorClassifier.readClassification(MAPPER.readTree(
                "{\"classifications\": [{\"name\": \"A\", \"score\": 80.0}], \"reasoning\": \" ok \"}"));

        assertThat(raw.entries()).containsExactly(new CompetitorClassifier.RawEntry("A", 80, ""));
        assertThat(raw.reasoning()).isEqualTo("ok");
    }

    @Test
    void constructor_shouldRejectThresholdOutsideRange() {
        ResilientGenerationCaller caller = new ResilientGenerationCaller(client, RetryPolicy.defaults());

        assertThatThrownBy(() -> new CompetitorClassifier(caller, 101))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
