package com.partselect.assistant.service;

import com.partselect.assistant.model.ConversationTurn;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KnowledgeRetrievalServiceTest {

    private static final List<String> DOCS = List.of(
            "Refrigerator water filter: replace every six months.",
            "Dishwasher drain pump hums but water stays in the tub.",
            "General safety: unplug before any repair."
    );

    private KnowledgeRetrievalService service(List<String> docs) {
        return new KnowledgeRetrievalService(docs, null);
    }

    @Test
    void emptyCorpusReturnsSentinel() {
        assertThat(service(List.of()).search("pump", "dishwasher", 5))
                .containsExactly(KnowledgeRetrievalService.NO_CONTEXT);
    }

    @Test
    void nothingMatchingReturnsSentinel() {
        assertThat(service(DOCS).search("xyzzy", "", 5)).containsExactly(KnowledgeRetrievalService.NO_CONTEXT);
    }

    @Test
    void applianceContextDominatesRanking() {
        List<String> hits = service(DOCS).search("water", "dishwasher", 3);

        assertThat(hits.get(0)).startsWith("Dishwasher drain pump");
        assertThat(hits).hasSize(2);
    }

    @Test
    void resultsAreCappedAtK() {
        assertThat(service(DOCS).search("e", "", 1)).hasSize(1);
    }

    @Test
    void jaccardFallbackKeepsSimilarDocuments() {
        KnowledgeRetrievalService retrieval = service(List.of("alpha beta gamma", "delta epsilon zeta eta theta"));

        assertThat(retrieval.similarDocuments("alpha beta", 5)).containsExactly("alpha beta gamma");
    }

    @Test
    void occurrencesAreCountedWithoutOverlap() {
        assertThat(KnowledgeRetrievalService.countOccurrences("aaaa", "aa")).isEqualTo(2);
        assertThat(KnowledgeRetrievalService.countOccurrences("rack rack", "rack")).isEqualTo(2);
        assertThat(KnowledgeRetrievalService.countOccurrences("rack", "")).isZero();
    }

    @Test
    void classifiesPromptIntent() {
        KnowledgeRetrievalService retrieval = service(DOCS);

        assertThat(retrieval.classifyPromptIntent("does it fit")).isEqualTo("compatibility");
        assertThat(retrieval.classifyPromptIntent("how to replace the pump")).isEqualTo("repair_guide");
        assertThat(retrieval.classifyPromptIntent("ice maker parts")).isEqualTo("part_lookup");
        assertThat(retrieval.classifyPromptIntent("it has a smell")).isEqualTo("maintenance");
        assertThat(retrieval.classifyPromptIntent("hello")).isEqualTo("general_help");
    }

    @Test
    void promptUsesFirstThreeDocsAndLastEightTurns() {
        List<ConversationTurn> history = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            history.add(ConversationTurn.user("turn-" + i));
        }

        String prompt = service(DOCS).buildPrompt("how to replace the pump",
                List.of("doc-one", "doc-two", "doc-three", "doc-four"), history, "dishwasher");

        assertThat(prompt).contains("doc-one", "doc-two", "doc-three").doesNotContain("doc-four");
        assertThat(prompt).contains("user: turn-2", "user: turn-9").doesNotContain("turn-0", "user: turn-1\n");
        assertThat(prompt).contains("DISHWASHER", "# Detected Intent: repair_guide", "how to replace the pump");
        assertThat(prompt).contains("PS11752778").containsIgnoringCase("safety");
    }

    @Test
    void userTextIsNotReinterpretedAsPlaceholder() {
        String rendered = KnowledgeRetrievalService.render("Q: {query} C: {context}",
                Map.of("query", "{context}", "context", "docs"));

        assertThat(rendered).isEqualTo("Q: {context} C: docs");
    }

    @Test
    void corpusIsFixedAtConstruction() {
        List<String> source = new ArrayList<>(List.of("Rack rollers snap on."));
        KnowledgeRetrievalService retrieval = service(source);
        source.add("Door gaskets peel off.");

        assertThat(retrieval.size()).isEqualTo(1);
        assertThat(retrieval.search("gaskets", "", 3)).containsExactly(KnowledgeRetrievalService.NO_CONTEXT);
    }
}
