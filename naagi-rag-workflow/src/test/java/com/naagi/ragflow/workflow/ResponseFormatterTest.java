package com.naagi.ragflow.workflow;

import com.naagi.ragflow.model.CitationSource;
import com.naagi.ragflow.model.RetrievedChunk;
import com.naagi.ragflow.model.SearchStrategy;
import com.naagi.ragflow.model.WorkflowOutput;
import com.naagi.ragflow.model.WorkflowState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResponseFormatterTest {

    private final ResponseFormatter formatter = new ResponseFormatter(20);

    @Test
    @DisplayName("Citations are numbered from 1 and carry distance = 1 - score")
    void citations() {
        List<CitationSource> citations = formatter.citations(List.of(
                RetrievedChunk.of("handbook.pdf", 3, "Employees get 25 days of paid leave per year.", 0.82),
                RetrievedChunk.of("policy.pdf", 0, "Short text", 1.0)));

        assertThat(citations).hasSize(2);
        assertThat(citations.get(0).index()).isEqualTo(1);
        assertThat(citations.get(0).source()).isEqualTo("handbook.pdf");
        assertThat(citations.get(0).distance()).isCloseTo(0.18, within(1e-9));
        assertThat(citations.get(0).preview()).isEqualTo("Employees get 25 day...");
        assertThat(citations.get(1).index()).isEqualTo(2);
        assertThat(citations.get(1).distance()).isZero();
        assertThat(citations.get(1).preview()).isEqualTo("Short text");
    }

    @Test
    @DisplayName("Apology without chunks is the generic message")
    void genericApology() {
        assertThat(formatter.apology(List.of())).isEqualTo(ResponseFormatter.GENERIC_APOLOGY);
        assertThat(formatter.apology(null)).isEqualTo(ResponseFormatter.GENERIC_APOLOGY);
    }

    @Test
    @DisplayName("Apology lists at most three passage previews")
    void apologyWithPreviews() {
        List<RetrievedChunk> chunks = List.of(
                RetrievedChunk.of("a.pdf", 0, "first passage", 0.9),
                RetrievedChunk.of("b.pdf", 0, "second passage", 0.8),
                RetrievedChunk.of("c.pdf", 0, "third passage", 0.7),
                RetrievedChunk.of("d.pdf", 0, "fourth passage", 0.6));

        String answer = formatter.apology(chunks);

        assertThat(answer).contains("[1] a.pdf: first passage", "[3] c.pdf: third passage");
        assertThat(answer).doesNotContain("d.pdf");
    }

    @Test
    @DisplayName("Validation errors are shown verbatim, anything else is replaced")
    void errorAnswer() {
        WorkflowState state = WorkflowState.builder().build();
        state.addError("Question must not be empty");

        assertThat(formatter.errorAnswer(state, true)).isEqualTo("Question must not be empty");
        assertThat(formatter.errorAnswer(state, false)).isEqualTo(ResponseFormatter.GENERIC_APOLOGY);
    }

    @Test
    @DisplayName("Unrouted state reports no category and no strategy")
    void outputBeforeRouting() {
        WorkflowState state = WorkflowState.builder().threadId("t-1").build();

        WorkflowOutput output = formatter.toOutput(state, "cp-1", true);

        assertThat(output.routedCategory()).isNull();
        assertThat(output.searchStrategy()).isNull();
        assertThat(output.fromCache()).isFalse();
        assertThat(output.checkpointId()).isEqualTo("cp-1");
        assertThat(output.threadId()).isEqualTo("t-1");
    }

    @Test
    @DisplayName("Routed state reports its category and strategy")
    void outputAfterRouting() {
        WorkflowState state = WorkflowState.builder()
                .threadId("t-1")
                .routedCategory("hr")
                .searchStrategy(SearchStrategy.HYBRID)
                .finalAnswer("25 days [1]")
                .build();

        WorkflowOutput output = formatter.toOutput(state, null, false);

        assertThat(output.routedCategory()).isEqualTo("hr");
        assertThat(output.searchStrategy()).isEqualTo(SearchStrategy.HYBRID);
        assertThat(output.finalAnswer()).isEqualTo("25 days [1]");
    }
}
