package com.naagi.ragflow.search;

import com.naagi.ragflow.model.RetrievedChunk;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResultFuser.
 * Tests normalization, weighted combination, tie ordering and weight validation.
 */
class ResultFuserTest {

    private final ResultFuser fuser = new ResultFuser(0.6, 0.4);

    @Nested
    class NormalizationTests {

        @Test
        void testMinMaxNormalization() {
            List<RetrievedChunk> results = List.of(
                    RetrievedChunk.of("a.pdf", 0, "a", 0.9),
                    RetrievedChunk.of("b.pdf", 0, "b", 0.5),
                    RetrievedChunk.of("c.pdf", 0, "c", 0.1));

            Map<String, Double> normalized = ResultFuser.normalizeScores(results);

            assertEquals(1.0, normalized.get("a.pdf#0"), 1e-9);
            assertEquals(0.5, normalized.get("b.pdf#0"), 1e-9);
            assertEquals(0.0, normalized.get("c.pdf#0"), 1e-9);
        }

        @Test
        void testConstantScoresNormalizeToOne() {
            List<RetrievedChunk> results = List.of(
                    RetrievedChunk.of("a.pdf", 0, "a", 0.4),
                    RetrievedChunk.of("b.pdf", 0, "b", 0.4));

            Map<String, Double> normalized = ResultFuser.normalizeScores(results);

            assertEquals(1.0, normalized.get("a.pdf#0"), 1e-9);
            assertEquals(1.0, normalized.get("b.pdf#0"), 1e-9);
        }

        @Test
        void testEmptyList() {
            assertTrue(ResultFuser.normalizeScores(List.of()).isEmpty());
        }
    }

    @Nested
    class FusionTests {

        @Test
        void testChunkInBothListsRanksFirst() {
            List<RetrievedChunk> semantic = List.of(
                    RetrievedChunk.of("shared.pdf", 1, "shared", 0.9),
                    RetrievedChunk.of("semantic.pdf", 0, "semantic only", 0.8));
            List<RetrievedChunk> keyword = List.of(
                    RetrievedChunk.of("shared.pdf", 1, "shared", 0.7),
                    RetrievedChunk.of("keyword.pdf", 0, "keyword only", 0.2));

            List<RetrievedChunk> fused = fuser.fuse(semantic, keyword, 10);

            assertEquals(3, fused.size());
            assertEquals("shared.pdf", fused.get(0).source());
            assertEquals(1.0, fused.get(0).score(), 1e-9);
        }

        @Test
        void testCombinedScoreNeverExceedsWeightSum() {
            List<RetrievedChunk> semantic = List.of(
                    RetrievedChunk.of("a.pdf", 0, "a", 1.0),
                    RetrievedChunk.of("b.pdf", 0, "b", 0.3));
            List<RetrievedChunk> keyword = List.of(
                    RetrievedChunk.of("a.pdf", 0, "a", 1.0),
                    RetrievedChunk.of("c.pdf", 0, "c", 0.1));

            ResultFuser discounted = new ResultFuser(0.5, 0.3);
            for (RetrievedChunk chunk : discounted.fuse(semantic, keyword, 10)) {
                assertTrue(chunk.score() <= 0.8 + 1e-9, "score " + chunk.score() + " above weight sum");
                assertTrue(chunk.score() >= 0.0);
            }
        }

        @Test
        void testSingleListChunkGetsOnlyItsWeightedScore() {
            List<RetrievedChunk> semantic = List.of(RetrievedChunk.of("a.pdf", 0, "a", 0.9));

            List<ResultFuser.FusedResult> fused = fuser.fuse(semantic, List.of(), 0.6, 0.4, 5);

            assertEquals(1, fused.size());
            assertEquals(0.6, fused.get(0).chunk().score(), 1e-9);
            assertEquals(0, fused.get(0).semanticRank());
            assertEquals(-1, fused.get(0).keywordRank());
            assertFalse(fused.get(0).inBoth());
        }

        @Test
        void testTiesBrokenBySemanticRankThenKeywordRank() {
            // all three end up with a combined score of 0.5
            List<RetrievedChunk> semantic = List.of(
                    RetrievedChunk.of("s1.pdf", 0, "s1", 0.7),
                    RetrievedChunk.of("s2.pdf", 0, "s2", 0.7));
            List<RetrievedChunk> keyword = List.of(
                    RetrievedChunk.of("k1.pdf", 0, "k1", 0.3));

            List<RetrievedChunk> fused = fuser.fuse(semantic, keyword, 0.5, 0.5, 10).stream()
                    .map(ResultFuser.FusedResult::chunk)
                    .toList();

            assertEquals(List.of("s1.pdf", "s2.pdf", "k1.pdf"), fused.stream().map(RetrievedChunk::source).toList());
        }

        @Test
        void testTruncatesToFinalK() {
            List<RetrievedChunk> semantic = List.of(
                    RetrievedChunk.of("a.pdf", 0, "a", 0.9),
                    RetrievedChunk.of("b.pdf", 0, "b", 0.8),
                    RetrievedChunk.of("c.pdf", 0, "c", 0.7));

            assertEquals(2, fuser.fuse(semantic, List.of(), 2).size());
            assertTrue(fuser.fuse(semantic, List.of(), 0).isEmpty());
        }

        @Test
        void testBothListsEmpty() {
            assertTrue(fuser.fuse(List.of(), List.of(), 5).isEmpty());
            assertTrue(fuser.fuse(null, null, 5).isEmpty());
        }
    }

    @Nested
    class WeightValidationTests {

        @Test
        void testNegativeWeightRejected() {
            assertThrows(IllegalArgumentException.class, () -> new ResultFuser(-0.1, 0.5));
        }

        @Test
        void testWeightsAboveOneRejected() {
            assertThrows(IllegalArgumentException.class, () -> new ResultFuser(0.7, 0.4));
            assertThrows(IllegalArgumentException.class,
                    () -> fuser.fuse(List.of(), List.of(), 0.9, 0.2, 5));
        }

        @Test
        void testWeightsBelowOneAllowed() {
            ResultFuser discounted = new ResultFuser(0.3, 0.3);
            assertEquals(0.3, discounted.getSemanticWeight());
            assertEquals(0.3, discounted.getKeywordWeight());
        }
    }
}
