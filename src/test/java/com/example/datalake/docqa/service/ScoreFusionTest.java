package com.example.datalake.docqa.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.example.datalake.docqa.model.RankedPassage;
import com.example.datalake.docqa.model.ScoredChunk;
import com.example.datalake.docqa.model.SearchType;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ScoreFusionTest {

  private static final UUID DOC = UUID.randomUUID();

  @Test
  void weightedFusionJoinsBothSides() {
    ScoredChunk a = hit("a", 0.9);
    ScoredChunk b = hit("b", 0.5);
    ScoredChunk bKeyword = new ScoredChunk(b.chunkId(), DOC, b.chunkIndex(), b.content(), "f.txt", 1.0);
    ScoredChunk c = hit("c", 0.8);

    List<RankedPassage> ranked = ScoreFusion.weighted(List.of(a, b), List.of(bKeyword, c), 0.6, 0.4, 20);

    assertThat(ranked).extracting(RankedPassage::content).containsExactly("b", "a", "c");
    RankedPassage first = ranked.get(0);
    assertThat(first.searchType()).isEqualTo(SearchType.HYBRID);
    assertThat(first.semanticScore()).isEqualTo(0.5);
    assertThat(first.keywordScore()).isEqualTo(1.0);
    assertThat(first.combinedScore()).isCloseTo(0.7, within(1e-9));
    assertThat(ranked.get(1).searchType()).isEqualTo(SearchType.SEMANTIC);
    assertThat(ranked.get(1).combinedScore()).isCloseTo(0.54, within(1e-9));
    assertThat(ranked.get(2).searchType()).isEqualTo(SearchType.KEYWORD);
    assertThat(ranked.get(2).keywordScore()).isEqualTo(0.8);
    assertThat(ranked.get(2).semanticScore()).isEqualTo(0.0);
    assertThat(ranked.get(2).combinedScore()).isCloseTo(0.32, within(1e-9));
  }

  @Test
  void exactTiesKeepSemanticResultsFirst() {
    ScoredChunk semanticOnly = hit("semantic", 0.5);
    ScoredChunk keywordOnly = hit("keyword", 0.5);

    List<RankedPassage> ranked = ScoreFusion.weighted(List.of(semanticOnly), List.of(keywordOnly), 0.5, 0.5, 20);

    assertThat(ranked.get(0).combinedScore()).isEqualTo(ranked.get(1).combinedScore());
    assertThat(ranked).extracting(RankedPassage::content).containsExactly("semantic", "keyword");
  }

  @Test
  void resultIsTruncatedToLimit() {
    List<ScoredChunk> semantic = List.of(hit("1", 0.9), hit("2", 0.8), hit("3", 0.7));

    List<RankedPassage> ranked = ScoreFusion.weighted(semantic, List.of(), 0.6, 0.4, 2);

    assertThat(ranked).extracting(RankedPassage::content).containsExactly("1", "2");
  }

  @Test
  void emptyInputsGiveEmptyResult() {
    assertThat(ScoreFusion.weighted(List.of(), null, 0.6, 0.4, 20)).isEmpty();
    assertThat(ScoreFusion.reciprocalRank(null, List.of(), 60, 20)).isEmpty();
  }

  @Test
  void reciprocalRankFavoursChunksFoundByBothLookups() {
    ScoredChunk onlySemantic = hit("semantic-top", 0.99);
    ScoredChunk both = hit("both", 0.3);
    ScoredChunk bothKeyword = new ScoredChunk(both.chunkId(), DOC, both.chunkIndex(), both.content(), "f.txt", 0.9);

    List<RankedPassage> ranked = ScoreFusion.reciprocalRank(List.of(onlySemantic, both), List.of(bothKeyword), 60, 20);

    assertThat(ranked).extracting(RankedPassage::content).containsExactly("both", "semantic-top");
    assertThat(ranked.get(0).combinedScore()).isCloseTo(1.0 / 62 + 1.0 / 61, within(1e-12));
    assertThat(ranked.get(1).combinedScore()).isCloseTo(1.0 / 61, within(1e-12));
  }

  @Test
  void chunkDeepInBothListsIsStillJoinedBeforeTruncation() {
    List<ScoredChunk> semantic = new ArrayList<>();
    for (int i = 0; i < 45; i++) {
      semantic.add(hit("filler " + i, 0.99 - i * 0.001));
    }
    ScoredChunk zebra = hit("zebra", 0.7);
    semantic.add(zebra);
    ScoredChunk zebraKeyword = new ScoredChunk(zebra.chunkId(), DOC, 0, "zebra", "f.txt", 1.0);

    List<RankedPassage> ranked = ScoreFusion.weighted(semantic, List.of(zebraKeyword), 0.6, 0.4, 20);

    assertThat(ranked).hasSize(20);
    assertThat(ranked.get(0).content()).isEqualTo("zebra");
    assertThat(ranked.get(0).searchType()).isEqualTo(SearchType.HYBRID);
    assertThat(ranked.get(0).combinedScore()).isCloseTo(0.7 * 0.6 + 0.4, within(1e-9));
  }

  private static ScoredChunk hit(String content, double score) {
    return new ScoredChunk(UUID.randomUUID(), DOC, 0, content, "f.txt", score);
  }
}
