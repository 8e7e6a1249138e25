package com.example.datalake.docqa.service;

import com.example.datalake.docqa.model.RankedPassage;
import com.example.datalake.docqa.model.ScoredChunk;
import com.example.datalake.docqa.model.SearchType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Merges the semantic and keyword hit lists by chunk id (full outer join).
 *
 * <p>Insertion order is semantic hits first, then keyword-only hits. The final sort is stable, so
 * exact ties keep that order.
 */
public final class ScoreFusion {

  private ScoreFusion() {
  }

  public static List<RankedPassage> weighted(List<ScoredChunk> semantic,
                                             List<ScoredChunk> keyword,
                                             double semanticWeight,
                                             double keywordWeight,
                                             int limit) {
    Map<UUID, Merged> merged = join(semantic, keyword);
    List<RankedPassage> out = new ArrayList<>(merged.size());
    for (Merged m : merged.values()) {
      double combined = m.semanticScore * semanticWeight + m.keywordScore * keywordWeight;
      out.add(m.toPassage(combined));
    }
    return sortAndLimit(out, limit);
  }

  /** Reciprocal rank fusion; ranks are 1-based positions in each input list. */
  public static List<RankedPassage> reciprocalRank(List<ScoredChunk> semantic,
                                                   List<ScoredChunk> keyword,
                                                   int k,
                                                   int limit) {
    Map<UUID, Merged> merged = join(semantic, keyword);
    List<RankedPassage> out = new ArrayList<>(merged.size());
    for (Merged m : merged.values()) {
      double combined = 0.0;
      if (m.semanticRank > 0) {
        combined += 1.0 / (k + m.semanticRank);
      }
      if (m.keywordRank > 0) {
        combined += 1.0 / (k + m.keywordRank);
      }
      out.add(m.toPassage(combined));
    }
    return sortAndLimit(out, limit);
  }

  private static Map<UUID, Merged> join(List<ScoredChunk> semantic, List<ScoredChunk> keyword) {
    Map<UUID, Merged> merged = new LinkedHashMap<>();
    int rank = 0;
    for (ScoredChunk hit : safe(semantic)) {
      rank++;
      Merged m = merged.computeIfAbsent(hit.chunkId(), id -> new Merged(hit));
      if (m.semanticRank == 0) {
        m.semanticScore = hit.score();
        m.semanticRank = rank;
      }
    }
    rank = 0;
    for (ScoredChunk hit : safe(keyword)) {
      rank++;
      Merged m = merged.computeIfAbsent(hit.chunkId(), id -> new Merged(hit));
      if (m.keywordRank == 0) {
        m.keywordScore = hit.score();
        m.keywordRank = rank;
      }
    }
    return merged;
  }

  private static List<RankedPassage> sortAndLimit(List<RankedPassage> passages, int limit) {
    // List.sort is a stable merge sort
    passages.sort(Comparator.comparingDouble(RankedPassage::combinedScore).reversed());
    if (limit >= 0 && passages.size() > limit) {
      return List.copyOf(passages.subList(0, limit));
    }
    return List.copyOf(passages);
  }

  private static List<ScoredChunk> safe(List<ScoredChunk> hits) {
    return hits == null ? List.of() : hits;
  }

  private static final class Merged {
    private final ScoredChunk first;
    private double semanticScore;
    private double keywordScore;
    private int semanticRank;
    private int keywordRank;

    private Merged(ScoredChunk first) {
      this.first = first;
    }

    private SearchType type() {
      if (semanticRank > 0 && keywordRank > 0) {
        return SearchType.HYBRID;
      }
      return semanticRank > 0 ? SearchType.SEMANTIC : SearchType.KEYWORD;
    }

    private RankedPassage toPassage(double combined) {
      return new RankedPassage(first.chunkId(), first.documentId(), first.chunkIndex(), first.content(),
          first.filename(), semanticScore, keywordScore, combined, type());
    }
  }
}
