package com.example.datalake.docqa.util;

public final class VectorMath {

  private VectorMath() {
  }

  /**
   * Cosine similarity of two vectors. Returns {@link Double#NaN} when either side is empty,
   * the dimensions differ, or a norm is zero, so callers can filter such entries out.
   */
  public static double cosineSimilarity(float[] left, float[] right) {
    if (left == null || right == null || left.length == 0 || left.length != right.length) {
      return Double.NaN;
    }
    double dot = 0;
    double leftMagnitude = 0;
    double rightMagnitude = 0;
    for (int i = 0; i < left.length; i++) {
      double l = left[i];
      double r = right[i];
      dot += l * r;
      leftMagnitude += l * l;
      rightMagnitude += r * r;
    }
    if (leftMagnitude == 0 || rightMagnitude == 0) {
      return Double.NaN;
    }
    return dot / (Math.sqrt(leftMagnitude) * Math.sqrt(rightMagnitude));
  }

  /** Full-text ranks are small; scale them and cap at 1.0 so they are comparable to similarities. */
  public static double normalizeKeywordRank(double rawRank, double multiplier) {
    if (Double.isNaN(rawRank) || rawRank <= 0) {
      return 0.0;
    }
    return Math.min(1.0, rawRank * multiplier);
  }
}
