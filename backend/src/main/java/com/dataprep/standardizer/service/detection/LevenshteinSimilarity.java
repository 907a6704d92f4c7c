package com.dataprep.standardizer.service.detection;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalized edit-distance similarity. Both inputs are lowercased and stripped of all whitespace
 * before comparison, so values differing only in casing or spacing score 1.0.
 */
public class LevenshteinSimilarity {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * Calculate similarity as {@code (len(longer) - distance) / len(longer)}.
   *
   * @return similarity score (0.0 to 1.0)
   */
  public double calculate(String first, String second) {
    if (first == null || second == null) {
      return 0.0;
    }
    String s1 = normalize(first);
    String s2 = normalize(second);
    if (s1.equals(s2)) {
      return 1.0;
    }

    String longer = s1.length() > s2.length() ? s1 : s2;
    String shorter = s1.length() > s2.length() ? s2 : s1;
    if (longer.isEmpty()) {
      return 1.0;
    }

    int distance = computeEditDistance(longer, shorter);
    return (longer.length() - distance) / (double) longer.length();
  }

  static String normalize(String value) {
    return WHITESPACE.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
  }

  /** Classic dynamic programming over an {@code (m+1) x (n+1)} edit matrix. */
  public static int computeEditDistance(String source, String target) {
    int m = source.length();
    int n = target.length();
    int[][] matrix = new int[m + 1][n + 1];

    for (int i = 0; i <= m; i++) {
      matrix[i][0] = i;
    }
    for (int j = 0; j <= n; j++) {
      matrix[0][j] = j;
    }

    for (int i = 1; i <= m; i++) {
      for (int j = 1; j <= n; j++) {
        int cost = source.charAt(i - 1) == target.charAt(j - 1) ? 0 : 1;
        matrix[i][j] =
            Math.min(
                Math.min(matrix[i - 1][j] + 1, matrix[i][j - 1] + 1), // delete or insert
                matrix[i - 1][j - 1] + cost); // substitute
      }
    }
    return matrix[m][n];
  }
}
