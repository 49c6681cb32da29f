package dev.medimatch.matching;

/**
 * Levenshtein distance over Unicode code points.
 *
 * <p>Uses the full dynamic-programming table; inputs are short medication and brand names, so no
 * banding or early exit is applied. Case is not folded here; callers pass normalised terms.
 */
public final class EditDistance {

  private EditDistance() {}

  /**
   * Minimum number of single code point insertions, deletions or substitutions turning {@code a}
   * into {@code b}.
   *
   * @param a first string
   * @param b second string
   * @return the edit distance; the other string's length if either is empty, 0 if equal
   */
  public static int levenshtein(String a, String b) {
    int[] s = a.codePoints().toArray();
    int[] t = b.codePoints().toArray();
    int[][] dist = new int[s.length + 1][t.length + 1];

    for (int i = 0; i <= s.length; i++) {
      dist[i][0] = i;
    }
    for (int j = 0; j <= t.length; j++) {
      dist[0][j] = j;
    }

    for (int i = 1; i <= s.length; i++) {
      for (int j = 1; j <= t.length; j++) {
        if (s[i - 1] == t[j - 1]) {
          dist[i][j] = dist[i - 1][j - 1];
        } else {
          int deletion = dist[i - 1][j] + 1;
          int insertion = dist[i][j - 1] + 1;
          int substitution = dist[i - 1][j - 1] + 1;
          dist[i][j] = Math.min(deletion, Math.min(insertion, substitution));
        }
      }
    }
    return dist[s.length][t.length];
  }
}
