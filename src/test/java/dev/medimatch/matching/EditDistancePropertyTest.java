package dev.medimatch.matching;

import static org.assertj.core.api.Assertions.assertThat;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for {@link EditDistance} metric invariants using jqwik. Terms are drawn
 * from a small alphabet so that random pairs share characters often enough to exercise the match
 * branch of the table.
 */
class EditDistancePropertyTest {

  @Provide
  Arbitrary<String> terms() {
    return Arbitraries.strings().withCharRange('a', 'f').ofMinLength(0).ofMaxLength(12);
  }

  @Property
  void distanceToSelfIsZero(@ForAll("terms") String s) {
    assertThat(EditDistance.levenshtein(s, s)).isZero();
  }

  @Property
  void distanceFromEmptyIsLength(@ForAll("terms") String s) {
    assertThat(EditDistance.levenshtein("", s)).isEqualTo(s.length());
  }

  @Property
  void distanceIsSymmetric(@ForAll("terms") String a, @ForAll("terms") String b) {
    assertThat(EditDistance.levenshtein(a, b)).isEqualTo(EditDistance.levenshtein(b, a));
  }

  @Property
  void distanceIsBoundedByLengths(@ForAll("terms") String a, @ForAll("terms") String b) {
    int distance = EditDistance.levenshtein(a, b);

    assertThat(distance).isGreaterThanOrEqualTo(Math.abs(a.length() - b.length()));
    assertThat(distance).isLessThanOrEqualTo(Math.max(a.length(), b.length()));
  }

  @Property
  void triangleInequalityHolds(
      @ForAll("terms") String a, @ForAll("terms") String b, @ForAll("terms") String c) {
    assertThat(EditDistance.levenshtein(a, c))
        .isLessThanOrEqualTo(EditDistance.levenshtein(a, b) + EditDistance.levenshtein(b, c));
  }
}
