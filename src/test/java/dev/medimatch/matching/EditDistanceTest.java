package dev.medimatch.matching;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class EditDistanceTest {

  @Test
  void identicalStringsHaveDistanceZero() {
    assertThat(EditDistance.levenshtein("aspirin", "aspirin")).isZero();
  }

  @Test
  void emptyInputReturnsLengthOfOther() {
    assertThat(EditDistance.levenshtein("", "advil")).isEqualTo(5);
    assertThat(EditDistance.levenshtein("advil", "")).isEqualTo(5);
    assertThat(EditDistance.levenshtein("", "")).isZero();
  }

  @Test
  void singleDeletionIsDistanceOne() {
    assertThat(EditDistance.levenshtein("aspirin", "asprin")).isEqualTo(1);
  }

  @Test
  void singleSubstitutionIsDistanceOne() {
    assertThat(EditDistance.levenshtein("advil", "advill")).isEqualTo(1);
    assertThat(EditDistance.levenshtein("motrin", "motrim")).isEqualTo(1);
  }

  @Test
  void classicKittenSittingExample() {
    assertThat(EditDistance.levenshtein("kitten", "sitting")).isEqualTo(3);
  }

  @Test
  void transpositionCostsTwo() {
    assertThat(EditDistance.levenshtein("tylenol", "tyelnol")).isEqualTo(2);
  }

  @Test
  void caseIsNotFolded() {
    assertThat(EditDistance.levenshtein("Aspirin", "aspirin")).isEqualTo(1);
  }

  @Test
  void supplementaryCharactersCountAsOneEdit() {
    // U+1F48A (pill emoji) is two UTF-16 chars but one code point
    assertThat(EditDistance.levenshtein("💊", "")).isEqualTo(1);
    assertThat(EditDistance.levenshtein("a💊b", "ab")).isEqualTo(1);
  }
}
