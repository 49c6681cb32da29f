package dev.medimatch.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class MatchingPropertiesTest {

  @Test
  void defaultsMatchDocumentedValues() {
    MatchingProperties props = new MatchingProperties();

    assertThat(props.getMinRelevance()).isEqualTo(0.1);
    assertThat(props.getMaxResults()).isEqualTo(10);
    assertThat(props.getFuzzyMaxDistance()).isEqualTo(2);
    assertThat(props.getParallelThreshold()).isEqualTo(512);
  }

  @Test
  void defaultsPassValidation() {
    assertThatCode(() -> new MatchingProperties().validate()).doesNotThrowAnyException();
  }

  @Test
  void minRelevanceOfOneIsRejected() {
    MatchingProperties props = new MatchingProperties();
    props.setMinRelevance(1.0);

    assertThatThrownBy(props::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("min-relevance");
  }

  @Test
  void negativeMinRelevanceIsRejected() {
    MatchingProperties props = new MatchingProperties();
    props.setMinRelevance(-0.1);

    assertThatThrownBy(props::validate).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void maxResultsOutOfRangeIsRejected() {
    MatchingProperties props = new MatchingProperties();
    props.setMaxResults(0);

    assertThatThrownBy(props::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("max-results");
  }

  @Test
  void fuzzyMaxDistanceOutOfRangeIsRejected() {
    MatchingProperties props = new MatchingProperties();
    props.setFuzzyMaxDistance(11);

    assertThatThrownBy(props::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("fuzzy-max-distance");
  }

  @Test
  void parallelThresholdBelowOneIsRejected() {
    MatchingProperties props = new MatchingProperties();
    props.setParallelThreshold(0);

    assertThatThrownBy(props::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("parallel-threshold");
  }
}
