package dev.medimatch.signal;

import static org.assertj.core.api.Assertions.assertThat;

import dev.medimatch.medication.PillColor;
import dev.medimatch.medication.PillShape;
import java.util.List;
import org.junit.jupiter.api.Test;

class SignalAggregatorTest {

  @Test
  void emptySignalsYieldNoTerms() {
    assertThat(SignalAggregator.aggregate(QuerySignals.empty())).isEmpty();
  }

  @Test
  void allSourcesAreMergedInFixedOrder() {
    QuerySignals signals =
        QuerySignals.builder()
            .recognizedText("Aspirin 500mg")
            .labels("pill")
            .aiTerms(List.of("Acetylsalicylic Acid"))
            .detectedColor(PillColor.WHITE)
            .detectedShape(PillShape.ROUND)
            .build();

    assertThat(SignalAggregator.aggregate(signals))
        .containsExactly("aspirin 500mg", "pill", "acetylsalicylic acid", "white", "round");
  }

  @Test
  void termsAreLowercasedAndTrimmed() {
    QuerySignals signals = QuerySignals.builder().labels("  ADVIL  ", "Tablet\n").build();

    assertThat(SignalAggregator.aggregate(signals)).containsExactly("advil", "tablet");
  }

  @Test
  void duplicatesAcrossSourcesCollapseAfterNormalisation() {
    QuerySignals signals =
        QuerySignals.builder()
            .recognizedText("Advil")
            .labels("advil ")
            .aiTerms(List.of("ADVIL", "Ibuprofen"))
            .build();

    assertThat(SignalAggregator.aggregate(signals)).containsExactly("advil", "ibuprofen");
  }

  @Test
  void lowConfidenceTextIsStillIncluded() {
    QuerySignals signals =
        QuerySignals.builder()
            .recognizedText(List.of(new RecognizedText("Motrin", 0.05)))
            .build();

    assertThat(SignalAggregator.aggregate(signals)).containsExactly("motrin");
  }

  @Test
  void blankEntriesAreSkipped() {
    QuerySignals signals =
        QuerySignals.builder().recognizedText("   ", "").labels("", "capsule").build();

    assertThat(SignalAggregator.aggregate(signals)).containsExactly("capsule");
  }

  @Test
  void externalCodeNeverBecomesATerm() {
    QuerySignals signals =
        QuerySignals.builder().externalCode("0573-0150-20").labels("pill").build();

    assertThat(SignalAggregator.aggregate(signals)).containsExactly("pill");
  }
}
