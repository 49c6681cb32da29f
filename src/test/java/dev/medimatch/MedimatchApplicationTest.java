package dev.medimatch;

import static org.assertj.core.api.Assertions.assertThat;

import dev.medimatch.identify.IdentificationService;
import dev.medimatch.matching.MatchingProperties;
import dev.medimatch.reference.CommonMedicationCatalog;
import dev.medimatch.signal.QuerySignals;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class MedimatchApplicationTest {

  @Autowired MatchingProperties properties;

  @Autowired IdentificationService identificationService;

  @Test
  void contextBindsMatchingDefaults() {
    assertThat(properties.getMinRelevance()).isEqualTo(0.1);
    assertThat(properties.getMaxResults()).isEqualTo(10);
    assertThat(properties.getFuzzyMaxDistance()).isEqualTo(2);
    assertThat(properties.getParallelThreshold()).isEqualTo(512);
  }

  @Test
  void wiredServiceIdentifiesAgainstReferenceCatalog() {
    QuerySignals signals = QuerySignals.builder().recognizedText("Tylenol", "500mg").build();

    assertThat(identificationService.identify(signals, CommonMedicationCatalog.asCandidates()))
        .first()
        .extracting(medication -> medication.name())
        .isEqualTo("Acetaminophen");
  }
}
