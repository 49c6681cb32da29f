package dev.medimatch.medication;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class MedicationTest {

  private static final UUID ID = UUID.fromString("3f2b8c1e-0000-4000-8000-000000000001");

  @Test
  void blankNameIsRejected() {
    assertThatThrownBy(() -> new Medication(ID, "  "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Medication name must not be blank");
  }

  @Test
  void nullIdIsRejected() {
    assertThatThrownBy(() -> new Medication(null, "Aspirin"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Medication id must not be null");
  }

  @Test
  void deepLinkUsesMedicationScheme() {
    assertThat(new Medication(ID, "Aspirin").deepLink())
        .isEqualTo("tabi://medication/3f2b8c1e-0000-4000-8000-000000000001");
  }

  @Test
  void externalCodeIsReadFromMetadata() {
    Medication withCode =
        new Medication(ID, "Aspirin", MedicationMetadata.builder().externalCode("0280-2000").build());

    assertThat(withCode.externalCode()).isEqualTo("0280-2000");
  }

  @Test
  void blankOrMissingExternalCodeIsNull() {
    assertThat(new Medication(ID, "Aspirin").externalCode()).isNull();
    assertThat(
            new Medication(ID, "Aspirin", MedicationMetadata.builder().externalCode(" ").build())
                .externalCode())
        .isNull();
  }

  @Test
  void brandNamesAreDefensivelyCopied() {
    List<String> brands = new ArrayList<>(List.of("Advil"));
    MedicationMetadata metadata = MedicationMetadata.builder().brandNames(brands).build();

    brands.add("Motrin");

    assertThat(metadata.brandNames()).containsExactly("Advil");
  }

  @Test
  void emptyMetadataHasNoBrandNames() {
    assertThat(MedicationMetadata.empty().brandNames()).isEmpty();
    assertThat(MedicationMetadata.empty().hasExternalCode()).isFalse();
  }
}
