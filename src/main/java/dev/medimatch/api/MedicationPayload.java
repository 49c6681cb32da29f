package dev.medimatch.api;

import dev.medimatch.medication.Medication;
import dev.medimatch.medication.MedicationMetadata;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** JSON form of a candidate {@link Medication} with its optional metadata flattened in. */
public record MedicationPayload(
    @NotNull UUID id,
    @NotBlank String name,
    @Nullable String genericName,
    @Nullable List<@NotNull String> brandNames,
    @Nullable String activeIngredient,
    @Nullable String dosageAmount,
    @Nullable String color,
    @Nullable String shape,
    @Nullable String externalCode,
    @Nullable String notes) {

  Medication toMedication() {
    return new Medication(id, name, hasMetadata() ? toMetadata() : null);
  }

  private MedicationMetadata toMetadata() {
    return MedicationMetadata.builder()
        .genericName(genericName)
        .brandNames(brandNames == null ? List.of() : brandNames)
        .activeIngredient(activeIngredient)
        .dosageAmount(dosageAmount)
        .pillColor(SignalsPayload.parseColor(color))
        .pillShape(SignalsPayload.parseShape(shape))
        .externalCode(externalCode)
        .notes(notes)
        .build();
  }

  private boolean hasMetadata() {
    return genericName != null
        || (brandNames != null && !brandNames.isEmpty())
        || activeIngredient != null
        || dosageAmount != null
        || color != null
        || shape != null
        || externalCode != null
        || notes != null;
  }
}
