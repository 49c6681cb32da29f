package dev.medimatch.medication;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Optional structured details about a medication, used to widen the set of terms a recognition
 * query can match against.
 *
 * @param genericName generic or scientific name (e.g. "Acetylsalicylic Acid")
 * @param brandNames brand names the medication is sold under; never null, possibly empty
 * @param activeIngredient the active ingredient
 * @param dosageAmount dosage as printed on the packaging (e.g. "500mg")
 * @param pillColor colour tag of the pill
 * @param pillShape shape tag of the pill
 * @param externalCode National Drug Code payload scanned from the package barcode
 * @param notes free-text notes; never used for matching
 */
public record MedicationMetadata(
    @Nullable String genericName,
    List<String> brandNames,
    @Nullable String activeIngredient,
    @Nullable String dosageAmount,
    @Nullable PillColor pillColor,
    @Nullable PillShape pillShape,
    @Nullable String externalCode,
    @Nullable String notes) {

  public MedicationMetadata {
    brandNames = brandNames == null ? List.of() : List.copyOf(brandNames);
  }

  /** Metadata with no fields set. */
  public static MedicationMetadata empty() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns true if an external code is present and not blank. */
  public boolean hasExternalCode() {
    return externalCode != null && !externalCode.isBlank();
  }

  /** Builder for the many optional metadata fields. */
  public static final class Builder {

    private @Nullable String genericName;
    private List<String> brandNames = List.of();
    private @Nullable String activeIngredient;
    private @Nullable String dosageAmount;
    private @Nullable PillColor pillColor;
    private @Nullable PillShape pillShape;
    private @Nullable String externalCode;
    private @Nullable String notes;

    private Builder() {}

    public Builder genericName(@Nullable String genericName) {
      this.genericName = genericName;
      return this;
    }

    public Builder brandNames(List<String> brandNames) {
      this.brandNames = brandNames;
      return this;
    }

    public Builder brandNames(String... brandNames) {
      this.brandNames = List.of(brandNames);
      return this;
    }

    public Builder activeIngredient(@Nullable String activeIngredient) {
      this.activeIngredient = activeIngredient;
      return this;
    }

    public Builder dosageAmount(@Nullable String dosageAmount) {
      this.dosageAmount = dosageAmount;
      return this;
    }

    public Builder pillColor(@Nullable PillColor pillColor) {
      this.pillColor = pillColor;
      return this;
    }

    public Builder pillShape(@Nullable PillShape pillShape) {
      this.pillShape = pillShape;
      return this;
    }

    public Builder externalCode(@Nullable String externalCode) {
      this.externalCode = externalCode;
      return this;
    }

    public Builder notes(@Nullable String notes) {
      this.notes = notes;
      return this;
    }

    public MedicationMetadata build() {
      return new MedicationMetadata(
          genericName,
          brandNames,
          activeIngredient,
          dosageAmount,
          pillColor,
          pillShape,
          externalCode,
          notes);
    }
  }
}
