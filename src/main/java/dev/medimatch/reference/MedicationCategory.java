package dev.medimatch.reference;

/** Therapeutic category of a reference catalog entry. */
public enum MedicationCategory {
  PAIN_RELIEF("Pain Relief"),
  ANTIBIOTIC("Antibiotic"),
  VITAMIN("Vitamin"),
  HEART_HEALTH("Heart Health"),
  DIABETES("Diabetes"),
  MENTAL_HEALTH("Mental Health"),
  ALLERGY("Allergy"),
  OTHER("Other");

  private final String displayName;

  MedicationCategory(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }
}
