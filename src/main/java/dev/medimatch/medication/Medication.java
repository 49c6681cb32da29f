package dev.medimatch.medication;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * A stored medication that recognition queries are matched against.
 *
 * <p>The metadata is the single source of truth for searchable details; searchable terms are
 * derived from it on demand and never stored alongside.
 *
 * @param id immutable unique identifier
 * @param name display name (must not be blank)
 * @param metadata optional structured details; null when the user never entered any
 */
public record Medication(UUID id, String name, @Nullable MedicationMetadata metadata) {

  /** URL scheme the mobile client registers for opening a medication. */
  static final String DEEP_LINK_PREFIX = "tabi://medication/";

  /** Compact constructor validating input. */
  public Medication {
    if (id == null) {
      throw new IllegalArgumentException("Medication id must not be null");
    }
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Medication name must not be blank");
    }
  }

  /** Convenience constructor for a medication without metadata. */
  public Medication(UUID id, String name) {
    this(id, name, null);
  }

  /** Creates a medication with a random identifier. */
  public static Medication named(String name, @Nullable MedicationMetadata metadata) {
    return new Medication(UUID.randomUUID(), name, metadata);
  }

  /** Returns the external code from metadata, or null if absent or blank. */
  public @Nullable String externalCode() {
    return metadata != null && metadata.hasExternalCode() ? metadata.externalCode() : null;
  }

  /** Deep link the client resolves to the medication detail screen. */
  public String deepLink() {
    return DEEP_LINK_PREFIX + id;
  }
}
