package dev.medimatch.api;

import dev.medimatch.identify.RankedMedication;
import java.util.UUID;

/**
 * One entry of the identification response.
 *
 * @param id medication identifier
 * @param name display name
 * @param score relevance score in [0.0, 1.0]
 * @param deepLink link the client opens when the user picks this result
 */
public record IdentificationResultDto(UUID id, String name, double score, String deepLink) {

  static IdentificationResultDto from(RankedMedication ranked) {
    return new IdentificationResultDto(
        ranked.medication().id(),
        ranked.medication().name(),
        ranked.score(),
        ranked.medication().deepLink());
  }
}
