package dev.medimatch.api;

import dev.medimatch.reference.CommonMedication;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** A reference catalog entry offered as autocomplete suggestion. */
public record SuggestionDto(
    String name,
    @Nullable String genericName,
    List<String> brandNames,
    List<String> commonDosages,
    String category) {

  static SuggestionDto from(CommonMedication entry) {
    return new SuggestionDto(
        entry.name(),
        entry.genericName(),
        entry.brandNames(),
        entry.commonDosages(),
        entry.category().displayName());
  }
}
