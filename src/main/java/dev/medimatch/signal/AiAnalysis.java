package dev.medimatch.signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Structured medication details extracted from recognized text by the optional language-model
 * collaborator. Every field is optional because the model leaves out anything it is unsure of.
 *
 * @param name primary medication name
 * @param genericName generic or scientific name
 * @param brandNames brand names mentioned on the packaging
 * @param dosageAmount dosage such as "500mg" or "10ml"
 * @param activeIngredient active ingredient
 * @param pillColor pill colour if mentioned (free text)
 * @param pillShape pill shape if mentioned (free text)
 */
public record AiAnalysis(
    @Nullable String name,
    @Nullable String genericName,
    List<String> brandNames,
    @Nullable String dosageAmount,
    @Nullable String activeIngredient,
    @Nullable String pillColor,
    @Nullable String pillShape) {

  public AiAnalysis {
    brandNames = brandNames == null ? List.of() : List.copyOf(brandNames);
  }

  /**
   * Flattens the analysis into AI-suggested search terms: name, generic name, brand names, dosage
   * and active ingredient, in that order. Colour and shape are left to the dedicated classifiers.
   */
  public List<String> searchTerms() {
    List<String> terms = new ArrayList<>();
    addIfPresent(terms, name);
    addIfPresent(terms, genericName);
    brandNames.forEach(brand -> addIfPresent(terms, brand));
    addIfPresent(terms, dosageAmount);
    addIfPresent(terms, activeIngredient);
    return List.copyOf(terms);
  }

  /**
   * Best guess at the medication's name: the model's answer if it gave one, otherwise the first
   * recognized text that looks like a medication name.
   *
   * @param recognizedText text elements from the same image
   * @return the best name guess, or empty if neither source has one
   */
  public Optional<String> bestGuessName(List<RecognizedText> recognizedText) {
    if (name != null && !name.isBlank()) {
      return Optional.of(name);
    }
    return recognizedText.stream()
        .filter(RecognizedText::looksLikeMedicationName)
        .map(RecognizedText::text)
        .findFirst();
  }

  private static void addIfPresent(List<String> terms, @Nullable String value) {
    if (value != null && !value.isBlank()) {
      terms.add(value);
    }
  }
}
