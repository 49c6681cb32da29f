package dev.medimatch.api;

import dev.medimatch.identify.IdentificationService;
import dev.medimatch.reference.CommonMedicationCatalog;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter exposing identification to the mobile client. Converts JSON payloads into domain
 * values and delegates to {@link IdentificationService}; no matching logic lives here.
 */
@RestController
@RequestMapping("/api")
public class IdentificationController {

  private final IdentificationService identificationService;

  public IdentificationController(IdentificationService identificationService) {
    this.identificationService = identificationService;
  }

  /** Ranks the supplied candidates against the captured signals. */
  @PostMapping("/identify")
  public List<IdentificationResultDto> identify(@Valid @RequestBody IdentifyRequest request) {
    var candidates = request.candidates().stream().map(MedicationPayload::toMedication).toList();
    return identificationService
        .identifyScored(request.signals().toSignals(), candidates)
        .stream()
        .map(IdentificationResultDto::from)
        .toList();
  }

  /** Scores one medication against raw query terms. */
  @PostMapping("/score")
  public ScoreResponse score(@Valid @RequestBody ScoreRequest request) {
    return new ScoreResponse(
        identificationService.score(request.queryTerms(), request.medication().toMedication()));
  }

  /** Autocomplete suggestions from the built-in reference catalog. */
  @GetMapping("/reference/suggestions")
  public List<SuggestionDto> suggestions(
      @RequestParam String term,
      @RequestParam(defaultValue = "" + CommonMedicationCatalog.DEFAULT_SUGGESTION_LIMIT)
          int limit) {
    return CommonMedicationCatalog.suggestions(term, limit).stream()
        .map(SuggestionDto::from)
        .toList();
  }
}
