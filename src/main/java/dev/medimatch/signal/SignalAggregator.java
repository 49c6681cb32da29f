package dev.medimatch.signal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Pure static utility merging heterogeneous recognition signals into one query term list.
 *
 * <p>Sources are merged in a fixed order: recognized text (all entries, regardless of
 * confidence), semantic labels, AI-suggested terms, then the detected colour and shape labels.
 * Every entry is normalised with {@link Terms#normalise} and exact duplicates are dropped. The
 * external code never becomes a term; it only drives the barcode shortcut.
 */
public final class SignalAggregator {

  private SignalAggregator() {}

  /**
   * Builds the query term list for the given signals.
   *
   * @param signals the captured evidence
   * @return distinct normalised terms in first-seen order; empty if the signals carry no text
   */
  public static Set<String> aggregate(QuerySignals signals) {
    List<String> raw = new ArrayList<>();
    for (RecognizedText text : signals.recognizedText()) {
      raw.add(text.text());
    }
    raw.addAll(signals.labels());
    raw.addAll(signals.aiTerms());
    if (signals.detectedColor() != null) {
      raw.add(signals.detectedColor().label());
    }
    if (signals.detectedShape() != null) {
      raw.add(signals.detectedShape().label());
    }
    return Collections.unmodifiableSet(Terms.normaliseAll(raw));
  }
}
