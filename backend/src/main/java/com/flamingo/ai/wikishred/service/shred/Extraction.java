package com.flamingo.ai.wikishred.service.shred;

import com.flamingo.ai.wikishred.service.shred.model.SidecarPayload;
import java.util.List;

/**
 * Payload produced by an extractor together with the reasons it had to fall back, if any.
 *
 * @param payload extracted content
 * @param label suggested placeholder label, may be blank
 * @param warnings degradation reasons, empty when the element was fully recognized
 */
record Extraction<P extends SidecarPayload>(P payload, String label, List<String> warnings) {

  Extraction {
    warnings = List.copyOf(warnings);
  }
}
