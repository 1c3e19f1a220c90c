package com.flamingo.ai.wikishred.service.shred.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An infobox extracted from an article.
 *
 * @param title infobox heading, empty if none was found
 * @param fields label to value mapping in document order
 * @param rawMarkup original infobox HTML, always kept as fallback
 */
public record InfoboxPayload(String title, Map<String, String> fields, String rawMarkup)
    implements SidecarPayload {

  public InfoboxPayload {
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }
}
