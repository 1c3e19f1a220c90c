package com.flamingo.ai.wikishred.service.shred.model;

/**
 * Structured content of a {@link SidecarEntry}.
 *
 * <p>Implemented by {@link TablePayload}, {@link InfoboxPayload} and {@link FormulaPayload}.
 */
public interface SidecarPayload {

  /** Original markup of the extracted element, kept so consumers can always re-render it. */
  String rawMarkup();
}
