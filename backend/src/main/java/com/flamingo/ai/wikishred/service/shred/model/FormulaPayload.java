package com.flamingo.ai.wikishred.service.shred.model;

/**
 * A math formula extracted from an article.
 *
 * @param tex TeX source when it could be recovered from the markup, otherwise empty
 * @param display {@code true} for block (display-style) formulas
 * @param rawMarkup original formula markup
 */
public record FormulaPayload(String tex, boolean display, String rawMarkup)
    implements SidecarPayload {}
