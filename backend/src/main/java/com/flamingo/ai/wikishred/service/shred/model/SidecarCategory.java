package com.flamingo.ai.wikishred.service.shred.model;

/**
 * Kind of heavy structured element lifted out of the flow text into the sidecar.
 *
 * <p>Each category carries the marker written into the placeholder ({@code TABLE}) and the prefix
 * used for its per-article token IDs ({@code TBL_1}).
 */
public enum SidecarCategory {
  TABLE("TABLE", "TBL"),
  INFOBOX("INFOBOX", "INFO"),
  FORMULA("FORMULA", "MATH");

  private final String marker;
  private final String tokenPrefix;

  SidecarCategory(String marker, String tokenPrefix) {
    this.marker = marker;
    this.tokenPrefix = tokenPrefix;
  }

  public String marker() {
    return marker;
  }

  public String tokenPrefix() {
    return tokenPrefix;
  }

  /**
   * Resolves a category from its placeholder marker.
   *
   * @param marker marker text, e.g. {@code INFOBOX}
   * @return the matching category
   * @throws IllegalArgumentException if the marker is unknown
   */
  public static SidecarCategory fromMarker(String marker) {
    for (SidecarCategory category : values()) {
      if (category.marker.equals(marker)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unknown sidecar category marker: " + marker);
  }
}
