package com.flamingo.ai.wikishred.service.shred;

/**
 * Builds {@code zim://I/<filename>} image locators.
 *
 * <p>Locators point into the archive image namespace; the media server resolves them to bytes on
 * demand, nothing is extracted while shredding.
 */
public final class MediaLocator {

  public static final String PREFIX = "zim://I/";

  private MediaLocator() {}

  /**
   * Extracts the archive file name from an image {@code src}: the last path segment, without query
   * string or fragment. Wikimedia-style {@code //upload.wikimedia.org/.../220px-File.jpg} and
   * archive-relative {@code ../I/File.jpg} sources both reduce to their final segment.
   *
   * @return file name, empty when {@code src} has no usable segment
   */
  public static String filenameFromSrc(String src) {
    if (src == null) {
      return "";
    }
    String path = src.strip();
    int cut = indexOfAny(path, '?', '#');
    if (cut >= 0) {
      path = path.substring(0, cut);
    }
    while (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    return path.substring(path.lastIndexOf('/') + 1);
  }

  /** Locator for a file name; spaces and angle brackets are percent-encoded. */
  public static String of(String filename) {
    return PREFIX + filename.replace(" ", "%20").replace("<", "%3C").replace(">", "%3E");
  }

  private static int indexOfAny(String value, char first, char second) {
    int a = value.indexOf(first);
    int b = value.indexOf(second);
    if (a < 0) {
      return b;
    }
    return b < 0 ? a : Math.min(a, b);
  }
}
