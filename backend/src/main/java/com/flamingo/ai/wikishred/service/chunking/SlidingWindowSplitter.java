package com.flamingo.ai.wikishred.service.chunking;

import com.flamingo.ai.wikishred.service.token.TokenScanner;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits an oversized run of Markdown blocks into overlapping windows.
 *
 * <p>Windows are cut at block boundaries. A block longer than the maximum is first divided into
 * lines, then sentences, then words; placeholder tokens always stay whole. A window grows until
 * it reaches the target size and never passes the maximum. When the text left after a window
 * would be too small for a chunk of its own, it is absorbed into the window if that fits, or units
 * are handed back from the window to the remainder.
 */
final class SlidingWindowSplitter {

  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final String BLOCK_SEPARATOR = "\n\n";

  /**
   * One window of a split.
   *
   * @param content overlap prefix plus body
   * @param overlapLength length of the overlap prefix including its separator
   * @param atomic whether the window is a single oversized token
   */
  record Window(String content, int overlapLength, boolean atomic) {}

  /** Smallest indivisible piece of text and the separator that precedes it. */
  private record Unit(String text, String separator, boolean token) {

    int length() {
      return text.length();
    }
  }

  private final ChunkingPolicy policy;

  SlidingWindowSplitter(ChunkingPolicy policy) {
    this.policy = policy;
  }

  List<Window> split(List<String> blocks) {
    List<Unit> units = units(blocks);
    List<Window> windows = new ArrayList<>();
    String overlap = "";
    int i = 0;
    while (i < units.size()) {
      Unit first = units.get(i);
      if (isOversizedToken(first)) {
        windows.add(new Window(first.text(), 0, true));
        overlap = "";
        i++;
        continue;
      }

      String prefix = overlap.isEmpty() ? "" : overlap + BLOCK_SEPARATOR;
      if (prefix.length() + first.length() > policy.maxChunkSize()) {
        prefix = "";
      }
      int j = i + 1;
      int size = prefix.length() + first.length();
      while (j < units.size() && size < policy.targetChunkSize()) {
        Unit next = units.get(j);
        int grown = size + next.separator().length() + next.length();
        if (isOversizedToken(next) || grown > policy.maxChunkSize()) {
          break;
        }
        size = grown;
        j++;
      }

      j = balanceTail(units, i, j, prefix.length());
      String body = join(units, i, j);
      windows.add(new Window(prefix + body, prefix.length(), false));
      overlap = overlapOf(body);
      i = j;
    }
    return windows;
  }

  /**
   * Moves the window end so the remainder is not left below the minimum size: the whole remainder
   * is absorbed when it fits, otherwise units are handed back while the window stays at least the
   * minimum.
   */
  private int balanceTail(List<Unit> units, int start, int end, int prefixLength) {
    if (end >= units.size()) {
      return end;
    }
    int tail = joinedLength(units, end, units.size());
    if (tail >= policy.minChunkSize()) {
      return end;
    }
    int window = prefixLength + joinedLength(units, start, end);
    boolean tailHasOversizedToken =
        units.subList(end, units.size()).stream().anyMatch(this::isOversizedToken);
    if (!tailHasOversizedToken
        && window + units.get(end).separator().length() + tail <= policy.maxChunkSize()) {
      return units.size();
    }
    int balanced = end;
    while (balanced - 1 > start
        && joinedLength(units, balanced, units.size()) < policy.minChunkSize()
        && prefixLength + joinedLength(units, start, balanced - 1) >= policy.minChunkSize()) {
      balanced--;
    }
    return balanced;
  }

  /**
   * Trailing {@code overlapSize} characters of a window body, starting on a word boundary and
   * never touching a placeholder token.
   */
  String overlapOf(String body) {
    if (policy.overlapSize() == 0 || body.isEmpty()) {
      return "";
    }
    int start = Math.max(0, body.length() - policy.overlapSize());
    while (start > 0 && start < body.length() && !Character.isWhitespace(body.charAt(start - 1))) {
      start++;
    }
    for (TokenScanner.TokenMatch match : TokenScanner.scan(body)) {
      if (match.end() > start) {
        start = Math.max(start, match.end());
      }
    }
    return start >= body.length() ? "" : body.substring(start).strip();
  }

  private boolean isOversizedToken(Unit unit) {
    return unit.token() && unit.length() > policy.maxChunkSize();
  }

  // ---- unit construction ----

  private List<Unit> units(List<String> blocks) {
    List<Unit> units = new ArrayList<>();
    for (String block : blocks) {
      int before = units.size();
      if (block.length() <= policy.maxChunkSize()) {
        units.add(new Unit(block, BLOCK_SEPARATOR, false));
      } else {
        for (String line : block.split("\n")) {
          String separator = units.size() == before ? BLOCK_SEPARATOR : "\n";
          addLine(units, line.stripTrailing(), separator);
        }
      }
    }
    return units;
  }

  private void addLine(List<Unit> units, String line, String separator) {
    if (line.isBlank()) {
      return;
    }
    if (line.length() <= policy.maxChunkSize()) {
      units.add(new Unit(line, separator, false));
      return;
    }
    String nextSeparator = separator;
    int position = 0;
    for (TokenScanner.TokenMatch match : TokenScanner.scan(line)) {
      nextSeparator = addText(units, line.substring(position, match.start()), nextSeparator);
      units.add(new Unit(line.substring(match.start(), match.end()), nextSeparator, true));
      nextSeparator = " ";
      position = match.end();
    }
    addText(units, line.substring(position), nextSeparator);
  }

  /** Adds sentences, falling back to words and then to hard cuts. Returns the next separator. */
  private String addText(List<Unit> units, String text, String separator) {
    String nextSeparator = separator;
    for (String sentence : SENTENCE_END.split(text.strip())) {
      if (sentence.isEmpty()) {
        continue;
      }
      if (sentence.length() <= policy.maxChunkSize()) {
        units.add(new Unit(sentence, nextSeparator, false));
        nextSeparator = " ";
        continue;
      }
      for (String word : WHITESPACE.split(sentence)) {
        for (int from = 0; from < word.length(); from += policy.maxChunkSize()) {
          int to = Math.min(word.length(), from + policy.maxChunkSize());
          units.add(new Unit(word.substring(from, to), nextSeparator, false));
          nextSeparator = " ";
        }
      }
    }
    return nextSeparator;
  }

  // ---- joining ----

  private static String join(List<Unit> units, int from, int to) {
    StringBuilder sb = new StringBuilder();
    for (int k = from; k < to; k++) {
      if (k > from) {
        sb.append(units.get(k).separator());
      }
      sb.append(units.get(k).text());
    }
    return sb.toString();
  }

  private static int joinedLength(List<Unit> units, int from, int to) {
    int length = 0;
    for (int k = from; k < to; k++) {
      if (k > from) {
        length += units.get(k).separator().length();
      }
      length += units.get(k).length();
    }
    return length;
  }
}
