package com.flamingo.ai.wikishred.service.shred;

import com.flamingo.ai.wikishred.archive.Article;
import com.flamingo.ai.wikishred.config.WikiConfig;
import com.flamingo.ai.wikishred.service.shred.model.FormulaPayload;
import com.flamingo.ai.wikishred.service.shred.model.ImageReference;
import com.flamingo.ai.wikishred.service.shred.model.InfoboxPayload;
import com.flamingo.ai.wikishred.service.shred.model.ShredWarning;
import com.flamingo.ai.wikishred.service.shred.model.ShreddedDocument;
import com.flamingo.ai.wikishred.service.shred.model.SidecarCategory;
import com.flamingo.ai.wikishred.service.shred.model.SidecarPayload;
import com.flamingo.ai.wikishred.service.shred.model.TablePayload;
import com.flamingo.ai.wikishred.service.shred.model.TocEntry;
import com.flamingo.ai.wikishred.service.token.PlaceholderToken;
import com.flamingo.ai.wikishred.service.token.TokenScanner;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.ParseError;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Service;

/**
 * Shreds wiki article HTML into Markdown with placeholder tokens.
 *
 * <p>Tables, infoboxes and formulas are lifted into the sidecar and replaced in the flow by a
 * {@link PlaceholderToken}. Everything else is rendered as Markdown in one depth-first walk, so
 * extracted elements, tokens and images always come out in document order. Images stay in the flow
 * as {@code zim://I/} links.
 *
 * <p>The parser recovers from malformed markup; what it had to repair is reported as {@link
 * ShredWarning.Kind#PARSE_RECOVERABLE} warnings. A heavy element whose structure is not recognized
 * is still extracted, with {@code degraded} set on its sidecar entry.
 */
@Service
@Slf4j
public class WikiShredder implements MarkupShredder {

  private static final String REMOVED_ELEMENTS =
      "script, style, link, meta, noscript, template, .mw-editsection, sup.reference,"
          + " .mw-cite-backlink";

  private static final Set<String> BLOCK_TAGS =
      Set.of(
          "p", "div", "section", "article", "main", "header", "footer", "aside", "nav", "figure",
          "figcaption", "center", "address", "details", "summary", "caption");

  private static final int FALLBACK_ABSTRACT_CHARS = 1000;

  private final WikiConfig.Shredding options;

  public WikiShredder(WikiConfig wikiConfig) {
    this.options = wikiConfig.getShredding();
  }

  @Override
  public ShreddedDocument shred(Article article) {
    String raw = article.rawMarkup() == null ? "" : article.rawMarkup();
    Parser parser = Parser.htmlParser().setTrackErrors(options.getMaxTrackedParseErrors());
    Document dom = Jsoup.parse(raw, "", parser);

    ShredContext context =
        new ShredContext(new TokenRegistry(article.id(), options.getMaxLabelLength()));
    for (ParseError error : parser.getErrors()) {
      context.warn(
          ShredWarning.Kind.PARSE_RECOVERABLE,
          "offset " + error.getPosition(),
          error.getErrorMessage());
    }
    markUnclosedTables(raw, dom, context);
    dom.select(REMOVED_ELEMENTS).remove();

    String markdown = MarkdownText.normalize(renderChildren(dom.body(), context, "body"));
    context.registry.verify(markdown);

    String title = article.title();
    if (title == null || title.isBlank()) {
      title = dom.title().strip();
    }
    ShreddedDocument document =
        new ShreddedDocument(
            article.id(),
            title,
            markdown,
            context.registry.entries(),
            context.images,
            abstractOf(markdown),
            context.toc,
            context.warnings);

    if (!document.warnings().isEmpty()) {
      log.warn(
          "Article {} shredded with {} warnings",
          article.id(),
          document.warnings().size());
    }
    log.debug(
        "Shredded article {}: {} chars markdown, {} sidecar entries, {} images",
        article.id(),
        markdown.length(),
        document.sidecar().size(),
        document.images().size());
    return document;
  }

  /**
   * Matches start tags left open in the source against the parsed tables, which the parser closed
   * at end of input. Tables are paired by their position in document order.
   */
  private void markUnclosedTables(String raw, Document dom, ShredContext context) {
    Set<Integer> unclosed = TagBalanceScanner.unclosedOrdinals(raw, "table");
    if (unclosed.isEmpty()) {
      return;
    }
    Elements tables = dom.select("table");
    for (int ordinal : unclosed) {
      if (ordinal < tables.size()) {
        context.unclosedTables.add(tables.get(ordinal));
      }
    }
  }

  // ---- flow rendering ----

  private String renderChildren(Element parent, ShredContext context, String path) {
    StringBuilder sb = new StringBuilder();
    Map<String, Integer> siblings = new HashMap<>();
    for (Node child : parent.childNodes()) {
      sb.append(renderNode(child, context, path, siblings));
    }
    return sb.toString();
  }

  private String renderNode(
      Node node, ShredContext context, String parentPath, Map<String, Integer> siblings) {
    if (node instanceof TextNode text) {
      return MarkdownText.escape(text.text());
    }
    if (node instanceof Element element) {
      int index = siblings.merge(element.normalName(), 1, Integer::sum) - 1;
      String path = parentPath + "/" + element.normalName() + "[" + index + "]";
      return renderElement(element, context, path);
    }
    return "";
  }

  private String renderElement(Element element, ShredContext context, String path) {
    if (FormulaExtractor.isFormula(element)) {
      return renderFormula(element, context, path);
    }
    String name = element.normalName();
    switch (name) {
      case "h1", "h2", "h3", "h4", "h5", "h6":
        return renderHeading(element, name.charAt(1) - '0', context, path);
      case "table":
        return renderTable(element, context, path);
      case "img":
        return renderImage(element, context);
      case "a":
        return renderLink(element, context, path);
      case "b", "strong":
        return surround(renderChildren(element, context, path), "**", "**");
      case "i", "em":
        return surround(renderChildren(element, context, path), "*", "*");
      case "code", "tt", "kbd", "samp":
        return renderCode(element, context, path);
      case "pre":
        return renderPre(element, context, path);
      case "br":
        return "\n";
      case "hr":
        return "\n\n---\n\n";
      case "ul", "ol":
        return renderList(element, context, path);
      case "li":
        return "\n\n- " + MarkdownText.singleLine(renderChildren(element, context, path)) + "\n\n";
      case "blockquote":
        return renderQuote(element, context, path);
      case "dt":
        return "\n\n" + surround(renderChildren(element, context, path), "**", "**") + "\n\n";
      case "dl", "dd":
        return "\n\n" + renderChildren(element, context, path) + "\n\n";
      default:
        if (BLOCK_TAGS.contains(name)) {
          return "\n\n" + renderChildren(element, context, path) + "\n\n";
        }
        return renderChildren(element, context, path);
    }
  }

  private String renderHeading(Element heading, int level, ShredContext context, String path) {
    String text = MarkdownText.singleLine(renderChildren(heading, context, path));
    if (text.isEmpty()) {
      return "\n\n";
    }
    if (level == 2 || level == 3) {
      context.toc.add(new TocEntry(level, heading.text().strip()));
    }
    return "\n\n" + "#".repeat(level) + " " + text + "\n\n";
  }

  private String renderImage(Element image, ShredContext context) {
    String src = image.attr("src");
    String filename = MediaLocator.filenameFromSrc(src);
    if (filename.isEmpty()) {
      return "";
    }
    String alt = image.attr("alt").strip();
    if (alt.isEmpty()) {
      alt = "Image";
    }
    String locator = MediaLocator.of(filename);
    context.images.add(new ImageReference(locator, filename, alt, src));
    return "![" + MarkdownText.singleLine(MarkdownText.escape(alt)) + "](" + locator + ")";
  }

  private String renderLink(Element link, ShredContext context, String path) {
    String inner = renderChildren(link, context, path);
    if (link.selectFirst("img") != null || TokenScanner.containsToken(inner)) {
      return inner;
    }
    String text = MarkdownText.singleLine(inner);
    if (text.isEmpty()) {
      return "";
    }
    String target = LinkNormalizer.normalize(link.attr("href"));
    if (target.isEmpty()) {
      return inner;
    }
    return surround(inner, "[", "](" + target + ")");
  }

  private String renderCode(Element code, ShredContext context, String path) {
    String text = code.text();
    if (text.isBlank()) {
      return text.isEmpty() ? "" : " ";
    }
    if (text.contains("`") || code.selectFirst("math, .mwe-math-element, table, img") != null) {
      return renderChildren(code, context, path);
    }
    return "`" + text + "`";
  }

  private String renderPre(Element pre, ShredContext context, String path) {
    String text = pre.wholeText().stripTrailing();
    while (text.startsWith("\n")) {
      text = text.substring(1);
    }
    if (text.isBlank()) {
      return "";
    }
    if (text.contains("```") || pre.selectFirst("math, .mwe-math-element, table, img") != null) {
      return "\n\n" + renderChildren(pre, context, path) + "\n\n";
    }
    return "\n\n```\n" + text + "\n```\n\n";
  }

  private String renderList(Element list, ShredContext context, String path) {
    boolean ordered = "ol".equals(list.normalName());
    int number = ordered ? startNumber(list) : 0;
    StringBuilder sb = new StringBuilder("\n\n");
    Map<String, Integer> siblings = new HashMap<>();
    for (Node child : list.childNodes()) {
      if (child instanceof Element item && "li".equals(item.normalName())) {
        int index = siblings.merge("li", 1, Integer::sum) - 1;
        String rendered = renderListItem(item, context, path + "/li[" + index + "]");
        if (!rendered.isEmpty()) {
          sb.append(ordered ? (number++) + ". " : "- ").append(rendered).append('\n');
        }
      } else if (child instanceof Element nested
          && ("ul".equals(nested.normalName()) || "ol".equals(nested.normalName()))) {
        int index = siblings.merge(nested.normalName(), 1, Integer::sum) - 1;
        String rendered =
            renderList(nested, context, path + "/" + nested.normalName() + "[" + index + "]");
        sb.append(indent(rendered.strip())).append('\n');
      } else {
        String stray = MarkdownText.singleLine(renderNode(child, context, path, siblings));
        if (!stray.isEmpty()) {
          sb.append(ordered ? (number++) + ". " : "- ").append(stray).append('\n');
        }
      }
    }
    return sb.append('\n').toString();
  }

  private String renderListItem(Element item, ShredContext context, String path) {
    StringBuilder inline = new StringBuilder();
    StringBuilder nestedLists = new StringBuilder();
    Map<String, Integer> siblings = new HashMap<>();
    for (Node child : item.childNodes()) {
      if (child instanceof Element nested
          && ("ul".equals(nested.normalName()) || "ol".equals(nested.normalName()))) {
        int index = siblings.merge(nested.normalName(), 1, Integer::sum) - 1;
        String rendered =
            renderList(nested, context, path + "/" + nested.normalName() + "[" + index + "]");
        nestedLists.append('\n').append(indent(rendered.strip()));
      } else {
        inline.append(renderNode(child, context, path, siblings));
      }
    }
    String text = MarkdownText.singleLine(inline.toString());
    if (nestedLists.length() == 0) {
      return text;
    }
    return text + nestedLists;
  }

  private static int startNumber(Element list) {
    try {
      return Integer.parseInt(list.attr("start").strip());
    } catch (NumberFormatException e) {
      return 1;
    }
  }

  private String renderQuote(Element quote, ShredContext context, String path) {
    String inner = MarkdownText.normalize(renderChildren(quote, context, path)).strip();
    if (inner.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder("\n\n");
    for (String line : inner.split("\n", -1)) {
      sb.append(line.isEmpty() ? ">" : "> " + line).append('\n');
    }
    return sb.append('\n').toString();
  }

  // ---- heavy elements ----

  private String renderTable(Element table, ShredContext context, String path) {
    boolean unclosed = context.unclosedTables.contains(table);
    if (isInfobox(table)) {
      Extraction<InfoboxPayload> extraction =
          extractSafely(
              () -> InfoboxExtractor.extract(table),
              e ->
                  new Extraction<>(
                      new InfoboxPayload("", Map.of(), table.outerHtml()),
                      "",
                      List.of(failure(e))),
              path);
      return block(register(SidecarCategory.INFOBOX, extraction, path, unclosed, context));
    }

    Extraction<TablePayload> extraction =
        extractSafely(() -> TableGridParser.parse(table), e -> fallbackTable(table, e), path);
    int inlineMax = options.getInlineTableMaxRows();
    if (inlineMax > 0
        && !unclosed
        && extraction.warnings().isEmpty()
        && extraction.payload().rowCount() < inlineMax) {
      return block(TableGridParser.toPipeTable(extraction.payload().rows()));
    }
    return block(register(SidecarCategory.TABLE, extraction, path, unclosed, context));
  }

  private String renderFormula(Element formula, ShredContext context, String path) {
    Extraction<FormulaPayload> extraction =
        extractSafely(
            () -> FormulaExtractor.extract(formula),
            e ->
                new Extraction<>(
                    new FormulaPayload("", false, formula.outerHtml()), "", List.of(failure(e))),
            path);
    String token = register(SidecarCategory.FORMULA, extraction, path, false, context);
    return extraction.payload().display() ? block(token) : token;
  }

  private String register(
      SidecarCategory category,
      Extraction<?> extraction,
      String path,
      boolean unclosed,
      ShredContext context) {
    List<String> reasons = new ArrayList<>(extraction.warnings());
    for (String reason : extraction.warnings()) {
      context.warn(ShredWarning.Kind.EXTRACTION_DEGRADED, path, reason);
    }
    if (unclosed) {
      String reason = "Unterminated <table>; content recovered up to end of input";
      reasons.add(reason);
      context.warn(ShredWarning.Kind.PARSE_RECOVERABLE, path, reason);
    }
    PlaceholderToken token =
        context.registry.register(
            category, extraction.label(), path, extraction.payload(), reasons);
    return token.render();
  }

  private <P extends SidecarPayload> Extraction<P> extractSafely(
      Supplier<Extraction<P>> extractor,
      Function<RuntimeException, Extraction<P>> fallback,
      String path) {
    try {
      return extractor.get();
    } catch (RuntimeException e) {
      log.warn("Extraction failed at {}, keeping raw markup: {}", path, e.getMessage());
      return fallback.apply(e);
    }
  }

  private static Extraction<TablePayload> fallbackTable(Element table, RuntimeException e) {
    List<List<String>> grid = List.of(List.of(table.text().strip()));
    return new Extraction<>(
        new TablePayload("", List.of(), grid, 1, 1, CsvRenderer.render(grid), table.outerHtml()),
        "",
        List.of(failure(e)));
  }

  private static String failure(RuntimeException e) {
    return "Extraction failed (" + e.getClass().getSimpleName() + "); raw markup kept";
  }

  private static boolean isInfobox(Element table) {
    return table.classNames().stream()
        .anyMatch(name -> name.toLowerCase(Locale.ROOT).contains("infobox"));
  }

  // ---- text helpers ----

  private static String block(String markdown) {
    return "\n\n" + markdown + "\n\n";
  }

  /** Wraps the non-blank core of {@code inner}, keeping its surrounding whitespace outside. */
  private static String surround(String inner, String open, String close) {
    String core = MarkdownText.singleLine(inner);
    if (core.isEmpty()) {
      return inner.isEmpty() ? "" : " ";
    }
    String leading = Character.isWhitespace(inner.charAt(0)) ? " " : "";
    String trailing = Character.isWhitespace(inner.charAt(inner.length() - 1)) ? " " : "";
    if (TokenScanner.containsToken(core)) {
      return leading + core + trailing;
    }
    return leading + open + core + close + trailing;
  }

  private static String indent(String markdown) {
    StringBuilder sb = new StringBuilder();
    for (String line : markdown.split("\n", -1)) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(line.isEmpty() ? "" : "    " + line);
    }
    return sb.toString();
  }

  /**
   * Text before the first header, capped. An article that opens with a header gets its first
   * characters instead. The cut never lands inside a placeholder.
   */
  private String abstractOf(String markdown) {
    StringBuilder lead = new StringBuilder();
    for (String line : markdown.split("\n", -1)) {
      if (line.startsWith("#")) {
        break;
      }
      lead.append(line).append('\n');
    }
    String text = lead.toString().strip();
    if (text.isEmpty()) {
      return truncateOutsideTokens(markdown, FALLBACK_ABSTRACT_CHARS).strip();
    }
    return truncateOutsideTokens(text, options.getAbstractMaxChars()).strip();
  }

  static String truncateOutsideTokens(String text, int maxChars) {
    if (text.length() <= maxChars) {
      return text;
    }
    int cut = maxChars;
    for (TokenScanner.TokenMatch match : TokenScanner.scan(text)) {
      if (match.start() < cut && match.end() > cut) {
        cut = match.start();
        break;
      }
    }
    return text.substring(0, cut);
  }

  /** Mutable state of one shredding pass. */
  private static final class ShredContext {
    private final TokenRegistry registry;
    private final List<ImageReference> images = new ArrayList<>();
    private final List<TocEntry> toc = new ArrayList<>();
    private final List<ShredWarning> warnings = new ArrayList<>();
    private final Set<Element> unclosedTables = Collections.newSetFromMap(new IdentityHashMap<>());

    private ShredContext(TokenRegistry registry) {
      this.registry = registry;
    }

    private void warn(ShredWarning.Kind kind, String location, String message) {
      warnings.add(new ShredWarning(kind, location, message));
    }
  }
}
