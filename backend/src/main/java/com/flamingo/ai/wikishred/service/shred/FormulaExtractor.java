package com.flamingo.ai.wikishred.service.shred;

import com.flamingo.ai.wikishred.service.shred.model.FormulaPayload;
import java.util.List;
import org.jsoup.nodes.Element;

/**
 * Recovers the TeX source of a math element.
 *
 * <p>Sources tried in order: a TeX {@code annotation}, the {@code alttext} attribute of {@code
 * <math>}, the {@code alt} text of the fallback image, the accessible MathML text, and finally the
 * element text.
 */
final class FormulaExtractor {

  private static final int LABEL_TEX_LENGTH = 40;

  private FormulaExtractor() {}

  static boolean isFormula(Element element) {
    return "math".equals(element.normalName()) || element.hasClass("mwe-math-element");
  }

  static Extraction<FormulaPayload> extract(Element formula) {
    String tex = tex(formula);
    boolean display =
        "block".equalsIgnoreCase(formula.attr("display"))
            || formula.selectFirst("math[display=block], .mwe-math-fallback-image-display") != null;
    List<String> warnings =
        tex.isEmpty() ? List.of("No TeX source found; only raw markup kept") : List.of();
    String label = tex.length() > LABEL_TEX_LENGTH ? tex.substring(0, LABEL_TEX_LENGTH) : tex;
    return new Extraction<>(
        new FormulaPayload(tex, display, formula.outerHtml()),
        label.isEmpty() ? "Formula" : label,
        warnings);
  }

  private static String tex(Element formula) {
    Element annotation = formula.selectFirst("annotation[encoding=application/x-tex]");
    if (annotation != null && !annotation.text().isBlank()) {
      return annotation.text().strip();
    }
    Element math = "math".equals(formula.normalName()) ? formula : formula.selectFirst("math");
    if (math != null && !math.attr("alttext").isBlank()) {
      return math.attr("alttext").strip();
    }
    Element image = formula.selectFirst("img[alt]");
    if (image != null && !image.attr("alt").isBlank()) {
      return image.attr("alt").strip();
    }
    Element accessible = formula.selectFirst(".mwe-math-mathml-a11y");
    if (accessible != null && !accessible.text().isBlank()) {
      return accessible.text().strip();
    }
    return formula.text().strip();
  }
}
