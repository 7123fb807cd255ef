package com.mk.fx.qa.bench.report.label;

import com.mk.fx.qa.bench.report.exception.TemplateException;
import com.mk.fx.qa.bench.report.model.MetricContext;
import com.samskivert.mustache.Mustache;
import com.samskivert.mustache.MustacheException;
import com.samskivert.mustache.Template;
import java.util.Map;
import java.util.Objects;

/**
 * Renders series labels from Mustache templates such as {@code "bs={{bs}} jobs={{numjobs}}"}.
 *
 * <p>Values are HTML-escaped. A variable missing from the context is an error: the compiler is
 * deliberately built without a default value so that an unknown key can never produce an empty
 * label.
 */
public class LabelRenderer {

  private final Template template;
  private final String source;

  /**
   * Compiles the template once; it is then rendered for every series.
   *
   * @throws TemplateException if the template does not parse
   */
  public LabelRenderer(String template) {
    this.source = Objects.requireNonNull(template, "template");
    try {
      this.template = Mustache.compiler().escapeHTML(true).compile(template);
    } catch (MustacheException e) {
      throw new TemplateException(
          "Invalid label template '" + template + "': " + e.getMessage(), e);
    }
  }

  /**
   * Renders the label for the given context.
   *
   * @throws TemplateException if the template references a key the context lacks
   */
  public String render(MetricContext context) {
    return render(context.toRawMap());
  }

  public String render(Map<String, Object> context) {
    try {
      return template.execute(context);
    } catch (MustacheException e) {
      throw new TemplateException(
          "Cannot render label template '" + source + "' for context " + context + ": "
              + e.getMessage(),
          e);
    }
  }

  public String source() {
    return source;
  }
}
