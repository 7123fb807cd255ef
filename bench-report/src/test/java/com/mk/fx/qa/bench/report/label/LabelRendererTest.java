package com.mk.fx.qa.bench.report.label;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.bench.report.exception.TemplateException;
import com.mk.fx.qa.bench.report.model.MetricContext;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LabelRendererTest {

  @Test
  void render_interpolatesContextValues() {
    var renderer = new LabelRenderer("{{rw}} bs={{bs}} jobs={{numjobs}}");
    var context = MetricContext.fromRaw(Map.of("rw", "randread", "bs", "4k", "numjobs", 8));

    assertEquals("randread bs=4k jobs=8", renderer.render(context));
  }

  @Test
  void render_escapesValues() {
    var renderer = new LabelRenderer("{{engine}}");

    assertEquals("a&lt;b&gt;", renderer.render(Map.of("engine", "a<b>")));
  }

  @Test
  void render_undefinedKeyFails() {
    var renderer = new LabelRenderer("bs={{bs}} depth={{iodepth}}");
    var context = MetricContext.fromRaw(Map.of("bs", "4k"));

    var ex = assertThrows(TemplateException.class, () -> renderer.render(context));
    assertTrue(ex.getMessage().contains("iodepth"));
  }

  @Test
  void constructor_rejectsUnbalancedTemplate() {
    assertThrows(TemplateException.class, () -> new LabelRenderer("{{#bs}} open section"));
  }

  @Test
  void render_plainTextTemplateNeedsNoContext() {
    assertEquals("baseline", new LabelRenderer("baseline").render(Map.of()));
  }
}
