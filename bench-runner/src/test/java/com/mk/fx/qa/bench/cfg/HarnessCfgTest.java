package com.mk.fx.qa.bench.cfg;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.bench.BenchHarnessApplication;
import com.mk.fx.qa.bench.plot.PlotService;
import com.mk.fx.qa.bench.run.SessionRunner;
import com.mk.fx.qa.bench.run.TestplanExecutor;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(
    classes = BenchHarnessApplication.class,
    properties = {
      "bench.session.lock-dir=/var/lock/bench",
      "bench.executor.command[0]=python3",
      "bench.executor.command[1]=-m",
      "bench.executor.command[2]=engine.run",
      "bench.plot.width=1600"
    })
class HarnessCfgTest {

  @Autowired private HarnessCfg cfg;
  @Autowired private ApplicationContext context;

  @Test
  void bindsOverridesAndKeepsDefaults() {
    assertThat(cfg.getSession().getLockDir()).isEqualTo(Path.of("/var/lock/bench"));
    assertThat(cfg.getExecutor().getCommand()).containsExactly("python3", "-m", "engine.run");
    assertThat(cfg.getPlot().getWidth()).isEqualTo(1600);
    assertThat(cfg.getPlot().getHeight()).isEqualTo(640);
    assertThat(cfg.getCollector().getTestcaseSuffix()).isEqualTo(".py");
    assertThat(cfg.getCollector().getMetricsArtifact()).isEqualTo("_aux/metrics.yml");
  }

  @Test
  void wiresRunnerAndReporting() {
    assertThat(context.getBean(SessionRunner.class)).isNotNull();
    assertThat(context.getBean(PlotService.class)).isNotNull();
    assertThat(context.getBeansOfType(TestplanExecutor.class)).hasSize(1);
  }
}
