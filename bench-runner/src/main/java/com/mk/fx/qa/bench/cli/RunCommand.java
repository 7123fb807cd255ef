package com.mk.fx.qa.bench.cli;

import com.github.rvesse.airline.annotations.Command;
import com.github.rvesse.airline.annotations.Option;
import com.github.rvesse.airline.annotations.restrictions.Required;
import com.mk.fx.qa.bench.run.RunConfiguration;
import com.mk.fx.qa.bench.run.RunRequest;
import com.mk.fx.qa.bench.run.SessionRunner;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationContext;

@Slf4j
@Command(name = "run", description = "Run testplans against an environment under its lock")
public class RunCommand implements HarnessCommand {

  @Option(
      name = {"-t", "--testplan"},
      title = "testplan",
      description = "Testplan file; repeat for several")
  @Required
  List<String> testplans = new ArrayList<>();

  @Option(
      name = {"-e", "--environment"},
      title = "environment",
      description = "Environment description file")
  @Required
  String environment;

  @Option(
      name = {"-o", "--output"},
      title = "dir",
      description = "Output directory; defaults to a fresh directory under the output root")
  String output;

  @Option(
      name = {"-f", "--filter"},
      title = "name",
      description = "Only run testcases matching this name")
  String filter;

  @Option(
      name = {"-v", "--verbose"},
      arity = 0,
      description = "More logging; repeat for more")
  List<Boolean> verbose = new ArrayList<>();

  @Override
  public int verbosity() {
    return verbose == null ? 0 : verbose.size();
  }

  RunRequest toRequest() {
    List<Path> plans = testplans.stream().map(Path::of).toList();
    return new RunRequest(
        plans, Path.of(environment), output == null ? null : Path.of(output), filter, verbosity());
  }

  @Override
  public int execute(ApplicationContext context) {
    RunConfiguration configuration = context.getBean(SessionRunner.class).run(toRequest());
    log.info("Results written to {}", configuration.outputDir());
    return 0;
  }
}
