package com.mk.fx.qa.bench.cli;

import com.github.rvesse.airline.annotations.Command;
import com.github.rvesse.airline.annotations.Option;
import com.github.rvesse.airline.annotations.restrictions.Required;
import com.mk.fx.qa.bench.session.LockStatus;
import com.mk.fx.qa.bench.session.SessionGuard;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationContext;

@Slf4j
@Command(name = "unlock", description = "Clear a stale environment lock after checking the target")
public class UnlockCommand implements HarnessCommand {

  @Option(
      name = {"-e", "--environment"},
      title = "environment",
      description = "Environment description file")
  @Required
  String environment;

  @Option(
      name = "--confirm",
      description = "Actually remove the lock; without it the lock state is only printed")
  boolean confirm;

  PrintStream out = System.out;

  @Override
  public int execute(ApplicationContext context) throws IOException {
    SessionGuard guard = context.getBean(SessionGuard.class);
    Path env = Path.of(environment);
    LockStatus status = guard.inspect(env);
    if (!status.locked()) {
      out.println("Environment " + environment + " is not locked (" + status.lockFile() + ")");
      return 0;
    }
    if (!confirm) {
      out.println(LockBanner.locked(status));
      return 1;
    }
    guard.clear(env);
    out.println("Removed " + status.lockFile());
    return 0;
  }
}
