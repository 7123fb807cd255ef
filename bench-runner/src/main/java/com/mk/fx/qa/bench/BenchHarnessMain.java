package com.mk.fx.qa.bench;

import com.mk.fx.qa.bench.cli.CommandLauncher;

/** {@code bench} launcher. */
public final class BenchHarnessMain {

  private BenchHarnessMain() {}

  public static void main(String[] args) {
    System.exit(new CommandLauncher().launch(args));
  }
}
