package com.mk.fx.qa.bench;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Context root for the harness; started by {@link com.mk.fx.qa.bench.cli.CommandLauncher}. */
@SpringBootApplication
public class BenchHarnessApplication {}
