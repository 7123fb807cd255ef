package com.mk.fx.qa.bench.exception;

import java.nio.file.Path;
import lombok.Getter;

/**
 * Invalid input detected before anything was locked, launched or written to the target. The
 * offending path is available when the problem concerns one.
 */
@Getter
public class ConfigException extends HarnessException {

  private final Path path;

  public ConfigException(String message) {
    super(message);
    this.path = null;
  }

  public ConfigException(String message, Path path) {
    super(message + ": " + path);
    this.path = path;
  }

  public ConfigException(String message, Path path, Throwable cause) {
    super(message + ": " + path, cause);
    this.path = path;
  }
}
