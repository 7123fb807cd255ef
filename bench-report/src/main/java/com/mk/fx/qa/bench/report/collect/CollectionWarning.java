package com.mk.fx.qa.bench.report.collect;

import java.nio.file.Path;

/**
 * A result artifact or directory that could not be used.
 *
 * @param path file or directory the problem relates to
 * @param message what went wrong
 */
public record CollectionWarning(Path path, String message) {}
