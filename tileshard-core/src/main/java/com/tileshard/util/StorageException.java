package com.tileshard.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * An output directory or file could not be created or written, usually because of the environment (permissions, a
 * full disk, a file where a directory was expected).
 */
public class StorageException extends UncheckedIOException {

  private final transient Path path;

  public StorageException(String message, Path path, IOException cause) {
    super(message + ": " + path, cause);
    this.path = path;
  }

  /** Returns the path that could not be created or written. */
  public Path path() {
    return path;
  }
}
