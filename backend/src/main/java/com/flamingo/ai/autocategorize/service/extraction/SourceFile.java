package com.flamingo.ai.autocategorize.service.extraction;

import com.flamingo.ai.autocategorize.exception.ContentUnavailableException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * A candidate file held in memory.
 *
 * @param name original file name, used for type hints and diagnostics
 * @param bytes raw file content
 */
public record SourceFile(String name, byte[] bytes) {

  public SourceFile {
    name = name == null ? "" : name;
    bytes = bytes == null ? new byte[0] : bytes;
  }

  /**
   * Reads a file from disk.
   *
   * @throws ContentUnavailableException if the path does not exist or cannot be read
   */
  public static SourceFile read(Path path) {
    if (path == null || !Files.isRegularFile(path)) {
      throw new ContentUnavailableException(String.valueOf(path), "File not found");
    }
    try {
      return new SourceFile(path.getFileName().toString(), Files.readAllBytes(path));
    } catch (IOException e) {
      throw new ContentUnavailableException(path.toString(), "File not readable", e);
    }
  }

  /** Lower-case extension without the dot, or an empty string. */
  public String extension() {
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  public boolean isEmpty() {
    return bytes.length == 0;
  }
}
