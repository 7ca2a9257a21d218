package ca.gc.cra.agentreplay.validation;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for trace inputs and export outputs.
 * <p><strong>Why:</strong> Catches unreadable traces and accidental overwrites before any work is done, so the CLI
 * can report a precise argument error.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses user input into a normalized absolute path.
   *
   * @param name logical parameter name for diagnostics
   * @param raw path text
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the text is blank, holds control characters, or is not a valid path
   */
  public static Path parse(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  /**
   * Ensures a path names an existing, readable regular file.
   *
   * @param path candidate file
   * @return the same path
   * @throws IllegalArgumentException if the file is missing, a directory, or unreadable
   */
  public static Path requireReadableFile(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("file does not exist: " + path);
    }
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("not a regular file: " + path);
    }
    if (!Files.isReadable(path)) {
      throw new IllegalArgumentException("file is not readable: " + path);
    }
    return path;
  }

  /**
   * Validates an output file location.
   *
   * @param path destination file
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return the same path
   * @throws IllegalArgumentException if the destination is a directory, exists without overwrite permission, or its
   *         parent directory is missing or not writable
   */
  public static Path validateWritableFile(Path path, boolean allowOverwrite) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("output is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new IllegalArgumentException(
          "output " + normalized + " already exists; re-run with --allow-overwrite to replace it");
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException("output directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("output directory is not writable: " + parent);
    }
    return normalized;
  }
}
