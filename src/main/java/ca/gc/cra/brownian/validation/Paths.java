package ca.gc.cra.brownian.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for BROWNIAN CLI flows.
 * <p><strong>Why:</strong> A simulation can run for minutes before its CSV is written; output targets are checked
 * up front so a bad path fails the run before any worker starts.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths and reject control characters.</li>
 *   <li>Guard against overwriting existing CSV or SVG files unless explicitly approved.</li>
 *   <li>Confirm input files exist and are readable.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a dangling symlink counts as an existing
 * target rather than a free name.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a file path that a run is about to create.
   *
   * @param path candidate output file; must not be {@code null}
   * @param createParents whether missing parent directories should be created
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return absolute normalized path
   * @throws ConfigurationException if the path is a directory, exists without overwrite approval, or its parent
   *     cannot be written
   */
  public static Path validateWritableFile(Path path, boolean createParents, boolean allowOverwrite) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new ConfigurationException("output path is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new ConfigurationException(
          "output file " + normalized + " already exists; re-run with --allow-overwrite to replace it");
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new ConfigurationException("path has no parent to validate: " + normalized);
    }
    try {
      if (!Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
        if (!createParents) {
          Path ancestor = nearestExistingAncestor(parent);
          if (!Files.isWritable(ancestor)) {
            throw new ConfigurationException("directory is not writable: " + ancestor);
          }
          return normalized;
        }
        Files.createDirectories(parent);
      }
      Path realParent = parent.toRealPath();
      if (!Files.isDirectory(realParent)) {
        throw new ConfigurationException("parent is not a directory: " + realParent);
      }
      if (!Files.isWritable(realParent)) {
        throw new ConfigurationException("parent directory is not writable: " + realParent);
      }
      return normalized;
    } catch (IOException ex) {
      throw new ConfigurationException(
          "unable to validate output file " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a file path that a run is about to read.
   *
   * @param path candidate input file; must not be {@code null}
   * @return real path of the file
   * @throws ConfigurationException if the file is missing, a directory, or unreadable
   */
  public static Path requireReadableFile(Path path) {
    Path normalized = normalize(path);
    if (!Files.exists(normalized)) {
      throw new ConfigurationException("input file does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new ConfigurationException("input path is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new ConfigurationException("input file is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new ConfigurationException("unable to access input file " + normalized, ex);
    }
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new ConfigurationException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new ConfigurationException("path must not contain null bytes");
    }
    if (Strings.containsControl(raw)) {
      throw new ConfigurationException("path must not contain control characters");
    }
    return path.toAbsolutePath().normalize();
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new ConfigurationException("no existing ancestor for " + start);
    }
    return current.toRealPath(LinkOption.NOFOLLOW_LINKS);
  }
}
