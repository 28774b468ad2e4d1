package ca.gc.cra.brownian.infrastructure.persistence;

import ca.gc.cra.brownian.application.port.SegmentSource;
import ca.gc.cra.brownian.domain.geometry.ExitBoundary;
import ca.gc.cra.brownian.domain.path.ExitCrossing;
import ca.gc.cra.brownian.domain.path.Segment;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads segment CSV files produced by {@link CsvSegmentFileWriter}.
 * <p>The header must match exactly. Every malformed row fails the whole read with an {@link IOException}
 * naming the file and the one-based line number. Blank lines are skipped.</p>
 *
 * @since 0.1.0
 */
public final class CsvSegmentReader implements SegmentSource {
  private final Path file;

  /**
   * Creates a reader for {@code file}.
   *
   * @param file CSV file to read
   */
  public CsvSegmentReader(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public List<Segment> readAll() throws IOException {
    List<Segment> segments = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String header = reader.readLine();
      if (header == null) {
        throw new IOException(file + ": file is empty; expected header " + SegmentCsvFormat.HEADER);
      }
      if (!header.strip().equals(SegmentCsvFormat.HEADER)) {
        throw new IOException(file + " line 1: unexpected header '" + header + "'");
      }
      String line;
      int lineNumber = 1;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        segments.add(parseRow(line, lineNumber));
      }
    }
    return segments;
  }

  private Segment parseRow(String line, int lineNumber) throws IOException {
    String[] cells = line.split(",", -1);
    if (cells.length != SegmentCsvFormat.COLUMNS.size()) {
      throw malformed(
          lineNumber, "expected " + SegmentCsvFormat.COLUMNS.size() + " columns but found " + cells.length, null);
    }
    try {
      long pathId = Long.parseLong(cells[0].trim());
      int step = Integer.parseInt(cells[1].trim());
      double startX = parseDouble(cells[2]);
      double startY = parseDouble(cells[3]);
      double endX = parseDouble(cells[4]);
      double endY = parseDouble(cells[5]);
      boolean exited = parseBoolean(cells[6]);
      Optional<ExitCrossing> exit = Optional.empty();
      if (exited) {
        exit = Optional.of(new ExitCrossing(
            parseDouble(cells[7]),
            parseDouble(cells[8]),
            ExitBoundary.fromLabel(cells[9].trim()),
            parseDouble(cells[10])));
      } else if (!cells[7].isBlank() || !cells[8].isBlank() || !cells[9].isBlank() || !cells[10].isBlank()) {
        throw malformed(lineNumber, "exit fields must be empty when has_exited is false", null);
      }
      return new Segment(pathId, step, startX, startY, endX, endY, exit);
    } catch (IllegalArgumentException ex) {
      throw malformed(lineNumber, ex.getMessage(), ex);
    }
  }

  private IOException malformed(int lineNumber, String detail, Throwable cause) {
    return new IOException(file + " line " + lineNumber + ": " + detail, cause);
  }

  private static double parseDouble(String cell) {
    String trimmed = cell.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("missing numeric value");
    }
    return Double.parseDouble(trimmed);
  }

  private static boolean parseBoolean(String cell) {
    String normalized = cell.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException("has_exited must be true or false (was '" + cell + "')");
    };
  }
}
