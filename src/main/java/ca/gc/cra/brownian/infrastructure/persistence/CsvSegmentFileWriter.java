package ca.gc.cra.brownian.infrastructure.persistence;

import ca.gc.cra.brownian.application.port.SegmentPersistencePort;
import ca.gc.cra.brownian.domain.path.ExitCrossing;
import ca.gc.cra.brownian.domain.path.Segment;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes segments as UTF-8 CSV, one row per segment, preceded by a header row.
 * <p>Absent exit fields are written as empty cells; doubles use {@link Double#toString(double)} so values
 * round-trip exactly. Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CsvSegmentFileWriter implements SegmentPersistencePort {
  private final Path file;
  private final BufferedWriter writer;
  private final StringBuilder row = new StringBuilder(192);
  private long rows;

  /**
   * Opens {@code file} for writing, truncating any existing content, and writes the header.
   *
   * @param file destination; the caller is responsible for overwrite checks
   * @throws IllegalStateException if the file cannot be opened
   */
  public CsvSegmentFileWriter(Path file) {
    this.file = Objects.requireNonNull(file, "file");
    try {
      this.writer = Files.newBufferedWriter(
          file,
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.TRUNCATE_EXISTING,
          StandardOpenOption.WRITE);
      writer.write(SegmentCsvFormat.HEADER);
      writer.newLine();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to open CSV output " + file, e);
    }
  }

  @Override
  public void persist(Segment segment) throws IOException {
    if (segment == null) {
      return;
    }
    row.setLength(0);
    row.append(segment.pathId()).append(',')
        .append(segment.step()).append(',')
        .append(segment.startX()).append(',')
        .append(segment.startY()).append(',')
        .append(segment.endX()).append(',')
        .append(segment.endY()).append(',')
        .append(segment.hasExited()).append(',');
    Optional<ExitCrossing> exit = segment.exit();
    if (exit.isPresent()) {
      ExitCrossing crossing = exit.get();
      row.append(crossing.intersectionX()).append(',')
          .append(crossing.intersectionY()).append(',')
          .append(crossing.boundary().label()).append(',')
          .append(crossing.boundaryValue());
    } else {
      row.append(",,,");
    }
    writer.write(row.toString());
    writer.newLine();
    rows++;
  }

  @Override
  public void flush() throws IOException {
    writer.flush();
  }

  @Override
  public void close() throws IOException {
    writer.close();
  }

  /** Destination file. */
  public Path file() {
    return file;
  }

  /** Number of data rows written so far. */
  public long rowsWritten() {
    return rows;
  }
}
