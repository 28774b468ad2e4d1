package ca.gc.cra.brownian.infrastructure.persistence;

import java.util.List;

/**
 * Column layout shared by {@link CsvSegmentFileWriter} and {@link CsvSegmentReader}.
 */
final class SegmentCsvFormat {
  static final List<String> COLUMNS = List.of(
      "path_id",
      "step",
      "start_x",
      "start_y",
      "end_x",
      "end_y",
      "has_exited",
      "intersection_x",
      "intersection_y",
      "exit_boundary",
      "boundary_value");

  static final String HEADER = String.join(",", COLUMNS);

  private SegmentCsvFormat() {}
}
