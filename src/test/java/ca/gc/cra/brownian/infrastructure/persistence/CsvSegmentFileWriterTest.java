package ca.gc.cra.brownian.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.brownian.domain.path.Segment;
import ca.gc.cra.brownian.testutil.SegmentFixtures;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvSegmentFileWriterTest {
  @TempDir Path tempDir;

  @Test
  void writesHeaderAndOneRowPerSegment() throws Exception {
    Path file = tempDir.resolve("paths.csv");
    List<Segment> segments = new ArrayList<>(SegmentFixtures.exitingThroughTop(7));

    try (CsvSegmentFileWriter writer = new CsvSegmentFileWriter(file)) {
      for (Segment segment : segments) {
        writer.persist(segment);
      }
      writer.flush();
      assertEquals(3, writer.rowsWritten());
    }

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(4, lines.size());
    assertEquals(
        "path_id,step,start_x,start_y,end_x,end_y,has_exited,intersection_x,intersection_y,exit_boundary,"
            + "boundary_value",
        lines.get(0));
    assertEquals("7,1,0.5,0.5,0.5,0.7,false,,,,", lines.get(1));
    assertEquals("7,3,0.5,0.9,0.5,1.1,true,0.5,1.0,top,1.0", lines.get(3));
  }

  @Test
  void existingContentIsTruncated() throws Exception {
    Path file = Files.writeString(tempDir.resolve("paths.csv"), "stale\nrows\nhere\n");

    try (CsvSegmentFileWriter writer = new CsvSegmentFileWriter(file)) {
      writer.persist(SegmentFixtures.exitingThroughLeft(1).get(0));
    }

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    assertEquals("1,1,0.1,0.4,-0.1,0.4,true,0.0,0.4,left,0.0", lines.get(1));
  }

  @Test
  void writtenFileReadsBackIdentically() throws Exception {
    Path file = tempDir.resolve("paths.csv");
    List<Segment> segments = new ArrayList<>();
    segments.addAll(SegmentFixtures.exitingThroughTop(0));
    segments.add(Segment.interior(1, 1, 1.0 / 3.0, Math.PI / 4, 0.123456789012345, 1e-17));
    segments.addAll(SegmentFixtures.exitingThroughLeft(2));

    try (CsvSegmentFileWriter writer = new CsvSegmentFileWriter(file)) {
      for (Segment segment : segments) {
        writer.persist(segment);
      }
    }

    assertEquals(segments, new CsvSegmentReader(file).readAll());
  }
}
