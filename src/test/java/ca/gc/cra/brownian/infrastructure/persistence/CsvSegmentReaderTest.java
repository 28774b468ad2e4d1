package ca.gc.cra.brownian.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.brownian.domain.geometry.ExitBoundary;
import ca.gc.cra.brownian.domain.path.ExitCrossing;
import ca.gc.cra.brownian.domain.path.Segment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvSegmentReaderTest {
  private static final String HEADER =
      "path_id,step,start_x,start_y,end_x,end_y,has_exited,intersection_x,intersection_y,exit_boundary,"
          + "boundary_value";

  @TempDir Path tempDir;

  @Test
  void parsesInteriorAndExitRowsSkippingBlankLines() throws IOException {
    Path file = write(HEADER,
        "3,1,0.5,0.5,0.6,0.5,False,,,,",
        "",
        "3,2,0.6,0.5,1.2,0.5,TRUE,1.0,0.5,right,1.0");

    List<Segment> segments = new CsvSegmentReader(file).readAll();

    assertEquals(2, segments.size());
    assertEquals(Segment.interior(3, 1, 0.5, 0.5, 0.6, 0.5), segments.get(0));
    assertEquals(
        Segment.exited(3, 2, 0.6, 0.5, 1.2, 0.5, new ExitCrossing(1.0, 0.5, ExitBoundary.RIGHT, 1.0)),
        segments.get(1));
  }

  @Test
  void headerOnlyFileHasNoSegments() throws IOException {
    assertTrue(new CsvSegmentReader(write(HEADER)).readAll().isEmpty());
  }

  @Test
  void emptyFileIsRejected() throws IOException {
    Path file = Files.createFile(tempDir.resolve("empty.csv"));

    IOException ex = assertThrows(IOException.class, () -> new CsvSegmentReader(file).readAll());
    assertTrue(ex.getMessage().contains("file is empty"));
  }

  @Test
  void unexpectedHeaderIsRejected() throws IOException {
    Path file = write("id,step,x,y");

    IOException ex = assertThrows(IOException.class, () -> new CsvSegmentReader(file).readAll());
    assertTrue(ex.getMessage().contains("line 1: unexpected header"));
  }

  @Test
  void malformedRowsReportLineNumbers() throws IOException {
    assertLineError(write(HEADER, "1,1,0.5,0.5,0.6,0.5,false,,,"), "line 2: expected 11 columns but found 10");
    assertLineError(write(HEADER, "1,1,0.5,abc,0.6,0.5,false,,,,"), "line 2:");
    assertLineError(write(HEADER, "1,1,0.5,0.5,0.6,0.5,false,,,,", "1,2,0.6,0.5,1.1,0.5,maybe,,,,"),
        "line 3: has_exited must be true or false");
    assertLineError(write(HEADER, "1,1,0.5,0.5,1.1,0.5,true,1.0,0.5,,1.0"), "line 2:");
    assertLineError(write(HEADER, "1,1,0.5,0.5,0.6,0.5,false,0.6,,,"),
        "line 2: exit fields must be empty when has_exited is false");
    assertLineError(write(HEADER, "1,0,0.5,0.5,0.6,0.5,false,,,,"), "line 2: step must be >= 1");
    assertLineError(write(HEADER, "1,1,0.5,0.5,1.1,0.5,true,1.0,0.5,east,1.0"), "unknown exit boundary");
  }

  private void assertLineError(Path file, String expected) {
    IOException ex = assertThrows(IOException.class, () -> new CsvSegmentReader(file).readAll());
    assertTrue(ex.getMessage().contains(expected), ex.getMessage());
  }

  private Path write(String... lines) throws IOException {
    Path file = Files.createTempFile(tempDir, "segments", ".csv");
    return Files.write(file, List.of(lines));
  }
}
