package ca.gc.cra.brownian.infrastructure.plot;

import ca.gc.cra.brownian.application.port.PathRenderer;
import ca.gc.cra.brownian.domain.geometry.Domain;
import ca.gc.cra.brownian.domain.path.PathTrace;
import ca.gc.cra.brownian.domain.path.Segment;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PathRenderer} that writes a standalone SVG document.
 * <p><strong>Layout:</strong> Equal-aspect plot area showing the domain plus {@link #VIEW_MARGIN} on each side,
 * with the legend on the right.</p>
 * <p>Draw order: dashed domain outline, path polylines, then per-path markers (circle at the start, diamond at the
 * boundary intersection, star at the exiting end point), then the legend and a solid outline on top.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the output path; safe to reuse sequentially.</p>
 *
 * @since 0.1.0
 */
public final class SvgPathRenderer implements PathRenderer {
  private static final Logger log = LoggerFactory.getLogger(SvgPathRenderer.class);

  /** Distance, in domain units, by which the view extends past each domain edge. */
  public static final double VIEW_MARGIN = 0.05;

  private static final double PLOT_SIZE = 600.0;
  private static final double LEFT = 60.0;
  private static final double TOP = 50.0;
  private static final double BOTTOM = 50.0;
  private static final double LEGEND_WIDTH = 200.0;
  private static final String[] PALETTE = {
    "#1f77b4", "#ff7f0e", "#2ca02c", "#d62728", "#9467bd",
    "#8c564b", "#e377c2", "#bcbd22", "#17becf", "#393b79"
  };

  private final Path output;

  /**
   * Creates a renderer writing to {@code output}.
   *
   * @param output SVG file to create or replace; overwrite checks are the caller's responsibility
   */
  public SvgPathRenderer(Path output) {
    this.output = Objects.requireNonNull(output, "output");
  }

  @Override
  public void render(Domain domain, List<PathTrace> traces) throws IOException {
    String svg = toSvg(domain, traces);
    try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
      writer.write(svg);
    }
    log.info("Rendered {} paths to {}", traces.size(), output);
  }

  String toSvg(Domain domain, List<PathTrace> traces) {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(traces, "traces");
    Viewport view = Viewport.of(domain);
    double width = LEFT + view.pixelWidth() + LEGEND_WIDTH;
    double height = TOP + view.pixelHeight() + BOTTOM;

    StringBuilder svg = new StringBuilder(8192);
    svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
    svg.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(fmt(width))
        .append("\" height=\"").append(fmt(height))
        .append("\" viewBox=\"0 0 ").append(fmt(width)).append(' ').append(fmt(height)).append("\">\n");
    svg.append("  <rect width=\"100%\" height=\"100%\" fill=\"white\"/>\n");
    svg.append("  <text class=\"title\" x=\"").append(fmt(LEFT + view.pixelWidth() / 2))
        .append("\" y=\"").append(fmt(TOP / 2))
        .append("\" text-anchor=\"middle\" font-family=\"sans-serif\" font-size=\"16\">")
        .append("Brownian Motion Paths</text>\n");
    appendAxes(svg, domain, view);

    svg.append("  <g id=\"domain\">\n");
    appendOutline(svg, domain, view, "stroke-dasharray=\"6,4\" stroke-width=\"1.5\"");
    svg.append("  </g>\n");

    svg.append("  <g id=\"paths\">\n");
    for (int i = 0; i < traces.size(); i++) {
      appendPolyline(svg, traces.get(i), colour(i), view);
    }
    svg.append("  </g>\n");

    svg.append("  <g id=\"markers\">\n");
    for (int i = 0; i < traces.size(); i++) {
      appendMarkers(svg, traces.get(i), colour(i), view);
    }
    svg.append("  </g>\n");

    appendLegend(svg, traces, view);

    svg.append("  <g id=\"border\">\n");
    appendOutline(svg, domain, view, "stroke-width=\"1\"");
    svg.append("  </g>\n");
    svg.append("</svg>\n");
    return svg.toString();
  }

  private static void appendAxes(StringBuilder svg, Domain domain, Viewport view) {
    double bottom = TOP + view.pixelHeight();
    double right = LEFT + view.pixelWidth();
    svg.append("  <g id=\"axes\" font-family=\"sans-serif\" font-size=\"11\" fill=\"#333\">\n");
    svg.append("    <rect x=\"").append(fmt(LEFT)).append("\" y=\"").append(fmt(TOP))
        .append("\" width=\"").append(fmt(view.pixelWidth())).append("\" height=\"")
        .append(fmt(view.pixelHeight())).append("\" fill=\"none\" stroke=\"#999\" stroke-width=\"0.5\"/>\n");
    for (double x : new double[] {domain.xMin(), domain.xMax()}) {
      svg.append("    <text x=\"").append(fmt(view.px(x))).append("\" y=\"").append(fmt(bottom + 16))
          .append("\" text-anchor=\"middle\">").append(label(x)).append("</text>\n");
    }
    for (double y : new double[] {domain.yMin(), domain.yMax()}) {
      svg.append("    <text x=\"").append(fmt(LEFT - 6)).append("\" y=\"").append(fmt(view.py(y) + 4))
          .append("\" text-anchor=\"end\">").append(label(y)).append("</text>\n");
    }
    svg.append("    <text x=\"").append(fmt(LEFT + view.pixelWidth() / 2)).append("\" y=\"")
        .append(fmt(bottom + 36)).append("\" text-anchor=\"middle\">x</text>\n");
    svg.append("    <text x=\"").append(fmt(LEFT - 40)).append("\" y=\"")
        .append(fmt(TOP + view.pixelHeight() / 2)).append("\" text-anchor=\"middle\">y</text>\n");
    svg.append("    <line x1=\"").append(fmt(right)).append("\" y1=\"").append(fmt(TOP))
        .append("\" x2=\"").append(fmt(right)).append("\" y2=\"").append(fmt(bottom))
        .append("\" stroke=\"#999\" stroke-width=\"0.5\"/>\n");
    svg.append("  </g>\n");
  }

  private static void appendOutline(StringBuilder svg, Domain domain, Viewport view, String style) {
    svg.append("    <polygon points=\"")
        .append(point(view, domain.xMin(), domain.yMin())).append(' ')
        .append(point(view, domain.xMax(), domain.yMin())).append(' ')
        .append(point(view, domain.xMax(), domain.yMax())).append(' ')
        .append(point(view, domain.xMin(), domain.yMax()))
        .append("\" fill=\"none\" stroke=\"black\" ").append(style).append("/>\n");
  }

  private static void appendPolyline(StringBuilder svg, PathTrace trace, String colour, Viewport view) {
    svg.append("    <polyline data-path=\"").append(trace.pathId()).append("\" points=\"");
    boolean first = true;
    for (double[] vertex : trace.vertices()) {
      if (!first) {
        svg.append(' ');
      }
      svg.append(point(view, vertex[0], vertex[1]));
      first = false;
    }
    svg.append("\" fill=\"none\" stroke=\"").append(colour)
        .append("\" stroke-width=\"1.5\" stroke-opacity=\"0.8\"/>\n");
  }

  private static void appendMarkers(StringBuilder svg, PathTrace trace, String colour, Viewport view) {
    svg.append("    ").append(circle(view.px(trace.startX()), view.py(trace.startY()), 4, colour, "start"))
        .append('\n');
    Optional<Segment> exit = trace.exitSegment();
    if (exit.isEmpty()) {
      return;
    }
    Segment segment = exit.get();
    segment.exit().ifPresent(crossing -> svg.append("    ")
        .append(diamond(view.px(crossing.intersectionX()), view.py(crossing.intersectionY()), 5, colour))
        .append('\n'));
    svg.append("    ").append(star(view.px(segment.endX()), view.py(segment.endY()), 7, colour, 1.0)).append('\n');
  }

  private static void appendLegend(StringBuilder svg, List<PathTrace> traces, Viewport view) {
    double x = LEFT + view.pixelWidth() + 20;
    double y = TOP + 10;
    svg.append("  <g id=\"legend\" font-family=\"sans-serif\" font-size=\"12\">\n");
    svg.append("    <line x1=\"").append(fmt(x)).append("\" y1=\"").append(fmt(y))
        .append("\" x2=\"").append(fmt(x + 24)).append("\" y2=\"").append(fmt(y))
        .append("\" stroke=\"black\" stroke-width=\"1.5\" stroke-dasharray=\"6,4\"/>\n");
    svg.append("    <text x=\"").append(fmt(x + 32)).append("\" y=\"").append(fmt(y + 4))
        .append("\">Domain</text>\n");
    for (int i = 0; i < traces.size(); i++) {
      y += 20;
      svg.append("    <line x1=\"").append(fmt(x)).append("\" y1=\"").append(fmt(y))
          .append("\" x2=\"").append(fmt(x + 24)).append("\" y2=\"").append(fmt(y))
          .append("\" stroke=\"").append(colour(i)).append("\" stroke-width=\"1.5\"/>\n");
      svg.append("    <text x=\"").append(fmt(x + 32)).append("\" y=\"").append(fmt(y + 4))
          .append("\">Path ").append(traces.get(i).pathId()).append("</text>\n");
    }
    y += 20;
    svg.append("    ").append(circle(x + 12, y, 4, "black", null)).append('\n');
    svg.append("    <text x=\"").append(fmt(x + 32)).append("\" y=\"").append(fmt(y + 4))
        .append("\">Start points</text>\n");
    y += 20;
    svg.append("    ").append(diamond(x + 12, y, 5, "black")).append('\n');
    svg.append("    <text x=\"").append(fmt(x + 32)).append("\" y=\"").append(fmt(y + 4))
        .append("\">Intersection points</text>\n");
    y += 20;
    svg.append("    ").append(star(x + 12, y, 7, "black", 0.5)).append('\n');
    svg.append("    <text x=\"").append(fmt(x + 32)).append("\" y=\"").append(fmt(y + 4))
        .append("\">Exit points</text>\n");
    svg.append("  </g>\n");
  }

  private static String circle(double cx, double cy, double r, String fill, String role) {
    StringBuilder sb = new StringBuilder("<circle");
    if (role != null) {
      sb.append(" class=\"").append(role).append('"');
    }
    return sb.append(" cx=\"").append(fmt(cx)).append("\" cy=\"").append(fmt(cy))
        .append("\" r=\"").append(fmt(r)).append("\" fill=\"").append(fill)
        .append("\" stroke=\"white\" stroke-width=\"1\"/>").toString();
  }

  private static String diamond(double cx, double cy, double r, String fill) {
    return "<polygon class=\"intersection\" points=\""
        + fmt(cx) + ',' + fmt(cy - r) + ' '
        + fmt(cx + r) + ',' + fmt(cy) + ' '
        + fmt(cx) + ',' + fmt(cy + r) + ' '
        + fmt(cx - r) + ',' + fmt(cy)
        + "\" fill=\"" + fill + "\" stroke=\"white\" stroke-width=\"1\"/>";
  }

  private static String star(double cx, double cy, double outer, String fill, double opacity) {
    double inner = outer * 0.4;
    StringBuilder points = new StringBuilder();
    for (int k = 0; k < 10; k++) {
      double radius = (k % 2 == 0) ? outer : inner;
      double angle = -Math.PI / 2 + k * Math.PI / 5;
      if (k > 0) {
        points.append(' ');
      }
      points.append(fmt(cx + radius * Math.cos(angle))).append(',').append(fmt(cy + radius * Math.sin(angle)));
    }
    return "<polygon class=\"exit\" points=\"" + points + "\" fill=\"" + fill
        + "\" fill-opacity=\"" + fmt(opacity) + "\" stroke=\"white\" stroke-width=\"1\"/>";
  }

  static String colour(int index) {
    if (index < PALETTE.length) {
      return PALETTE[index];
    }
    // golden-angle hue walk keeps later colours apart from their neighbours
    double hue = (index * 137.508) % 360.0;
    return hslToHex(hue, 0.65, 0.45);
  }

  private static String hslToHex(double hue, double saturation, double lightness) {
    double c = (1 - Math.abs(2 * lightness - 1)) * saturation;
    double x = c * (1 - Math.abs((hue / 60.0) % 2 - 1));
    double m = lightness - c / 2;
    double r;
    double g;
    double b;
    if (hue < 60) {
      r = c; g = x; b = 0;
    } else if (hue < 120) {
      r = x; g = c; b = 0;
    } else if (hue < 180) {
      r = 0; g = c; b = x;
    } else if (hue < 240) {
      r = 0; g = x; b = c;
    } else if (hue < 300) {
      r = x; g = 0; b = c;
    } else {
      r = c; g = 0; b = x;
    }
    return String.format(
        Locale.ROOT,
        "#%02x%02x%02x",
        Math.round((r + m) * 255),
        Math.round((g + m) * 255),
        Math.round((b + m) * 255));
  }

  private static String point(Viewport view, double x, double y) {
    return fmt(view.px(x)) + ',' + fmt(view.py(y));
  }

  private static String label(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }

  private static String fmt(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }

  private record Viewport(double minX, double maxY, double scale, double pixelWidth, double pixelHeight) {
    static Viewport of(Domain domain) {
      double minX = domain.xMin() - VIEW_MARGIN;
      double maxX = domain.xMax() + VIEW_MARGIN;
      double minY = domain.yMin() - VIEW_MARGIN;
      double maxY = domain.yMax() + VIEW_MARGIN;
      double scale = PLOT_SIZE / Math.max(maxX - minX, maxY - minY);
      return new Viewport(minX, maxY, scale, (maxX - minX) * scale, (maxY - minY) * scale);
    }

    double px(double x) {
      return LEFT + (x - minX) * scale;
    }

    double py(double y) {
      return TOP + (maxY - y) * scale;
    }
  }
}
