package io.uniqints.bench.report;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Lists each size group in table order:
 * <pre>
 * Array size: 1000
 * Naive algorithm: 1250.0µs
 * HashTable algorithm: 48.3µs
 * -----------------------------
 * </pre>
 */
public class TextReport implements ReportSink
{
  public static final String SEPARATOR = "-----------------------------";

  private final Appendable out;

  public TextReport(Appendable out)
  {
    this.out = out;
  }

  public static String render(ResultTable table)
  {
    StringBuilder sb = new StringBuilder();
    try {
      new TextReport(sb).write(table);
    }
    catch (IOException e) {
      // StringBuilder never throws
      throw new UncheckedIOException(e);
    }
    return sb.toString();
  }

  @Override
  public void write(ResultTable table) throws IOException
  {
    for (long size : table.sizes()) {
      out.append("Array size: ").append(String.valueOf(size)).append('\n');
      for (Map.Entry<String, Double> entry : table.get(size).entrySet()) {
        out.append(entry.getKey())
           .append(": ")
           .append(MicrosFormat.format(entry.getValue()))
           .append(TimeUnitSuffix.MICROSECONDS.symbol())
           .append('\n');
      }
      out.append(SEPARATOR).append('\n');
    }
  }
}
