package io.uniqints.bench.report;

import com.google.common.base.Joiner;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Writes one column per algorithm and one row per input size, ascending, for plotting size against microseconds:
 * <pre>
 * Size	Naive algorithm	HashTable algorithm
 * 10	0.5	0.9
 * 100	12.0	3.1
 * </pre>
 * A cell is empty when an algorithm was not timed at that size.
 */
public class TsvSeriesReport implements ReportSink
{
  private static final Joiner TAB = Joiner.on('\t');

  private final Appendable out;

  public TsvSeriesReport(Appendable out)
  {
    this.out = out;
  }

  @Override
  public void write(ResultTable table) throws IOException
  {
    List<String> algorithms = table.algorithms();

    List<String> header = new ArrayList<>(algorithms.size() + 1);
    header.add("Size");
    header.addAll(algorithms);
    out.append(TAB.join(header)).append('\n');

    List<Long> sizes = new ArrayList<>(table.sizes());
    Collections.sort(sizes);
    for (long size : sizes) {
      List<String> row = new ArrayList<>(algorithms.size() + 1);
      row.add(String.valueOf(size));
      for (String algorithm : algorithms) {
        OptionalDouble micros = table.get(size, algorithm);
        row.add(micros.isPresent() ? MicrosFormat.format(micros.getAsDouble()) : "");
      }
      out.append(TAB.join(row)).append('\n');
    }
  }
}
