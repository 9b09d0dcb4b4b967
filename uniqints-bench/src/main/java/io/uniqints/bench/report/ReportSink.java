package io.uniqints.bench.report;

import java.io.IOException;

/**
 * Destination for a finished {@link ResultTable}: a text report, a plot-ready series file, a chart.
 */
public interface ReportSink
{
  void write(ResultTable table) throws IOException;
}
