package io.uniqints.bench.report;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.io.IOException;

import static org.junit.Assert.assertEquals;

public class TextReportTest
{
  private static final ResultTable TABLE = new BenchmarkAggregator().parseStream(ImmutableList.of(
      "Benchmark for array size 1000",
      "Benchmark for Naive algorithm",
      "Execution time: 1.25ms",
      "Benchmark for HashTable algorithm",
      "Execution time: 48.5µs",
      "Benchmark for array size 10",
      "Benchmark for Naive algorithm",
      "Execution time: 500ns"
  ));

  @Test
  public void testRender()
  {
    assertEquals(
        "Array size: 1000\n"
        + "Naive algorithm: 1250.0µs\n"
        + "HashTable algorithm: 48.5µs\n"
        + "-----------------------------\n"
        + "Array size: 10\n"
        + "Naive algorithm: 0.5µs\n"
        + "-----------------------------\n",
        TextReport.render(TABLE)
    );
  }

  @Test
  public void testSeriesReport() throws IOException
  {
    StringBuilder out = new StringBuilder();
    new TsvSeriesReport(out).write(TABLE);
    assertEquals(
        "Size\tNaive algorithm\tHashTable algorithm\n"
        + "10\t0.5\t\n"
        + "1000\t1250.0\t48.5\n",
        out.toString()
    );
  }

  @Test
  public void testLargeAndTinyValuesStayInPlainNotation() throws IOException
  {
    ResultTable table = new BenchmarkAggregator().parseStream(ImmutableList.of(
        "Benchmark for array size 100000",
        "Benchmark for Naive algorithm",
        "Execution time: 12.5s",
        "Benchmark for HashTable algorithm",
        "Execution time: 0.0001µs"
    ));
    assertEquals(
        "Array size: 100000\n"
        + "Naive algorithm: 12500000.0µs\n"
        + "HashTable algorithm: 0.0001µs\n"
        + "-----------------------------\n",
        TextReport.render(table)
    );

    StringBuilder out = new StringBuilder();
    new TsvSeriesReport(out).write(table);
    assertEquals(
        "Size\tNaive algorithm\tHashTable algorithm\n"
        + "100000\t12500000.0\t0.0001\n",
        out.toString()
    );
  }

  @Test
  public void testEmptyTable() throws IOException
  {
    ResultTable empty = new BenchmarkAggregator().parseStream(ImmutableList.of());
    assertEquals("", TextReport.render(empty));

    StringBuilder out = new StringBuilder();
    new TsvSeriesReport(out).write(empty);
    assertEquals("Size\n", out.toString());
  }
}
