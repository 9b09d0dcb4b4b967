package io.uniqints.bench;

import io.uniqints.bench.report.ResultTable;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class BenchmarkMainTest
{
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testRunThenReport() throws IOException
  {
    Path log = folder.getRoot().toPath().resolve("benchmark_results.txt");
    Path results = folder.getRoot().toPath().resolve("results.txt");
    Path series = folder.getRoot().toPath().resolve("series.tsv");

    BenchmarkMain.runBenchmark(log, new int[]{10, 200});
    ResultTable table = BenchmarkMain.report(log, results, series);

    assertEquals(2, table.sizes().size());
    assertEquals(4, table.algorithms().size());

    List<String> resultLines = Files.readAllLines(results, StandardCharsets.UTF_8);
    assertEquals("Array size: 10", resultLines.get(0));
    assertTrue(resultLines.get(1), resultLines.get(1).startsWith("Naive algorithm: "));
    assertTrue(resultLines.get(1), resultLines.get(1).endsWith("µs"));

    List<String> seriesLines = Files.readAllLines(series, StandardCharsets.UTF_8);
    assertEquals(3, seriesLines.size());
    assertTrue(seriesLines.get(0), seriesLines.get(0).startsWith("Size\tNaive algorithm\t"));
    assertTrue(seriesLines.get(1).startsWith("10\t"));
    assertTrue(seriesLines.get(2).startsWith("200\t"));
  }

  @Test
  public void testReportWithoutSeries() throws IOException
  {
    Path log = folder.newFile("log.txt").toPath();
    Files.write(log, "Benchmark for array size 100\nBenchmark for AlgoA\nAlgoA time: 2ms\n".getBytes(StandardCharsets.UTF_8));
    Path results = folder.getRoot().toPath().resolve("results.txt");

    BenchmarkMain.report(log, results, null);

    assertEquals(
        "Array size: 100\nAlgoA: 2000.0µs\n-----------------------------\n",
        new String(Files.readAllBytes(results), StandardCharsets.UTF_8)
    );
  }
}
