package io.uniqints.bench;

import io.uniqints.bench.filter.UniqueFilters;
import io.uniqints.bench.report.BenchmarkAggregator;
import io.uniqints.bench.report.ResultTable;
import io.uniqints.bench.report.TextReport;
import io.uniqints.bench.report.TsvSeriesReport;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

public class BenchmarkMain
{
  static final int[] DEFAULT_SIZES = {10, 100, 1000, 5000, 10000, 50000, 100000};

  private static void usage()
  {
    System.err.println("Arguments: run <logFile> [<size>..]");
    System.err.println("           report <logFile> <resultsFile> [<seriesFile>]");
    System.exit(1);
  }

  static void runBenchmark(Path logFile, int[] sizes) throws IOException
  {
    FilterBenchmark benchmark = new FilterBenchmark(sizes, UniqueFilters.all(), System.nanoTime());
    try (BufferedWriter writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8)) {
      benchmark.run(writer);
    }
    System.out.println("Benchmark results saved in " + logFile);
  }

  static ResultTable report(Path logFile, Path resultsFile, Path seriesFile) throws IOException
  {
    ResultTable table = new BenchmarkAggregator().parseStream(Files.readAllLines(logFile, StandardCharsets.UTF_8));

    try (BufferedWriter writer = Files.newBufferedWriter(resultsFile, StandardCharsets.UTF_8)) {
      new TextReport(writer).write(table);
    }
    if (seriesFile != null) {
      try (BufferedWriter writer = Files.newBufferedWriter(seriesFile, StandardCharsets.UTF_8)) {
        new TsvSeriesReport(writer).write(table);
      }
    }
    return table;
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 2) {
      usage();
      return;
    }

    switch (args[0]) {
      case "run": {
        int[] sizes = args.length > 2
                      ? Arrays.stream(args, 2, args.length).mapToInt(Integer::parseInt).toArray()
                      : DEFAULT_SIZES;
        runBenchmark(Paths.get(args[1]), sizes);
        break;
      }
      case "report": {
        if (args.length < 3 || args.length > 4) {
          usage();
          return;
        }
        Path seriesFile = args.length == 4 ? Paths.get(args[3]) : null;
        ResultTable table = report(Paths.get(args[1]), Paths.get(args[2]), seriesFile);
        System.out.print(TextReport.render(table));
        System.out.println("Writing results to " + args[2]);
        break;
      }
      default:
        usage();
    }
  }
}
