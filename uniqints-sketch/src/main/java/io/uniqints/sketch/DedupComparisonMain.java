package io.uniqints.sketch;

import com.google.common.base.Splitter;
import io.uniqints.sketch.redis.RedisCountingService;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.Protocol;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Counts the distinct integers of a file, one per line, with both an exact set and a HyperLogLog.
 */
public class DedupComparisonMain
{
  static long[] readValues(List<String> lines)
  {
    long[] values = new long[lines.size()];
    int count = 0;
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty()) {
        continue;
      }
      try {
        values[count++] = Long.parseLong(line);
      }
      catch (NumberFormatException e) {
        throw new IllegalArgumentException("line " + (i + 1) + ": not an integer \"" + line + "\"", e);
      }
    }
    return count == values.length ? values : Arrays.copyOf(values, count);
  }

  static DistinctCountingService createService(String service, int precision)
  {
    if (service.equals("inprocess")) {
      return new InProcessCountingService(() -> new HyperLogLog(precision));
    }
    if (service.equals("redis") || service.startsWith("redis:")) {
      List<String> parts = Splitter.on(':').splitToList(service);
      String host = parts.size() > 1 ? parts.get(1) : Protocol.DEFAULT_HOST;
      int port = parts.size() > 2 ? Integer.parseInt(parts.get(2)) : Protocol.DEFAULT_PORT;
      return new RedisCountingService(new Jedis(host, port));
    }
    throw new IllegalArgumentException("Unknown counting service : " + service);
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 1 || args.length > 3) {
      System.err.println("Arguments: <numbersFile> [inprocess|redis[:<host>[:<port>]]] [<precision>]");
      System.exit(1);
    }

    Path numbersFile = Paths.get(args[0]);
    String serviceName = args.length > 1 ? args[1] : "inprocess";
    int precision = args.length > 2 ? Integer.parseInt(args[2]) : CardinalityEstimators.DEFAULT_PRECISION;

    System.out.println("Reading file " + numbersFile + " ...");
    long[] values = readValues(Files.readAllLines(numbersFile, StandardCharsets.UTF_8));

    DistinctCountingService service = createService(serviceName, precision);
    try {
      ComparisonResult result = new DedupComparison(service).run(values);
      System.out.printf("Set method: %,d ms%n", TimeUnit.NANOSECONDS.toMillis(result.getExactNanos()));
      System.out.printf("UNIQUE_SET: %d%n", result.getExactCount());
      System.out.printf("HLL method: %,d ms%n", TimeUnit.NANOSECONDS.toMillis(result.getSketchNanos()));
      System.out.printf("UNIQUE_HLL: %d%n", Math.round(result.getEstimate()));
      System.out.printf("Relative error: %.3f%%%n", 100 * result.relativeError());
    }
    finally {
      if (service instanceof RedisCountingService) {
        ((RedisCountingService) service).close();
      }
    }
  }
}
