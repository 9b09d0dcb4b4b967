package io.uniqints.sketch;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Counts the distinct values of a stream twice, once with an exact set and once with a sketch,
 * timing both.
 */
public class DedupComparison
{
  private static final Logger LOG = LoggerFactory.getLogger(DedupComparison.class);

  public static final String DEFAULT_EXACT_KEY = "unique_numbers";
  public static final String DEFAULT_SKETCH_KEY = "unique_numbers_hyperloglog";

  private final DistinctCountingService service;
  private final String exactKey;
  private final String sketchKey;
  private final Ticker ticker;

  public DedupComparison(DistinctCountingService service)
  {
    this(service, DEFAULT_EXACT_KEY, DEFAULT_SKETCH_KEY, Ticker.systemTicker());
  }

  public DedupComparison(DistinctCountingService service, String exactKey, String sketchKey, Ticker ticker)
  {
    this.service = service;
    this.exactKey = exactKey;
    this.sketchKey = sketchKey;
    this.ticker = ticker;
  }

  public ComparisonResult run(long[] values)
  {
    service.delete(exactKey);
    service.delete(sketchKey);

    LOG.info("Start filtering {} values using set method", values.length);
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    service.addAllToExactSet(exactKey, values);
    final long exactNanos = stopwatch.elapsed(TimeUnit.NANOSECONDS);
    final long exactCount = service.exactCount(exactKey);

    LOG.info("Start filtering {} values using HyperLogLog method", values.length);
    stopwatch.reset().start();
    service.addToSketch(sketchKey, values);
    final long sketchNanos = stopwatch.elapsed(TimeUnit.NANOSECONDS);
    final double estimate = service.sketchEstimate(sketchKey);

    ComparisonResult result = new ComparisonResult(exactCount, estimate, exactNanos, sketchNanos);
    LOG.info("Comparison done: {}", result);
    return result;
  }
}
