package io.uniqints.bench;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import io.uniqints.bench.filter.UniqueFilter;
import io.uniqints.bench.report.BenchmarkAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Times every filter on random inputs of increasing size and writes the log {@link BenchmarkAggregator} reads.
 */
public class FilterBenchmark
{
  private static final Logger LOG = LoggerFactory.getLogger(FilterBenchmark.class);

  public static final String SEPARATOR = "---------------------------------------";

  private final int[] sizes;
  private final List<UniqueFilter> filters;
  private final long seed;
  private final int runs;
  private final Ticker ticker;
  private final Clock clock;

  public FilterBenchmark(int[] sizes, List<UniqueFilter> filters, long seed)
  {
    this(sizes, filters, seed, 1, Ticker.systemTicker(), Clock.systemDefaultZone());
  }

  /**
   * @param runs timed runs per (size, filter), the logged duration is their mean
   */
  public FilterBenchmark(int[] sizes, List<UniqueFilter> filters, long seed, int runs, Ticker ticker, Clock clock)
  {
    Preconditions.checkArgument(sizes.length > 0, "no sizes to benchmark");
    Preconditions.checkArgument(!filters.isEmpty(), "no filters to benchmark");
    Preconditions.checkArgument(runs > 0, "runs must be positive, got [%s]", runs);
    for (int size : sizes) {
      Preconditions.checkArgument(size > 0, "size must be positive, got [%s]", size);
    }
    this.sizes = sizes.clone();
    this.filters = ImmutableList.copyOf(filters);
    this.seed = seed;
    this.runs = runs;
    this.ticker = ticker;
    this.clock = clock;
  }

  public void run(Appendable out) throws IOException
  {
    out.append("Benchmark results\n");
    out.append("Date: ").append(ZonedDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)).append('\n');
    out.append(SEPARATOR).append('\n');

    Random random = new Random(seed);
    for (int size : sizes) {
      LOG.info("Benchmark for array size {}", size);
      out.append(BenchmarkAggregator.SIZE_MARKER).append(' ').append(String.valueOf(size)).append('\n');
      final int[] input = InputGenerator.forBenchmark(size, random);

      int expectedDistinct = -1;
      for (UniqueFilter filter : filters) {
        out.append(BenchmarkAggregator.ALGORITHM_MARKER).append(' ').append(filter.name()).append(" algorithm\n");

        long totalNanos = 0;
        int distinct = 0;
        for (int i = 0; i < runs; i++) {
          Stopwatch stopwatch = Stopwatch.createStarted(ticker);
          distinct = filter.filter(input).length;
          totalNanos += stopwatch.elapsed(TimeUnit.NANOSECONDS);
        }

        if (expectedDistinct < 0) {
          expectedDistinct = distinct;
        } else if (distinct != expectedDistinct) {
          throw new IllegalStateException(String.format(
              "filter %s kept %,d values at size %,d, %s kept %,d",
              filter.name(),
              distinct,
              size,
              filters.get(0).name(),
              expectedDistinct
          ));
        }

        final long meanNanos = totalNanos / runs;
        LOG.debug("{} on {} values: {} distinct in {} ns", filter.name(), size, distinct, meanNanos);
        out.append("Execution time: ").append(DurationFormat.format(meanNanos)).append('\n');
      }
      out.append(SEPARATOR).append('\n');
    }
  }
}
