package io.uniqints.bench;

import com.google.common.base.Splitter;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import io.uniqints.bench.filter.HashSetFilter;
import io.uniqints.bench.filter.NaiveFilter;
import io.uniqints.bench.filter.UniqueFilter;
import io.uniqints.bench.report.BenchmarkAggregator;
import io.uniqints.bench.report.ResultTable;
import org.junit.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class FilterBenchmarkTest
{
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-04-08T00:17:00Z"), ZoneOffset.UTC);

  private static final class SteppingTicker extends Ticker
  {
    private final long stepNanos;
    private long nanos;

    SteppingTicker(long stepNanos)
    {
      this.stepNanos = stepNanos;
    }

    @Override
    public long read()
    {
      nanos += stepNanos;
      return nanos;
    }
  }

  private static String runBenchmark(int[] sizes, List<UniqueFilter> filters, int runs) throws IOException
  {
    StringBuilder out = new StringBuilder();
    new FilterBenchmark(sizes, filters, 1L, runs, new SteppingTicker(TimeUnit.MILLISECONDS.toNanos(2)), CLOCK)
        .run(out);
    return out.toString();
  }

  @Test
  public void testLogLayout() throws IOException
  {
    String log = runBenchmark(new int[]{10, 100}, ImmutableList.of(new NaiveFilter(), new HashSetFilter()), 1);
    List<String> lines = Splitter.on('\n').omitEmptyStrings().splitToList(log);

    assertEquals("Benchmark results", lines.get(0));
    assertTrue(lines.get(1), lines.get(1).startsWith("Date: 2024-04-08T00:17"));
    assertEquals(FilterBenchmark.SEPARATOR, lines.get(2));
    assertEquals(
        ImmutableList.of(
            "Benchmark for array size 10",
            "Benchmark for Naive algorithm",
            "Execution time: 2ms",
            "Benchmark for HashTable algorithm",
            "Execution time: 2ms",
            FilterBenchmark.SEPARATOR,
            "Benchmark for array size 100",
            "Benchmark for Naive algorithm",
            "Execution time: 2ms",
            "Benchmark for HashTable algorithm",
            "Execution time: 2ms",
            FilterBenchmark.SEPARATOR
        ),
        lines.subList(3, lines.size())
    );
  }

  @Test
  public void testLogIsReadableByAggregator() throws IOException
  {
    String log = runBenchmark(new int[]{1000, 10}, ImmutableList.of(new NaiveFilter(), new HashSetFilter()), 3);
    ResultTable table = new BenchmarkAggregator().parseStream(Splitter.on('\n').split(log));

    assertEquals(ImmutableList.of(1000L, 10L), ImmutableList.copyOf(table.sizes()));
    assertEquals(ImmutableList.of("Naive algorithm", "HashTable algorithm"), table.algorithms());
    assertEquals(2000.0, table.get(10, "Naive algorithm").getAsDouble(), 0.0);
    assertEquals(2000.0, table.get(1000, "HashTable algorithm").getAsDouble(), 0.0);
    assertEquals(0, table.duplicateCount());
  }

  @Test(expected = IllegalStateException.class)
  public void testDisagreeingFilterFails() throws IOException
  {
    UniqueFilter broken = new UniqueFilter()
    {
      @Override
      public int[] filter(int[] input)
      {
        return new int[0];
      }

      @Override
      public String name()
      {
        return "Broken";
      }
    };
    runBenchmark(new int[]{10}, ImmutableList.of(new HashSetFilter(), broken), 1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsNonPositiveSize()
  {
    new FilterBenchmark(new int[]{10, 0}, ImmutableList.of(new HashSetFilter()), 1L);
  }
}
