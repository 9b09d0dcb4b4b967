package io.uniqints.bench.report;

import com.google.common.collect.ImmutableList;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * The duration units a benchmark log may use, with their conversion to microseconds.
 */
public enum TimeUnitSuffix
{
  NANOSECONDS("ns") {
    @Override
    public double toMicros(double duration)
    {
      return duration / 1000;
    }
  },
  MICROSECONDS("µs") {
    @Override
    public double toMicros(double duration)
    {
      return duration;
    }
  },
  MILLISECONDS("ms") {
    @Override
    public double toMicros(double duration)
    {
      return duration * 1000;
    }
  },
  SECONDS("s") {
    @Override
    public double toMicros(double duration)
    {
      return duration * 1_000_000;
    }
  };

  // longest suffix first, so "ms", "ns" and "µs" are never read as "s"
  private static final List<TimeUnitSuffix> MATCH_ORDER = ImmutableList.sortedCopyOf(
      Comparator.comparingInt((TimeUnitSuffix unit) -> unit.symbol.length()).reversed(),
      ImmutableList.copyOf(values())
  );

  private final String symbol;

  TimeUnitSuffix(String symbol)
  {
    this.symbol = symbol;
  }

  public String symbol()
  {
    return symbol;
  }

  public abstract double toMicros(double duration);

  /**
   * @return the unit whose symbol ends {@code token}, preferring the longest symbol
   */
  public static Optional<TimeUnitSuffix> matchSuffix(String token)
  {
    for (TimeUnitSuffix unit : MATCH_ORDER) {
      if (token.endsWith(unit.symbol)) {
        return Optional.of(unit);
      }
    }
    return Optional.empty();
  }

  public static Optional<TimeUnitSuffix> fromSymbol(String symbol)
  {
    for (TimeUnitSuffix unit : values()) {
      if (unit.symbol.equals(symbol)) {
        return Optional.of(unit);
      }
    }
    return Optional.empty();
  }
}
