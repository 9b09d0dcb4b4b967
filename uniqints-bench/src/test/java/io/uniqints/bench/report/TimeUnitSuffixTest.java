package io.uniqints.bench.report;

import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.assertEquals;

public class TimeUnitSuffixTest
{
  @Test
  public void testMatchSuffixPrefersLongest()
  {
    assertEquals(Optional.of(TimeUnitSuffix.MILLISECONDS), TimeUnitSuffix.matchSuffix("12ms"));
    assertEquals(Optional.of(TimeUnitSuffix.NANOSECONDS), TimeUnitSuffix.matchSuffix("12ns"));
    assertEquals(Optional.of(TimeUnitSuffix.MICROSECONDS), TimeUnitSuffix.matchSuffix("12µs"));
    assertEquals(Optional.of(TimeUnitSuffix.SECONDS), TimeUnitSuffix.matchSuffix("12s"));
    assertEquals(Optional.empty(), TimeUnitSuffix.matchSuffix("12h"));
    assertEquals(Optional.empty(), TimeUnitSuffix.matchSuffix(""));
  }

  @Test
  public void testFromSymbol()
  {
    assertEquals(Optional.of(TimeUnitSuffix.MICROSECONDS), TimeUnitSuffix.fromSymbol("µs"));
    assertEquals(Optional.empty(), TimeUnitSuffix.fromSymbol("us"));
  }

  @Test
  public void testToMicros()
  {
    assertEquals(0.5, TimeUnitSuffix.NANOSECONDS.toMicros(500), 0.0);
    assertEquals(2.5, TimeUnitSuffix.MICROSECONDS.toMicros(2.5), 0.0);
    assertEquals(2500.0, TimeUnitSuffix.MILLISECONDS.toMicros(2.5), 0.0);
    assertEquals(2_500_000.0, TimeUnitSuffix.SECONDS.toMicros(2.5), 0.0);
  }
}
