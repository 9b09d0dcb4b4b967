package io.uniqints.bench;

import com.google.common.base.Preconditions;
import io.uniqints.bench.report.TimeUnitSuffix;

import java.math.BigDecimal;

/**
 * Prints elapsed nanoseconds with the largest unit that keeps the value at least 1, e.g. {@code 850ns},
 * {@code 12.5µs}, {@code 3.2ms}, {@code 1.5s}. The value is exact, no rounding.
 */
public final class DurationFormat
{
  private DurationFormat()
  {
  }

  public static String format(long nanos)
  {
    Preconditions.checkArgument(nanos >= 0, "negative duration [%s]", nanos);
    if (nanos < 1_000L) {
      return nanos + TimeUnitSuffix.NANOSECONDS.symbol();
    }
    if (nanos < 1_000_000L) {
      return scaled(nanos, 3) + TimeUnitSuffix.MICROSECONDS.symbol();
    }
    if (nanos < 1_000_000_000L) {
      return scaled(nanos, 6) + TimeUnitSuffix.MILLISECONDS.symbol();
    }
    return scaled(nanos, 9) + TimeUnitSuffix.SECONDS.symbol();
  }

  private static String scaled(long nanos, int decimals)
  {
    return BigDecimal.valueOf(nanos).movePointLeft(decimals).stripTrailingZeros().toPlainString();
  }
}
