package io.uniqints.sketch;

import java.util.concurrent.TimeUnit;

/**
 * Outcome of feeding one stream into both an exact set and a sketch.
 */
public final class ComparisonResult
{
  private final long exactCount;
  private final double estimate;
  private final long exactNanos;
  private final long sketchNanos;

  public ComparisonResult(long exactCount, double estimate, long exactNanos, long sketchNanos)
  {
    this.exactCount = exactCount;
    this.estimate = estimate;
    this.exactNanos = exactNanos;
    this.sketchNanos = sketchNanos;
  }

  public long getExactCount()
  {
    return exactCount;
  }

  public double getEstimate()
  {
    return estimate;
  }

  public long getExactNanos()
  {
    return exactNanos;
  }

  public long getSketchNanos()
  {
    return sketchNanos;
  }

  /**
   * @return |estimate - exact| / exact, or 0 when both are 0
   */
  public double relativeError()
  {
    if (exactCount == 0) {
      return estimate == 0 ? 0 : Double.POSITIVE_INFINITY;
    }
    return Math.abs(estimate - exactCount) / exactCount;
  }

  @Override
  public String toString()
  {
    return String.format(
        "exact=%,d in %,d ms, estimate=%,.0f in %,d ms, error=%.3f%%",
        exactCount,
        TimeUnit.NANOSECONDS.toMillis(exactNanos),
        estimate,
        TimeUnit.NANOSECONDS.toMillis(sketchNanos),
        100 * relativeError()
    );
  }
}
