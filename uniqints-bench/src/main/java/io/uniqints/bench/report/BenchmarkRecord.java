package io.uniqints.bench.report;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * One timing taken from a benchmark log: how long {@code algorithm} took on an input of {@code inputSize} values.
 */
public final class BenchmarkRecord
{
  private final long inputSize;
  private final String algorithm;
  private final double duration;
  private final TimeUnitSuffix unit;
  private final int lineNumber;

  public BenchmarkRecord(long inputSize, String algorithm, double duration, TimeUnitSuffix unit)
  {
    this(inputSize, algorithm, duration, unit, 0);
  }

  public BenchmarkRecord(long inputSize, String algorithm, double duration, TimeUnitSuffix unit, int lineNumber)
  {
    Preconditions.checkArgument(duration >= 0, "duration must be non-negative, got [%s]", duration);
    this.inputSize = inputSize;
    this.algorithm = Preconditions.checkNotNull(algorithm, "algorithm");
    this.duration = duration;
    this.unit = Preconditions.checkNotNull(unit, "unit");
    this.lineNumber = lineNumber;
  }

  public long getInputSize()
  {
    return inputSize;
  }

  public String getAlgorithm()
  {
    return algorithm;
  }

  public double getDuration()
  {
    return duration;
  }

  public TimeUnitSuffix getUnit()
  {
    return unit;
  }

  /**
   * @return line of the duration in the parsed log, 0 if unknown
   */
  public int getLineNumber()
  {
    return lineNumber;
  }

  public double toMicros()
  {
    return BenchmarkAggregator.normalize(duration, unit);
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    BenchmarkRecord that = (BenchmarkRecord) o;
    return inputSize == that.inputSize
           && Double.compare(that.duration, duration) == 0
           && algorithm.equals(that.algorithm)
           && unit == that.unit;
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(inputSize, algorithm, duration, unit);
  }

  @Override
  public String toString()
  {
    return inputSize + "/" + algorithm + "=" + duration + unit.symbol();
  }
}
