package io.uniqints.bench.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what a {@link ResultTable} keeps when the same (input size, algorithm) pair is timed more than once.
 */
public enum DuplicatePolicy
{
  /**
   * The later timing replaces the earlier one. The earlier timing is lost, a warning is logged for each overwrite.
   */
  LAST_WRITE_WINS {
    @Override
    public double resolve(BenchmarkRecord duplicate, double existingMicros, double incomingMicros)
    {
      LOG.warn(
          "Overwriting {}µs with {}µs for algorithm [{}] at size {} (line {})",
          existingMicros,
          incomingMicros,
          duplicate.getAlgorithm(),
          duplicate.getInputSize(),
          duplicate.getLineNumber()
      );
      return incomingMicros;
    }
  },
  KEEP_FIRST {
    @Override
    public double resolve(BenchmarkRecord duplicate, double existingMicros, double incomingMicros)
    {
      return existingMicros;
    }
  },
  REJECT {
    @Override
    public double resolve(BenchmarkRecord duplicate, double existingMicros, double incomingMicros)
    {
      throw new MalformedRecordException(
          duplicate.getLineNumber(),
          duplicate.toString(),
          "duplicate timing for algorithm [" + duplicate.getAlgorithm() + "] at size " + duplicate.getInputSize()
      );
    }
  };

  private static final Logger LOG = LoggerFactory.getLogger(DuplicatePolicy.class);

  /**
   * @param duplicate the record that collides with an earlier one
   *
   * @return the duration, in microseconds, to keep for the pair
   */
  public abstract double resolve(BenchmarkRecord duplicate, double existingMicros, double incomingMicros);
}
