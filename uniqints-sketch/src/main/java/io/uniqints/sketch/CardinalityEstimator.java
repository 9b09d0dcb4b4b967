package io.uniqints.sketch;

/**
 * Counts distinct values of a stream, either exactly or approximately.
 *
 * <p>Instances are not thread-safe, callers feeding one estimator from several threads must synchronize externally.
 */
public interface CardinalityEstimator<T extends CardinalityEstimator<T>>
{
  void add(byte[] value);
  void add(long value);

  /**
   * Folds the state of {@code that} into this estimator, as if every value added to {@code that}
   * had been added here too. {@code that} is left untouched.
   */
  void merge(T that);

  double estimate();

  default long cardinality()
  {
    return Math.round(estimate());
  }

  long memoryFootprint();

  String name();
}
