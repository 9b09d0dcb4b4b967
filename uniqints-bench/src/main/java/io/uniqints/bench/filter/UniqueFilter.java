package io.uniqints.bench.filter;

/**
 * Removes repeated values from an array.
 */
public interface UniqueFilter
{
  /**
   * @return the distinct values of {@code input}, in order of first occurrence
   */
  int[] filter(int[] input);

  String name();
}
