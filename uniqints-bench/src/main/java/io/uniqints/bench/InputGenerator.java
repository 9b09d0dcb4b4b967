package io.uniqints.bench;

import com.google.common.base.Preconditions;

import java.util.Random;

/**
 * Builds the integer arrays the filters are timed on.
 */
public final class InputGenerator
{
  private static final int[] SAMPLE = {16, 17, 2, 17, 4, 2, 97, 4, 17, 56};

  private InputGenerator()
  {
  }

  /**
   * @return a fixed 10-element array with 6 distinct values
   */
  public static int[] sample()
  {
    return SAMPLE.clone();
  }

  /**
   * @return {@code size} values drawn uniformly from (-randMax, randMax), each sign equally likely
   */
  public static int[] randomSigned(int size, int randMax, Random random)
  {
    Preconditions.checkArgument(size >= 1, "size must be at least 1, got [%s]", size);
    Preconditions.checkArgument(randMax >= 1, "randMax must be at least 1, got [%s]", randMax);
    int[] values = new int[size];
    for (int i = 0; i < size; i++) {
      int value = random.nextInt(randMax);
      values[i] = random.nextBoolean() ? value : -value;
    }
    return values;
  }

  /**
   * @return 0, 1, .., size - 1
   */
  public static int[] growing(int size)
  {
    Preconditions.checkArgument(size >= 1, "size must be at least 1, got [%s]", size);
    int[] values = new int[size];
    for (int i = 0; i < size; i++) {
      values[i] = i;
    }
    return values;
  }

  /**
   * The input used for a benchmark round of {@code size} values: the fixed sample for size 10, otherwise random
   * values with roughly 10 possible values per slot.
   */
  public static int[] forBenchmark(int size, Random random)
  {
    if (size == SAMPLE.length) {
      return sample();
    }
    return randomSigned(size, (int) Math.min(Integer.MAX_VALUE, size * 10L), random);
  }
}
