package io.uniqints.bench.filter;

import java.util.Arrays;

/**
 * Sorts a copy of the input to find the distinct values, then walks the input once more to emit them in order of
 * first occurrence. O(n log n), no hashing.
 */
public class SortingFilter implements UniqueFilter
{
  @Override
  public int[] filter(int[] input)
  {
    int[] sorted = input.clone();
    Arrays.sort(sorted);
    int distinct = 0;
    for (int i = 0; i < sorted.length; i++) {
      if (i == 0 || sorted[i] != sorted[distinct - 1]) {
        sorted[distinct++] = sorted[i];
      }
    }

    boolean[] emitted = new boolean[distinct];
    int[] output = new int[distinct];
    int count = 0;
    for (int elem : input) {
      int index = Arrays.binarySearch(sorted, 0, distinct, elem);
      if (!emitted[index]) {
        emitted[index] = true;
        output[count++] = elem;
      }
    }
    return output;
  }

  @Override
  public String name()
  {
    return "Sorting";
  }
}
