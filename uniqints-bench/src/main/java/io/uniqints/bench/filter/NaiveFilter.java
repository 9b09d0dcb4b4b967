package io.uniqints.bench.filter;

import java.util.Arrays;

/**
 * Scans every value kept so far before keeping a new one. O(n * distinct).
 */
public class NaiveFilter implements UniqueFilter
{
  @Override
  public int[] filter(int[] input)
  {
    int[] output = new int[input.length];
    int count = 0;
    for (int elem : input) {
      boolean found = false;
      for (int i = 0; i < count; i++) {
        if (output[i] == elem) {
          found = true;
          break;
        }
      }
      if (!found) {
        output[count++] = elem;
      }
    }
    return Arrays.copyOf(output, count);
  }

  @Override
  public String name()
  {
    return "Naive";
  }
}
