package io.uniqints.bench.filter;

import com.google.common.collect.Sets;

import java.util.Arrays;
import java.util.Set;

public class HashSetFilter implements UniqueFilter
{
  @Override
  public int[] filter(int[] input)
  {
    Set<Integer> seen = Sets.newHashSetWithExpectedSize(input.length);
    int[] output = new int[input.length];
    int count = 0;
    for (int elem : input) {
      if (seen.add(elem)) {
        output[count++] = elem;
      }
    }
    return Arrays.copyOf(output, count);
  }

  @Override
  public String name()
  {
    return "HashTable";
  }
}
