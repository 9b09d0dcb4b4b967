package io.uniqints.bench.filter;

import java.util.Arrays;

/**
 * Marks seen values in a two-level bitmap over the whole 32-bit space: the high 16 bits pick a page of 2^16 bits,
 * allocated on first use, the low 16 bits pick the bit inside the page.
 *
 * <p>Memory is bounded by 512 MiB of pages no matter how long the input is, and proportional to the number of
 * distinct high halves actually seen.
 */
public class BitmapFilter implements UniqueFilter
{
  private static final int PAGE_BITS = 16;
  private static final int PAGE_COUNT = 1 << (Integer.SIZE - PAGE_BITS);
  private static final int WORDS_PER_PAGE = (1 << PAGE_BITS) / Long.SIZE;

  @Override
  public int[] filter(int[] input)
  {
    long[][] pages = new long[PAGE_COUNT][];
    int[] output = new int[input.length];
    int count = 0;
    for (int elem : input) {
      final int high = elem >>> PAGE_BITS;
      final int low = elem & ((1 << PAGE_BITS) - 1);

      long[] page = pages[high];
      if (page == null) {
        page = new long[WORDS_PER_PAGE];
        pages[high] = page;
      }

      final int word = low >>> 6;
      final long mask = 1L << low; // shift distance is taken mod 64
      if ((page[word] & mask) == 0) {
        page[word] |= mask;
        output[count++] = elem;
      }
    }
    return Arrays.copyOf(output, count);
  }

  @Override
  public String name()
  {
    return "BitHashTable";
  }
}
