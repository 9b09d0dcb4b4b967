package io.uniqints.sketch;

import java.nio.ByteBuffer;
import java.util.HashSet;
import java.util.Set;

/**
 * Keeps every distinct value it has seen. Used as ground truth for {@link HyperLogLog}: the count is exact,
 * memory grows with the number of distinct values.
 *
 * <p>Longs and byte arrays are kept in separate domains, {@code add(1L)} and {@code add(new byte[] {1})}
 * count as two values.
 */
public class ExactCounter implements CardinalityEstimator<ExactCounter>
{
  private final Set<Long> longs = new HashSet<>();
  private final Set<ByteBuffer> byteValues = new HashSet<>();
  private long byteValuesFootprint;

  @Override
  public void add(byte[] value)
  {
    // copy, the caller may reuse its buffer
    if (byteValues.add(ByteBuffer.wrap(value.clone()))) {
      byteValuesFootprint += value.length;
    }
  }

  @Override
  public void add(long value)
  {
    longs.add(value);
  }

  public boolean contains(long value)
  {
    return longs.contains(value);
  }

  public long count()
  {
    return longs.size() + byteValues.size();
  }

  @Override
  public void merge(ExactCounter that)
  {
    longs.addAll(that.longs);
    for (ByteBuffer value : that.byteValues) {
      if (byteValues.add(value)) {
        byteValuesFootprint += value.remaining();
      }
    }
  }

  @Override
  public double estimate()
  {
    return count();
  }

  @Override
  public long cardinality()
  {
    return count();
  }

  @Override
  public long memoryFootprint()
  {
    return (long) Long.BYTES * longs.size() + byteValuesFootprint; // payload only
  }

  @Override
  public String name()
  {
    return "exact";
  }
}
