package io.uniqints.sketch;

import com.google.common.base.Supplier;
import com.google.common.hash.Hashing;

public final class CardinalityEstimators
{
  public static final int DEFAULT_PRECISION = 14;

  private CardinalityEstimators()
  {
  }

  /**
   * @param name {@code "exact"}, {@code "hll"} or {@code "hll<p>"}, e.g. {@code "hll12"}
   */
  public static CardinalityEstimator<?> get(String name)
  {
    if (name.startsWith("hll")) {
      String pStr = name.substring("hll".length());
      final int precision;
      try {
        precision = pStr.isEmpty() ? DEFAULT_PRECISION : Integer.parseInt(pStr);
      }
      catch (NumberFormatException e) {
        throw new IllegalArgumentException("Unknown estimator : " + name, e);
      }
      return new HyperLogLog(precision, Hashing.murmur3_128());
    }
    if (name.equals("exact")) {
      return new ExactCounter();
    }
    throw new IllegalArgumentException("Unknown estimator : " + name);
  }

  public static Supplier<CardinalityEstimator<?>> lazyGet(String name)
  {
    // fail fast on a bad name instead of on first use
    get(name);
    return () -> get(name);
  }
}
