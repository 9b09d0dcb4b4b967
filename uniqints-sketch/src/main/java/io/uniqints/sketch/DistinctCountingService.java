package io.uniqints.sketch;

/**
 * Keyed store of exact sets and cardinality sketches, mirroring the SADD/SCARD/PFADD/PFCOUNT command family.
 *
 * <p>Keys that were never written count as empty.
 */
public interface DistinctCountingService
{
  void addToExactSet(String key, long value);

  default void addAllToExactSet(String key, long... values)
  {
    for (long value : values) {
      addToExactSet(key, value);
    }
  }

  long exactCount(String key);

  void addToSketch(String key, long... values);

  double sketchEstimate(String key);

  /**
   * Drops both the exact set and the sketch stored under {@code key}, if any.
   */
  void delete(String key);
}
