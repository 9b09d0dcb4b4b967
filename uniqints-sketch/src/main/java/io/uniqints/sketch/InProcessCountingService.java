package io.uniqints.sketch;

import com.google.common.base.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

public class InProcessCountingService implements DistinctCountingService
{
  private static final Logger LOG = LoggerFactory.getLogger(InProcessCountingService.class);

  private final Supplier<HyperLogLog> sketchSupplier;
  private final Map<String, ExactCounter> exactSets = new HashMap<>();
  private final Map<String, HyperLogLog> sketches = new HashMap<>();

  public InProcessCountingService()
  {
    this(() -> new HyperLogLog(CardinalityEstimators.DEFAULT_PRECISION));
  }

  public InProcessCountingService(Supplier<HyperLogLog> sketchSupplier)
  {
    this.sketchSupplier = sketchSupplier;
  }

  @Override
  public void addToExactSet(String key, long value)
  {
    exactSets.computeIfAbsent(key, k -> {
      LOG.debug("Creating exact set [{}]", k);
      return new ExactCounter();
    }).add(value);
  }

  @Override
  public long exactCount(String key)
  {
    ExactCounter counter = exactSets.get(key);
    return counter == null ? 0 : counter.count();
  }

  @Override
  public void addToSketch(String key, long... values)
  {
    HyperLogLog sketch = sketches.computeIfAbsent(key, k -> {
      HyperLogLog created = sketchSupplier.get();
      LOG.debug("Creating sketch [{}] as {}", k, created);
      return created;
    });
    for (long value : values) {
      sketch.add(value);
    }
  }

  @Override
  public double sketchEstimate(String key)
  {
    HyperLogLog sketch = sketches.get(key);
    return sketch == null ? 0 : sketch.estimate();
  }

  @Override
  public void delete(String key)
  {
    exactSets.remove(key);
    sketches.remove(key);
  }
}
