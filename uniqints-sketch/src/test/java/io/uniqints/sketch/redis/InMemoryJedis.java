package io.uniqints.sketch.redis;

import io.uniqints.sketch.HyperLogLog;
import redis.clients.jedis.Jedis;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Answers the set and HyperLogLog commands from memory, never opening a connection.
 */
class InMemoryJedis extends Jedis
{
  final Map<String, Set<String>> sets = new HashMap<>();
  final Map<String, HyperLogLog> hlls = new HashMap<>();
  final List<Integer> batchSizes = new ArrayList<>();
  boolean closed;

  @Override
  public long sadd(String key, String... members)
  {
    batchSizes.add(members.length);
    Set<String> set = sets.computeIfAbsent(key, k -> new HashSet<>());
    long added = 0;
    for (String member : members) {
      if (set.add(member)) {
        added++;
      }
    }
    return added;
  }

  @Override
  public long scard(String key)
  {
    Set<String> set = sets.get(key);
    return set == null ? 0 : set.size();
  }

  @Override
  public long pfadd(String key, String... elements)
  {
    batchSizes.add(elements.length);
    HyperLogLog hll = hlls.computeIfAbsent(key, k -> new HyperLogLog(14));
    for (String element : elements) {
      hll.add(element.getBytes(StandardCharsets.UTF_8));
    }
    return 1;
  }

  @Override
  public long pfcount(String key)
  {
    HyperLogLog hll = hlls.get(key);
    return hll == null ? 0 : hll.cardinality();
  }

  @Override
  public long del(String key)
  {
    long removed = 0;
    if (sets.remove(key) != null) {
      removed++;
    }
    if (hlls.remove(key) != null) {
      removed++;
    }
    return removed;
  }

  @Override
  public void close()
  {
    closed = true;
  }
}
