package io.uniqints.sketch.redis;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.primitives.Longs;
import io.uniqints.sketch.DistinctCountingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;

import java.io.Closeable;
import java.util.List;

/**
 * Delegates exact sets to Redis sets (SADD/SCARD) and sketches to Redis HyperLogLogs (PFADD/PFCOUNT).
 *
 * <p>Values are sent in batches of {@code batchSize} members per command. The Jedis handle is owned by
 * this service once passed in and is closed with it.
 */
public class RedisCountingService implements DistinctCountingService, Closeable
{
  private static final Logger LOG = LoggerFactory.getLogger(RedisCountingService.class);

  public static final int DEFAULT_BATCH_SIZE = 10_000;

  private final Jedis jedis;
  private final int batchSize;

  public RedisCountingService(Jedis jedis)
  {
    this(jedis, DEFAULT_BATCH_SIZE);
  }

  public RedisCountingService(Jedis jedis, int batchSize)
  {
    Preconditions.checkArgument(batchSize > 0, "batchSize must be positive, got [%s]", batchSize);
    this.jedis = Preconditions.checkNotNull(jedis, "jedis");
    this.batchSize = batchSize;
  }

  @Override
  public void addToExactSet(String key, long value)
  {
    jedis.sadd(key, Long.toString(value));
  }

  @Override
  public void addAllToExactSet(String key, long... values)
  {
    for (List<Long> batch : Lists.partition(Longs.asList(values), batchSize)) {
      jedis.sadd(key, toMembers(batch));
    }
    LOG.debug("SADD {} values to [{}]", values.length, key);
  }

  @Override
  public long exactCount(String key)
  {
    return jedis.scard(key);
  }

  @Override
  public void addToSketch(String key, long... values)
  {
    for (List<Long> batch : Lists.partition(Longs.asList(values), batchSize)) {
      jedis.pfadd(key, toMembers(batch));
    }
    LOG.debug("PFADD {} values to [{}]", values.length, key);
  }

  @Override
  public double sketchEstimate(String key)
  {
    return jedis.pfcount(key);
  }

  @Override
  public void delete(String key)
  {
    jedis.del(key);
  }

  @Override
  public void close()
  {
    jedis.close();
  }

  private static String[] toMembers(List<Long> batch)
  {
    String[] members = new String[batch.size()];
    for (int i = 0; i < members.length; i++) {
      members[i] = Long.toString(batch.get(i));
    }
    return members;
  }
}
