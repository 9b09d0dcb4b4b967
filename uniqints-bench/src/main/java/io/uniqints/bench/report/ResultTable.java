package io.uniqints.bench.report;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Normalized benchmark timings: input size -> algorithm -> duration in microseconds.
 *
 * <p>Sizes and algorithms iterate in the order they were first seen, which is not necessarily sorted.
 * {@link #series()} is the sorted view.
 */
public final class ResultTable
{
  private final Map<Long, Map<String, Double>> rows;
  private final int duplicateCount;

  ResultTable(Map<Long, Map<String, Double>> rows, int duplicateCount)
  {
    ImmutableMap.Builder<Long, Map<String, Double>> builder = ImmutableMap.builder();
    for (Map.Entry<Long, Map<String, Double>> entry : rows.entrySet()) {
      builder.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    this.rows = builder.build();
    this.duplicateCount = duplicateCount;
  }

  public Set<Long> sizes()
  {
    return rows.keySet();
  }

  /**
   * @return algorithm -> microseconds for {@code size}, empty if the size was never benchmarked
   */
  public Map<String, Double> get(long size)
  {
    Map<String, Double> row = rows.get(size);
    return row == null ? Collections.emptyMap() : row;
  }

  public OptionalDouble get(long size, String algorithm)
  {
    Double micros = get(size).get(algorithm);
    return micros == null ? OptionalDouble.empty() : OptionalDouble.of(micros);
  }

  /**
   * @return every algorithm present in any group, in order of first appearance
   */
  public List<String> algorithms()
  {
    Set<String> algorithms = new LinkedHashSet<>();
    for (Map<String, Double> row : rows.values()) {
      algorithms.addAll(row.keySet());
    }
    return ImmutableList.copyOf(algorithms);
  }

  /**
   * One series per algorithm, points sorted by ascending input size. Sizes where the algorithm was not timed
   * are skipped.
   */
  public Map<String, List<Point>> series()
  {
    List<Long> sortedSizes = new ArrayList<>(rows.keySet());
    Collections.sort(sortedSizes);

    Map<String, List<Point>> series = new LinkedHashMap<>();
    for (String algorithm : algorithms()) {
      ImmutableList.Builder<Point> points = ImmutableList.builder();
      for (long size : sortedSizes) {
        Double micros = rows.get(size).get(algorithm);
        if (micros != null) {
          points.add(new Point(size, micros));
        }
      }
      series.put(algorithm, points.build());
    }
    return Collections.unmodifiableMap(series);
  }

  /**
   * @return how many records collided with an earlier (size, algorithm) pair while building this table
   */
  public int duplicateCount()
  {
    return duplicateCount;
  }

  public boolean isEmpty()
  {
    return rows.isEmpty();
  }

  public Map<Long, Map<String, Double>> asMap()
  {
    return rows;
  }

  @Override
  public String toString()
  {
    return rows.toString();
  }

  public static final class Point
  {
    private final long size;
    private final double micros;

    public Point(long size, double micros)
    {
      this.size = size;
      this.micros = micros;
    }

    public long getSize()
    {
      return size;
    }

    public double getMicros()
    {
      return micros;
    }

    @Override
    public boolean equals(Object o)
    {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      Point point = (Point) o;
      return size == point.size && Double.compare(point.micros, micros) == 0;
    }

    @Override
    public int hashCode()
    {
      return 31 * Long.hashCode(size) + Double.hashCode(micros);
    }

    @Override
    public String toString()
    {
      return "(" + size + ", " + micros + ")";
    }
  }
}
