package io.uniqints.bench.filter;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class UniqueFilters
{
  private UniqueFilters()
  {
  }

  /**
   * @return every filter, slowest first
   */
  public static List<UniqueFilter> all()
  {
    return ImmutableList.of(new NaiveFilter(), new SortingFilter(), new HashSetFilter(), new BitmapFilter());
  }

  public static UniqueFilter get(String name)
  {
    for (UniqueFilter filter : all()) {
      if (filter.name().equalsIgnoreCase(name)) {
        return filter;
      }
    }
    throw new IllegalArgumentException("Unknown filter : " + name);
  }
}
