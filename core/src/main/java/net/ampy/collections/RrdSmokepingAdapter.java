// This file is part of ampy.
// Copyright (C) 2013-2026  The ampy Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.ampy.collections;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableSet;

import net.ampy.collection.StreamFinder;
import net.ampy.data.Aggregation;
import net.ampy.data.Label;

/**
 * Smokeping latency data collected from RRD files. Groups are described as
 * {@code SOURCE <source> TARGET <host> <split>} where the split is IPV4, 
 * IPV6 or FAMILY. Smokeping measures every five minutes so the default 
 * binsize ladder applies.
 * 
 * @since 1.0
 */
public class RrdSmokepingAdapter extends BaseCollectionAdapter {
  public static final String NAME = "rrd-smokeping";
  
  private static final Pattern DESCRIPTION = Pattern.compile(
      "SOURCE (?<source>[.a-zA-Z0-9-]+) "
      + "TARGET (?<host>\\S+) "
      + "(?<split>[A-Z0-9]+)");
  
  private static final ImmutableSet<String> SPLITS = 
      ImmutableSet.of("IPV4", "IPV6", "FAMILY");
  
  /**
   * Default ctor.
   * @param target_points How many points a graph should have.
   */
  public RrdSmokepingAdapter(final int target_points) {
    super(NAME, Arrays.asList("source", "host", FAMILY), target_points);
  }
  
  @Override
  public Aggregation detailColumns(final String detail) {
    if ("matrix".equals(detail)) {
      return new Aggregation(
          Arrays.asList("median", "median", "median", "loss", "pingsent", 
              "lossrate"),
          Arrays.asList("avg", "stddev", "count", "sum", "sum", "stddev"));
    }
    if ("basic".equals(detail) || "spark".equals(detail) 
        || "tooltiptext".equals(detail)) {
      return new Aggregation(
          Arrays.asList("loss", "pingsent", "median"),
          Arrays.asList("sum", "sum", "avg"));
    }
    return new Aggregation(
        Arrays.asList("median", "pings", "loss", "pingsent"),
        Arrays.asList("avg", "smokearray", "sum", "sum"));
  }
  
  @Override
  public List<Label> groupToLabels(final long group_id, 
                                   final String description, 
                                   final StreamFinder finder) {
    final Matcher matcher = applyGroupRegex(DESCRIPTION, description);
    final String split = matcher.group("split");
    if (!SPLITS.contains(split)) {
      throw new IllegalArgumentException(NAME 
          + " group description has no aggregation method: " + description);
    }
    final Map<String, Object> search = new LinkedHashMap<String, Object>();
    search.put("source", matcher.group("source"));
    search.put("host", matcher.group("host"));
    return familyLabels(group_id, search, split, finder);
  }
}
