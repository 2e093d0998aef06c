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
 * AMP ICMP latency tests. Groups are described as
 * {@code FROM <source> TO <destination> OPTION <packet size> <split>} where
 * the split is one of IPV4, IPV6, FAMILY (one line per family) or FULL (a
 * single line across both families).
 * 
 * @since 1.0
 */
public class AmpIcmpAdapter extends BaseCollectionAdapter {
  public static final String NAME = "amp-icmp";
  
  private static final Pattern DESCRIPTION = Pattern.compile(
      "FROM (?<source>[.a-zA-Z0-9-]+) "
      + "TO (?<destination>[.a-zA-Z0-9-]+) "
      + "OPTION (?<option>[a-zA-Z0-9]+) "
      + "(?<split>[A-Z0-9]+)");
  
  private static final ImmutableSet<String> SPLITS = 
      ImmutableSet.of("FAMILY", "FULL", "IPV4", "IPV6");
  
  /** ICMP tests run every minute so the binsize can go below 5m. */
  private static final long NATIVE_BINSIZE = 60;
  
  /**
   * Default ctor.
   * @param target_points How many points a graph should have.
   */
  public AmpIcmpAdapter(final int target_points) {
    super(NAME, 
        Arrays.asList("source", "destination", "packet_size", FAMILY), 
        target_points);
  }
  
  @Override
  public Aggregation detailColumns(final String detail) {
    if ("matrix".equals(detail)) {
      return new Aggregation(
          Arrays.asList("median", "median", "median", "loss", "results", 
              "lossrate"),
          Arrays.asList("avg", "stddev", "count", "sum", "sum", "stddev"));
    }
    if ("basic".equals(detail) || "spark".equals(detail) 
        || "tooltiptext".equals(detail)) {
      return new Aggregation(
          Arrays.asList("median", "loss", "results"),
          Arrays.asList("avg", "sum", "sum"));
    }
    return new Aggregation(
        Arrays.asList("median", "rtts", "loss", "results"),
        Arrays.asList("avg", "smokearray", "sum", "sum"));
  }
  
  @Override
  public long calculateBinsize(final long start, 
                               final long end, 
                               final String detail) {
    if ((end - start) / (double) NATIVE_BINSIZE < target_points) {
      return NATIVE_BINSIZE;
    }
    return super.calculateBinsize(start, end, detail);
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
    search.put("destination", matcher.group("destination"));
    search.put("packet_size", matcher.group("option"));
    return familyLabels(group_id, search, split, finder);
  }
}
