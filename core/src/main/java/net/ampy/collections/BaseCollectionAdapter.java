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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.ampy.collection.CollectionAdapter;
import net.ampy.collection.StreamFinder;
import net.ampy.data.DataPoint;
import net.ampy.data.Label;
import net.ampy.data.Stream;

/**
 * Defaults shared by most collections: a binsize ladder aimed at a fixed 
 * number of points per graph with a five minute floor, two blocks of 
 * prefetch for the panning "full" view, no grouping, and points passed 
 * through unformatted.
 * 
 * @since 1.0
 */
public abstract class BaseCollectionAdapter implements CollectionAdapter {
  private static final Logger LOG = 
      LoggerFactory.getLogger(BaseCollectionAdapter.class);
  
  /** Standard binsizes in seconds, smallest first. */
  protected static final long[] BINSIZES = { 300, 600, 1200, 2400, 4800 };
  
  /** The binsize used for anything wider than the ladder. */
  protected static final long MAX_BINSIZE = 14400;
  
  /** The detail level of the main, pannable graph. */
  public static final String FULL_DETAIL = "full";
  
  /** The property holding a stream's address family. */
  public static final String FAMILY = "family";
  
  /** The property some upstream streams carry an address in. */
  public static final String ADDRESS = "address";
  
  /** Orders labels on their short label. */
  protected static final Comparator<Label> SHORT_LABEL_ORDER = 
      new Comparator<Label>() {
    @Override
    public int compare(final Label a, final Label b) {
      return a.shortLabel().compareTo(b.shortLabel());
    }
  };
  
  /** The collection name. */
  protected final String name;
  
  /** The ordered stream properties. */
  protected final List<String> stream_properties;
  
  /** How many points a graph should have, roughly. */
  protected final int target_points;
  
  /**
   * Default ctor.
   * @param name The non-null and non-empty collection name.
   * @param stream_properties The ordered stream properties.
   * @param target_points How many points a graph should have.
   */
  protected BaseCollectionAdapter(final String name, 
                                  final List<String> stream_properties, 
                                  final int target_points) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    Preconditions.checkArgument(target_points > 0, 
        "Target points must be greater than zero.");
    this.name = name;
    this.stream_properties = ImmutableList.copyOf(stream_properties);
    this.target_points = target_points;
  }
  
  @Override
  public String name() {
    return name;
  }
  
  @Override
  public List<String> streamProperties() {
    return stream_properties;
  }
  
  @Override
  public List<String> groupColumns(final String detail) {
    return Collections.emptyList();
  }
  
  @Override
  public DataPoint formatPoint(final DataPoint point, 
                               final long frequency, 
                               final String detail) {
    return point;
  }
  
  @Override
  public long calculateBinsize(final long start, 
                               final long end, 
                               final String detail) {
    final long min_bin = (end - start) / target_points;
    for (final long binsize : BINSIZES) {
      if (min_bin <= binsize) {
        return binsize;
      }
    }
    return MAX_BINSIZE;
  }
  
  @Override
  public int extraBlocks(final String detail) {
    return FULL_DETAIL.equals(detail) ? 2 : 0;
  }
  
  /**
   * Adds a {@code family} property derived from the {@code address} 
   * property when the collection is keyed on family and the upstream 
   * didn't supply one.
   */
  @Override
  public Stream prepareStream(final Stream stream) {
    if (stream_properties.contains(FAMILY) 
        && stream.property(FAMILY) == null
        && stream.property(ADDRESS) != null) {
      return stream.withProperty(FAMILY, 
          addressToFamily(stream.property(ADDRESS).toString()));
    }
    return stream;
  }
  
  @Override
  public Object storagePayload(final Stream stream) {
    return null;
  }
  
  /**
   * @param address An IPv4 or IPv6 address.
   * @return "ipv4" if the address is dotted, "ipv6" otherwise.
   */
  public static String addressToFamily(final String address) {
    return address.indexOf('.') >= 0 ? "ipv4" : "ipv6";
  }
  
  /**
   * Matches a group description against the start of a pattern.
   * @param pattern The non-null pattern.
   * @param description The description.
   * @return The successful matcher.
   * @throws IllegalArgumentException if the description didn't match.
   */
  protected Matcher applyGroupRegex(final Pattern pattern, 
                                    final String description) {
    if (Strings.isNullOrEmpty(description)) {
      throw new IllegalArgumentException("Description cannot be null or "
          + "empty for " + name);
    }
    final Matcher matcher = pattern.matcher(description);
    if (!matcher.lookingAt()) {
      LOG.warn("Group description did not match regex for " + name + ": " 
          + description);
      throw new IllegalArgumentException("Invalid " + name 
          + " group description: " + description);
    }
    return matcher;
  }
  
  /**
   * Builds the labels for an address family split.
   * @param group_id The group ID.
   * @param search The properties shared by every label of the group.
   * @param split One of "IPV4", "IPV6", "FAMILY" or "FULL".
   * @param finder An optional stream lookup.
   * @return The labels sorted on short label.
   */
  protected List<Label> familyLabels(final long group_id, 
                                     final Map<String, Object> search, 
                                     final String split, 
                                     final StreamFinder finder) {
    final String base = "group_" + group_id;
    final List<Label> labels = new ArrayList<Label>(2);
    if ("IPV4".equals(split) || "FAMILY".equals(split)) {
      labels.add(familyLabel(base, search, "IPv4", finder));
    }
    if ("IPV6".equals(split) || "FAMILY".equals(split)) {
      labels.add(familyLabel(base, search, "IPv6", finder));
    }
    if ("FULL".equals(split)) {
      labels.add(familyLabel(base, search, null, finder));
    }
    Collections.sort(labels, SHORT_LABEL_ORDER);
    return labels;
  }
  
  private Label familyLabel(final String base, 
                            final Map<String, Object> search, 
                            final String family, 
                            final StreamFinder finder) {
    final Map<String, Object> properties = 
        new LinkedHashMap<String, Object>(search);
    final String label;
    final String short_label;
    if (family == null) {
      label = base;
      short_label = "All addresses";
    } else {
      label = base + "_" + family;
      short_label = family;
      properties.put(FAMILY, family.toLowerCase());
    }
    final List<Long> streams = finder == null ? 
        Collections.<Long>emptyList() : finder.findStreamIds(properties);
    return new Label(label, streams, short_label);
  }
  
  @Override
  public String toString() {
    return name;
  }
}
