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
package net.ampy.collection;

import java.util.List;

import net.ampy.data.Aggregation;
import net.ampy.data.DataPoint;
import net.ampy.data.Label;
import net.ampy.data.Stream;

/**
 * Per measurement type glue: which properties identify a stream, how a 
 * group description turns into labels, which columns to ask the upstream
 * for at each detail level and how raw points are dressed up for display.
 * <p>
 * Implementations must be thread safe, they are shared by every request
 * for the collection.
 * 
 * @since 1.0
 */
public interface CollectionAdapter {

  /** @return The collection name, {@code module-subtype}. */
  public String name();
  
  /** @return The ordered list of properties that identify a stream. */
  public List<String> streamProperties();
  
  /**
   * @param detail The detail level, e.g. "full" or "basic".
   * @return The non-null columns and aggregation functions to query.
   */
  public Aggregation detailColumns(final String detail);
  
  /**
   * @param detail The detail level.
   * @return A non-null, usually empty, list of columns to group by.
   */
  public List<String> groupColumns(final String detail);
  
  /**
   * Formats a single point for display. May modify and return the given 
   * point.
   * @param point The non-null point fetched from the upstream.
   * @param frequency The measurement frequency reported for the label.
   * @param detail The detail level.
   * @return The formatted point.
   */
  public DataPoint formatPoint(final DataPoint point, 
                               final long frequency, 
                               final String detail);
  
  /**
   * Converts a group description into the labels that should be drawn for
   * the group.
   * @param group_id The group ID, used to build unique label strings.
   * @param description The group description.
   * @param finder An optional stream lookup. When null the labels are 
   * returned with empty stream lists.
   * @return The non-null list of labels sorted by short label.
   * @throws IllegalArgumentException if the description could not be parsed.
   */
  public List<Label> groupToLabels(final long group_id, 
                                   final String description, 
                                   final StreamFinder finder);
  
  /**
   * Picks a binsize for a window when the caller didn't provide one.
   * @param start The window start in seconds.
   * @param end The window end in seconds.
   * @param detail The detail level.
   * @return A positive binsize in seconds.
   */
  public long calculateBinsize(final long start, 
                               final long end, 
                               final String detail);
  
  /**
   * @param detail The detail level.
   * @return The number of blocks to prefetch on either side of a window.
   */
  public int extraBlocks(final String detail);
  
  /**
   * Adds derived properties to a stream before it is indexed, e.g. an
   * address family computed from an address.
   * @param stream The non-null stream from the upstream.
   * @return The stream to index.
   */
  public Stream prepareStream(final Stream stream);
  
  /**
   * @param stream The prepared stream.
   * @return An optional payload stored next to the stream ID in the index.
   */
  public Object storagePayload(final Stream stream);
  
}
