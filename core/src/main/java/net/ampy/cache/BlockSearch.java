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
package net.ampy.cache;

import java.util.List;
import java.util.Map;

import net.ampy.data.DataPoint;
import net.ampy.data.TimeRange;

/**
 * The outcome of looking a label's blocks up in the cache: the cached 
 * points keyed on block start and the missing blocks coalesced into 
 * contiguous, half open ranges.
 * 
 * @since 1.0
 */
public class BlockSearch {
  private final List<TimeRange> missing;
  private final Map<Long, List<DataPoint>> cached;
  
  /**
   * Default ctor.
   * @param missing The non-null missing ranges in ascending order.
   * @param cached The non-null cached points keyed on block start.
   */
  public BlockSearch(final List<TimeRange> missing, 
                     final Map<Long, List<DataPoint>> cached) {
    this.missing = missing;
    this.cached = cached;
  }
  
  /** @return The missing ranges, each {@code [start, end)}. */
  public List<TimeRange> missing() {
    return missing;
  }
  
  /** @return The cached points keyed on block start. */
  public Map<Long, List<DataPoint>> cached() {
    return cached;
  }
  
  @Override
  public String toString() {
    return "missing=" + missing + ", cached=" + cached.keySet();
  }
}
