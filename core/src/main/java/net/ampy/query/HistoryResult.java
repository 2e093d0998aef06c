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
package net.ampy.query;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import net.ampy.data.DataPoint;
import net.ampy.data.TimeRange;

/**
 * The gap filled series for each requested label along with the binsize 
 * used and any ranges that timed out upstream.
 * 
 * @since 1.0
 */
public class HistoryResult {
  private final long binsize;
  private final Map<String, List<DataPoint>> series;
  private final Map<String, List<TimeRange>> timed_out;
  
  /**
   * Default ctor.
   * @param binsize The binsize the series were built with.
   * @param series The non-null series keyed on label, in request order.
   * @param timed_out The non-null timed out ranges keyed on label. Labels 
   * without timeouts are absent.
   */
  public HistoryResult(final long binsize, 
                       final Map<String, List<DataPoint>> series,
                       final Map<String, List<TimeRange>> timed_out) {
    this.binsize = binsize;
    this.series = Collections.unmodifiableMap(series);
    this.timed_out = Collections.unmodifiableMap(timed_out);
  }
  
  /** @return The binsize in seconds. */
  public long binsize() {
    return binsize;
  }
  
  /** @return The series keyed on label string. */
  public Map<String, List<DataPoint>> series() {
    return series;
  }
  
  /**
   * @param label The label string.
   * @return The series or null if the label wasn't requested.
   */
  public List<DataPoint> series(final String label) {
    return series.get(label);
  }
  
  /** @return Timed out ranges keyed on label string. */
  public Map<String, List<TimeRange>> timedOut() {
    return timed_out;
  }
  
  @Override
  public String toString() {
    return "binsize=" + binsize + ", labels=" + series.keySet() 
        + ", timedOut=" + timed_out;
  }
}
