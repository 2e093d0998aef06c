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
package net.ampy.data;

import java.util.ArrayList;
import java.util.List;

/**
 * The raw upstream answer for one label of a history request: the points
 * in ascending order, the measurement frequency the upstream reported and
 * any sub-ranges the upstream gave up on. Built incrementally as response
 * chunks arrive.
 * 
 * @since 1.0
 */
public class LabelHistory {
  
  /** Measurement frequency in seconds, 0 until reported. */
  private long frequency;
  
  private final List<DataPoint> points;
  
  private final List<TimeRange> timed_out;
  
  /** Default ctor. */
  public LabelHistory() {
    points = new ArrayList<DataPoint>();
    timed_out = new ArrayList<TimeRange>();
  }
  
  /** @return The measurement frequency in seconds, 0 if unknown. */
  public long frequency() {
    return frequency;
  }
  
  /** @param frequency The frequency to set in seconds. */
  public void setFrequency(final long frequency) {
    this.frequency = frequency;
  }
  
  /** @return The mutable, ascending point list. */
  public List<DataPoint> points() {
    return points;
  }
  
  /** @return The mutable list of ranges the upstream reported as timed out,
   * inclusive of their ends. */
  public List<TimeRange> timedOut() {
    return timed_out;
  }
  
  /**
   * Merges another response for the same label into this one. Points are 
   * appended so callers must merge in ascending range order.
   * @param other The history to merge, may be null.
   */
  public void merge(final LabelHistory other) {
    if (other == null) {
      return;
    }
    points.addAll(other.points);
    timed_out.addAll(other.timed_out);
    if (frequency == 0) {
      frequency = other.frequency;
    }
  }
  
  @Override
  public String toString() {
    return "frequency=" + frequency + ", points=" + points.size() 
        + ", timedOut=" + timed_out;
  }
}
