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

/**
 * Summary points for the recent past of each label and the labels whose
 * query timed out upstream.
 * 
 * @since 1.0
 */
public class RecentResult {
  private final Map<String, List<DataPoint>> recent;
  private final List<String> timed_out;
  
  /**
   * Default ctor.
   * @param recent The non-null summaries keyed on label.
   * @param timed_out The non-null list of labels that timed out.
   */
  public RecentResult(final Map<String, List<DataPoint>> recent, 
                      final List<String> timed_out) {
    this.recent = Collections.unmodifiableMap(recent);
    this.timed_out = Collections.unmodifiableList(timed_out);
  }
  
  /** @return The summaries keyed on label string. */
  public Map<String, List<DataPoint>> recent() {
    return recent;
  }
  
  /** @return Labels whose data is incomplete due to upstream timeouts. */
  public List<String> timedOut() {
    return timed_out;
  }
  
  @Override
  public String toString() {
    return "labels=" + recent.keySet() + ", timedOut=" + timed_out;
  }
}
