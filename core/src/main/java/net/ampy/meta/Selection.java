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
package net.ampy.meta;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * One page of the values available at the next undecided level of a 
 * stream index, used to populate drop downs incrementally.
 * 
 * @since 1.0
 */
public class Selection {
  
  /** Returned when the caller selected a value the index doesn't hold. */
  public static final Selection EMPTY = new Selection(null, 
      Collections.emptyList(), 0, false);
  
  /** Returned when every level has already been selected. */
  public static final Selection COMPLETE = new Selection(null, 
      Collections.emptyList(), 0, true);
  
  /** The property the values belong to, null for the constants. */
  private final String property;
  
  /** The values on this page. */
  private final List<Object> values;
  
  /** Total number of distinct values matching the term across all pages. */
  private final int total;
  
  /** Whether the selection path was valid. */
  private final boolean valid;
  
  /**
   * Default ctor.
   * @param property The property name.
   * @param values The values on the page.
   * @param total The total distinct value count.
   */
  public Selection(final String property, 
                   final List<Object> values, 
                   final int total) {
    this(property, values, total, true);
  }
  
  private Selection(final String property, 
                    final List<Object> values, 
                    final int total, 
                    final boolean valid) {
    this.property = property;
    this.values = ImmutableList.copyOf(values);
    this.total = total;
    this.valid = valid;
  }
  
  /** @return The property name or null if there is nothing to select. */
  public String property() {
    return property;
  }
  
  /** @return The values on this page. */
  public List<Object> values() {
    return values;
  }
  
  /** @return The total number of values across all pages. */
  public int total() {
    return total;
  }
  
  /** @return False if the selection path referenced a missing value. */
  public boolean isValid() {
    return valid;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("property=")
        .append(property)
        .append(", values=")
        .append(values)
        .append(", total=")
        .append(total)
        .append(", valid=")
        .append(valid)
        .toString();
  }
}
