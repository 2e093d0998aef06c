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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The columns and upstream aggregation functions requested for a detail
 * level. The two lists are parallel: {@code functions().get(i)} is applied
 * to {@code columns().get(i)}. A column may appear more than once with 
 * different functions.
 * 
 * @since 1.0
 */
public class Aggregation {
  private final List<String> columns;
  private final List<String> functions;
  
  /**
   * Default ctor.
   * @param columns The non-null column list.
   * @param functions The non-null function list of the same length.
   * @throws IllegalArgumentException if the lists differ in length.
   */
  public Aggregation(final List<String> columns, final List<String> functions) {
    Preconditions.checkNotNull(columns, "Columns cannot be null.");
    Preconditions.checkNotNull(functions, "Functions cannot be null.");
    Preconditions.checkArgument(columns.size() == functions.size(),
        "Column and function counts differ: %s vs %s", columns, functions);
    this.columns = ImmutableList.copyOf(columns);
    this.functions = ImmutableList.copyOf(functions);
  }
  
  /** @return The columns. */
  public List<String> columns() {
    return columns;
  }
  
  /** @return The aggregation functions. */
  public List<String> functions() {
    return functions;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Aggregation)) {
      return false;
    }
    return columns.equals(((Aggregation) o).columns) 
        && functions.equals(((Aggregation) o).functions);
  }
  
  @Override
  public int hashCode() {
    return 31 * columns.hashCode() + functions.hashCode();
  }
  
  @Override
  public String toString() {
    return "columns=" + columns + ", functions=" + functions;
  }
}
