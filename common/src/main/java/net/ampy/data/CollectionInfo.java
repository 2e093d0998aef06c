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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A measurement collection hosted by the upstream store, e.g. 
 * {@code amp/icmp}.
 * 
 * @since 1.0
 */
public class CollectionInfo {
  private final long id;
  private final String module;
  private final String subtype;
  
  /**
   * Default ctor.
   * @param id The upstream collection ID.
   * @param module The module, e.g. "amp".
   * @param subtype The subtype, e.g. "icmp".
   */
  @JsonCreator
  public CollectionInfo(@JsonProperty("id") final long id, 
                        @JsonProperty("module") final String module, 
                        @JsonProperty("modsubtype") final String subtype) {
    this.id = id;
    this.module = module;
    this.subtype = subtype;
  }
  
  /** @return The upstream collection ID. */
  public long id() {
    return id;
  }
  
  /** @return The module name. */
  public String module() {
    return module;
  }
  
  /** @return The module subtype. */
  public String subtype() {
    return subtype;
  }
  
  /** @return The registry name, {@code module-subtype}. */
  public String name() {
    return module + "-" + subtype;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CollectionInfo)) {
      return false;
    }
    final CollectionInfo other = (CollectionInfo) o;
    return id == other.id 
        && Objects.equals(module, other.module)
        && Objects.equals(subtype, other.subtype);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(id, module, subtype);
  }
  
  @Override
  public String toString() {
    return name() + " (" + id + ")";
  }
}
