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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * A named aggregate of one or more stream IDs that is rendered as a single
 * series. Labels are computed from group descriptions on demand and never
 * persisted.
 * 
 * @since 1.0
 */
public class Label {

  /** The unique label string, used in cache keys and upstream requests. */
  private final String label;
  
  /** The stream IDs making up this label. */
  private final List<Long> streams;
  
  /** A short human readable name for legends. */
  private final String short_label;
  
  /**
   * Default ctor.
   * @param label A non-null and non-empty label string.
   * @param streams A non-null list of stream IDs, may be empty.
   * @param short_label An optional short label, defaults to the label.
   */
  public Label(final String label, 
               final List<Long> streams, 
               final String short_label) {
    if (Strings.isNullOrEmpty(label)) {
      throw new IllegalArgumentException("Label cannot be null or empty.");
    }
    Preconditions.checkNotNull(streams, "Streams cannot be null.");
    this.label = label;
    this.streams = ImmutableList.copyOf(streams);
    this.short_label = Strings.isNullOrEmpty(short_label) ? label : short_label;
  }
  
  /**
   * Ctor for labels without a separate short name.
   * @param label A non-null and non-empty label string.
   * @param streams A non-null list of stream IDs.
   */
  public Label(final String label, final List<Long> streams) {
    this(label, streams, null);
  }
  
  /** @return The label string. */
  public String label() {
    return label;
  }
  
  /** @return The immutable stream ID list. */
  public List<Long> streams() {
    return streams;
  }
  
  /** @return The short label. */
  public String shortLabel() {
    return short_label;
  }
  
  /**
   * @param streams The replacement stream list.
   * @return A copy of this label with different streams.
   */
  public Label withStreams(final List<Long> streams) {
    return new Label(label, 
        streams == null ? Collections.<Long>emptyList() : streams, 
        short_label);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Label)) {
      return false;
    }
    final Label other = (Label) o;
    return label.equals(other.label) 
        && streams.equals(other.streams)
        && short_label.equals(other.short_label);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(label, streams, short_label);
  }
  
  @Override
  public String toString() {
    return label + " (" + short_label + ") " + streams;
  }
}
