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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The aggregated values of a single bin for a label. The two time fields
 * are always present; everything else is collection specific (e.g. a
 * median latency and a loss count for ICMP) and lives in a loosely typed,
 * insertion ordered value map so that it survives a round trip through the
 * cache unchanged.
 * <p>
 * A point without any values is a <i>gap</i>: it tells a renderer that no
 * measurement exists for the bin starting at {@link #binstart()}.
 * <p>
 * <b>Note:</b> Points are mutable while a collection formats them. Once a
 * point has been placed in a block it should be treated as read only.
 * 
 * @since 1.0
 */
@JsonPropertyOrder({ "binstart", "timestamp" })
public class DataPoint {

  /** The start of the bin this point belongs to, Unix epoch seconds. */
  private long binstart;

  /** The timestamp of the measurement, Unix epoch seconds. */
  private long timestamp;

  /** Measurement fields, empty for a gap. */
  private final Map<String, Object> values;

  /**
   * Empty ctor for Jackson.
   */
  public DataPoint() {
    values = new LinkedHashMap<String, Object>();
  }

  /**
   * Ctor setting the times.
   * @param binstart The start of the bin.
   * @param timestamp The measurement timestamp.
   */
  public DataPoint(final long binstart, final long timestamp) {
    this();
    this.binstart = binstart;
    this.timestamp = timestamp;
  }

  /**
   * Creates a gap marker.
   * @param timestamp The start of the missing bin, also used as the 
   * timestamp.
   * @return A point with no measurement fields.
   */
  public static DataPoint gap(final long timestamp) {
    return new DataPoint(timestamp, timestamp);
  }

  /** @return The start of the bin in seconds. */
  @JsonProperty("binstart")
  public long binstart() {
    return binstart;
  }

  /** @return The measurement timestamp in seconds. */
  @JsonProperty("timestamp")
  public long timestamp() {
    return timestamp;
  }

  /** @param binstart The bin start to set. */
  @JsonProperty("binstart")
  public void setBinstart(final long binstart) {
    this.binstart = binstart;
  }

  /** @param timestamp The timestamp to set. */
  @JsonProperty("timestamp")
  public void setTimestamp(final long timestamp) {
    this.timestamp = timestamp;
  }

  /** @return An unmodifiable view of the measurement fields. */
  @JsonAnyGetter
  public Map<String, Object> values() {
    return Collections.unmodifiableMap(values);
  }

  /**
   * Sets or replaces a measurement field.
   * @param field The non-null field name.
   * @param value The value, may be null.
   * @return The point for chaining.
   */
  public DataPoint set(final String field, final Object value) {
    values.put(field, value);
    return this;
  }

  @JsonAnySetter
  private void setAny(final String field, final Object value) {
    values.put(field, value);
  }
  
  /**
   * @param field The field to look up.
   * @return The value or null if the field wasn't present.
   */
  public Object get(final String field) {
    return values.get(field);
  }

  /**
   * Removes a measurement field.
   * @param field The field to drop.
   * @return The previous value if present, null if not.
   */
  public Object remove(final String field) {
    return values.remove(field);
  }

  /** @return True if the point carries no measurement fields. */
  @JsonIgnore
  public boolean isGap() {
    return values.isEmpty();
  }

  /** @return A shallow copy of this point. */
  public DataPoint copy() {
    final DataPoint copy = new DataPoint(binstart, timestamp);
    copy.values.putAll(values);
    return copy;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DataPoint)) {
      return false;
    }
    final DataPoint other = (DataPoint) o;
    return binstart == other.binstart 
        && timestamp == other.timestamp
        && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(binstart, timestamp, values);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("binstart=")
        .append(binstart)
        .append(", timestamp=")
        .append(timestamp)
        .append(", values=")
        .append(values)
        .toString();
  }
}
