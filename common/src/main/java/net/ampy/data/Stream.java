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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * An atomic measurement series as reported by the upstream store. The
 * properties are the flat record the upstream sends minus the bookkeeping
 * fields, so for an ICMP test they would be something like 
 * {@code source, destination, packet_size, family}.
 * 
 * @since 1.0
 */
public class Stream {
  /** Upstream field carrying the stream ID. */
  public static final String STREAM_ID = "stream_id";
  
  /** Upstream field carrying the first measurement time. */
  public static final String FIRST_TIMESTAMP = "firsttimestamp";
  
  /** Upstream field carrying the most recent measurement time. */
  public static final String LAST_TIMESTAMP = "lasttimestamp";
  
  /** The unique stream ID. */
  private final long id;
  
  /** Descriptive properties, never null. */
  private final Map<String, Object> properties;
  
  /** First time data was seen in seconds, 0 if never. */
  private final long first_timestamp;
  
  /** Last time data was seen in seconds, 0 if never. */
  private final long last_timestamp;
  
  /**
   * Default ctor.
   * @param id The stream ID.
   * @param properties A non-null map of properties. Copied.
   * @param first_timestamp First measurement time in seconds.
   * @param last_timestamp Last measurement time in seconds.
   */
  public Stream(final long id, 
                final Map<String, Object> properties, 
                final long first_timestamp, 
                final long last_timestamp) {
    Preconditions.checkNotNull(properties, "Properties cannot be null.");
    this.id = id;
    this.properties = Collections.unmodifiableMap(
        new LinkedHashMap<String, Object>(properties));
    this.first_timestamp = first_timestamp;
    this.last_timestamp = last_timestamp;
  }
  
  /**
   * Builds a stream from a raw upstream record, stripping the ID and 
   * timestamp fields out of the properties.
   * @param record The non-null record.
   * @return The stream.
   * @throws IllegalArgumentException if the record lacks a numeric stream ID.
   */
  public static Stream fromRecord(final Map<String, Object> record) {
    Preconditions.checkNotNull(record, "Record cannot be null.");
    final Object id = record.get(STREAM_ID);
    checkArgument(id instanceof Number, 
        "Stream record is missing a numeric " + STREAM_ID + ": %s", record);
    final Map<String, Object> properties = 
        new LinkedHashMap<String, Object>(record);
    properties.remove(STREAM_ID);
    properties.remove(FIRST_TIMESTAMP);
    properties.remove(LAST_TIMESTAMP);
    return new Stream(((Number) id).longValue(), properties, 
        asLong(record.get(FIRST_TIMESTAMP)), 
        asLong(record.get(LAST_TIMESTAMP)));
  }
  
  /** @return The stream ID. */
  public long id() {
    return id;
  }
  
  /** @return The unmodifiable properties. */
  public Map<String, Object> properties() {
    return properties;
  }
  
  /**
   * @param key The property to fetch.
   * @return The value or null if not present.
   */
  public Object property(final String key) {
    return properties.get(key);
  }
  
  /** @return The first measurement time in seconds. */
  public long firstTimestamp() {
    return first_timestamp;
  }
  
  /** @return The last measurement time in seconds. */
  public long lastTimestamp() {
    return last_timestamp;
  }
  
  /**
   * Returns a copy of this stream with a property added or replaced.
   * @param key The property key.
   * @param value The property value.
   * @return A new stream.
   */
  public Stream withProperty(final String key, final Object value) {
    final Map<String, Object> copy = 
        new LinkedHashMap<String, Object>(properties);
    copy.put(key, value);
    return new Stream(id, copy, first_timestamp, last_timestamp);
  }
  
  static long asLong(final Object value) {
    if (value == null) {
      return 0;
    }
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    try {
      return (long) Double.parseDouble(value.toString());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a timestamp: " + value, e);
    }
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Stream)) {
      return false;
    }
    final Stream other = (Stream) o;
    return id == other.id 
        && first_timestamp == other.first_timestamp
        && last_timestamp == other.last_timestamp
        && properties.equals(other.properties);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(id, properties, first_timestamp, last_timestamp);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("id=")
        .append(id)
        .append(", properties=")
        .append(properties)
        .append(", first=")
        .append(first_timestamp)
        .append(", last=")
        .append(last_timestamp)
        .toString();
  }
}
