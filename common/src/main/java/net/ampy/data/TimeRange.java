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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An immutable span of Unix epoch seconds. Whether the end is inclusive
 * depends on the producer: blocks and missing block ranges are half open,
 * {@code [start, end)}, while ranges reported by the upstream as timed out
 * are inclusive of their end, mirroring the inclusive end sent in the query.
 * 
 * @since 1.0
 */
public class TimeRange implements Comparable<TimeRange> {

  /** The start timestamp in seconds. */
  private final long start;

  /** The end timestamp in seconds. */
  private final long end;

  /**
   * Default ctor.
   * @param start The start timestamp in seconds.
   * @param end The end timestamp in seconds, must be >= the start.
   * @throws IllegalArgumentException if the end is before the start.
   */
  @JsonCreator
  public TimeRange(@JsonProperty("start") final long start, 
                   @JsonProperty("end") final long end) {
    checkTimespan(start, end);
    this.start = start;
    this.end = end;
  }

  /**
   * Validates that a timespan is not negative.
   * @param start The start timestamp.
   * @param end The end timestamp.
   * @throws IllegalArgumentException if end is less than start.
   */
  public static void checkTimespan(final long start, final long end) {
    checkArgument(end >= start,
        "The end timestamp cannot be less than the start timestamp. "
        + "End %s, Start %s", end, start);
  }

  /** @return The start timestamp in seconds. */
  @JsonProperty("start")
  public long start() {
    return start;
  }

  /** @return The end timestamp in seconds. */
  @JsonProperty("end")
  public long end() {
    return end;
  }

  /**
   * Whether or not this range, treated as inclusive of its end, overlaps the
   * half open span {@code [other_start, other_end)}.
   * @param other_start The start of the other span.
   * @param other_end The exclusive end of the other span.
   * @return True if any second is shared.
   */
  public boolean overlaps(final long other_start, final long other_end) {
    return start < other_end && end >= other_start;
  }

  @Override
  public int compareTo(final TimeRange other) {
    if (start != other.start) {
      return Long.compare(start, other.start);
    }
    return Long.compare(end, other.end);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeRange)) {
      return false;
    }
    final TimeRange other = (TimeRange) o;
    return start == other.start && end == other.end;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("[")
        .append(start)
        .append(", ")
        .append(end)
        .append("]")
        .toString();
  }
}
