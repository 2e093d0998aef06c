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
package net.ampy.utils;

import com.google.common.base.Strings;

/**
 * Utility class that provides helpers for dealing with timestamps and
 * human readable durations. All "now" lookups in ampy go through this class
 * so that tests can pin the clock.
 * @since 1.0
 */
public class DateTime {

  /**
   * Parses a human-readable duration (e.g, "10m", "3h", "14d") into
   * milliseconds.
   * <p>
   * Formats supported:<ul>
   * <li>{@code ms}: milliseconds</li>
   * <li>{@code s}: seconds</li>
   * <li>{@code m}: minutes</li>
   * <li>{@code h}: hours</li>
   * <li>{@code d}: days</li>
   * <li>{@code w}: weeks</li></ul>
   * @param duration The human-readable duration to parse.
   * @return A strictly positive number of milliseconds.
   * @throws IllegalArgumentException if the interval was malformed.
   */
  public static final long parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    long interval;
    long multiplier;
    int unit = 0;
    while (Character.isDigit(duration.charAt(unit))) {
      unit++;
      if (unit >= duration.length()) {
        throw new IllegalArgumentException("Invalid duration, must have an "
            + "integer and unit: " + duration);
      }
    }
    try {
      interval = Long.parseLong(duration.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): "
          + duration);
    }
    if (interval <= 0) {
      throw new IllegalArgumentException("Zero or negative duration: "
          + duration);
    }
    switch (duration.toLowerCase().charAt(duration.length() - 1)) {
      case 's':
        if (duration.length() > 1 &&
            duration.toLowerCase().charAt(duration.length() - 2) == 'm') {
          return interval;
        }
        multiplier = 1; break;                        // seconds
      case 'm': multiplier = 60; break;               // minutes
      case 'h': multiplier = 3600; break;             // hours
      case 'd': multiplier = 3600 * 24; break;        // days
      case 'w': multiplier = 3600 * 24 * 7; break;    // weeks
      default: throw new IllegalArgumentException("Invalid duration (suffix): "
          + duration);
    }
    multiplier *= 1000;
    if ((double) interval * multiplier > Long.MAX_VALUE) {
      throw new IllegalArgumentException("Duration must be < Long.MAX_VALUE ms: "
          + duration);
    }
    return interval * multiplier;
  }

  /**
   * Pass through to {@link System#currentTimeMillis()} for use in classes to
   * make unit testing easier. Mocking System.class is a bad idea in general
   * so placing this here and mocking DateTime.class is MUCH cleaner.
   * @return The current epoch time in milliseconds
   */
  public static long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  /** @return The current Unix epoch time in seconds, derived from
   * {@link #currentTimeMillis()}. */
  public static long currentTimeSeconds() {
    return currentTimeMillis() / 1000L;
  }

  /**
   * Pass through to {@link System#nanoTime()} for use in classes to
   * make unit testing easier.
   * @return The current JVM nano time.
   */
  public static long nanoTime() {
    return System.nanoTime();
  }

  /**
   * Calculates the difference between two values and returns the time in
   * milliseconds as a double.
   * @param end The end timestamp
   * @param start The start timestamp
   * @return The value in milliseconds
   * @throws IllegalArgumentException if end is less than start
   */
  public static double msFromNanoDiff(final long end, final long start) {
    if (end < start) {
      throw new IllegalArgumentException("End (" + end + ") cannot be less "
          + "than start (" + start + ")");
    }
    return ((double) end - (double) start) / 1000000;
  }

}
