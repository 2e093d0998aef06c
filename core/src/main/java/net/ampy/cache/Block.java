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
package net.ampy.cache;

import java.util.Objects;

/**
 * A fixed size, aligned span of bins that is cached as a unit. The range is
 * half open, {@code [start, end)}.
 * 
 * @since 1.0
 */
public class Block {
  private final long start;
  private final long end;
  private final long binsize;
  private final long ttl;
  
  /**
   * Default ctor.
   * @param start The aligned start in seconds.
   * @param end The exclusive end in seconds.
   * @param binsize The bin width in seconds.
   * @param ttl How long to cache the block for, in seconds.
   */
  public Block(final long start, 
               final long end, 
               final long binsize, 
               final long ttl) {
    this.start = start;
    this.end = end;
    this.binsize = binsize;
    this.ttl = ttl;
  }
  
  /** @return The aligned start in seconds. */
  public long start() {
    return start;
  }
  
  /** @return The exclusive end in seconds. */
  public long end() {
    return end;
  }
  
  /** @return The bin width in seconds. */
  public long binsize() {
    return binsize;
  }
  
  /** @return The cache TTL in seconds. */
  public long ttl() {
    return ttl;
  }
  
  /** @return The number of bins in the block. */
  public long bins() {
    return (end - start) / binsize;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Block)) {
      return false;
    }
    final Block other = (Block) o;
    return start == other.start 
        && end == other.end 
        && binsize == other.binsize
        && ttl == other.ttl;
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(start, end, binsize, ttl);
  }
  
  @Override
  public String toString() {
    return "[" + start + ", " + end + ") binsize=" + binsize + " ttl=" + ttl;
  }
}
