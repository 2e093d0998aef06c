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

/**
 * A simple expiring key/value store, local or distributed, that the block
 * cache writes serialized points into.
 * <p>
 * Implementations may throw {@link net.ampy.exceptions.CacheBackendException}
 * from any call. Callers treat it as a miss or a dropped write.
 * 
 * @since 1.0
 */
public interface CacheBackend {

  /**
   * @param key A non-null and non-empty key.
   * @return The cached value or null if it was missing or expired.
   */
  public byte[] get(final String key);
  
  /**
   * Writes a value, replacing any existing one.
   * @param key A non-null and non-empty key.
   * @param value A non-null value.
   * @param ttl_seconds How long the value should live, in seconds.
   */
  public void set(final String key, final byte[] value, final long ttl_seconds);
  
}
