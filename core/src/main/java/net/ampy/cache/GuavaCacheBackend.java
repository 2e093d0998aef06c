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

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalListener;
import com.google.common.cache.RemovalNotification;

import net.ampy.stats.CacheStatsGauge;
import net.ampy.utils.Config;
import net.ampy.utils.DateTime;

/**
 * A very simple on-heap, in-memory LRU cache backend using the Guava 
 * {@link Cache} class for a configurable object limit and thread safety.
 * <p>
 * Each value is wrapped with an expiration computed at write time. A value
 * read after it expired is kicked out of the cache and reported as a miss.
 * <p>
 * <b>Note:</b> There is a race between a reader invalidating an expired 
 * value and a writer storing a fresh one under the same key, in which case
 * the fresh value may be dropped. The block cache tolerates lost writes so
 * this is only a performance concern.
 * <p>
 * The backend also tracks the number of value bytes stored (not counting
 * Guava overhead or keys) and refuses writes that would exceed the size 
 * limit until evictions free some space.
 * 
 * @since 1.0
 */
public class GuavaCacheBackend implements CacheBackend {
  private static final Logger LOG = 
      LoggerFactory.getLogger(GuavaCacheBackend.class);
  
  /** A counter used to track how many bytes are in the cache. */
  private final AtomicLong size;
  
  /** A counter to track how many values have been expired out of the cache. */
  private final AtomicLong expired;
  
  /** The Guava cache implementation. */
  private final Cache<String, ExpiringValue> cache;
  
  /** The configured sized limit. */
  private final long size_limit;
  
  /** The configured maximum number of objects. */
  private final int max_objects;
  
  /**
   * Ctor reading the limits from the config.
   * @param config A non-null config.
   */
  public GuavaCacheBackend(final Config config) {
    this(config.getInt(Config.LRU_OBJECTS_KEY), 
         config.getLong(Config.LRU_SIZE_KEY));
  }
  
  /**
   * Default ctor.
   * @param max_objects The maximum number of values to hold.
   * @param size_limit The maximum number of value bytes to hold.
   */
  public GuavaCacheBackend(final int max_objects, final long size_limit) {
    Preconditions.checkArgument(max_objects > 0, 
        "Max objects must be greater than zero.");
    Preconditions.checkArgument(size_limit > 0, 
        "Size limit must be greater than zero.");
    size = new AtomicLong();
    expired = new AtomicLong();
    this.max_objects = max_objects;
    this.size_limit = size_limit;
    cache = CacheBuilder.newBuilder()
        .maximumSize(max_objects)
        .removalListener(new Decrementer())
        .recordStats()
        .build();
  }
  
  @Override
  public byte[] get(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final ExpiringValue value = cache.getIfPresent(key);
    if (value == null) {
      return null;
    }
    if (value.expired()) {
      cache.invalidate(key);
      expired.incrementAndGet();
      return null;
    }
    return value.value;
  }
  
  @Override
  public void set(final String key, final byte[] value, final long ttl_seconds) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (value == null) {
      throw new IllegalArgumentException("Value cannot be null.");
    }
    if (ttl_seconds < 0) {
      return;
    }
    
    // best effort
    if (size.get() + value.length >= size_limit) {
      // expired values are otherwise only reclaimed when read
      purgeExpired();
    }
    if (size.get() + value.length >= size_limit) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Will not cache key [" + key + "] due to size limit.");
      }
      return;
    }
    cache.put(key, new ExpiringValue(value, ttl_seconds));
    size.addAndGet(value.length);
  }
  
  /**
   * Drops every expired value from the cache.
   * @return The number of values dropped.
   */
  public int purgeExpired() {
    int purged = 0;
    final Map<String, ExpiringValue> map = cache.asMap();
    for (final Map.Entry<String, ExpiringValue> entry : map.entrySet()) {
      if (entry.getValue().expired() && 
          map.remove(entry.getKey(), entry.getValue())) {
        purged++;
      }
    }
    if (purged > 0) {
      expired.addAndGet(purged);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Purged " + purged + " expired values from the cache.");
      }
    }
    return purged;
  }
  
  /**
   * Registers the Guava stats gauges plus expiration and size gauges.
   * @param registry A non-null registry.
   * @param prefix The metric name prefix, e.g. "ampy.cache".
   */
  public void registerMetrics(final MetricRegistry registry, 
                              final String prefix) {
    CacheStatsGauge.registerAll(registry, prefix, cache);
    registry.register(MetricRegistry.name(prefix, "expiredCount"), 
        new Gauge<Long>() {
          @Override
          public Long getValue() {
            return expired.get();
          }
        });
    registry.register(MetricRegistry.name(prefix, "bytesStored"), 
        new Gauge<Long>() {
          @Override
          public Long getValue() {
            return size.get();
          }
        });
  }
  
  @VisibleForTesting
  Cache<String, ExpiringValue> cache() {
    return cache;
  }
  
  @VisibleForTesting
  long bytesStored() {
    return size.get();
  }
  
  @VisibleForTesting
  long sizeLimit() {
    return size_limit;
  }
  
  @VisibleForTesting
  int maxObjects() {
    return max_objects;
  }
  
  @VisibleForTesting
  long expired() {
    return expired.get();
  }
  
  /** Super simple listener that decrements our size counter. */
  private class Decrementer implements 
      RemovalListener<String, ExpiringValue> {
    @Override
    public void onRemoval(
        final RemovalNotification<String, ExpiringValue> notification) {
      if (notification.getValue() != null) {
        size.addAndGet(-notification.getValue().value.length);
      }
    }
  }
  
  /** Wrapper around a value that stores the expiration timestamp. */
  static class ExpiringValue {
    /** The value stored in the cache. */
    private final byte[] value;
    
    /** The expiration timestamp in JVM nanos, 0 to never expire. */
    private final long expires;
    
    /**
     * Default ctor.
     * @param value A non-null value.
     * @param ttl_seconds The time to live in seconds, 0 for no expiry.
     */
    ExpiringValue(final byte[] value, final long ttl_seconds) {
      this.value = value;
      expires = ttl_seconds == 0 ? 0 : 
        DateTime.nanoTime() + (ttl_seconds * 1000L * 1000L * 1000L);
    }
    
    /** @return Whether or not the value has expired. */
    boolean expired() {
      return expires == 0 ? false : DateTime.nanoTime() > expires;
    }
    
    @Override
    public String toString() {
      return new StringBuilder()
          .append("{length=")
          .append(value.length)
          .append(", expires=")
          .append(expires)
          .append("}")
          .toString();
    }
  }
}
