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
package net.ampy.core;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.TimerTask;
import net.ampy.cache.BlockCache;
import net.ampy.cache.CacheBackend;
import net.ampy.collection.CollectionAdapter;
import net.ampy.collections.AmpIcmpAdapter;
import net.ampy.collections.RrdSmokepingAdapter;
import net.ampy.data.CollectionInfo;
import net.ampy.exceptions.SourceException;
import net.ampy.source.TimeSeriesSource;
import net.ampy.utils.Config;
import net.ampy.utils.Threads;

/**
 * Top level owner of every {@link StreamCollection}. On 
 * {@link #initialize()} it asks the upstream for its collections, builds
 * each one whose {@code module-subtype} name has a registered adapter
 * factory and starts a timer that keeps their stream indices fresh. 
 * {@link #shutdown()} stops the timer.
 * <p>
 * Adapters for "amp-icmp" and "rrd-smokeping" are registered by default.
 * 
 * @since 1.0
 */
public class CollectionRegistry implements TimerTask {
  private static final Logger LOG = 
      LoggerFactory.getLogger(CollectionRegistry.class);
  
  private final Config config;
  private final TimeSeriesSource source;
  private final CacheBackend backend;
  
  /** Adapter factories keyed on collection name. */
  private final Map<String, Function<Config, CollectionAdapter>> factories;
  
  /** Built collections keyed on collection name. */
  private final Map<String, StreamCollection> collections;
  
  /** Optional metrics for the block caches. */
  private MetricRegistry metrics;
  
  private HashedWheelTimer timer;
  
  private volatile boolean running;
  
  /**
   * Default ctor.
   * @param config The non-null config.
   * @param source The non-null upstream source.
   * @param backend The non-null cache backend shared by all collections.
   */
  public CollectionRegistry(final Config config, 
                            final TimeSeriesSource source, 
                            final CacheBackend backend) {
    this.config = Preconditions.checkNotNull(config);
    this.source = Preconditions.checkNotNull(source);
    this.backend = Preconditions.checkNotNull(backend);
    factories = new ConcurrentHashMap<String, 
        Function<Config, CollectionAdapter>>();
    collections = new ConcurrentHashMap<String, StreamCollection>();
    registerAdapter(AmpIcmpAdapter.NAME, c -> 
        new AmpIcmpAdapter(c.getInt(Config.TARGET_POINTS_KEY)));
    registerAdapter(RrdSmokepingAdapter.NAME, c -> 
        new RrdSmokepingAdapter(c.getInt(Config.TARGET_POINTS_KEY)));
  }
  
  /**
   * Registers or replaces an adapter factory. Must be called before 
   * {@link #initialize()}.
   * @param name The collection name, {@code module-subtype}.
   * @param factory The non-null factory.
   */
  public void registerAdapter(final String name, 
                              final Function<Config, CollectionAdapter> factory) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    factories.put(name, Preconditions.checkNotNull(factory));
  }
  
  /**
   * Sets a registry for block cache counters. Must be called before 
   * {@link #initialize()}.
   * @param metrics The registry.
   */
  public void setMetricRegistry(final MetricRegistry metrics) {
    this.metrics = metrics;
  }
  
  /**
   * Discovers the upstream collections, builds those with adapters, loads
   * their streams and starts the refresh timer.
   * @throws SourceException if the upstream could not be queried.
   */
  public void initialize() {
    for (final CollectionInfo info : source.requestCollections()) {
      final Function<Config, CollectionAdapter> factory = 
          factories.get(info.name());
      if (factory == null) {
        LOG.warn("No adapter registered for collection " + info 
            + ", skipping it");
        continue;
      }
      final BlockCache cache = new BlockCache(backend, info.name(), config);
      if (metrics != null) {
        cache.registerMetrics(metrics);
      }
      final StreamCollection collection = new StreamCollection(info, 
          factory.apply(config), source, cache, config);
      collections.put(info.name(), collection);
      LOG.info("Loaded collection " + info);
    }
    
    for (final StreamCollection collection : collections.values()) {
      refresh(collection);
    }
    
    running = true;
    timer = Threads.newTimer("CollectionRefresh");
    timer.newTimeout(this, config.getDuration(Config.REFRESH_INTERVAL_KEY), 
        TimeUnit.SECONDS);
  }
  
  /**
   * Fetches a collection, first bringing its streams up to date if a 
   * refresh is due.
   * @param name The collection name.
   * @return The collection or null if there is no such collection.
   * @throws SourceException if a due refresh failed.
   */
  public StreamCollection get(final String name) {
    final StreamCollection collection = collections.get(name);
    if (collection == null) {
      return null;
    }
    collection.updateStreams();
    return collection;
  }
  
  /** @return The sorted names of the loaded collections. */
  public Set<String> names() {
    return Collections.unmodifiableSet(
        new TreeSet<String>(collections.keySet()));
  }
  
  @Override
  public void run(final Timeout ignored) throws Exception {
    try {
      for (final StreamCollection collection : collections.values()) {
        refresh(collection);
      }
    } finally {
      if (running) {
        timer.newTimeout(this, 
            config.getDuration(Config.REFRESH_INTERVAL_KEY), TimeUnit.SECONDS);
      }
    }
  }
  
  @VisibleForTesting
  long pendingRefreshes() {
    return timer == null ? 0 : timer.pendingTimeouts();
  }
  
  /** Stops the refresh timer. */
  public void shutdown() {
    running = false;
    Threads.stop(timer, "CollectionRefresh");
  }
  
  private void refresh(final StreamCollection collection) {
    try {
      collection.updateStreams();
    } catch (SourceException e) {
      LOG.error("Failed to refresh streams for " + collection, e);
    } catch (RuntimeException e) {
      // one broken collection must not starve the others
      LOG.error("Unexpected failure refreshing streams for " + collection, e);
    }
  }
}
