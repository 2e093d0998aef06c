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
package net.ampy.stats;

import static com.google.common.base.Preconditions.checkNotNull;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheStats;

/**
 * A metrics gauge exposing one figure from the stats of a Guava cache 
 * built with {@code recordStats()}.
 */
public class CacheStatsGauge implements Gauge<Number> {
  
  /** The figures we report, each with its metric name. */
  public enum Stat {
    HIT_RATE("hitRate"),
    MISS_RATE("missRate"),
    REQUESTS("requestCount"),
    EVICTIONS("evictionCount");
    
    private final String metric;
    
    Stat(final String metric) {
      this.metric = metric;
    }
    
    /** @return The metric name suffix. */
    public String metric() {
      return metric;
    }
  }
  
  private final Cache<?, ?> cache;
  private final Stat stat;

  /**
   * Default ctor.
   * @param cache A non-null cache.
   * @param stat A non-null figure to report.
   */
  public CacheStatsGauge(final Cache<?, ?> cache, final Stat stat) {
    this.cache = checkNotNull(cache);
    this.stat = checkNotNull(stat);
  }

  @Override
  public Number getValue() {
    final CacheStats stats = cache.stats();
    switch (stat) {
    case HIT_RATE:
      return stats.hitRate();
    case MISS_RATE:
      return stats.missRate();
    case REQUESTS:
      return stats.requestCount();
    case EVICTIONS:
      return stats.evictionCount();
    default:
      throw new IllegalStateException("Unhandled stat: " + stat);
    }
  }
  
  /**
   * Registers a gauge for every {@link Stat} under the prefix.
   * @param registry A non-null registry.
   * @param prefix The metric name prefix.
   * @param cache A non-null cache.
   */
  public static void registerAll(final MetricRegistry registry, 
                                 final String prefix,
                                 final Cache<?, ?> cache) {
    for (final Stat stat : Stat.values()) {
      registry.register(MetricRegistry.name(prefix, stat.metric()), 
          new CacheStatsGauge(cache, stat));
    }
  }
}
