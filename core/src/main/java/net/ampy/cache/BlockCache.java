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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import net.ampy.data.DataPoint;
import net.ampy.data.TimeRange;
import net.ampy.exceptions.CacheBackendException;
import net.ampy.utils.Config;
import net.ampy.utils.DateTime;
import net.ampy.utils.JSON;

/**
 * Translates query windows into aligned blocks and stores or fetches the 
 * points of those blocks through a {@link CacheBackend}.
 * <p>
 * Blocks are {@code binsize * block_factor} seconds long and start on a 
 * multiple of that length. Blocks close to "now" get a short TTL as data 
 * may still be arriving while older blocks get a long TTL.
 * <p>
 * Keys are built as:
 * <ul>
 * <li>Blocks: {@code <namespace>_<label>_<binsize>_<start>_<detail>}</li>
 * <li>Recent: {@code <namespace>_<label>_recent_<duration>_<detail>}</li>
 * </ul>
 * <p>
 * Backend failures never surface to callers. Failed reads are misses and
 * failed writes are dropped, both are logged at WARN.
 * 
 * @since 1.0
 */
public class BlockCache {
  private static final Logger LOG = LoggerFactory.getLogger(BlockCache.class);
  
  /** Type for deserializing cached points. */
  private static final TypeReference<List<DataPoint>> POINT_LIST = 
      new TypeReference<List<DataPoint>>() { };
  
  /** The backend to write to. */
  private final CacheBackend backend;
  
  /** Prefix for every key, usually the collection name. */
  private final String namespace;
  
  /** Number of bins per block. */
  private final int block_factor;
  
  /** TTL in seconds for blocks that may still change. */
  private final long short_ttl;
  
  /** TTL in seconds for historical blocks. */
  private final long long_ttl;
  
  /** Optional counters, null when metrics are disabled. */
  private Counter hits;
  private Counter misses;
  private Counter stores;
  private Counter tainted;
  private Counter errors;
  
  /**
   * Ctor reading the block factor and TTLs from the config.
   * @param backend A non-null backend.
   * @param namespace A non-null and non-empty key prefix.
   * @param config A non-null config.
   */
  public BlockCache(final CacheBackend backend, 
                    final String namespace, 
                    final Config config) {
    this(backend, namespace, 
        config.getInt(Config.BLOCK_FACTOR_KEY),
        config.getDuration(Config.SHORT_TTL_KEY),
        config.getDuration(Config.LONG_TTL_KEY));
  }
  
  /**
   * Default ctor.
   * @param backend A non-null backend.
   * @param namespace A non-null and non-empty key prefix.
   * @param block_factor The number of bins per block, at least 1.
   * @param short_ttl TTL in seconds for blocks near "now".
   * @param long_ttl TTL in seconds for historical blocks.
   */
  public BlockCache(final CacheBackend backend, 
                    final String namespace, 
                    final int block_factor, 
                    final long short_ttl, 
                    final long long_ttl) {
    Preconditions.checkNotNull(backend, "Backend cannot be null.");
    if (Strings.isNullOrEmpty(namespace)) {
      throw new IllegalArgumentException("Namespace cannot be null or empty.");
    }
    Preconditions.checkArgument(block_factor > 0, 
        "Block factor must be greater than zero.");
    this.backend = backend;
    this.namespace = namespace;
    this.block_factor = block_factor;
    this.short_ttl = short_ttl;
    this.long_ttl = long_ttl;
  }
  
  /**
   * Registers counters for hits, misses, stores, stores skipped for 
   * overlapping a timeout and backend errors.
   * @param registry A non-null registry.
   */
  public void registerMetrics(final MetricRegistry registry) {
    final String prefix = MetricRegistry.name("ampy.blockCache", namespace);
    hits = registry.counter(MetricRegistry.name(prefix, "hits"));
    misses = registry.counter(MetricRegistry.name(prefix, "misses"));
    stores = registry.counter(MetricRegistry.name(prefix, "stores"));
    tainted = registry.counter(MetricRegistry.name(prefix, "taintedSkips"));
    errors = registry.counter(MetricRegistry.name(prefix, "backendErrors"));
  }
  
  /**
   * Splits a window into aligned blocks. The first block starts at the 
   * window start rounded down to a block boundary, less {@code extra_blocks}
   * blocks, and blocks continue until the window end plus 
   * {@code extra_blocks} blocks is covered. No block starting after "now" 
   * is returned.
   * @param start The window start in seconds.
   * @param end The exclusive window end in seconds.
   * @param binsize The bin width in seconds.
   * @param extra_blocks Blocks to add on either side, zero or more.
   * @return The non-null, possibly empty list of blocks in ascending order.
   */
  public List<Block> getBlocks(final long start, 
                               final long end, 
                               final long binsize, 
                               final int extra_blocks) {
    Preconditions.checkArgument(binsize > 0, 
        "Binsize must be greater than zero.");
    Preconditions.checkArgument(extra_blocks >= 0, 
        "Extra blocks cannot be negative.");
    TimeRange.checkTimespan(start, end);
    
    final long blocksize = binsize * block_factor;
    final long prefetch = extra_blocks * blocksize;
    final long now = DateTime.currentTimeSeconds();
    final List<Block> blocks = new ArrayList<Block>();
    long ts = start - Math.floorMod(start, blocksize) - prefetch;
    while (ts < end + prefetch) {
      if (ts > now) {
        break;
      }
      final long block_end = ts + blocksize;
      blocks.add(new Block(ts, block_end, binsize, 
          block_end > now - blocksize ? short_ttl : long_ttl));
      ts = block_end;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Split [" + start + ", " + end + ") at binsize " + binsize 
          + " into " + blocks.size() + " blocks");
    }
    return blocks;
  }
  
  /**
   * Looks up every block for a label. Runs of consecutive missing blocks are
   * merged into a single range so they can be fetched with one request.
   * @param blocks The non-null blocks in ascending order.
   * @param label The non-null label.
   * @param binsize The bin width in seconds.
   * @param detail The detail level.
   * @return The non-null search result.
   */
  public BlockSearch searchBlocks(final List<Block> blocks, 
                                  final String label, 
                                  final long binsize, 
                                  final String detail) {
    Preconditions.checkNotNull(blocks, "Blocks cannot be null.");
    final List<TimeRange> missing = new ArrayList<TimeRange>();
    final Map<Long, List<DataPoint>> cached = 
        new HashMap<Long, List<DataPoint>>();
    long run_start = -1;
    long run_end = -1;
    boolean in_run = false;
    for (final Block block : blocks) {
      final List<DataPoint> points = fetch(
          blockKey(label, binsize, block.start(), detail));
      if (points != null) {
        cached.put(block.start(), points);
        increment(hits);
        continue;
      }
      increment(misses);
      if (in_run && block.start() == run_end) {
        run_end = block.end();
        continue;
      }
      if (in_run) {
        missing.add(new TimeRange(run_start, run_end));
      }
      run_start = block.start();
      run_end = block.end();
      in_run = true;
    }
    if (in_run) {
      missing.add(new TimeRange(run_start, run_end));
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Label " + label + " has " + cached.size() + " of " 
          + blocks.size() + " blocks cached, missing " + missing);
    }
    return new BlockSearch(missing, cached);
  }
  
  /**
   * Stores the points for a block unless the block overlaps one of the 
   * ranges the upstream reported as timed out for the label.
   * @param block The non-null block.
   * @param points The non-null points.
   * @param label The non-null label.
   * @param detail The detail level.
   * @param failed An optional list of timed out ranges, inclusive of their 
   * ends.
   * @return True if the block was handed to the backend, false if skipped.
   */
  public boolean storeBlock(final Block block, 
                            final List<DataPoint> points, 
                            final String label, 
                            final String detail, 
                            final List<TimeRange> failed) {
    Preconditions.checkNotNull(block, "Block cannot be null.");
    Preconditions.checkNotNull(points, "Points cannot be null.");
    if (failed != null) {
      for (final TimeRange range : failed) {
        if (range.overlaps(block.start(), block.end())) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Not caching block " + block + " for " + label 
                + " as it overlaps timed out range " + range);
          }
          increment(tainted);
          return false;
        }
      }
    }
    store(blockKey(label, block.binsize(), block.start(), detail), points, 
        block.ttl());
    return true;
  }
  
  /**
   * @param label The non-null label.
   * @param duration The recent duration in seconds.
   * @param detail The detail level.
   * @return The cached points or null if missing.
   */
  public List<DataPoint> searchRecent(final String label, 
                                      final long duration, 
                                      final String detail) {
    final List<DataPoint> points = fetch(recentKey(label, duration, detail));
    increment(points == null ? misses : hits);
    return points;
  }
  
  /**
   * Stores a recent summary with a TTL from {@link #recentTtl(long)}.
   * @param label The non-null label.
   * @param duration The recent duration in seconds.
   * @param detail The detail level.
   * @param points The non-null points.
   */
  public void storeRecent(final String label, 
                          final long duration, 
                          final String detail, 
                          final List<DataPoint> points) {
    Preconditions.checkNotNull(points, "Points cannot be null.");
    store(recentKey(label, duration, detail), points, recentTtl(duration));
  }
  
  /**
   * Picks a TTL for a recent summary. Longer summaries change less so they
   * are kept longer.
   * @param duration The recent duration in seconds.
   * @return The TTL in seconds.
   */
  public static long recentTtl(final long duration) {
    if (duration <= 600) {
      return 60;
    }
    if (duration <= 3600) {
      return 300;
    }
    if (duration <= 86400) {
      return 1800;
    }
    if (duration <= 86400 * 7) {
      return 10800;
    }
    return 21600;
  }
  
  /** @return The number of bins per block. */
  public int blockFactor() {
    return block_factor;
  }
  
  @VisibleForTesting
  String blockKey(final String label, 
                  final long binsize, 
                  final long start, 
                  final String detail) {
    return new StringBuilder()
        .append(namespace)
        .append("_")
        .append(label)
        .append("_")
        .append(binsize)
        .append("_")
        .append(start)
        .append("_")
        .append(detail)
        .toString();
  }
  
  @VisibleForTesting
  String recentKey(final String label, 
                   final long duration, 
                   final String detail) {
    return new StringBuilder()
        .append(namespace)
        .append("_")
        .append(label)
        .append("_recent_")
        .append(duration)
        .append("_")
        .append(detail)
        .toString();
  }
  
  private List<DataPoint> fetch(final String key) {
    final byte[] raw;
    try {
      raw = backend.get(key);
    } catch (CacheBackendException e) {
      LOG.warn("Failed to fetch " + key + " from the cache backend", e);
      increment(errors);
      return null;
    }
    if (raw == null) {
      return null;
    }
    try {
      return JSON.parseToObject(raw, POINT_LIST);
    } catch (RuntimeException e) {
      LOG.warn("Discarding unreadable cache entry " + key, e);
      increment(errors);
      return null;
    }
  }
  
  private void store(final String key, 
                     final List<DataPoint> points, 
                     final long ttl) {
    try {
      backend.set(key, JSON.serializeToBytes(points), ttl);
      increment(stores);
    } catch (CacheBackendException e) {
      LOG.warn("Failed to store " + key + " in the cache backend", e);
      increment(errors);
    }
  }
  
  private static void increment(final Counter counter) {
    if (counter != null) {
      counter.inc();
    }
  }
}
