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
package net.ampy.query;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import net.ampy.cache.Block;
import net.ampy.cache.BlockCache;
import net.ampy.cache.BlockSearch;
import net.ampy.collection.CollectionAdapter;
import net.ampy.data.DataPoint;
import net.ampy.data.Label;
import net.ampy.data.LabelHistory;
import net.ampy.data.TimeRange;
import net.ampy.meta.StreamIndex;
import net.ampy.source.TimeSeriesSource;
import net.ampy.utils.DateTime;

/**
 * Builds complete, one point per bin series for a set of labels by merging
 * cached blocks with data fetched from the upstream store.
 * <p>
 * For a history request:
 * <ol>
 * <li>The window is split into aligned blocks.</li>
 * <li>Each label's blocks are looked up in the cache. Missing runs are 
 * coalesced into ranges.</li>
 * <li>Labels missing the same range share a single upstream request, so 
 * there is one call per distinct range.</li>
 * <li>Each missing block is reconciled from the fetched points, filling 
 * gaps, then written back to the cache unless the upstream timed out on 
 * part of it.</li>
 * </ol>
 * A {@link net.ampy.exceptions.SourceException} from the upstream aborts 
 * the whole request before anything is cached.
 * <p>
 * When more than one measurement lands in the same bin the first one wins
 * and the rest are dropped. Aggregating them is the upstream's job.
 * 
 * @since 1.0
 */
public class SeriesReconciler {
  private static final Logger LOG = 
      LoggerFactory.getLogger(SeriesReconciler.class);
  
  private final long collection_id;
  private final CollectionAdapter adapter;
  private final StreamIndex index;
  private final BlockCache cache;
  private final TimeSeriesSource source;
  
  /**
   * Default ctor.
   * @param collection_id The upstream collection ID.
   * @param adapter The non-null collection adapter.
   * @param index The non-null stream index of the collection.
   * @param cache The non-null block cache of the collection.
   * @param source The non-null upstream source.
   */
  public SeriesReconciler(final long collection_id,
                          final CollectionAdapter adapter, 
                          final StreamIndex index, 
                          final BlockCache cache, 
                          final TimeSeriesSource source) {
    this.collection_id = collection_id;
    this.adapter = Preconditions.checkNotNull(adapter);
    this.index = Preconditions.checkNotNull(index);
    this.cache = Preconditions.checkNotNull(cache);
    this.source = Preconditions.checkNotNull(source);
  }
  
  /**
   * Fetches history, gap filling timed out ranges.
   * @see #assembleHistory(List, long, long, long, String, boolean)
   */
  public HistoryResult assembleHistory(final List<Label> labels, 
                                       final long start, 
                                       final long end, 
                                       final long binsize, 
                                       final String detail) {
    return assembleHistory(labels, start, end, binsize, detail, false);
  }
  
  /**
   * Fetches a gap filled series per label for the window.
   * @param labels The non-null labels to fetch.
   * @param start The window start in seconds.
   * @param end The exclusive window end in seconds.
   * @param binsize The bin width in seconds, zero or less to let the 
   * collection pick one.
   * @param detail The detail level.
   * @param omit_timed_out When true, blocks overlapping a range the upstream
   * timed out on are left out of the series instead of being gap filled.
   * @return The non-null result.
   * @throws net.ampy.exceptions.SourceException if the upstream failed.
   */
  public HistoryResult assembleHistory(final List<Label> labels, 
                                       final long start, 
                                       final long end, 
                                       final long binsize, 
                                       final String detail,
                                       final boolean omit_timed_out) {
    Preconditions.checkNotNull(labels, "Labels cannot be null.");
    TimeRange.checkTimespan(start, end);
    final long bin = binsize > 0 ? binsize : 
      adapter.calculateBinsize(start, end, detail);
    
    final List<Block> blocks = cache.getBlocks(start, end, bin, 
        adapter.extraBlocks(detail));
    final Map<String, List<DataPoint>> series = 
        new LinkedHashMap<String, List<DataPoint>>();
    final Map<String, List<TimeRange>> timed_out = 
        new LinkedHashMap<String, List<TimeRange>>();
    if (blocks.isEmpty()) {
      for (final Label label : labels) {
        series.put(label.label(), new ArrayList<DataPoint>());
      }
      return new HistoryResult(bin, series, timed_out);
    }
    final long window_start = blocks.get(0).start();
    final long window_end = blocks.get(blocks.size() - 1).end();
    
    // sorted so that each label's ranges are fetched in ascending order
    final Map<TimeRange, Map<String, List<Long>>> wanted = 
        new TreeMap<TimeRange, Map<String, List<Long>>>();
    final Map<String, BlockSearch> searches = 
        new HashMap<String, BlockSearch>();
    for (final Label label : labels) {
      final BlockSearch search = cache.searchBlocks(blocks, label.label(), 
          bin, detail);
      searches.put(label.label(), search);
      if (search.missing().isEmpty()) {
        continue;
      }
      
      final List<Long> active = index.filterActive(label.streams(), 
          window_start, window_end);
      if (active.isEmpty()) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("No active streams for " + label.label() 
              + ", gap filling without a query");
        }
        continue;
      }
      for (final TimeRange range : search.missing()) {
        Map<String, List<Long>> group = wanted.get(range);
        if (group == null) {
          group = new LinkedHashMap<String, List<Long>>();
          wanted.put(range, group);
        }
        group.put(label.label(), active);
      }
    }
    
    final Map<String, LabelHistory> fetched = 
        new HashMap<String, LabelHistory>();
    for (final Map.Entry<TimeRange, Map<String, List<Long>>> entry : 
        wanted.entrySet()) {
      final TimeRange range = entry.getKey();
      if (LOG.isDebugEnabled()) {
        LOG.debug("Fetching " + range + " for labels " 
            + entry.getValue().keySet() + " from collection " + adapter.name());
      }
      final Map<String, LabelHistory> response = 
          source.requestAggregateHistory(collection_id, entry.getValue(), 
              range.start(), range.end() - 1, bin, 
              adapter.detailColumns(detail), adapter.groupColumns(detail));
      for (final Map.Entry<String, LabelHistory> history : 
          response.entrySet()) {
        LabelHistory merged = fetched.get(history.getKey());
        if (merged == null) {
          merged = new LabelHistory();
          fetched.put(history.getKey(), merged);
        }
        merged.merge(history.getValue());
      }
    }
    
    for (final Label label : labels) {
      final BlockSearch search = searches.get(label.label());
      final LabelHistory history = fetched.get(label.label());
      final long frequency = history == null ? 0 : history.frequency();
      final List<TimeRange> failed = history == null ? 
          Collections.<TimeRange>emptyList() : history.timedOut();
      if (!failed.isEmpty()) {
        LOG.warn("Upstream timed out fetching " + failed + " for label " 
            + label.label() + " of " + adapter.name());
        timed_out.put(label.label(), new ArrayList<TimeRange>(failed));
      }
      
      final Deque<DataPoint> queued = history == null ? 
          new ArrayDeque<DataPoint>() : 
            new ArrayDeque<DataPoint>(history.points());
      final List<DataPoint> points = new ArrayList<DataPoint>();
      for (final Block block : blocks) {
        final List<DataPoint> cached = search.cached().get(block.start());
        final List<DataPoint> block_points = reconcileBlock(block, cached, 
            queued, frequency, detail);
        if (cached == null) {
          if (!cache.storeBlock(block, block_points, label.label(), detail, 
              failed) && omit_timed_out) {
            continue;
          }
        }
        points.addAll(block_points);
      }
      series.put(label.label(), points);
    }
    return new HistoryResult(bin, series, timed_out);
  }
  
  /**
   * Produces the points of a single block. Cached points are returned as 
   * is. Otherwise the block is walked from its start in steps of the larger
   * of the measurement frequency and the binsize, consuming queued points 
   * that fall into the current step and inserting gaps where none do. When 
   * the frequency is the larger, points are matched on their own timestamp
   * and given the step start as their bin start, otherwise they are matched
   * on the bin start the upstream computed. Points before the current step
   * are duplicates for an already filled bin and are dropped. The first 
   * step of a block always yields a point, a gap if nothing matched, so 
   * renderers break the line between a missing block and its predecessor.
   * The walk stops at the block end or "now", whichever is first.
   * @param block The non-null block.
   * @param cached The cached points for the block or null if not cached.
   * @param queued Ascending points fetched from the upstream. Points used 
   * by this block are removed.
   * @param frequency The measurement frequency in seconds, 0 if unknown.
   * @param detail The detail level.
   * @return The non-null list of points.
   */
  public List<DataPoint> reconcileBlock(final Block block, 
                                        final List<DataPoint> cached, 
                                        final Deque<DataPoint> queued, 
                                        final long frequency, 
                                        final String detail) {
    if (cached != null) {
      return cached;
    }
    final boolean match_timestamp = frequency > block.binsize();
    final long step = match_timestamp ? frequency : block.binsize();
    final List<DataPoint> points = new ArrayList<DataPoint>();
    if (step < 1) {
      return points;
    }
    
    final long now = DateTime.currentTimeSeconds();
    long ts = block.start();
    while (ts < block.end()) {
      if (ts > now) {
        break;
      }
      
      final DataPoint datum;
      if (queued.isEmpty()) {
        if (block.end() - ts < step && !points.isEmpty()) {
          break;
        }
        datum = DataPoint.gap(ts);
        ts += step;
      } else {
        final DataPoint head = queued.peekFirst();
        final long next = match_timestamp ? head.timestamp() : head.binstart();
        final long max = Math.min(ts + step, block.end());
        if (next < ts) {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Dropping extra measurement at " + next 
                + " for a bin that is already filled in " + adapter.name());
          }
          queued.pollFirst();
          ts = next + step;
          continue;
        }
        
        if (next < max) {
          datum = adapter.formatPoint(queued.pollFirst(), frequency, detail);
          if (match_timestamp) {
            datum.setBinstart(ts);
          }
          ts += step;
        } else if (ts + step <= next || points.isEmpty()) {
          datum = DataPoint.gap(ts);
          ts += step;
        } else {
          ts += step;
          continue;
        }
      }
      points.add(datum);
    }
    return points;
  }
  
  /**
   * Fetches summary points covering the last {@code duration} seconds for 
   * each label. Cached summaries are used where present. Labels with no 
   * streams active in the window get an empty list without a query and the
   * rest go upstream in a single request with the binsize set to the 
   * duration.
   * @param labels The non-null labels.
   * @param duration The look back in seconds.
   * @param detail The detail level.
   * @return The non-null result.
   * @throws net.ampy.exceptions.SourceException if the upstream failed.
   */
  public RecentResult assembleRecent(final List<Label> labels, 
                                     final long duration, 
                                     final String detail) {
    Preconditions.checkNotNull(labels, "Labels cannot be null.");
    Preconditions.checkArgument(duration > 0, 
        "Duration must be greater than zero.");
    final long end = DateTime.currentTimeSeconds();
    final long start = end - duration;
    
    final Map<String, List<DataPoint>> recent = 
        new LinkedHashMap<String, List<DataPoint>>();
    final List<String> timed_out = new ArrayList<String>();
    final Map<String, List<Long>> query = 
        new LinkedHashMap<String, List<Long>>();
    for (final Label label : labels) {
      final List<DataPoint> cached = cache.searchRecent(label.label(), 
          duration, detail);
      if (cached != null) {
        recent.put(label.label(), cached);
        continue;
      }
      final List<Long> active = index.filterActive(label.streams(), 
          start, end);
      if (active.isEmpty()) {
        recent.put(label.label(), new ArrayList<DataPoint>());
      } else {
        query.put(label.label(), active);
        // placeholder to keep the request order
        recent.put(label.label(), null);
      }
    }
    
    if (!query.isEmpty()) {
      final Map<String, LabelHistory> response = 
          source.requestAggregateHistory(collection_id, query, start, end, 
              duration, adapter.detailColumns(detail), 
              adapter.groupColumns(detail));
      for (final String label : query.keySet()) {
        final LabelHistory history = response.get(label);
        final List<DataPoint> formatted = new ArrayList<DataPoint>();
        if (history == null) {
          LOG.warn("No recent data returned for " + label + " of " 
              + adapter.name());
          recent.put(label, formatted);
          continue;
        }
        for (final DataPoint point : history.points()) {
          formatted.add(adapter.formatPoint(point, history.frequency(), 
              detail));
        }
        recent.put(label, formatted);
        if (history.timedOut().isEmpty()) {
          cache.storeRecent(label, duration, detail, formatted);
        } else {
          LOG.warn("Upstream timed out fetching recent data for " + label 
              + " of " + adapter.name());
          timed_out.add(label);
        }
      }
    }
    return new RecentResult(recent, timed_out);
  }
}
