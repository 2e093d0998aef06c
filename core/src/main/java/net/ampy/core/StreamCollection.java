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

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import net.ampy.cache.BlockCache;
import net.ampy.collection.CollectionAdapter;
import net.ampy.data.CollectionInfo;
import net.ampy.data.Label;
import net.ampy.data.Stream;
import net.ampy.exceptions.MissingPropertyException;
import net.ampy.meta.Selection;
import net.ampy.meta.StreamIndex;
import net.ampy.query.HistoryResult;
import net.ampy.query.RecentResult;
import net.ampy.query.SeriesReconciler;
import net.ampy.source.TimeSeriesSource;
import net.ampy.utils.Config;
import net.ampy.utils.DateTime;

/**
 * Everything needed to serve one measurement collection: its adapter, a
 * stream index, a block cache view and a reconciler wired together. 
 * <p>
 * The index is brought up to date by {@link #updateStreams()}, which pulls
 * streams created since the last pull at most once per refresh interval 
 * and, once per active interval, extends the activity windows of streams
 * that have reported data. Refreshes are serialized by a per collection 
 * lock so unrelated collections never contend.
 * 
 * @since 1.0
 */
public class StreamCollection {
  private static final Logger LOG = 
      LoggerFactory.getLogger(StreamCollection.class);
  
  private final CollectionInfo info;
  private final CollectionAdapter adapter;
  private final TimeSeriesSource source;
  private final StreamIndex index;
  private final SeriesReconciler reconciler;
  
  /** Seconds between new stream pulls. */
  private final long refresh_interval;
  
  /** Seconds between active stream pulls. */
  private final long active_interval;
  
  private final ReentrantLock refresh_lock;
  
  /** When we last pulled new streams, seconds. Guarded by the lock. */
  private long last_checked;
  
  /** When we last pulled active streams, seconds. Guarded by the lock. */
  private long last_active_check;
  
  /** The highest stream ID seen. Guarded by the lock. */
  private long last_new_stream;
  
  /** Streams skipped because they had no data yet. Guarded by the lock. */
  private final Set<Long> skipped;
  
  /**
   * Ctor reading the refresh intervals from the config.
   * @param info The non-null upstream collection.
   * @param adapter The non-null adapter for the collection.
   * @param source The non-null upstream source.
   * @param cache The non-null block cache for the collection.
   * @param config The non-null config.
   */
  public StreamCollection(final CollectionInfo info, 
                          final CollectionAdapter adapter, 
                          final TimeSeriesSource source, 
                          final BlockCache cache, 
                          final Config config) {
    this(info, adapter, source, cache, 
        config.getDuration(Config.REFRESH_INTERVAL_KEY),
        config.getDuration(Config.ACTIVE_INTERVAL_KEY));
  }
  
  /**
   * Default ctor.
   * @param info The non-null upstream collection.
   * @param adapter The non-null adapter for the collection.
   * @param source The non-null upstream source.
   * @param cache The non-null block cache for the collection.
   * @param refresh_interval Seconds between new stream pulls.
   * @param active_interval Seconds between active stream pulls.
   */
  public StreamCollection(final CollectionInfo info, 
                          final CollectionAdapter adapter, 
                          final TimeSeriesSource source, 
                          final BlockCache cache, 
                          final long refresh_interval, 
                          final long active_interval) {
    this.info = Preconditions.checkNotNull(info);
    this.adapter = Preconditions.checkNotNull(adapter);
    this.source = Preconditions.checkNotNull(source);
    this.refresh_interval = refresh_interval;
    this.active_interval = active_interval;
    index = new StreamIndex(adapter.streamProperties());
    reconciler = new SeriesReconciler(info.id(), adapter, index, cache, 
        source);
    refresh_lock = new ReentrantLock();
    skipped = new HashSet<Long>();
  }
  
  /**
   * Pulls new streams if the refresh interval has passed and refreshes
   * activity windows if the active interval has passed.
   * @return The number of streams added to the index.
   * @throws net.ampy.exceptions.SourceException if the upstream failed.
   */
  public int updateStreams() {
    refresh_lock.lock();
    try {
      int added = 0;
      final long now = DateTime.currentTimeSeconds();
      if (now >= last_checked + refresh_interval) {
        added += fetchStreams();
        last_checked = now;
        if (last_active_check == 0) {
          // a full pull carries fresh activity windows
          last_active_check = now;
        }
      }
      if (now >= last_active_check + active_interval) {
        added += fetchActiveStreams(now);
        last_active_check = now;
      }
      return added;
    } finally {
      refresh_lock.unlock();
    }
  }
  
  /**
   * Returns the options at the next undecided level of the index. When a 
   * level offers a single value it is selected automatically and the next
   * level is returned as well.
   * @param selected A non-null map of selected properties. Not modified.
   * @param term An optional substring filter.
   * @param page The 1 based page.
   * @param page_size Values per page, zero or less for all.
   * @return An ordered map of property to options. Empty when every level
   * was selected or a selected value doesn't exist.
   */
  public Map<String, Selection> getSelections(
      final Map<String, Object> selected, 
      final String term, 
      final int page, 
      final int page_size) {
    Preconditions.checkNotNull(selected, "Selected cannot be null.");
    final Map<String, Object> path = new HashMap<String, Object>(selected);
    final Map<String, Selection> result = 
        new LinkedHashMap<String, Selection>();
    while (true) {
      final Selection selection = index.findSelections(path, term, page, 
          page_size);
      if (selection.property() == null) {
        if (!selection.isValid()) {
          LOG.warn("Invalid selection " + selected + " for " + adapter.name());
        }
        break;
      }
      result.put(selection.property(), selection);
      if (selection.total() != 1 || selection.values().size() != 1) {
        break;
      }
      path.put(selection.property(), selection.values().get(0));
    }
    return result;
  }
  
  /**
   * Converts a group description into labels.
   * @param group_id The group ID.
   * @param description The group description.
   * @param lookup Whether to resolve the stream IDs of each label.
   * @return The labels.
   * @throws IllegalArgumentException if the description was invalid.
   */
  public List<Label> groupToLabels(final long group_id, 
                                   final String description, 
                                   final boolean lookup) {
    return adapter.groupToLabels(group_id, description, lookup ? index : null);
  }
  
  /**
   * @param stream_id A stream ID.
   * @return The key properties of the stream or null if unknown.
   */
  public Map<String, Object> findStream(final long stream_id) {
    return index.findStreamProperties(stream_id);
  }
  
  /** @see StreamIndex#filterActive(List, long, long) */
  public List<Long> filterActive(final List<Long> ids, 
                                 final long start, 
                                 final long end) {
    return index.filterActive(ids, start, end);
  }
  
  /** @see SeriesReconciler#assembleHistory(List, long, long, long, String) */
  public HistoryResult getHistory(final List<Label> labels, 
                                  final long start, 
                                  final long end, 
                                  final long binsize, 
                                  final String detail) {
    return reconciler.assembleHistory(labels, start, end, binsize, detail);
  }
  
  /** 
   * @see SeriesReconciler#assembleHistory(List, long, long, long, String, 
   * boolean) 
   */
  public HistoryResult getHistory(final List<Label> labels, 
                                  final long start, 
                                  final long end, 
                                  final long binsize, 
                                  final String detail,
                                  final boolean omit_timed_out) {
    return reconciler.assembleHistory(labels, start, end, binsize, detail, 
        omit_timed_out);
  }
  
  /** @see SeriesReconciler#assembleRecent(List, long, String) */
  public RecentResult getRecent(final List<Label> labels, 
                                final long duration, 
                                final String detail) {
    return reconciler.assembleRecent(labels, duration, detail);
  }
  
  /** @return The upstream collection. */
  public CollectionInfo info() {
    return info;
  }
  
  /** @return The adapter. */
  public CollectionAdapter adapter() {
    return adapter;
  }
  
  @VisibleForTesting
  StreamIndex index() {
    return index;
  }
  
  /** Must be called with the refresh lock held. */
  private int fetchStreams() {
    final List<Stream> streams = source.requestStreams(info.id(), 
        last_new_stream);
    int added = 0;
    for (final Stream stream : streams) {
      if (stream.id() > last_new_stream) {
        last_new_stream = stream.id();
      }
      if (stream.lastTimestamp() == 0) {
        skipped.add(stream.id());
        if (LOG.isDebugEnabled()) {
          LOG.debug("Skipping stream " + stream.id() + " of " + adapter.name()
              + " as it has never produced data");
        }
        continue;
      }
      final boolean known = index.findStreamProperties(stream.id()) != null;
      if (index(stream) && !known) {
        added++;
      }
    }
    if (added > 0) {
      LOG.info("Added " + added + " new streams to " + adapter.name());
    }
    return added;
  }
  
  /** 
   * Must be called with the refresh lock held. The upstream only returns
   * IDs here so a stream we skipped while it had no data is picked up by
   * pulling streams again from just before it.
   */
  private int fetchActiveStreams(final long now) {
    final List<Long> ids = source.requestActiveStreams(info.id(), 
        last_active_check);
    int added = 0;
    long rewind = Long.MAX_VALUE;
    for (final long id : ids) {
      if (skipped.remove(id)) {
        rewind = Math.min(rewind, id - 1);
      }
    }
    if (rewind != Long.MAX_VALUE) {
      last_new_stream = Math.min(last_new_stream, rewind);
      added = fetchStreams();
    }
    for (final long id : ids) {
      index.updateActivity(id, now);
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Refreshed activity of " + ids.size() + " streams of " 
          + adapter.name());
    }
    return added;
  }
  
  private boolean index(final Stream stream) {
    final Stream prepared = adapter.prepareStream(stream);
    try {
      index.addStream(prepared, adapter.storagePayload(prepared));
      return true;
    } catch (MissingPropertyException e) {
      LOG.warn("Dropping stream " + stream.id() + " of " + adapter.name() 
          + ": " + e.getMessage());
      return false;
    }
  }
  
  @Override
  public String toString() {
    return info.toString();
  }
}
