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
package net.ampy.meta;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.ampy.collection.StreamFinder;
import net.ampy.data.Stream;
import net.ampy.exceptions.MissingPropertyException;

/**
 * A fixed depth trie over the ordered stream properties of a collection,
 * e.g. {@code [source, destination, packet_size, family]}. Each level maps
 * a property value to the next level and the leaves hold the streams with
 * that exact property tuple. An inverse map gives the tuple for an ID and an
 * activity map records when each stream was producing data.
 * <p>
 * Reads run concurrently under the shared lock, inserts and activity 
 * updates take the exclusive lock.
 * <p>
 * Selected values are matched exactly first, then by their string form so 
 * that values typed by a user ("84") find numeric properties (84). The 
 * strings "true" and "false" also match boolean properties.
 * 
 * @since 1.0
 */
public class StreamIndex implements StreamFinder {
  private static final Logger LOG = LoggerFactory.getLogger(StreamIndex.class);
  
  /** Sorts numbers numerically ahead of everything else sorted lexically. */
  static final Comparator<Object> VALUE_COMPARATOR = new Comparator<Object>() {
    @Override
    public int compare(final Object a, final Object b) {
      if (a instanceof Number && b instanceof Number) {
        return Double.compare(((Number) a).doubleValue(), 
            ((Number) b).doubleValue());
      }
      if (a instanceof Number) {
        return -1;
      }
      if (b instanceof Number) {
        return 1;
      }
      return String.valueOf(a).compareTo(String.valueOf(b));
    }
  };
  
  /** The ordered property keys. */
  private final List<String> keys;
  
  /** The root level. */
  private final Node root;
  
  /** Stream ID to its entry. */
  private final Map<Long, Entry> streams;
  
  /** Stream ID to {first, last} activity timestamps. */
  private final Map<Long, long[]> activity;
  
  private final ReentrantReadWriteLock lock;
  
  /**
   * Default ctor.
   * @param keys A non-null and non-empty ordered list of property keys.
   * @throws IllegalArgumentException if the keys were null, empty or had
   * duplicates.
   */
  public StreamIndex(final List<String> keys) {
    Preconditions.checkArgument(keys != null && !keys.isEmpty(), 
        "Keys cannot be null or empty.");
    Preconditions.checkArgument(
        new HashSet<String>(keys).size() == keys.size(), 
        "Keys cannot contain duplicates: %s", keys);
    this.keys = ImmutableList.copyOf(keys);
    root = new Node();
    streams = new HashMap<Long, Entry>();
    activity = new HashMap<Long, long[]>();
    lock = new ReentrantReadWriteLock();
  }
  
  /**
   * Adds a stream, using its timestamps as the initial activity window.
   * @param stream The non-null stream.
   * @param payload An optional payload to store with the ID.
   * @throws MissingPropertyException if a key property was missing.
   */
  public void addStream(final Stream stream, final Object payload) {
    Preconditions.checkNotNull(stream, "Stream cannot be null.");
    final Map<String, Object> properties = 
        new LinkedHashMap<String, Object>(stream.properties());
    properties.put(Stream.FIRST_TIMESTAMP, stream.firstTimestamp());
    properties.put(Stream.LAST_TIMESTAMP, stream.lastTimestamp());
    addStream(stream.id(), payload, properties);
  }
  
  /**
   * Adds a stream to the index. If {@code firsttimestamp} and 
   * {@code lasttimestamp} are present in the properties they seed the 
   * stream's activity window. Adding an ID that is already indexed replaces
   * the old entry so a stream only ever lives at one leaf.
   * @param id The stream ID.
   * @param payload An optional payload to store with the ID.
   * @param properties The non-null stream properties.
   * @throws MissingPropertyException if a key property was missing.
   */
  public void addStream(final long id, 
                        final Object payload, 
                        final Map<String, Object> properties) {
    Preconditions.checkNotNull(properties, "Properties cannot be null.");
    final List<Object> values = new ArrayList<Object>(keys.size());
    for (final String key : keys) {
      final Object value = properties.get(key);
      if (value == null) {
        throw new MissingPropertyException(key, id);
      }
      values.add(value);
    }
    
    final Lock write = lock.writeLock();
    write.lock();
    try {
      final Entry extant = streams.get(id);
      if (extant != null) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Replacing existing entry for stream " + id);
        }
        removeFromLeaf(extant);
      }
      
      Node node = root;
      for (final Object value : values) {
        Node next = node.children.get(value);
        if (next == null) {
          next = new Node();
          node.children.put(value, next);
        }
        node = next;
      }
      final Entry entry = new Entry(id, payload, values);
      node.leaf.add(entry);
      streams.put(id, entry);
      
      final Object first = properties.get(Stream.FIRST_TIMESTAMP);
      final Object last = properties.get(Stream.LAST_TIMESTAMP);
      if (first instanceof Number && last instanceof Number) {
        activity.put(id, new long[] { ((Number) first).longValue(), 
            ((Number) last).longValue() });
      }
    } finally {
      write.unlock();
    }
  }
  
  /**
   * Records that a stream was active at the given time, creating an activity
   * window if the stream had none.
   * @param id The stream ID.
   * @param timestamp The time in seconds the stream was seen active.
   */
  public void updateActivity(final long id, final long timestamp) {
    final Lock write = lock.writeLock();
    write.lock();
    try {
      final long[] window = activity.get(id);
      if (window == null) {
        activity.put(id, new long[] { timestamp, timestamp });
      } else {
        if (timestamp > window[1]) {
          window[1] = timestamp;
        }
        if (timestamp < window[0]) {
          window[0] = timestamp;
        }
      }
    } finally {
      write.unlock();
    }
  }
  
  /**
   * Drops any stream whose activity window does not intersect 
   * {@code [start, end)}. Streams without a known window are kept.
   * @param ids The non-null IDs to filter.
   * @param start The window start in seconds.
   * @param end The window end in seconds.
   * @return A new list with the active streams in their original order.
   */
  public List<Long> filterActive(final List<Long> ids, 
                                 final long start, 
                                 final long end) {
    Preconditions.checkNotNull(ids, "IDs cannot be null.");
    final List<Long> active = new ArrayList<Long>(ids.size());
    final Lock read = lock.readLock();
    read.lock();
    try {
      for (final Long id : ids) {
        final long[] window = activity.get(id);
        if (window == null || (window[1] > start && window[0] < end)) {
          active.add(id);
        }
      }
    } finally {
      read.unlock();
    }
    return active;
  }
  
  /**
   * @param id The stream ID.
   * @return The key properties of the stream in key order or null if the
   * stream isn't indexed.
   */
  public Map<String, Object> findStreamProperties(final long id) {
    final Lock read = lock.readLock();
    read.lock();
    try {
      final Entry entry = streams.get(id);
      if (entry == null) {
        return null;
      }
      final Map<String, Object> properties = 
          new LinkedHashMap<String, Object>(keys.size());
      for (int i = 0; i < keys.size(); i++) {
        properties.put(keys.get(i), entry.values.get(i));
      }
      return properties;
    } finally {
      read.unlock();
    }
  }
  
  /**
   * Finds the entries of every stream matching the given properties. Keys 
   * absent from the map match every value at their level.
   * @param properties A non-null, possibly empty property map.
   * @return A non-null, possibly empty list of entries.
   */
  public List<Entry> findStreams(final Map<String, Object> properties) {
    Preconditions.checkNotNull(properties, "Properties cannot be null.");
    final List<Entry> found = new ArrayList<Entry>();
    final Lock read = lock.readLock();
    read.lock();
    try {
      final Deque<Node> nodes = new ArrayDeque<Node>();
      final Deque<Integer> depths = new ArrayDeque<Integer>();
      nodes.push(root);
      depths.push(0);
      while (!nodes.isEmpty()) {
        final Node node = nodes.pop();
        final int depth = depths.pop();
        if (depth == keys.size()) {
          found.addAll(node.leaf);
          continue;
        }
        
        final String key = keys.get(depth);
        if (properties.containsKey(key)) {
          final Node next = node.match(properties.get(key));
          if (next != null) {
            nodes.push(next);
            depths.push(depth + 1);
          }
          continue;
        }
        
        for (final Node next : node.children.values()) {
          nodes.push(next);
          depths.push(depth + 1);
        }
      }
    } finally {
      read.unlock();
    }
    return found;
  }
  
  @Override
  public List<Long> findStreamIds(final Map<String, Object> properties) {
    final List<Entry> entries = findStreams(properties);
    final List<Long> ids = new ArrayList<Long>(entries.size());
    for (final Entry entry : entries) {
      ids.add(entry.id);
    }
    Collections.sort(ids);
    return ids;
  }
  
  /**
   * Returns every value at the first level not present in the selection.
   * @param selected A non-null, possibly empty map of selected properties.
   * @return The selection, {@link Selection#EMPTY} if a selected value 
   * wasn't found or {@link Selection#COMPLETE} if every level was selected.
   */
  public Selection findSelections(final Map<String, Object> selected) {
    return findSelections(selected, null, 1, 0);
  }
  
  /**
   * Returns a page of the distinct values available at the first level not
   * present in the selection. Values are sorted so pages are stable.
   * @param selected A non-null, possibly empty map of selected properties.
   * @param term An optional case insensitive substring values must contain.
   * @param page The 1 based page to return.
   * @param page_size The number of values per page, zero or less for all.
   * @return The selection, {@link Selection#EMPTY} if a selected value 
   * wasn't found or {@link Selection#COMPLETE} if every level was selected.
   */
  public Selection findSelections(final Map<String, Object> selected, 
                                  final String term, 
                                  final int page, 
                                  final int page_size) {
    Preconditions.checkNotNull(selected, "Selected cannot be null.");
    final List<Object> values;
    String requested = null;
    final Lock read = lock.readLock();
    read.lock();
    try {
      Node node = root;
      for (final String key : keys) {
        if (!selected.containsKey(key)) {
          requested = key;
          break;
        }
        final Object value = selected.get(key);
        final Node next = node.match(value);
        if (next == null) {
          LOG.warn("Selected value " + value + " for property " + key 
              + " is not present in the index, invalid selection");
          return Selection.EMPTY;
        }
        node = next;
      }
      
      if (requested == null) {
        return Selection.COMPLETE;
      }
      
      values = new ArrayList<Object>(node.children.size());
      final String filter = Strings.isNullOrEmpty(term) ? null : 
        term.toLowerCase(Locale.ROOT);
      for (final Object value : node.children.keySet()) {
        if (filter == null || 
            String.valueOf(value).toLowerCase(Locale.ROOT).contains(filter)) {
          values.add(value);
        }
      }
    } finally {
      read.unlock();
    }
    
    Collections.sort(values, VALUE_COMPARATOR);
    if (page_size <= 0) {
      return new Selection(requested, values, values.size());
    }
    final int first = (Math.max(page, 1) - 1) * page_size;
    if (first >= values.size()) {
      return new Selection(requested, Collections.emptyList(), values.size());
    }
    return new Selection(requested, 
        values.subList(first, Math.min(first + page_size, values.size())), 
        values.size());
  }
  
  /** @return The ordered property keys. */
  public List<String> keys() {
    return keys;
  }
  
  /** @return The number of indexed streams. */
  public int size() {
    final Lock read = lock.readLock();
    read.lock();
    try {
      return streams.size();
    } finally {
      read.unlock();
    }
  }
  
  /** 
   * Must be called with the write lock held. Branches left without any 
   * stream are pruned so their values are no longer offered as selections.
   */
  private void removeFromLeaf(final Entry entry) {
    final Deque<Node> path = new ArrayDeque<Node>(entry.values.size() + 1);
    Node node = root;
    path.push(node);
    for (final Object value : entry.values) {
      node = node.children.get(value);
      if (node == null) {
        return;
      }
      path.push(node);
    }
    final Iterator<Entry> iterator = node.leaf.iterator();
    while (iterator.hasNext()) {
      if (iterator.next().id == entry.id) {
        iterator.remove();
      }
    }
    
    for (int i = entry.values.size() - 1; i >= 0; i--) {
      final Node child = path.pop();
      if (!child.leaf.isEmpty() || !child.children.isEmpty()) {
        break;
      }
      path.peek().children.remove(entry.values.get(i));
    }
  }
  
  /**
   * A stream ID with its optional payload, as stored at a leaf.
   */
  public static class Entry {
    private final long id;
    private final Object payload;
    private final List<Object> values;
    
    Entry(final long id, final Object payload, final List<Object> values) {
      this.id = id;
      this.payload = payload;
      this.values = values;
    }
    
    /** @return The stream ID. */
    public long id() {
      return id;
    }
    
    /** @return The payload, may be null. */
    public Object payload() {
      return payload;
    }
    
    @Override
    public String toString() {
      return payload == null ? Long.toString(id) : id + ":" + payload;
    }
  }
  
  /** A level of the trie. Leaf levels only use the entry list. */
  private static class Node {
    private final Map<Object, Node> children = new HashMap<Object, Node>();
    private final List<Entry> leaf = new ArrayList<Entry>(1);
    
    Node match(final Object value) {
      Node next = children.get(value);
      if (next != null || value == null) {
        return next;
      }
      if ("true".equals(value)) {
        next = children.get(Boolean.TRUE);
      } else if ("false".equals(value)) {
        next = children.get(Boolean.FALSE);
      }
      if (next != null) {
        return next;
      }
      final String text = value.toString();
      for (final Map.Entry<Object, Node> child : children.entrySet()) {
        if (String.valueOf(child.getKey()).equals(text)) {
          return child.getValue();
        }
      }
      return null;
    }
  }
}
