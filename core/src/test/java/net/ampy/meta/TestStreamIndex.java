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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import net.ampy.data.Stream;
import net.ampy.exceptions.MissingPropertyException;

public final class TestStreamIndex {
  private static final List<String> KEYS = 
      ImmutableList.of("source", "destination", "packet_size", "family");
  
  private StreamIndex index;
  
  @Before
  public void before() throws Exception {
    index = new StreamIndex(KEYS);
    index.addStream(1, null, props("a", "x", 84L, "ipv4"));
    index.addStream(2, null, props("a", "x", 84L, "ipv6"));
    index.addStream(3, null, props("a", "y", 1500L, "ipv4"));
    index.addStream(4, null, props("b", "x", 84L, "ipv4"));
  }
  
  @Test
  public void ctor() throws Exception {
    assertEquals(KEYS, index.keys());
    assertEquals(4, index.size());
    
    try {
      new StreamIndex(Collections.<String>emptyList());
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new StreamIndex(ImmutableList.of("source", "source"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void addStreamMissingProperty() throws Exception {
    final Map<String, Object> props = props("c", "z", 84L, "ipv4");
    props.remove("family");
    try {
      index.addStream(5, null, props);
      fail("Expected MissingPropertyException");
    } catch (MissingPropertyException e) {
      assertEquals("family", e.property());
    }
    assertEquals(4, index.size());
  }
  
  @Test
  public void addStreamReplaces() throws Exception {
    index.addStream(1, "payload", props("a", "x", 84L, "ipv4"));
    assertEquals(4, index.size());
    final List<StreamIndex.Entry> entries = 
        index.findStreams(props("a", "x", 84L, "ipv4"));
    assertEquals(1, entries.size());
    assertEquals("payload", entries.get(0).payload());
    
    // moving a stream to another path drops it from the old one
    index.addStream(1, null, props("c", "x", 84L, "ipv4"));
    assertTrue(index.findStreamIds(ImmutableMap.<String, Object>of(
        "source", "a", "family", "ipv4", "destination", "x")).isEmpty());
    assertEquals(ImmutableList.of(1L), index.findStreamIds(
        ImmutableMap.<String, Object>of("source", "c")));
    
    // the emptied branch is no longer offered
    final Selection families = index.findSelections(
        ImmutableMap.<String, Object>of("source", "a", "destination", "x", 
            "packet_size", 84L));
    assertEquals(ImmutableList.<Object>of("ipv6"), families.values());
    assertEquals(1, families.total());
  }
  
  @Test
  public void addStreamReplacesPrunesToRoot() throws Exception {
    final StreamIndex single = new StreamIndex(KEYS);
    single.addStream(1, null, props("a", "x", 84L, "ipv4"));
    single.addStream(1, null, props("b", "x", 84L, "ipv4"));
    
    final Selection sources = single.findSelections(
        Collections.<String, Object>emptyMap());
    assertEquals(ImmutableList.<Object>of("b"), sources.values());
    assertEquals(1, sources.total());
    assertTrue(single.findStreamIds(ImmutableMap.<String, Object>of(
        "source", "a")).isEmpty());
    
    // re-adding at the same path keeps the branch
    single.addStream(1, "p", props("b", "x", 84L, "ipv4"));
    assertEquals(ImmutableList.of(1L), single.findStreamIds(
        ImmutableMap.<String, Object>of("source", "b")));
  }
  
  @Test
  public void addStreamFromStream() throws Exception {
    final Map<String, Object> props = props("c", "z", 84L, "ipv4");
    index.addStream(new Stream(9, props, 100, 200), "p");
    assertEquals(ImmutableList.of(9L), index.findStreamIds(
        ImmutableMap.<String, Object>of("source", "c")));
    
    // activity is seeded from the stream timestamps
    assertTrue(index.filterActive(ImmutableList.of(9L), 300, 400).isEmpty());
    assertEquals(ImmutableList.of(9L), 
        index.filterActive(ImmutableList.of(9L), 150, 400));
  }
  
  @Test
  public void findStreamIds() throws Exception {
    assertEquals(ImmutableList.of(1L, 2L, 3L, 4L), 
        index.findStreamIds(Collections.<String, Object>emptyMap()));
    assertEquals(ImmutableList.of(1L, 2L, 3L), index.findStreamIds(
        ImmutableMap.<String, Object>of("source", "a")));
    assertEquals(ImmutableList.of(1L, 3L, 4L), index.findStreamIds(
        ImmutableMap.<String, Object>of("family", "ipv4")));
    assertEquals(ImmutableList.of(1L, 2L), index.findStreamIds(
        ImmutableMap.<String, Object>of("source", "a", "destination", "x", 
            "packet_size", 84L)));
    assertTrue(index.findStreamIds(
        ImmutableMap.<String, Object>of("source", "nosuch")).isEmpty());
  }
  
  @Test
  public void findStreamIdsStringForm() throws Exception {
    assertEquals(ImmutableList.of(3L), index.findStreamIds(
        ImmutableMap.<String, Object>of("packet_size", "1500")));
    
    index.addStream(10, null, props("d", "x", 84L, true));
    assertEquals(ImmutableList.of(10L), index.findStreamIds(
        ImmutableMap.<String, Object>of("family", "true")));
  }
  
  @Test
  public void findStreamProperties() throws Exception {
    final Map<String, Object> props = index.findStreamProperties(3);
    assertEquals(ImmutableList.copyOf(KEYS), 
        ImmutableList.copyOf(props.keySet()));
    assertEquals("y", props.get("destination"));
    assertEquals(1500L, props.get("packet_size"));
    assertNull(index.findStreamProperties(42));
  }
  
  @Test
  public void findSelections() throws Exception {
    Selection selection = index.findSelections(
        Collections.<String, Object>emptyMap());
    assertTrue(selection.isValid());
    assertEquals("source", selection.property());
    assertEquals(ImmutableList.<Object>of("a", "b"), selection.values());
    assertEquals(2, selection.total());
    
    selection = index.findSelections(
        ImmutableMap.<String, Object>of("source", "a"));
    assertEquals("destination", selection.property());
    assertEquals(ImmutableList.<Object>of("x", "y"), selection.values());
    
    selection = index.findSelections(ImmutableMap.<String, Object>of(
        "source", "a", "destination", "x", "packet_size", 84L));
    assertEquals("family", selection.property());
    assertEquals(ImmutableList.<Object>of("ipv4", "ipv6"), 
        selection.values());
  }
  
  @Test
  public void findSelectionsComplete() throws Exception {
    final Selection selection = index.findSelections(
        ImmutableMap.<String, Object>of("source", "a", "destination", "x", 
            "packet_size", 84L, "family", "ipv4"));
    assertSame(Selection.COMPLETE, selection);
    assertTrue(selection.isValid());
    assertNull(selection.property());
  }
  
  @Test
  public void findSelectionsInvalid() throws Exception {
    final Selection selection = index.findSelections(
        ImmutableMap.<String, Object>of("source", "nosuch"));
    assertSame(Selection.EMPTY, selection);
    assertFalse(selection.isValid());
    assertTrue(selection.values().isEmpty());
  }
  
  @Test
  public void findSelectionsSorted() throws Exception {
    index.addStream(20, null, props("a", "x", 9000L, "ipv4"));
    index.addStream(21, null, props("a", "x", 128L, "ipv4"));
    final Selection selection = index.findSelections(
        ImmutableMap.<String, Object>of("source", "a", "destination", "x"));
    assertEquals("packet_size", selection.property());
    assertEquals(ImmutableList.<Object>of(84L, 128L, 9000L), 
        selection.values());
  }
  
  @Test
  public void findSelectionsSearchAndPage() throws Exception {
    for (int i = 0; i < 25; i++) {
      index.addStream(100 + i, null, props("host" + (char) ('a' + i), 
          "x", 84L, "ipv4"));
    }
    
    Selection selection = index.findSelections(
        Collections.<String, Object>emptyMap(), "HOST", 1, 10);
    assertEquals(25, selection.total());
    assertEquals(10, selection.values().size());
    assertEquals("hosta", selection.values().get(0));
    
    selection = index.findSelections(
        Collections.<String, Object>emptyMap(), "host", 3, 10);
    assertEquals(25, selection.total());
    assertEquals(5, selection.values().size());
    assertEquals("hostu", selection.values().get(0));
    
    selection = index.findSelections(
        Collections.<String, Object>emptyMap(), "host", 4, 10);
    assertEquals(25, selection.total());
    assertTrue(selection.values().isEmpty());
    
    // no page size returns everything that matched
    selection = index.findSelections(
        Collections.<String, Object>emptyMap(), "sty", 1, 0);
    assertEquals(1, selection.total());
    assertEquals(ImmutableList.<Object>of("hosty"), selection.values());
  }
  
  @Test
  public void activity() throws Exception {
    final List<Long> ids = ImmutableList.of(1L, 2L, 3L);
    // unknown activity is kept
    assertEquals(ids, index.filterActive(ids, 1000, 2000));
    
    index.updateActivity(1, 500);
    index.updateActivity(2, 1500);
    index.updateActivity(2, 1200);
    assertEquals(ImmutableList.of(2L, 3L), 
        index.filterActive(ids, 1000, 2000));
    
    // widening backwards brings 2 into an earlier window
    assertEquals(ImmutableList.of(1L, 3L), 
        index.filterActive(ids, 0, 1000));
    index.updateActivity(2, 100);
    assertEquals(ids, index.filterActive(ids, 0, 1000));
  }
  
  private static Map<String, Object> props(final Object source, 
                                           final Object destination, 
                                           final Object size, 
                                           final Object family) {
    final Map<String, Object> props = Maps.newLinkedHashMap();
    props.put("source", source);
    props.put("destination", destination);
    props.put("packet_size", size);
    props.put("family", family);
    return props;
  }
}
