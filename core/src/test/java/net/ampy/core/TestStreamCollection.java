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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.MockedStatic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.ampy.cache.BlockCache;
import net.ampy.cache.GuavaCacheBackend;
import net.ampy.collections.AmpIcmpAdapter;
import net.ampy.data.Aggregation;
import net.ampy.data.CollectionInfo;
import net.ampy.data.DataPoint;
import net.ampy.data.Label;
import net.ampy.data.LabelHistory;
import net.ampy.data.Stream;
import net.ampy.exceptions.ProtocolException;
import net.ampy.meta.Selection;
import net.ampy.query.HistoryResult;
import net.ampy.source.TimeSeriesSource;
import net.ampy.utils.Config;
import net.ampy.utils.DateTime;

public final class TestStreamCollection {
  private static final long BASE_TIME = 1546300800;
  private static final long REFRESH = 300;
  private static final long ACTIVE = 1800;
  
  private MockedStatic<DateTime> date_time;
  private long[] now;
  private TimeSeriesSource source;
  private StreamCollection collection;
  
  @Before
  public void before() throws Exception {
    now = new long[] { BASE_TIME };
    date_time = mockStatic(DateTime.class, CALLS_REAL_METHODS);
    date_time.when(DateTime::currentTimeMillis).thenAnswer(
        invocation -> now[0] * 1000L);
    date_time.when(DateTime::currentTimeSeconds).thenAnswer(
        invocation -> now[0]);
    
    source = mock(TimeSeriesSource.class);
    when(source.requestStreams(4, 0)).thenReturn(Lists.newArrayList(
        stream(1, "ampz-waikato", "www.google.com", 84, "10.0.0.1", 
            BASE_TIME - 86400, BASE_TIME - 60),
        stream(2, "ampz-waikato", "www.google.com", 84, "2001:db8::1", 
            BASE_TIME - 86400, BASE_TIME - 60),
        stream(3, "ampz-waikato", "www.google.com", 1500, "10.0.0.1", 
            BASE_TIME - 86400, BASE_TIME - 60),
        // never measured
        stream(4, "ampz-auckland", "www.google.com", 84, "10.0.0.2", 0, 0)));
    when(source.requestStreams(4, 4)).thenReturn(
        Collections.<Stream>emptyList());
    when(source.requestActiveStreams(anyLong(), anyLong())).thenReturn(
        Collections.<Long>emptyList());
    when(source.requestAggregateHistory(anyLong(), anyMap(), anyLong(), 
        anyLong(), anyLong(), any(Aggregation.class), anyList()))
      .thenReturn(Collections.<String, LabelHistory>emptyMap());
    
    collection = new StreamCollection(new CollectionInfo(4, "amp", "icmp"), 
        new AmpIcmpAdapter(200), source, 
        new BlockCache(new GuavaCacheBackend(1000, 1024 * 1024), "amp-icmp", 
            12, 300, 21600), 
        REFRESH, ACTIVE);
  }
  
  @After
  public void after() throws Exception {
    date_time.close();
  }
  
  @Test
  public void ctorFromConfig() throws Exception {
    final StreamCollection from_config = new StreamCollection(
        new CollectionInfo(4, "amp", "icmp"), new AmpIcmpAdapter(200), source, 
        new BlockCache(new GuavaCacheBackend(1000, 1024), "amp-icmp", 
            new Config()), 
        new Config());
    assertEquals("amp-icmp", from_config.info().name());
    assertEquals("amp-icmp", from_config.adapter().name());
  }
  
  @Test
  public void updateStreams() throws Exception {
    assertEquals(3, collection.updateStreams());
    assertEquals(3, collection.index().size());
    verify(source, times(1)).requestStreams(4, 0);
    verify(source, never()).requestActiveStreams(anyLong(), anyLong());
    
    // families were derived from the address
    assertEquals("ipv6", collection.findStream(2).get("family"));
    assertNull(collection.findStream(4));
    
    // within the interval nothing is fetched
    now[0] += REFRESH - 1;
    assertEquals(0, collection.updateStreams());
    verify(source, times(1)).requestStreams(anyLong(), anyLong());
    
    // the next pull starts after the newest stream seen
    now[0] += 1;
    assertEquals(0, collection.updateStreams());
    verify(source, times(1)).requestStreams(4, 4);
  }
  
  @Test
  public void updateActiveStreams() throws Exception {
    collection.updateStreams();
    
    when(source.requestActiveStreams(4, BASE_TIME)).thenReturn(
        Lists.newArrayList(1L, 4L));
    when(source.requestStreams(4, 3)).thenReturn(Lists.newArrayList(
        stream(4, "ampz-auckland", "www.google.com", 84, "10.0.0.2", 
            BASE_TIME + 900, BASE_TIME + 1000)));
    now[0] += ACTIVE;
    
    // stream 4 finally has data so it's pulled again from just before it
    assertEquals(1, collection.updateStreams());
    verify(source, times(1)).requestActiveStreams(4, BASE_TIME);
    verify(source, times(1)).requestStreams(4, 3);
    assertEquals("ampz-auckland", collection.findStream(4).get("source"));
    assertEquals(4, collection.index().size());
    
    // the activity window of 1 now reaches the refresh time
    assertEquals(ImmutableList.of(1L, 4L), collection.filterActive(
        ImmutableList.of(1L, 2L, 4L), BASE_TIME + 1500, BASE_TIME + 2000));
    
    // the next new stream pull resumes after the newest stream
    now[0] += REFRESH;
    collection.updateStreams();
    verify(source, times(2)).requestStreams(4, 4);
  }
  
  @Test
  public void updateActiveStreamsKnownOnly() throws Exception {
    collection.updateStreams();
    when(source.requestActiveStreams(4, BASE_TIME)).thenReturn(
        Lists.newArrayList(2L, 99L));
    now[0] += ACTIVE;
    
    assertEquals(0, collection.updateStreams());
    verify(source, never()).requestStreams(4, 3);
    assertEquals(3, collection.index().size());
    assertEquals(ImmutableList.of(2L), collection.filterActive(
        ImmutableList.of(1L, 2L), BASE_TIME + 1000, BASE_TIME + 2000));
  }
  
  @Test
  public void updateActiveStreamsFails() throws Exception {
    collection.updateStreams();
    when(source.requestActiveStreams(4, BASE_TIME)).thenThrow(
        new ProtocolException("Invalid stream ID"));
    now[0] += ACTIVE;
    
    try {
      collection.updateStreams();
      fail("Expected ProtocolException");
    } catch (ProtocolException e) { }
  }
  
  @Test
  public void getSelections() throws Exception {
    collection.updateStreams();
    
    // single choices are followed automatically
    Map<String, Selection> selections = collection.getSelections(
        Collections.<String, Object>emptyMap(), null, 1, 0);
    assertEquals(ImmutableList.of("source", "destination", "packet_size"), 
        ImmutableList.copyOf(selections.keySet()));
    assertEquals(ImmutableList.<Object>of("ampz-waikato"), 
        selections.get("source").values());
    assertEquals(ImmutableList.<Object>of(84L, 1500L), 
        selections.get("packet_size").values());
    
    selections = collection.getSelections(ImmutableMap.<String, Object>of(
        "source", "ampz-waikato", "destination", "www.google.com", 
        "packet_size", "84"), null, 1, 0);
    assertEquals(1, selections.size());
    assertEquals(ImmutableList.<Object>of("ipv4", "ipv6"), 
        selections.get("family").values());
    
    // complete and invalid selections have nothing left to offer
    assertTrue(collection.getSelections(ImmutableMap.<String, Object>of(
        "source", "ampz-waikato", "destination", "www.google.com", 
        "packet_size", 1500L, "family", "ipv4"), null, 1, 0).isEmpty());
    assertTrue(collection.getSelections(ImmutableMap.<String, Object>of(
        "source", "nosuch"), null, 1, 0).isEmpty());
  }
  
  @Test
  public void groupToLabels() throws Exception {
    collection.updateStreams();
    final String description = 
        "FROM ampz-waikato TO www.google.com OPTION 84 FAMILY";
    
    List<Label> labels = collection.groupToLabels(9, description, true);
    assertEquals(2, labels.size());
    assertEquals(ImmutableList.of(1L), labels.get(0).streams());
    assertEquals(ImmutableList.of(2L), labels.get(1).streams());
    
    labels = collection.groupToLabels(9, description, false);
    assertEquals(2, labels.size());
    assertTrue(labels.get(0).streams().isEmpty());
  }
  
  @Test
  public void getHistory() throws Exception {
    collection.updateStreams();
    final List<Label> labels = collection.groupToLabels(9, 
        "FROM ampz-waikato TO www.google.com OPTION 84 IPV4", true);
    final HistoryResult result = collection.getHistory(labels, 
        BASE_TIME - 7200, BASE_TIME, 300, "basic");
    final List<DataPoint> points = result.series("group_9_IPv4");
    assertEquals(24, points.size());
    assertTrue(points.get(0).isGap());
    verify(source, times(1)).requestAggregateHistory(anyLong(), anyMap(), 
        anyLong(), anyLong(), anyLong(), any(Aggregation.class), anyList());
    assertFalse(result.timedOut().containsKey("group_9_IPv4"));
  }
  
  private static Stream stream(final long id, 
                               final String source, 
                               final String destination, 
                               final long size, 
                               final String address, 
                               final long first, 
                               final long last) {
    return new Stream(id, ImmutableMap.<String, Object>of(
        "source", source, 
        "destination", destination, 
        "packet_size", size, 
        "address", address), first, last);
  }
}
