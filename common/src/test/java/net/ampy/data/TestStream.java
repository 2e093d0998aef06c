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
package net.ampy.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

public final class TestStream {

  @Test
  public void fromRecord() {
    final Map<String, Object> record = Maps.newLinkedHashMap();
    record.put("stream_id", 42L);
    record.put("source", "ampz-waikato");
    record.put("destination", "www.google.com");
    record.put("firsttimestamp", 1400000000L);
    record.put("lasttimestamp", "1400003600");
    
    final Stream stream = Stream.fromRecord(record);
    assertEquals(42, stream.id());
    assertEquals(1400000000L, stream.firstTimestamp());
    assertEquals(1400003600L, stream.lastTimestamp());
    assertEquals(ImmutableMap.of("source", "ampz-waikato", 
        "destination", "www.google.com"), stream.properties());
    assertFalse(stream.properties().containsKey("stream_id"));
  }

  @Test
  public void fromRecordNoTimestamps() {
    final Stream stream = Stream.fromRecord(
        ImmutableMap.<String, Object>of("stream_id", 7, "host", "foo"));
    assertEquals(7, stream.id());
    assertEquals(0, stream.firstTimestamp());
    assertEquals(0, stream.lastTimestamp());
    assertEquals("foo", stream.property("host"));
    assertNull(stream.property("family"));
  }

  @Test
  public void fromRecordBadId() {
    try {
      Stream.fromRecord(ImmutableMap.<String, Object>of("host", "foo"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      Stream.fromRecord(ImmutableMap.<String, Object>of(
          "stream_id", "abc", "host", "foo"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test(expected = IllegalArgumentException.class)
  public void fromRecordBadTimestamp() {
    Stream.fromRecord(ImmutableMap.<String, Object>of(
        "stream_id", 1, "lasttimestamp", "yesterday"));
  }

  @Test
  public void withProperty() {
    final Stream stream = new Stream(1, 
        ImmutableMap.<String, Object>of("host", "foo"), 10, 20);
    final Stream copy = stream.withProperty("family", "ipv4");
    assertNull(stream.property("family"));
    assertEquals("ipv4", copy.property("family"));
    assertEquals(10, copy.firstTimestamp());
    assertEquals(20, copy.lastTimestamp());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void propertiesUnmodifiable() {
    new Stream(1, Maps.<String, Object>newHashMap(), 0, 0)
      .properties().put("foo", "bar");
  }
}
