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
package net.ampy.nntsc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Bytes;

import net.ampy.exceptions.ProtocolException;

public final class TestMessageBuffer {
  
  private MessageBuffer buffer;
  
  @Before
  public void before() throws Exception {
    buffer = new MessageBuffer();
  }
  
  @After
  public void after() throws Exception {
    buffer.close();
  }
  
  @Test
  public void encode() throws Exception {
    final byte[] frame = NntscMessage.encode(MessageType.REQUEST, 
        ImmutableMap.<String, Object>of("request", 0, "collection", -1));
    final byte[] json = "{\"request\":0,\"collection\":-1}"
        .getBytes(StandardCharsets.UTF_8);
    assertEquals(NntscMessage.HEADER_LENGTH + json.length, frame.length);
    assertEquals(1, frame[0]);
    assertEquals(0, frame[1]);
    assertEquals(0, frame[2]);
    assertEquals(0, frame[3]);
    assertEquals(0, frame[4]);
    assertEquals(json.length, frame[5]);
    assertEquals(new String(json, StandardCharsets.UTF_8), 
        new String(frame, 6, json.length, StandardCharsets.UTF_8));
  }
  
  @Test
  public void singleFrame() throws Exception {
    final byte[] frame = NntscMessage.encode(MessageType.HISTORY, 
        ImmutableMap.<String, Object>of("collection", 4, "streamid", "group_1", 
            "more", true));
    buffer.append(frame, 0, frame.length);
    final NntscMessage message = buffer.next();
    assertEquals(MessageType.HISTORY, message.type());
    assertEquals(4, message.collection());
    assertTrue(message.more());
    assertEquals("group_1", message.body().path("streamid").asText());
    assertEquals(0, buffer.buffered());
    assertNull(buffer.next());
  }
  
  @Test
  public void fragmented() throws Exception {
    final byte[] frame = NntscMessage.encode(MessageType.STREAMS, 
        ImmutableMap.<String, Object>of("collection", 4, "streams", new int[0]));
    // header split
    buffer.append(frame, 0, 3);
    assertNull(buffer.next());
    // body split
    buffer.append(frame, 3, 10);
    assertNull(buffer.next());
    assertEquals(13, buffer.buffered());
    buffer.append(frame, 13, frame.length - 13);
    final NntscMessage message = buffer.next();
    assertEquals(MessageType.STREAMS, message.type());
    assertFalse(message.more());
  }
  
  @Test
  public void multipleFrames() throws Exception {
    final byte[] first = NntscMessage.encode(MessageType.LIVE, 
        ImmutableMap.<String, Object>of("collection", 1));
    final byte[] second = NntscMessage.encode(MessageType.QUERY_CANCELLED, 
        ImmutableMap.<String, Object>of("collection", 2));
    final byte[] both = Bytes.concat(first, second);
    buffer.append(both, 0, both.length);
    assertEquals(MessageType.LIVE, buffer.next().type());
    final NntscMessage message = buffer.next();
    assertEquals(MessageType.QUERY_CANCELLED, message.type());
    assertEquals(2, message.collection());
    assertNull(buffer.next());
  }
  
  @Test
  public void missingCollection() throws Exception {
    final byte[] frame = NntscMessage.encode(MessageType.LIVE, 
        ImmutableMap.<String, Object>of("more", false));
    buffer.append(frame, 0, frame.length);
    assertEquals(-1, buffer.next().collection());
  }
  
  @Test
  public void badVersion() throws Exception {
    final byte[] frame = NntscMessage.encode(MessageType.LIVE, 
        ImmutableMap.<String, Object>of("collection", 1));
    frame[0] = 2;
    buffer.append(frame, 0, frame.length);
    try {
      buffer.next();
      fail("Expected ProtocolException");
    } catch (ProtocolException e) { }
  }
  
  @Test
  public void unknownType() throws Exception {
    final byte[] frame = NntscMessage.encode(MessageType.LIVE, 
        ImmutableMap.<String, Object>of("collection", 1));
    frame[1] = 42;
    buffer.append(frame, 0, frame.length);
    try {
      buffer.next();
      fail("Expected ProtocolException");
    } catch (ProtocolException e) { }
  }
  
  @Test
  public void tooLong() throws Exception {
    final MessageBuffer small = new MessageBuffer(8);
    try {
      final byte[] frame = NntscMessage.encode(MessageType.LIVE, 
          ImmutableMap.<String, Object>of("collection", 1));
      // only the header is needed to reject it
      small.append(frame, 0, NntscMessage.HEADER_LENGTH);
      small.next();
      fail("Expected ProtocolException");
    } catch (ProtocolException e) {
    } finally {
      small.close();
    }
  }
  
  @Test
  public void badBody() throws Exception {
    final byte[] json = "[1, 2".getBytes(StandardCharsets.UTF_8);
    final byte[] frame = Bytes.concat(new byte[] { 1, 4, 0, 0, 0, 
        (byte) json.length }, json);
    buffer.append(frame, 0, frame.length);
    try {
      buffer.next();
      fail("Expected ProtocolException");
    } catch (ProtocolException e) { }
  }
  
  @Test
  public void bodyNotAnObject() throws Exception {
    final byte[] json = "[1, 2]".getBytes(StandardCharsets.UTF_8);
    final byte[] frame = Bytes.concat(new byte[] { 1, 4, 0, 0, 0, 
        (byte) json.length }, json);
    buffer.append(frame, 0, frame.length);
    try {
      buffer.next();
      fail("Expected ProtocolException");
    } catch (ProtocolException e) { }
  }
}
