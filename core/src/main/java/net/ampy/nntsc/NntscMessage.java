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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import net.ampy.utils.JSON;

/**
 * A single NNTSC frame. On the wire a frame is a six byte header, the
 * protocol version, the message type and a big endian four byte body 
 * length, followed by a JSON body.
 * 
 * @since 1.0
 */
public class NntscMessage {
  /** The protocol version we speak. */
  public static final int VERSION = 1;
  
  /** Length of the frame header in bytes. */
  public static final int HEADER_LENGTH = 6;
  
  private final MessageType type;
  private final JsonNode body;
  
  /**
   * Default ctor.
   * @param type The non-null message type.
   * @param body The non-null parsed body.
   */
  public NntscMessage(final MessageType type, final JsonNode body) {
    this.type = Preconditions.checkNotNull(type);
    this.body = Preconditions.checkNotNull(body);
  }
  
  /** @return The message type. */
  public MessageType type() {
    return type;
  }
  
  /** @return The parsed body. */
  public JsonNode body() {
    return body;
  }
  
  /** @return The collection the message refers to or -1 if absent. */
  public long collection() {
    return body.path("collection").asLong(-1);
  }
  
  /** @return The continuation flag, false if absent. */
  public boolean more() {
    return body.path("more").asBoolean(false);
  }
  
  /**
   * Serializes a frame.
   * @param type The non-null message type.
   * @param body The body, serialized as JSON.
   * @return The encoded frame.
   */
  public static byte[] encode(final MessageType type, final Object body) {
    final byte[] json = JSON.serializeToBytes(body);
    final ByteBuf buffer = Unpooled.buffer(HEADER_LENGTH + json.length);
    try {
      buffer.writeByte(VERSION);
      buffer.writeByte(type.code());
      buffer.writeInt(json.length);
      buffer.writeBytes(json);
      final byte[] frame = new byte[buffer.readableBytes()];
      buffer.readBytes(frame);
      return frame;
    } finally {
      buffer.release();
    }
  }
  
  @Override
  public String toString() {
    return type + " " + body;
  }
}
