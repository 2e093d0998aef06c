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

import java.io.Closeable;

import com.fasterxml.jackson.databind.JsonNode;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import net.ampy.exceptions.ProtocolException;
import net.ampy.utils.JSON;
import net.ampy.utils.JSONException;

/**
 * Accumulates bytes read from an NNTSC socket and hands back complete 
 * frames. Partial frames stay buffered until the rest arrives.
 * <p>
 * This buffer is stateful and is thus <strong>NOT</strong> shareable.
 * 
 * @since 1.0
 */
public class MessageBuffer implements Closeable {
  /** Default maximum body length, 64MB. */
  public static final int DEFAULT_MAX_LENGTH = 64 * 1024 * 1024;
  
  /** Maximum length of a frame body we're willing to decode. */
  private final int max_length;
  
  private final ByteBuf buffer;
  
  /** Default ctor using {@link #DEFAULT_MAX_LENGTH}. */
  public MessageBuffer() {
    this(DEFAULT_MAX_LENGTH);
  }
  
  /**
   * Creates a new buffer.
   * @param max_length Maximum body length we're willing to decode. Longer
   * frames cause a {@link ProtocolException}.
   */
  public MessageBuffer(final int max_length) {
    this.max_length = max_length;
    buffer = Unpooled.buffer();
  }
  
  /**
   * Appends bytes read from the socket.
   * @param data The source array.
   * @param offset Where to start copying.
   * @param length How many bytes to copy.
   */
  public void append(final byte[] data, final int offset, final int length) {
    buffer.writeBytes(data, offset, length);
  }
  
  /**
   * Decodes the next frame if it has been fully received.
   * @return The message or null if more bytes are needed.
   * @throws ProtocolException if the header was invalid or the body could
   * not be parsed.
   */
  public NntscMessage next() {
    if (buffer.readableBytes() < NntscMessage.HEADER_LENGTH) {
      return null;
    }
    final int start = buffer.readerIndex();
    final int version = buffer.getUnsignedByte(start);
    if (version != NntscMessage.VERSION) {
      throw new ProtocolException("Unsupported NNTSC protocol version " 
          + version + ", expected " + NntscMessage.VERSION);
    }
    final int code = buffer.getUnsignedByte(start + 1);
    final MessageType type = MessageType.fromCode(code);
    if (type == null) {
      throw new ProtocolException("Unknown NNTSC message type " + code);
    }
    final long length = buffer.getUnsignedInt(start + 2);
    if (length > max_length) {
      throw new ProtocolException("Frame length " + length 
          + " exceeds " + max_length);
    }
    if (buffer.readableBytes() < NntscMessage.HEADER_LENGTH + length) {
      return null;
    }
    
    buffer.skipBytes(NntscMessage.HEADER_LENGTH);
    final byte[] body = new byte[(int) length];
    buffer.readBytes(body);
    buffer.discardReadBytes();
    try {
      final JsonNode node = JSON.parseToTree(body);
      if (node == null || !node.isObject()) {
        throw new ProtocolException("Body of " + type 
            + " message was not a JSON object");
      }
      return new NntscMessage(type, node);
    } catch (IllegalArgumentException | JSONException e) {
      throw new ProtocolException("Unparseable body in " + type 
          + " message", e);
    }
  }
  
  /** @return The number of buffered, undecoded bytes. */
  public int buffered() {
    return buffer.readableBytes();
  }
  
  @Override
  public void close() {
    buffer.release();
  }
}
