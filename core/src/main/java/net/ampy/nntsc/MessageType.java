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

/**
 * The message types carried in the second header byte of an NNTSC frame.
 * 
 * @since 1.0
 */
public enum MessageType {
  REQUEST(0),
  COLLECTIONS(1),
  SCHEMAS(2),
  STREAMS(3),
  HISTORY(4),
  ACTIVE_STREAMS(5),
  LIVE(6),
  SUBSCRIBE(7),
  AGGREGATE(8),
  PERCENTILE(9),
  REGISTER_COLLECTION(10),
  QUERY_CANCELLED(11);
  
  private final int code;
  
  private MessageType(final int code) {
    this.code = code;
  }
  
  /** @return The wire code. */
  public int code() {
    return code;
  }
  
  /**
   * @param code A wire code.
   * @return The matching type or null if the code is unknown.
   */
  public static MessageType fromCode(final int code) {
    for (final MessageType type : values()) {
      if (type.code == code) {
        return type;
      }
    }
    return null;
  }
}
