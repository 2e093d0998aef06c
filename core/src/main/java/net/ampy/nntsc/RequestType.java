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
 * The kinds of {@link MessageType#REQUEST} a client can make.
 * 
 * @since 1.0
 */
public enum RequestType {
  COLLECTIONS(0),
  SCHEMAS(1),
  STREAMS(2),
  ACTIVE_STREAMS(3);
  
  private final int code;
  
  private RequestType(final int code) {
    this.code = code;
  }
  
  /** @return The code sent in the request body. */
  public int code() {
    return code;
  }
}
