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
package net.ampy.exceptions;

/**
 * Thrown when the upstream sends a malformed frame or a message that makes
 * no sense for the outstanding request.
 * 
 * @since 1.0
 */
public class ProtocolException extends SourceException {
  private static final long serialVersionUID = -1942715538217034905L;

  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   */
  public ProtocolException(final String msg) {
    super(msg);
  }
  
  /**
   * Ctor with a cause.
   * @param msg A non-null message to be given.
   * @param e The original exception that caused this to be thrown.
   */
  public ProtocolException(final String msg, final Throwable e) {
    super(msg, e);
  }
}
