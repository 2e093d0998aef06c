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
 * Base class for hard failures talking to the upstream time series store.
 * These abort the request they occur in and nothing fetched during that
 * request is cached.
 * 
 * @since 1.0
 */
public class SourceException extends RuntimeException {
  private static final long serialVersionUID = -3360207396452211873L;

  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   */
  public SourceException(final String msg) {
    super(msg);
  }
  
  /**
   * Ctor with a cause.
   * @param msg A non-null message to be given.
   * @param e The original exception that caused this to be thrown.
   */
  public SourceException(final String msg, final Throwable e) {
    super(msg, e);
  }
}
