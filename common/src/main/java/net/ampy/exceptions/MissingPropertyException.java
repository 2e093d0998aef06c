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
 * Thrown when a stream is added to an index without one of the properties
 * the index is keyed on.
 * 
 * @since 1.0
 */
public class MissingPropertyException extends IllegalArgumentException {
  private static final long serialVersionUID = 7802230912648717790L;
  
  /** The name of the missing property. */
  private final String property;
  
  /**
   * Default ctor.
   * @param property The missing property key.
   * @param stream_id The stream that was rejected.
   */
  public MissingPropertyException(final String property, final long stream_id) {
    super("Stream " + stream_id + " is missing required property '" 
        + property + "'");
    this.property = property;
  }
  
  /** @return The name of the missing property. */
  public String property() {
    return property;
  }
}
