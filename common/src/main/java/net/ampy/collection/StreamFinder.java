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
package net.ampy.collection;

import java.util.List;
import java.util.Map;

/**
 * Lookup handed to collection adapters so they can resolve the stream IDs
 * behind a group without seeing the index itself.
 * 
 * @since 1.0
 */
public interface StreamFinder {

  /**
   * Finds every stream matching the given properties. Property keys that
   * are absent match any value.
   * @param properties A non-null, possibly empty property map.
   * @return A non-null, possibly empty list of stream IDs.
   */
  public List<Long> findStreamIds(final Map<String, Object> properties);
  
}
