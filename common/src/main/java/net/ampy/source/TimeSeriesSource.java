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
package net.ampy.source;

import java.util.List;
import java.util.Map;

import net.ampy.data.Aggregation;
import net.ampy.data.CollectionInfo;
import net.ampy.data.LabelHistory;
import net.ampy.data.Stream;

/**
 * The upstream time series store that holds the raw measurements and
 * performs aggregation. All calls are synchronous and block the calling
 * thread until the complete, possibly multi-part, response has arrived.
 * <p>
 * Implementations should:
 * <ul>
 * <li>Throw {@link net.ampy.exceptions.ConnectionException} if the store
 * could not be reached or the connection dropped mid response.</li>
 * <li>Throw {@link net.ampy.exceptions.ProtocolException} if the store
 * answered with something that could not be understood.</li>
 * <li>Report per label query timeouts in 
 * {@link LabelHistory#timedOut()} rather than throwing.</li>
 * </ul>
 * 
 * @since 1.0
 */
public interface TimeSeriesSource {

  /**
   * @return The non-null list of collections hosted upstream.
   */
  public List<CollectionInfo> requestCollections();
  
  /**
   * Fetches the streams of a collection created after the given stream.
   * @param collection_id The collection to query.
   * @param since_stream_id Only streams with a greater ID are returned. Use 
   * 0 for every stream.
   * @return The non-null, possibly empty list of streams.
   */
  public List<Stream> requestStreams(final long collection_id, 
                                     final long since_stream_id);
  
  /**
   * Fetches the IDs of the streams of a collection that have produced data
   * since the given time.
   * @param collection_id The collection to query.
   * @param since_timestamp A Unix epoch timestamp in seconds.
   * @return The non-null, possibly empty list of stream IDs.
   */
  public List<Long> requestActiveStreams(final long collection_id, 
                                           final long since_timestamp);
  
  /**
   * Fetches aggregated history for a set of labels.
   * @param collection_id The collection to query.
   * @param labels A non-null and non-empty map of label strings to the 
   * stream IDs that should be combined for that label.
   * @param start The first timestamp to include, in seconds.
   * @param end The last timestamp to include, in seconds. Inclusive.
   * @param binsize The aggregation period in seconds.
   * @param aggregation The columns and functions to apply.
   * @param group_by Optional columns to group on. May be empty.
   * @return A map of label to the history for that label. Every requested 
   * label that the store answered for is present.
   */
  public Map<String, LabelHistory> requestAggregateHistory(
      final long collection_id,
      final Map<String, List<Long>> labels,
      final long start,
      final long end,
      final long binsize,
      final Aggregation aggregation,
      final List<String> group_by);
}
