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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import net.ampy.data.Aggregation;
import net.ampy.data.CollectionInfo;
import net.ampy.data.DataPoint;
import net.ampy.data.LabelHistory;
import net.ampy.data.Stream;
import net.ampy.data.TimeRange;
import net.ampy.exceptions.ConnectionException;
import net.ampy.exceptions.ProtocolException;
import net.ampy.exceptions.SourceException;
import net.ampy.source.TimeSeriesSource;
import net.ampy.utils.Config;
import net.ampy.utils.DateTime;
import net.ampy.utils.JSON;

/**
 * A {@link TimeSeriesSource} talking to an NNTSC exporter over TCP. Every
 * call opens its own connection, sends one request and reads frames until
 * the response is complete, then closes the connection. Instances are 
 * therefore thread safe.
 * 
 * @since 1.0
 */
public class NntscConnection implements TimeSeriesSource {
  private static final Logger LOG = 
      LoggerFactory.getLogger(NntscConnection.class);
  
  private static final TypeReference<Map<String, Object>> RECORD = 
      new TypeReference<Map<String, Object>>() { };
  
  /** Size of the socket read buffer. */
  private static final int READ_SIZE = 8192;
  
  private final String host;
  private final int port;
  
  /** Connect and read timeout in milliseconds, 0 for none. */
  private final int socket_timeout;
  
  /**
   * Ctor reading the host, port and timeout from the config.
   * @param config A non-null config.
   */
  public NntscConnection(final Config config) {
    this(config.getString(Config.NNTSC_HOST_KEY), 
         config.getInt(Config.NNTSC_PORT_KEY),
         config.getInt(Config.NNTSC_SOCKET_TIMEOUT_KEY));
  }
  
  /**
   * Default ctor.
   * @param host A non-null and non-empty host name.
   * @param port The port the exporter listens on for clients.
   * @param socket_timeout Connect and read timeout in ms, 0 for none.
   */
  public NntscConnection(final String host, 
                         final int port, 
                         final int socket_timeout) {
    if (Strings.isNullOrEmpty(host)) {
      throw new IllegalArgumentException("Host cannot be null or empty.");
    }
    Preconditions.checkArgument(port > 0 && port < 65536, 
        "Invalid port: %s", port);
    Preconditions.checkArgument(socket_timeout >= 0, 
        "Socket timeout cannot be negative.");
    this.host = host;
    this.port = port;
    this.socket_timeout = socket_timeout;
  }
  
  @Override
  public List<CollectionInfo> requestCollections() {
    final Map<String, Object> request = new LinkedHashMap<String, Object>();
    request.put("request", RequestType.COLLECTIONS.code());
    request.put("collection", -1);
    
    final List<CollectionInfo> collections = new ArrayList<CollectionInfo>();
    exchange(MessageType.REQUEST, request, new ResponseHandler() {
      @Override
      public boolean handle(final NntscMessage message) {
        switch (message.type()) {
        case COLLECTIONS:
          for (final JsonNode node : message.body().path("collections")) {
            collections.add(JSON.getMapper().convertValue(node, 
                CollectionInfo.class));
          }
          return true;
        case QUERY_CANCELLED:
          throw new SourceException("Request for NNTSC collections timed out");
        default:
          throw new ProtocolException("Unexpected response to a collections " 
              + "request: " + message.type());
        }
      }
    });
    return collections;
  }
  
  @Override
  public List<Stream> requestStreams(final long collection_id, 
                                     final long since_stream_id) {
    return requestStreams(RequestType.STREAMS, MessageType.STREAMS, 
        collection_id, since_stream_id);
  }

  @Override
  public List<Long> requestActiveStreams(final long collection_id, 
                                         final long since_timestamp) {
    final List<Long> ids = new ArrayList<Long>();
    exchange(MessageType.REQUEST, request(RequestType.ACTIVE_STREAMS, 
        collection_id, since_timestamp), new ResponseHandler() {
      @Override
      public boolean handle(final NntscMessage message) {
        if (message.type() == MessageType.ACTIVE_STREAMS) {
          if (message.collection() != collection_id) {
            return false;
          }
          for (final JsonNode node : message.body().path("streams")) {
            if (!node.isIntegralNumber()) {
              throw new ProtocolException("Invalid stream ID in " 
                  + message.type() + " message: " + node);
            }
            ids.add(node.asLong());
          }
          return !message.more();
        }
        return unexpected(RequestType.ACTIVE_STREAMS, collection_id, 
            message);
      }
    });
    return ids;
  }
  
  @Override
  public Map<String, LabelHistory> requestAggregateHistory(
      final long collection_id, 
      final Map<String, List<Long>> labels, 
      final long start,
      final long end, 
      final long binsize, 
      final Aggregation aggregation, 
      final List<String> group_by) {
    Preconditions.checkArgument(labels != null && !labels.isEmpty(), 
        "Labels cannot be null or empty.");
    Preconditions.checkNotNull(aggregation, "Aggregation cannot be null.");
    final Map<String, Object> request = new LinkedHashMap<String, Object>();
    request.put("collection", collection_id);
    request.put("labels", labels);
    request.put("start", start);
    request.put("end", end);
    request.put("columns", aggregation.columns());
    request.put("binsize", binsize);
    request.put("groupcols", group_by == null ? 
        new ArrayList<String>() : group_by);
    request.put("aggfuncs", aggregation.functions());
    if (LOG.isDebugEnabled()) {
      LOG.debug("Requesting history from " + host + ":" + port + " " 
          + request);
    }
    
    final Map<String, LabelHistory> results = 
        new LinkedHashMap<String, LabelHistory>();
    final Set<String> completed = new HashSet<String>();
    exchange(MessageType.AGGREGATE, request, new ResponseHandler() {
      @Override
      public boolean handle(final NntscMessage message) {
        switch (message.type()) {
        case STREAMS:
        case ACTIVE_STREAMS:
        case LIVE:
          // new stream announcements can be interleaved, we don't care here
          return false;
        case QUERY_CANCELLED:
          if (message.collection() != collection_id) {
            return false;
          }
          final TimeRange range = new TimeRange(
              message.body().path("start").asLong(start), 
              message.body().path("end").asLong(end));
          for (final JsonNode node : message.body().path("labels")) {
            final String label = node.asText();
            if (!labels.containsKey(label)) {
              continue;
            }
            final LabelHistory history = historyFor(results, label);
            history.timedOut().add(range);
            if (!message.more()) {
              if (history.frequency() == 0) {
                history.setFrequency(binsize);
              }
              completed.add(label);
            }
          }
          return completed.size() >= labels.size();
        case HISTORY:
          if (message.collection() != collection_id) {
            return false;
          }
          final String label = message.body().path("streamid").asText();
          if (!labels.containsKey(label)) {
            return false;
          }
          final LabelHistory history = historyFor(results, label);
          if (history.frequency() == 0) {
            history.setFrequency(message.body().path("binsize").asLong(0));
          }
          for (final JsonNode node : message.body().path("data")) {
            history.points().add(JSON.getMapper().convertValue(node, 
                DataPoint.class));
          }
          if (!message.more()) {
            completed.add(label);
          }
          return completed.size() >= labels.size();
        default:
          throw new ProtocolException("Unexpected response to a history " 
              + "request: " + message.type());
        }
      }
    });
    return results;
  }
  
  private List<Stream> requestStreams(final RequestType request_type, 
                                      final MessageType response_type, 
                                      final long collection_id, 
                                      final long boundary) {
    final List<Stream> streams = new ArrayList<Stream>();
    exchange(MessageType.REQUEST, request(request_type, collection_id, 
        boundary), new ResponseHandler() {
      @Override
      public boolean handle(final NntscMessage message) {
        if (message.type() == response_type) {
          if (message.collection() != collection_id) {
            return false;
          }
          for (final JsonNode node : message.body().path("streams")) {
            try {
              final Map<String, Object> record = 
                  JSON.getMapper().convertValue(node, RECORD);
              streams.add(Stream.fromRecord(record));
            } catch (IllegalArgumentException e) {
              throw new ProtocolException("Invalid stream record in " 
                  + message.type() + " message", e);
            }
          }
          return !message.more();
        }
        return unexpected(request_type, collection_id, message);
      }
    });
    return streams;
  }
  
  private static Map<String, Object> request(final RequestType request_type,
                                             final long collection_id, 
                                             final long boundary) {
    final Map<String, Object> request = new LinkedHashMap<String, Object>();
    request.put("request", request_type.code());
    request.put("collection", collection_id);
    request.put("boundary", boundary);
    return request;
  }
  
  /**
   * Handles a message that doesn't answer a stream request.
   * @return Never returns normally.
   * @throws SourceException if the query was cancelled upstream.
   * @throws ProtocolException for anything else.
   */
  private static boolean unexpected(final RequestType request_type, 
                                    final long collection_id, 
                                    final NntscMessage message) {
    if (message.type() == MessageType.QUERY_CANCELLED) {
      throw new SourceException("Query for " + request_type 
          + " of collection " + collection_id + " timed out");
    }
    throw new ProtocolException("Unexpected response to a " + request_type
        + " request: " + message.type());
  }
  
  /**
   * Sends a request and feeds every frame received to the handler until it
   * reports the response as complete.
   * @throws ConnectionException if the socket failed or closed early.
   */
  private void exchange(final MessageType type, 
                        final Object request, 
                        final ResponseHandler handler) {
    final long start_ns = DateTime.nanoTime();
    try (final Socket socket = new Socket();
         final MessageBuffer buffer = new MessageBuffer()) {
      socket.connect(new InetSocketAddress(host, port), socket_timeout);
      socket.setSoTimeout(socket_timeout);
      socket.setTcpNoDelay(true);
      final OutputStream out = socket.getOutputStream();
      out.write(NntscMessage.encode(type, request));
      out.flush();
      
      final InputStream in = socket.getInputStream();
      final byte[] read_buffer = new byte[READ_SIZE];
      while (true) {
        NntscMessage message = buffer.next();
        while (message != null) {
          if (handler.handle(message)) {
            if (LOG.isDebugEnabled()) {
              LOG.debug(type + " exchange with " + host + ":" + port 
                  + " took " + DateTime.msFromNanoDiff(DateTime.nanoTime(), 
                      start_ns) + "ms");
            }
            return;
          }
          message = buffer.next();
        }
        
        final int read = in.read(read_buffer);
        if (read < 0) {
          throw new ConnectionException("NNTSC at " + host + ":" + port 
              + " closed the connection before the response was complete");
        }
        buffer.append(read_buffer, 0, read);
      }
    } catch (IOException e) {
      LOG.error("Failed talking to NNTSC at " + host + ":" + port, e);
      throw new ConnectionException("Failed talking to NNTSC at " + host 
          + ":" + port, e);
    }
  }
  
  private static LabelHistory historyFor(final Map<String, LabelHistory> results,
                                         final String label) {
    LabelHistory history = results.get(label);
    if (history == null) {
      history = new LabelHistory();
      results.put(label, history);
    }
    return history;
  }
  
  /** Receives frames until the response is complete. */
  private interface ResponseHandler {
    /**
     * @param message The next frame.
     * @return True when no more frames are needed.
     */
    boolean handle(final NntscMessage message);
  }
  
  @Override
  public String toString() {
    return "NntscConnection(" + host + ":" + port + ")";
  }
}
