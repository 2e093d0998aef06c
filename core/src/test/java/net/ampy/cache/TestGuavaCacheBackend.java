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
package net.ampy.cache;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.mockStatic;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.MockedStatic;

import com.codahale.metrics.MetricRegistry;

import net.ampy.utils.Config;
import net.ampy.utils.DateTime;

public final class TestGuavaCacheBackend {
  private static final long NANOS = 1000L * 1000L * 1000L;
  
  private MockedStatic<DateTime> date_time;
  private long[] nano_time;
  
  @Before
  public void before() throws Exception {
    nano_time = new long[] { 1000 * NANOS };
    date_time = mockStatic(DateTime.class, CALLS_REAL_METHODS);
    date_time.when(DateTime::nanoTime).thenAnswer(
        invocation -> nano_time[0]);
  }
  
  @After
  public void after() throws Exception {
    date_time.close();
  }
  
  @Test
  public void ctor() throws Exception {
    GuavaCacheBackend backend = new GuavaCacheBackend(new Config());
    assertEquals(100000, backend.maxObjects());
    assertEquals(134217728, backend.sizeLimit());
    
    backend = new GuavaCacheBackend(10, 1024);
    assertEquals(10, backend.maxObjects());
    assertEquals(1024, backend.sizeLimit());
    assertEquals(0, backend.bytesStored());
    
    try {
      new GuavaCacheBackend(0, 1024);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new GuavaCacheBackend(10, 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void setAndGet() throws Exception {
    final GuavaCacheBackend backend = new GuavaCacheBackend(10, 1024);
    assertNull(backend.get("key"));
    backend.set("key", new byte[] { 1, 2, 3 }, 60);
    assertArrayEquals(new byte[] { 1, 2, 3 }, backend.get("key"));
    assertEquals(3, backend.bytesStored());
    
    // replacing the value adjusts the size
    backend.set("key", new byte[] { 4, 5 }, 60);
    assertArrayEquals(new byte[] { 4, 5 }, backend.get("key"));
    assertEquals(2, backend.bytesStored());
  }
  
  @Test
  public void badArguments() throws Exception {
    final GuavaCacheBackend backend = new GuavaCacheBackend(10, 1024);
    try {
      backend.get(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      backend.set("", new byte[1], 60);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      backend.set("key", null, 60);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void expiration() throws Exception {
    final GuavaCacheBackend backend = new GuavaCacheBackend(10, 1024);
    backend.set("short", new byte[] { 1 }, 60);
    backend.set("forever", new byte[] { 2 }, 0);
    
    nano_time[0] += 59 * NANOS;
    assertArrayEquals(new byte[] { 1 }, backend.get("short"));
    
    nano_time[0] += 2 * NANOS;
    assertNull(backend.get("short"));
    assertEquals(1, backend.expired());
    assertEquals(1, backend.bytesStored());
    
    nano_time[0] += 86400 * NANOS;
    assertArrayEquals(new byte[] { 2 }, backend.get("forever"));
  }
  
  @Test
  public void negativeTtlIsNotStored() throws Exception {
    final GuavaCacheBackend backend = new GuavaCacheBackend(10, 1024);
    backend.set("key", new byte[] { 1 }, -1);
    assertNull(backend.get("key"));
    assertEquals(0, backend.bytesStored());
  }
  
  @Test
  public void sizeLimit() throws Exception {
    final GuavaCacheBackend backend = new GuavaCacheBackend(10, 16);
    backend.set("a", new byte[10], 60);
    backend.set("b", new byte[10], 60);
    assertNull(backend.get("b"));
    assertEquals(10, backend.bytesStored());
    
    backend.cache().invalidate("a");
    assertEquals(0, backend.bytesStored());
    backend.set("b", new byte[10], 60);
    assertEquals(10, backend.bytesStored());
  }
  
  @Test
  public void sizeLimitReclaimsUnreadExpired() throws Exception {
    final GuavaCacheBackend backend = new GuavaCacheBackend(10, 32);
    backend.set("a", new byte[10], 60);
    backend.set("b", new byte[10], 300);
    backend.set("forever", new byte[5], 0);
    assertEquals(25, backend.bytesStored());
    
    // "a" expired but was never read
    nano_time[0] += 61 * NANOS;
    backend.set("c", new byte[10], 60);
    assertArrayEquals(new byte[10], backend.get("c"));
    assertNull(backend.cache().getIfPresent("a"));
    assertEquals(25, backend.bytesStored());
    assertEquals(1, backend.expired());
    
    // nothing left to reclaim
    backend.set("d", new byte[10], 60);
    assertNull(backend.get("d"));
    assertEquals(25, backend.bytesStored());
  }
  
  @Test
  public void purgeExpired() throws Exception {
    final GuavaCacheBackend backend = new GuavaCacheBackend(10, 1024);
    backend.set("a", new byte[4], 60);
    backend.set("b", new byte[4], 120);
    backend.set("forever", new byte[4], 0);
    assertEquals(0, backend.purgeExpired());
    
    nano_time[0] += 90 * NANOS;
    assertEquals(1, backend.purgeExpired());
    assertEquals(8, backend.bytesStored());
    
    nano_time[0] += 86400 * NANOS;
    assertEquals(1, backend.purgeExpired());
    assertEquals(4, backend.bytesStored());
    assertEquals(2, backend.expired());
  }
  
  @Test
  public void registerMetrics() throws Exception {
    final GuavaCacheBackend backend = new GuavaCacheBackend(10, 1024);
    final MetricRegistry registry = new MetricRegistry();
    backend.registerMetrics(registry, "ampy.lru");
    
    backend.set("key", new byte[4], 60);
    backend.get("key");
    backend.get("nosuch");
    
    assertTrue(registry.getGauges().containsKey("ampy.lru.hitRate"));
    assertTrue(registry.getGauges().containsKey("ampy.lru.evictionCount"));
    assertEquals(0.5, (Double) registry.getGauges()
        .get("ampy.lru.hitRate").getValue(), 0.001);
    assertEquals(2L, registry.getGauges()
        .get("ampy.lru.requestCount").getValue());
    assertEquals(4L, registry.getGauges()
        .get("ampy.lru.bytesStored").getValue());
    assertEquals(0L, registry.getGauges()
        .get("ampy.lru.expiredCount").getValue());
  }
}
