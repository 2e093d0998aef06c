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
package net.ampy.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import io.netty.util.HashedWheelTimer;

public class TestThreads {

  @Test
  public void newTimerRuns() throws Exception {
    final HashedWheelTimer timer = Threads.newTimer(10, "UT");
    try {
      final CountDownLatch latch = new CountDownLatch(1);
      timer.newTimeout(timeout -> latch.countDown(), 1, TimeUnit.MILLISECONDS);
      assertTrue(latch.await(5, TimeUnit.SECONDS));
    } finally {
      Threads.stop(timer, "UT");
    }
  }
  
  @Test
  public void newTimerBadTick() throws Exception {
    try {
      Threads.newTimer(0, "UT");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void stopPending() throws Exception {
    final HashedWheelTimer timer = Threads.newTimer("UT");
    timer.newTimeout(timeout -> { }, 1, TimeUnit.HOURS);
    timer.newTimeout(timeout -> { }, 2, TimeUnit.HOURS);
    assertEquals(2, Threads.stop(timer, "UT"));
  }
  
  @Test
  public void stopNull() throws Exception {
    assertEquals(0, Threads.stop(null, "UT"));
  }
}
